/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Input to a sampling decision: what is being called, which call it is, and anything the call site
 * knows that a policy may key on, such as a user ID in {@link #metadata()} or the producers of a
 * consumed batch in {@link #links()}.
 */
//@Immutable
public final class SamplingContext {

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Shortcut for a context with only an operation name and a fresh invocation ID. */
  public static SamplingContext create(String operationName) {
    return newBuilder().operationName(operationName).build();
  }

  public String operationName() {
    return operationName;
  }

  /** Stable for the duration of one call and distinct across concurrent calls. */
  public InvocationId invocationId() {
    return invocationId;
  }

  /** Unmodifiable, possibly empty. For example feature flags or a request's user ID. */
  public Map<String, Object> metadata() {
    return metadata;
  }

  /** Unmodifiable, possibly empty. Causal references attached to the span being decided on. */
  public List<Link> links() {
    return links;
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public static final class Builder {
    String operationName;
    InvocationId invocationId;
    Map<String, Object> metadata;
    List<Link> links;

    Builder() {
    }

    Builder(SamplingContext source) {
      operationName = source.operationName;
      invocationId = source.invocationId;
      if (!source.metadata.isEmpty()) metadata = new LinkedHashMap<>(source.metadata);
      if (!source.links.isEmpty()) links = new ArrayList<>(source.links);
    }

    public Builder operationName(String operationName) {
      if (operationName == null) throw new NullPointerException("operationName == null");
      this.operationName = operationName;
      return this;
    }

    public Builder invocationId(InvocationId invocationId) {
      if (invocationId == null) throw new NullPointerException("invocationId == null");
      this.invocationId = invocationId;
      return this;
    }

    public Builder putMetadata(String key, Object value) {
      if (key == null) throw new NullPointerException("key == null");
      if (value == null) throw new NullPointerException("value of " + key + " == null");
      if (metadata == null) metadata = new LinkedHashMap<>();
      metadata.put(key, value);
      return this;
    }

    public Builder metadata(Map<String, ?> metadata) {
      if (metadata == null) throw new NullPointerException("metadata == null");
      this.metadata = null;
      for (Map.Entry<String, ?> entry : metadata.entrySet()) {
        putMetadata(entry.getKey(), entry.getValue());
      }
      return this;
    }

    public Builder addLink(Link link) {
      if (link == null) throw new NullPointerException("link == null");
      if (links == null) links = new ArrayList<>();
      links.add(link);
      return this;
    }

    public Builder links(List<Link> links) {
      if (links == null) throw new NullPointerException("links == null");
      this.links = null;
      for (Link link : links) addLink(link);
      return this;
    }

    /** Allocates an {@link InvocationId} when none was set. */
    public SamplingContext build() {
      if (operationName == null) throw new IllegalStateException("Missing : operationName");
      return new SamplingContext(this);
    }
  }

  final String operationName;
  final InvocationId invocationId;
  final Map<String, Object> metadata;
  final List<Link> links;

  SamplingContext(Builder builder) {
    operationName = builder.operationName;
    invocationId = builder.invocationId != null ? builder.invocationId : InvocationId.next();
    metadata = builder.metadata == null
      ? Collections.emptyMap()
      : Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    links = builder.links == null
      ? Collections.emptyList()
      : Collections.unmodifiableList(new ArrayList<>(builder.links));
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof SamplingContext)) return false;
    SamplingContext that = (SamplingContext) o;
    return operationName.equals(that.operationName)
      && invocationId.equals(that.invocationId)
      && metadata.equals(that.metadata)
      && links.equals(that.links);
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= operationName.hashCode();
    h *= 1000003;
    h ^= invocationId.hashCode();
    h *= 1000003;
    h ^= metadata.hashCode();
    h *= 1000003;
    h ^= links.hashCode();
    return h;
  }

  @Override public String toString() {
    return "SamplingContext{operationName=" + operationName + ", invocationId=" + invocationId.value
      + (metadata.isEmpty() ? "" : ", metadata=" + metadata)
      + (links.isEmpty() ? "" : ", links=" + links.size())
      + "}";
  }
}
