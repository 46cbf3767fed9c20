/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A causal reference to another span that is not this span's parent. Unlike a parent, a span can
 * have any number of links, which is how a batch consumer records each producer it descends from.
 *
 * <p>Attribute values are primitives: {@link String}, {@link Boolean}, {@link Long} or {@link
 * Double}. Other integral and floating point numbers are widened on the way in.
 */
//@Immutable
public final class Link {

  public static Link create(SpanContext context) {
    return new Link(context, Collections.emptyMap());
  }

  /**
   * @throws IllegalArgumentException if an attribute value is not a primitive
   */
  public static Link create(SpanContext context, Map<String, ?> attributes) {
    if (attributes == null) throw new NullPointerException("attributes == null");
    if (attributes.isEmpty()) return create(context);
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : attributes.entrySet()) {
      if (entry.getKey() == null) throw new NullPointerException("attribute key == null");
      copy.put(entry.getKey(), primitive(entry.getKey(), entry.getValue()));
    }
    return new Link(context, Collections.unmodifiableMap(copy));
  }

  public SpanContext context() {
    return context;
  }

  /** Unmodifiable, in insertion order. */
  public Map<String, Object> attributes() {
    return attributes;
  }

  static Object primitive(String key, Object value) {
    if (value instanceof String || value instanceof Boolean) return value;
    if (value instanceof Long || value instanceof Double) return value;
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof Float) return ((Float) value).doubleValue();
    throw new IllegalArgumentException(
      "attribute " + key + " should be a string, boolean, long or double: was " + value);
  }

  final SpanContext context;
  final Map<String, Object> attributes;

  Link(SpanContext context, Map<String, Object> attributes) {
    if (context == null) throw new NullPointerException("context == null");
    this.context = context;
    this.attributes = attributes;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Link)) return false;
    Link that = (Link) o;
    return context.equals(that.context) && attributes.equals(that.attributes);
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= context.hashCode();
    h *= 1000003;
    h ^= attributes.hashCode();
    return h;
  }

  @Override public String toString() {
    return "Link{context=" + context + ", attributes=" + attributes + "}";
  }
}
