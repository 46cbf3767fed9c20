/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel.sdk;

import autotel.Link;
import autotel.SpanContext;
import autotel.internal.Nullable;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.AttributeType;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.TraceFlags;
import io.opentelemetry.api.trace.TraceState;
import io.opentelemetry.api.trace.TraceStateBuilder;
import io.opentelemetry.sdk.trace.data.LinkData;
import java.util.LinkedHashMap;
import java.util.Map;

/** Converts between this library's model and OpenTelemetry's. */
public final class OtelConverter {
  /**
   * Set to true by an {@link Instrumenter} on a finished call's span when the tail decision drops
   * it. Exported only when no {@link TailSamplingSpanProcessor} discards the span first.
   */
  public static final AttributeKey<Boolean> TAIL_DROPPED =
    AttributeKey.booleanKey("autotel.sampling.dropped");

  public static io.opentelemetry.api.trace.SpanContext toOtel(SpanContext context) {
    if (context == null) throw new NullPointerException("context == null");
    TraceFlags flags = TraceFlags.fromByte(context.traceFlags());
    TraceState state = parseTraceState(context.traceState());
    return context.remote()
      ? io.opentelemetry.api.trace.SpanContext.createFromRemoteParent(
      context.traceId(), context.spanId(), flags, state)
      : io.opentelemetry.api.trace.SpanContext.create(
      context.traceId(), context.spanId(), flags, state);
  }

  /** Returns null when the OpenTelemetry context is invalid, for example all zeros. */
  @Nullable public static SpanContext fromOtel(io.opentelemetry.api.trace.SpanContext context) {
    if (context == null || !context.isValid()) return null;
    return SpanContext.newBuilder()
      .traceId(context.getTraceId())
      .spanId(context.getSpanId())
      .traceFlags(context.getTraceFlags().asByte())
      .remote(context.isRemote())
      .build();
  }

  public static Attributes toAttributes(Map<String, Object> attributes) {
    if (attributes.isEmpty()) return Attributes.empty();
    AttributesBuilder builder = Attributes.builder();
    attributes.forEach((key, value) -> {
      if (value instanceof String) {
        builder.put(key, (String) value);
      } else if (value instanceof Boolean) {
        builder.put(key, (Boolean) value);
      } else if (value instanceof Long) {
        builder.put(key, (Long) value);
      } else if (value instanceof Double) {
        builder.put(key, (Double) value);
      }
    });
    return builder.build();
  }

  public static LinkData toOtel(Link link) {
    return LinkData.create(toOtel(link.context()), toAttributes(link.attributes()));
  }

  /** Returns null when the link's context is invalid. Array attributes are skipped. */
  @Nullable public static Link fromOtel(LinkData link) {
    SpanContext context = fromOtel(link.getSpanContext());
    if (context == null) return null;
    Map<String, Object> attributes = new LinkedHashMap<>();
    link.getAttributes().forEach((key, value) -> {
      AttributeType type = key.getType();
      if (type == AttributeType.STRING || type == AttributeType.BOOLEAN
        || type == AttributeType.LONG || type == AttributeType.DOUBLE) {
        attributes.put(key.getKey(), value);
      }
    });
    return Link.create(context, attributes);
  }

  static TraceState parseTraceState(@Nullable String traceState) {
    if (traceState == null) return TraceState.getDefault();
    TraceStateBuilder builder = TraceState.builder();
    for (String member : traceState.split(",")) {
      int equals = member.indexOf('=');
      if (equals <= 0) continue;
      // the builder drops keys and values that aren't valid
      builder.put(member.substring(0, equals).trim(), member.substring(equals + 1).trim());
    }
    return builder.build();
  }

  OtelConverter() {}
}
