/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel.sdk;

import autotel.Link;
import autotel.SpanContext;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.TraceFlags;
import io.opentelemetry.api.trace.TraceState;
import io.opentelemetry.sdk.trace.data.LinkData;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class OtelConverterTest {
  static final SpanContext CONTEXT = SpanContext.newBuilder()
    .traceId("0af7651916cd43dd8448eb211c80319c")
    .spanId("b7ad6b7169203331")
    .sampled(true)
    .remote(true)
    .traceState("congo=t61rcWkgMzE,rojo=00f067aa0ba902b7")
    .build();

  @Test void toOtel_spanContext() {
    io.opentelemetry.api.trace.SpanContext otel = OtelConverter.toOtel(CONTEXT);

    assertThat(otel.getTraceId()).isEqualTo(CONTEXT.traceId());
    assertThat(otel.getSpanId()).isEqualTo(CONTEXT.spanId());
    assertThat(otel.isSampled()).isTrue();
    assertThat(otel.isRemote()).isTrue();
    assertThat(otel.getTraceState().asMap())
      .containsOnly(entry("congo", "t61rcWkgMzE"), entry("rojo", "00f067aa0ba902b7"));
  }

  @Test void toOtel_local() {
    assertThat(OtelConverter.toOtel(CONTEXT.toBuilder().remote(false).build()).isRemote()).isFalse();
  }

  @Test void fromOtel_spanContext() {
    SpanContext context = OtelConverter.fromOtel(io.opentelemetry.api.trace.SpanContext.create(
      CONTEXT.traceId(), CONTEXT.spanId(), TraceFlags.getDefault(), TraceState.getDefault()));

    assertThat(context.traceId()).isEqualTo(CONTEXT.traceId());
    assertThat(context.sampled()).isFalse();
    assertThat(context.remote()).isFalse();
  }

  @Test void fromOtel_invalid() {
    assertThat(OtelConverter.fromOtel(io.opentelemetry.api.trace.SpanContext.getInvalid())).isNull();
  }

  @Test void parseTraceState_skipsInvalidMembers() {
    assertThat(OtelConverter.parseTraceState("congo=t61rcWkgMzE,garbage,=x").asMap())
      .containsOnly(entry("congo", "t61rcWkgMzE"));
    assertThat(OtelConverter.parseTraceState(null).isEmpty()).isTrue();
  }

  @Test void toOtel_link() {
    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("messaging.batch.message.index", 2L);
    attributes.put("producer", "checkout");

    LinkData link = OtelConverter.toOtel(Link.create(CONTEXT, attributes));

    assertThat(link.getSpanContext().getSpanId()).isEqualTo(CONTEXT.spanId());
    assertThat(link.getAttributes().get(AttributeKey.longKey("messaging.batch.message.index")))
      .isEqualTo(2L);
    assertThat(link.getAttributes().get(AttributeKey.stringKey("producer"))).isEqualTo("checkout");
  }

  @Test void fromOtel_link_skipsArrays() {
    LinkData link = LinkData.create(OtelConverter.toOtel(CONTEXT), Attributes.builder()
      .put("index", 1L)
      .put("ok", true)
      .put(AttributeKey.stringArrayKey("tags"), List.of("a", "b"))
      .build());

    assertThat(OtelConverter.fromOtel(link).attributes())
      .containsOnly(entry("index", 1L), entry("ok", true));
  }
}
