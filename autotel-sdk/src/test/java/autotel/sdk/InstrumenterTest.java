/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel.sdk;

import autotel.Link;
import autotel.OperationResult;
import autotel.SamplingContext;
import autotel.SpanContext;
import autotel.sampling.AdaptiveSamplingPolicy;
import autotel.sampling.SamplingPolicy;
import com.github.valfirst.slf4jtest.TestLogger;
import com.github.valfirst.slf4jtest.TestLoggerFactory;
import com.github.valfirst.slf4jtest.TestLoggerFactoryExtension;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.event.Level;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(TestLoggerFactoryExtension.class)
class InstrumenterTest {
  TestLogger logger = TestLoggerFactory.getTestLogger(Instrumenter.class);
  InMemorySpanExporter exporter = InMemorySpanExporter.create();
  SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
    .addSpanProcessor(SimpleSpanProcessor.create(exporter))
    .build();

  @AfterEach void close() {
    tracerProvider.close();
  }

  Instrumenter instrumenter(SamplingPolicy policy) {
    return Instrumenter.create(tracerProvider.get("autotel"), policy);
  }

  @Test void sampled_runsInCurrentSpan() {
    AtomicReference<Span> current = new AtomicReference<>();

    String result = instrumenter(SamplingPolicy.ALWAYS_SAMPLE).trace("get", span -> {
      current.set(Span.current());
      assertThat(span.isRecording()).isTrue();
      return "ok";
    });

    assertThat(result).isEqualTo("ok");
    SpanData span = exporter.getFinishedSpanItems().get(0);
    assertThat(span.getName()).isEqualTo("get");
    assertThat(span.getKind()).isEqualTo(SpanKind.INTERNAL);
    assertThat(current.get().getSpanContext()).isEqualTo(span.getSpanContext());
  }

  @Test void unsampled_runsWithInvalidSpan() {
    String result = instrumenter(SamplingPolicy.NEVER_SAMPLE).trace("get", span -> {
      assertThat(span.getSpanContext().isValid()).isFalse();
      return "ok";
    });

    assertThat(result).isEqualTo("ok");
    assertThat(exporter.getFinishedSpanItems()).isEmpty();
  }

  @Test void unsampled_stillPropagatesExceptions() {
    assertThatThrownBy(() -> instrumenter(SamplingPolicy.NEVER_SAMPLE).trace("get", span -> {
      throw new IllegalStateException("boom");
    })).hasMessage("boom");
  }

  @Test void rethrowsCheckedExceptions() {
    Instrumenter instrumenter = instrumenter(SamplingPolicy.ALWAYS_SAMPLE);

    assertThatThrownBy(() -> instrumenter.<Void, IOException>trace("read", span -> {
      throw new IOException("disk");
    })).isInstanceOf(IOException.class);

    SpanData span = exporter.getFinishedSpanItems().get(0);
    assertThat(span.getStatus().getDescription()).isEqualTo("disk");
    assertThat(span.getEvents().get(0).getAttributes().get(AttributeKey.stringKey("exception.type")))
      .isEqualTo("java.io.IOException");
  }

  @Test void addsLinksKindAndAttributes() {
    SpanContext producer = SpanContext.newBuilder()
      .traceId("0af7651916cd43dd8448eb211c80319c")
      .spanId("b7ad6b7169203331")
      .sampled(true)
      .remote(true)
      .build();
    SamplingContext context = SamplingContext.newBuilder()
      .operationName("process")
      .addLink(Link.create(producer, java.util.Collections.singletonMap("index", 0L)))
      .build();

    instrumenter(SamplingPolicy.ALWAYS_SAMPLE).trace(context, SpanKind.CONSUMER,
      Attributes.of(AttributeKey.stringKey("messaging.system"), "kafka"), span -> null);

    SpanData span = exporter.getFinishedSpanItems().get(0);
    assertThat(span.getKind()).isEqualTo(SpanKind.CONSUMER);
    assertThat(span.getAttributes().get(AttributeKey.stringKey("messaging.system")))
      .isEqualTo("kafka");
    assertThat(span.getLinks()).singleElement().satisfies(link -> {
      assertThat(link.getSpanContext().getSpanId()).isEqualTo("b7ad6b7169203331");
      assertThat(link.getAttributes().get(AttributeKey.longKey("index"))).isZero();
    });
  }

  @Test void samples_whenPolicyThrows() {
    SamplingPolicy policy = mock(SamplingPolicy.class);
    when(policy.shouldSample(any())).thenThrow(new IllegalStateException("broken policy"));

    instrumenter(policy).trace("get", span -> null);

    assertThat(exporter.getFinishedSpanItems()).hasSize(1);
    assertThat(logger.getLoggingEvents()).singleElement().satisfies(event -> {
      assertThat(event.getLevel()).isEqualTo(Level.WARN);
      assertThat(event.getArguments()).startsWith("get");
    });
  }

  /** Without a tail sampling processor, dropped spans are exported with a marker. */
  @Test void releasesHeadDecisions_withoutTailSamplingProcessor() {
    AdaptiveSamplingPolicy policy = AdaptiveSamplingPolicy.newBuilder().baselineRate(0.0f).build();
    Instrumenter instrumenter = instrumenter(policy);

    for (int i = 0; i < 1000; i++) instrumenter.trace("get", span -> null);

    assertThat(policy.pendingCount()).isZero();
    assertThat(exporter.getFinishedSpanItems()).hasSize(1000).allSatisfy(span ->
      assertThat(span.getAttributes().get(OtelConverter.TAIL_DROPPED)).isTrue());
  }

  @Test void doesntMarkKeptSpans() {
    instrumenter(AdaptiveSamplingPolicy.newBuilder().baselineRate(1.0f).build())
      .trace("get", span -> null);

    assertThat(exporter.getFinishedSpanItems().get(0).getAttributes().asMap()).isEmpty();
  }

  @Test void decidesOnceWithOutcome() {
    RecordingTailPolicy policy = new RecordingTailPolicy();
    Instrumenter instrumenter = instrumenter(policy);
    IllegalStateException error = new IllegalStateException("boom");

    String result = instrumenter.trace("get", span -> "ok");
    assertThatThrownBy(() -> instrumenter.trace("put", span -> {
      throw error;
    })).isSameAs(error);

    assertThat(policy.contexts).extracting(SamplingContext::operationName)
      .containsExactly("get", "put");
    assertThat(result).isEqualTo("ok");
    assertThat(policy.results.get(0).success()).isTrue();
    assertThat(policy.results.get(0).durationMs()).isNotNegative();
    assertThat(policy.results.get(1).success()).isFalse();
    assertThat(policy.results.get(1).error()).isSameAs(error);
  }

  @Test void keeps_whenTailDecisionThrows() {
    RecordingTailPolicy policy = new RecordingTailPolicy() {
      @Override public boolean shouldKeepTrace(SamplingContext context, OperationResult result) {
        throw new IllegalStateException("broken policy");
      }
    };

    instrumenter(policy).trace("get", span -> null);

    assertThat(exporter.getFinishedSpanItems().get(0).getAttributes()
      .get(OtelConverter.TAIL_DROPPED)).isNull();
    assertThat(logger.getLoggingEvents()).singleElement().satisfies(event -> {
      assertThat(event.getLevel()).isEqualTo(Level.WARN);
      assertThat(event.getArguments()).contains("get", "broken policy");
    });
  }

  static class RecordingTailPolicy extends SamplingPolicy {
    final List<SamplingContext> contexts = new ArrayList<>();
    final List<OperationResult> results = new ArrayList<>();

    @Override public boolean shouldSample(SamplingContext context) {
      return true;
    }

    @Override public boolean needsTailSampling() {
      return true;
    }

    @Override public boolean shouldKeepTrace(SamplingContext context, OperationResult result) {
      contexts.add(context);
      results.add(result);
      return true;
    }
  }
}
