/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel.sdk;

import autotel.Link;
import autotel.OperationResult;
import autotel.SamplingContext;
import autotel.sampling.SamplingPolicy;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs operations in spans, asking a {@link SamplingPolicy} first whether to create one.
 *
 * <p>When the policy {@linkplain SamplingPolicy#needsTailSampling() needs tail sampling}, the
 * keep or drop decision is also made here, once per call as it completes, whether or not the span
 * is recording. A dropped span is marked with {@link OtelConverter#TAIL_DROPPED} for a {@link
 * TailSamplingSpanProcessor} to discard before export.
 */
public final class Instrumenter {
  static final Logger LOG = LoggerFactory.getLogger(Instrumenter.class);

  public static Instrumenter create(Tracer tracer, SamplingPolicy policy) {
    if (tracer == null) throw new NullPointerException("tracer == null");
    if (policy == null) throw new NullPointerException("policy == null");
    return new Instrumenter(tracer, policy);
  }

  final Tracer tracer;
  final SamplingPolicy policy;

  Instrumenter(Tracer tracer, SamplingPolicy policy) {
    this.tracer = tracer;
    this.policy = policy;
  }

  public SamplingPolicy policy() {
    return policy;
  }

  /** Runs the operation in an internal span named {@code operationName}. */
  public <T, E extends Exception> T trace(String operationName, TracedOperation<T, E> operation)
    throws E {
    return trace(SamplingContext.create(operationName), SpanKind.INTERNAL, Attributes.empty(),
      operation);
  }

  /**
   * Runs the operation in a span named after {@link SamplingContext#operationName()}, linked to
   * each of {@link SamplingContext#links()}.
   *
   * <p>If the policy declines, the operation still runs, with an invalid span. An exception raised
   * by the operation is recorded on the span, which is marked as an error, then rethrown. The
   * duration passed to {@link SamplingPolicy#shouldKeepTrace} is measured around the operation.
   */
  public <T, E extends Exception> T trace(SamplingContext context, SpanKind kind,
    Attributes attributes, TracedOperation<T, E> operation) throws E {
    if (context == null) throw new NullPointerException("context == null");
    if (kind == null) throw new NullPointerException("kind == null");
    if (attributes == null) throw new NullPointerException("attributes == null");
    if (operation == null) throw new NullPointerException("operation == null");

    if (!shouldSample(context)) return operation.call(Span.getInvalid());

    SpanBuilder builder = tracer.spanBuilder(context.operationName())
      .setSpanKind(kind)
      .setAllAttributes(attributes);
    for (Link link : context.links()) {
      builder.addLink(OtelConverter.toOtel(link.context()),
        OtelConverter.toAttributes(link.attributes()));
    }

    Span span = builder.startSpan();
    long startNanos = System.nanoTime();
    Throwable error = null;
    try (Scope scope = span.makeCurrent()) {
      return operation.call(span);
    } catch (Throwable t) {
      error = t;
      span.recordException(t);
      span.setStatus(StatusCode.ERROR, t.getMessage() != null ? t.getMessage() : "");
      throw t;
    } finally {
      // decided even when the span isn't recording, so the policy can release its head decision
      if (policy.needsTailSampling()) {
        double durationMs = (System.nanoTime() - startNanos) / 1_000_000d;
        OperationResult result = error == null
          ? OperationResult.success(durationMs)
          : OperationResult.failure(durationMs, error);
        if (!shouldKeepTrace(context, result)) span.setAttribute(OtelConverter.TAIL_DROPPED, true);
      }
      span.end();
    }
  }

  boolean shouldSample(SamplingContext context) {
    try {
      return policy.shouldSample(context);
    } catch (RuntimeException e) {
      LOG.warn("Sampling {} as {} could not decide due to {}({})", context.operationName(), policy,
        e.getClass().getSimpleName(), e.getMessage(), e);
      return true;
    }
  }

  boolean shouldKeepTrace(SamplingContext context, OperationResult result) {
    try {
      return policy.shouldKeepTrace(context, result);
    } catch (RuntimeException e) {
      LOG.warn("Keeping {} as {} could not decide due to {}({})", context.operationName(), policy,
        e.getClass().getSimpleName(), e.getMessage(), e);
      return true;
    }
  }

  @Override public String toString() {
    return "Instrumenter{policy=" + policy + "}";
  }
}
