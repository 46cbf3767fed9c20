/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel.sdk;

import autotel.sampling.SamplingPolicy;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.ReadWriteSpan;
import io.opentelemetry.sdk.trace.ReadableSpan;
import io.opentelemetry.sdk.trace.SpanProcessor;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static autotel.sdk.OtelConverter.TAIL_DROPPED;

/**
 * Wraps the span processor that exports spans, only passing it the finished spans that the
 * sampling policy keeps.
 *
 * <p>Starting spans are always passed through: sampling never changes the shape of a trace, only
 * what is exported. This matters because a span dropped here could still have propagated its
 * context to child operations while it was active.
 *
 * <p>The keep or drop decision is made by the {@link Instrumenter} as each call completes, never
 * here: the SDK only ends recording spans, so a decision left to this processor would never be made
 * for calls under an unsampled parent. Spans the call site marked {@linkplain
 * OtelConverter#TAIL_DROPPED dropped} are discarded entirely. All others, including those of
 * third-party instrumentation, are passed through. As only unmarked spans reach the delegate, the
 * marker is never exported.
 */
public final class TailSamplingSpanProcessor implements SpanProcessor {
  static final Logger LOG = LoggerFactory.getLogger(TailSamplingSpanProcessor.class);

  /**
   * @param delegate receives starting spans and the finished spans that are kept
   * @param policy the same policy the call sites use. Nothing is dropped unless it {@linkplain
   *     SamplingPolicy#needsTailSampling() needs tail sampling}.
   */
  public static TailSamplingSpanProcessor create(SpanProcessor delegate, SamplingPolicy policy) {
    if (delegate == null) throw new NullPointerException("delegate == null");
    if (policy == null) throw new NullPointerException("policy == null");
    return new TailSamplingSpanProcessor(delegate, policy);
  }

  final SpanProcessor delegate;
  final SamplingPolicy policy;
  final LongAdder keptSpans = new LongAdder(), droppedSpans = new LongAdder();

  TailSamplingSpanProcessor(SpanProcessor delegate, SamplingPolicy policy) {
    this.delegate = delegate;
    this.policy = policy;
  }

  public SamplingPolicy policy() {
    return policy;
  }

  /** Count of finished spans kept since this processor was created. */
  public long keptSpans() {
    return keptSpans.sum();
  }

  /** Count of finished spans dropped since this processor was created. */
  public long droppedSpans() {
    return droppedSpans.sum();
  }

  @Override public void onStart(Context parentContext, ReadWriteSpan span) {
    delegate.onStart(parentContext, span);
  }

  @Override public boolean isStartRequired() {
    return delegate.isStartRequired();
  }

  @Override public void onEnd(ReadableSpan span) {
    if (!shouldKeep(span)) {
      droppedSpans.increment();
      return;
    }
    keptSpans.increment();
    if (delegate.isEndRequired()) delegate.onEnd(span);
  }

  boolean shouldKeep(ReadableSpan span) {
    if (!policy.needsTailSampling()) return true;
    if (!Boolean.TRUE.equals(span.getAttribute(TAIL_DROPPED))) return true;
    LOG.trace("Dropping span {}/{}", span.getSpanContext().getTraceId(),
      span.getSpanContext().getSpanId());
    return false;
  }

  // Always true: kept spans are forwarded from here
  @Override public boolean isEndRequired() {
    return true;
  }

  @Override public CompletableResultCode shutdown() {
    return delegate.shutdown();
  }

  @Override public CompletableResultCode forceFlush() {
    return delegate.forceFlush();
  }

  @Override public String toString() {
    return "TailSamplingSpanProcessor{policy=" + policy + ", delegate=" + delegate + "}";
  }
}
