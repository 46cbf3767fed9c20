/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel.sampling;

import autotel.OperationResult;
import autotel.SamplingContext;

/**
 * SamplingPolicy decides if a particular call should be traced, and for policies that need it,
 * whether the trace of a finished call should be exported.
 *
 * <h3>Head and tail decisions</h3>
 *
 * <p>Call sites invoke {@link #shouldSample(SamplingContext)} before doing work. When it returns
 * false, no span is created. Policies that return true from {@link #needsTailSampling()} defer the
 * real decision: the span is always created, and once the call completes, {@link
 * #shouldKeepTrace(SamplingContext, OperationResult)} is invoked exactly once, with the same
 * context, to decide whether the finished span is exported. This lets outcome, such as an error or
 * high latency, keep a trace that a rate alone would have dropped.
 *
 * <p>Implementations must be cheap and free of I/O as they run on the path of every instrumented
 * call.
 */
// abstract for factory-method support
public abstract class SamplingPolicy {

  public static final SamplingPolicy ALWAYS_SAMPLE = new SamplingPolicy() {
    @Override public boolean shouldSample(SamplingContext context) {
      return true;
    }

    @Override public String toString() {
      return "AlwaysSample";
    }
  };

  public static final SamplingPolicy NEVER_SAMPLE = new SamplingPolicy() {
    @Override public boolean shouldSample(SamplingContext context) {
      return false;
    }

    @Override public String toString() {
      return "NeverSample";
    }
  };

  /** Returns true if a span should be created for this call. */
  public abstract boolean shouldSample(SamplingContext context);

  /**
   * Returns true if {@link #shouldKeepTrace(SamplingContext, OperationResult)} must be consulted
   * after the call completes. Defaults to false: the head decision is final.
   */
  public boolean needsTailSampling() {
    return false;
  }

  /**
   * Returns true if the finished span of this call should be exported. Only invoked when {@link
   * #needsTailSampling()}, exactly once per call that was passed to {@link
   * #shouldSample(SamplingContext)}.
   *
   * @throws UnsupportedOperationException if this policy doesn't use tail sampling
   */
  public boolean shouldKeepTrace(SamplingContext context, OperationResult result) {
    throw new UnsupportedOperationException(this + " does not use tail sampling");
  }

  static float checkRate(String name, float rate) {
    if (!(rate >= 0 && rate <= 1)) { // also catches NaN
      throw new IllegalArgumentException(name + " should be between 0 and 1: was " + rate);
    }
    return rate;
  }

  protected SamplingPolicy() {
  }
}
