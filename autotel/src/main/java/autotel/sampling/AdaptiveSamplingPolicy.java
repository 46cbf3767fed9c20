/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel.sampling;

import autotel.InvocationId;
import autotel.Link;
import autotel.OperationResult;
import autotel.SamplingContext;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps every failed or slow call, and a baseline share of the rest. This is the recommended
 * production policy: critical traces are never lost while the volume of routine ones stays low.
 *
 * <p>This policy uses tail sampling. {@link #shouldSample(SamplingContext)} always returns true so
 * that every call gets a span, and draws a baseline decision it remembers by {@link
 * SamplingContext#invocationId()}. Once the call completes, {@link #shouldKeepTrace(SamplingContext,
 * OperationResult)} resolves in this order:
 *
 * <ol>
 *   <li>Failed calls are kept, if {@linkplain Builder#alwaysKeepErrors(boolean) enabled}</li>
 *   <li>Calls at or above the {@linkplain Builder#slowThresholdMs(long) slow threshold} are kept,
 *   if {@linkplain Builder#alwaysKeepSlow(boolean) enabled}</li>
 *   <li>When {@linkplain Builder#linksBased(boolean) links-based}, a call linked to any sampled
 *   context is kept with probability {@linkplain Builder#linksRate(float) linksRate}</li>
 *   <li>Otherwise, the baseline decision drawn at the start of the call</li>
 * </ol>
 *
 * <p>Spans of a tail-sampled policy are only dropped when finished spans pass through a
 * tail-sampling span processor. Without one, every span is exported.
 */
public final class AdaptiveSamplingPolicy extends SamplingPolicy {
  static final Logger LOG = LoggerFactory.getLogger(AdaptiveSamplingPolicy.class);

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    float baselineRate = 0.1f, linksRate = 1.0f;
    long slowThresholdMs = 1000L;
    boolean alwaysKeepErrors = true, alwaysKeepSlow = true, linksBased;

    Builder() {
    }

    /** Share of successful, fast calls that are kept. Defaults to 0.1 */
    public Builder baselineRate(float baselineRate) {
      this.baselineRate = checkRate("baselineRate", baselineRate);
      return this;
    }

    /** Calls taking at least this many milliseconds are slow. Defaults to 1000 */
    public Builder slowThresholdMs(long slowThresholdMs) {
      if (slowThresholdMs < 0) {
        throw new IllegalArgumentException("slowThresholdMs < 0: was " + slowThresholdMs);
      }
      this.slowThresholdMs = slowThresholdMs;
      return this;
    }

    /** Keep every failed call. Defaults to true */
    public Builder alwaysKeepErrors(boolean alwaysKeepErrors) {
      this.alwaysKeepErrors = alwaysKeepErrors;
      return this;
    }

    /** Keep every slow call. Defaults to true */
    public Builder alwaysKeepSlow(boolean alwaysKeepSlow) {
      this.alwaysKeepSlow = alwaysKeepSlow;
      return this;
    }

    /** Consider links to sampled contexts, for example producers of a consumed batch. Defaults to false */
    public Builder linksBased(boolean linksBased) {
      this.linksBased = linksBased;
      return this;
    }

    /** Probability of keeping a call linked to a sampled context. Defaults to 1.0 */
    public Builder linksRate(float linksRate) {
      this.linksRate = checkRate("linksRate", linksRate);
      return this;
    }

    public AdaptiveSamplingPolicy build() {
      return new AdaptiveSamplingPolicy(this);
    }
  }

  final float baselineRate, linksRate;
  final long slowThresholdMs;
  final boolean alwaysKeepErrors, alwaysKeepSlow, linksBased;
  // Each entry lives from shouldSample to shouldKeepTrace of a single call.
  final ConcurrentHashMap<InvocationId, Boolean> pendingDecisions = new ConcurrentHashMap<>();

  AdaptiveSamplingPolicy(Builder builder) {
    baselineRate = builder.baselineRate;
    slowThresholdMs = builder.slowThresholdMs;
    alwaysKeepErrors = builder.alwaysKeepErrors;
    alwaysKeepSlow = builder.alwaysKeepSlow;
    linksBased = builder.linksBased;
    linksRate = builder.linksRate;
  }

  public float baselineRate() {
    return baselineRate;
  }

  public long slowThresholdMs() {
    return slowThresholdMs;
  }

  public boolean alwaysKeepErrors() {
    return alwaysKeepErrors;
  }

  public boolean alwaysKeepSlow() {
    return alwaysKeepSlow;
  }

  public boolean linksBased() {
    return linksBased;
  }

  public float linksRate() {
    return linksRate;
  }

  @Override public boolean needsTailSampling() {
    return true;
  }

  /** Always returns true. The baseline decision is remembered until the call completes. */
  @Override public boolean shouldSample(SamplingContext context) {
    pendingDecisions.put(context.invocationId(), RandomSamplingPolicy.draw(baselineRate));
    return true;
  }

  @Override public boolean shouldKeepTrace(SamplingContext context, OperationResult result) {
    Boolean pending = pendingDecisions.remove(context.invocationId());
    boolean baseline;
    if (pending != null) {
      baseline = pending;
    } else {
      LOG.debug("No baseline decision for {}; was shouldSample skipped?", context);
      baseline = false;
    }

    if (alwaysKeepErrors && !result.success()) {
      if (!baseline && LOG.isDebugEnabled()) {
        Throwable error = result.error();
        LOG.debug("Keeping failed trace of {} due to {}", context.operationName(),
          error != null ? error.getClass().getSimpleName() + "(" + error.getMessage() + ")" : "error");
      }
      return true;
    }

    if (alwaysKeepSlow && result.durationMs() >= slowThresholdMs) {
      if (!baseline) {
        LOG.debug("Keeping slow trace of {} which took {}ms", context.operationName(),
          result.durationMs());
      }
      return true;
    }

    if (linksBased && hasSampledLink(context)) {
      return RandomSamplingPolicy.draw(linksRate);
    }

    return baseline;
  }

  static boolean hasSampledLink(SamplingContext context) {
    for (Link link : context.links()) {
      if (link.context().sampled()) return true;
    }
    return false;
  }

  /**
   * Count of calls that have a head decision but haven't completed. This returns to zero once
   * every call given to {@link #shouldSample} has been given to {@link #shouldKeepTrace}.
   */
  public int pendingCount() {
    return pendingDecisions.size();
  }

  @Override public String toString() {
    return "AdaptiveSamplingPolicy{baselineRate=" + baselineRate
      + ", slowThresholdMs=" + slowThresholdMs
      + ", alwaysKeepErrors=" + alwaysKeepErrors
      + ", alwaysKeepSlow=" + alwaysKeepSlow
      + (linksBased ? ", linksRate=" + linksRate : "")
      + "}";
  }
}
