/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel.sampling;

import autotel.SamplingContext;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Always samples calls made with a watched feature flag enabled, so an experiment can be correlated
 * with its traces. Other calls are sampled randomly at the baseline rate.
 */
public final class FeatureFlagSamplingPolicy extends SamplingPolicy {
  static final Logger LOG = LoggerFactory.getLogger(FeatureFlagSamplingPolicy.class);

  /**
   * @param flagExtractor returns the flags enabled for a call, or null if there are none
   */
  public static Builder newBuilder(Function<SamplingContext, ? extends Collection<String>> flagExtractor) {
    if (flagExtractor == null) throw new NullPointerException("flagExtractor == null");
    return new Builder(flagExtractor);
  }

  /**
   * Returns a flag extractor which reads a metadata entry holding either a collection of flag names
   * or a single name.
   */
  public static Function<SamplingContext, Collection<String>> metadataFlags(String name) {
    if (name == null) throw new NullPointerException("name == null");
    return context -> {
      Object value = context.metadata().get(name);
      if (value == null) return null;
      if (value instanceof Collection) {
        Set<String> result = new LinkedHashSet<>();
        for (Object flag : (Collection<?>) value) {
          if (flag != null) result.add(flag.toString());
        }
        return result;
      }
      return Collections.singleton(value.toString());
    };
  }

  public static final class Builder {
    final Function<SamplingContext, ? extends Collection<String>> flagExtractor;
    float baselineRate = 0.1f;
    Set<String> alwaysSampleFlags = new LinkedHashSet<>();

    Builder(Function<SamplingContext, ? extends Collection<String>> flagExtractor) {
      this.flagExtractor = flagExtractor;
    }

    /** Rate used for calls without a watched flag. Defaults to 0.1 */
    public Builder baselineRate(float baselineRate) {
      this.baselineRate = checkRate("baselineRate", baselineRate);
      return this;
    }

    /** Flags which cause a call to always be sampled. Defaults to none. */
    public Builder alwaysSampleFlags(Collection<String> alwaysSampleFlags) {
      if (alwaysSampleFlags == null) throw new NullPointerException("alwaysSampleFlags == null");
      this.alwaysSampleFlags = new LinkedHashSet<>(alwaysSampleFlags);
      return this;
    }

    public FeatureFlagSamplingPolicy build() {
      return new FeatureFlagSamplingPolicy(this);
    }
  }

  final float baselineRate;
  final Set<String> alwaysSampleFlags = ConcurrentHashMap.newKeySet();
  final Function<SamplingContext, ? extends Collection<String>> flagExtractor;

  FeatureFlagSamplingPolicy(Builder builder) {
    baselineRate = builder.baselineRate;
    flagExtractor = builder.flagExtractor;
    alwaysSampleFlags.addAll(builder.alwaysSampleFlags);
  }

  public float baselineRate() {
    return baselineRate;
  }

  /** A read-only view of the flags that cause sampling. */
  public Set<String> alwaysSampleFlags() {
    return Collections.unmodifiableSet(alwaysSampleFlags);
  }

  @Override public boolean shouldSample(SamplingContext context) {
    Collection<String> flags = flagExtractor.apply(context);
    if (flags != null) {
      for (String flag : flags) {
        if (flag != null && alwaysSampleFlags.contains(flag)) {
          LOG.debug("Sampling {} for feature flag {}", context.operationName(), flag);
          return true;
        }
      }
    }
    return RandomSamplingPolicy.draw(baselineRate);
  }

  public void addAlwaysSampleFlags(String... flags) {
    alwaysSampleFlags.addAll(Arrays.asList(flags));
  }

  public void removeAlwaysSampleFlags(String... flags) {
    alwaysSampleFlags.removeAll(Arrays.asList(flags));
  }

  @Override public String toString() {
    return "FeatureFlagSamplingPolicy(" + baselineRate + ")";
  }
}
