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
 * Samples calls consistently by a key extracted from the call, such as a user or tenant ID. All
 * calls carrying the same key get the same decision, so a sampled user's requests are traced
 * together.
 *
 * <h3>Implementation</h3>
 *
 * <p>Keys in the allow-list are always sampled. Other keys are hashed with a 32-bit polynomial
 * hash over their code points. The absolute value of the hash, divided by 2<sup>31</sup>, is
 * compared to the baseline rate: {@code isSampled == abs(hash) / 2^31 < baselineRate}. The hash is
 * a pure function of the key, so the decision survives restarts and is shared by every instance
 * configured with the same rate.
 *
 * <p>Calls without a key fall back to an independent random decision at the baseline rate.
 */
public final class PerKeySamplingPolicy extends SamplingPolicy {
  static final Logger LOG = LoggerFactory.getLogger(PerKeySamplingPolicy.class);

  /**
   * @param keyExtractor returns the key of a call, or null if it has none
   */
  public static Builder newBuilder(Function<SamplingContext, String> keyExtractor) {
    if (keyExtractor == null) throw new NullPointerException("keyExtractor == null");
    return new Builder(keyExtractor);
  }

  /** Returns a key extractor which reads a metadata entry by name, converting it to a string. */
  public static Function<SamplingContext, String> metadataKey(String name) {
    if (name == null) throw new NullPointerException("name == null");
    return context -> {
      Object value = context.metadata().get(name);
      return value != null ? value.toString() : null;
    };
  }

  public static final class Builder {
    final Function<SamplingContext, String> keyExtractor;
    float baselineRate = 0.1f;
    Set<String> alwaysSampleKeys = new LinkedHashSet<>();

    Builder(Function<SamplingContext, String> keyExtractor) {
      this.keyExtractor = keyExtractor;
    }

    /** Share of keys sampled when not in the allow-list. Defaults to 0.1 */
    public Builder baselineRate(float baselineRate) {
      this.baselineRate = checkRate("baselineRate", baselineRate);
      return this;
    }

    /** Keys which are always sampled. Defaults to none. */
    public Builder alwaysSampleKeys(Collection<String> alwaysSampleKeys) {
      if (alwaysSampleKeys == null) throw new NullPointerException("alwaysSampleKeys == null");
      this.alwaysSampleKeys = new LinkedHashSet<>(alwaysSampleKeys);
      return this;
    }

    public PerKeySamplingPolicy build() {
      return new PerKeySamplingPolicy(this);
    }
  }

  final float baselineRate;
  final Set<String> alwaysSampleKeys = ConcurrentHashMap.newKeySet();
  final Function<SamplingContext, String> keyExtractor;

  PerKeySamplingPolicy(Builder builder) {
    baselineRate = builder.baselineRate;
    keyExtractor = builder.keyExtractor;
    alwaysSampleKeys.addAll(builder.alwaysSampleKeys);
  }

  public float baselineRate() {
    return baselineRate;
  }

  /** A read-only view of the keys that are always sampled. */
  public Set<String> alwaysSampleKeys() {
    return Collections.unmodifiableSet(alwaysSampleKeys);
  }

  @Override public boolean shouldSample(SamplingContext context) {
    String key = keyExtractor.apply(context);
    if (key == null || key.isEmpty()) return RandomSamplingPolicy.draw(baselineRate);

    if (alwaysSampleKeys.contains(key)) {
      LOG.debug("Sampling {} for always sampled key {}", context.operationName(), key);
      return true;
    }
    return normalizedHash(key) < baselineRate;
  }

  public void addAlwaysSampleKeys(String... keys) {
    alwaysSampleKeys.addAll(Arrays.asList(keys));
  }

  public void removeAlwaysSampleKeys(String... keys) {
    alwaysSampleKeys.removeAll(Arrays.asList(keys));
  }

  /** Maps the key to [0, 1). */
  static double normalizedHash(String key) {
    int hash = 0;
    for (int i = 0, length = key.length(); i < length; ) {
      int codePoint = key.codePointAt(i);
      hash = 31 * hash + codePoint;
      i += Character.charCount(codePoint);
    }
    // The absolute value of Integer.MIN_VALUE is larger than an int, so Math.abs returns identity.
    int positive = hash == Integer.MIN_VALUE ? Integer.MAX_VALUE : Math.abs(hash);
    return positive / 2147483648.0;
  }

  @Override public String toString() {
    return "PerKeySamplingPolicy(" + baselineRate + ")";
  }
}
