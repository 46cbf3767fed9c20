/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel.sampling;

import autotel.SamplingContext;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Accepts each call independently with probability {@link #rate()}. Unlike {@link
 * PerKeySamplingPolicy}, two calls with identical inputs can get different decisions.
 */
public final class RandomSamplingPolicy extends SamplingPolicy {

  /**
   * @param rate 0 drops every call and 1 keeps every call
   * @throws IllegalArgumentException if the rate is outside [0, 1]
   */
  public static RandomSamplingPolicy create(float rate) {
    return new RandomSamplingPolicy(checkRate("rate", rate));
  }

  final float rate;

  RandomSamplingPolicy(float rate) {
    this.rate = rate;
  }

  public float rate() {
    return rate;
  }

  @Override public boolean shouldSample(SamplingContext context) {
    return draw(rate);
  }

  /** Returns true with the given probability. {@code nextFloat()} is in [0, 1), so 1 always wins. */
  static boolean draw(float rate) {
    if (rate <= 0f) return false;
    return ThreadLocalRandom.current().nextFloat() < rate;
  }

  @Override public String toString() {
    return "RandomSamplingPolicy(" + rate + ")";
  }
}
