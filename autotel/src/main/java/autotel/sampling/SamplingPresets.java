/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel.sampling;

import java.util.Locale;

/** Policies for common deployment situations. Each call returns a new instance. */
public final class SamplingPresets {

  /** 10% baseline, all errors and all calls slower than 1s. Suits most production services. */
  public static SamplingPolicy production() {
    return AdaptiveSamplingPolicy.newBuilder().baselineRate(0.1f).slowThresholdMs(1000L).build();
  }

  /** 1% baseline, all errors and all calls slower than 2s, for high-volume services. */
  public static SamplingPolicy highTraffic() {
    return AdaptiveSamplingPolicy.newBuilder().baselineRate(0.01f).slowThresholdMs(2000L).build();
  }

  /** 50% baseline, all errors and all calls slower than 500ms, for active debugging sessions. */
  public static SamplingPolicy debugging() {
    return AdaptiveSamplingPolicy.newBuilder().baselineRate(0.5f).slowThresholdMs(500L).build();
  }

  /** Traces everything. */
  public static SamplingPolicy development() {
    return SamplingPolicy.ALWAYS_SAMPLE;
  }

  /** Keeps failed calls and drops all successful ones. */
  public static SamplingPolicy errorsOnly() {
    return AdaptiveSamplingPolicy.newBuilder()
      .baselineRate(0.0f)
      .alwaysKeepErrors(true)
      .alwaysKeepSlow(false)
      .build();
  }

  /**
   * Returns the preset of the given name, ignoring case and treating '-' and '_' alike. For example,
   * "high-traffic" and "HIGH_TRAFFIC" both return {@link #highTraffic()}.
   *
   * @throws IllegalArgumentException if there is no such preset
   */
  public static SamplingPolicy forName(String name) {
    if (name == null) throw new NullPointerException("name == null");
    switch (name.trim().toLowerCase(Locale.ROOT).replace('-', '_')) {
      case "production":
        return production();
      case "high_traffic":
      case "hightraffic":
        return highTraffic();
      case "debugging":
        return debugging();
      case "development":
        return development();
      case "errors_only":
      case "errorsonly":
        return errorsOnly();
      default:
        throw new IllegalArgumentException("Unknown sampling preset: " + name);
    }
  }

  SamplingPresets() {}
}
