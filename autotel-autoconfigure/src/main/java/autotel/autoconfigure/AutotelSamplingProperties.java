/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel.autoconfigure;

import autotel.propagation.PropagationFormat;
import autotel.propagation.TraceContextExtractor;
import autotel.sampling.AdaptiveSamplingPolicy;
import autotel.sampling.RandomSamplingPolicy;
import autotel.sampling.SamplingPolicy;
import autotel.sampling.SamplingPresets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Properties for building the {@link SamplingPolicy} and {@link TraceContextExtractor}. */
@ConfigurationProperties("autotel.sampling")
public class AutotelSamplingProperties {

  /** Set to false to disable sampling auto-configuration. */
  private boolean enabled = true;
  /** One of adaptive, random, always or never. */
  private String strategy = "adaptive";
  /** Name of a preset such as production or high-traffic. When set, overrides other options. */
  private String preset;
  /** Share of successful, fast calls kept, between 0 and 1. */
  private float baselineSampleRate = 0.1f;
  /** Calls taking at least this many milliseconds are kept when always-sample-slow. */
  private long slowThresholdMs = 1000L;
  /** Keep every failed call. */
  private boolean alwaysSampleErrors = true;
  /** Keep every slow call. */
  private boolean alwaysSampleSlow = true;
  /** Keep calls linked to a sampled context, such as consumers of a sampled message. */
  private boolean linksBased;
  /** Probability of keeping a call linked to a sampled context. */
  private float linksRate = 1.0f;
  /** Trace context formats to read from incoming headers, tried in order. */
  private List<String> propagationFormats = new ArrayList<>(List.of("W3C"));

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getStrategy() {
    return strategy;
  }

  public void setStrategy(String strategy) {
    this.strategy = strategy;
  }

  public String getPreset() {
    return preset;
  }

  public void setPreset(String preset) {
    this.preset = preset;
  }

  public float getBaselineSampleRate() {
    return baselineSampleRate;
  }

  public void setBaselineSampleRate(float baselineSampleRate) {
    this.baselineSampleRate = baselineSampleRate;
  }

  public long getSlowThresholdMs() {
    return slowThresholdMs;
  }

  public void setSlowThresholdMs(long slowThresholdMs) {
    this.slowThresholdMs = slowThresholdMs;
  }

  public boolean isAlwaysSampleErrors() {
    return alwaysSampleErrors;
  }

  public void setAlwaysSampleErrors(boolean alwaysSampleErrors) {
    this.alwaysSampleErrors = alwaysSampleErrors;
  }

  public boolean isAlwaysSampleSlow() {
    return alwaysSampleSlow;
  }

  public void setAlwaysSampleSlow(boolean alwaysSampleSlow) {
    this.alwaysSampleSlow = alwaysSampleSlow;
  }

  public boolean isLinksBased() {
    return linksBased;
  }

  public void setLinksBased(boolean linksBased) {
    this.linksBased = linksBased;
  }

  public float getLinksRate() {
    return linksRate;
  }

  public void setLinksRate(float linksRate) {
    this.linksRate = linksRate;
  }

  public List<String> getPropagationFormats() {
    return propagationFormats;
  }

  public void setPropagationFormats(List<String> propagationFormats) {
    this.propagationFormats = propagationFormats;
  }

  public SamplingPolicy toPolicy() {
    if (preset != null && !preset.isEmpty()) return SamplingPresets.forName(preset);
    switch (strategy.trim().toLowerCase(Locale.ROOT)) {
      case "adaptive":
        return AdaptiveSamplingPolicy.newBuilder()
          .baselineRate(baselineSampleRate)
          .slowThresholdMs(slowThresholdMs)
          .alwaysKeepErrors(alwaysSampleErrors)
          .alwaysKeepSlow(alwaysSampleSlow)
          .linksBased(linksBased)
          .linksRate(linksRate)
          .build();
      case "random":
        return RandomSamplingPolicy.create(baselineSampleRate);
      case "always":
        return SamplingPolicy.ALWAYS_SAMPLE;
      case "never":
        return SamplingPolicy.NEVER_SAMPLE;
      default:
        throw new IllegalArgumentException("Unknown sampling strategy: " + strategy);
    }
  }

  public TraceContextExtractor toExtractor() {
    List<PropagationFormat> formats = new ArrayList<>();
    for (String name : propagationFormats) formats.add(PropagationFormat.forName(name));
    return PropagationFormat.extractorFor(formats);
  }
}
