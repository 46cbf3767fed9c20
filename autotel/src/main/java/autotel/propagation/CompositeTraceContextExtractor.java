/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel.propagation;

import autotel.SpanContext;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Tries each extractor in order and returns the first context found. Use this when inbound
 * messages can come from producers instrumented with different tracers.
 */
public final class CompositeTraceContextExtractor implements TraceContextExtractor {

  public static CompositeTraceContextExtractor create(TraceContextExtractor... extractors) {
    if (extractors == null) throw new NullPointerException("extractors == null");
    return create(Arrays.asList(extractors));
  }

  /** @throws IllegalArgumentException if there are no extractors */
  public static CompositeTraceContextExtractor create(List<? extends TraceContextExtractor> extractors) {
    if (extractors == null) throw new NullPointerException("extractors == null");
    if (extractors.isEmpty()) throw new IllegalArgumentException("extractors are empty");
    List<TraceContextExtractor> copy = new ArrayList<>(extractors.size());
    for (TraceContextExtractor extractor : extractors) {
      if (extractor == null) throw new NullPointerException("extractor == null");
      copy.add(extractor);
    }
    return new CompositeTraceContextExtractor(Collections.unmodifiableList(copy));
  }

  final List<TraceContextExtractor> extractors;

  CompositeTraceContextExtractor(List<TraceContextExtractor> extractors) {
    this.extractors = extractors;
  }

  public List<TraceContextExtractor> extractors() {
    return extractors;
  }

  @Override public SpanContext extract(Map<String, String> headers) {
    for (int i = 0, length = extractors.size(); i < length; i++) {
      SpanContext result = extractors.get(i).extract(headers);
      if (result != null) return result;
    }
    return null;
  }

  @Override public String toString() {
    return "CompositeTraceContextExtractor" + extractors;
  }
}
