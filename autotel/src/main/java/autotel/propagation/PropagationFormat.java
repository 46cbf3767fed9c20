/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel.propagation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Wire formats of trace context that can be extracted, by name. */
public enum PropagationFormat {
  /** {@code traceparent} and {@code tracestate} */
  W3C(W3CTraceContextExtractor.INSTANCE),
  /** Either form of B3 */
  B3(B3Extractor.INSTANCE),
  /** The single {@code b3} header */
  B3_SINGLE(B3SingleExtractor.INSTANCE),
  /** {@code X-B3-TraceId}, {@code X-B3-SpanId} and friends */
  B3_MULTI(B3MultiExtractor.INSTANCE),
  /** {@code x-datadog-*} */
  DATADOG(DatadogExtractor.INSTANCE),
  /** {@code X-Amzn-Trace-Id} */
  XRAY(AwsXRayExtractor.INSTANCE);

  final TraceContextExtractor extractor;

  PropagationFormat(TraceContextExtractor extractor) {
    this.extractor = extractor;
  }

  public TraceContextExtractor extractor() {
    return extractor;
  }

  /**
   * Parses a format name ignoring case and treating '-' and '_' alike, for example "b3-multi".
   *
   * @throws IllegalArgumentException if there is no such format
   */
  public static PropagationFormat forName(String name) {
    if (name == null) throw new NullPointerException("name == null");
    String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    if ("TRACECONTEXT".equals(normalized) || "TRACEPARENT".equals(normalized)) return W3C;
    if ("AWS_XRAY".equals(normalized) || "X_RAY".equals(normalized)) return XRAY;
    return valueOf(normalized);
  }

  /**
   * Returns an extractor that tries each format in order. A single format returns its extractor
   * directly.
   */
  public static TraceContextExtractor extractorFor(List<PropagationFormat> formats) {
    if (formats == null) throw new NullPointerException("formats == null");
    if (formats.isEmpty()) throw new IllegalArgumentException("formats are empty");
    if (formats.size() == 1) return formats.get(0).extractor;
    List<TraceContextExtractor> extractors = new ArrayList<>(formats.size());
    for (PropagationFormat format : formats) extractors.add(format.extractor);
    return CompositeTraceContextExtractor.create(extractors);
  }
}
