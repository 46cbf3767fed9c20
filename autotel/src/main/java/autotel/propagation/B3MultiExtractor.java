/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel.propagation;

import autotel.SpanContext;
import autotel.internal.Headers;
import autotel.internal.HexCodec;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts the multi-header form of B3: {@code X-B3-TraceId}, {@code X-B3-SpanId}, and optionally
 * {@code X-B3-Sampled} or {@code X-B3-Flags}.
 *
 * <p>{@code X-B3-Sampled} of {@code 1} or {@code true} sets the sampled flag, as does a debug
 * {@code X-B3-Flags: 1}. Without either header the context is treated as sampled.
 */
public final class B3MultiExtractor implements TraceContextExtractor {
  static final Logger LOG = LoggerFactory.getLogger(B3MultiExtractor.class);
  static final B3MultiExtractor INSTANCE = new B3MultiExtractor();

  public static final String TRACE_ID = "x-b3-traceid";
  public static final String SPAN_ID = "x-b3-spanid";
  public static final String SAMPLED = "x-b3-sampled";
  public static final String FLAGS = "x-b3-flags";

  public static B3MultiExtractor get() {
    return INSTANCE;
  }

  @Override public SpanContext extract(Map<String, String> headers) {
    String traceIdHeader = Headers.getNonBlank(headers, TRACE_ID);
    String spanIdHeader = Headers.getNonBlank(headers, SPAN_ID);
    if (traceIdHeader == null || spanIdHeader == null) return null;

    String traceId = HexCodec.normalize(traceIdHeader, 32);
    String spanId = HexCodec.normalize(spanIdHeader, 16);
    if (traceId == null || spanId == null) {
      LOG.debug("Malformed B3 identifiers: {}/{}", traceIdHeader, spanIdHeader);
      return null;
    }
    if (HexCodec.isAllZeros(traceId) || HexCodec.isAllZeros(spanId)) return null;

    return SpanContext.newBuilder()
      .traceId(traceId)
      .spanId(spanId)
      .sampled(sampled(headers))
      .remote(true)
      .build();
  }

  static boolean sampled(Map<String, String> headers) {
    String sampled = Headers.getNonBlank(headers, SAMPLED);
    if (sampled != null) return "1".equals(sampled) || "true".equalsIgnoreCase(sampled);
    String flags = Headers.getNonBlank(headers, FLAGS);
    if (flags != null) return "1".equals(flags);
    return true;
  }

  @Override public String toString() {
    return "B3MultiExtractor";
  }

  B3MultiExtractor() {
  }
}
