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
 * Extracts Datadog's {@code x-datadog-trace-id} and {@code x-datadog-parent-id} headers. Datadog
 * sends identifiers as unsigned decimal numbers, which are converted to lower-hex and left-padded
 * to 32 and 16 characters.
 *
 * <p>A {@code x-datadog-sampling-priority} above zero sets the sampled flag. Zero, negative and
 * unparsable priorities clear it. Without the header, the context is treated as sampled.
 */
public final class DatadogExtractor implements TraceContextExtractor {
  static final Logger LOG = LoggerFactory.getLogger(DatadogExtractor.class);
  static final DatadogExtractor INSTANCE = new DatadogExtractor();

  public static final String TRACE_ID = "x-datadog-trace-id";
  public static final String PARENT_ID = "x-datadog-parent-id";
  public static final String SAMPLING_PRIORITY = "x-datadog-sampling-priority";

  public static DatadogExtractor get() {
    return INSTANCE;
  }

  @Override public SpanContext extract(Map<String, String> headers) {
    String traceIdDecimal = Headers.getNonBlank(headers, TRACE_ID);
    String parentIdDecimal = Headers.getNonBlank(headers, PARENT_ID);
    if (traceIdDecimal == null || parentIdDecimal == null) return null;

    String traceId = HexCodec.decimalToHex(traceIdDecimal, 32);
    String spanId = HexCodec.decimalToHex(parentIdDecimal, 16);
    if (traceId == null || spanId == null) {
      LOG.debug("Malformed Datadog identifiers: {}/{}", traceIdDecimal, parentIdDecimal);
      return null;
    }
    if (HexCodec.isAllZeros(traceId) || HexCodec.isAllZeros(spanId)) return null;

    return SpanContext.newBuilder()
      .traceId(traceId)
      .spanId(spanId)
      .sampled(sampled(Headers.getNonBlank(headers, SAMPLING_PRIORITY)))
      .remote(true)
      .build();
  }

  static boolean sampled(String samplingPriority) {
    if (samplingPriority == null) return true;
    try {
      return Integer.parseInt(samplingPriority) > 0;
    } catch (NumberFormatException e) {
      LOG.debug("Malformed Datadog sampling priority: {}", samplingPriority);
      return false;
    }
  }

  @Override public String toString() {
    return "DatadogExtractor";
  }

  DatadogExtractor() {
  }
}
