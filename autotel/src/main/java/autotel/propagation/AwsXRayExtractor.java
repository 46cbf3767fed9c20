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
 * Extracts the AWS X-Ray {@code X-Amzn-Trace-Id} header, for example
 * {@code Root=1-5759e988-bd862e3fe1be46a994272793;Parent=53995c3f42cd8ad8;Sampled=1}.
 *
 * <p>The trace ID is the concatenation of the 8 character epoch and the 24 character random part of
 * {@code Root}. {@code Parent} becomes the span ID. {@code Sampled=0} clears the sampled flag and
 * {@code Sampled=1} sets it. Without a decision the context is treated as sampled. Other fields,
 * such as {@code Lineage}, are ignored.
 */
public final class AwsXRayExtractor implements TraceContextExtractor {
  static final Logger LOG = LoggerFactory.getLogger(AwsXRayExtractor.class);
  static final AwsXRayExtractor INSTANCE = new AwsXRayExtractor();

  public static final String TRACE_HEADER = "X-Amzn-Trace-Id";

  public static AwsXRayExtractor get() {
    return INSTANCE;
  }

  @Override public SpanContext extract(Map<String, String> headers) {
    String header = Headers.getNonBlank(headers, TRACE_HEADER);
    if (header == null) return null;

    String root = null, parent = null, sampled = null;
    for (String field : header.split(";")) {
      int equals = field.indexOf('=');
      if (equals == -1) continue;
      String key = field.substring(0, equals).trim(), value = field.substring(equals + 1).trim();
      if ("Root".equals(key)) {
        root = value;
      } else if ("Parent".equals(key)) {
        parent = value;
      } else if ("Sampled".equals(key)) {
        sampled = value;
      }
    }
    if (root == null || parent == null) {
      LOG.debug("Malformed X-Ray header: missing Root or Parent: {}", header);
      return null;
    }

    String traceId = parseRoot(root);
    String spanId = parent.length() == 16 ? HexCodec.normalize(parent, 16) : null;
    if (traceId == null || spanId == null) {
      LOG.debug("Malformed X-Ray header: {}", header);
      return null;
    }
    if (HexCodec.isAllZeros(traceId) || HexCodec.isAllZeros(spanId)) return null;

    return SpanContext.newBuilder()
      .traceId(traceId)
      .spanId(spanId)
      .sampled(!"0".equals(sampled))
      .remote(true)
      .build();
  }

  /** Returns the 32 character trace ID of a root like {@code 1-5759e988-bd862e3fe1be46a994272793}. */
  static String parseRoot(String root) {
    // 1 + '-' + 8 + '-' + 24
    if (root.length() != 35 || !root.startsWith("1-") || root.charAt(10) != '-') return null;
    String epoch = root.substring(2, 10), random = root.substring(11);
    if (!HexCodec.isHex(epoch) || !HexCodec.isHex(random)) return null;
    return HexCodec.normalize(epoch + random, 32);
  }

  @Override public String toString() {
    return "AwsXRayExtractor";
  }

  AwsXRayExtractor() {
  }
}
