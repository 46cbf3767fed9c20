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
 * Extracts the single {@code b3} header: {@code {TraceId}-{SpanId}-{SamplingState}-{ParentSpanId}},
 * where the last two fields are optional. For example,
 * {@code 80f198ee56343ba864fe8b2a57d3eff7-e457b5a2e4d86bd1-1}.
 *
 * <p>A value of {@code 0} is a bare "don't sample" decision with no identifiers, so nothing is
 * extracted. The sampling state {@code 0} clears the sampled flag, while {@code 1} and {@code d}
 * (debug) set it. When absent, the context is treated as sampled.
 *
 * @see <a href="https://github.com/openzipkin/b3-propagation">B3 Propagation</a>
 */
public final class B3SingleExtractor implements TraceContextExtractor {
  static final Logger LOG = LoggerFactory.getLogger(B3SingleExtractor.class);
  static final B3SingleExtractor INSTANCE = new B3SingleExtractor();

  public static final String B3 = "b3";

  public static B3SingleExtractor get() {
    return INSTANCE;
  }

  @Override public SpanContext extract(Map<String, String> headers) {
    String b3 = Headers.getNonBlank(headers, B3);
    if (b3 == null || "0".equals(b3)) return null;

    String[] fields = b3.split("-", -1);
    if (fields.length < 2 || fields.length > 4) {
      LOG.debug("Malformed b3: expected 2 to 4 fields: {}", b3);
      return null;
    }

    String traceId = HexCodec.normalize(fields[0], 32);
    String spanId = HexCodec.normalize(fields[1], 16);
    if (traceId == null || spanId == null) {
      LOG.debug("Malformed b3: invalid identifiers: {}", b3);
      return null;
    }
    if (HexCodec.isAllZeros(traceId) || HexCodec.isAllZeros(spanId)) return null;

    boolean sampled = true;
    if (fields.length > 2) {
      switch (fields[2]) {
        case "0":
          sampled = false;
          break;
        case "1":
        case "d":
          break;
        default:
          LOG.debug("Malformed b3: invalid sampling state: {}", b3);
          return null;
      }
    }

    return SpanContext.newBuilder()
      .traceId(traceId)
      .spanId(spanId)
      .sampled(sampled)
      .remote(true)
      .build();
  }

  @Override public String toString() {
    return "B3SingleExtractor";
  }

  B3SingleExtractor() {
  }
}
