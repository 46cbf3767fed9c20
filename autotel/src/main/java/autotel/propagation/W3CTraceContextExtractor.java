/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel.propagation;

import autotel.SpanContext;
import autotel.internal.Headers;
import autotel.internal.HexCodec;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts the W3C Trace Context {@code traceparent} header, for example
 * {@code 00-0af7651916cd43dd8448eb211c80319c-b7ad6b7169203331-01}, along with {@code tracestate}.
 *
 * <p>Version {@code 00} must match the grammar exactly. Later versions may append fields, which are
 * ignored. Version {@code ff} is invalid.
 *
 * @see <a href="https://www.w3.org/TR/trace-context/">W3C Trace Context</a>
 */
public final class W3CTraceContextExtractor implements TraceContextExtractor {
  static final Logger LOG = LoggerFactory.getLogger(W3CTraceContextExtractor.class);
  static final W3CTraceContextExtractor INSTANCE = new W3CTraceContextExtractor();

  public static final String TRACEPARENT = "traceparent";
  public static final String TRACESTATE = "tracestate";

  static final Pattern TRACEPARENT_PATTERN =
    Pattern.compile("([0-9a-f]{2})-([0-9a-f]{32})-([0-9a-f]{16})-([0-9a-f]{2})(-.*)?");

  public static W3CTraceContextExtractor get() {
    return INSTANCE;
  }

  @Override public SpanContext extract(Map<String, String> headers) {
    String traceparent = Headers.getNonBlank(headers, TRACEPARENT);
    if (traceparent == null) return null;

    Matcher matcher = TRACEPARENT_PATTERN.matcher(traceparent);
    if (!matcher.matches()) {
      LOG.debug("Malformed traceparent: {}", traceparent);
      return null;
    }

    String version = matcher.group(1);
    if ("ff".equals(version)) {
      LOG.debug("Invalid traceparent version ff: {}", traceparent);
      return null;
    }
    if ("00".equals(version) && matcher.group(5) != null) {
      LOG.debug("Malformed traceparent: version 00 has extra fields: {}", traceparent);
      return null;
    }

    String traceId = matcher.group(2), spanId = matcher.group(3);
    if (HexCodec.isAllZeros(traceId) || HexCodec.isAllZeros(spanId)) return null;

    return SpanContext.newBuilder()
      .traceId(traceId)
      .spanId(spanId)
      .traceFlags((byte) Integer.parseInt(matcher.group(4), 16))
      .remote(true)
      .traceState(Headers.getNonBlank(headers, TRACESTATE))
      .build();
  }

  @Override public String toString() {
    return "W3CTraceContextExtractor";
  }

  W3CTraceContextExtractor() {
  }
}
