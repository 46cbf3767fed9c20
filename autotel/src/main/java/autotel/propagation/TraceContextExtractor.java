/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel.propagation;

import autotel.SpanContext;
import autotel.internal.Nullable;
import java.util.Map;

/**
 * Parses the trace context of one wire format out of message or request headers.
 *
 * <p>Absent, partial or malformed headers are an expected situation, for example a message sent by
 * an uninstrumented producer. Implementations return null in that case instead of throwing, and
 * never return a context with an all-zero identifier.
 */
@FunctionalInterface
public interface TraceContextExtractor {

  /**
   * @param headers header names to values. Names are matched exactly first, then ignoring case.
   * @return the remote context, or null if the headers don't hold a valid one
   */
  @Nullable SpanContext extract(Map<String, String> headers);
}
