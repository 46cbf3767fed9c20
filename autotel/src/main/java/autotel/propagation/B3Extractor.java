/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel.propagation;

import autotel.SpanContext;
import java.util.Map;

/** Accepts either form of B3, preferring the single {@code b3} header when both are present. */
public final class B3Extractor implements TraceContextExtractor {
  static final B3Extractor INSTANCE = new B3Extractor();

  public static B3Extractor get() {
    return INSTANCE;
  }

  @Override public SpanContext extract(Map<String, String> headers) {
    SpanContext result = B3SingleExtractor.INSTANCE.extract(headers);
    if (result != null) return result;
    return B3MultiExtractor.INSTANCE.extract(headers);
  }

  @Override public String toString() {
    return "B3Extractor";
  }

  B3Extractor() {
  }
}
