/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel.sdk;

import io.opentelemetry.api.trace.Span;

/**
 * Work run by an {@link Instrumenter}.
 *
 * @param <T> the result of the work
 * @param <E> the checked exception the work can raise, or {@link RuntimeException} if none
 */
@FunctionalInterface
public interface TracedOperation<T, E extends Exception> {

  /**
   * @param span the current span, or an invalid, non-recording span if the call isn't sampled
   */
  T call(Span span) throws E;
}
