/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Identifies one in-flight call, from the head sampling decision to its completion. Policies that
 * need to remember something between {@code shouldSample} and {@code shouldKeepTrace} key it by
 * this handle.
 *
 * <p>Values come from a process-wide counter, so concurrent calls never share one. The numeric
 * value can travel as a span attribute and be turned back into the same handle with {@link
 * #of(long)}.
 */
//@Immutable
public final class InvocationId {
  static final AtomicLong NEXT = new AtomicLong(1L);

  /** Allocates a handle no other call in this process has. */
  public static InvocationId next() {
    return new InvocationId(NEXT.getAndIncrement());
  }

  /** Recreates a handle previously read with {@link #value()}. */
  public static InvocationId of(long value) {
    return new InvocationId(value);
  }

  public long value() {
    return value;
  }

  final long value;

  InvocationId(long value) {
    this.value = value;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof InvocationId)) return false;
    return value == ((InvocationId) o).value;
  }

  @Override public int hashCode() {
    return (int) (value ^ (value >>> 32));
  }

  @Override public String toString() {
    return "InvocationId(" + value + ")";
  }
}
