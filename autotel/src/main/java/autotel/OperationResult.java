/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel;

import autotel.internal.Nullable;

/** Outcome of a completed call, used by tail sampling to decide whether to keep its trace. */
//@Immutable
public final class OperationResult {

  public static OperationResult success(double durationMs) {
    return new OperationResult(true, durationMs, null);
  }

  /** @param error the cause of the failure, if known */
  public static OperationResult failure(double durationMs, @Nullable Throwable error) {
    return new OperationResult(false, durationMs, error);
  }

  public boolean success() {
    return success;
  }

  /** Wall time of the call in milliseconds, possibly fractional. */
  public double durationMs() {
    return durationMs;
  }

  @Nullable public Throwable error() {
    return error;
  }

  final boolean success;
  final double durationMs;
  final Throwable error;

  OperationResult(boolean success, double durationMs, Throwable error) {
    if (durationMs < 0 || Double.isNaN(durationMs)) {
      throw new IllegalArgumentException("durationMs should be non-negative: was " + durationMs);
    }
    this.success = success;
    this.durationMs = durationMs;
    this.error = error;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof OperationResult)) return false;
    OperationResult that = (OperationResult) o;
    return success == that.success
      && Double.compare(durationMs, that.durationMs) == 0
      && (error == null ? that.error == null : error.equals(that.error));
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= success ? 1231 : 1237;
    h *= 1000003;
    h ^= Double.hashCode(durationMs);
    h *= 1000003;
    h ^= error == null ? 0 : error.hashCode();
    return h;
  }

  @Override public String toString() {
    return "OperationResult{success=" + success + ", durationMs=" + durationMs
      + (error != null ? ", error=" + error : "") + "}";
  }
}
