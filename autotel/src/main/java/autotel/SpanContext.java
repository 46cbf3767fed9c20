/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel;

import autotel.internal.HexCodec;
import autotel.internal.Nullable;

/**
 * The identifiers needed to correlate a unit of work with its trace. Instances are usually the
 * result of parsing propagation headers of an inbound message or request.
 *
 * <p>Trace IDs are encoded as 32 lowercase hex characters (128 bits) and span IDs as 16 (64 bits).
 * Narrower inputs are left-padded with zeros. An all-zero identifier means "absent" on every
 * supported wire format, so this type never holds one.
 */
//@Immutable
public final class SpanContext {
  /** Bit of {@link #traceFlags()} set when the upstream decided to record the trace. */
  public static final byte FLAG_SAMPLED = 0x01;

  public static Builder newBuilder() {
    return new Builder();
  }

  /** 32 lowercase hex characters. For example {@code 4bf92f3577b34da6a3ce929d0e0e4736} */
  public String traceId() {
    return traceId;
  }

  /** 16 lowercase hex characters. For example {@code 00f067aa0ba902b7} */
  public String spanId() {
    return spanId;
  }

  /** The W3C trace flags byte. Only {@link #FLAG_SAMPLED} is interpreted. */
  public byte traceFlags() {
    return traceFlags;
  }

  public boolean sampled() {
    return (traceFlags & FLAG_SAMPLED) == FLAG_SAMPLED;
  }

  /** True when this context was propagated from another process. */
  public boolean remote() {
    return remote;
  }

  /** The raw W3C {@code tracestate} value received with this context, if any. */
  @Nullable public String traceState() {
    return traceState;
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public static final class Builder {
    String traceId, spanId, traceState;
    byte traceFlags;
    boolean remote;

    Builder() {
    }

    Builder(SpanContext source) {
      traceId = source.traceId;
      spanId = source.spanId;
      traceFlags = source.traceFlags;
      remote = source.remote;
      traceState = source.traceState;
    }

    /**
     * @param traceId 1 to 32 hex characters. Narrower values are left-padded with zeros.
     * @throws IllegalArgumentException if the input isn't hex or is wider than 32 characters
     */
    public Builder traceId(String traceId) {
      if (traceId == null) throw new NullPointerException("traceId == null");
      String normalized = HexCodec.normalize(traceId, 32);
      if (normalized == null) {
        throw new IllegalArgumentException(
          traceId + " should be a 1 to 32 character hex string with no prefix");
      }
      this.traceId = normalized;
      return this;
    }

    /**
     * @param spanId 1 to 16 hex characters. Narrower values are left-padded with zeros.
     * @throws IllegalArgumentException if the input isn't hex or is wider than 16 characters
     */
    public Builder spanId(String spanId) {
      if (spanId == null) throw new NullPointerException("spanId == null");
      String normalized = HexCodec.normalize(spanId, 16);
      if (normalized == null) {
        throw new IllegalArgumentException(
          spanId + " should be a 1 to 16 character hex string with no prefix");
      }
      this.spanId = normalized;
      return this;
    }

    public Builder traceFlags(byte traceFlags) {
      this.traceFlags = traceFlags;
      return this;
    }

    /** Sets or clears {@link #FLAG_SAMPLED} without touching other flag bits. */
    public Builder sampled(boolean sampled) {
      if (sampled) {
        traceFlags |= FLAG_SAMPLED;
      } else {
        traceFlags &= ~FLAG_SAMPLED;
      }
      return this;
    }

    public Builder remote(boolean remote) {
      this.remote = remote;
      return this;
    }

    public Builder traceState(@Nullable String traceState) {
      this.traceState = traceState == null || traceState.isEmpty() ? null : traceState;
      return this;
    }

    /**
     * @throws IllegalStateException if an identifier is missing or all zeros
     */
    public SpanContext build() {
      String missing = "";
      if (traceId == null) missing += " traceId";
      if (spanId == null) missing += " spanId";
      if (!"".equals(missing)) throw new IllegalStateException("Missing :" + missing);
      if (HexCodec.isAllZeros(traceId)) throw new IllegalStateException("traceId is all zeros");
      if (HexCodec.isAllZeros(spanId)) throw new IllegalStateException("spanId is all zeros");
      return new SpanContext(this);
    }
  }

  final String traceId, spanId, traceState;
  final byte traceFlags;
  final boolean remote;

  SpanContext(Builder builder) {
    traceId = builder.traceId;
    spanId = builder.spanId;
    traceFlags = builder.traceFlags;
    remote = builder.remote;
    traceState = builder.traceState;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof SpanContext)) return false;
    SpanContext that = (SpanContext) o;
    return traceId.equals(that.traceId)
      && spanId.equals(that.spanId)
      && traceFlags == that.traceFlags
      && remote == that.remote
      && (traceState == null ? that.traceState == null : traceState.equals(that.traceState));
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= traceId.hashCode();
    h *= 1000003;
    h ^= spanId.hashCode();
    h *= 1000003;
    h ^= traceFlags;
    h *= 1000003;
    h ^= remote ? 1231 : 1237;
    h *= 1000003;
    h ^= traceState == null ? 0 : traceState.hashCode();
    return h;
  }

  @Override public String toString() {
    char[] flags = {HexCodec.HEX_DIGITS[(traceFlags >> 4) & 0xf], HexCodec.HEX_DIGITS[traceFlags & 0xf]};
    return "SpanContext{" + traceId + "-" + spanId + "-" + new String(flags)
      + (remote ? ", remote" : "") + "}";
  }
}
