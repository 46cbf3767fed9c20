/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel.internal;

import java.math.BigInteger;

/** Helpers for the lower-hex identifiers carried by trace contexts. */
public final class HexCodec {
  public static final char[] HEX_DIGITS = {
    '0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'a', 'b', 'c', 'd', 'e', 'f'
  };

  static final BigInteger MAX_UNSIGNED_128 = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

  /** Returns true if the input is 1 or more characters of {@code [0-9a-fA-F]}. */
  public static boolean isHex(CharSequence input) {
    int length = input.length();
    if (length == 0) return false;
    for (int i = 0; i < length; i++) {
      char c = input.charAt(i);
      if ((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F')) continue;
      return false;
    }
    return true;
  }

  /** Returns true if every character is '0'. An empty input is all zeros. */
  public static boolean isAllZeros(CharSequence hex) {
    for (int i = 0, length = hex.length(); i < length; i++) {
      if (hex.charAt(i) != '0') return false;
    }
    return true;
  }

  /**
   * Lower-cases the hex input and left-pads it with zeros to the given width. Returns null if the
   * input is not hex or wider than the width.
   */
  @Nullable public static String normalize(String hex, int width) {
    if (hex == null || hex.length() > width || !isHex(hex)) return null;
    char[] result = new char[width];
    int pad = width - hex.length();
    for (int i = 0; i < pad; i++) result[i] = '0';
    for (int i = 0, length = hex.length(); i < length; i++) {
      result[pad + i] = Character.toLowerCase(hex.charAt(i));
    }
    return new String(result);
  }

  /**
   * Converts an unsigned decimal identifier, such as one sent by Datadog, to lower-hex padded to
   * the given width. Returns null if the input isn't a non-negative integer or doesn't fit.
   */
  @Nullable public static String decimalToHex(String decimal, int width) {
    if (decimal == null || decimal.isEmpty()) return null;
    for (int i = 0, length = decimal.length(); i < length; i++) {
      char c = decimal.charAt(i);
      if (c < '0' || c > '9') return null;
    }
    BigInteger value = new BigInteger(decimal);
    if (value.compareTo(MAX_UNSIGNED_128) > 0) return null;
    return normalize(value.toString(16), width);
  }

  HexCodec() {}
}
