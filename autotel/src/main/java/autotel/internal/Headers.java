/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel.internal;

import java.util.Map;

/** Header lookups that tolerate the casing differences of message brokers and http stacks. */
public final class Headers {

  /** Returns the value of the exact key, or else the first key that matches ignoring case. */
  @Nullable public static String get(Map<String, String> headers, String name) {
    if (headers == null || headers.isEmpty()) return null;
    String value = headers.get(name);
    if (value != null) return value;
    for (Map.Entry<String, String> entry : headers.entrySet()) {
      if (name.equalsIgnoreCase(entry.getKey())) return entry.getValue();
    }
    return null;
  }

  /** Like {@link #get(Map, String)} except empty and blank values are returned as null. */
  @Nullable public static String getNonBlank(Map<String, String> headers, String name) {
    String value = get(headers, name);
    if (value == null) return null;
    value = value.trim();
    return value.isEmpty() ? null : value;
  }

  Headers() {}
}
