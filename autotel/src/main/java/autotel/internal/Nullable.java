/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel.internal;

/**
 * Marks a return value, field or parameter that may be null. Named {@code Nullable} so tools that
 * process any annotation of that name pick it up without a jsr305 dependency.
 */
@java.lang.annotation.Documented
@java.lang.annotation.Retention(java.lang.annotation.RetentionPolicy.CLASS)
public @interface Nullable {
}
