/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel.sampling;

import autotel.OperationResult;
import autotel.SamplingContext;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Samples a call if any child policy samples it.
 *
 * <p>Children must agree on {@link #needsTailSampling()}. When they all use tail sampling, every
 * child sees every call: each one's {@link #shouldSample(SamplingContext)} is invoked so it can
 * record its own baseline, and the trace is kept if any child's {@link
 * #shouldKeepTrace(SamplingContext, OperationResult)} keeps it. Otherwise, evaluation stops at the
 * first child that samples.
 */
public final class CompositeSamplingPolicy extends SamplingPolicy {

  public static CompositeSamplingPolicy create(SamplingPolicy... children) {
    if (children == null) throw new NullPointerException("children == null");
    return create(Arrays.asList(children));
  }

  /**
   * @throws IllegalArgumentException if there are no children, or they disagree on whether tail
   * sampling is needed
   */
  public static CompositeSamplingPolicy create(List<? extends SamplingPolicy> children) {
    if (children == null) throw new NullPointerException("children == null");
    if (children.isEmpty()) {
      throw new IllegalArgumentException("CompositeSamplingPolicy requires at least one child");
    }
    List<SamplingPolicy> copy = new ArrayList<>(children.size());
    for (SamplingPolicy child : children) {
      if (child == null) throw new NullPointerException("child == null");
      copy.add(child);
    }
    boolean tail = copy.get(0).needsTailSampling();
    for (SamplingPolicy child : copy) {
      if (child.needsTailSampling() != tail) {
        throw new IllegalArgumentException(
          "children must all use tail sampling or none may: " + copy);
      }
    }
    return new CompositeSamplingPolicy(Collections.unmodifiableList(copy), tail);
  }

  final List<SamplingPolicy> children;
  final boolean tail;

  CompositeSamplingPolicy(List<SamplingPolicy> children, boolean tail) {
    this.children = children;
    this.tail = tail;
  }

  public List<SamplingPolicy> children() {
    return children;
  }

  @Override public boolean needsTailSampling() {
    return tail;
  }

  @Override public boolean shouldSample(SamplingContext context) {
    boolean sampled = false;
    for (int i = 0, length = children.size(); i < length; i++) {
      if (children.get(i).shouldSample(context)) {
        if (!tail) return true;
        sampled = true;
      }
    }
    return sampled;
  }

  @Override public boolean shouldKeepTrace(SamplingContext context, OperationResult result) {
    if (!tail) return super.shouldKeepTrace(context, result);
    boolean keep = false;
    for (int i = 0, length = children.size(); i < length; i++) {
      // don't short-circuit: each child consumes its pending decision
      if (children.get(i).shouldKeepTrace(context, result)) keep = true;
    }
    return keep;
  }

  @Override public String toString() {
    return "CompositeSamplingPolicy" + children;
  }
}
