/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel.sampling;

import autotel.OperationResult;
import autotel.SamplingContext;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SamplingPolicyTest {
  SamplingContext context = SamplingContext.create("get");

  @Test void alwaysSample() {
    assertThat(SamplingPolicy.ALWAYS_SAMPLE.shouldSample(context)).isTrue();
    assertThat(SamplingPolicy.ALWAYS_SAMPLE.needsTailSampling()).isFalse();
  }

  @Test void neverSample() {
    assertThat(SamplingPolicy.NEVER_SAMPLE.shouldSample(context)).isFalse();
    assertThat(SamplingPolicy.NEVER_SAMPLE.needsTailSampling()).isFalse();
  }

  @Test void headPoliciesDontKeepTraces() {
    assertThatThrownBy(() -> SamplingPolicy.ALWAYS_SAMPLE.shouldKeepTrace(context,
      OperationResult.success(1)))
      .isInstanceOf(UnsupportedOperationException.class)
      .hasMessage("AlwaysSample does not use tail sampling");
  }
}
