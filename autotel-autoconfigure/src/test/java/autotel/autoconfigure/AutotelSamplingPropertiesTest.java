/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel.autoconfigure;

import autotel.propagation.AwsXRayExtractor;
import autotel.sampling.RandomSamplingPolicy;
import autotel.sampling.SamplingPolicy;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AutotelSamplingPropertiesTest {
  AutotelSamplingProperties properties = new AutotelSamplingProperties();

  @Test void randomStrategy() {
    properties.setStrategy("RANDOM");
    properties.setBaselineSampleRate(0.3f);

    assertThat(properties.toPolicy())
      .isInstanceOfSatisfying(RandomSamplingPolicy.class, p -> assertThat(p.rate()).isEqualTo(0.3f));
  }

  @Test void alwaysStrategy() {
    properties.setStrategy("always");

    assertThat(properties.toPolicy()).isSameAs(SamplingPolicy.ALWAYS_SAMPLE);
  }

  @Test void emptyPresetIsIgnored() {
    properties.setPreset("");
    properties.setStrategy("never");

    assertThat(properties.toPolicy()).isSameAs(SamplingPolicy.NEVER_SAMPLE);
  }

  @Test void unknownPreset() {
    properties.setPreset("everything");

    assertThatThrownBy(properties::toPolicy)
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessage("Unknown sampling preset: everything");
  }

  @Test void singleFormat() {
    properties.setPropagationFormats(List.of("xray"));

    assertThat(properties.toExtractor()).isSameAs(AwsXRayExtractor.get());
  }
}
