/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel;

import org.junit.jupiter.api.Test;

import static autotel.TestObjects.SAMPLED_CONTEXT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class SamplingContextTest {

  @Test void allocatesInvocationId() {
    SamplingContext first = SamplingContext.create("get"), second = SamplingContext.create("get");

    assertThat(first.invocationId()).isNotEqualTo(second.invocationId());
  }

  @Test void toBuilder_keepsInvocationId() {
    SamplingContext context = SamplingContext.newBuilder()
      .operationName("get")
      .putMetadata("userId", "alice")
      .addLink(Link.create(SAMPLED_CONTEXT))
      .build();

    SamplingContext copy = context.toBuilder().putMetadata("tier", "gold").build();

    assertThat(copy.invocationId()).isEqualTo(context.invocationId());
    assertThat(copy.metadata()).containsExactly(entry("userId", "alice"), entry("tier", "gold"));
    assertThat(copy.links()).isEqualTo(context.links());
    assertThat(context.metadata()).containsOnlyKeys("userId");
  }

  @Test void explicitInvocationId() {
    assertThat(SamplingContext.newBuilder()
      .operationName("get")
      .invocationId(InvocationId.of(42L))
      .build().invocationId().value()).isEqualTo(42L);
  }

  @Test void operationNameIsRequired() {
    assertThatThrownBy(() -> SamplingContext.newBuilder().build())
      .isInstanceOf(IllegalStateException.class)
      .hasMessage("Missing : operationName");
  }

  @Test void rejectsNullMetadataValues() {
    assertThatThrownBy(() -> SamplingContext.newBuilder().putMetadata("userId", null))
      .isInstanceOf(NullPointerException.class)
      .hasMessage("value of userId == null");
  }

  @Test void emptyByDefault() {
    SamplingContext context = SamplingContext.create("get");

    assertThat(context.metadata()).isEmpty();
    assertThat(context.links()).isEmpty();
  }
}
