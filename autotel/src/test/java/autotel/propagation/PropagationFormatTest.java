/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel.propagation;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static java.util.Arrays.asList;
import static java.util.Collections.singletonList;
import static java.util.Collections.singletonMap;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PropagationFormatTest {

  @Test void forName() {
    assertThat(PropagationFormat.forName("w3c")).isEqualTo(PropagationFormat.W3C);
    assertThat(PropagationFormat.forName("tracecontext")).isEqualTo(PropagationFormat.W3C);
    assertThat(PropagationFormat.forName("b3-multi")).isEqualTo(PropagationFormat.B3_MULTI);
    assertThat(PropagationFormat.forName("aws-xray")).isEqualTo(PropagationFormat.XRAY);
    assertThat(PropagationFormat.forName(" Datadog ")).isEqualTo(PropagationFormat.DATADOG);
  }

  @Test void forName_unknown() {
    assertThatThrownBy(() -> PropagationFormat.forName("jaeger"))
      .isInstanceOf(IllegalArgumentException.class);
  }

  @Test void extractorFor_single() {
    assertThat(PropagationFormat.extractorFor(singletonList(PropagationFormat.B3)))
      .isSameAs(B3Extractor.get());
  }

  @Test void extractorFor_triesInOrder() {
    TraceContextExtractor extractor =
      PropagationFormat.extractorFor(asList(PropagationFormat.DATADOG, PropagationFormat.W3C));

    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("traceparent", "00-0af7651916cd43dd8448eb211c80319c-b7ad6b7169203331-01");
    assertThat(extractor.extract(headers).traceId()).isEqualTo("0af7651916cd43dd8448eb211c80319c");

    headers.put("x-datadog-trace-id", "1234567890123456789");
    headers.put("x-datadog-parent-id", "987654321");
    assertThat(extractor.extract(headers).traceId()).isEqualTo("0000000000000000112210f47de98115");
  }

  @Test void b3_prefersSingleHeader() {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("b3", "80f198ee56343ba864fe8b2a57d3eff7-e457b5a2e4d86bd1-1");
    headers.put("x-b3-traceid", "463ac35c9f6413ad48485a3953bb6124");
    headers.put("x-b3-spanid", "a2fb4a1d1a96d312");

    assertThat(B3Extractor.get().extract(headers).traceId())
      .isEqualTo("80f198ee56343ba864fe8b2a57d3eff7");

    headers.remove("b3");
    assertThat(B3Extractor.get().extract(headers).traceId())
      .isEqualTo("463ac35c9f6413ad48485a3953bb6124");
  }

  @Test void composite_noMatch() {
    TraceContextExtractor extractor = CompositeTraceContextExtractor.create(
      W3CTraceContextExtractor.get(), AwsXRayExtractor.get());

    assertThat(extractor.extract(singletonMap("b3", "0"))).isNull();
  }

  @Test void composite_rejectsEmpty() {
    assertThatThrownBy(() -> CompositeTraceContextExtractor.create())
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessage("extractors are empty");
  }
}
