/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel.autoconfigure;

import autotel.propagation.TraceContextExtractor;
import autotel.sampling.SamplingPolicy;
import autotel.sdk.TailSamplingSpanProcessor;
import io.opentelemetry.sdk.trace.SpanProcessor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Auto-configuration for {@link SamplingPolicy}, {@link TraceContextExtractor} and, when there is
 * a span processor named {@value #EXPORT_PROCESSOR} to wrap, {@link TailSamplingSpanProcessor}.
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "autotel.sampling", name = "enabled", havingValue = "true",
  matchIfMissing = true)
@EnableConfigurationProperties(AutotelSamplingProperties.class)
public class AutotelSamplingAutoConfiguration {
  /** Name of the span processor bean that exports kept spans. */
  public static final String EXPORT_PROCESSOR = "autotelExportProcessor";

  @Bean @ConditionalOnMissingBean SamplingPolicy samplingPolicy(AutotelSamplingProperties properties) {
    return properties.toPolicy();
  }

  @Bean @ConditionalOnMissingBean
  TraceContextExtractor traceContextExtractor(AutotelSamplingProperties properties) {
    return properties.toExtractor();
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(SpanProcessor.class)
  @ConditionalOnBean(name = EXPORT_PROCESSOR)
  static class TailSamplingConfiguration {
    // destroyMethod: the SDK shuts processors down, not Spring
    @Bean(destroyMethod = "") @ConditionalOnMissingBean
    TailSamplingSpanProcessor tailSamplingSpanProcessor(
      @Qualifier(EXPORT_PROCESSOR) SpanProcessor exportProcessor, SamplingPolicy policy) {
      return TailSamplingSpanProcessor.create(exportProcessor, policy);
    }
  }
}
