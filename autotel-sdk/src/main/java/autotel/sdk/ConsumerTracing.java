/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel.sdk;

import autotel.Link;
import autotel.SamplingContext;
import autotel.internal.Nullable;
import autotel.messaging.BatchLinks;
import autotel.propagation.TraceContextExtractor;
import autotel.propagation.W3CTraceContextExtractor;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.SpanKind;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Traces the processing of consumed messages in {@link SpanKind#CONSUMER} spans linked to the
 * producers of those messages.
 *
 * <p>Ex.
 * <pre>{@code
 * ConsumerTracing tracing = ConsumerTracing.newBuilder(instrumenter)
 *   .system("kafka")
 *   .destination("orders")
 *   .consumerGroup("billing")
 *   .build();
 *
 * tracing.traceBatch("process orders", records, this::headersOf, span -> {
 *   records.forEach(billing::charge);
 *   return null;
 * });
 * }</pre>
 */
public final class ConsumerTracing {
  static final AttributeKey<String> MESSAGING_SYSTEM = AttributeKey.stringKey("messaging.system");
  static final AttributeKey<String> MESSAGING_DESTINATION_NAME =
    AttributeKey.stringKey("messaging.destination.name");
  static final AttributeKey<String> MESSAGING_CONSUMER_GROUP_NAME =
    AttributeKey.stringKey("messaging.consumer.group.name");
  static final AttributeKey<String> MESSAGING_OPERATION = AttributeKey.stringKey("messaging.operation");
  static final AttributeKey<Long> MESSAGING_BATCH_MESSAGE_COUNT =
    AttributeKey.longKey("messaging.batch.message_count");

  public static Builder newBuilder(Instrumenter instrumenter) {
    return new Builder(instrumenter);
  }

  public static final class Builder {
    final Instrumenter instrumenter;
    String system, destination, consumerGroup;
    TraceContextExtractor extractor = W3CTraceContextExtractor.get();

    Builder(Instrumenter instrumenter) {
      if (instrumenter == null) throw new NullPointerException("instrumenter == null");
      this.instrumenter = instrumenter;
    }

    /** The messaging system, such as "kafka" or "rabbitmq". Required. */
    public Builder system(String system) {
      if (system == null) throw new NullPointerException("system == null");
      this.system = system;
      return this;
    }

    /** The queue or topic messages are consumed from. Required. */
    public Builder destination(String destination) {
      if (destination == null) throw new NullPointerException("destination == null");
      this.destination = destination;
      return this;
    }

    /** Optional. */
    public Builder consumerGroup(@Nullable String consumerGroup) {
      this.consumerGroup = consumerGroup;
      return this;
    }

    /** Defaults to reading the W3C {@code traceparent} header. */
    public Builder extractor(TraceContextExtractor extractor) {
      if (extractor == null) throw new NullPointerException("extractor == null");
      this.extractor = extractor;
      return this;
    }

    public ConsumerTracing build() {
      String missing = "";
      if (system == null) missing += " system";
      if (destination == null) missing += " destination";
      if (!"".equals(missing)) throw new IllegalStateException("Missing :" + missing);
      return new ConsumerTracing(this);
    }
  }

  final Instrumenter instrumenter;
  final TraceContextExtractor extractor;
  final Attributes attributes;

  ConsumerTracing(Builder builder) {
    instrumenter = builder.instrumenter;
    extractor = builder.extractor;
    AttributesBuilder attributes = Attributes.builder()
      .put(MESSAGING_SYSTEM, builder.system)
      .put(MESSAGING_DESTINATION_NAME, builder.destination)
      .put(MESSAGING_OPERATION, "process");
    if (builder.consumerGroup != null) {
      attributes.put(MESSAGING_CONSUMER_GROUP_NAME, builder.consumerGroup);
    }
    this.attributes = attributes.build();
  }

  /**
   * Runs the operation in one span for the whole batch, with a link to each message that carries a
   * trace context.
   *
   * @param headerAccessor returns the headers of a message, or null if it has none
   */
  public <M, T, E extends Exception> T traceBatch(String operationName, List<M> messages,
    Function<? super M, Map<String, String>> headerAccessor, TracedOperation<T, E> operation)
    throws E {
    List<Link> links = BatchLinks.extractLinksFromBatch(messages, headerAccessor, extractor);
    SamplingContext context = SamplingContext.newBuilder()
      .operationName(operationName)
      .links(links)
      .build();
    Attributes batchAttributes = attributes.toBuilder()
      .put(MESSAGING_BATCH_MESSAGE_COUNT, (long) messages.size())
      .build();
    return instrumenter.trace(context, SpanKind.CONSUMER, batchAttributes, operation);
  }

  /** Runs the operation in a span linked to the message's producer, if its headers have one. */
  public <T, E extends Exception> T traceMessage(String operationName,
    @Nullable Map<String, String> headers, TracedOperation<T, E> operation) throws E {
    Link link = BatchLinks.linkFromHeaders(headers, extractor);
    SamplingContext context = SamplingContext.newBuilder()
      .operationName(operationName)
      .links(link != null ? Collections.singletonList(link) : Collections.emptyList())
      .build();
    return instrumenter.trace(context, SpanKind.CONSUMER, attributes, operation);
  }

  @Override public String toString() {
    return "ConsumerTracing{" + attributes + "}";
  }
}
