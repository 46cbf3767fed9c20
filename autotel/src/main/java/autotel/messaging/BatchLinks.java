/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package autotel.messaging;

import autotel.Link;
import autotel.SpanContext;
import autotel.internal.Nullable;
import autotel.propagation.TraceContextExtractor;
import autotel.propagation.W3CTraceContextExtractor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Turns the propagation headers of consumed messages into {@link Link links}. A consumer span that
 * processes a batch has no single parent: it descends from each producer in the batch, and these
 * links record that fan-in.
 */
public final class BatchLinks {
  /** Position of a link among the links extracted from one batch, starting at zero. */
  public static final String MESSAGE_INDEX = "messaging.batch.message.index";

  /**
   * Like {@link #extractLinksFromBatch(List, Function, TraceContextExtractor)}, except reading the
   * W3C {@code traceparent} header.
   */
  public static <M> List<Link> extractLinksFromBatch(
    List<M> messages, Function<? super M, Map<String, String>> headerAccessor) {
    return extractLinksFromBatch(messages, headerAccessor, W3CTraceContextExtractor.get());
  }

  /**
   * Returns one link per message that carries a valid trace context, in the order of the batch.
   * Messages without headers or without a valid context are skipped, so the {@link #MESSAGE_INDEX}
   * attribute counts extracted links, not messages: it is always 0, 1, 2 and so on.
   *
   * @param headerAccessor returns the headers of a message, or null if it has none
   */
  public static <M> List<Link> extractLinksFromBatch(List<M> messages,
    Function<? super M, Map<String, String>> headerAccessor, TraceContextExtractor extractor) {
    if (messages == null) throw new NullPointerException("messages == null");
    if (headerAccessor == null) throw new NullPointerException("headerAccessor == null");
    if (extractor == null) throw new NullPointerException("extractor == null");
    if (messages.isEmpty()) return Collections.emptyList();

    List<Link> result = new ArrayList<>(messages.size());
    for (M message : messages) {
      if (message == null) continue;
      Map<String, String> headers = headerAccessor.apply(message);
      if (headers == null) continue;
      SpanContext context = extractor.extract(headers);
      if (context == null) continue;
      result.add(Link.create(context,
        Collections.singletonMap(MESSAGE_INDEX, (long) result.size())));
    }
    return result;
  }

  /** Like {@link #linkFromHeaders(Map, TraceContextExtractor)}, except reading W3C headers. */
  @Nullable public static Link linkFromHeaders(Map<String, String> headers) {
    return linkFromHeaders(headers, W3CTraceContextExtractor.get());
  }

  /** Returns a link to the context in the headers of a single message, or null if there is none. */
  @Nullable public static Link linkFromHeaders(
    @Nullable Map<String, String> headers, TraceContextExtractor extractor) {
    if (extractor == null) throw new NullPointerException("extractor == null");
    if (headers == null) return null;
    SpanContext context = extractor.extract(headers);
    return context != null ? Link.create(context) : null;
  }

  BatchLinks() {}
}
