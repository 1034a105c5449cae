package me.golemcore.runstream.adapter.inbound.web.controller;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runstream.domain.model.StreamEvent;
import me.golemcore.runstream.domain.service.ConversationRegistry;
import me.golemcore.runstream.domain.stream.PushStreamMultiplexer;
import me.golemcore.runstream.domain.stream.StreamConsumer;
import me.golemcore.runstream.infrastructure.config.RunStreamProperties;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Server-Sent Events endpoint of the push-stream channel.
 *
 * <p>
 * A client attaches with the last sequence number it has seen, either as
 * {@code afterSeq} or through the {@code Last-Event-ID} header that browsers
 * send on reconnect (the header wins). It receives the backfill, preceded by a
 * {@code gap} event when part of it was already evicted, then live events.
 * Each event carries its sequence number as the SSE id and its kind as the SSE
 * event name. Idle streams get periodic keep-alive comments.
 */
@RestController
@RequestMapping("/api/conversations")
@RequiredArgsConstructor
@Slf4j
public class EventStreamController {

    private static final Duration CLIENT_RETRY = Duration.ofMillis(1000);

    private final PushStreamMultiplexer multiplexer;
    private final ConversationRegistry registry;
    private final RunStreamProperties properties;

    @GetMapping(value = "/{conversationId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<StreamEvent>> streamEvents(@PathVariable String conversationId,
            @RequestParam(required = false) String afterSeq,
            @RequestHeader(value = "Last-Event-ID", required = false) String lastEventId) {
        String resolvedId = registry.resolveKey(conversationId).conversationId();
        long watermark = parseWatermark(lastEventId != null && !lastEventId.isBlank() ? lastEventId : afterSeq);
        long pollMs = normalizePositive(properties.getPushStream().getPollIntervalMs(), 300);
        long keepAliveTicks = Math.max(1,
                normalizePositive(properties.getPushStream().getKeepAliveSeconds(), 15) * 1000 / pollMs);

        return Flux.defer(() -> {
            StreamConsumer consumer = multiplexer.attach(resolvedId, watermark);
            AtomicLong idleTicks = new AtomicLong();
            return Flux.interval(Duration.ZERO, Duration.ofMillis(pollMs))
                    .onBackpressureDrop()
                    .takeWhile(tick -> !consumer.isClosed())
                    .concatMapIterable(tick -> nextBatch(consumer, idleTicks, keepAliveTicks))
                    .doFinally(signal -> {
                        multiplexer.detach(consumer);
                        log.debug("[PushStream] Stream {} of {} ended: {}", consumer.getId(), resolvedId, signal);
                    });
        });
    }

    private List<ServerSentEvent<StreamEvent>> nextBatch(StreamConsumer consumer, AtomicLong idleTicks,
            long keepAliveTicks) {
        List<StreamEvent> events = consumer.drain();
        if (events.isEmpty()) {
            if (idleTicks.incrementAndGet() >= keepAliveTicks) {
                idleTicks.set(0);
                return List.of(ServerSentEvent.<StreamEvent>builder().comment("keep-alive").build());
            }
            return List.of();
        }
        idleTicks.set(0);
        return events.stream().map(EventStreamController::toServerSentEvent).toList();
    }

    private static ServerSentEvent<StreamEvent> toServerSentEvent(StreamEvent event) {
        return ServerSentEvent.builder(event)
                .id(String.valueOf(event.sequenceNo()))
                .event(event.kind().wireName())
                .retry(CLIENT_RETRY)
                .build();
    }

    static long parseWatermark(String raw) {
        if (raw == null || raw.isBlank()) {
            return 0L;
        }
        try {
            return Math.max(0L, Long.parseLong(raw.trim()));
        } catch (NumberFormatException ignored) {
            return 0L;
        }
    }

    private static long normalizePositive(long value, long fallback) {
        return value > 0 ? value : fallback;
    }
}
