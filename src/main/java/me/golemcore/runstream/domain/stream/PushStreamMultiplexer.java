package me.golemcore.runstream.domain.stream;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.runstream.domain.model.ConversationSession;
import me.golemcore.runstream.domain.model.EventKind;
import me.golemcore.runstream.domain.model.StreamEvent;
import me.golemcore.runstream.domain.service.ConversationRegistry;
import me.golemcore.runstream.infrastructure.config.RunStreamProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Delivers the event sequence of each conversation to any number of
 * independently-paced push-stream consumers.
 *
 * <p>
 * Attach and live delivery both run inside the conversation's exclusive
 * section, so a new consumer receives its backfill and then exactly the events
 * produced after it, with nothing skipped or duplicated. A consumer whose
 * queue overflows is closed and detached; it is expected to reconnect with its
 * last seen sequence number.
 */
@Service
@Slf4j
public class PushStreamMultiplexer {

    private final ConversationRegistry registry;
    private final RunStreamProperties properties;
    private final Clock clock;
    private final Map<String, List<StreamConsumer>> consumersByConversation = new ConcurrentHashMap<>();

    public PushStreamMultiplexer(ConversationRegistry registry, RunStreamProperties properties, Clock clock) {
        this.registry = registry;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Attaches a consumer that has seen everything up to {@code watermark}
     * (0 for a fresh consumer). The conversation is registered if it is not
     * known yet, so a client may subscribe before its first message.
     */
    public StreamConsumer attach(String conversationId, long watermark) {
        ConversationSession session = registry.getOrCreate(conversationId);
        String id = session.getConversationId();
        return session.exclusive(() -> {
            RollingEventHistory.Backfill backfill = session.getHistory().replayAfter(watermark);
            int capacity = normalizePositive(properties.getPushStream().getMaxQueuedEvents(), 1000)
                    + backfill.events().size() + 1;
            StreamConsumer consumer = new StreamConsumer(id, capacity);
            if (backfill.gap()) {
                consumer.offer(gapMarker(id, backfill));
            }
            backfill.events().forEach(consumer::offer);
            consumersByConversation.computeIfAbsent(id, key -> new CopyOnWriteArrayList<>()).add(consumer);
            session.consumerAttached();
            log.debug("[PushStream] Attached consumer {} to {} after seq {} (backfill={}, gap={})",
                    consumer.getId(), id, watermark, backfill.events().size(), backfill.gap());
            return consumer;
        });
    }

    /**
     * Detaches a consumer and discards whatever it has not read. Idempotent.
     */
    public void detach(StreamConsumer consumer) {
        if (consumer == null) {
            return;
        }
        registry.find(consumer.getConversationId())
                .ifPresent(session -> session.exclusive(() -> removeLocked(session, consumer)));
        consumer.close();
    }

    /**
     * Enqueues a live event for every consumer of its conversation. Called by
     * the push-stream channel from inside the conversation's exclusive section.
     *
     * @return number of consumers the event was queued for
     */
    public int deliver(StreamEvent event) {
        List<StreamConsumer> consumers = consumersByConversation.get(event.conversationId());
        if (consumers == null || consumers.isEmpty()) {
            return 0;
        }
        ConversationSession session = registry.find(event.conversationId()).orElse(null);
        if (session == null) {
            return 0;
        }
        return session.exclusive(() -> {
            int delivered = 0;
            for (StreamConsumer consumer : consumers) {
                if (consumer.offer(event)) {
                    delivered++;
                } else {
                    log.warn("[PushStream] Consumer {} of {} overflowed at seq {}, closing it",
                            consumer.getId(), event.conversationId(), event.sequenceNo());
                    removeLocked(session, consumer);
                    consumer.close();
                }
            }
            return delivered;
        });
    }

    public int consumerCount(String conversationId) {
        List<StreamConsumer> consumers = consumersByConversation.get(conversationId);
        return consumers != null ? consumers.size() : 0;
    }

    private void removeLocked(ConversationSession session, StreamConsumer consumer) {
        List<StreamConsumer> consumers = consumersByConversation.get(session.getConversationId());
        if (consumers != null && consumers.remove(consumer)) {
            session.consumerDetached();
            log.debug("[PushStream] Detached consumer {} from {}", consumer.getId(), session.getConversationId());
        }
    }

    private StreamEvent gapMarker(String conversationId, RollingEventHistory.Backfill backfill) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("requestedWatermark", backfill.requestedWatermark());
        payload.put("oldestRetained", backfill.oldestRetained());
        return StreamEvent.builder()
                .kind(EventKind.GAP)
                .conversationId(conversationId)
                .payload(payload)
                .sequenceNo(Math.max(0, backfill.oldestRetained() - 1))
                .timestamp(clock.instant())
                .build();
    }

    private static int normalizePositive(int value, int fallback) {
        return value > 0 ? value : fallback;
    }
}
