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

import me.golemcore.runstream.domain.model.EventKind;
import me.golemcore.runstream.domain.model.StreamEvent;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, insertion-ordered window of the most recent events of one
 * conversation. The oldest entry is evicted first once {@code capacity} is
 * reached.
 *
 * <p>
 * Not thread-safe. Callers mutate and read it only while holding the owning
 * conversation's exclusive section.
 */
public class RollingEventHistory {

    private final int capacity;
    private final Deque<StreamEvent> events;
    private long lastSequenceNo;

    public RollingEventHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("history capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.events = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    /**
     * Appends the next event. Sequence numbers must be contiguous and gap
     * markers are never stored.
     */
    public void append(StreamEvent event) {
        if (event.kind() == EventKind.GAP) {
            throw new IllegalArgumentException("gap markers are not stored in history");
        }
        long expected = lastSequenceNo + 1;
        if (event.sequenceNo() != expected) {
            throw new IllegalArgumentException(
                    "non-contiguous sequence number " + event.sequenceNo() + ", expected " + expected);
        }
        events.addLast(event);
        lastSequenceNo = event.sequenceNo();
        while (events.size() > capacity) {
            events.removeFirst();
        }
    }

    /**
     * Computes the backfill for a consumer that has seen everything up to and
     * including {@code watermark}.
     *
     * <p>
     * A gap is reported when the watermark predates the oldest retained event,
     * or when it is ahead of anything this history has produced (the consumer
     * saw a previous incarnation of the stream and must reset).
     */
    public Backfill replayAfter(long watermark) {
        long requested = Math.max(0, watermark);
        if (requested > lastSequenceNo) {
            return new Backfill(new ArrayList<>(events), true, requested, oldestRetainedOrNext());
        }
        long oldest = oldestRetainedOrNext();
        boolean gap = requested < oldest - 1;
        List<StreamEvent> replay = new ArrayList<>();
        for (StreamEvent event : events) {
            if (event.sequenceNo() > requested) {
                replay.add(event);
            }
        }
        return new Backfill(replay, gap, requested, oldest);
    }

    public List<StreamEvent> snapshot() {
        return new ArrayList<>(events);
    }

    public int size() {
        return events.size();
    }

    public int capacity() {
        return capacity;
    }

    public long lastSequenceNo() {
        return lastSequenceNo;
    }

    private long oldestRetainedOrNext() {
        StreamEvent oldest = events.peekFirst();
        return oldest != null ? oldest.sequenceNo() : lastSequenceNo + 1;
    }

    /**
     * Events to replay plus whether a discontinuity precedes them.
     * {@code oldestRetained} is the first sequence number the consumer can
     * still receive.
     */
    public record Backfill(List<StreamEvent> events, boolean gap, long requestedWatermark, long oldestRetained) {

        public Backfill {
            events = List.copyOf(events);
        }
    }
}
