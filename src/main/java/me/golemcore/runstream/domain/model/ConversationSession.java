package me.golemcore.runstream.domain.model;

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
import me.golemcore.runstream.domain.stream.RollingEventHistory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Supplier;

/**
 * Mutable state of one (agent, user) conversation.
 *
 * <p>
 * All mutating methods require the caller to be inside {@link #exclusive}; the
 * session monitor is the conversation's exclusive section and is reentrant.
 * Two flags track run activity:
 * <ul>
 * <li>{@code busy} - reserved when a user message is accepted, released when
 * the worker that serves it finishes. Guards "at most one run per
 * conversation".</li>
 * <li>{@code activeRunId} - id of the upstream run, bound when the backend
 * reports it and cleared when the run reaches a terminal state.</li>
 * </ul>
 */
@Slf4j
public class ConversationSession {

    private final ConversationKey key;
    private final RollingEventHistory history;
    private final Object lock = new Object();
    private final Deque<String> pendingMessages = new ArrayDeque<>();

    private volatile String threadId;
    private volatile String activeRunId;
    private volatile boolean busy;
    private volatile int attachedConsumers;
    private volatile long lastSequenceNo;

    public ConversationSession(ConversationKey key, int historyCapacity) {
        this.key = key;
        this.history = new RollingEventHistory(historyCapacity);
    }

    public <T> T exclusive(Supplier<T> action) {
        synchronized (lock) {
            return action.get();
        }
    }

    public void exclusive(Runnable action) {
        synchronized (lock) {
            action.run();
        }
    }

    public boolean isHeldByCurrentThread() {
        return Thread.holdsLock(lock);
    }

    public ConversationKey getKey() {
        return key;
    }

    public String getConversationId() {
        return key.conversationId();
    }

    public RollingEventHistory getHistory() {
        requireExclusive();
        return history;
    }

    public String getThreadId() {
        return threadId;
    }

    public void setThreadId(String threadId) {
        this.threadId = threadId;
    }

    public String getActiveRunId() {
        return activeRunId;
    }

    public boolean isBusy() {
        return busy;
    }

    public int getAttachedConsumers() {
        return attachedConsumers;
    }

    public long getLastSequenceNo() {
        return lastSequenceNo;
    }

    /**
     * Reserves the conversation for a new run.
     *
     * @return false when a run is already in flight
     */
    public boolean tryReserve() {
        requireExclusive();
        if (busy) {
            return false;
        }
        busy = true;
        activeRunId = null;
        return true;
    }

    public void release() {
        requireExclusive();
        busy = false;
        activeRunId = null;
    }

    public void bindActiveRun(String runId) {
        requireExclusive();
        if (activeRunId != null && !activeRunId.equals(runId)) {
            log.warn("[Session] {} rebinding active run {} -> {}", getConversationId(), activeRunId, runId);
        }
        activeRunId = runId;
    }

    public void clearActiveRun() {
        requireExclusive();
        activeRunId = null;
    }

    public long nextSequenceNo() {
        requireExclusive();
        lastSequenceNo = lastSequenceNo + 1;
        return lastSequenceNo;
    }

    public void consumerAttached() {
        requireExclusive();
        attachedConsumers++;
    }

    public void consumerDetached() {
        requireExclusive();
        if (attachedConsumers > 0) {
            attachedConsumers--;
        }
    }

    /**
     * Queues a message for after the current run.
     *
     * @return the oldest message dropped to respect {@code maxQueued}, or null
     */
    public String enqueuePending(String text, int maxQueued) {
        requireExclusive();
        String dropped = null;
        if (pendingMessages.size() >= Math.max(1, maxQueued)) {
            dropped = pendingMessages.pollFirst();
        }
        pendingMessages.addLast(text);
        return dropped;
    }

    public String pollPending() {
        requireExclusive();
        return pendingMessages.pollFirst();
    }

    public int pendingCount() {
        requireExclusive();
        return pendingMessages.size();
    }

    private void requireExclusive() {
        if (!Thread.holdsLock(lock)) {
            throw new IllegalStateException("conversation " + getConversationId() + " is not locked by caller");
        }
    }
}
