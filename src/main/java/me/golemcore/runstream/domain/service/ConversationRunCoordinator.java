package me.golemcore.runstream.domain.service;

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
import me.golemcore.runstream.domain.model.ConversationKey;
import me.golemcore.runstream.domain.model.ConversationSession;
import me.golemcore.runstream.infrastructure.config.RunStreamProperties;
import me.golemcore.runstream.port.inbound.ConversationInputPort;
import me.golemcore.runstream.port.outbound.AgentGatewayException;
import me.golemcore.runstream.port.outbound.AgentGatewayPort;
import me.golemcore.runstream.port.outbound.RunEventSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Entry point for user messages. Serializes runs per conversation and drives
 * each run on the conversation run executor: ensure thread, submit the
 * message, start the run, route its stream.
 *
 * <p>
 * A message that arrives while the conversation is busy is rejected with
 * {@link RunAlreadyActiveException} under the default {@code reject} policy.
 * Under {@code queue} it is held (bounded, oldest dropped) and started once the
 * current run has finished.
 */
@Service
@Slf4j
public class ConversationRunCoordinator implements ConversationInputPort {

    private final ConversationRegistry registry;
    private final AgentGatewayPort gateway;
    private final RunEventRouter router;
    private final ExecutorService conversationRunExecutor;
    private final RunStreamProperties properties;

    public ConversationRunCoordinator(ConversationRegistry registry, AgentGatewayPort gateway, RunEventRouter router,
            @Qualifier("conversationRunExecutor") ExecutorService conversationRunExecutor,
            RunStreamProperties properties) {
        this.registry = registry;
        this.gateway = gateway;
        this.router = router;
        this.conversationRunExecutor = conversationRunExecutor;
        this.properties = properties;
    }

    @Override
    public Submission handleUserMessage(String conversationId, String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("message text must not be empty");
        }
        ConversationSession session = registry.getOrCreate(conversationId);
        RunStreamProperties.TurnProperties turn = properties.getTurn();

        boolean reserved = session.exclusive(() -> {
            if (session.tryReserve()) {
                return true;
            }
            if (turn.getBusyPolicy() != RunStreamProperties.BusyPolicy.QUEUE) {
                throw new RunAlreadyActiveException(session.getConversationId(), session.getActiveRunId());
            }
            String dropped = session.enqueuePending(text, turn.getMaxQueuedMessages());
            if (dropped != null) {
                log.warn("[Coordinator] {} queue full, dropped oldest pending message", session.getConversationId());
            }
            return false;
        });

        if (!reserved) {
            log.debug("[Coordinator] {} busy, message queued", session.getConversationId());
            return Submission.QUEUED;
        }
        startRun(session, text);
        return Submission.STARTED;
    }

    @Override
    public boolean cancelRun(String conversationId) {
        ConversationSession session = registry.find(conversationId).orElse(null);
        if (session == null) {
            return false;
        }
        String threadId = session.getThreadId();
        String runId = session.getActiveRunId();
        if (threadId == null || runId == null) {
            log.info("[Coordinator] {} cancel requested while no run is active", session.getConversationId());
            return false;
        }
        gateway.cancelRun(threadId, runId);
        log.info("[Coordinator] {} cancel requested for run {}", session.getConversationId(), runId);
        return true;
    }

    private void startRun(ConversationSession session, String text) {
        try {
            conversationRunExecutor.submit(() -> {
                try {
                    executeRun(session, text);
                } catch (Exception e) { // NOSONAR - must not kill executor thread
                    log.error("[Coordinator] {} run failed: {}", session.getConversationId(), e.getMessage(), e);
                } finally {
                    onRunComplete(session);
                }
            });
        } catch (RejectedExecutionException e) {
            session.exclusive(session::release);
            throw new IllegalStateException("run executor is not accepting work", e);
        }
    }

    private void executeRun(ConversationSession session, String text) {
        ConversationKey key = session.getKey();
        RunEventSource source;
        try {
            String threadId = ensureThread(session);
            gateway.submitUserMessage(threadId, key.userId(), text);
            source = gateway.startRun(threadId, key.agentId());
        } catch (AgentGatewayException e) {
            log.warn("[Coordinator] {} could not start run: {}", session.getConversationId(), e.getMessage());
            router.reportFailure(session, e.getMessage());
            return;
        } catch (RuntimeException e) {
            log.error("[Coordinator] {} could not start run", session.getConversationId(), e);
            router.reportFailure(session, "could not start run: " + e.getMessage());
            return;
        }
        router.route(session, source);
    }

    private String ensureThread(ConversationSession session) {
        String previous = session.getThreadId();
        String threadId = gateway.ensureThread(session.getKey());
        if (!threadId.equals(previous)) {
            session.setThreadId(threadId);
            if (previous == null) {
                log.info("[Coordinator] {} bound to thread {}", session.getConversationId(), threadId);
            } else {
                log.info("[Coordinator] {} moved from thread {} to {}", session.getConversationId(), previous,
                        threadId);
            }
        }
        return threadId;
    }

    private void onRunComplete(ConversationSession session) {
        String next = session.exclusive(() -> {
            session.release();
            String pending = session.pollPending();
            if (pending != null) {
                session.tryReserve();
            }
            return pending;
        });
        if (next != null) {
            log.debug("[Coordinator] {} starting queued message", session.getConversationId());
            startRun(session, next);
        }
    }
}
