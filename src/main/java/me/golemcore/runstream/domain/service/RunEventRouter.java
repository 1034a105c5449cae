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
import me.golemcore.runstream.domain.model.ConversationSession;
import me.golemcore.runstream.domain.model.EventKind;
import me.golemcore.runstream.domain.model.PublishOutcome;
import me.golemcore.runstream.domain.model.RunNotification;
import me.golemcore.runstream.domain.model.RunState;
import me.golemcore.runstream.domain.model.RunStatus;
import me.golemcore.runstream.domain.model.StreamEvent;
import me.golemcore.runstream.domain.model.ToolCall;
import me.golemcore.runstream.domain.model.ToolFailureKind;
import me.golemcore.runstream.domain.model.ToolResultEnvelope;
import me.golemcore.runstream.port.outbound.AgentGatewayException;
import me.golemcore.runstream.port.outbound.AgentGatewayPort;
import me.golemcore.runstream.port.outbound.RunEventSource;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Consumes the notification stream of one run and turns it into the
 * conversation's event sequence.
 *
 * <p>
 * Per run the router moves through {@code STREAMING -> AWAITING_TOOLS ->
 * STREAMING -> TERMINAL}:
 * <ul>
 * <li>message deltas become {@code fragment} events and are accumulated per
 * message id; a completed message becomes one {@code finalized} event with the
 * accumulated text</li>
 * <li>a requires-action notification emits one {@code tool_call} event per
 * call, runs the whole batch, submits one result per call id and continues on
 * the resumed stream</li>
 * <li>a terminal status becomes a {@code status} event; provider errors,
 * transport errors and a stream that ends early become an {@code error}
 * event</li>
 * </ul>
 *
 * <p>
 * Each event takes the next sequence number, is appended to history and is
 * handed to the fan-out inside the conversation's exclusive section, so every
 * channel and every attached consumer sees the same order.
 */
@Service
@Slf4j
public class RunEventRouter {

    static final String STREAM_ENDED_MESSAGE = "run stream ended before the run reached a terminal state";
    private static final String SOURCE_TRANSPORT = "transport";
    private static final String SOURCE_PROVIDER = "provider";

    private final ChannelFanOutService fanOut;
    private final ToolInvocationService toolInvoker;
    private final AgentGatewayPort gateway;
    private final Clock clock;

    public RunEventRouter(ChannelFanOutService fanOut, ToolInvocationService toolInvoker, AgentGatewayPort gateway,
            Clock clock) {
        this.fanOut = fanOut;
        this.toolInvoker = toolInvoker;
        this.gateway = gateway;
        this.clock = clock;
    }

    /**
     * Routes notifications until the run is terminal. Always returns
     * {@link RunState#TERMINAL}; the source and every resumed source are closed.
     */
    public RunState route(ConversationSession session, RunEventSource source) {
        RunContext run = new RunContext(session);
        RunEventSource current = source;
        try {
            while (run.state != RunState.TERMINAL) {
                RunNotification notification;
                try {
                    notification = current.next();
                } catch (AgentGatewayException e) {
                    log.warn("[Router] Stream of {} failed: {}", session.getConversationId(), e.getMessage());
                    terminateWithError(run, SOURCE_TRANSPORT, e.getMessage());
                    break;
                }
                if (notification == null) {
                    log.warn("[Router] Stream of {} ended in state {}", session.getConversationId(), run.state);
                    terminateWithError(run, SOURCE_TRANSPORT, STREAM_ENDED_MESSAGE);
                    break;
                }
                RunEventSource resumed = handle(run, notification);
                if (resumed != null) {
                    current.close();
                    current = resumed;
                }
            }
        } finally {
            current.close();
        }
        return run.state;
    }

    /**
     * Emits a single error event for a run that failed before its stream
     * produced anything, and clears the active run.
     */
    public StreamEvent reportFailure(ConversationSession session, String message) {
        return session.exclusive(() -> {
            StreamEvent event = emitLocked(session, EventKind.ERROR, null,
                    errorPayload(session.getActiveRunId(), message, SOURCE_TRANSPORT));
            session.clearActiveRun();
            return event;
        });
    }

    private RunEventSource handle(RunContext run, RunNotification notification) {
        ConversationSession session = run.session;
        if (isForeignThread(session, notification)) {
            log.warn("[Router] Ignoring {} for thread {}, conversation {} is on thread {}",
                    notification.sourceEvent(), notification.threadId(), session.getConversationId(),
                    session.getThreadId());
            return null;
        }

        switch (notification.type()) {
        case RUN_CREATED, RUN_STATUS -> {
            bindRun(session, notification.runId());
            log.debug("[Router] {} run {} status {}", session.getConversationId(), notification.runId(),
                    notification.status());
        }
        case MESSAGE_CREATED -> run.buffer(notification.messageId());
        case MESSAGE_DELTA -> onDelta(run, notification);
        case MESSAGE_COMPLETED -> onMessageCompleted(run, notification);
        case REQUIRES_ACTION -> {
            return onRequiresAction(run, notification);
        }
        case RUN_TERMINAL -> onTerminal(run, notification);
        case ERROR -> {
            String message = notification.errorMessage() != null
                    ? notification.errorMessage()
                    : "agent backend reported an error";
            terminateWithError(run, SOURCE_PROVIDER, message);
        }
        case DONE -> log.debug("[Router] {} received end-of-stream marker in state {}",
                session.getConversationId(), run.state);
        case IGNORED -> log.trace("[Router] {} ignoring {}", session.getConversationId(),
                notification.sourceEvent());
        default -> log.debug("[Router] Unhandled notification type {}", notification.type());
        }
        return null;
    }

    private void onDelta(RunContext run, RunNotification notification) {
        String delta = notification.text();
        if (delta == null || delta.isEmpty()) {
            return;
        }
        run.buffer(notification.messageId()).append(delta);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("delta", delta);
        emit(run.session, EventKind.FRAGMENT, notification.messageId(), payload);
    }

    private void onMessageCompleted(RunContext run, RunNotification notification) {
        StringBuilder accumulated = run.buffers.remove(bufferKey(notification.messageId()));
        String text = accumulated != null && accumulated.length() > 0
                ? accumulated.toString()
                : notification.text();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", text != null ? text : "");
        emit(run.session, EventKind.FINALIZED, notification.messageId(), payload);
    }

    private RunEventSource onRequiresAction(RunContext run, RunNotification notification) {
        ConversationSession session = run.session;
        String runId = notification.runId() != null ? notification.runId() : session.getActiveRunId();
        bindRun(session, runId);
        List<ToolCall> calls = notification.toolCalls();
        if (calls.isEmpty()) {
            log.warn("[Router] {} run {} requires action without tool calls", session.getConversationId(), runId);
            return null;
        }

        run.state = RunState.AWAITING_TOOLS;
        Set<String> outstanding = new LinkedHashSet<>();
        for (ToolCall call : calls) {
            outstanding.add(call.callId());
            emit(session, EventKind.TOOL_CALL, null, toolCallPayload(call, runId));
        }
        log.info("[Router] {} run {} awaiting {} tool call(s)", session.getConversationId(), runId,
                outstanding.size());

        Map<String, ToolResultEnvelope> results = toolInvoker.invokeAll(calls);
        Map<String, ToolResultEnvelope> submission = new LinkedHashMap<>();
        for (String callId : outstanding) {
            ToolResultEnvelope envelope = results.get(callId);
            if (envelope == null) {
                envelope = ToolResultEnvelope.failure(ToolFailureKind.EXECUTION_FAILED, "no result produced");
            }
            submission.put(callId, envelope);
        }

        try {
            RunEventSource resumed = gateway.submitToolResults(session.getThreadId(), runId, submission);
            run.state = RunState.STREAMING;
            return resumed;
        } catch (AgentGatewayException e) {
            log.warn("[Router] {} failed to submit tool results for run {}: {}", session.getConversationId(),
                    runId, e.getMessage());
            terminateWithError(run, SOURCE_TRANSPORT, "failed to submit tool results: " + e.getMessage());
            return null;
        }
    }

    private void onTerminal(RunContext run, RunNotification notification) {
        ConversationSession session = run.session;
        RunStatus status = notification.status() != null ? notification.status() : RunStatus.COMPLETED;
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("runId", notification.runId() != null ? notification.runId() : session.getActiveRunId());
        payload.put("status", status.wireName());
        payload.put("state", "terminal");
        if (notification.errorMessage() != null) {
            payload.put("message", notification.errorMessage());
        }
        session.exclusive(() -> {
            emitLocked(session, EventKind.STATUS, null, payload);
            session.clearActiveRun();
        });
        run.state = RunState.TERMINAL;
        log.info("[Router] {} run {} finished: {}", session.getConversationId(), payload.get("runId"),
                status.wireName());
    }

    private void terminateWithError(RunContext run, String source, String message) {
        ConversationSession session = run.session;
        session.exclusive(() -> {
            emitLocked(session, EventKind.ERROR, null, errorPayload(session.getActiveRunId(), message, source));
            session.clearActiveRun();
        });
        run.state = RunState.TERMINAL;
    }

    private StreamEvent emit(ConversationSession session, EventKind kind, String messageId,
            Map<String, Object> payload) {
        return session.exclusive(() -> emitLocked(session, kind, messageId, payload));
    }

    private StreamEvent emitLocked(ConversationSession session, EventKind kind, String messageId,
            Map<String, Object> payload) {
        StreamEvent event = StreamEvent.builder()
                .kind(kind)
                .conversationId(session.getConversationId())
                .messageId(messageId)
                .payload(payload)
                .sequenceNo(session.nextSequenceNo())
                .timestamp(clock.instant())
                .build();
        session.getHistory().append(event);
        List<PublishOutcome> outcomes = fanOut.publishAll(event);
        if (log.isDebugEnabled()) {
            log.debug("[Router] {} seq {} {} -> {}", event.conversationId(), event.sequenceNo(),
                    kind.wireName(), outcomes);
        }
        return event;
    }

    private void bindRun(ConversationSession session, String runId) {
        if (runId == null || runId.equals(session.getActiveRunId())) {
            return;
        }
        session.exclusive(() -> session.bindActiveRun(runId));
    }

    private static boolean isForeignThread(ConversationSession session, RunNotification notification) {
        return notification.threadId() != null && session.getThreadId() != null
                && !notification.threadId().equals(session.getThreadId());
    }

    private static Map<String, Object> toolCallPayload(ToolCall call, String runId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("callId", call.callId());
        payload.put("toolName", call.toolName());
        payload.put("arguments", call.hasValidArguments() ? call.arguments() : call.rawArguments());
        payload.put("runId", runId);
        return payload;
    }

    private static Map<String, Object> errorPayload(String runId, String message, String source) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (runId != null) {
            payload.put("runId", runId);
        }
        payload.put("message", message != null ? message : "unknown error");
        payload.put("source", source);
        return payload;
    }

    private static String bufferKey(String messageId) {
        return messageId != null ? messageId : "";
    }

    private static final class RunContext {

        private final ConversationSession session;
        private final Map<String, StringBuilder> buffers = new HashMap<>();
        private RunState state = RunState.STREAMING;

        private RunContext(ConversationSession session) {
            this.session = session;
        }

        private StringBuilder buffer(String messageId) {
            return buffers.computeIfAbsent(bufferKey(messageId), key -> new StringBuilder());
        }
    }
}
