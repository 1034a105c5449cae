package me.golemcore.runstream.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.runstream.domain.model.ConversationKey;
import me.golemcore.runstream.domain.model.RunNotification;
import me.golemcore.runstream.domain.model.RunNotificationType;
import me.golemcore.runstream.domain.model.RunStatus;
import me.golemcore.runstream.domain.model.ToolCall;
import me.golemcore.runstream.domain.model.ToolFailureKind;
import me.golemcore.runstream.domain.model.ToolResultEnvelope;
import me.golemcore.runstream.port.outbound.AgentGatewayException;
import me.golemcore.runstream.port.outbound.AgentGatewayPort;
import me.golemcore.runstream.port.outbound.RunEventSource;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sends a message to another assistant on its own backend thread and waits for
 * the run to finish. Used by the agent-collaboration tools.
 *
 * <p>
 * Delegated runs are not routed to output channels. Tool calls requested by
 * the delegated assistant are answered with failure envelopes so the run can
 * finish. Exchanges with the same assistant are serialized because a thread
 * accepts one active run at a time. A caller that is interrupted, for example
 * by the tool timeout, stops reading at the next notification.
 */
@Service
@Slf4j
public class AgentDelegationService {

    static final String DELEGATE_USER_ID = "delegate";
    static final String NESTED_TOOLS_MESSAGE = "Tools are not available to delegated runs";

    private final AgentGatewayPort gateway;
    private final Map<String, Object> locksByAssistant = new ConcurrentHashMap<>();

    public AgentDelegationService(AgentGatewayPort gateway) {
        this.gateway = gateway;
    }

    public DelegatedReply send(String assistantId, String text) {
        ConversationKey key = new ConversationKey(assistantId, DELEGATE_USER_ID);
        synchronized (locksByAssistant.computeIfAbsent(assistantId, id -> new Object())) {
            String threadId = gateway.ensureThread(key);
            gateway.submitUserMessage(threadId, DELEGATE_USER_ID, text);
            log.info("[Delegation] Sent message to assistant {} on thread {}", assistantId, threadId);
            return await(assistantId, threadId, gateway.startRun(threadId, assistantId));
        }
    }

    private DelegatedReply await(String assistantId, String threadId, RunEventSource initial) {
        RunEventSource source = initial;
        String runId = null;
        RunStatus status = null;
        String errorMessage = null;
        StringBuilder streamed = new StringBuilder();
        String reply = null;
        try {
            RunNotification notification;
            while ((notification = source.next()) != null) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new AgentGatewayException("delegated run of assistant " + assistantId + " was abandoned");
                }
                if (notification.runId() != null) {
                    runId = notification.runId();
                }
                switch (notification.type()) {
                case MESSAGE_CREATED -> streamed.setLength(0);
                case MESSAGE_DELTA -> {
                    if (notification.text() != null) {
                        streamed.append(notification.text());
                    }
                }
                case MESSAGE_COMPLETED -> reply = streamed.length() > 0 ? streamed.toString() : notification.text();
                case REQUIRES_ACTION -> {
                    source.close();
                    source = gateway.submitToolResults(threadId, runId, declineAll(notification));
                }
                case RUN_TERMINAL -> {
                    status = notification.status();
                    errorMessage = notification.errorMessage();
                }
                case ERROR -> throw new AgentGatewayException(
                        "assistant " + assistantId + " stream failed: " + notification.errorMessage());
                default -> {
                    // progress notifications carry nothing to collect
                }
                }
                if (notification.type() == RunNotificationType.DONE || status != null) {
                    break;
                }
            }
        } finally {
            source.close();
        }
        if (status == null) {
            throw new AgentGatewayException("assistant " + assistantId + " stream ended before the run finished");
        }
        log.debug("[Delegation] Run {} of assistant {} ended with {}", runId, assistantId, status.wireName());
        return new DelegatedReply(assistantId, threadId, runId, status, reply, errorMessage);
    }

    private static Map<String, ToolResultEnvelope> declineAll(RunNotification notification) {
        Map<String, ToolResultEnvelope> results = new LinkedHashMap<>();
        for (ToolCall call : notification.toolCalls()) {
            results.put(call.callId(), ToolResultEnvelope.failure(ToolFailureKind.POLICY_DENIED, NESTED_TOOLS_MESSAGE));
        }
        return results;
    }

    /**
     * Outcome of one delegated exchange. {@code reply} is the text of the last
     * completed assistant message, or null when the run produced none.
     */
    public record DelegatedReply(String assistantId, String threadId, String runId, RunStatus status, String reply,
            String errorMessage) {

        public boolean isCompleted() {
            return status == RunStatus.COMPLETED;
        }
    }
}
