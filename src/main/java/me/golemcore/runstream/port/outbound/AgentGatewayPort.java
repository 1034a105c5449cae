package me.golemcore.runstream.port.outbound;

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

import me.golemcore.runstream.domain.model.ConversationKey;
import me.golemcore.runstream.domain.model.ToolResultEnvelope;

import java.util.Map;

/**
 * Port for the conversational-agent backend: threads, messages and streaming
 * runs. All operations block the calling thread and throw
 * {@link AgentGatewayException} on transport or protocol failures.
 */
public interface AgentGatewayPort {

    /**
     * Get provider identifier.
     */
    String getProviderId();

    /**
     * Returns the backend thread for the conversation, creating it on first use.
     * Idempotent: repeated calls for the same key return the same thread id.
     */
    String ensureThread(ConversationKey key);

    /**
     * Appends a user message to the thread.
     *
     * @return backend message id
     * @throws IllegalArgumentException
     *             if {@code text} is blank
     */
    String submitUserMessage(String threadId, String userId, String text);

    /**
     * Starts a streaming run of the agent on the thread.
     */
    RunEventSource startRun(String threadId, String agentId);

    /**
     * Submits one result per outstanding tool call of a suspended run and
     * returns the stream of the resumed run.
     */
    RunEventSource submitToolResults(String threadId, String runId, Map<String, ToolResultEnvelope> resultsByCallId);

    /**
     * Requests cancellation. The run's own stream then reports the terminal
     * status.
     */
    void cancelRun(String threadId, String runId);
}
