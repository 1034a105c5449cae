package me.golemcore.runstream.tools;

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
import me.golemcore.runstream.domain.component.ToolComponent;
import me.golemcore.runstream.domain.service.AgentDelegationService;
import me.golemcore.runstream.domain.service.AgentDelegationService.DelegatedReply;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Built-in {@code communicate_with_assistant} tool: sends a message to another
 * assistant, waits for its run and returns the reply. A run that does not
 * complete fails the call.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CommunicateWithAssistantTool implements ToolComponent {

    public static final String TOOL_NAME = "communicate_with_assistant";

    static final String PARAM_ASSISTANT = "assistant_id";
    static final String PARAM_CONTENT = "user_content";

    private final AgentDelegationService delegationService;

    @Override
    public String getToolName() {
        return TOOL_NAME;
    }

    @Override
    public String getDescription() {
        return "Send a message to another assistant and return its reply.";
    }

    @Override
    public Object execute(Map<String, Object> arguments) {
        String assistantId = ToolArguments.requireText(arguments, PARAM_ASSISTANT);
        String content = ToolArguments.requireText(arguments, PARAM_CONTENT);

        DelegatedReply reply = delegationService.send(assistantId, content);
        if (!reply.isCompleted()) {
            log.warn("[CommunicateTool] Run {} of assistant {} ended with {}", reply.runId(), assistantId,
                    reply.status().wireName());
            throw new IllegalStateException("Assistant '" + assistantId + "' run ended with status "
                    + reply.status().wireName()
                    + (reply.errorMessage() != null ? ": " + reply.errorMessage() : ""));
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("message", "Message successfully sent to assistant '" + assistantId + "'.");
        result.put("assistantId", assistantId);
        result.put("threadId", reply.threadId());
        result.put("runId", reply.runId());
        result.put("reply", reply.reply());
        return result;
    }
}
