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
import me.golemcore.runstream.domain.component.ToolComponent;
import me.golemcore.runstream.domain.service.AgentDelegationService;
import me.golemcore.runstream.domain.service.AgentDelegationService.DelegatedReply;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Built-in {@code initialize_agent} tool: opens the delegation thread of
 * another assistant and runs it once with a greeting, so later
 * {@code communicate_with_assistant} calls reach a warmed-up thread.
 */
@Component
@RequiredArgsConstructor
public class InitializeAgentTool implements ToolComponent {

    public static final String TOOL_NAME = "initialize_agent";

    static final String PARAM_ASSISTANT = "assistant_id";
    static final String GREETING = "Agent initialized successfully.";

    private final AgentDelegationService delegationService;

    @Override
    public String getToolName() {
        return TOOL_NAME;
    }

    @Override
    public String getDescription() {
        return "Initialize another assistant before communicating with it.";
    }

    @Override
    public Object execute(Map<String, Object> arguments) {
        String assistantId = ToolArguments.requireText(arguments, PARAM_ASSISTANT);

        DelegatedReply reply = delegationService.send(assistantId, GREETING);
        if (!reply.isCompleted()) {
            throw new IllegalStateException("Assistant '" + assistantId + "' could not be initialized: run ended with "
                    + reply.status().wireName());
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("message", "Assistant '" + assistantId + "' initialized successfully.");
        result.put("threadId", reply.threadId());
        return result;
    }
}
