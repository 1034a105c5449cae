package me.golemcore.runstream.adapter.outbound.gateway;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runstream.domain.model.RunNotification;
import me.golemcore.runstream.domain.model.RunNotificationType;
import me.golemcore.runstream.domain.model.RunStatus;
import me.golemcore.runstream.domain.model.ToolCall;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Classifies Assistants API stream events into {@link RunNotification}s.
 *
 * <p>
 * Handled event families:
 * <ul>
 * <li>{@code thread.run.*} - created, status changes, requires_action and the
 * terminal statuses</li>
 * <li>{@code thread.message.*} - created, delta, completed/incomplete</li>
 * <li>{@code error} and {@code done}</li>
 * </ul>
 * Run steps and anything unknown map to {@link RunNotificationType#IGNORED}.
 */
@Component
@Slf4j
public class AssistantsEventMapper {

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public AssistantsEventMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public RunNotification map(String eventName, String data) {
        String event = eventName != null ? eventName.trim() : "";
        if ("done".equals(event) || "[DONE]".equals(data != null ? data.trim() : null)) {
            return RunNotification.done();
        }

        JsonNode node = parse(event, data);
        if ("error".equals(event)) {
            return RunNotification.builder()
                    .type(RunNotificationType.ERROR)
                    .sourceEvent(event)
                    .errorMessage(errorMessage(node))
                    .build();
        }
        if (event.startsWith("thread.run.step.")) {
            return ignored(event);
        }
        if (event.startsWith("thread.run.")) {
            return mapRunEvent(event, node);
        }
        if (event.startsWith("thread.message.")) {
            return mapMessageEvent(event, node);
        }
        return ignored(event);
    }

    private RunNotification mapRunEvent(String event, JsonNode run) {
        RunStatus status = RunStatus.fromWire(run.path("status").asText(null));
        RunNotification.RunNotificationBuilder builder = RunNotification.builder()
                .sourceEvent(event)
                .threadId(text(run, "thread_id"))
                .runId(text(run, "id"))
                .status(status);

        if ("thread.run.created".equals(event)) {
            return builder.type(RunNotificationType.RUN_CREATED).build();
        }
        if ("thread.run.requires_action".equals(event)) {
            return builder.type(RunNotificationType.REQUIRES_ACTION)
                    .status(RunStatus.REQUIRES_ACTION)
                    .toolCalls(toolCalls(run))
                    .build();
        }

        RunStatus eventStatus = RunStatus.fromWire(event.substring("thread.run.".length()));
        RunStatus effective = eventStatus != null ? eventStatus : status;
        if (effective != null && effective.isTerminal()) {
            return builder.type(RunNotificationType.RUN_TERMINAL)
                    .status(effective)
                    .errorMessage(lastError(run))
                    .build();
        }
        if (effective != null) {
            return builder.type(RunNotificationType.RUN_STATUS).status(effective).build();
        }
        return ignored(event);
    }

    private RunNotification mapMessageEvent(String event, JsonNode message) {
        RunNotification.RunNotificationBuilder builder = RunNotification.builder()
                .sourceEvent(event)
                .threadId(text(message, "thread_id"))
                .runId(text(message, "run_id"))
                .messageId(text(message, "id"));

        switch (event) {
        case "thread.message.created":
            return builder.type(RunNotificationType.MESSAGE_CREATED).build();
        case "thread.message.delta":
            return builder.type(RunNotificationType.MESSAGE_DELTA)
                    .text(joinText(message.path("delta").path("content")))
                    .build();
        case "thread.message.completed":
        case "thread.message.incomplete":
            return builder.type(RunNotificationType.MESSAGE_COMPLETED)
                    .text(joinText(message.path("content")))
                    .build();
        default:
            return ignored(event);
        }
    }

    private List<ToolCall> toolCalls(JsonNode run) {
        JsonNode calls = run.path("required_action").path("submit_tool_outputs").path("tool_calls");
        List<ToolCall> result = new ArrayList<>();
        if (!calls.isArray()) {
            log.warn("[Gateway] requires_action without tool_calls for run {}", text(run, "id"));
            return result;
        }
        String runId = text(run, "id");
        for (JsonNode call : calls) {
            JsonNode function = call.path("function");
            String rawArguments = function.path("arguments").asText("");
            result.add(ToolCall.builder()
                    .callId(text(call, "id"))
                    .toolName(text(function, "name"))
                    .rawArguments(rawArguments)
                    .arguments(parseArguments(rawArguments))
                    .originatingRunId(runId)
                    .build());
        }
        return result;
    }

    /**
     * Blank arguments mean "no arguments". Anything that is not a JSON object
     * yields null so the tool invoker reports it.
     */
    Map<String, Object> parseArguments(String rawArguments) {
        if (rawArguments == null || rawArguments.isBlank()) {
            return Map.of();
        }
        try {
            JsonNode node = objectMapper.readTree(rawArguments);
            if (node == null || !node.isObject()) {
                return null;
            }
            return objectMapper.convertValue(node, ARGUMENTS_TYPE);
        } catch (JsonProcessingException e) {
            log.debug("[Gateway] Unparseable tool arguments: {}", e.getOriginalMessage());
            return null;
        }
    }

    private JsonNode parse(String event, String data) {
        if (data == null || data.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(data);
        } catch (JsonProcessingException e) {
            log.warn("[Gateway] Malformed payload for event {}: {}", event, e.getOriginalMessage());
            return objectMapper.createObjectNode();
        }
    }

    private static String joinText(JsonNode contentParts) {
        if (!contentParts.isArray()) {
            return null;
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode part : contentParts) {
            if ("text".equals(part.path("type").asText())) {
                text.append(part.path("text").path("value").asText(""));
            }
        }
        return text.toString();
    }

    private static String errorMessage(JsonNode node) {
        String message = text(node, "message");
        if (message == null) {
            message = text(node.path("error"), "message");
        }
        return message != null ? message : "agent backend reported an error";
    }

    private static String lastError(JsonNode run) {
        JsonNode lastError = run.path("last_error");
        if (lastError.isMissingNode() || lastError.isNull()) {
            return null;
        }
        return text(lastError, "message");
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }

    private static RunNotification ignored(String event) {
        return RunNotification.builder()
                .type(RunNotificationType.IGNORED)
                .sourceEvent(event)
                .build();
    }
}
