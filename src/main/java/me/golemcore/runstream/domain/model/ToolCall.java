package me.golemcore.runstream.domain.model;

import lombok.Builder;

import java.util.Map;

/**
 * Tool invocation requested by a suspended run. {@code arguments} is null when
 * {@code rawArguments} could not be parsed as a JSON object.
 */
@Builder
public record ToolCall(String callId, String toolName, Map<String, Object> arguments, String rawArguments,
        String originatingRunId) {

    public boolean hasValidArguments() {
        return arguments != null;
    }
}
