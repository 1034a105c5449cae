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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runstream.domain.component.ToolComponent;
import me.golemcore.runstream.domain.model.ToolCall;
import me.golemcore.runstream.domain.model.ToolFailureKind;
import me.golemcore.runstream.domain.model.ToolResultEnvelope;
import me.golemcore.runstream.infrastructure.config.RunStreamProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes local tools on behalf of a suspended run and turns every outcome
 * into a {@link ToolResultEnvelope}. Nothing thrown by a tool escapes this
 * class.
 *
 * <p>
 * Calls of one batch are started together on the tool executor and joined
 * before returning, each bounded by {@code runstream.tools.timeout-seconds}
 * measured from its start. Successful output larger than the token budget is
 * reduced to its tail by {@link ToolOutputTruncator}.
 */
@Service
@Slf4j
public class ToolInvocationService {

    private final Map<String, ToolComponent> toolRegistry = new ConcurrentHashMap<>();
    private final ToolOutputTruncator truncator;
    private final ExecutorService toolExecutor;
    private final RunStreamProperties properties;
    private final ObjectMapper objectMapper;

    public ToolInvocationService(List<ToolComponent> tools, ToolOutputTruncator truncator,
            @Qualifier("toolExecutor") ExecutorService toolExecutor, RunStreamProperties properties,
            ObjectMapper objectMapper) {
        this.truncator = truncator;
        this.toolExecutor = toolExecutor;
        this.properties = properties;
        this.objectMapper = objectMapper;
        for (ToolComponent tool : tools) {
            registerTool(tool);
        }
        log.info("[Tools] Registered {} tools: {}", toolRegistry.size(), new TreeSet<>(toolRegistry.keySet()));
    }

    public void registerTool(ToolComponent tool) {
        ToolComponent previous = toolRegistry.put(tool.getToolName(), tool);
        if (previous != null && previous != tool) {
            log.warn("[Tools] Tool '{}' replaced by {}", tool.getToolName(), tool.getClass().getSimpleName());
        }
    }

    public void unregisterTools(Collection<String> toolNames) {
        if (toolNames == null) {
            return;
        }
        for (String name : toolNames) {
            toolRegistry.remove(name);
        }
        log.debug("[Tools] Unregistered tools: {}", toolNames);
    }

    public ToolComponent getTool(String name) {
        return toolRegistry.get(name);
    }

    public Set<String> getToolNames() {
        return new TreeSet<>(toolRegistry.keySet());
    }

    /**
     * Invokes a single tool and waits for its envelope.
     */
    public ToolResultEnvelope invoke(String toolName, Map<String, Object> arguments) {
        ToolCall call = ToolCall.builder()
                .toolName(toolName)
                .arguments(arguments != null ? arguments : Map.of())
                .build();
        return await(launch(call));
    }

    /**
     * Invokes every call of a batch concurrently.
     *
     * @return exactly one envelope per call id, in call order
     */
    public Map<String, ToolResultEnvelope> invokeAll(List<ToolCall> calls) {
        List<PendingInvocation> pending = new ArrayList<>(calls.size());
        for (ToolCall call : calls) {
            pending.add(launch(call));
        }
        Map<String, ToolResultEnvelope> results = new LinkedHashMap<>();
        for (PendingInvocation invocation : pending) {
            ToolResultEnvelope envelope = await(invocation);
            if (results.putIfAbsent(invocation.call().callId(), envelope) != null) {
                log.warn("[Tools] Duplicate call id {} in batch, keeping the first result",
                        invocation.call().callId());
            }
        }
        return results;
    }

    private PendingInvocation launch(ToolCall call) {
        String toolName = call.toolName();
        ToolComponent tool = toolName != null ? toolRegistry.get(toolName) : null;

        if (tool == null) {
            log.warn("[Tools] Unknown tool requested: {} (available: {})", toolName, getToolNames());
            return PendingInvocation.completed(call,
                    ToolResultEnvelope.failure(ToolFailureKind.UNKNOWN_TOOL, "unknown tool: " + toolName));
        }
        if (!tool.isEnabled()) {
            return PendingInvocation.completed(call,
                    ToolResultEnvelope.failure(ToolFailureKind.POLICY_DENIED, "tool is disabled: " + toolName));
        }
        if (!call.hasValidArguments()) {
            log.warn("[Tools] Invalid arguments for '{}': {}", toolName, call.rawArguments());
            return PendingInvocation.completed(call,
                    ToolResultEnvelope.failure(ToolFailureKind.INVALID_ARGUMENTS,
                            "invalid arguments for tool " + toolName + ": expected a JSON object"));
        }

        log.debug("[Tools] Invoking '{}' (call {})", toolName, call.callId());
        try {
            Future<Object> future = toolExecutor.submit(() -> tool.execute(call.arguments()));
            return new PendingInvocation(call, future, System.nanoTime(), null);
        } catch (RejectedExecutionException e) {
            log.error("[Tools] Tool executor rejected '{}'", toolName, e);
            return PendingInvocation.completed(call,
                    ToolResultEnvelope.failure(ToolFailureKind.EXECUTION_FAILED, "tool executor unavailable"));
        }
    }

    private ToolResultEnvelope await(PendingInvocation invocation) {
        if (invocation.immediate() != null) {
            return invocation.immediate();
        }
        String toolName = invocation.call().toolName();
        long timeoutNanos = TimeUnit.SECONDS.toNanos(Math.max(1, properties.getTools().getTimeoutSeconds()));
        long remaining = timeoutNanos - (System.nanoTime() - invocation.startedNanos());
        try {
            Object result = invocation.future().get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
            return successEnvelope(toolName, result);
        } catch (TimeoutException e) {
            invocation.future().cancel(true);
            log.error("[Tools] Tool '{}' timed out after {}s", toolName, properties.getTools().getTimeoutSeconds());
            return ToolResultEnvelope.failure(ToolFailureKind.TIMEOUT,
                    "tool " + toolName + " timed out after " + properties.getTools().getTimeoutSeconds() + "s");
        } catch (ExecutionException e) {
            log.error("[Tools] Tool execution failed: {}", toolName, e.getCause());
            return ToolResultEnvelope.failure(ToolFailureKind.EXECUTION_FAILED, safeCauseMessage(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            invocation.future().cancel(true);
            return ToolResultEnvelope.failure(ToolFailureKind.EXECUTION_FAILED, "tool invocation interrupted");
        }
    }

    private ToolResultEnvelope successEnvelope(String toolName, Object result) {
        String serialized;
        try {
            serialized = result instanceof String text ? text : objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            log.error("[Tools] Output of '{}' is not serializable", toolName, e);
            return ToolResultEnvelope.failure(ToolFailureKind.EXECUTION_FAILED,
                    "tool output is not serializable: " + e.getOriginalMessage());
        }
        if (!truncator.exceedsBudget(serialized)) {
            return ToolResultEnvelope.success(result);
        }
        String truncated = truncator.truncate(serialized);
        log.warn("[Tools] Output of '{}' truncated from {} to {} chars", toolName, serialized.length(),
                truncated.length());
        return ToolResultEnvelope.success(truncated);
    }

    private static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }

        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null) {
            if (cause.equals(cursor)) {
                break;
            }
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    private record PendingInvocation(ToolCall call, Future<Object> future, long startedNanos,
            ToolResultEnvelope immediate) {

        static PendingInvocation completed(ToolCall call, ToolResultEnvelope envelope) {
            return new PendingInvocation(call, null, 0L, envelope);
        }
    }
}
