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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runstream.domain.model.ConversationKey;
import me.golemcore.runstream.domain.model.ToolResultEnvelope;
import me.golemcore.runstream.infrastructure.config.RunStreamProperties;
import me.golemcore.runstream.port.outbound.AgentGatewayException;
import me.golemcore.runstream.port.outbound.AgentGatewayPort;
import me.golemcore.runstream.port.outbound.RunEventSource;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Gateway to an OpenAI Assistants-compatible backend over HTTP.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>POST /threads - create a thread for a conversation
 * <li>GET /threads/{thread} - check that a cached thread still exists
 * <li>POST /threads/{thread}/messages - append a user message
 * <li>POST /threads/{thread}/runs - start a streaming run
 * <li>POST /threads/{thread}/runs/{run}/submit_tool_outputs - resume a run
 * <li>POST /threads/{thread}/runs/{run}/cancel - cancel a run
 * </ul>
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code runstream.gateway.base-url} - API base URL
 * <li>{@code runstream.gateway.api-key} - bearer token
 * <li>{@code runstream.gateway.beta-header} - {@code OpenAI-Beta} header value
 * <li>{@code runstream.gateway.stream-read-timeout-ms} - idle timeout of run
 * streams
 * </ul>
 *
 * @see AssistantsEventMapper
 */
@Component
@Slf4j
public class AssistantsApiGateway implements AgentGatewayPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int MAX_ERROR_BODY_CHARS = 500;

    private final RunStreamProperties properties;
    private final OkHttpClient httpClient;
    private final OkHttpClient streamingHttpClient;
    private final ObjectMapper objectMapper;
    private final AssistantsEventMapper eventMapper;
    private final Map<ConversationKey, String> threadsByConversation = new ConcurrentHashMap<>();

    public AssistantsApiGateway(RunStreamProperties properties, @Qualifier("okHttpClient") OkHttpClient httpClient,
            @Qualifier("streamingHttpClient") OkHttpClient streamingHttpClient, ObjectMapper objectMapper,
            AssistantsEventMapper eventMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.streamingHttpClient = streamingHttpClient;
        this.objectMapper = objectMapper;
        this.eventMapper = eventMapper;
    }

    @Override
    public String getProviderId() {
        return "openai-assistants";
    }

    /**
     * Returns the conversation's thread, creating one on first use. A cached
     * thread is checked upstream first; if the backend no longer knows it, the
     * entry is dropped and a fresh thread takes its place.
     */
    @Override
    public String ensureThread(ConversationKey key) {
        String cached = threadsByConversation.get(key);
        if (cached != null) {
            if (threadExists(cached)) {
                return cached;
            }
            log.info("[Gateway] Thread {} of {} no longer exists upstream, creating a new one", cached, key);
            threadsByConversation.remove(key, cached);
        }
        String created = createThread(key);
        String existing = threadsByConversation.putIfAbsent(key, created);
        if (existing != null) {
            log.debug("[Gateway] Thread {} for {} was created concurrently, keeping {}", created, key, existing);
            return existing;
        }
        return created;
    }

    @Override
    public String submitUserMessage(String threadId, String userId, String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("message text must not be empty");
        }
        JsonNode message = postJson("/threads/" + threadId + "/messages",
                new MessageRequest("user", text, Map.of("user_id", userId)));
        String messageId = message.path("id").asText(null);
        log.debug("[Gateway] Added message {} to thread {}", messageId, threadId);
        return messageId;
    }

    @Override
    public RunEventSource startRun(String threadId, String agentId) {
        log.debug("[Gateway] Starting run of agent {} on thread {}", agentId, threadId);
        return openStream("/threads/" + threadId + "/runs", new RunRequest(agentId, true));
    }

    @Override
    public RunEventSource submitToolResults(String threadId, String runId,
            Map<String, ToolResultEnvelope> resultsByCallId) {
        List<ToolOutput> outputs = new ArrayList<>(resultsByCallId.size());
        for (Map.Entry<String, ToolResultEnvelope> entry : resultsByCallId.entrySet()) {
            outputs.add(new ToolOutput(entry.getKey(), serialize(entry.getValue())));
        }
        log.debug("[Gateway] Submitting {} tool output(s) for run {}", outputs.size(), runId);
        return openStream("/threads/" + threadId + "/runs/" + runId + "/submit_tool_outputs",
                new ToolOutputsRequest(outputs, true));
    }

    @Override
    public void cancelRun(String threadId, String runId) {
        postJson("/threads/" + threadId + "/runs/" + runId + "/cancel", Map.of());
    }

    private String createThread(ConversationKey key) {
        JsonNode thread = postJson("/threads",
                new ThreadRequest(Map.of("agent_id", key.agentId(), "user_id", key.userId())));
        String threadId = thread.path("id").asText(null);
        if (threadId == null || threadId.isBlank()) {
            throw new AgentGatewayException("thread creation returned no id");
        }
        log.info("[Gateway] Created thread {} for {}", threadId, key);
        return threadId;
    }

    private boolean threadExists(String threadId) {
        String path = "/threads/" + threadId;
        Request request = withHeaders(new Request.Builder().url(baseUrl() + path).get(), false).build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (response.isSuccessful()) {
                return true;
            }
            if (response.code() == 404 || response.code() == 410) {
                return false;
            }
            log.warn("[Gateway] GET {} failed: HTTP {}", path, response.code());
            throw new AgentGatewayException("GET " + path + " failed: HTTP " + response.code(), response.code(),
                    null);
        } catch (IOException e) {
            throw new AgentGatewayException("GET " + path + " failed: " + e.getMessage(), e);
        }
    }

    private JsonNode postJson(String path, Object payload) {
        Request request = buildRequest(path, payload, false);
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                log.warn("[Gateway] POST {} failed: HTTP {}", path, response.code());
                throw new AgentGatewayException(
                        "POST " + path + " failed: HTTP " + response.code() + " " + abbreviate(text),
                        response.code(), null);
            }
            return text.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(text);
        } catch (IOException e) {
            throw new AgentGatewayException("POST " + path + " failed: " + e.getMessage(), e);
        }
    }

    private RunEventSource openStream(String path, Object payload) {
        Request request = buildRequest(path, payload, true);
        Response response;
        try {
            response = streamingHttpClient.newCall(request).execute();
        } catch (IOException e) {
            throw new AgentGatewayException("POST " + path + " failed: " + e.getMessage(), e);
        }
        if (!response.isSuccessful()) {
            String text = readQuietly(response);
            log.warn("[Gateway] POST {} failed: HTTP {}", path, response.code());
            throw new AgentGatewayException(
                    "POST " + path + " failed: HTTP " + response.code() + " " + abbreviate(text),
                    response.code(), null);
        }
        return new AssistantsSseEventSource(response, eventMapper);
    }

    private Request buildRequest(String path, Object payload, boolean streaming) {
        Request.Builder builder = new Request.Builder()
                .url(baseUrl() + path)
                .post(RequestBody.create(serialize(payload), JSON));
        return withHeaders(builder, streaming).build();
    }

    private Request.Builder withHeaders(Request.Builder builder, boolean streaming) {
        String apiKey = properties.getGateway().getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        String beta = properties.getGateway().getBetaHeader();
        if (beta != null && !beta.isBlank()) {
            builder.header("OpenAI-Beta", beta);
        }
        if (streaming) {
            builder.header("Accept", "text/event-stream");
        }
        return builder;
    }

    private String baseUrl() {
        String url = properties.getGateway().getBaseUrl();
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private String serialize(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new AgentGatewayException("failed to serialize request: " + e.getOriginalMessage(), e);
        }
    }

    private static String readQuietly(Response response) {
        try (response) {
            ResponseBody body = response.body();
            return body != null ? body.string() : "";
        } catch (IOException e) {
            return "(unreadable body: " + e.getMessage() + ")";
        }
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > MAX_ERROR_BODY_CHARS ? text.substring(0, MAX_ERROR_BODY_CHARS) + "..." : text;
    }

    record ThreadRequest(Map<String, String> metadata) {
    }

    record MessageRequest(String role, String content, Map<String, String> metadata) {
    }

    record RunRequest(@JsonProperty("assistant_id") String assistantId, boolean stream) {
    }

    record ToolOutput(@JsonProperty("tool_call_id") String toolCallId, String output) {
    }

    record ToolOutputsRequest(@JsonProperty("tool_outputs") List<ToolOutput> toolOutputs, boolean stream) {
    }
}
