package me.golemcore.runstream.adapter.outbound.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.runstream.domain.model.ConversationKey;
import me.golemcore.runstream.domain.model.RunNotification;
import me.golemcore.runstream.domain.model.RunNotificationType;
import me.golemcore.runstream.domain.model.ToolFailureKind;
import me.golemcore.runstream.domain.model.ToolResultEnvelope;
import me.golemcore.runstream.infrastructure.config.RunStreamProperties;
import me.golemcore.runstream.port.outbound.AgentGatewayException;
import me.golemcore.runstream.port.outbound.RunEventSource;
import me.golemcore.runstream.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.LinkedHashMap;
import java.util.Map;

import static me.golemcore.runstream.testsupport.http.OkHttpMockEngine.frame;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AssistantsApiGatewayTest {

    private static final String THREAD_ID = "thread_abc";
    private static final String RUN_ID = "run_1";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private OkHttpMockEngine engine;
    private AssistantsApiGateway gateway;

    @BeforeEach
    void setUp() {
        RunStreamProperties properties = new RunStreamProperties();
        properties.getGateway().setBaseUrl("https://agents.test/v1/");
        properties.getGateway().setApiKey("sk-test");
        engine = new OkHttpMockEngine();
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(engine).build();
        gateway = new AssistantsApiGateway(properties, client, client, objectMapper,
                new AssistantsEventMapper(objectMapper));
    }

    // ==================== threads and messages ====================

    @Test
    void shouldCreateThreadOnceAndValidateItOnReuse() throws IOException {
        engine.enqueueJson(200, "{\"id\":\"" + THREAD_ID + "\",\"object\":\"thread\"}");
        engine.enqueueJson(200, "{\"id\":\"" + THREAD_ID + "\",\"object\":\"thread\"}");
        ConversationKey key = new ConversationKey("asst_1", "alice");

        assertEquals(THREAD_ID, gateway.ensureThread(key));
        assertEquals(THREAD_ID, gateway.ensureThread(key));

        assertEquals(2, engine.getRequestCount());
        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("POST", request.method());
        assertEquals("/v1/threads", request.path());
        assertEquals("Bearer sk-test", request.headers().get("Authorization"));
        assertEquals("assistants=v2", request.headers().get("OpenAI-Beta"));
        JsonNode body = objectMapper.readTree(request.body());
        assertEquals("asst_1", body.path("metadata").path("agent_id").asText());
        assertEquals("alice", body.path("metadata").path("user_id").asText());

        OkHttpMockEngine.CapturedRequest validation = engine.takeRequest();
        assertEquals("GET", validation.method());
        assertEquals("/v1/threads/" + THREAD_ID, validation.path());
        assertEquals("Bearer sk-test", validation.headers().get("Authorization"));
    }

    @Test
    void shouldReplaceThreadThatNoLongerExistsUpstream() {
        engine.enqueueJson(200, "{\"id\":\"" + THREAD_ID + "\"}");
        engine.enqueueJson(404, "{\"error\":{\"message\":\"No thread found\"}}");
        engine.enqueueJson(200, "{\"id\":\"thread_new\"}");
        engine.enqueueJson(200, "{\"id\":\"thread_new\"}");
        ConversationKey key = new ConversationKey("asst_1", "alice");
        gateway.ensureThread(key);

        assertEquals("thread_new", gateway.ensureThread(key));
        assertEquals("thread_new", gateway.ensureThread(key));

        engine.takeRequest();
        assertEquals("GET", engine.takeRequest().method());
        OkHttpMockEngine.CapturedRequest recreate = engine.takeRequest();
        assertEquals("POST", recreate.method());
        assertEquals("/v1/threads", recreate.path());
        assertEquals("/v1/threads/thread_new", engine.takeRequest().path());
    }

    @Test
    void shouldKeepCachedThreadWhenValidationFailsTransiently() {
        engine.enqueueJson(200, "{\"id\":\"" + THREAD_ID + "\"}");
        engine.enqueueJson(503, "{\"error\":\"overloaded\"}");
        engine.enqueueJson(200, "{\"id\":\"" + THREAD_ID + "\"}");
        ConversationKey key = new ConversationKey("asst_1", "alice");
        gateway.ensureThread(key);

        AgentGatewayException error = assertThrows(AgentGatewayException.class, () -> gateway.ensureThread(key));

        assertEquals(503, error.getHttpStatus());
        assertEquals(THREAD_ID, gateway.ensureThread(key));
        assertEquals(3, engine.getRequestCount());
    }

    @Test
    void shouldFailThreadCreationWithoutId() {
        engine.enqueueJson(200, "{}");

        assertThrows(AgentGatewayException.class, () -> gateway.ensureThread(new ConversationKey("asst_1", "bob")));
    }

    @Test
    void shouldAppendUserMessage() throws IOException {
        engine.enqueueJson(200, "{\"id\":\"msg_u1\"}");

        String messageId = gateway.submitUserMessage(THREAD_ID, "alice", "What's up?");

        assertEquals("msg_u1", messageId);
        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("/v1/threads/" + THREAD_ID + "/messages", request.path());
        JsonNode body = objectMapper.readTree(request.body());
        assertEquals("user", body.path("role").asText());
        assertEquals("What's up?", body.path("content").asText());
        assertEquals("alice", body.path("metadata").path("user_id").asText());
    }

    @Test
    void shouldRejectBlankMessageWithoutCallingBackend() {
        assertThrows(IllegalArgumentException.class, () -> gateway.submitUserMessage(THREAD_ID, "alice", " "));
        assertEquals(0, engine.getRequestCount());
    }

    @Test
    void shouldReportHttpStatusOfFailedCall() {
        engine.enqueueJson(401, "{\"error\":{\"message\":\"Incorrect API key\"}}");

        AgentGatewayException error = assertThrows(AgentGatewayException.class,
                () -> gateway.submitUserMessage(THREAD_ID, "alice", "hi"));

        assertEquals(401, error.getHttpStatus());
        assertTrue(error.getMessage().contains("Incorrect API key"));
    }

    @Test
    void shouldWrapTransportFailure() {
        engine.enqueueFailure(new SocketTimeoutException("timeout"));

        AgentGatewayException error = assertThrows(AgentGatewayException.class,
                () -> gateway.cancelRun(THREAD_ID, RUN_ID));

        assertEquals(0, error.getHttpStatus());
        assertTrue(error.getMessage().contains("timeout"));
    }

    @Test
    void shouldPostCancellation() {
        engine.enqueueJson(200, "{\"id\":\"" + RUN_ID + "\",\"status\":\"cancelling\"}");

        gateway.cancelRun(THREAD_ID, RUN_ID);

        assertEquals("/v1/threads/" + THREAD_ID + "/runs/" + RUN_ID + "/cancel", engine.takeRequest().path());
    }

    // ==================== run streams ====================

    @Test
    void shouldStreamRunNotifications() throws IOException {
        engine.enqueueEventStream(
                frame("thread.run.created", "{\"id\":\"run_1\",\"thread_id\":\"thread_abc\",\"status\":\"queued\"}"),
                frame("thread.message.delta",
                        "{\"id\":\"msg_1\",\"delta\":{\"content\":[{\"type\":\"text\",\"text\":{\"value\":\"Hi\"}}]}}"),
                frame("thread.run.completed", "{\"id\":\"run_1\",\"thread_id\":\"thread_abc\",\"status\":\"completed\"}"),
                frame("done", "[DONE]"));

        try (RunEventSource source = gateway.startRun(THREAD_ID, "asst_1")) {
            assertEquals(RunNotificationType.RUN_CREATED, source.next().type());
            RunNotification delta = source.next();
            assertEquals(RunNotificationType.MESSAGE_DELTA, delta.type());
            assertEquals("Hi", delta.text());
            assertEquals(RunNotificationType.RUN_TERMINAL, source.next().type());
            assertEquals(RunNotificationType.DONE, source.next().type());
            assertNull(source.next());
        }

        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("/v1/threads/" + THREAD_ID + "/runs", request.path());
        assertEquals("text/event-stream", request.headers().get("Accept"));
        JsonNode body = objectMapper.readTree(request.body());
        assertEquals("asst_1", body.path("assistant_id").asText());
        assertTrue(body.path("stream").asBoolean());
    }

    @Test
    void shouldParseCommentsMultilineDataAndEndOfStream() {
        engine.enqueueRawEventStream(": keep-alive\n\n"
                + "event: thread.message.completed\n"
                + "data: {\"id\":\"msg_1\",\n"
                + "data: \"content\":[{\"type\":\"text\",\"text\":{\"value\":\"Done\"}}]}\n"
                + "\n"
                + "event: thread.run.step.created\n"
                + "data: {\"id\":\"step_1\"}\n");

        RunEventSource source = gateway.startRun(THREAD_ID, "asst_1");

        RunNotification completed = source.next();
        assertEquals(RunNotificationType.MESSAGE_COMPLETED, completed.type());
        assertEquals("Done", completed.text());
        assertEquals(RunNotificationType.IGNORED, source.next().type());
        assertNull(source.next());
        source.close();
    }

    @Test
    void shouldFailToOpenStreamOnHttpError() {
        engine.enqueueJson(404, "{\"error\":{\"message\":\"No thread found\"}}");

        AgentGatewayException error = assertThrows(AgentGatewayException.class,
                () -> gateway.startRun("thread_missing", "asst_1"));

        assertEquals(404, error.getHttpStatus());
    }

    @Test
    void shouldSubmitSerializedEnvelopesAndStreamResumedRun() throws IOException {
        engine.enqueueEventStream(
                frame("thread.run.completed", "{\"id\":\"run_1\",\"thread_id\":\"thread_abc\",\"status\":\"completed\"}"));
        Map<String, ToolResultEnvelope> results = new LinkedHashMap<>();
        results.put("call_1", ToolResultEnvelope.success(Map.of("id", 42)));
        results.put("call_2", ToolResultEnvelope.failure(ToolFailureKind.UNKNOWN_TOOL, "unknown tool: nope"));

        try (RunEventSource resumed = gateway.submitToolResults(THREAD_ID, RUN_ID, results)) {
            assertEquals(RunNotificationType.RUN_TERMINAL, resumed.next().type());
        }

        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("/v1/threads/" + THREAD_ID + "/runs/" + RUN_ID + "/submit_tool_outputs", request.path());
        JsonNode body = objectMapper.readTree(request.body());
        assertTrue(body.path("stream").asBoolean());
        JsonNode outputs = body.path("tool_outputs");
        assertEquals(2, outputs.size());
        assertEquals("call_1", outputs.get(0).path("tool_call_id").asText());
        assertEquals(objectMapper.readTree("{\"status\":true,\"message\":\"Success\",\"result\":{\"id\":42}}"),
                objectMapper.readTree(outputs.get(0).path("output").asText()));
        assertEquals(objectMapper.readTree("{\"status\":false,\"message\":\"unknown tool: nope\",\"result\":null}"),
                objectMapper.readTree(outputs.get(1).path("output").asText()));
    }
}
