package me.golemcore.runstream.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.runstream.domain.component.ToolComponent;
import me.golemcore.runstream.domain.model.ConversationKey;
import me.golemcore.runstream.domain.model.ConversationSession;
import me.golemcore.runstream.domain.model.EventKind;
import me.golemcore.runstream.domain.model.PublishOutcome;
import me.golemcore.runstream.domain.model.RunNotification;
import me.golemcore.runstream.domain.model.RunNotificationType;
import me.golemcore.runstream.domain.model.RunState;
import me.golemcore.runstream.domain.model.RunStatus;
import me.golemcore.runstream.domain.model.StreamEvent;
import me.golemcore.runstream.domain.model.ToolCall;
import me.golemcore.runstream.domain.model.ToolFailureKind;
import me.golemcore.runstream.domain.model.ToolResultEnvelope;
import me.golemcore.runstream.infrastructure.config.RunStreamProperties;
import me.golemcore.runstream.port.outbound.AgentGatewayException;
import me.golemcore.runstream.port.outbound.AgentGatewayPort;
import me.golemcore.runstream.port.outbound.OutputChannelPort;
import me.golemcore.runstream.testsupport.stream.RecordingChannel;
import me.golemcore.runstream.testsupport.stream.ScriptedRunEventSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RunEventRouterTest {

    private static final String THREAD_ID = "thread_1";
    private static final String RUN_ID = "run_1";
    private static final String MESSAGE_ID = "msg_1";

    private RecordingChannel channel;
    private AgentGatewayPort gateway;
    private ExecutorService toolExecutor;
    private ConversationSession session;
    private RunEventRouter router;
    private RunStreamProperties properties;
    private ToolInvocationService toolInvoker;
    private Clock clock;

    @BeforeEach
    void setUp() {
        properties = new RunStreamProperties();
        properties.getChannels().setActive(List.of(RecordingChannel.TYPE));
        channel = new RecordingChannel();
        gateway = mock(AgentGatewayPort.class);
        toolExecutor = Executors.newFixedThreadPool(2);

        ToolComponent lookup = new ToolComponent() {
            @Override
            public String getToolName() {
                return "lookup";
            }

            @Override
            public Object execute(Map<String, Object> arguments) {
                return Map.of("id", arguments.get("id"), "name", "Widget");
            }
        };
        toolInvoker = new ToolInvocationService(List.of(lookup),
                new ToolOutputTruncator(properties), toolExecutor, properties, new ObjectMapper());
        ChannelFanOutService fanOut = new ChannelFanOutService(List.of(channel), properties);
        clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
        router = new RunEventRouter(fanOut, toolInvoker, gateway, clock);

        session = new ConversationSession(new ConversationKey("agent-1", "alice"), 300);
        session.setThreadId(THREAD_ID);
        session.exclusive(() -> {
            session.tryReserve();
        });
    }

    @AfterEach
    void tearDown() {
        toolExecutor.shutdownNow();
    }

    // ==================== text streaming ====================

    @Test
    void shouldStreamFragmentsThenFinalizedThenStatus() {
        ScriptedRunEventSource source = new ScriptedRunEventSource(
                runCreated(),
                messageCreated(),
                delta("He"),
                delta("llo!"),
                messageCompleted(null),
                terminal(RunStatus.COMPLETED, null),
                RunNotification.done());

        RunState state = router.route(session, source);

        assertEquals(RunState.TERMINAL, state);
        List<StreamEvent> events = channel.getEvents();
        assertEquals(4, events.size());
        assertEvent(events.get(0), 1, EventKind.FRAGMENT, "delta", "He");
        assertEvent(events.get(1), 2, EventKind.FRAGMENT, "delta", "llo!");
        assertEvent(events.get(2), 3, EventKind.FINALIZED, "text", "Hello!");
        assertEvent(events.get(3), 4, EventKind.STATUS, "status", "completed");
        assertEquals(RUN_ID, events.get(3).payloadText("runId"));
        assertEquals(MESSAGE_ID, events.get(0).messageId());
        assertNull(session.getActiveRunId());
        assertTrue(source.isClosed());
        assertEquals(1, source.remaining());
    }

    @Test
    void shouldAppendEveryEventToHistoryBeforePublishing() {
        router.route(session, new ScriptedRunEventSource(
                runCreated(), delta("Hi"), messageCompleted(null), terminal(RunStatus.COMPLETED, null)));

        List<StreamEvent> retained = session.exclusive(() -> session.getHistory().snapshot());
        assertEquals(channel.getEvents(), retained);
        assertEquals(3L, session.getLastSequenceNo());
    }

    @Test
    void shouldUseProviderTextWhenNoDeltasArrived() {
        router.route(session, new ScriptedRunEventSource(
                runCreated(), messageCompleted("Full answer"), terminal(RunStatus.COMPLETED, null)));

        StreamEvent finalized = channel.eventsOfKind(EventKind.FINALIZED).get(0);
        assertEquals("Full answer", finalized.payloadText("text"));
    }

    @Test
    void shouldReportFailedRunStatusWithMessage() {
        router.route(session, new ScriptedRunEventSource(runCreated(), terminal(RunStatus.FAILED, "quota exceeded")));

        StreamEvent status = channel.getEvents().get(0);
        assertEquals(EventKind.STATUS, status.kind());
        assertEquals("failed", status.payloadText("status"));
        assertEquals("quota exceeded", status.payloadText("message"));
    }

    @Test
    void shouldIgnoreNotificationsForForeignThread() {
        RunNotification foreign = RunNotification.builder()
                .type(RunNotificationType.MESSAGE_DELTA)
                .sourceEvent("thread.message.delta")
                .threadId("thread_other")
                .messageId(MESSAGE_ID)
                .text("leak")
                .build();

        router.route(session, new ScriptedRunEventSource(runCreated(), foreign, terminal(RunStatus.COMPLETED, null)));

        assertTrue(channel.eventsOfKind(EventKind.FRAGMENT).isEmpty());
        assertEquals(1, channel.getEvents().size());
    }

    // ==================== tool calls ====================

    @Test
    void shouldExecuteToolCallsAndContinueOnResumedStream() {
        ScriptedRunEventSource initial = new ScriptedRunEventSource(
                runCreated(), requiresAction(toolCall("call_1", "lookup", Map.of("id", 42))));
        ScriptedRunEventSource resumed = new ScriptedRunEventSource(
                delta("Found Widget"), messageCompleted(null), terminal(RunStatus.COMPLETED, null));
        when(gateway.submitToolResults(eq(THREAD_ID), eq(RUN_ID), anyMap())).thenReturn(resumed);

        RunState state = router.route(session, initial);

        assertEquals(RunState.TERMINAL, state);
        List<StreamEvent> events = channel.getEvents();
        assertEquals(List.of(EventKind.TOOL_CALL, EventKind.FRAGMENT, EventKind.FINALIZED, EventKind.STATUS),
                events.stream().map(StreamEvent::kind).toList());
        StreamEvent toolCall = events.get(0);
        assertEquals("call_1", toolCall.payloadText("callId"));
        assertEquals("lookup", toolCall.payloadText("toolName"));
        assertEquals(Map.of("id", 42), toolCall.payloadValue("arguments"));
        assertEquals(RUN_ID, toolCall.payloadText("runId"));

        Map<String, ToolResultEnvelope> submitted = captureSubmission();
        assertEquals(1, submitted.size());
        ToolResultEnvelope envelope = submitted.get("call_1");
        assertTrue(envelope.isStatus());
        assertEquals(Map.of("id", 42, "name", "Widget"), envelope.getResult());
        assertTrue(initial.isClosed());
        assertTrue(resumed.isClosed());
    }

    @Test
    void shouldSubmitFailureEnvelopeForUnknownToolAndFinishRun() {
        when(gateway.submitToolResults(eq(THREAD_ID), eq(RUN_ID), anyMap()))
                .thenReturn(new ScriptedRunEventSource(terminal(RunStatus.COMPLETED, null)));

        RunState state = router.route(session, new ScriptedRunEventSource(
                runCreated(), requiresAction(toolCall("call_9", "unknown_tool", Map.of()))));

        assertEquals(RunState.TERMINAL, state);
        ToolResultEnvelope envelope = captureSubmission().get("call_9");
        assertFalse(envelope.isStatus());
        assertEquals("unknown tool: unknown_tool", envelope.getMessage());
        assertNull(envelope.getResult());
        assertEquals(ToolFailureKind.UNKNOWN_TOOL, envelope.getFailureKind());
        assertEquals(EventKind.STATUS, channel.getEvents().get(channel.getEvents().size() - 1).kind());
    }

    @Test
    void shouldSubmitOneResultPerCallInBatch() {
        when(gateway.submitToolResults(eq(THREAD_ID), eq(RUN_ID), anyMap()))
                .thenReturn(new ScriptedRunEventSource(terminal(RunStatus.COMPLETED, null)));

        router.route(session, new ScriptedRunEventSource(runCreated(), requiresAction(
                toolCall("call_a", "lookup", Map.of("id", 1)),
                toolCall("call_b", "lookup", Map.of("id", 2)))));

        assertEquals(2, channel.eventsOfKind(EventKind.TOOL_CALL).size());
        Map<String, ToolResultEnvelope> submitted = captureSubmission();
        assertEquals(List.of("call_a", "call_b"), List.copyOf(submitted.keySet()));
        verify(gateway, times(1)).submitToolResults(anyString(), anyString(), anyMap());
    }

    @Test
    void shouldEmitErrorWhenToolResultSubmissionFails() {
        when(gateway.submitToolResults(eq(THREAD_ID), eq(RUN_ID), anyMap()))
                .thenThrow(new AgentGatewayException("run expired", 400, null));

        RunState state = router.route(session, new ScriptedRunEventSource(
                runCreated(), requiresAction(toolCall("call_1", "lookup", Map.of("id", 1)))));

        assertEquals(RunState.TERMINAL, state);
        StreamEvent error = channel.eventsOfKind(EventKind.ERROR).get(0);
        assertEquals("failed to submit tool results: run expired", error.payloadText("message"));
        assertNull(session.getActiveRunId());
    }

    // ==================== failures ====================

    @Test
    void shouldEmitErrorWhenStreamEndsBeforeTerminalStatus() {
        ScriptedRunEventSource source = new ScriptedRunEventSource(runCreated(), delta("partial"));

        RunState state = router.route(session, source);

        assertEquals(RunState.TERMINAL, state);
        List<StreamEvent> events = channel.getEvents();
        assertEquals(2, events.size());
        StreamEvent error = events.get(1);
        assertEquals(EventKind.ERROR, error.kind());
        assertEquals(2L, error.sequenceNo());
        assertEquals(RunEventRouter.STREAM_ENDED_MESSAGE, error.payloadText("message"));
        assertEquals(RUN_ID, error.payloadText("runId"));
        assertNull(session.getActiveRunId());
        assertTrue(source.isClosed());
    }

    @Test
    void shouldEmitTransportErrorWhenStreamFails() {
        router.route(session, new ScriptedRunEventSource(runCreated(),
                new AgentGatewayException("connection reset")));

        StreamEvent error = channel.getEvents().get(0);
        assertEquals(EventKind.ERROR, error.kind());
        assertEquals("connection reset", error.payloadText("message"));
        assertEquals("transport", error.payloadText("source"));
    }

    @Test
    void shouldEmitProviderErrorAndStop() {
        RunNotification providerError = RunNotification.builder()
                .type(RunNotificationType.ERROR)
                .sourceEvent("error")
                .errorMessage("rate limited")
                .build();
        ScriptedRunEventSource source = new ScriptedRunEventSource(runCreated(), providerError, delta("ignored"));

        router.route(session, source);

        assertEquals(1, channel.getEvents().size());
        StreamEvent error = channel.getEvents().get(0);
        assertEquals("rate limited", error.payloadText("message"));
        assertEquals("provider", error.payloadText("source"));
        assertEquals(1, source.remaining());
    }

    @Test
    void shouldReportPreStreamFailureAsSingleErrorEvent() {
        StreamEvent event = router.reportFailure(session, "backend unavailable");

        assertEquals(EventKind.ERROR, event.kind());
        assertEquals(1L, event.sequenceNo());
        assertEquals(List.of(event), channel.getEvents());
        verify(gateway, never()).submitToolResults(any(), any(), any());
    }

    // ==================== slow channels ====================

    @Test
    void shouldFinishRunAndAllowAttachWhileNetworkChannelIsStalled() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        OutputChannelPort stalled = mock(OutputChannelPort.class);
        when(stalled.getChannelType()).thenReturn("redis");
        when(stalled.isRunning()).thenReturn(true);
        when(stalled.publish(any())).thenAnswer(invocation -> {
            release.await(10, TimeUnit.SECONDS);
            return PublishOutcome.delivered("redis");
        });
        properties.getChannels().setActive(List.of(RecordingChannel.TYPE, "redis"));
        ChannelFanOutService fanOut = new ChannelFanOutService(List.of(channel, stalled), properties);
        RunEventRouter slowRouter = new RunEventRouter(fanOut, toolInvoker, gateway, clock);
        ScriptedRunEventSource source = new ScriptedRunEventSource(
                runCreated(),
                messageCreated(),
                delta("Hi"),
                messageCompleted(null),
                terminal(RunStatus.COMPLETED, null));

        try {
            RunState state = assertTimeoutPreemptively(Duration.ofSeconds(2), () -> slowRouter.route(session, source));
            assertEquals(RunState.TERMINAL, state);
            assertEquals(3, channel.getEvents().size());

            ExecutorService attacher = Executors.newSingleThreadExecutor();
            try {
                Future<Integer> replayed = attacher.submit(
                        () -> session.exclusive(() -> session.getHistory().replayAfter(0).events().size()));
                assertEquals(3, replayed.get(1, TimeUnit.SECONDS));
            } finally {
                attacher.shutdownNow();
            }
        } finally {
            release.countDown();
        }
        verify(stalled, timeout(2000).times(3)).publish(any());
        fanOut.stopAll();
    }

    @SuppressWarnings("unchecked")
    private Map<String, ToolResultEnvelope> captureSubmission() {
        ArgumentCaptor<Map<String, ToolResultEnvelope>> captor = ArgumentCaptor.forClass(Map.class);
        verify(gateway).submitToolResults(eq(THREAD_ID), eq(RUN_ID), captor.capture());
        return captor.getValue();
    }

    private static void assertEvent(StreamEvent event, long sequenceNo, EventKind kind, String key, String value) {
        assertEquals(sequenceNo, event.sequenceNo());
        assertEquals(kind, event.kind());
        assertEquals(value, event.payloadText(key));
        assertEquals("agent-1:alice", event.conversationId());
    }

    private static RunNotification runCreated() {
        return RunNotification.builder()
                .type(RunNotificationType.RUN_CREATED)
                .sourceEvent("thread.run.created")
                .threadId(THREAD_ID)
                .runId(RUN_ID)
                .status(RunStatus.QUEUED)
                .build();
    }

    private static RunNotification messageCreated() {
        return RunNotification.builder()
                .type(RunNotificationType.MESSAGE_CREATED)
                .sourceEvent("thread.message.created")
                .threadId(THREAD_ID)
                .runId(RUN_ID)
                .messageId(MESSAGE_ID)
                .build();
    }

    private static RunNotification delta(String text) {
        return RunNotification.builder()
                .type(RunNotificationType.MESSAGE_DELTA)
                .sourceEvent("thread.message.delta")
                .messageId(MESSAGE_ID)
                .text(text)
                .build();
    }

    private static RunNotification messageCompleted(String text) {
        return RunNotification.builder()
                .type(RunNotificationType.MESSAGE_COMPLETED)
                .sourceEvent("thread.message.completed")
                .threadId(THREAD_ID)
                .runId(RUN_ID)
                .messageId(MESSAGE_ID)
                .text(text)
                .build();
    }

    private static RunNotification requiresAction(ToolCall... calls) {
        return RunNotification.builder()
                .type(RunNotificationType.REQUIRES_ACTION)
                .sourceEvent("thread.run.requires_action")
                .threadId(THREAD_ID)
                .runId(RUN_ID)
                .status(RunStatus.REQUIRES_ACTION)
                .toolCalls(List.of(calls))
                .build();
    }

    private static RunNotification terminal(RunStatus status, String errorMessage) {
        return RunNotification.builder()
                .type(RunNotificationType.RUN_TERMINAL)
                .sourceEvent("thread.run." + status.wireName())
                .threadId(THREAD_ID)
                .runId(RUN_ID)
                .status(status)
                .errorMessage(errorMessage)
                .build();
    }

    private static ToolCall toolCall(String callId, String toolName, Map<String, Object> arguments) {
        return ToolCall.builder()
                .callId(callId)
                .toolName(toolName)
                .arguments(arguments)
                .rawArguments("{}")
                .originatingRunId(RUN_ID)
                .build();
    }
}
