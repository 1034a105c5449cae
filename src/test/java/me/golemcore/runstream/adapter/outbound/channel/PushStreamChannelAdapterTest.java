package me.golemcore.runstream.adapter.outbound.channel;

import me.golemcore.runstream.domain.model.EventKind;
import me.golemcore.runstream.domain.model.PublishOutcome;
import me.golemcore.runstream.domain.model.StreamEvent;
import me.golemcore.runstream.domain.stream.PushStreamMultiplexer;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PushStreamChannelAdapterTest {

    private final PushStreamMultiplexer multiplexer = mock(PushStreamMultiplexer.class);
    private final PushStreamChannelAdapter adapter = new PushStreamChannelAdapter(multiplexer);

    @Test
    void shouldSkipConversationWithoutConsumers() {
        when(multiplexer.consumerCount("agent-1:alice")).thenReturn(0);

        PublishOutcome outcome = adapter.publish(event());

        assertEquals(PublishOutcome.Status.SKIPPED, outcome.status());
        verify(multiplexer, never()).deliver(any());
    }

    @Test
    void shouldDeliverToAttachedConsumers() {
        StreamEvent event = event();
        when(multiplexer.consumerCount("agent-1:alice")).thenReturn(2);
        when(multiplexer.deliver(event)).thenReturn(2);

        PublishOutcome outcome = adapter.publish(event);

        assertEquals(PublishOutcome.Status.DELIVERED, outcome.status());
        assertEquals("consumers=2", outcome.detail());
    }

    private static StreamEvent event() {
        return StreamEvent.builder()
                .kind(EventKind.FRAGMENT)
                .conversationId("agent-1:alice")
                .payload(Map.of("delta", "x"))
                .sequenceNo(1)
                .timestamp(Instant.EPOCH)
                .build();
    }
}
