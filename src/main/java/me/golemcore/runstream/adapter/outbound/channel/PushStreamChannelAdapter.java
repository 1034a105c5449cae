package me.golemcore.runstream.adapter.outbound.channel;

import me.golemcore.runstream.domain.model.PublishOutcome;
import me.golemcore.runstream.domain.model.StreamEvent;
import me.golemcore.runstream.domain.stream.PushStreamMultiplexer;
import me.golemcore.runstream.port.outbound.OutputChannelPort;
import org.springframework.stereotype.Component;

/**
 * Output channel backed by the push-stream multiplexer. Browser clients read
 * the queued events over Server-Sent Events.
 */
@Component
public class PushStreamChannelAdapter implements OutputChannelPort {

    static final String CHANNEL_TYPE = "push-stream";

    private final PushStreamMultiplexer multiplexer;
    private volatile boolean running;

    public PushStreamChannelAdapter(PushStreamMultiplexer multiplexer) {
        this.multiplexer = multiplexer;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public void start() {
        running = true;
    }

    @Override
    public void stop() {
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean publishesInline() {
        return true;
    }

    @Override
    public PublishOutcome publish(StreamEvent event) {
        if (multiplexer.consumerCount(event.conversationId()) == 0) {
            return PublishOutcome.skipped(CHANNEL_TYPE, "no attached consumers");
        }
        int delivered = multiplexer.deliver(event);
        return PublishOutcome.delivered(CHANNEL_TYPE, "consumers=" + delivered);
    }
}
