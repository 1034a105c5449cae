package me.golemcore.runstream.port.outbound;

import me.golemcore.runstream.domain.model.PublishOutcome;
import me.golemcore.runstream.domain.model.StreamEvent;

/**
 * Port for output channels that receive every event of every conversation
 * (terminal, browser push-stream, pub/sub bus). Each channel is an
 * independent failure domain.
 */
public interface OutputChannelPort {

    /**
     * Get channel type identifier as used in {@code runstream.channels.active}.
     */
    String getChannelType();

    /**
     * Start the channel.
     */
    void start();

    /**
     * Stop the channel.
     */
    void stop();

    /**
     * Check if channel is running.
     */
    boolean isRunning();

    /**
     * Whether {@link #publish} only touches in-process memory and may run while
     * the conversation is held exclusively. Channels that do I/O return
     * {@code false} and are fed from a dedicated dispatch queue instead.
     */
    default boolean publishesInline() {
        return false;
    }

    /**
     * Deliver one event. May throw; the fan-out isolates failures per channel.
     */
    PublishOutcome publish(StreamEvent event);
}
