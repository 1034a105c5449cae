package me.golemcore.runstream.port.outbound;

import me.golemcore.runstream.domain.model.RunNotification;

import java.io.Closeable;

/**
 * Pull-based stream of notifications for one run request.
 */
public interface RunEventSource extends Closeable {

    /**
     * Blocks until the next notification is available.
     *
     * @return the next notification, or null once the stream has ended
     * @throws AgentGatewayException
     *             if the transport fails mid-stream
     */
    RunNotification next();

    @Override
    void close();
}
