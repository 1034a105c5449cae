package me.golemcore.runstream.testsupport.stream;

import me.golemcore.runstream.domain.model.RunNotification;
import me.golemcore.runstream.port.outbound.RunEventSource;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Run stream that replays a fixed script. A {@link RuntimeException} in the
 * script is thrown from {@link #next()} instead of being returned; the end of
 * the script ends the stream.
 */
public class ScriptedRunEventSource implements RunEventSource {

    private final Deque<Object> script;
    private volatile boolean closed;

    public ScriptedRunEventSource(Object... steps) {
        this.script = new ArrayDeque<>(Arrays.asList(steps));
    }

    @Override
    public synchronized RunNotification next() {
        Object step = script.pollFirst();
        if (step instanceof RuntimeException failure) {
            throw failure;
        }
        return (RunNotification) step;
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public synchronized int remaining() {
        return script.size();
    }
}
