package me.golemcore.runstream.adapter.outbound.gateway;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.runstream.domain.model.RunNotification;
import me.golemcore.runstream.domain.model.RunNotificationType;
import me.golemcore.runstream.port.outbound.AgentGatewayException;
import me.golemcore.runstream.port.outbound.RunEventSource;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;

import java.io.IOException;

/**
 * Reads a {@code text/event-stream} response one event at a time.
 *
 * <p>
 * Lines are accumulated until a blank line dispatches the event: {@code event:}
 * sets the name, {@code data:} lines are joined with newlines, comments
 * ({@code :}) and other fields are skipped. The stream ends at EOF or after the
 * {@code done} notification.
 */
@Slf4j
class AssistantsSseEventSource implements RunEventSource {

    private final Response response;
    private final BufferedSource source;
    private final AssistantsEventMapper mapper;
    private boolean finished;

    AssistantsSseEventSource(Response response, AssistantsEventMapper mapper) {
        this.response = response;
        ResponseBody body = response.body();
        if (body == null) {
            response.close();
            throw new AgentGatewayException("run stream response has no body", response.code(), null);
        }
        this.source = body.source();
        this.mapper = mapper;
    }

    @Override
    public RunNotification next() {
        if (finished) {
            return null;
        }
        String eventName = null;
        StringBuilder data = null;
        try {
            while (true) {
                String line = source.readUtf8Line();
                if (line == null) {
                    finished = true;
                    if (data == null) {
                        return null;
                    }
                    return dispatch(eventName, data);
                }
                if (line.isEmpty()) {
                    if (data == null && eventName == null) {
                        continue;
                    }
                    return dispatch(eventName, data);
                }
                if (line.startsWith(":")) {
                    continue;
                }
                String field = fieldName(line);
                String value = fieldValue(line);
                if ("event".equals(field)) {
                    eventName = value;
                } else if ("data".equals(field)) {
                    if (data == null) {
                        data = new StringBuilder(value);
                    } else {
                        data.append('\n').append(value);
                    }
                }
            }
        } catch (IOException e) {
            finished = true;
            throw new AgentGatewayException("run stream interrupted: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        finished = true;
        response.close();
    }

    private RunNotification dispatch(String eventName, StringBuilder data) {
        RunNotification notification = mapper.map(eventName, data != null ? data.toString() : null);
        if (notification.type() == RunNotificationType.DONE) {
            finished = true;
        }
        log.trace("[Gateway] SSE {} -> {}", eventName, notification.type());
        return notification;
    }

    private static String fieldName(String line) {
        int colon = line.indexOf(':');
        return colon < 0 ? line : line.substring(0, colon);
    }

    private static String fieldValue(String line) {
        int colon = line.indexOf(':');
        if (colon < 0) {
            return "";
        }
        String value = line.substring(colon + 1);
        return value.startsWith(" ") ? value.substring(1) : value;
    }
}
