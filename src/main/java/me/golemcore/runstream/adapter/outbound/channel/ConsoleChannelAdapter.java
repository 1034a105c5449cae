package me.golemcore.runstream.adapter.outbound.channel;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.runstream.domain.model.PublishOutcome;
import me.golemcore.runstream.domain.model.StreamEvent;
import me.golemcore.runstream.port.outbound.OutputChannelPort;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Writes run output to the process console. Fragments are printed inline as
 * they arrive and a finalized message ends the line; a message that finalizes
 * without any streamed fragment is printed whole. Tool calls, status changes
 * and errors get one line each.
 */
@Component
@Slf4j
public class ConsoleChannelAdapter implements OutputChannelPort {

    static final String CHANNEL_TYPE = "console";

    private final PrintStream out;
    private final Set<String> streamedMessages = ConcurrentHashMap.newKeySet();
    private volatile boolean running;

    public ConsoleChannelAdapter() {
        this(System.out);
    }

    ConsoleChannelAdapter(PrintStream out) {
        this.out = out;
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
        out.flush();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public PublishOutcome publish(StreamEvent event) {
        switch (event.kind()) {
        case FRAGMENT -> {
            streamedMessages.add(messageKey(event));
            out.print(event.payloadText("delta"));
        }
        case FINALIZED -> {
            if (!streamedMessages.remove(messageKey(event))) {
                String text = event.payloadText("text");
                if (text != null) {
                    out.print(text);
                }
            }
            out.println();
        }
        case TOOL_CALL -> out.println("[tool] " + event.payloadText("toolName") + " "
                + event.payloadText("arguments"));
        case STATUS -> out.println("[run " + event.payloadText("status") + "]");
        case ERROR -> out.println("[error] " + event.payloadText("message"));
        case GAP -> {
            return PublishOutcome.skipped(CHANNEL_TYPE, "gap markers are not printed");
        }
        default -> {
            return PublishOutcome.skipped(CHANNEL_TYPE, "unsupported kind");
        }
        }
        out.flush();
        return PublishOutcome.delivered(CHANNEL_TYPE);
    }

    private static String messageKey(StreamEvent event) {
        String messageId = event.messageId() != null ? event.messageId() : "";
        return event.conversationId() + "/" + messageId;
    }
}
