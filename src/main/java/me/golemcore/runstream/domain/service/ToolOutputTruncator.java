package me.golemcore.runstream.domain.service;

import me.golemcore.runstream.infrastructure.config.RunStreamProperties;
import org.springframework.stereotype.Component;

/**
 * Caps serialized tool output at the configured token budget, keeping the
 * tail. Tokens are estimated from character count.
 *
 * <p>
 * The result never exceeds the character budget, so truncating an already
 * truncated value returns it unchanged.
 */
@Component
public class ToolOutputTruncator {

    private static final String MARKER_TEMPLATE = "[truncated %d chars] ";
    private static final double DEFAULT_CHARS_PER_TOKEN = 3.5;

    private final RunStreamProperties properties;

    public ToolOutputTruncator(RunStreamProperties properties) {
        this.properties = properties;
    }

    public int maxChars() {
        RunStreamProperties.ToolsProperties tools = properties.getTools();
        double charsPerToken = tools.getCharsPerToken() > 0 ? tools.getCharsPerToken() : DEFAULT_CHARS_PER_TOKEN;
        long chars = (long) Math.floor(Math.max(0, tools.getMaxOutputTokens()) * charsPerToken);
        return (int) Math.min(Integer.MAX_VALUE, chars);
    }

    public boolean exceedsBudget(String content) {
        return content != null && content.length() > maxChars();
    }

    public String truncate(String content) {
        return truncate(content, maxChars());
    }

    static String truncate(String content, int maxChars) {
        if (content == null || content.length() <= maxChars) {
            return content;
        }
        if (maxChars <= 0) {
            return "";
        }
        int removed = content.length() - maxChars;
        String marker = String.format(MARKER_TEMPLATE, removed);
        // The marker costs characters too, so more of the head has to go.
        while (marker.length() < maxChars) {
            int keep = maxChars - marker.length();
            int actuallyRemoved = content.length() - keep;
            String candidate = String.format(MARKER_TEMPLATE, actuallyRemoved);
            if (candidate.length() == marker.length()) {
                return candidate + content.substring(content.length() - keep);
            }
            marker = candidate;
        }
        return content.substring(content.length() - maxChars);
    }
}
