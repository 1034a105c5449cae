package me.golemcore.runstream.tools;

import java.util.Map;

/**
 * Argument helpers shared by the built-in tools.
 */
final class ToolArguments {

    private ToolArguments() {
    }

    static String requireText(Map<String, Object> arguments, String name) {
        Object value = arguments.get(name);
        if (value == null || value.toString().isBlank()) {
            throw new IllegalArgumentException("Missing required parameter: " + name);
        }
        return value.toString().trim();
    }

    static boolean flag(Map<String, Object> arguments, String name) {
        Object value = arguments.get(name);
        if (value instanceof Boolean bool) {
            return bool;
        }
        return value != null && Boolean.parseBoolean(value.toString().trim());
    }
}
