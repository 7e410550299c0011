package me.golemcore.mailgate.tools;

import java.util.List;
import java.util.Map;

/**
 * Argument helpers shared by the email tools.
 */
final class ToolArguments {

    private ToolArguments() {
    }

    static String requireString(Map<String, Object> parameters, String name) {
        Object value = parameters.get(name);
        if (value == null || String.valueOf(value).isBlank()) {
            throw new IllegalArgumentException("Missing required argument: " + name);
        }
        return String.valueOf(value);
    }

    static String optionalString(Map<String, Object> parameters, String name, String defaultValue) {
        Object value = parameters.get(name);
        return value != null ? String.valueOf(value) : defaultValue;
    }

    static int optionalInt(Map<String, Object> parameters, String name, int defaultValue) {
        Object value = parameters.get(name);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Argument " + name + " is not a number: " + text, e);
            }
        }
        return defaultValue;
    }

    static List<String> stringList(Map<String, Object> parameters, String name) {
        Object value = parameters.get(name);
        if (value instanceof List<?> items) {
            return items.stream().map(String::valueOf).toList();
        }
        if (value instanceof String text && !text.isBlank()) {
            return List.of(text.split("\\s*,\\s*"));
        }
        return List.of();
    }
}
