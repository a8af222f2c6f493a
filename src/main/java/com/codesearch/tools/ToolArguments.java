package com.codesearch.tools;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Typed access to the loosely typed argument map a transport hands to a tool. */
final class ToolArguments {
    private final Map<String, Object> values;

    ToolArguments(Map<String, Object> values) {
        this.values = values == null ? Map.of() : values;
    }

    String requireString(String name) {
        String value = optionalString(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required argument: " + name);
        }
        return value;
    }

    String optionalString(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String)) {
            throw new IllegalArgumentException("Argument " + name + " must be a string");
        }
        return (String) value;
    }

    int optionalInt(int defaultValue, String... names) {
        for (String name : names) {
            Object value = values.get(name);
            if (value == null) {
                continue;
            }
            if (value instanceof Number) {
                return ((Number) value).intValue();
            }
            if (value instanceof String) {
                try {
                    return Integer.parseInt(((String) value).trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Argument " + name + " must be a number", e);
                }
            }
            throw new IllegalArgumentException("Argument " + name + " must be a number");
        }
        return defaultValue;
    }

    List<String> optionalStringList(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof List)) {
            throw new IllegalArgumentException("Argument " + name + " must be an array of strings");
        }
        List<String> out = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (!(item instanceof String)) {
                throw new IllegalArgumentException("Argument " + name + " must be an array of strings");
            }
            out.add((String) item);
        }
        return out;
    }
}
