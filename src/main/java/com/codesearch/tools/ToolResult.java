package com.codesearch.tools;

public record ToolResult(String text, boolean error) {

    public static ToolResult success(String text) {
        return new ToolResult(text, false);
    }

    public static ToolResult error(String message) {
        return new ToolResult("Error: " + message, true);
    }
}
