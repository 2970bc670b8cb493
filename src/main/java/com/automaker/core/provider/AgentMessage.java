package com.automaker.core.provider;

import java.util.Map;

/**
 * One message from a provider's stream.
 *
 * @param type      message variant
 * @param text      prose for TEXT and THINKING, final text for RESULT, message for ERROR
 * @param toolName  tool name for TOOL_USE
 * @param toolInput tool arguments for TOOL_USE
 * @param errorType "authentication" or "execution" for ERROR
 */
public record AgentMessage(Type type, String text, String toolName, Map<String, Object> toolInput,
                           String errorType) {

    public enum Type {
        ASSISTANT_TEXT,
        TOOL_USE,
        THINKING,
        ERROR,
        RESULT
    }

    public static AgentMessage text(String text) {
        return new AgentMessage(Type.ASSISTANT_TEXT, text, null, null, null);
    }

    public static AgentMessage toolUse(String toolName, Map<String, Object> input) {
        return new AgentMessage(Type.TOOL_USE, null, toolName, input == null ? Map.of() : input, null);
    }

    public static AgentMessage thinking(String text) {
        return new AgentMessage(Type.THINKING, text, null, null, null);
    }

    public static AgentMessage error(String message, String errorType) {
        return new AgentMessage(Type.ERROR, message, null, null, errorType);
    }

    public static AgentMessage result(String text) {
        return new AgentMessage(Type.RESULT, text, null, null, null);
    }
}
