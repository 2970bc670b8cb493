package com.automaker.core.provider;

import com.automaker.core.model.FeatureImage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Drives the {@code claude} CLI in print mode with {@code stream-json} output.
 *
 * <p>Without images the prompt is piped as plain text. With images the input switches to
 * {@code stream-json} and a single user message carries the prompt plus base64 image blocks.
 * The thinking budget is passed through {@code MAX_THINKING_TOKENS}. When a status tool launcher
 * is configured, the stdio tool server is registered inline with {@code --mcp-config} and its
 * tool is added to the allow-list.
 */
public class ClaudeCliProvider extends ProcessAgentProvider {

    private static final Logger log = LoggerFactory.getLogger(ClaudeCliProvider.class);

    private final String command;
    private final StatusToolLauncher statusTool;

    public ClaudeCliProvider(String command) {
        this(command, null);
    }

    public ClaudeCliProvider(String command, StatusToolLauncher statusTool) {
        this.command = command;
        this.statusTool = statusTool;
    }

    @Override
    public String name() {
        return "claude";
    }

    @Override
    public ModelFamily family() {
        return ModelFamily.CLAUDE;
    }

    @Override
    protected String executable() {
        return command;
    }

    @Override
    protected List<String> buildCommand(AgentRequest request) {
        List<String> cmd = new ArrayList<>(List.of(
                command, "-p",
                "--output-format", "stream-json",
                "--verbose",
                "--model", request.model().modelId(),
                "--max-turns", String.valueOf(request.maxTurns()),
                "--permission-mode", "acceptEdits"));
        List<String> allowedTools = new ArrayList<>(request.allowedTools());
        if (exposesStatusTool(request)) {
            cmd.add("--mcp-config");
            cmd.add(mcpConfig(request.projectPath()));
            allowedTools.add(StatusToolLauncher.qualifiedToolName());
        }
        if (!allowedTools.isEmpty()) {
            cmd.add("--allowedTools");
            cmd.add(String.join(",", allowedTools));
        }
        if (!request.images().isEmpty()) {
            cmd.add("--input-format");
            cmd.add("stream-json");
        }
        return cmd;
    }

    private boolean exposesStatusTool(AgentRequest request) {
        return statusTool != null && request.projectPath() != null;
    }

    /** {@code {"mcpServers":{"automaker-tools":{"type":"stdio","command":...,"args":[...]}}}} */
    String mcpConfig(String projectPath) {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode server = root.putObject("mcpServers").putObject(StatusToolLauncher.SERVER_NAME);
        server.put("type", "stdio");
        server.put("command", statusTool.executable());
        ArrayNode args = server.putArray("args");
        statusTool.arguments(projectPath).forEach(args::add);
        return root.toString();
    }

    @Override
    protected Map<String, String> environment(AgentRequest request) {
        if (request.thinkingBudget() == null) {
            return Map.of();
        }
        return Map.of("MAX_THINKING_TOKENS", String.valueOf(request.thinkingBudget()));
    }

    @Override
    protected void writeInput(OutputStream stdin, AgentRequest request) throws IOException {
        if (request.images().isEmpty()) {
            stdin.write(request.prompt().getBytes(StandardCharsets.UTF_8));
            return;
        }
        stdin.write(objectMapper.writeValueAsBytes(userMessage(request)));
        stdin.write('\n');
    }

    ObjectNode userMessage(AgentRequest request) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("type", "user");
        ObjectNode message = root.putObject("message");
        message.put("role", "user");
        ArrayNode content = message.putArray("content");
        content.addObject().put("type", "text").put("text", request.prompt());
        for (FeatureImage image : request.images()) {
            try {
                byte[] bytes = Files.readAllBytes(Path.of(image.path()));
                ObjectNode block = content.addObject();
                block.put("type", "image");
                block.putObject("source")
                        .put("type", "base64")
                        .put("media_type", image.mimeType() != null ? image.mimeType() : "image/png")
                        .put("data", Base64.getEncoder().encodeToString(bytes));
            } catch (IOException e) {
                log.warn("Skipping unreadable image {}: {}", image.path(), e.getMessage());
            }
        }
        return root;
    }

    @Override
    protected List<AgentMessage> parseEvent(JsonNode event) {
        String type = event.path("type").asText();
        switch (type) {
            case "assistant":
                return parseAssistant(event);
            case "result":
                String result = event.path("result").asText("");
                if (event.path("is_error").asBoolean(false)) {
                    return List.of(errorFor(result.isEmpty() ? "Claude reported an error result" : result));
                }
                return List.of(AgentMessage.result(result));
            case "error":
                return List.of(errorFor(event.path("error").path("message").asText(event.path("error").asText("Unknown error"))));
            default:
                // system init, user tool results, stream events
                return List.of();
        }
    }

    private List<AgentMessage> parseAssistant(JsonNode event) {
        if (event.hasNonNull("error")) {
            String error = event.path("error").asText();
            if ("authentication_failed".equals(error)) {
                return List.of(AgentMessage.error(
                        "Authentication failed: invalid or expired API key. Set ANTHROPIC_API_KEY or run 'claude login'.",
                        ProviderConfigurationException.AUTHENTICATION));
            }
            return List.of(errorFor(error));
        }
        List<AgentMessage> messages = new ArrayList<>();
        for (JsonNode block : event.path("message").path("content")) {
            switch (block.path("type").asText()) {
                case "text" -> {
                    String text = block.path("text").asText("");
                    if (isAuthFailure(text)) {
                        messages.add(AgentMessage.error(
                                "Authentication failed: " + text.strip(),
                                ProviderConfigurationException.AUTHENTICATION));
                    } else if (!text.isEmpty()) {
                        messages.add(AgentMessage.text(text));
                    }
                }
                case "tool_use" -> messages.add(AgentMessage.toolUse(
                        block.path("name").asText(), toMap(block.path("input"))));
                case "thinking" -> messages.add(AgentMessage.thinking(block.path("thinking").asText("")));
                default -> { }
            }
        }
        return messages;
    }
}
