package com.automaker.core.provider;

import com.automaker.core.model.FeatureImage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Drives {@code codex exec --json}, which prints one JSONL event per thread item.
 *
 * <p>Completed items are translated: {@code agent_message} to text, {@code reasoning} to
 * thinking, command executions, file changes, MCP and web-search calls to tool invocations.
 * {@code turn.failed} and {@code error} events become error messages. Images are passed with
 * {@code --image}; Codex models take no thinking budget. When a status tool launcher is
 * configured, the stdio tool server is declared through {@code -c mcp_servers.*} overrides.
 */
public class CodexCliProvider extends ProcessAgentProvider {

    private final String command;
    private final StatusToolLauncher statusTool;

    public CodexCliProvider(String command) {
        this(command, null);
    }

    public CodexCliProvider(String command, StatusToolLauncher statusTool) {
        this.command = command;
        this.statusTool = statusTool;
    }

    @Override
    public String name() {
        return "codex";
    }

    @Override
    public ModelFamily family() {
        return ModelFamily.CODEX;
    }

    @Override
    protected String executable() {
        return command;
    }

    @Override
    protected List<String> buildCommand(AgentRequest request) {
        List<String> cmd = new ArrayList<>(List.of(
                command, "exec",
                "--json",
                "--model", request.model().modelId(),
                "--full-auto",
                "--skip-git-repo-check",
                "-C", request.workDir().toString()));
        if (statusTool != null && request.projectPath() != null) {
            String prefix = "mcp_servers." + StatusToolLauncher.SERVER_NAME + ".";
            cmd.add("-c");
            cmd.add(prefix + "command=" + tomlValue(statusTool.executable()));
            cmd.add("-c");
            cmd.add(prefix + "args=" + tomlValue(statusTool.arguments(request.projectPath())));
        }
        for (FeatureImage image : request.images()) {
            cmd.add("--image");
            cmd.add(image.path());
        }
        // read the prompt from stdin
        cmd.add("-");
        return cmd;
    }

    /** JSON strings and string arrays are also valid TOML values. */
    private String tomlValue(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode " + value, e);
        }
    }

    @Override
    protected void writeInput(OutputStream stdin, AgentRequest request) throws IOException {
        stdin.write(request.prompt().getBytes(StandardCharsets.UTF_8));
    }

    @Override
    protected List<AgentMessage> parseEvent(JsonNode event) {
        String type = event.path("type").asText();
        switch (type) {
            case "item.completed":
                return parseItem(event.path("item"));
            case "turn.completed":
                return List.of(AgentMessage.result(""));
            case "turn.failed":
                return List.of(errorFor(event.path("error").path("message").asText("Codex turn failed")));
            case "error":
                return List.of(errorFor(event.path("message").asText("Codex reported an error")));
            default:
                return List.of();
        }
    }

    private List<AgentMessage> parseItem(JsonNode item) {
        String itemType = item.path("type").asText();
        switch (itemType) {
            case "agent_message": {
                String text = item.path("text").asText("");
                return text.isEmpty() ? List.of() : List.of(AgentMessage.text(text));
            }
            case "reasoning":
                return List.of(AgentMessage.thinking(item.path("text").asText("")));
            case "command_execution":
                return List.of(AgentMessage.toolUse("Bash",
                        Map.of("command", item.path("command").asText(""))));
            case "file_change": {
                JsonNode changes = item.path("changes");
                return List.of(AgentMessage.toolUse("Edit", Map.of("changes",
                        changes.isArray() ? objectMapper.convertValue(changes, List.class) : List.of())));
            }
            case "mcp_tool_call":
                return List.of(AgentMessage.toolUse(item.path("tool").asText("mcp"),
                        toMap(item.path("arguments"))));
            case "web_search":
                return List.of(AgentMessage.toolUse("WebSearch",
                        Map.of("query", item.path("query").asText(""))));
            case "error":
                return List.of(errorFor(item.path("message").asText("Codex item failed")));
            default:
                return List.of();
        }
    }
}
