package com.automaker.dispatch.cli;

import com.automaker.core.context.FeatureContextStore;
import com.automaker.core.engine.FeatureStatusTool;
import com.automaker.core.model.AutomakerException;
import com.automaker.core.provider.StatusToolLauncher;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

/**
 * CLI command: automaker mcp-status --project &lt;path&gt;
 * <p>
 * Serves the feature status tool over MCP on stdin/stdout. Agent CLIs start this process
 * themselves from the server entry the providers put on their command line, and stop it when the
 * session ends. Stdout carries only JSON-RPC; logging goes to stderr in this mode.
 */
@Command(name = StatusToolLauncher.SUBCOMMAND, mixinStandardHelpOptions = true,
        description = "Serve the feature status tool to an agent CLI over MCP stdio")
@Component
public class McpStatusCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(McpStatusCommand.class);

    static final String SERVER_VERSION = "0.1.0";

    @Option(names = "--project", required = true, description = "Project whose features the tool updates")
    private String projectPath;

    private final FeatureContextStore store;
    private final ObjectMapper objectMapper;

    public McpStatusCommand(FeatureContextStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() throws InterruptedException {
        McpSyncServer server = McpServer.sync(new StdioServerTransportProvider(objectMapper))
                .serverInfo(StatusToolLauncher.SERVER_NAME, SERVER_VERSION)
                .capabilities(McpSchema.ServerCapabilities.builder().tools(false).build())
                .tools(toolSpecification())
                .build();
        log.info("Status tool server ready for {}", projectPath);

        CountDownLatch terminated = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.closeGracefully();
            terminated.countDown();
        }, "mcp-status-shutdown"));
        // the agent CLI ends the session by terminating this process
        terminated.await();
        return 0;
    }

    McpServerFeatures.SyncToolSpecification toolSpecification() {
        FeatureStatusTool tool = new FeatureStatusTool(store);
        McpSchema.Tool definition = new McpSchema.Tool(
                FeatureStatusTool.NAME, FeatureStatusTool.DESCRIPTION, FeatureStatusTool.INPUT_SCHEMA);
        return new McpServerFeatures.SyncToolSpecification(definition,
                (exchange, arguments) -> callTool(tool, arguments));
    }

    /** Failures are returned to the agent as tool errors rather than protocol errors. */
    McpSchema.CallToolResult callTool(FeatureStatusTool tool, Map<String, Object> arguments) {
        try {
            return result(tool.call(projectPath, arguments), false);
        } catch (AutomakerException | IllegalArgumentException e) {
            log.warn("Status tool call rejected: {}", e.getMessage());
            return result(e.getMessage(), true);
        }
    }

    private static McpSchema.CallToolResult result(String text, boolean isError) {
        List<McpSchema.Content> content = List.of(new McpSchema.TextContent(text));
        return new McpSchema.CallToolResult(content, isError);
    }
}
