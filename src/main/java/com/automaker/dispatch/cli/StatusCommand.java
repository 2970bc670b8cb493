package com.automaker.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * CLI command: automaker status [--port]
 * <p>
 * Queries a running server for the auto-mode loop state and running features.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show auto-mode status of a running server")
@Component
public class StatusCommand implements Runnable {

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})", defaultValue = "8080")
    private int port;

    private final ObjectMapper objectMapper;

    public StatusCommand(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        URI uri = URI.create("http://localhost:" + port + "/api/v1/auto-mode/status");
        try {
            HttpClient client = HttpClient.newBuilder()
                    .connectTimeout(Duration.ofSeconds(5))
                    .build();
            HttpResponse<String> response = client.send(HttpRequest.newBuilder(uri).GET().build(),
                    HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                ConsoleOutput.error("Server returned HTTP " + response.statusCode());
                return;
            }
            print(objectMapper.readTree(response.body()));
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to Automaker server at localhost:" + port);
            ConsoleOutput.info("Start the server first: automaker serve");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Interrupted.");
        } catch (IOException e) {
            ConsoleOutput.error("Status request failed: " + e.getMessage());
        }
    }

    static void print(JsonNode status) {
        boolean loop = status.path("autoLoopRunning").asBoolean();
        if (loop) {
            ConsoleOutput.success("Auto mode running" + (status.hasNonNull("projectPath")
                    ? " for " + status.get("projectPath").asText()
                    : ""));
        } else {
            ConsoleOutput.info("Auto mode stopped");
        }
        ConsoleOutput.info("Running features: " + status.path("runningCount").asInt());
        for (JsonNode id : status.path("runningFeatures")) {
            System.out.println("  - " + id.asText());
        }
    }
}
