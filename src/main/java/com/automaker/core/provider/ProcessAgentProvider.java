package com.automaker.core.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Base for providers that drive a vendor CLI emitting one JSON event per stdout line.
 *
 * <p>The prompt is written to the subprocess's stdin. Stdout is read lazily as the returned
 * stream is consumed; stderr is collected on a background thread and quoted when the process
 * exits non-zero. Cancelling the request's token destroys the process and ends the stream.
 */
public abstract class ProcessAgentProvider implements AgentProvider {

    private static final Logger log = LoggerFactory.getLogger(ProcessAgentProvider.class);

    private static final List<String> AUTH_FAILURE_MARKERS = List.of(
            "invalid api key",
            "authentication_failed",
            "fix external api key",
            "401 unauthorized",
            "invalid_api_key",
            "not logged in",
            "please run /login");

    private static final int STDERR_TAIL_LINES = 20;

    protected final ObjectMapper objectMapper = new ObjectMapper();

    /** Full command line, executable first. */
    protected abstract List<String> buildCommand(AgentRequest request);

    /** Writes the prompt (and any inline attachments) to the process's stdin. */
    protected abstract void writeInput(OutputStream stdin, AgentRequest request) throws IOException;

    /** Translates one JSON event into zero or more messages. */
    protected abstract List<AgentMessage> parseEvent(JsonNode event);

    /** Extra environment variables for the subprocess. */
    protected Map<String, String> environment(AgentRequest request) {
        return Map.of();
    }

    /** Executable used for {@link #isAvailable()}. */
    protected abstract String executable();

    @Override
    public Stream<AgentMessage> execute(AgentRequest request) {
        List<String> command = buildCommand(request);
        log.info("Starting {} in {} (model {})", name(), request.workDir(), request.model().modelId());
        log.debug("Command: {}", String.join(" ", command));

        Process process;
        try {
            ProcessBuilder builder = new ProcessBuilder(command).directory(request.workDir().toFile());
            builder.environment().putAll(environment(request));
            process = builder.start();
        } catch (IOException e) {
            throw new ProviderConfigurationException(
                    "%s CLI could not be started (%s): %s. Is it installed and on the PATH?"
                            .formatted(name(), command.get(0), e.getMessage()),
                    ProviderConfigurationException.CONFIGURATION, e);
        }

        StderrCollector stderr = new StderrCollector(process.getErrorStream(), name());
        stderr.start();

        try (OutputStream stdin = process.getOutputStream()) {
            writeInput(stdin, request);
        } catch (IOException e) {
            // the process exited before reading its input; the exit code reports why
            log.warn("{} did not accept input: {}", name(), e.getMessage());
        }

        request.cancellation().onCancel(() -> {
            log.info("Cancelling {} process", name());
            process.destroy();
        });

        BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
        MessageIterator iterator = new MessageIterator(process, reader, stderr, request.cancellation());
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
                        false)
                .onClose(() -> {
                    if (process.isAlive()) {
                        process.destroy();
                    }
                    try {
                        reader.close();
                    } catch (IOException e) {
                        log.debug("Closing {} output failed: {}", name(), e.getMessage());
                    }
                });
    }

    /**
     * Parses one stdout line. Lines that are not JSON objects are logged at debug and skipped.
     */
    List<AgentMessage> parseLine(String line) {
        if (line == null || line.isBlank() || !line.trim().startsWith("{")) {
            if (line != null && !line.isBlank()) {
                log.debug("{}: {}", name(), line);
            }
            return List.of();
        }
        try {
            return parseEvent(objectMapper.readTree(line));
        } catch (JsonProcessingException e) {
            log.debug("Skipping unparseable {} output: {}", name(), line);
            return List.of();
        }
    }

    protected Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return objectMapper.convertValue(node, new TypeReference<Map<String, Object>>() {});
    }

    /** Error message with "authentication" type when the text carries a known auth failure marker. */
    protected static AgentMessage errorFor(String message) {
        return AgentMessage.error(message, isAuthFailure(message)
                ? ProviderConfigurationException.AUTHENTICATION
                : "execution");
    }

    static boolean isAuthFailure(String text) {
        if (text == null) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return AUTH_FAILURE_MARKERS.stream().anyMatch(lower::contains);
    }

    @Override
    public boolean isAvailable() {
        try {
            Process process = new ProcessBuilder(executable(), "--version")
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
            return process.waitFor() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private final class MessageIterator implements Iterator<AgentMessage> {

        private final Process process;
        private final BufferedReader reader;
        private final StderrCollector stderr;
        private final CancellationToken cancellation;
        private final Deque<AgentMessage> buffer = new ArrayDeque<>();
        private boolean finished;
        private boolean sawError;

        MessageIterator(Process process, BufferedReader reader, StderrCollector stderr,
                        CancellationToken cancellation) {
            this.process = process;
            this.reader = reader;
            this.stderr = stderr;
            this.cancellation = cancellation;
        }

        @Override
        public boolean hasNext() {
            while (buffer.isEmpty() && !finished) {
                if (cancellation.isCancelled()) {
                    finished = true;
                    break;
                }
                String line;
                try {
                    line = reader.readLine();
                } catch (IOException e) {
                    if (!cancellation.isCancelled()) {
                        buffer.add(AgentMessage.error(name() + " output could not be read: " + e.getMessage(),
                                "execution"));
                    }
                    finished = true;
                    break;
                }
                if (line == null) {
                    finish();
                    break;
                }
                for (AgentMessage message : parseLine(line)) {
                    if (message.type() == AgentMessage.Type.ERROR) {
                        sawError = true;
                    }
                    buffer.add(message);
                }
            }
            if (cancellation.isCancelled()) {
                buffer.clear();
                return false;
            }
            return !buffer.isEmpty();
        }

        @Override
        public AgentMessage next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return buffer.poll();
        }

        private void finish() {
            finished = true;
            int exitCode;
            try {
                exitCode = process.waitFor();
                stderr.join(1_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroy();
                buffer.add(AgentMessage.error(name() + " was interrupted", "execution"));
                return;
            }
            log.info("{} exited with code {}", name(), exitCode);
            if (exitCode != 0 && !sawError && !cancellation.isCancelled()) {
                String tail = stderr.tail();
                buffer.add(errorFor("%s process exited with code %d%s".formatted(
                        name(), exitCode, tail.isEmpty() ? "" : ": " + tail)));
            }
        }
    }

    /** Drains stderr so the subprocess never blocks on a full pipe, keeping the last lines. */
    private static final class StderrCollector extends Thread {

        private final InputStream stream;
        private final Deque<String> lines = new ArrayDeque<>();

        StderrCollector(InputStream stream, String providerName) {
            super(providerName + "-stderr");
            this.stream = stream;
            setDaemon(true);
        }

        @Override
        public void run() {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.debug("{}: {}", getName(), line);
                    synchronized (lines) {
                        lines.add(line);
                        if (lines.size() > STDERR_TAIL_LINES) {
                            lines.poll();
                        }
                    }
                }
            } catch (IOException e) {
                log.debug("{} closed: {}", getName(), e.getMessage());
            }
        }

        String tail() {
            synchronized (lines) {
                return String.join("\n", lines).trim();
            }
        }
    }
}
