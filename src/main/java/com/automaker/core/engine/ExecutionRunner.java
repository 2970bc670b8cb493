package com.automaker.core.engine;

import com.automaker.core.config.AutomakerProperties;
import com.automaker.core.context.DebouncedTranscriptWriter;
import com.automaker.core.context.FeatureContextStore;
import com.automaker.core.events.AutoModeEvents;
import com.automaker.core.events.EventBus;
import com.automaker.core.logging.MdcContext;
import com.automaker.core.metrics.AutomakerMetrics;
import com.automaker.core.model.Feature;
import com.automaker.core.model.FeatureImage;
import com.automaker.core.model.RunResult;
import com.automaker.core.provider.AgentExecutionException;
import com.automaker.core.provider.AgentMessage;
import com.automaker.core.provider.AgentProviderFactory;
import com.automaker.core.provider.AgentRequest;
import com.automaker.core.state.FeatureStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Drives one feature's conversation with a provider to completion or cancellation.
 *
 * <p>Assistant text, tool markers and phase markers are appended to the feature transcript through
 * a debounced writer that is always flushed before {@link #run} returns or throws. A provider
 * error message aborts the run with {@link AgentExecutionException}; cancellation returns
 * {@link RunResult#cancelledByUser()} and is never an error. The runner does not write the final status:
 * it re-reads the feature after the stream ends and reports whether the agent left it passing.
 */
@Service
public class ExecutionRunner {

    private static final Logger log = LoggerFactory.getLogger(ExecutionRunner.class);

    static final String FOLLOW_UP_SEPARATOR = "\n\n---\n\n## Follow-up Session\n\n";
    static final String VERIFICATION_PASSED = "✓ Verification successful: All tests passed\n";
    static final String VERIFICATION_FAILED = "✗ Verification: Tests need attention\n";

    private static final int SUMMARY_CHARS = 500;
    private static final int THINKING_PREVIEW_CHARS = 200;
    private static final int CONTEXT_PREVIEW_LINES = 50;

    private final AgentProviderFactory providerFactory;
    private final FeatureContextStore store;
    private final EventBus eventBus;
    private final AutomakerMetrics metrics;
    private final AutomakerProperties.Provider providerProperties;
    private final FeatureStatusTool statusTool;

    public ExecutionRunner(AgentProviderFactory providerFactory, FeatureContextStore store, EventBus eventBus,
                           AutomakerMetrics metrics, AutomakerProperties properties) {
        this.providerFactory = providerFactory;
        this.store = store;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.providerProperties = properties.getProvider();
        this.statusTool = new FeatureStatusTool(store);
    }

    /**
     * Runs the agent for {@code feature} in the context's working directory.
     *
     * @throws com.automaker.core.provider.ProviderConfigurationException before any provider call
     *         when the model or provider is misconfigured
     * @throws AgentExecutionException when the provider reports an error
     */
    public RunResult run(ExecutionContext ctx, Feature feature, RunRequest request) {
        String projectPath = ctx.projectPath();
        String featureId = feature.id();

        AgentProviderFactory.Selection selection = providerFactory.select(feature.provider(), feature.model());
        MdcContext.setModel(selection.model().modelId());
        log.info("Running {} with provider {}, model {}, thinking {}", featureId, selection.provider().name(),
                selection.model().modelId(), feature.thinkingLevel().value());

        ProjectNotes notes = loadNotes(projectPath);
        List<FeatureImage> images = new ArrayList<>(feature.imagePaths());
        images.addAll(request.images());
        images = resolveImages(projectPath, images);

        String prompt = switch (request.mode()) {
            case INITIAL -> PromptBuilder.build(feature, notes);
            case RESUME -> PromptBuilder.buildResume(feature, notes, request.previousTranscript());
            case FOLLOW_UP -> PromptBuilder.buildFollowUp(feature, notes, request.previousTranscript(),
                    request.instructions(), request.images());
        };

        Integer thinkingBudget = selection.model().supportsThinking()
                ? feature.thinkingLevel().budgetTokens()
                : null;
        AgentRequest agentRequest = new AgentRequest(prompt, selection.model(), ctx.workDir(), projectPath,
                providerProperties.getAllowedTools(), providerProperties.getMaxTurns(), thinkingBudget,
                images, ctx.cancellation());

        long start = System.currentTimeMillis();
        try (DebouncedTranscriptWriter transcript = store.openTranscript(projectPath, featureId)) {
            if (request.mode() != RunRequest.Mode.INITIAL && !transcript.isEmpty()) {
                transcript.append(FOLLOW_UP_SEPARATOR);
                if (request.mode() == RunRequest.Mode.FOLLOW_UP && request.instructions() != null) {
                    transcript.append(request.instructions().strip() + "\n\n");
                }
            }

            phase(ctx, transcript, feature, "planning", "📋 Planning implementation for: ");
            phase(ctx, transcript, feature, "action", "⚡ Executing implementation for: ");

            StringBuilder assistantText = new StringBuilder();
            boolean completed;
            try (Stream<AgentMessage> messages = selection.provider().execute(agentRequest)) {
                completed = consume(ctx, feature, messages, transcript, assistantText);
            } catch (RuntimeException e) {
                if (ctx.cancellation().isCancelled()) {
                    log.info("Run of {} ended by cancellation: {}", featureId, e.getMessage());
                    completed = false;
                } else {
                    throw e;
                }
            } finally {
                metrics.recordExecutionDuration(selection.provider().name(), System.currentTimeMillis() - start);
            }

            if (!completed || ctx.cancellation().isCancelled()) {
                log.info("Run of {} stopped by user", featureId);
                return RunResult.cancelledByUser();
            }

            phase(ctx, transcript, feature, "verification", "✅ Verifying implementation for: ");
            Feature reread = store.loadFeature(projectPath, featureId);
            boolean passes = FeatureStateMachine.passes(reread);
            String verdict = passes ? VERIFICATION_PASSED : VERIFICATION_FAILED;
            transcript.append(verdict);
            eventBus.publish(AutoModeEvents.progress(projectPath, featureId, verdict));

            String summary = summarize(assistantText, start);
            return passes ? RunResult.passed(summary) : RunResult.failed(summary);
        }
    }

    /**
     * Consumes the provider stream.
     *
     * @return false when consumption stopped because of cancellation
     */
    private boolean consume(ExecutionContext ctx, Feature feature, Stream<AgentMessage> messages,
                            DebouncedTranscriptWriter transcript, StringBuilder assistantText) {
        String projectPath = ctx.projectPath();
        String featureId = feature.id();
        var iterator = messages.iterator();
        while (iterator.hasNext()) {
            if (ctx.cancellation().isCancelled()) {
                return false;
            }
            AgentMessage message = iterator.next();
            switch (message.type()) {
                case ASSISTANT_TEXT -> {
                    transcript.appendParagraph(message.text());
                    assistantText.append(message.text());
                    eventBus.publish(AutoModeEvents.progress(projectPath, featureId, message.text()));
                }
                case THINKING -> {
                    String text = message.text() == null ? "" : message.text();
                    String preview = text.length() > THINKING_PREVIEW_CHARS
                            ? text.substring(0, THINKING_PREVIEW_CHARS) + "..."
                            : text;
                    String marker = "\n💭 Thinking: " + preview + "\n";
                    transcript.append(marker);
                    eventBus.publish(AutoModeEvents.progress(projectPath, featureId, marker));
                }
                case TOOL_USE -> {
                    transcript.append("\n🔧 Tool: " + message.toolName() + "\n");
                    eventBus.publish(AutoModeEvents.tool(projectPath, featureId, message.toolName(),
                            message.toolInput()));
                    if (isStatusTool(message.toolName())) {
                        applyStatusUpdate(projectPath, feature, message.toolInput());
                    }
                }
                case ERROR -> {
                    log.warn("Provider reported error for {}: {}", featureId, message.text());
                    throw new AgentExecutionException(message.text(),
                            message.errorType() != null ? message.errorType() : AutoModeEvents.ERROR_TYPE_EXECUTION);
                }
                case RESULT -> transcript.flush();
            }
        }
        return !ctx.cancellation().isCancelled();
    }

    static boolean isStatusTool(String toolName) {
        return toolName != null
                && (toolName.equals(FeatureStatusTool.NAME) || toolName.endsWith("__" + FeatureStatusTool.NAME));
    }

    /**
     * Applies a status change requested by the agent through the status tool. Only the running
     * feature may be updated; invalid requests are logged and ignored.
     */
    void applyStatusUpdate(String projectPath, Feature feature, Map<String, Object> input) {
        Object requestedId = input.get("featureId");
        if (requestedId != null && !feature.id().equals(requestedId.toString())) {
            log.warn("Ignoring status update for {} issued while running {}", requestedId, feature.id());
            return;
        }
        try {
            statusTool.apply(projectPath, feature, input);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring status update for {}: {}", feature.id(), e.getMessage());
        }
    }

    private void phase(ExecutionContext ctx, DebouncedTranscriptWriter transcript, Feature feature,
                       String phase, String marker) {
        transcript.append(marker + feature.title() + "\n");
        eventBus.publish(AutoModeEvents.phase(ctx.projectPath(), feature.id(), phase,
                marker.substring(marker.indexOf(' ') + 1) + feature.title()));
    }

    private static String summarize(StringBuilder assistantText, long start) {
        String text = assistantText.toString().strip();
        if (text.isEmpty()) {
            return "Feature completed in " + Math.round((System.currentTimeMillis() - start) / 1000.0) + "s";
        }
        return text.length() > SUMMARY_CHARS ? text.substring(0, SUMMARY_CHARS) : text;
    }

    ProjectNotes loadNotes(String projectPath) {
        List<ProjectNotes.ContextFile> files = new ArrayList<>();
        for (Path file : store.listContextFiles(projectPath)) {
            try {
                List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
                String preview = String.join("\n", lines.subList(0, Math.min(CONTEXT_PREVIEW_LINES, lines.size())));
                files.add(new ProjectNotes.ContextFile(file.getFileName().toString(), preview, lines.size()));
            } catch (IOException e) {
                log.debug("Skipping context file {}: {}", file, e.getMessage());
            }
        }
        return new ProjectNotes(store.readMemory(projectPath).orElse(null), files);
    }

    private static List<FeatureImage> resolveImages(String projectPath, List<FeatureImage> images) {
        Path root = Path.of(projectPath).toAbsolutePath();
        return images.stream()
                .map(img -> new FeatureImage(root.resolve(img.path()).normalize().toString(),
                        img.mimeType(), img.filename()))
                .toList();
    }

    // ══════════════════════════════════════════════════════════════════════════
    // PROJECT ANALYSIS
    // ══════════════════════════════════════════════════════════════════════════

    /**
     * Runs a read-only analysis session and writes the final text to
     * {@code .automaker/project-analysis.md}.
     *
     * @return the analysis text, or null when cancelled
     */
    public String analyze(ExecutionContext ctx) {
        String projectPath = ctx.projectPath();
        AgentProviderFactory.Selection selection = providerFactory.select(null, "sonnet");
        AgentRequest request = new AgentRequest(PromptBuilder.ANALYSIS_PROMPT, selection.model(), ctx.workDir(),
                null, List.of("Read", "Glob", "Grep"), 5, null, List.of(), ctx.cancellation());

        String analysis = "";
        try (Stream<AgentMessage> messages = selection.provider().execute(request)) {
            var iterator = messages.iterator();
            while (iterator.hasNext() && !ctx.cancellation().isCancelled()) {
                AgentMessage message = iterator.next();
                switch (message.type()) {
                    case ASSISTANT_TEXT -> {
                        analysis = message.text();
                        eventBus.publish(AutoModeEvents.progress(projectPath, ctx.featureId(), message.text()));
                    }
                    case RESULT -> {
                        if (message.text() != null && !message.text().isBlank()) {
                            analysis = message.text();
                        }
                    }
                    case ERROR -> throw new AgentExecutionException(message.text(),
                            message.errorType() != null ? message.errorType() : AutoModeEvents.ERROR_TYPE_EXECUTION);
                    default -> { }
                }
            }
        }
        if (ctx.cancellation().isCancelled()) {
            return null;
        }
        Path file = store.writeProjectAnalysis(projectPath, analysis);
        log.info("Project analysis written to {}", file);
        return analysis;
    }
}
