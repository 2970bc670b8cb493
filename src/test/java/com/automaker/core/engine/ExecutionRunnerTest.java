package com.automaker.core.engine;

import com.automaker.core.config.AutomakerProperties;
import com.automaker.core.context.FeatureContextStore;
import com.automaker.core.events.AutoModeEvents;
import com.automaker.core.events.AutomakerEvent;
import com.automaker.core.events.EventBus;
import com.automaker.core.metrics.AutomakerMetrics;
import com.automaker.core.model.Feature;
import com.automaker.core.model.FeatureFixtures;
import com.automaker.core.model.FeatureImage;
import com.automaker.core.model.FeatureStatus;
import com.automaker.core.model.RunResult;
import com.automaker.core.model.ThinkingLevel;
import com.automaker.core.provider.AgentExecutionException;
import com.automaker.core.provider.AgentMessage;
import com.automaker.core.provider.AgentProviderFactory;
import com.automaker.core.provider.ProviderConfigurationException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static com.automaker.core.engine.ScriptedAgentProvider.status;
import static org.junit.jupiter.api.Assertions.*;

class ExecutionRunnerTest {

    @TempDir
    Path project;

    private String projectPath;
    private FeatureContextStore store;
    private ScriptedAgentProvider provider;
    private ExecutionRunner runner;
    private final List<AutomakerEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        projectPath = project.toString();
        AutomakerProperties props = new AutomakerProperties();
        props.getTranscript().setDebounceMs(5);
        store = new FeatureContextStore(props);
        EventBus eventBus = new EventBus(Runnable::run, EventBus.DEFAULT_QUEUE_CAPACITY);
        eventBus.subscribeAll(events::add);
        provider = new ScriptedAgentProvider();
        runner = new ExecutionRunner(new AgentProviderFactory(List.of(provider), "opus"), store, eventBus,
                new AutomakerMetrics(new SimpleMeterRegistry()), props);
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    private Feature started(Feature feature) {
        store.saveFeature(projectPath, feature);
        return store.markStarted(projectPath, feature.id());
    }

    private Feature started(String id) {
        return started(Feature.backlog(id, "auth", "Add login page", List.of("Create form")));
    }

    private ExecutionContext ctx(String id) {
        return new ExecutionContext(id, projectPath, ExecutionContext.Kind.RUN, false);
    }

    private String transcript(String id) {
        return store.readTranscript(projectPath, id).orElse("");
    }

    private List<String> eventTypes() {
        return events.stream().map(AutomakerEvent::eventType).toList();
    }

    @Nested
    @DisplayName("initial run")
    class InitialRun {

        @Test
        void agentReportingVerifiedPasses() {
            Feature feature = started("f1");
            provider.then(AgentMessage.text("Implementing the login form"),
                    status("f1", "verified", "Login page added"),
                    AgentMessage.result("done"));

            RunResult result = runner.run(ctx("f1"), feature, RunRequest.initial());

            assertTrue(result.passes());
            assertEquals("Implementing the login form", result.message());
            Feature after = store.loadFeature(projectPath, "f1");
            assertEquals(FeatureStatus.VERIFIED, after.status());
            assertEquals("Login page added", after.summary());

            String text = transcript("f1");
            assertTrue(text.startsWith("📋 Planning implementation for: Add login page\n"));
            assertTrue(text.contains("⚡ Executing implementation for: Add login page\n"));
            assertTrue(text.contains("Implementing the login form"));
            assertTrue(text.contains("🔧 Tool: update_feature_status\n"));
            assertTrue(text.endsWith(ExecutionRunner.VERIFICATION_PASSED));
        }

        @Test
        void publishesPhaseProgressAndToolEvents() {
            Feature feature = started("f1");
            provider.then(AgentMessage.text("hello"), AgentMessage.toolUse("Edit", Map.of("file_path", "a.ts")));

            runner.run(ctx("f1"), feature, RunRequest.initial());

            List<String> phases = events.stream()
                    .filter(e -> e.eventType().equals(AutoModeEvents.PHASE))
                    .map(e -> (String) e.payload().get("phase"))
                    .toList();
            assertEquals(List.of("planning", "action", "verification"), phases);
            assertTrue(eventTypes().contains(AutoModeEvents.TOOL));
            assertTrue(events.stream().anyMatch(e -> e.eventType().equals(AutoModeEvents.PROGRESS)
                    && "hello".equals(e.payload().get("content"))));
        }

        @Test
        void agentNotReportingStatusFails() {
            Feature feature = started("f1");
            provider.then(AgentMessage.text("I could not finish"));

            RunResult result = runner.run(ctx("f1"), feature, RunRequest.initial());

            assertFalse(result.passes());
            assertFalse(result.stopped());
            assertEquals(FeatureStatus.IN_PROGRESS, store.loadFeature(projectPath, "f1").status());
            assertTrue(transcript("f1").endsWith(ExecutionRunner.VERIFICATION_FAILED));
        }

        @Test
        void skipTestsFeatureCannotBeVerifiedByAgent() {
            Feature feature = started(FeatureFixtures.from(Feature.backlog("f1", null, "Tweak copy", List.of()))
                    .withSkipTests(true).build());
            provider.then(status("f1", "verified", "Copy updated"));

            RunResult result = runner.run(ctx("f1"), feature, RunRequest.initial());

            assertTrue(result.passes());
            assertEquals(FeatureStatus.WAITING_APPROVAL, store.loadFeature(projectPath, "f1").status());
        }

        @Test
        void emptyAssistantTextYieldsDurationSummary() {
            Feature feature = started("f1");
            provider.then(status("f1", "verified", "x"));

            RunResult result = runner.run(ctx("f1"), feature, RunRequest.initial());

            assertTrue(result.message().startsWith("Feature completed in "));
        }

        @Test
        void thinkingIsPreviewedInTranscript() {
            Feature feature = started("f1");
            provider.then(AgentMessage.thinking("x".repeat(300)));

            runner.run(ctx("f1"), feature, RunRequest.initial());

            assertTrue(transcript("f1").contains("\n💭 Thinking: " + "x".repeat(200) + "...\n"));
        }
    }

    @Nested
    @DisplayName("request building")
    class RequestBuilding {

        @Test
        void thinkingBudgetFollowsLevelForClaudeModels() {
            Feature feature = started(FeatureFixtures.from(Feature.backlog("f1", null, "x", List.of()))
                    .withModel(null, "sonnet", ThinkingLevel.HIGH).build());

            runner.run(ctx("f1"), feature, RunRequest.initial());

            assertEquals(65536, provider.lastRequest().thinkingBudget());
            assertEquals("claude-sonnet-4-20250514", provider.lastRequest().model().modelId());
        }

        @Test
        void imagesAreResolvedAgainstProject() {
            Feature feature = started(FeatureFixtures.from(Feature.backlog("f1", null, "x", List.of()))
                    .withSpec(null, List.of(new FeatureImage(".automaker/images/a.png", "image/png", "a.png")))
                    .build());

            runner.run(ctx("f1"), feature, RunRequest.initial());

            assertEquals(project.toAbsolutePath().resolve(".automaker/images/a.png").normalize().toString(),
                    provider.lastRequest().images().get(0).path());
        }

        @Test
        void agentWorksInContextDirectory() {
            Feature feature = started("f1");
            ExecutionContext context = ctx("f1");
            context.bindWorktree(project.resolve(".worktrees/f1"), "feature/f1");

            runner.run(context, feature, RunRequest.initial());

            assertEquals(project.resolve(".worktrees/f1"), provider.lastRequest().workDir());
            assertEquals(projectPath, provider.lastRequest().projectPath());
        }

        @Test
        void misconfiguredModelFailsBeforeProviderCall() {
            Feature feature = started(FeatureFixtures.from(Feature.backlog("f1", null, "x", List.of()))
                    .withModel("claude", "gpt-5", ThinkingLevel.NONE).build());

            assertThrows(ProviderConfigurationException.class,
                    () -> runner.run(ctx("f1"), feature, RunRequest.initial()));
            assertTrue(provider.requests.isEmpty());
            assertFalse(store.contextExists(projectPath, "f1"));
        }

        @Test
        void notesPreviewFirstFiftyLines() throws Exception {
            Path dir = Files.createDirectories(project.resolve(".automaker/context"));
            Files.writeString(dir.resolve("rules.md"), IntStream.rangeClosed(1, 80)
                    .mapToObj(i -> "line " + i).collect(Collectors.joining("\n")));
            Files.writeString(project.resolve(".automaker/memory.md"), "Remember the cache");

            ProjectNotes notes = runner.loadNotes(projectPath);

            assertEquals("Remember the cache", notes.memory());
            ProjectNotes.ContextFile file = notes.contextFiles().get(0);
            assertEquals(80, file.totalLines());
            assertEquals(50, file.preview().lines().count());
        }
    }

    @Nested
    @DisplayName("errors and cancellation")
    class Failures {

        @Test
        void providerErrorAbortsWithTypeAndKeepsTranscript() {
            Feature feature = started("f1");
            provider.then(AgentMessage.text("Starting"), AgentMessage.error("Invalid API key", "authentication"),
                    AgentMessage.text("never seen"));

            var ex = assertThrows(AgentExecutionException.class,
                    () -> runner.run(ctx("f1"), feature, RunRequest.initial()));

            assertEquals("authentication", ex.getErrorType());
            assertTrue(transcript("f1").contains("Starting"));
            assertFalse(transcript("f1").contains("never seen"));
        }

        @Test
        void cancellationReturnsStopped() {
            Feature feature = started("f1");
            provider.then(request -> Stream.of(AgentMessage.text("first"), AgentMessage.text("second"))
                    .peek(m -> request.cancellation().cancel()));

            RunResult result = runner.run(ctx("f1"), feature, RunRequest.initial());

            assertTrue(result.stopped());
            assertFalse(transcript("f1").contains(ExecutionRunner.VERIFICATION_FAILED));
        }

        @Test
        void streamFailureAfterCancellationIsStillStopped() {
            Feature feature = started("f1");
            provider.then(request -> {
                request.cancellation().cancel();
                return Stream.<AgentMessage>generate(() -> {
                    throw new IllegalStateException("pipe closed");
                });
            });

            assertTrue(runner.run(ctx("f1"), feature, RunRequest.initial()).stopped());
        }
    }

    @Nested
    @DisplayName("resume and follow-up")
    class Continuations {

        @Test
        void resumeAppendsSeparatorAndSendsPreviousContext() {
            Feature feature = started("f1");
            store.appendTranscript(projectPath, "f1", "earlier work");

            runner.run(ctx("f1"), feature, RunRequest.resume("earlier work"));

            assertTrue(transcript("f1").startsWith("earlier work" + ExecutionRunner.FOLLOW_UP_SEPARATOR));
            assertTrue(provider.lastRequest().prompt().contains("## Previous Context"));
        }

        @Test
        void followUpRecordsInstructions() {
            Feature feature = started("f1");
            store.appendTranscript(projectPath, "f1", "earlier work");

            runner.run(ctx("f1"), feature, RunRequest.followUp("earlier work", "Make it blue", List.of()));

            assertTrue(transcript("f1").contains(ExecutionRunner.FOLLOW_UP_SEPARATOR + "Make it blue\n\n"));
            assertTrue(provider.lastRequest().prompt().contains("Make it blue"));
        }

        @Test
        void followUpWithoutPriorTranscriptHasNoSeparator() {
            Feature feature = started("f1");

            runner.run(ctx("f1"), feature, RunRequest.followUp("", "Make it blue", List.of()));

            assertFalse(transcript("f1").contains("Follow-up Session"));
        }
    }

    @Nested
    @DisplayName("status tool")
    class StatusTool {

        @Test
        void recognisesPlainAndNamespacedToolNames() {
            assertTrue(ExecutionRunner.isStatusTool("update_feature_status"));
            assertTrue(ExecutionRunner.isStatusTool("mcp__automaker-tools__update_feature_status"));
            assertFalse(ExecutionRunner.isStatusTool("Edit"));
            assertFalse(ExecutionRunner.isStatusTool(null));
        }

        @Test
        void updatesForOtherFeaturesAreIgnored() {
            Feature feature = started("f1");
            started("f2");

            runner.applyStatusUpdate(projectPath, feature, Map.of("featureId", "f2", "status", "verified"));

            assertEquals(FeatureStatus.IN_PROGRESS, store.loadFeature(projectPath, "f2").status());
        }

        @Test
        void unknownAndBacklogStatusesAreIgnored() {
            Feature feature = started("f1");

            runner.applyStatusUpdate(projectPath, feature, Map.of("status", "done"));
            runner.applyStatusUpdate(projectPath, feature, Map.of("status", "backlog"));

            assertEquals(FeatureStatus.IN_PROGRESS, store.loadFeature(projectPath, "f1").status());
        }

        @Test
        void waitingApprovalIsRecordedWithSummary() {
            Feature feature = started("f1");

            runner.applyStatusUpdate(projectPath, feature,
                    Map.of("featureId", "f1", "status", "waiting_approval", "summary", "Needs a design review"));

            Feature after = store.loadFeature(projectPath, "f1");
            assertEquals(FeatureStatus.WAITING_APPROVAL, after.status());
            assertEquals("Needs a design review", after.summary());
        }
    }

    @Test
    void analysisWritesFinalText() throws Exception {
        provider.then(AgentMessage.text("draft"), AgentMessage.text("# Final analysis"), AgentMessage.result(""));
        var context = new ExecutionContext("analysis-1", projectPath, ExecutionContext.Kind.ANALYSIS, false);

        String analysis = runner.analyze(context);

        assertEquals("# Final analysis", analysis);
        assertEquals("# Final analysis", Files.readString(project.resolve(".automaker/project-analysis.md")));
        assertEquals(List.of("Read", "Glob", "Grep"), provider.lastRequest().allowedTools());
    }
}
