package com.automaker.core.context;

import com.automaker.core.config.AutomakerProperties;
import com.automaker.core.model.Feature;
import com.automaker.core.model.FeatureNotFoundException;
import com.automaker.core.model.FeatureStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeatureContextStoreTest {

    @TempDir
    Path project;

    private FeatureContextStore store;
    private String projectPath;

    @BeforeEach
    void setUp() {
        AutomakerProperties props = new AutomakerProperties();
        props.getTranscript().setDebounceMs(10);
        store = new FeatureContextStore(props);
        projectPath = project.toString();
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    private void writeRaw(String id, String json) throws Exception {
        Path dir = project.resolve(".automaker/features").resolve(id);
        Files.createDirectories(dir);
        Files.writeString(dir.resolve("feature.json"), json);
    }

    @Nested
    @DisplayName("metadata")
    class Metadata {

        @Test
        void loadMissingFeatureThrows() {
            assertThrows(FeatureNotFoundException.class, () -> store.loadFeature(projectPath, "nope"));
            assertTrue(store.findFeature(projectPath, "nope").isEmpty());
        }

        @Test
        void listOnProjectWithoutAutomakerDirIsEmpty() {
            assertTrue(store.listFeatures(projectPath).isEmpty());
        }

        @Test
        void saveThenLoad() {
            store.saveFeature(projectPath, Feature.backlog("f1", "auth", "Add login", List.of("one", "two")));

            Feature loaded = store.loadFeature(projectPath, "f1");
            assertEquals("Add login", loaded.description());
            assertEquals(List.of("one", "two"), loaded.steps());
            assertEquals(FeatureStatus.BACKLOG, loaded.status());
        }

        @Test
        void unreadableFeatureIsSkippedInListing() throws Exception {
            writeRaw("a", "{\"id\":\"a\",\"description\":\"ok\",\"status\":\"backlog\"}");
            writeRaw("b", "{ not json");
            writeRaw("c", "{\"id\":\"c\",\"description\":\"bad status\",\"status\":\"finished\"}");

            List<Feature> features = store.listFeatures(projectPath);

            assertEquals(1, features.size());
            assertEquals("a", features.get(0).id());
        }

        @Test
        void pendingFeaturesSortedByPriorityThenDirectoryName() throws Exception {
            writeRaw("a", "{\"id\":\"a\",\"description\":\"x\",\"status\":\"pending\"}");
            writeRaw("b", "{\"id\":\"b\",\"description\":\"x\",\"status\":\"backlog\",\"priority\":2}");
            writeRaw("c", "{\"id\":\"c\",\"description\":\"x\",\"status\":\"verified\",\"priority\":1}");
            writeRaw("d", "{\"id\":\"d\",\"description\":\"x\",\"status\":\"ready\",\"priority\":1}");
            writeRaw("e", "{\"id\":\"e\",\"description\":\"x\"}");

            List<String> ids = store.loadPendingFeatures(projectPath).stream().map(Feature::id).toList();

            assertEquals(List.of("d", "b", "a", "e"), ids);
        }

        @Test
        void statusUpdatePreservesUnknownFields() throws Exception {
            writeRaw("f1", "{\"id\":\"f1\",\"description\":\"x\",\"status\":\"backlog\",\"boardColumn\":7}");

            store.updateFeatureStatus(projectPath, "f1", FeatureStatus.IN_PROGRESS);

            String raw = Files.readString(project.resolve(".automaker/features/f1/feature.json"));
            assertTrue(raw.contains("\"boardColumn\" : 7"));
            assertTrue(raw.contains("\"status\" : \"in_progress\""));
        }

        @Test
        void waitingApprovalStampsJustFinishedAndOtherStatusesClearIt() {
            store.saveFeature(projectPath, Feature.backlog("f1", null, "x", List.of()));

            Feature waiting = store.updateFeatureStatus(projectPath, "f1", FeatureStatus.WAITING_APPROVAL,
                    "did it", null);
            assertNotNull(waiting.justFinishedAt());
            assertNotNull(waiting.updatedAt());
            assertEquals("did it", waiting.summary());

            Feature verified = store.updateFeatureStatus(projectPath, "f1", FeatureStatus.VERIFIED);
            assertNull(verified.justFinishedAt());
            assertEquals("did it", verified.summary());
        }

        @Test
        void markStartedClearsPreviousError() {
            store.saveFeature(projectPath, Feature.backlog("f1", null, "x", List.of()));
            store.updateFeatureStatus(projectPath, "f1", FeatureStatus.WAITING_APPROVAL, null, "boom");

            Feature started = store.markStarted(projectPath, "f1");

            assertEquals(FeatureStatus.IN_PROGRESS, started.status());
            assertNull(started.error());
            assertNotNull(started.startedAt());
        }

        @Test
        void updateMissingFeatureThrows() {
            assertThrows(FeatureNotFoundException.class,
                    () -> store.updateFeatureStatus(projectPath, "ghost", FeatureStatus.VERIFIED));
        }

        @Test
        void worktreeBindingRoundTrip() {
            store.saveFeature(projectPath, Feature.backlog("f1", null, "x", List.of()));

            Feature bound = store.updateWorktree(projectPath, "f1", "/wt/f1", "feature/f1", "main");
            assertEquals("/wt/f1", bound.worktreePath());
            assertEquals("main", bound.baseBranch());

            Feature cleared = store.clearWorktree(projectPath, "f1");
            assertNull(cleared.worktreePath());
            assertNull(cleared.branchName());
        }

        @Test
        void deleteFeatureRemovesDirectory() {
            store.saveFeature(projectPath, Feature.backlog("f1", null, "x", List.of()));
            store.appendTranscript(projectPath, "f1", "text");

            store.deleteFeature(projectPath, "f1");

            assertFalse(Files.exists(store.featureDir(projectPath, "f1")));
            assertDoesNotThrow(() -> store.deleteFeature(projectPath, "f1"));
        }
    }

    @Nested
    @DisplayName("transcript")
    class TranscriptTests {

        @Test
        void appendCreatesAndExtends() {
            assertFalse(store.contextExists(projectPath, "f1"));

            store.appendTranscript(projectPath, "f1", "first ");
            store.appendTranscript(projectPath, "f1", "second");

            assertTrue(store.contextExists(projectPath, "f1"));
            assertEquals("first second", store.readTranscript(projectPath, "f1").orElseThrow());
        }

        @Test
        void deleteContextKeepsMetadata() {
            store.saveFeature(projectPath, Feature.backlog("f1", null, "x", List.of()));
            store.appendTranscript(projectPath, "f1", "text");

            store.deleteContext(projectPath, "f1");

            assertFalse(store.contextExists(projectPath, "f1"));
            assertTrue(store.findFeature(projectPath, "f1").isPresent());
        }
    }

    @Nested
    @DisplayName("project documents")
    class ProjectDocuments {

        @Test
        void blankMemoryIsAbsent() throws Exception {
            Files.createDirectories(project.resolve(".automaker"));
            Files.writeString(project.resolve(".automaker/memory.md"), "  \n");

            assertTrue(store.readMemory(projectPath).isEmpty());
        }

        @Test
        void memoryIsRead() throws Exception {
            Files.createDirectories(project.resolve(".automaker"));
            Files.writeString(project.resolve(".automaker/memory.md"), "Use tabs");

            assertEquals("Use tabs", store.readMemory(projectPath).orElseThrow());
        }

        @Test
        void contextFilesSortedByName() throws Exception {
            Path ctx = Files.createDirectories(project.resolve(".automaker/context"));
            Files.writeString(ctx.resolve("b.md"), "b");
            Files.writeString(ctx.resolve("a.md"), "a");
            Files.createDirectories(ctx.resolve("nested"));

            List<Path> files = store.listContextFiles(projectPath);

            assertEquals(2, files.size());
            assertEquals("a.md", files.get(0).getFileName().toString());
        }

        @Test
        void analysisIsWritten() throws Exception {
            Path file = store.writeProjectAnalysis(projectPath, "# Analysis");

            assertEquals("# Analysis", Files.readString(file));
            assertEquals("project-analysis.md", file.getFileName().toString());
        }
    }
}
