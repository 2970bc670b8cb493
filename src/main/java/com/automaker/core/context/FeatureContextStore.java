package com.automaker.core.context;

import com.automaker.core.config.AutomakerProperties;
import com.automaker.core.model.Feature;
import com.automaker.core.model.FeatureNotFoundException;
import com.automaker.core.model.FeatureStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Durable per-feature storage under {@code <project>/.automaker/}.
 *
 * <pre>
 * .automaker/features/&lt;id&gt;/feature.json      metadata
 * .automaker/features/&lt;id&gt;/agent-output.md   append-only agent transcript
 * .automaker/memory.md                          lessons learned, injected into prompts
 * .automaker/context/                           project context files, previewed in prompts
 * </pre>
 *
 * Metadata updates patch the JSON document in place so fields this engine does not know
 * about are preserved.
 */
@Service
public class FeatureContextStore {

    private static final Logger log = LoggerFactory.getLogger(FeatureContextStore.class);

    static final String AUTOMAKER_DIR = ".automaker";
    static final String FEATURES_DIR = "features";
    static final String FEATURE_FILE = "feature.json";
    static final String TRANSCRIPT_FILE = "agent-output.md";
    static final String MEMORY_FILE = "memory.md";
    static final String CONTEXT_DIR = "context";
    static final String ANALYSIS_FILE = "project-analysis.md";

    private static final int NO_PRIORITY = 999;

    private final ObjectMapper objectMapper;
    private final long debounceMs;
    private final ScheduledExecutorService flushTimer;
    private final ConcurrentHashMap<Path, Object> fileLocks = new ConcurrentHashMap<>();

    public FeatureContextStore(AutomakerProperties properties) {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.debounceMs = properties.getTranscript().getDebounceMs();
        this.flushTimer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "transcript-flush");
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        flushTimer.shutdown();
    }

    // ══════════════════════════════════════════════════════════════════════════
    // FEATURE METADATA
    // ══════════════════════════════════════════════════════════════════════════

    public Path featuresDir(String projectPath) {
        return Path.of(projectPath).toAbsolutePath().resolve(AUTOMAKER_DIR).resolve(FEATURES_DIR);
    }

    public Path featureDir(String projectPath, String featureId) {
        return featuresDir(projectPath).resolve(featureId);
    }

    public Optional<Feature> findFeature(String projectPath, String featureId) {
        Path file = featureDir(projectPath, featureId).resolve(FEATURE_FILE);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), Feature.class));
        } catch (IOException e) {
            throw new ContextStoreException("Failed to read " + file, e);
        }
    }

    /**
     * @throws FeatureNotFoundException if the feature has no metadata file
     */
    public Feature loadFeature(String projectPath, String featureId) {
        return findFeature(projectPath, featureId)
                .orElseThrow(() -> new FeatureNotFoundException(featureId));
    }

    /**
     * All readable features, in directory-name order. Unreadable documents are skipped with a warning.
     */
    public List<Feature> listFeatures(String projectPath) {
        Path dir = featuresDir(projectPath);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<Path> featureDirs;
        try (Stream<Path> entries = Files.list(dir)) {
            featureDirs = entries.filter(Files::isDirectory).sorted().toList();
        } catch (IOException e) {
            throw new ContextStoreException("Failed to list " + dir, e);
        }

        List<Feature> features = new ArrayList<>();
        for (Path featureDir : featureDirs) {
            Path file = featureDir.resolve(FEATURE_FILE);
            if (!Files.isRegularFile(file)) {
                continue;
            }
            try {
                features.add(objectMapper.readValue(file.toFile(), Feature.class));
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Skipping unreadable feature {}: {}", featureDir.getFileName(), e.getMessage());
            }
        }
        return features;
    }

    /**
     * Features eligible for the auto-mode loop: pending status, ordered by priority
     * (missing priority sorts last), ties kept in discovery order.
     */
    public List<Feature> loadPendingFeatures(String projectPath) {
        return listFeatures(projectPath).stream()
                .filter(f -> f.status().isPending())
                .sorted(Comparator.comparingInt(f -> f.priority() == null ? NO_PRIORITY : f.priority()))
                .toList();
    }

    /**
     * Writes a complete feature document, creating its directory. Used when features are created.
     */
    public void saveFeature(String projectPath, Feature feature) {
        Path file = featureDir(projectPath, feature.id()).resolve(FEATURE_FILE);
        synchronized (lockFor(file)) {
            try {
                Files.createDirectories(file.getParent());
                objectMapper.writeValue(file.toFile(), feature);
            } catch (IOException e) {
                throw new ContextStoreException("Failed to write " + file, e);
            }
        }
    }

    /**
     * Sets the status, stamping {@code updatedAt}. {@code justFinishedAt} is stamped when entering
     * waiting_approval and cleared otherwise.
     *
     * @param summary optional summary to record (null leaves the existing value)
     * @param error   optional error message to record (null leaves the existing value)
     * @return the feature as re-read after the write
     */
    public Feature updateFeatureStatus(String projectPath, String featureId, FeatureStatus status,
                                       String summary, String error) {
        log.info("Feature {} -> {}", featureId, status);
        return patchFeature(projectPath, featureId, node -> {
            String now = Instant.now().toString();
            node.put("status", status.value());
            node.put("updatedAt", now);
            if (status == FeatureStatus.WAITING_APPROVAL) {
                node.put("justFinishedAt", now);
            } else {
                node.remove("justFinishedAt");
            }
            if (summary != null) {
                node.put("summary", summary);
            }
            if (error != null) {
                node.put("error", error);
            }
        });
    }

    public Feature updateFeatureStatus(String projectPath, String featureId, FeatureStatus status) {
        return updateFeatureStatus(projectPath, featureId, status, null, null);
    }

    /** Moves the feature to in_progress for a new run, clearing the previous error and summary. */
    public Feature markStarted(String projectPath, String featureId) {
        log.info("Feature {} -> {}", featureId, FeatureStatus.IN_PROGRESS);
        return patchFeature(projectPath, featureId, node -> {
            String now = Instant.now().toString();
            node.put("status", FeatureStatus.IN_PROGRESS.value());
            node.put("startedAt", now);
            node.put("updatedAt", now);
            node.remove("justFinishedAt");
            node.remove("error");
            node.remove("summary");
        });
    }

    /** Records the worktree binding for a feature. */
    public Feature updateWorktree(String projectPath, String featureId, String worktreePath,
                                  String branchName, String baseBranch) {
        return patchFeature(projectPath, featureId, node -> {
            node.put("worktreePath", worktreePath);
            node.put("branchName", branchName);
            if (baseBranch != null) {
                node.put("baseBranch", baseBranch);
            }
        });
    }

    public Feature clearWorktree(String projectPath, String featureId) {
        return patchFeature(projectPath, featureId, node -> {
            node.remove("worktreePath");
            node.remove("branchName");
            node.remove("baseBranch");
        });
    }

    /** Deletes the whole feature directory, metadata and transcript included. */
    public void deleteFeature(String projectPath, String featureId) {
        Path dir = featureDir(projectPath, featureId);
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
            log.info("Deleted feature directory {}", dir);
        } catch (IOException e) {
            throw new ContextStoreException("Failed to delete " + dir, e);
        }
    }

    private Feature patchFeature(String projectPath, String featureId, Consumer<ObjectNode> patch) {
        Path file = featureDir(projectPath, featureId).resolve(FEATURE_FILE);
        synchronized (lockFor(file)) {
            if (!Files.isRegularFile(file)) {
                throw new FeatureNotFoundException(featureId);
            }
            try {
                ObjectNode node = (ObjectNode) objectMapper.readTree(file.toFile());
                patch.accept(node);
                objectMapper.writeValue(file.toFile(), node);
                return objectMapper.treeToValue(node, Feature.class);
            } catch (IOException e) {
                throw new ContextStoreException("Failed to update " + file, e);
            }
        }
    }

    private Object lockFor(Path file) {
        return fileLocks.computeIfAbsent(file, k -> new Object());
    }

    // ══════════════════════════════════════════════════════════════════════════
    // TRANSCRIPT
    // ══════════════════════════════════════════════════════════════════════════

    public Path transcriptPath(String projectPath, String featureId) {
        return featureDir(projectPath, featureId).resolve(TRANSCRIPT_FILE);
    }

    public boolean contextExists(String projectPath, String featureId) {
        return Files.isRegularFile(transcriptPath(projectPath, featureId));
    }

    public Optional<String> readTranscript(String projectPath, String featureId) {
        Path file = transcriptPath(projectPath, featureId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ContextStoreException("Failed to read transcript " + file, e);
        }
    }

    /** Appends directly, bypassing any debounce. For markers written outside a running execution. */
    public void appendTranscript(String projectPath, String featureId, String text) {
        try (DebouncedTranscriptWriter writer = openTranscript(projectPath, featureId)) {
            writer.append(text);
        }
    }

    /** Opens a debounced writer for a feature's transcript. The caller must close it. */
    public DebouncedTranscriptWriter openTranscript(String projectPath, String featureId) {
        return new DebouncedTranscriptWriter(transcriptPath(projectPath, featureId), flushTimer, debounceMs);
    }

    /** Removes the transcript only; metadata stays. */
    public void deleteContext(String projectPath, String featureId) {
        try {
            if (Files.deleteIfExists(transcriptPath(projectPath, featureId))) {
                log.info("Deleted agent context for feature {}", featureId);
            }
        } catch (IOException e) {
            throw new ContextStoreException("Failed to delete transcript for " + featureId, e);
        }
    }

    // ══════════════════════════════════════════════════════════════════════════
    // PROJECT-LEVEL DOCUMENTS
    // ══════════════════════════════════════════════════════════════════════════

    /** Contents of {@code .automaker/memory.md}, or empty when absent or blank. */
    public Optional<String> readMemory(String projectPath) {
        Path file = Path.of(projectPath).resolve(AUTOMAKER_DIR).resolve(MEMORY_FILE);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            return content.isBlank() ? Optional.empty() : Optional.of(content);
        } catch (IOException e) {
            log.warn("Could not read memory file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Regular files directly under {@code .automaker/context/}, sorted by name.
     */
    public List<Path> listContextFiles(String projectPath) {
        Path dir = Path.of(projectPath).resolve(AUTOMAKER_DIR).resolve(CONTEXT_DIR);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.filter(Files::isRegularFile).sorted().toList();
        } catch (IOException e) {
            log.warn("Could not list context directory {}: {}", dir, e.getMessage());
            return List.of();
        }
    }

    public Path writeProjectAnalysis(String projectPath, String analysis) {
        Path file = Path.of(projectPath).toAbsolutePath().resolve(AUTOMAKER_DIR).resolve(ANALYSIS_FILE);
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, analysis, StandardCharsets.UTF_8);
            return file;
        } catch (IOException e) {
            throw new ContextStoreException("Failed to write " + file, e);
        }
    }
}
