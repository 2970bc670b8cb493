package com.automaker.dispatch.api;

import com.automaker.core.engine.FeatureWorkflowService;
import com.automaker.core.engine.RunningAgent;
import com.automaker.core.scheduler.AutoModeScheduler;
import com.automaker.core.worktree.WorktreeManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST control surface for auto mode. Long-running operations return as soon as the work is
 * accepted; progress and completion arrive on {@code GET /events}.
 */
@RestController
@RequestMapping("/api/v1/auto-mode")
public class AutoModeController {

    private static final Logger log = LoggerFactory.getLogger(AutoModeController.class);

    private final AutoModeScheduler scheduler;
    private final FeatureWorkflowService workflow;
    private final SseStreamingService sseStreamingService;

    public AutoModeController(AutoModeScheduler scheduler,
                              FeatureWorkflowService workflow,
                              SseStreamingService sseStreamingService) {
        this.scheduler = scheduler;
        this.workflow = workflow;
        this.sseStreamingService = sseStreamingService;
    }

    // ── Loop ─────────────────────────────────────────────────────────────────

    @PostMapping("/start")
    public ResponseEntity<Map<String, Object>> start(@RequestBody StartRequest request) {
        requireText(request.projectPath(), "projectPath");
        scheduler.start(request.projectPath(), request.maxConcurrency());
        return ok();
    }

    @PostMapping("/stop")
    public ResponseEntity<Map<String, Object>> stop() {
        int stillRunning = scheduler.stop();
        return ok("runningFeatures", stillRunning);
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        AutoModeScheduler.Status status = scheduler.getStatus();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("isRunning", status.isRunning());
        body.put("autoLoopRunning", status.autoLoopRunning());
        if (status.projectPath() != null) {
            body.put("projectPath", status.projectPath());
        }
        body.put("runningFeatures", status.runningFeatures());
        body.put("runningCount", status.runningCount());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/running-agents")
    public ResponseEntity<Map<String, Object>> runningAgents() {
        List<RunningAgent> agents = workflow.getRunningAgents();
        return ok("agents", agents, "totalCount", agents.size());
    }

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@RequestParam(required = false) String featureId) {
        return sseStreamingService.createEmitter(featureId);
    }

    // ── Feature runs ─────────────────────────────────────────────────────────

    @PostMapping("/stop-feature")
    public ResponseEntity<Map<String, Object>> stopFeature(@RequestBody FeatureRequest request) {
        requireText(request.featureId(), "featureId");
        return ok("stopped", workflow.stopFeature(request.featureId()));
    }

    @PostMapping("/run-feature")
    public ResponseEntity<Map<String, Object>> runFeature(@RequestBody FeatureRequest request) {
        requireFeature(request.projectPath(), request.featureId());
        workflow.runFeature(request.projectPath(), request.featureId(), request.worktreesOrDefault(), false);
        log.info("Accepted run of {}", request.featureId());
        return ok();
    }

    @PostMapping("/resume-feature")
    public ResponseEntity<Map<String, Object>> resumeFeature(@RequestBody FeatureRequest request) {
        requireFeature(request.projectPath(), request.featureId());
        workflow.resumeFeature(request.projectPath(), request.featureId(), request.worktreesOrDefault());
        return ok();
    }

    @PostMapping("/follow-up-feature")
    public ResponseEntity<Map<String, Object>> followUpFeature(@RequestBody FollowUpRequest request) {
        requireFeature(request.projectPath(), request.featureId());
        requireText(request.prompt(), "prompt");
        workflow.followUpFeature(request.projectPath(), request.featureId(), request.prompt(),
                request.imagePaths(), request.useWorktrees() == null || request.useWorktrees());
        return ok();
    }

    @PostMapping("/verify-feature")
    public ResponseEntity<Map<String, Object>> verifyFeature(@RequestBody FeatureRequest request) {
        requireFeature(request.projectPath(), request.featureId());
        workflow.verifyFeature(request.projectPath(), request.featureId());
        return ok();
    }

    @PostMapping("/commit-feature")
    public ResponseEntity<Map<String, Object>> commitFeature(@RequestBody FeatureRequest request) {
        requireFeature(request.projectPath(), request.featureId());
        String hash = workflow.commitFeature(request.projectPath(), request.featureId());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("commitHash", hash);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/revert-feature")
    public ResponseEntity<Map<String, Object>> revertFeature(@RequestBody FeatureRequest request) {
        requireFeature(request.projectPath(), request.featureId());
        Path removed = workflow.revertFeature(request.projectPath(), request.featureId());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("removedPath", removed != null ? removed.toString() : null);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/merge-feature")
    public ResponseEntity<Map<String, Object>> mergeFeature(@RequestBody MergeRequest request) {
        requireFeature(request.projectPath(), request.featureId());
        WorktreeManager.MergeResult result = workflow.mergeFeature(request.projectPath(), request.featureId(),
                request.toMergeOptions());
        return ok("mergedBranch", result.mergedBranch(), "intoBranch", result.intoBranch());
    }

    // ── Queries ──────────────────────────────────────────────────────────────

    @PostMapping("/context-exists")
    public ResponseEntity<Map<String, Object>> contextExists(@RequestBody FeatureRequest request) {
        requireFeature(request.projectPath(), request.featureId());
        return ok("exists", workflow.contextExists(request.projectPath(), request.featureId()));
    }

    @PostMapping("/worktree-status")
    public ResponseEntity<Map<String, Object>> worktreeStatus(@RequestBody FeatureRequest request) {
        requireFeature(request.projectPath(), request.featureId());
        return ok("status", workflow.getWorktreeStatus(request.projectPath(), request.featureId()));
    }

    @PostMapping("/file-diffs")
    public ResponseEntity<Map<String, Object>> fileDiffs(@RequestBody FeatureRequest request) {
        requireFeature(request.projectPath(), request.featureId());
        return ok("diff", workflow.getFileDiffs(request.projectPath(), request.featureId()));
    }

    @PostMapping("/worktrees")
    public ResponseEntity<Map<String, Object>> worktrees(@RequestBody ProjectRequest request) {
        requireText(request.projectPath(), "projectPath");
        List<Map<String, Object>> worktrees = workflow.listWorktrees(request.projectPath()).stream()
                .map(info -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("path", info.path().toString());
                    entry.put("branch", info.branch());
                    entry.put("head", info.head());
                    return entry;
                })
                .toList();
        return ok("worktrees", worktrees);
    }

    @PostMapping("/analyze-project")
    public ResponseEntity<Map<String, Object>> analyzeProject(@RequestBody ProjectRequest request) {
        requireText(request.projectPath(), "projectPath");
        String analysisId = workflow.analyzeProject(request.projectPath()).featureId();
        return ok("analysisId", analysisId);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static void requireFeature(String projectPath, String featureId) {
        requireText(projectPath, "projectPath");
        requireText(featureId, "featureId");
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }

    private static ResponseEntity<Map<String, Object>> ok(Object... keyValues) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            body.put((String) keyValues[i], keyValues[i + 1]);
        }
        return ResponseEntity.ok(body);
    }
}
