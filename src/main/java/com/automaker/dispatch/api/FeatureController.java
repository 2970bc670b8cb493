package com.automaker.dispatch.api;

import com.automaker.core.context.FeatureContextStore;
import com.automaker.core.engine.FeatureWorkflowService;
import com.automaker.core.model.Feature;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read access to a project's features for thin clients, plus deletion.
 */
@RestController
@RequestMapping("/api/v1/features")
public class FeatureController {

    private final FeatureContextStore store;
    private final FeatureWorkflowService workflow;

    public FeatureController(FeatureContextStore store, FeatureWorkflowService workflow) {
        this.store = store;
        this.workflow = workflow;
    }

    @GetMapping
    public List<Feature> listFeatures(@RequestParam String projectPath) {
        return store.listFeatures(projectPath);
    }

    @GetMapping("/{featureId}")
    public Feature getFeature(@PathVariable String featureId, @RequestParam String projectPath) {
        return store.loadFeature(projectPath, featureId);
    }

    /**
     * GET /api/v1/features/{id}/transcript returns the agent output so far, empty when none exists yet.
     */
    @GetMapping("/{featureId}/transcript")
    public ResponseEntity<Map<String, Object>> getTranscript(@PathVariable String featureId,
                                                             @RequestParam String projectPath) {
        store.loadFeature(projectPath, featureId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("featureId", featureId);
        body.put("running", workflow.isRunning(featureId));
        body.put("transcript", store.readTranscript(projectPath, featureId).orElse(""));
        return ResponseEntity.ok(body);
    }

    @DeleteMapping("/{featureId}")
    public ResponseEntity<Map<String, Object>> deleteFeature(@PathVariable String featureId,
                                                             @RequestParam String projectPath) {
        workflow.deleteFeature(projectPath, featureId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("featureId", featureId);
        return ResponseEntity.ok(body);
    }
}
