package com.automaker.dispatch.api;

import com.automaker.core.provider.AgentProvider;
import com.automaker.core.provider.AgentProviderFactory;
import com.automaker.core.worktree.WorktreeManager;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for engine health: git and provider CLI availability.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final WorktreeManager worktreeManager;
    private final AgentProviderFactory providerFactory;

    public HealthController(WorktreeManager worktreeManager, AgentProviderFactory providerFactory) {
        this.worktreeManager = worktreeManager;
        this.providerFactory = providerFactory;
    }

    /**
     * GET /api/v1/health returns 200 when git and at least one provider are available, 503 otherwise.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> components = new LinkedHashMap<>();
        boolean gitUp = worktreeManager.isGitAvailable();
        components.put("git", gitUp ? "UP" : "DOWN");

        boolean anyProvider = false;
        for (AgentProvider provider : providerFactory.getProviders()) {
            boolean available = provider.isAvailable();
            anyProvider |= available;
            components.put(provider.name(), available ? "UP" : "DOWN");
        }

        boolean up = gitUp && anyProvider;
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", up ? "UP" : "DOWN");
        result.put("components", components);
        return up ? ResponseEntity.ok(result) : ResponseEntity.status(503).body(result);
    }
}
