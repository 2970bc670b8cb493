package com.automaker.core.engine;

import com.automaker.core.model.FeatureAlreadyRunningException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The running set: featureId to its single live {@link ExecutionContext}.
 * <p>
 * Registration is atomic, so two concurrent starts of the same feature cannot both succeed.
 */
@Component
public class RunningFeatureRegistry {

    private static final Logger log = LoggerFactory.getLogger(RunningFeatureRegistry.class);

    private final ConcurrentHashMap<String, ExecutionContext> running = new ConcurrentHashMap<>();

    /**
     * @throws FeatureAlreadyRunningException if the feature already has a live context
     */
    public void register(ExecutionContext context) {
        ExecutionContext existing = running.putIfAbsent(context.featureId(), context);
        if (existing != null) {
            throw new FeatureAlreadyRunningException(context.featureId());
        }
        log.debug("Registered {} ({}), {} running", context.featureId(), context.kind(), running.size());
    }

    /** Removes the context only if it is still the registered one. */
    public void remove(ExecutionContext context) {
        if (running.remove(context.featureId(), context)) {
            log.debug("Released {}, {} running", context.featureId(), running.size());
        }
    }

    /**
     * Signals the feature's cancellation token.
     *
     * @return false when the feature is not running
     */
    public boolean stop(String featureId) {
        ExecutionContext context = running.get(featureId);
        if (context == null) {
            return false;
        }
        context.cancellation().cancel();
        log.info("Stop requested for {}", featureId);
        return true;
    }

    public boolean isRunning(String featureId) {
        return running.containsKey(featureId);
    }

    public Optional<ExecutionContext> get(String featureId) {
        return Optional.ofNullable(running.get(featureId));
    }

    public int size() {
        return running.size();
    }

    public List<String> featureIds() {
        return List.copyOf(running.keySet());
    }

    public List<ExecutionContext> snapshot() {
        return List.copyOf(running.values());
    }
}
