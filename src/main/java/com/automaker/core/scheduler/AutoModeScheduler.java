package com.automaker.core.scheduler;

import com.automaker.core.config.AutomakerProperties;
import com.automaker.core.context.FeatureContextStore;
import com.automaker.core.engine.FeatureWorkflowService;
import com.automaker.core.engine.RunningFeatureRegistry;
import com.automaker.core.events.AutoModeEvents;
import com.automaker.core.events.EventBus;
import com.automaker.core.logging.MdcContext;
import com.automaker.core.metrics.AutomakerMetrics;
import com.automaker.core.model.AutoModeAlreadyRunningException;
import com.automaker.core.model.Feature;
import com.automaker.core.model.FeatureAlreadyRunningException;
import com.automaker.core.provider.CancellationToken;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * The auto-mode control loop. Polls the project's backlog and launches features while the running
 * set is below the concurrency ceiling.
 *
 * <p>The ceiling is checked before each launch and is not a semaphore: a manual run racing the
 * loop may briefly overshoot it by one. Launches are fire-and-forget; the running set is the only
 * accounting. {@link #stop()} ends the loop but leaves running features alone.
 */
@Service
public class AutoModeScheduler {

    private static final Logger log = LoggerFactory.getLogger(AutoModeScheduler.class);

    private final FeatureContextStore store;
    private final FeatureWorkflowService workflow;
    private final RunningFeatureRegistry registry;
    private final EventBus eventBus;
    private final AutomakerMetrics metrics;
    private final AutomakerProperties.AutoMode settings;

    private final Object lock = new Object();
    private Loop loop;

    public AutoModeScheduler(FeatureContextStore store,
                             FeatureWorkflowService workflow,
                             RunningFeatureRegistry registry,
                             EventBus eventBus,
                             AutomakerMetrics metrics,
                             AutomakerProperties properties) {
        this.store = store;
        this.workflow = workflow;
        this.registry = registry;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.settings = properties.getAutoMode();
    }

    /**
     * Snapshot returned by {@link #getStatus()}.
     *
     * @param isRunning       true while the loop runs or any feature is running
     * @param autoLoopRunning true while the loop runs
     * @param projectPath     project the loop is serving, or null
     * @param runningFeatures ids in the running set
     */
    public record Status(boolean isRunning, boolean autoLoopRunning, String projectPath,
                         List<String> runningFeatures, int runningCount) {}

    private static final class Loop {
        final String projectPath;
        final int maxConcurrency;
        final CancellationToken token = new CancellationToken();
        final CountDownLatch wakeUp = new CountDownLatch(1);

        Loop(String projectPath, int maxConcurrency) {
            this.projectPath = projectPath;
            this.maxConcurrency = maxConcurrency;
            token.onCancel(wakeUp::countDown);
        }
    }

    /**
     * Starts the loop for {@code projectPath}.
     *
     * @param maxConcurrency ceiling for the running set; null or non-positive uses the configured default
     * @throws AutoModeAlreadyRunningException if the loop is already running
     */
    public void start(String projectPath, Integer maxConcurrency) {
        int ceiling = maxConcurrency != null && maxConcurrency > 0 ? maxConcurrency : settings.getMaxConcurrency();
        Loop started;
        synchronized (lock) {
            if (loop != null) {
                throw new AutoModeAlreadyRunningException(loop.projectPath);
            }
            started = new Loop(projectPath, ceiling);
            loop = started;
        }
        log.info("Auto mode started for {} with max {} concurrent features", projectPath, ceiling);
        eventBus.publish(AutoModeEvents.started(projectPath, ceiling));

        Thread thread = new Thread(() -> runLoop(started), "auto-mode-loop");
        thread.setDaemon(true);
        thread.start();
    }

    /**
     * Stops the loop. Running features continue.
     *
     * @return the number of features still running
     */
    public int stop() {
        Loop stopping;
        synchronized (lock) {
            stopping = loop;
            loop = null;
        }
        int stillRunning = registry.size();
        if (stopping == null) {
            return stillRunning;
        }
        stopping.token.cancel();
        log.info("Auto mode stopped for {}, {} features still running", stopping.projectPath, stillRunning);
        eventBus.publish(AutoModeEvents.stopped(stopping.projectPath, stillRunning));
        return stillRunning;
    }

    boolean isLoopRunning() {
        synchronized (lock) {
            return loop != null;
        }
    }

    public Status getStatus() {
        String projectPath;
        boolean loopRunning;
        synchronized (lock) {
            loopRunning = loop != null;
            projectPath = loopRunning ? loop.projectPath : null;
        }
        List<String> running = registry.featureIds();
        return new Status(loopRunning || !running.isEmpty(), loopRunning, projectPath, running, running.size());
    }

    @PreDestroy
    void shutdown() {
        stop();
    }

    private void runLoop(Loop state) {
        MdcContext.setProject(state.projectPath);
        try {
            while (!state.token.isCancelled()) {
                try {
                    long pause = iterate(state);
                    sleep(state, pause);
                } catch (RuntimeException e) {
                    log.error("Auto mode iteration failed: {}", e.getMessage(), e);
                    sleep(state, settings.getCapacityPollMs());
                }
            }
        } finally {
            log.debug("Auto mode loop for {} exited", state.projectPath);
            MdcContext.clear();
        }
    }

    /**
     * One pass of the loop.
     *
     * @return how long to sleep before the next pass
     */
    private long iterate(Loop state) {
        if (registry.size() >= state.maxConcurrency) {
            log.debug("At capacity ({}/{})", registry.size(), state.maxConcurrency);
            return settings.getCapacityPollMs();
        }

        List<Feature> pending = store.loadPendingFeatures(state.projectPath);
        if (pending.isEmpty()) {
            eventBus.publish(AutoModeEvents.idle(state.projectPath));
            return settings.getIdlePollMs();
        }

        Optional<Feature> next = pending.stream()
                .filter(f -> !registry.isRunning(f.id()))
                .findFirst();
        if (next.isPresent() && !state.token.isCancelled()) {
            String featureId = next.get().id();
            try {
                workflow.runFeature(state.projectPath, featureId, true, true);
                metrics.recordSchedulerLaunch();
                log.info("Auto mode launched {} ({}/{} running)", featureId, registry.size(), state.maxConcurrency);
            } catch (FeatureAlreadyRunningException e) {
                log.debug("{} was started elsewhere", featureId);
            }
        }
        return settings.getLaunchDelayMs();
    }

    private static void sleep(Loop state, long millis) {
        try {
            state.wakeUp.await(millis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            state.token.cancel();
        }
    }
}
