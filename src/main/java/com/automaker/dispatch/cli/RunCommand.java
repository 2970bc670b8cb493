package com.automaker.dispatch.cli;

import com.automaker.core.engine.ExecutionContext;
import com.automaker.core.engine.FeatureWorkflowService;
import com.automaker.core.events.EventBus;
import com.automaker.core.model.AutomakerException;
import com.automaker.core.model.RunResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;

/**
 * CLI command: automaker run &lt;project-path&gt; &lt;feature-id&gt;
 * <p>
 * Runs one feature in-process and blocks until it finishes, printing its events.
 * Exit code 0 when the feature passes, 1 otherwise.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a single feature and wait for it")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Project directory")
    private String projectPath;

    @Parameters(index = "1", description = "Feature ID")
    private String featureId;

    @Option(names = "--no-worktree", description = "Run directly in the project instead of a git worktree")
    private boolean noWorktree;

    private static final Duration EVENT_DRAIN_TIMEOUT = Duration.ofSeconds(2);

    private final FeatureWorkflowService workflow;
    private final EventBus eventBus;

    public RunCommand(FeatureWorkflowService workflow, EventBus eventBus) {
        this.workflow = workflow;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        EventBus.Subscription subscription = eventBus.subscribe(featureId, ConsoleOutput::event);
        try {
            ExecutionContext ctx = workflow.runFeature(projectPath, featureId, !noWorktree, false);
            ConsoleOutput.info("Running " + featureId + (noWorktree ? " in " + projectPath : " in a worktree"));
            RunResult result = ctx.completion().join();
            drainEvents(subscription);
            System.out.println();
            if (result.passes()) {
                ConsoleOutput.success("Feature " + featureId + " passed");
                return 0;
            }
            ConsoleOutput.error("Feature " + featureId + " did not pass: " + result.message());
            return 1;
        } catch (AutomakerException | IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        } catch (CompletionException e) {
            ConsoleOutput.error("Run failed: " + e.getCause().getMessage());
            return 1;
        } finally {
            subscription.unsubscribe();
        }
    }

    private static void drainEvents(EventBus.Subscription subscription) {
        try {
            subscription.awaitDelivered(EVENT_DRAIN_TIMEOUT);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
