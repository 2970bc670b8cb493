package com.automaker.dispatch.cli;

import com.automaker.core.context.FeatureContextStore;
import com.automaker.core.model.Feature;
import com.automaker.core.model.FeatureNotFoundException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: automaker log &lt;project-path&gt; &lt;feature-id&gt;
 * <p>
 * Prints the feature's status line followed by its full agent transcript.
 */
@Command(name = "log", mixinStandardHelpOptions = true, description = "Show a feature's agent transcript")
@Component
public class LogCommand implements Runnable {

    @Parameters(index = "0", description = "Project directory")
    private String projectPath;

    @Parameters(index = "1", description = "Feature ID")
    private String featureId;

    private final FeatureContextStore store;

    public LogCommand(FeatureContextStore store) {
        this.store = store;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        Feature feature;
        try {
            feature = store.loadFeature(projectPath, featureId);
        } catch (FeatureNotFoundException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }

        ConsoleOutput.info(feature.id() + " [" + feature.status().value() + "] " + feature.title());
        if (feature.error() != null) {
            ConsoleOutput.error(feature.error());
        }
        System.out.println();

        store.readTranscript(projectPath, featureId).ifPresentOrElse(
                System.out::println,
                () -> ConsoleOutput.info("No agent output recorded yet"));
    }
}
