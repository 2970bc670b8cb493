package com.automaker.dispatch.cli;

import com.automaker.core.context.FeatureContextStore;
import com.automaker.core.model.Feature;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: automaker features &lt;project-path&gt;
 */
@Command(name = "features", mixinStandardHelpOptions = true, description = "List a project's features")
@Component
public class FeaturesCommand implements Runnable {

    @Parameters(index = "0", description = "Project directory")
    private String projectPath;

    private final FeatureContextStore store;

    public FeaturesCommand(FeatureContextStore store) {
        this.store = store;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        List<Feature> features = store.listFeatures(projectPath);
        if (features.isEmpty()) {
            ConsoleOutput.info("No features found under " + store.featuresDir(projectPath));
            return;
        }

        System.out.printf("  %-24s %-18s %-9s %s%n", "ID", "STATUS", "PRIORITY", "TITLE");
        System.out.println("  " + "-".repeat(76));
        for (Feature f : features) {
            System.out.println(ConsoleOutput.featureRow(f));
        }
        System.out.println();
        ConsoleOutput.info(features.size() + " feature" + (features.size() != 1 ? "s" : ""));
    }
}
