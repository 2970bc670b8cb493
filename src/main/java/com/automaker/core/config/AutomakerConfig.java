package com.automaker.core.config;

import com.automaker.core.provider.AgentProvider;
import com.automaker.core.provider.AgentProviderFactory;
import com.automaker.core.provider.ClaudeCliProvider;
import com.automaker.core.provider.CodexCliProvider;
import com.automaker.core.provider.StatusToolLauncher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class AutomakerConfig {

    @Bean
    public ClaudeCliProvider claudeCliProvider(AutomakerProperties properties) {
        return new ClaudeCliProvider(properties.getProvider().getClaudeCommand(), statusToolLauncher(properties));
    }

    @Bean
    public CodexCliProvider codexCliProvider(AutomakerProperties properties) {
        return new CodexCliProvider(properties.getProvider().getCodexCommand(), statusToolLauncher(properties));
    }

    /** Null when the status tool server is disabled. */
    static StatusToolLauncher statusToolLauncher(AutomakerProperties properties) {
        AutomakerProperties.StatusTool statusTool = properties.getProvider().getStatusTool();
        if (!statusTool.isEnabled()) {
            return null;
        }
        if (statusTool.getLaunchCommand().isEmpty()) {
            return StatusToolLauncher.forRunningJvm();
        }
        return new StatusToolLauncher(statusTool.getLaunchCommand());
    }

    @Bean
    public AgentProviderFactory agentProviderFactory(List<AgentProvider> providers, AutomakerProperties properties) {
        return new AgentProviderFactory(providers, properties.getProvider().getDefaultModel());
    }

    /**
     * Worker threads for feature executions. Unbounded: the scheduler enforces the concurrency
     * ceiling, and manual runs are limited only by at-most-one per feature.
     */
    @Bean(name = "featureExecutor", destroyMethod = "shutdownNow")
    public ExecutorService featureExecutor() {
        var counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "feature-exec-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
