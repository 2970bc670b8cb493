package com.automaker.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "automaker")
public class AutomakerProperties {

    private AutoMode autoMode = new AutoMode();
    private Transcript transcript = new Transcript();
    private Worktrees worktrees = new Worktrees();
    private Provider provider = new Provider();
    private Verification verification = new Verification();

    public AutoMode getAutoMode() { return autoMode; }
    public void setAutoMode(AutoMode autoMode) { this.autoMode = autoMode; }
    public Transcript getTranscript() { return transcript; }
    public void setTranscript(Transcript transcript) { this.transcript = transcript; }
    public Worktrees getWorktrees() { return worktrees; }
    public void setWorktrees(Worktrees worktrees) { this.worktrees = worktrees; }
    public Provider getProvider() { return provider; }
    public void setProvider(Provider provider) { this.provider = provider; }
    public Verification getVerification() { return verification; }
    public void setVerification(Verification verification) { this.verification = verification; }

    public static class AutoMode {
        private int maxConcurrency = 3;
        /** Sleep while the running set is full. */
        private long capacityPollMs = 5_000;
        /** Sleep when there is nothing pending. */
        private long idlePollMs = 10_000;
        /** Sleep after launching a feature. */
        private long launchDelayMs = 2_000;
        private int maxResumeAttempts = 3;

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }
        public long getCapacityPollMs() { return capacityPollMs; }
        public void setCapacityPollMs(long capacityPollMs) { this.capacityPollMs = capacityPollMs; }
        public long getIdlePollMs() { return idlePollMs; }
        public void setIdlePollMs(long idlePollMs) { this.idlePollMs = idlePollMs; }
        public long getLaunchDelayMs() { return launchDelayMs; }
        public void setLaunchDelayMs(long launchDelayMs) { this.launchDelayMs = launchDelayMs; }
        public int getMaxResumeAttempts() { return maxResumeAttempts; }
        public void setMaxResumeAttempts(int maxResumeAttempts) { this.maxResumeAttempts = maxResumeAttempts; }
    }

    public static class Transcript {
        private long debounceMs = 500;

        public long getDebounceMs() { return debounceMs; }
        public void setDebounceMs(long debounceMs) { this.debounceMs = debounceMs; }
    }

    public static class Worktrees {
        private boolean enabled = true;
        private String directory = ".worktrees";
        private String branchPrefix = "feature/";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
        public String getBranchPrefix() { return branchPrefix; }
        public void setBranchPrefix(String branchPrefix) { this.branchPrefix = branchPrefix; }
    }

    public static class Provider {
        private String defaultModel = "opus";
        private String claudeCommand = "claude";
        private String codexCommand = "codex";
        private int maxTurns = 50;
        private List<String> allowedTools = new ArrayList<>(List.of("Read", "Write", "Edit", "Glob", "Grep", "Bash"));

        public String getDefaultModel() { return defaultModel; }
        public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }
        public String getClaudeCommand() { return claudeCommand; }
        public void setClaudeCommand(String claudeCommand) { this.claudeCommand = claudeCommand; }
        public String getCodexCommand() { return codexCommand; }
        public void setCodexCommand(String codexCommand) { this.codexCommand = codexCommand; }
        public int getMaxTurns() { return maxTurns; }
        public void setMaxTurns(int maxTurns) { this.maxTurns = maxTurns; }
        private StatusTool statusTool = new StatusTool();

        public List<String> getAllowedTools() { return allowedTools; }
        public void setAllowedTools(List<String> allowedTools) { this.allowedTools = allowedTools; }
        public StatusTool getStatusTool() { return statusTool; }
        public void setStatusTool(StatusTool statusTool) { this.statusTool = statusTool; }
    }

    /** The stdio MCP server that gives agent CLIs the status tool. */
    public static class StatusTool {
        private boolean enabled = true;
        /** Command that runs this application; empty relaunches the running JVM. */
        private List<String> launchCommand = new ArrayList<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public List<String> getLaunchCommand() { return launchCommand; }
        public void setLaunchCommand(List<String> launchCommand) { this.launchCommand = launchCommand; }
    }

    public static class Verification {
        private List<Check> commands = new ArrayList<>(List.of(
                new Check("Lint", "npm run lint"),
                new Check("Type check", "npm run typecheck"),
                new Check("Tests", "npm test"),
                new Check("Build", "npm run build")));
        private int timeoutSeconds = 120;

        public List<Check> getCommands() { return commands; }
        public void setCommands(List<Check> commands) { this.commands = commands; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    public static class Check {
        private String name;
        private String command;

        public Check() {}

        public Check(String name, String command) {
            this.name = name;
            this.command = command;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
    }
}
