package com.automaker.core.config;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class AutomakerPropertiesTest {

    @Test
    void autoModeDefaultsAreReasonable() {
        var props = new AutomakerProperties();
        assertEquals(3, props.getAutoMode().getMaxConcurrency());
        assertEquals(5_000, props.getAutoMode().getCapacityPollMs());
        assertEquals(10_000, props.getAutoMode().getIdlePollMs());
        assertEquals(2_000, props.getAutoMode().getLaunchDelayMs());
        assertEquals(3, props.getAutoMode().getMaxResumeAttempts());
    }

    @Test
    void worktreeDefaultsAreReasonable() {
        var props = new AutomakerProperties();
        assertTrue(props.getWorktrees().isEnabled());
        assertEquals(".worktrees", props.getWorktrees().getDirectory());
        assertEquals("feature/", props.getWorktrees().getBranchPrefix());
    }

    @Test
    void providerDefaultsAreReasonable() {
        var props = new AutomakerProperties();
        assertEquals("opus", props.getProvider().getDefaultModel());
        assertEquals("claude", props.getProvider().getClaudeCommand());
        assertEquals("codex", props.getProvider().getCodexCommand());
        assertEquals(50, props.getProvider().getMaxTurns());
        assertTrue(props.getProvider().getAllowedTools().contains("Bash"));
        assertEquals(500, props.getTranscript().getDebounceMs());
    }
}
