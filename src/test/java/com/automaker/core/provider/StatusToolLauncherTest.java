package com.automaker.core.provider;

import org.junit.jupiter.api.Test;

import java.io.File;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatusToolLauncherTest {

    private static final String JAVA = Path.of("/opt/jdk", "bin", "java").toString();

    @Test
    void singleJarIsRelaunchedWithDashJar() {
        assertEquals(List.of(JAVA, "-jar", "/opt/automaker.jar"),
                StatusToolLauncher.jvmPrefix("/opt/jdk", "/opt/automaker.jar"));
    }

    @Test
    void classPathIsRelaunchedWithMainClass() {
        String classPath = "target/classes" + File.pathSeparator + "lib/picocli.jar";

        assertEquals(List.of(JAVA, "-cp", classPath, "com.automaker.AutomakerApplication"),
                StatusToolLauncher.jvmPrefix("/opt/jdk", classPath));
    }

    @Test
    void argumentsAppendSubcommandAndProject() {
        var launcher = new StatusToolLauncher(List.of("automaker"));

        assertEquals("automaker", launcher.executable());
        assertEquals(List.of("mcp-status", "--project", "/work"), launcher.arguments("/work"));
        assertEquals("mcp__automaker-tools__update_feature_status", StatusToolLauncher.qualifiedToolName());
    }

    @Test
    void emptyLaunchCommandIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new StatusToolLauncher(List.of()));
    }
}
