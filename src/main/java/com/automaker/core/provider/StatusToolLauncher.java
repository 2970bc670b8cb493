package com.automaker.core.provider;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line that starts the stdio MCP server exposing the status tool to an agent CLI.
 *
 * <p>The server is this application's {@code mcp-status} subcommand. By default it is launched
 * with the JVM and class path of the running process; a configured prefix replaces both.
 */
public class StatusToolLauncher {

    public static final String SERVER_NAME = "automaker-tools";
    public static final String TOOL_NAME = "update_feature_status";
    public static final String SUBCOMMAND = "mcp-status";

    private static final String MAIN_CLASS = "com.automaker.AutomakerApplication";

    private final List<String> launchPrefix;

    /**
     * @param launchPrefix executable and arguments that run the application, without subcommand
     */
    public StatusToolLauncher(List<String> launchPrefix) {
        if (launchPrefix == null || launchPrefix.isEmpty()) {
            throw new IllegalArgumentException("launchPrefix must name an executable");
        }
        this.launchPrefix = List.copyOf(launchPrefix);
    }

    /** Relaunches the running JVM: {@code -jar} for a single jar, {@code -cp} otherwise. */
    public static StatusToolLauncher forRunningJvm() {
        return new StatusToolLauncher(jvmPrefix(System.getProperty("java.home"),
                System.getProperty("java.class.path")));
    }

    static List<String> jvmPrefix(String javaHome, String classPath) {
        String java = Path.of(javaHome, "bin", "java").toString();
        if (classPath != null && !classPath.contains(File.pathSeparator) && classPath.endsWith(".jar")) {
            return List.of(java, "-jar", classPath);
        }
        return List.of(java, "-cp", classPath == null ? "" : classPath, MAIN_CLASS);
    }

    /** Executable of the server process. */
    public String executable() {
        return launchPrefix.get(0);
    }

    /** Arguments after the executable for a server bound to {@code projectPath}. */
    public List<String> arguments(String projectPath) {
        List<String> args = new ArrayList<>(launchPrefix.subList(1, launchPrefix.size()));
        args.add(SUBCOMMAND);
        args.add("--project");
        args.add(projectPath);
        return args;
    }

    /** Name under which Claude exposes the tool: {@code mcp__<server>__<tool>}. */
    public static String qualifiedToolName() {
        return "mcp__" + SERVER_NAME + "__" + TOOL_NAME;
    }
}
