package com.automaker.dispatch.cli;

import com.automaker.core.provider.StatusToolLauncher;

import java.util.List;
import java.util.Set;

/**
 * How the process was started, decided from the first subcommand on the command line.
 */
public enum LaunchMode {

    /** One-shot picocli command; the JVM exits with its exit code. */
    COMMAND,
    /** Embedded web server; picocli is not run. */
    SERVER,
    /** Stdio tool server for an agent CLI; stdout is reserved for JSON-RPC. */
    STATUS_TOOL;

    /** Spring profile active in {@link #STATUS_TOOL} mode; routes logging to stderr. */
    public static final String STATUS_TOOL_PROFILE = "status-tool";

    private static final Set<String> INFO_FLAGS = Set.of("-h", "--help", "-V", "--version");

    public static LaunchMode of(String... args) {
        List<String> argList = List.of(args);
        String subcommand = argList.stream()
                .filter(arg -> !arg.startsWith("-"))
                .findFirst()
                .orElse("");
        if ("serve".equals(subcommand) && argList.stream().noneMatch(INFO_FLAGS::contains)) {
            return SERVER;
        }
        if (StatusToolLauncher.SUBCOMMAND.equals(subcommand)) {
            return STATUS_TOOL;
        }
        return COMMAND;
    }

    public boolean runsPicocli() {
        return this != SERVER;
    }
}
