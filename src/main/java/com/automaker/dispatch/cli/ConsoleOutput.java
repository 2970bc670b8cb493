package com.automaker.dispatch.cli;

import com.automaker.core.events.AutoModeEvents;
import com.automaker.core.events.AutomakerEvent;
import com.automaker.core.model.Feature;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Automaker CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AUTOMAKER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [AUTOMAKER]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    static String featureRow(Feature f) {
        String status = f.status().value();
        String color = switch (f.status()) {
            case VERIFIED -> "fg(green)";
            case WAITING_APPROVAL -> "fg(yellow)";
            case IN_PROGRESS -> "fg(blue)";
            case BACKLOG -> "fg(white)";
        };
        return CommandLine.Help.Ansi.AUTO.string(String.format("  %-24s @|%s %-18s|@ %-9s %s",
                f.id(), color, status, f.priority() != null ? f.priority() : "-", f.title()));
    }

    /** Prints one engine event while a feature runs in the foreground. */
    public static void event(AutomakerEvent event) {
        Object content = switch (event.eventType()) {
            case AutoModeEvents.PROGRESS -> event.payload().get("content");
            case AutoModeEvents.TOOL -> "🔧 " + event.payload().get("tool");
            case AutoModeEvents.PHASE -> "[" + event.payload().get("phase") + "] " + event.payload().get("message");
            case AutoModeEvents.ERROR -> "ERROR (" + event.payload().get("errorType") + "): "
                    + event.payload().get("error");
            case AutoModeEvents.FEATURE_START -> "Started " + event.payload().get("title");
            default -> null;
        };
        if (content == null) {
            return;
        }
        String prefix = switch (event.eventType()) {
            case AutoModeEvents.PROGRESS -> "";
            case AutoModeEvents.TOOL -> "@|fg(magenta) [TOOL]|@ ";
            case AutoModeEvents.PHASE -> "@|bold,fg(yellow) [PHASE]|@ ";
            case AutoModeEvents.ERROR -> "@|fg(red),bold [ERROR]|@ ";
            default -> "@|fg(blue) [FEATURE]|@ ";
        };
        if (prefix.isEmpty()) {
            System.out.print(content);
            System.out.flush();
        } else {
            System.out.println();
            System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix) + content);
        }
    }
}
