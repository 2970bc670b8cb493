package com.automaker.dispatch.cli;

import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: automaker serve
 * <p>
 * Runs the REST control surface and the SSE event stream until the process is stopped.
 * {@link LaunchMode} sees "serve" before Spring starts and switches the context to a servlet
 * application; the routes are printed when Tomcat reports its port. Set the port with
 * {@code SERVER_PORT}.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Automaker HTTP server")
@Component
public class ServeCommand implements Runnable {

    /** Reached only when picocli dispatches "serve", which happens outside server mode. */
    @Override
    public void run() {
        ConsoleOutput.error("serve must be launched as the first subcommand: automaker serve");
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        int port = event.getWebServer().getPort();
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Automaker server listening on port " + port);
        String base = "http://localhost:" + port + "/api/v1";
        System.out.println();
        System.out.println("  Features:   " + base + "/features?projectPath=<dir>");
        System.out.println("  Auto mode:  " + base + "/auto-mode/start");
        System.out.println("  Events:     " + base + "/auto-mode/events");
        System.out.println("  Health:     " + base + "/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
