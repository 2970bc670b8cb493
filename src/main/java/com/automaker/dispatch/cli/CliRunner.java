package com.automaker.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree once the Spring context is up and keeps its exit code for
 * {@link org.springframework.boot.SpringApplication#exit}.
 * <p>
 * In {@link LaunchMode#SERVER} nothing is run here: Tomcat's non-daemon threads hold the
 * process open until it is stopped.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final AutomakerCommand rootCommand;
    private final IFactory springFactory;
    private int lastExitCode;

    public CliRunner(AutomakerCommand rootCommand, IFactory springFactory) {
        this.rootCommand = rootCommand;
        this.springFactory = springFactory;
    }

    @Override
    public void run(String... args) {
        if (!LaunchMode.of(args).runsPicocli()) {
            return;
        }
        lastExitCode = new CommandLine(rootCommand, springFactory).execute(args);
    }

    @Override
    public int getExitCode() {
        return lastExitCode;
    }
}
