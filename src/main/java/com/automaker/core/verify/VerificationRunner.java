package com.automaker.core.verify;

import com.automaker.core.config.AutomakerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Runs the configured verification commands (lint, type check, tests, build) in a working
 * directory, stopping at the first failure. Best-effort: a check that cannot start counts as failed.
 */
@Service
public class VerificationRunner {

    private static final Logger log = LoggerFactory.getLogger(VerificationRunner.class);

    private static final int MAX_OUTPUT_CHARS = 4_000;

    private final List<AutomakerProperties.Check> checks;
    private final int timeoutSeconds;

    public VerificationRunner(AutomakerProperties properties) {
        this.checks = List.copyOf(properties.getVerification().getCommands());
        this.timeoutSeconds = properties.getVerification().getTimeoutSeconds();
    }

    public record CheckResult(String name, String command, boolean passed, String output) {}

    public record VerificationReport(boolean allPassed, List<CheckResult> results) {
        /** Name of the first failing check, or null when all passed. */
        public String failedCheck() {
            return results.stream().filter(r -> !r.passed()).map(CheckResult::name).findFirst().orElse(null);
        }

        public String summary() {
            return allPassed
                    ? "All verification checks passed"
                    : "Verification failed: " + failedCheck();
        }
    }

    public VerificationReport verify(Path workDir) {
        List<CheckResult> results = new ArrayList<>();
        for (AutomakerProperties.Check check : checks) {
            CheckResult result = runCheck(workDir, check);
            results.add(result);
            if (!result.passed()) {
                log.warn("Verification check '{}' failed in {}", check.getName(), workDir);
                return new VerificationReport(false, results);
            }
            log.info("Verification check '{}' passed", check.getName());
        }
        return new VerificationReport(true, results);
    }

    CheckResult runCheck(Path workDir, AutomakerProperties.Check check) {
        Path output = null;
        try {
            output = Files.createTempFile("automaker-verify-", ".log");
            Process process = new ProcessBuilder(shell(check.getCommand()))
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile())
                    .start();
            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                return new CheckResult(check.getName(), check.getCommand(), false,
                        "Timed out after " + timeoutSeconds + "s");
            }
            String text = Files.readString(output, StandardCharsets.UTF_8);
            if (text.length() > MAX_OUTPUT_CHARS) {
                text = text.substring(text.length() - MAX_OUTPUT_CHARS);
            }
            return new CheckResult(check.getName(), check.getCommand(), process.exitValue() == 0, text);
        } catch (IOException e) {
            return new CheckResult(check.getName(), check.getCommand(), false, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new CheckResult(check.getName(), check.getCommand(), false, "Interrupted");
        } finally {
            if (output != null) {
                try {
                    Files.deleteIfExists(output);
                } catch (IOException e) {
                    log.debug("Could not delete {}: {}", output, e.getMessage());
                }
            }
        }
    }

    private static List<String> shell(String command) {
        if (System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows")) {
            return List.of("cmd", "/c", command);
        }
        return List.of("sh", "-c", command);
    }
}
