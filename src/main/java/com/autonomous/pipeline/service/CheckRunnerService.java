package com.autonomous.pipeline.service;

import com.autonomous.pipeline.exception.ConfigurationException;
import com.autonomous.pipeline.model.CheckConfig;
import com.autonomous.pipeline.model.CheckResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs the post-step validations of a pipeline step.
 */
@Slf4j
@Service
public class CheckRunnerService {

    private Duration timeout = Duration.ofMinutes(30);

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    /**
     * Runs {@code checks} in order. The first failure stops the run and its output is returned.
     */
    public CheckResult run(List<CheckConfig> checks, Path projectRoot) {
        if (checks == null || checks.isEmpty()) {
            return CheckResult.passed();
        }
        for (int i = 0; i < checks.size(); i++) {
            if (checks.size() > 1) {
                log.info("Running check {}/{}...", i + 1, checks.size());
            }
            CheckResult result = runSingle(checks.get(i), projectRoot);
            if (!result.isSuccess()) {
                return result;
            }
        }
        return CheckResult.passed();
    }

    public CheckResult runSingle(CheckConfig check, Path projectRoot) {
        if (check.getType() == null) {
            throw new ConfigurationException("Check is missing its 'type'.");
        }
        log.info("Running check: {}", check.getType());

        return switch (check.getType()) {
            case NONE -> {
                log.info("No automated validation for this step.");
                yield CheckResult.passed();
            }
            case FILE_EXISTS -> fileExists(check, projectRoot);
            case SHELL -> shell(check, projectRoot);
        };
    }

    private CheckResult fileExists(CheckConfig check, Path projectRoot) {
        if (check.getPath() == null) {
            throw new ConfigurationException("Check type 'fileExists' requires a 'path' property.");
        }
        Path file = projectRoot.resolve(check.getPath());
        if (!Files.exists(file)) {
            String message = "Validation failed: File not found at " + file;
            log.warn("Check failed: {}", message);
            return CheckResult.failed(message);
        }
        log.info("Check passed: File \"{}\" exists.", check.getPath());
        return CheckResult.passed();
    }

    private CheckResult shell(CheckConfig check, Path projectRoot) {
        if (check.getCommand() == null) {
            throw new ConfigurationException("Check type 'shell' requires a 'command' property.");
        }
        CheckConfig.Expect expect = check.getExpect() != null ? check.getExpect() : CheckConfig.Expect.PASS;
        log.info("Executing: \"{}\" (expecting to {})", check.getCommand(), expect.name().toLowerCase());

        ShellResult result = execute(check.getCommand(), projectRoot);
        boolean passed = result.exitCode == 0;

        if (passed && expect == CheckConfig.Expect.FAIL) {
            String message = String.format("Validation failed: Command \"%s\" succeeded but was expected to fail.",
                check.getCommand());
            log.warn("Check failed: {}", message);
            return CheckResult.failed(message + result.capturedOutput());
        }
        if (!passed && expect == CheckConfig.Expect.PASS) {
            String message = String.format("Check failed: Command \"%s\" failed (exit code %d) but was expected to pass.",
                check.getCommand(), result.exitCode);
            log.warn(message);
            return CheckResult.failed(message + result.capturedOutput());
        }
        log.info("Check passed: Command {} as expected.", passed ? "succeeded" : "failed");
        return CheckResult.passed();
    }

    private ShellResult execute(String command, Path projectRoot) {
        try {
            ProcessBuilder pb = new ProcessBuilder("sh", "-c", command);
            pb.directory(projectRoot.toFile());
            Process process = pb.start();
            process.getOutputStream().close();

            // Both pipes drain in the background so a chatty command cannot block before the wait starts
            CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
            CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                log.warn("Command \"{}\" did not finish within {} and was killed", command, describe(timeout));
                return new ShellResult(-1, stdout.getNow(""), "Command timed out after " + describe(timeout));
            }
            return new ShellResult(process.exitValue(), stdout.get(), stderr.get());
        } catch (IOException e) {
            return new ShellResult(-1, "", "Could not run command: " + e.getMessage());
        } catch (ExecutionException e) {
            return new ShellResult(-1, "", "Could not capture command output: " + e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new ShellResult(-1, "", "Interrupted while running command");
        }
    }

    private static String describe(Duration duration) {
        return duration.toMillis() < 1000 ? duration.toMillis() + "ms" : duration.toSeconds() + "s";
    }

    private static String drain(InputStream stream) {
        try (InputStream in = stream) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            in.transferTo(out);
            return out.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static final class ShellResult {
        private final int exitCode;
        private final String stdout;
        private final String stderr;

        ShellResult(int exitCode, String stdout, String stderr) {
            this.exitCode = exitCode;
            this.stdout = stdout;
            this.stderr = stderr;
        }

        String capturedOutput() {
            StringBuilder captured = new StringBuilder();
            if (!stderr.isBlank()) {
                captured.append("\n--- stderr ---\n").append(stderr.strip());
            }
            if (!stdout.isBlank()) {
                captured.append("\n--- stdout ---\n").append(stdout.strip());
            }
            return captured.toString();
        }
    }
}
