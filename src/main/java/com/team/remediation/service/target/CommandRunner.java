package com.team.remediation.service.target;

import com.team.remediation.config.TargetSystemConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Runs allow-listed executables through {@link ProcessBuilder}, without a shell.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CommandRunner {

    private static final int MAX_LOGGED_OUTPUT = 200;

    private final TargetSystemConfig config;

    /**
     * @throws IllegalArgumentException when the command is empty or its executable is not allowed
     */
    public CommandResult run(List<String> command) {
        checkAllowed(command);
        String commandLine = String.join(" ", command);
        log.debug("Running command: {}", commandLine);

        Process process;
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectErrorStream(true);
            process = pb.start();
        } catch (IOException e) {
            log.error("Failed to start command '{}': {}", commandLine, e.getMessage());
            return new CommandResult(-1, "Failed to start: " + e.getMessage(), false);
        }

        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readOutput(process));
        try {
            boolean finished = process.waitFor(config.getCommandTimeoutSeconds(), TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                log.warn("Command timed out after {}s: {}", config.getCommandTimeoutSeconds(), commandLine);
                return new CommandResult(-1, "Timed out after " + config.getCommandTimeoutSeconds() + "s", true);
            }
            String text = output.get(5, TimeUnit.SECONDS);
            int exitCode = process.exitValue();
            log.debug("Command finished with exit code {}: {}", exitCode,
                    text.length() > MAX_LOGGED_OUTPUT ? text.substring(0, MAX_LOGGED_OUTPUT) + "..." : text);
            return new CommandResult(exitCode, text, false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return new CommandResult(-1, "Interrupted", false);
        } catch (Exception e) {
            log.warn("Could not read output of '{}': {}", commandLine, e.getMessage());
            return new CommandResult(process.isAlive() ? -1 : process.exitValue(), "", false);
        }
    }

    public boolean isAllowed(List<String> command) {
        return command != null && !command.isEmpty() && config.getAllowedCommands().contains(command.get(0));
    }

    private void checkAllowed(List<String> command) {
        if (command == null || command.isEmpty() || command.get(0) == null || command.get(0).isBlank()) {
            throw new IllegalArgumentException("Empty command");
        }
        if (!isAllowed(command)) {
            throw new IllegalArgumentException("Executable not allowed: " + command.get(0));
        }
    }

    private static String readOutput(Process process) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            return "";
        }
    }
}
