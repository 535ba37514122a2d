package com.playpilot.orchestrator.execution;

import com.playpilot.orchestrator.config.PlayPilotProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Shells out to {@code ansible-playbook -i <inventory> <playbook>}.
 *
 * Generated content is written to a temp file first and removed afterwards.
 * Combined stdout/stderr goes to a temp log so the wait can be bounded; a run
 * past the configured timeout is killed and reported as failed. Exit code 0
 * is success, anything else is failure.
 */
@Component
public class AnsiblePlaybookEngine implements ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(AnsiblePlaybookEngine.class);

    // Keep stored output bounded; ansible can be very chatty.
    private static final int MAX_OUTPUT_CHARS = 64 * 1024;

    private final PlayPilotProperties.Execution config;

    public AnsiblePlaybookEngine(PlayPilotProperties properties) {
        this.config = properties.execution();
    }

    @Override
    public ExecutionOutcome run(ExecutionRequest request) {
        Path workDir = Path.of(config.workingDirectory()).toAbsolutePath();
        Path generatedFile = null;
        Path logFile = null;
        try {
            Path playbook;
            if (request.playbookContent() != null) {
                generatedFile = Files.createTempFile("playbook-" + request.taskId() + "-", ".yml");
                Files.writeString(generatedFile, request.playbookContent(), StandardCharsets.UTF_8);
                playbook = generatedFile;
            } else {
                playbook = workDir.resolve(request.playbookPath());
                if (!Files.isRegularFile(playbook)) {
                    return ExecutionOutcome.failed("Playbook not found: " + playbook);
                }
            }
            logFile = Files.createTempFile("ansible-" + request.taskId() + "-", ".log");

            List<String> command = List.of(config.command(), "-i", request.inventory(), playbook.toString());
            log.info("Running {}", String.join(" ", command));

            Process process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(logFile.toFile())
                    .start();

            boolean finished = process.waitFor(config.timeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                return ExecutionOutcome.failed(readOutput(logFile)
                        + "\n[killed after " + config.timeout() + "]");
            }
            int exitCode = process.exitValue();
            log.info("ansible-playbook exited with {}", exitCode);
            return new ExecutionOutcome(exitCode == 0, readOutput(logFile));

        } catch (IOException e) {
            throw new ExecutionException("Could not launch " + config.command() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionException("Interrupted while waiting for " + config.command(), e);
        } finally {
            deleteQuietly(generatedFile);
            deleteQuietly(logFile);
        }
    }

    private static String readOutput(Path logFile) throws IOException {
        String output = new String(Files.readAllBytes(logFile), StandardCharsets.UTF_8);
        return output.length() <= MAX_OUTPUT_CHARS
                ? output
                : output.substring(output.length() - MAX_OUTPUT_CHARS);
    }

    private static void deleteQuietly(Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete temp file {}: {}", file, e.getMessage());
        }
    }
}
