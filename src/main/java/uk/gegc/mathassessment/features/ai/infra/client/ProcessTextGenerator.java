package uk.gegc.mathassessment.features.ai.infra.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import uk.gegc.mathassessment.features.ai.api.dto.GenerationOutcome;
import uk.gegc.mathassessment.features.ai.api.dto.GenerationOutcome.FailureReason;
import uk.gegc.mathassessment.features.ai.application.TextGenerator;
import uk.gegc.mathassessment.features.ai.infra.parser.JsonBlockExtractor;
import uk.gegc.mathassessment.shared.config.GeneratorProperties;
import uk.gegc.mathassessment.shared.exception.AiServiceException;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Text generator that runs a local model runner as a child process
 * ({@code <command> run <model>}), feeding the prompt on stdin and reading the reply
 * from stdout.
 */
@Component
@ConditionalOnProperty(prefix = "app.generator", name = "backend", havingValue = "process")
@Slf4j
public class ProcessTextGenerator implements TextGenerator {

    private final GeneratorProperties.Process settings;
    private final JsonBlockExtractor jsonBlockExtractor;

    public ProcessTextGenerator(GeneratorProperties generatorProperties, JsonBlockExtractor jsonBlockExtractor) {
        this.settings = generatorProperties.getProcess();
        this.jsonBlockExtractor = jsonBlockExtractor;
    }

    @Override
    public GenerationOutcome generate(String prompt) {
        Optional<Path> executable = resolveExecutable();
        if (executable.isEmpty()) {
            return GenerationOutcome.failure(FailureReason.BACKEND_UNAVAILABLE,
                    settings.getCommand() + " binary not found on PATH");
        }

        try {
            return jsonBlockExtractor.toOutcome(run(executable.get(), prompt));
        } catch (AiServiceException e) {
            log.warn("Model process failed: {}", e.getMessage());
            return GenerationOutcome.failure(FailureReason.BACKEND_FAILURE, e.getMessage());
        }
    }

    @Override
    public String name() {
        return "process:" + settings.getCommand();
    }

    private String run(Path executable, String prompt) {
        List<String> command = List.of(executable.toString(), "run", settings.getModel());
        log.debug("Starting model process: {}", command);
        try {
            Process process = new ProcessBuilder(command).start();
            // stderr is drained alongside stdout so a chatty child cannot fill its pipe and stall
            CompletableFuture<String> stderrFuture = CompletableFuture.supplyAsync(
                    () -> readUnchecked(process.getErrorStream()));
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(prompt.getBytes(StandardCharsets.UTF_8));
            }
            String stdout = readFully(process.getInputStream());
            String stderr = awaitStderr(stderrFuture);

            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new AiServiceException("Model process exited with code " + exitCode + ": " + stderr.trim());
            }
            log.debug("Model process replied: {}", stdout);
            return stdout;
        } catch (IOException e) {
            throw new AiServiceException("Failed to run model process: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AiServiceException("Interrupted while waiting for model process", e);
        }
    }

    /**
     * Resolves the configured command to an executable file, searching PATH when the
     * command is a bare name.
     */
    Optional<Path> resolveExecutable() {
        String command = settings.getCommand();
        if (command.contains(File.separator)) {
            Path direct = Paths.get(command);
            return Files.isExecutable(direct) ? Optional.of(direct) : Optional.empty();
        }
        String path = System.getenv("PATH");
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Paths.get(dir, command);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static String awaitStderr(CompletableFuture<String> stderrFuture) throws InterruptedException {
        try {
            return stderrFuture.get();
        } catch (ExecutionException e) {
            throw new AiServiceException("Failed to read model process stderr: " + e.getCause().getMessage(), e.getCause());
        }
    }

    private static String readUnchecked(InputStream in) {
        try {
            return readFully(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String readFully(InputStream in) throws IOException {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
