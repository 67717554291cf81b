package com.dirgen.orchestrator.llm.local;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * {@link ModelRuntime} backed by the Docker Model Runner CLI:
 * <pre>
 *   docker model ps              → running models (first column, after the header)
 *   docker model run &lt;id&gt; Hello → loads the model by sending it a first prompt
 *   docker model unload &lt;id&gt;   → frees it
 * </pre>
 */
public class DockerModelRuntime implements ModelRuntime {

    private static final Logger log = LoggerFactory.getLogger(DockerModelRuntime.class);

    private final String   command;
    private final Duration queryTimeout;
    private final Duration stopTimeout;

    public DockerModelRuntime(LocalModelProperties props) {
        this.command      = props.command();
        this.queryTimeout = props.commandTimeout();
        this.stopTimeout  = props.stopTimeout();
    }

    @Override
    public Set<String> runningModels() {
        Set<String> running = new LinkedHashSet<>();
        Path output = null;
        Process p = null;
        try {
            // read only after waitFor; a hung CLI must not hold us on an open pipe
            output = Files.createTempFile("dirgen-model-ps", ".out");
            p = new ProcessBuilder(command, "model", "ps")
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile())
                    .start();
            if (!p.waitFor(queryTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("'{} model ps' timed out after {}s", command, queryTimeout.toSeconds());
                return running;
            }
            if (p.exitValue() != 0) {
                log.warn("'{} model ps' exited with {}", command, p.exitValue());
                return running;
            }
            Files.readAllLines(output, StandardCharsets.UTF_8).stream()
                    .skip(1)   // header
                    .map(String::strip)
                    .filter(l -> !l.isEmpty())
                    .map(l -> l.split("\\s+")[0])
                    .forEach(running::add);
        } catch (IOException e) {
            log.warn("Could not query running models: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            if (p != null && p.isAlive()) {
                p.destroyForcibly();
            }
            deleteQuietly(output);
        }
        return running;
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete {}: {}", file, e.getMessage());
        }
    }

    @Override
    public ModelHandle start(String modelId) throws IOException {
        log.info("Starting local model {}", modelId);
        Process p = new ProcessBuilder(command, "model", "run", modelId, "Hello")
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .start();
        return new CliModelHandle(p);
    }

    @Override
    public void stop(String modelId) {
        try {
            Process p = new ProcessBuilder(command, "model", "unload", modelId)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
            if (!p.waitFor(stopTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                p.destroyForcibly();
                log.warn("Unloading {} timed out after {}s", modelId, stopTimeout.toSeconds());
            }
        } catch (IOException e) {
            log.warn("Could not unload {}: {}", modelId, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private record CliModelHandle(Process process) implements ModelHandle {
        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public void terminate() {
            if (!process.isAlive()) {
                return;
            }
            process.destroy();
            try {
                if (!process.waitFor(5, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
            }
        }
    }
}
