package work.agentflow.kernel.runtime;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an external command per invocation: the instruction is written to stdin, stdout becomes
 * the payload and exit code 0 means success. {@code AGENTFLOW_MODEL}, {@code AGENTFLOW_NODE} and
 * {@code AGENTFLOW_STEP} are exported to the child.
 */
public final class ProcessStepFunction implements StepFunction {
    private static final Logger log = LoggerFactory.getLogger(ProcessStepFunction.class);
    private static final long POLL_MILLIS = 50;
    private static final AtomicInteger READERS = new AtomicInteger();
    // one blocking reader thread per open pipe
    private static final ExecutorService PIPE_READERS = Executors.newCachedThreadPool(runnable -> {
        var thread = new Thread(runnable, "agentflow-pipe-" + READERS.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    private final List<String> command;
    private final Path workingDirectory;

    public ProcessStepFunction(List<String> command) {
        this(command, null);
    }

    public ProcessStepFunction(List<String> command, Path workingDirectory) {
        Objects.requireNonNull(command, "command");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        this.command = List.copyOf(command);
        this.workingDirectory = workingDirectory;
    }

    public List<String> command() {
        return command;
    }

    @Override
    public StepResult invoke(StepRequest request) throws Exception {
        var builder = new ProcessBuilder(new ArrayList<>(command));
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }
        Map<String, String> environment = builder.environment();
        environment.put("AGENTFLOW_NODE", request.nodeId());
        environment.put("AGENTFLOW_STEP", request.stepName());
        request.options().maybeModel().ifPresent(model -> environment.put("AGENTFLOW_MODEL", model));

        log.debug("Starting {} for node {}", command, request.nodeId());
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to start process: " + String.join(" ", command), e);
        }
        var stdout = drain(process.getInputStream());
        var stderr = drain(process.getErrorStream());
        try (OutputStream output = process.getOutputStream();
             var writer = new OutputStreamWriter(output, StandardCharsets.UTF_8)) {
            writer.write(request.instructionOrEmpty());
            writer.flush();
        } catch (IOException e) {
            // the child may exit without reading stdin
            log.debug("Could not write instruction to {}: {}", command, e.getMessage());
        }

        var token = request.options().cancellation();
        try {
            while (!process.waitFor(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                if (token.isCancelled()) {
                    process.destroyForcibly();
                    throw new CancellationToken.StepCancelledException("Process for node " + request.nodeId() + " cancelled");
                }
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw e;
        }

        int exit = process.exitValue();
        var out = join(stdout).strip();
        if (exit == 0) {
            return StepResult.success(out);
        }
        var err = join(stderr).strip();
        var message = "Command " + command.get(0) + " exited with code " + exit + (err.isEmpty() ? "" : ": " + err);
        return StepResult.failure(message, out.isEmpty() ? null : out);
    }

    private static CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (stream) {
                return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, PIPE_READERS);
    }

    private static String join(CompletableFuture<String> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            var cause = e.getCause();
            throw new IllegalStateException("Failed to read process output", cause == null ? e : cause);
        }
    }
}
