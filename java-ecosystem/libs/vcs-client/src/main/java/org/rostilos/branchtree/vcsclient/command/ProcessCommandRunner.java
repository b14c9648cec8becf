package org.rostilos.branchtree.vcsclient.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs commands as child processes via {@link ProcessBuilder}.
 *
 * <p>stdout and stderr are drained on background threads so a chatty process cannot block on a full pipe
 * while we wait for it. A process still running after the timeout is destroyed forcibly.
 */
public class ProcessCommandRunner implements ExternalCommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    /**
     * Extra time allowed for the output readers after the process has exited.
     */
    private static final long STREAM_DRAIN_SECONDS = 5;

    private final Duration timeout;
    private final ExecutorService streamReaders;

    public ProcessCommandRunner(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Command timeout must be positive");
        }
        this.timeout = timeout;
        this.streamReaders = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "command-output-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public CommandResult run(Path workDir, List<String> command) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Command cannot be null or empty");
        }
        String commandLine = String.join(" ", command);
        log.debug("Running: {} (in {})", commandLine, workDir);

        ProcessBuilder builder = new ProcessBuilder(command);
        if (workDir != null) {
            builder.directory(workDir.toFile());
        }
        // never let git block on a credential prompt
        builder.environment().put("GIT_TERMINAL_PROMPT", "0");

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            log.warn("Failed to start command '{}': {}", commandLine, e.getMessage());
            return CommandResult.failure(e.getMessage());
        }

        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                log.warn("Command '{}' timed out after {} ms", commandLine, timeout.toMillis());
                return CommandResult.timeout(collect(stdout));
            }
            return new CommandResult(process.exitValue(), collect(stdout), collect(stderr), false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            log.warn("Interrupted while waiting for '{}'", commandLine);
            return CommandResult.failure("interrupted");
        }
    }

    private CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, streamReaders);
    }

    private String collect(CompletableFuture<String> output) throws InterruptedException {
        try {
            return output.get(STREAM_DRAIN_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.debug("Could not read command output: {}", e.getMessage());
            return "";
        }
    }
}
