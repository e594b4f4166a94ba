package io.crawlrelay.dispatch;

import io.crawlrelay.config.WorkerConfig;
import io.crawlrelay.model.PendingJob;
import io.crawlrelay.stage.DurableStage;
import io.crawlrelay.stage.StageException;
import org.slf4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a staged job as a child process of the configured crawler executable.
 */
public final class Dispatcher {
    private static final AtomicInteger READER_IDS = new AtomicInteger();
    private static final ExecutorService OUTPUT_READERS = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "crawlrelay-output-reader-" + READER_IDS.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    private final WorkerConfig config;
    private final DurableStage stage;
    private final Logger log;

    public Dispatcher(WorkerConfig config, DurableStage stage, Logger log) {
        this.config = config;
        this.stage = stage;
        this.log = log;
    }

    /**
     * Bumps the persisted attempt count, runs the job and, on exit status 0,
     * removes the staged file.
     */
    public Dispatch execute(PendingJob pending, String source) {
        PendingJob current = stage.markAttempt(pending);
        String msgId = current.messageId();
        List<String> command = JobCommand.build(config, current.job().data(), msgId, log);
        log.info("Subprocess starting. message_id={} source={} attempts={} cmd={}",
                msgId, source, current.job().attempts(), JobCommand.display(command));

        ExecutionResult result = run(command);
        if (result.success()) {
            log.info("Subprocess finished. message_id={} source={} returncode=0 elapsed_sec={}",
                    msgId, source, seconds(result.duration()));
            logOutput(result, false);
            try {
                if (stage.delete(current)) {
                    log.info("Queue file removed. message_id={} path={}", msgId, current.location());
                }
            } catch (StageException e) {
                log.error("Queue file not removed after success; it runs again on next recovery. message_id={} path={}",
                        msgId, current.location(), e);
            }
            return new Dispatch(current, result);
        }

        if (result.exitStatus() != null) {
            log.error("Subprocess failed. message_id={} source={} returncode={} elapsed_sec={}",
                    msgId, source, result.exitStatus(), seconds(result.duration()));
        } else {
            log.error("Subprocess failed. message_id={} source={} failure={} elapsed_sec={}",
                    msgId, source, result.failure(), seconds(result.duration()));
        }
        logOutput(result, true);
        return new Dispatch(current, result);
    }

    ExecutionResult run(List<String> command) {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(config.workingDir().toFile());
        long startedAt = System.nanoTime();
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return ExecutionResult.failed(
                    ExecutionResult.FAILURE_UNEXPECTED + ": spawn failed: " + e.getMessage(),
                    "",
                    "",
                    elapsedSince(startedAt)
            );
        }

        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());
        try {
            process.getOutputStream().close();
            if (config.timeoutMs() > 0L) {
                boolean finished = process.waitFor(config.timeoutMs(), TimeUnit.MILLISECONDS);
                if (!finished) {
                    process.destroyForcibly();
                    process.waitFor(5, TimeUnit.SECONDS);
                    return ExecutionResult.failed(
                            ExecutionResult.FAILURE_TIMEOUT,
                            collect(stdout),
                            collect(stderr),
                            elapsedSince(startedAt)
                    );
                }
            } else {
                process.waitFor();
            }
            return ExecutionResult.exited(process.exitValue(), collect(stdout), collect(stderr), elapsedSince(startedAt));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return ExecutionResult.failed(ExecutionResult.FAILURE_UNEXPECTED + ": interrupted", "", "", elapsedSince(startedAt));
        } catch (IOException e) {
            process.destroyForcibly();
            return ExecutionResult.failed(
                    ExecutionResult.FAILURE_UNEXPECTED + ": " + e.getMessage(),
                    "",
                    "",
                    elapsedSince(startedAt)
            );
        }
    }

    private void logOutput(ExecutionResult result, boolean failed) {
        if (result.stdout() != null && !result.stdout().isBlank()) {
            log.info("stdout:\n{}", result.stdout().stripTrailing());
        }
        if (result.stderr() != null && !result.stderr().isBlank()) {
            if (failed) {
                log.error("stderr:\n{}", result.stderr().stripTrailing());
            } else {
                log.warn("stderr:\n{}", result.stderr().stripTrailing());
            }
        }
    }

    private static CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                return "";
            }
        }, OUTPUT_READERS);
    }

    private static String collect(CompletableFuture<String> output) throws InterruptedException {
        try {
            return output.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            output.cancel(true);
            return "";
        }
    }

    private static Duration elapsedSince(long startedAtNanos) {
        return Duration.ofNanos(System.nanoTime() - startedAtNanos);
    }

    private static String seconds(Duration duration) {
        return String.format(Locale.ROOT, "%.2f", duration.toMillis() / 1000.0d);
    }

    public record Dispatch(PendingJob job, ExecutionResult result) {
    }
}
