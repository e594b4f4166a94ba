package io.crawlrelay.runtime;

import io.crawlrelay.bus.BusSubscription;
import io.crawlrelay.bus.Delivery;
import io.crawlrelay.bus.FlowControl;
import io.crawlrelay.bus.MessageBus;
import io.crawlrelay.config.WorkerConfig;
import io.crawlrelay.dispatch.Dispatcher;
import io.crawlrelay.dispatch.ExecutionResult;
import io.crawlrelay.model.ErrorGenre;
import io.crawlrelay.model.JobAttributes;
import io.crawlrelay.model.PendingJob;
import io.crawlrelay.retry.FailureClassifier;
import io.crawlrelay.retry.RetryOutcome;
import io.crawlrelay.retry.RetryPolicy;
import io.crawlrelay.retry.Sleeper;
import io.crawlrelay.sink.ErrorSink;
import io.crawlrelay.stage.DurableStage;
import io.crawlrelay.stage.RecoverySweep;
import io.crawlrelay.stage.StageException;
import io.crawlrelay.stage.StageOutcome;
import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns one subscription: drains the local backlog, then listens with a single
 * delivery in flight. A delivery is acknowledged as soon as it is staged on
 * disk; the job then runs in this subscription's only slot.
 */
public final class WorkerSupervisor {
    static final String SOURCE_QUEUE = "queue";
    static final String SOURCE_SUBSCRIPTION = "subscription";
    private static final Duration STOP_WAIT_STEP = Duration.ofSeconds(30);

    private final WorkerConfig config;
    private final MessageBus bus;
    private final DurableStage stage;
    private final RecoverySweep recoverySweep;
    private final Dispatcher dispatcher;
    private final RetryPolicy retryPolicy;
    private final ErrorSink errorSink;
    private final Logger log;
    private final AtomicReference<WorkerState> state;
    private final AtomicBoolean stopRequested;
    private final CountDownLatch stopSignal;
    private final AtomicLong completedTotal;
    private final AtomicLong resubmittedTotal;
    private final AtomicLong abandonedTotal;
    private final AtomicLong keptTotal;
    private final AtomicLong nackedTotal;

    public WorkerSupervisor(WorkerConfig config, MessageBus bus, ErrorSink errorSink, Sleeper sleeper, Logger log) {
        this.config = config;
        this.bus = bus;
        this.errorSink = errorSink;
        this.log = log;
        this.stage = new DurableStage(config.stagingDir(), log);
        this.recoverySweep = new RecoverySweep(stage, log);
        this.dispatcher = new Dispatcher(config, stage, log);
        this.retryPolicy = new RetryPolicy(config, bus, sleeper, log);
        this.state = new AtomicReference<>(WorkerState.STARTING);
        this.stopRequested = new AtomicBoolean(false);
        this.stopSignal = new CountDownLatch(1);
        this.completedTotal = new AtomicLong();
        this.resubmittedTotal = new AtomicLong();
        this.abandonedTotal = new AtomicLong();
        this.keptTotal = new AtomicLong();
        this.nackedTotal = new AtomicLong();
    }

    public String subscriptionName() {
        return config.subscriptionName();
    }

    public WorkerState state() {
        return state.get();
    }

    public DurableStage stage() {
        return stage;
    }

    /**
     * Runs the subscription until {@link #stop()} is called. Blocks the calling thread.
     */
    public void run() {
        state.set(WorkerState.STARTING);
        log.info("Worker initialized. subscription={} working_dir={} executable={} staging_dir={}",
                config.subscriptionName(), config.workingDir(), config.executablePath(), config.stagingDir());
        if (config.retryEnabled()) {
            log.info("Retry publisher initialized. channel={} max_retries={}", config.retryChannel(), config.maxRetries());
        } else {
            log.warn("Retry disabled. subscription={} retry_channel={} max_retries={}",
                    config.subscriptionName(), config.retryChannel(), config.maxRetries());
        }

        drainBacklog();
        if (stopRequested.get()) {
            finish();
            return;
        }

        state.set(WorkerState.LISTENING);
        BusSubscription subscription = bus.subscribe(config.subscriptionName(), FlowControl.singleInFlight(), this::onMessage);
        log.info("Listening on {} ...", config.subscriptionName());
        try {
            stopSignal.await();
            subscription.stop();
            while (!subscription.awaitTermination(STOP_WAIT_STEP)) {
                log.info("Waiting for in-flight job before stopping. subscription={}", config.subscriptionName());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            subscription.stop();
            log.warn("Worker interrupted while stopping. subscription={}", config.subscriptionName());
        }
        finish();
    }

    /** Stops taking deliveries. A job that is already running finishes first. */
    public void stop() {
        if (stopRequested.compareAndSet(false, true)) {
            log.info("Stop requested. subscription={}", config.subscriptionName());
            stopSignal.countDown();
        }
    }

    void drainBacklog() {
        state.set(WorkerState.DRAINING_BACKLOG);
        List<PendingJob> backlog = recoverySweep.sweep();
        for (PendingJob job : backlog) {
            if (stopRequested.get()) {
                log.info("Stop requested during backlog drain; remaining jobs stay staged. subscription={}",
                        config.subscriptionName());
                return;
            }
            process(job, SOURCE_QUEUE);
        }
    }

    void onMessage(Delivery delivery) {
        String msgId = delivery.messageId();
        Map<String, String> attributes;
        byte[] data;
        try {
            attributes = delivery.attributes();
            data = delivery.data();
        } catch (RuntimeException e) {
            log.error("Message unreadable. message_id={} NACK.", msgId, e);
            nack(delivery, msgId);
            return;
        }
        int retryCount = JobAttributes.retryCount(attributes, log);
        log.info("Message received. message_id={} retry_count={} attributes={} data_len={}",
                msgId, retryCount, attributes, data.length);

        state.set(WorkerState.STAGING);
        StageOutcome staged = stage.stage(msgId, data, attributes);
        if (!staged.isOk()) {
            log.error("Queue save failed. message_id={} reason={} NACK.", msgId, staged.error());
            nack(delivery, msgId);
            return;
        }
        log.info("Queue saved. message_id={} path={}", msgId, staged.job().location());

        try {
            delivery.ack();
            log.info("ACKed early. message_id={}", msgId);
        } catch (RuntimeException e) {
            log.error("Ack failed; job is staged and runs anyway. message_id={}", msgId, e);
        }

        process(staged.job(), SOURCE_SUBSCRIPTION);
        state.set(WorkerState.LISTENING);
    }

    private void nack(Delivery delivery, String msgId) {
        nackedTotal.incrementAndGet();
        try {
            delivery.nack();
        } catch (RuntimeException e) {
            log.error("Nack failed. message_id={}", msgId, e);
        }
        state.set(WorkerState.LISTENING);
    }

    Resolution process(PendingJob pending, String source) {
        state.set(WorkerState.DISPATCHING);
        PendingJob current = pending;
        ExecutionResult result;
        try {
            Dispatcher.Dispatch dispatch = dispatcher.execute(pending, source);
            current = dispatch.job();
            result = dispatch.result();
        } catch (RuntimeException e) {
            log.error("Unexpected error. message_id={} source={}", pending.messageId(), source, e);
            result = ExecutionResult.failed(ExecutionResult.FAILURE_UNEXPECTED, "", "", Duration.ZERO);
        }

        if (result.success()) {
            state.set(WorkerState.COMPLETE);
            completedTotal.incrementAndGet();
            log.info("Done. message_id={} elapsed_sec={}", current.messageId(), result.duration().toMillis() / 1000.0d);
            return Resolution.COMPLETED;
        }

        state.set(WorkerState.RETRY_DECISION);
        Optional<ErrorGenre> genre = FailureClassifier.classify(result.exitStatus());
        genre.ifPresent(this::recordErrorEvent);
        try {
            current = stage.recordError(current, result.errorLabel());
        } catch (StageException e) {
            log.error("Failed to record last error. message_id={}", current.messageId(), e);
        }

        RetryOutcome outcome = retryPolicy.resubmit(current, genre, reason(result));
        if (!outcome.releasesStagedFile()) {
            keptTotal.incrementAndGet();
            log.warn("Queue file kept for next recovery. message_id={} outcome={} path={}",
                    current.messageId(), outcome, current.location());
            return Resolution.KEPT;
        }
        try {
            if (stage.delete(current)) {
                log.info("Queue file removed after retry decision. message_id={} outcome={} path={}",
                        current.messageId(), outcome, current.location());
            }
        } catch (StageException e) {
            log.error("Failed to remove queue file. message_id={} outcome={}", current.messageId(), outcome, e);
        }
        if (outcome == RetryOutcome.PUBLISHED) {
            resubmittedTotal.incrementAndGet();
            return Resolution.RESUBMITTED;
        }
        abandonedTotal.incrementAndGet();
        log.warn("Job abandoned. message_id={} outcome={} last_error={}", current.messageId(), outcome, result.errorLabel());
        return Resolution.ABANDONED;
    }

    private void recordErrorEvent(ErrorGenre genre) {
        try {
            errorSink.record(config.subscriptionName(), genre, Instant.now());
        } catch (RuntimeException e) {
            log.error("Error sink failed. subscription={} error_genre={}", config.subscriptionName(), genre.label(), e);
        }
    }

    private static String reason(ExecutionResult result) {
        if (result.exitStatus() != null) {
            return "subprocess_failed";
        }
        if (ExecutionResult.FAILURE_TIMEOUT.equals(result.failure())) {
            return ExecutionResult.FAILURE_TIMEOUT;
        }
        return ExecutionResult.FAILURE_UNEXPECTED;
    }

    private void finish() {
        state.set(WorkerState.STOPPED);
        log.info("Worker stopped. subscription={} completed={} resubmitted={} abandoned={} kept={} nacked={}",
                config.subscriptionName(), completedTotal.get(), resubmittedTotal.get(), abandonedTotal.get(),
                keptTotal.get(), nackedTotal.get());
    }

    public WorkerStats stats() {
        return new WorkerStats(
                config.subscriptionName(),
                state.get().name(),
                completedTotal.get(),
                resubmittedTotal.get(),
                abandonedTotal.get(),
                keptTotal.get(),
                nackedTotal.get()
        );
    }

    enum Resolution {
        COMPLETED,
        RESUBMITTED,
        ABANDONED,
        KEPT
    }

    public record WorkerStats(
            String subscription,
            String state,
            long completed,
            long resubmitted,
            long abandoned,
            long kept,
            long nacked
    ) {
    }
}
