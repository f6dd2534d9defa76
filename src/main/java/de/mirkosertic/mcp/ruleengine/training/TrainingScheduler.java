package de.mirkosertic.mcp.ruleengine.training;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs training off the request path: periodic {@code maybeTrain(false)} checks and on-demand jobs
 * share one daemon thread. On-demand triggers are single-flight.
 */
public class TrainingScheduler implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TrainingScheduler.class);

    private final TrainingOrchestrator orchestrator;
    private final Duration interval;
    private final ScheduledExecutorService executor =
            Executors.newSingleThreadScheduledExecutor(r -> {
                final Thread t = new Thread(r, "calibration-training");
                t.setDaemon(true);
                return t;
            });

    private final AtomicBoolean triggerPending = new AtomicBoolean(false);

    private volatile @Nullable ScheduledFuture<?> periodic;
    private volatile @Nullable Instant nextRunAt;

    public TrainingScheduler(final TrainingOrchestrator orchestrator, final Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.orchestrator = orchestrator;
        this.interval = interval;
    }

    public synchronized void start() {
        if (periodic != null) {
            return;
        }
        final long millis = interval.toMillis();
        nextRunAt = Instant.now().plus(interval);
        periodic = executor.scheduleAtFixedRate(this::runScheduled, millis, millis, TimeUnit.MILLISECONDS);
        logger.info("Calibration training check scheduled every {}", interval);
    }

    private void runScheduled() {
        nextRunAt = Instant.now().plus(interval);
        try {
            final TrainingJob job = orchestrator.maybeTrain(false);
            logger.debug("Scheduled training check finished with {} ({})", job.status(), job.reason());
        } catch (final RuntimeException e) {
            // an exception would cancel all further runs
            logger.error("Scheduled training check failed", e);
        }
    }

    /**
     * Run a job on the training thread. While a job is running or another trigger is pending, the
     * returned future is already completed with a SKIPPED job and nothing is queued.
     */
    public CompletableFuture<TrainingJob> trigger(final boolean force) {
        if (orchestrator.isRunning() || !triggerPending.compareAndSet(false, true)) {
            return CompletableFuture.completedFuture(orchestrator.rejectConcurrentTrigger());
        }
        try {
            return CompletableFuture.supplyAsync(() -> orchestrator.maybeTrain(force), executor)
                    .whenComplete((job, error) -> triggerPending.set(false));
        } catch (final RejectedExecutionException e) {
            triggerPending.set(false);
            throw e;
        }
    }

    public @Nullable Instant getNextRunAt() {
        return periodic != null ? nextRunAt : null;
    }

    public boolean isStarted() {
        return periodic != null;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
