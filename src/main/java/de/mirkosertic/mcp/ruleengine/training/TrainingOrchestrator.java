package de.mirkosertic.mcp.ruleengine.training;

import de.mirkosertic.mcp.ruleengine.calibration.ActiveCalibrationModel;
import de.mirkosertic.mcp.ruleengine.calibration.CalibrationEvaluation;
import de.mirkosertic.mcp.ruleengine.calibration.CalibrationFailedException;
import de.mirkosertic.mcp.ruleengine.calibration.CalibrationModel;
import de.mirkosertic.mcp.ruleengine.calibration.CalibrationModelRepository;
import de.mirkosertic.mcp.ruleengine.calibration.CalibrationPair;
import de.mirkosertic.mcp.ruleengine.calibration.ConfidenceCalibrator;
import de.mirkosertic.mcp.ruleengine.calibration.FitResult;
import de.mirkosertic.mcp.ruleengine.calibration.InsufficientDataException;
import de.mirkosertic.mcp.ruleengine.config.ApplicationConfig;
import de.mirkosertic.mcp.ruleengine.feedback.FeedbackStore;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Retrains the calibration model from feedback and deploys a candidate only when it beats the
 * active model by the configured margin.
 * <p>
 * At most one job runs at a time; a second trigger while one is running is answered with a
 * SKIPPED job instead of being queued. Deployment persists the model first and then swaps it
 * into the {@link ActiveCalibrationModel}, so a failed write leaves the active model untouched.
 */
public class TrainingOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(TrainingOrchestrator.class);

    private static final int MAX_HISTORY = 100;
    private static final double STALE_MODEL_DAYS = 30.0;
    private static final double STALE_TRAINING_DAYS = 14.0;

    private final FeedbackStore feedbackStore;
    private final ConfidenceCalibrator calibrator;
    private final ActiveCalibrationModel activeModel;
    private final CalibrationModelRepository modelRepository;
    private final TrainingJobLog jobLog;
    private final Clock clock;

    private final Duration trainingInterval;
    private final int feedbackDelta;
    private final double improvementThreshold;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Deque<TrainingJob> history = new ArrayDeque<>();

    private volatile @Nullable Instant lastAttemptAt;
    private volatile int samplesAtLastAttempt;

    public TrainingOrchestrator(final ApplicationConfig config,
                                final FeedbackStore feedbackStore,
                                final ConfidenceCalibrator calibrator,
                                final CalibrationModelRepository modelRepository,
                                final TrainingJobLog jobLog,
                                final Clock clock) {
        this.feedbackStore = feedbackStore;
        this.calibrator = calibrator;
        this.activeModel = calibrator.getActiveModel();
        this.modelRepository = modelRepository;
        this.jobLog = jobLog;
        this.clock = clock;
        this.trainingInterval = Duration.ofDays(config.getTrainingIntervalDays());
        this.feedbackDelta = config.getFeedbackDelta();
        this.improvementThreshold = config.getImprovementThreshold();
        restoreHistory();
    }

    private void restoreHistory() {
        final List<TrainingJob> persisted;
        try {
            persisted = jobLog.readAll();
        } catch (final IOException e) {
            logger.warn("Cannot read training job history from {}, starting with an empty history", jobLog.getFile(), e);
            return;
        }
        for (final TrainingJob job : persisted) {
            remember(job);
            if (job.attempt()) {
                lastAttemptAt = job.startedAt();
                samplesAtLastAttempt = job.sampleCount();
            }
        }
        if (!persisted.isEmpty()) {
            logger.info("Restored {} training jobs, last attempt at {}", persisted.size(), lastAttemptAt);
        }
    }

    /**
     * Run one training job if one is due (or {@code force} is set).
     *
     * @return the job record, never null; failures are reported through its status
     */
    public TrainingJob maybeTrain(final boolean force) {
        final Instant startedAt = clock.instant();
        if (!running.compareAndSet(false, true)) {
            return rejectConcurrentTrigger();
        }
        try {
            final int available = feedbackStore.size();
            if (!force && !isDue(startedAt, available)) {
                logger.debug("Training not due ({} samples, last attempt {})", available, lastAttemptAt);
                return finish(new TrainingJob(newId(), JobStatus.SKIPPED, startedAt, clock.instant(),
                        available, null, false, null, TrainingJob.REASON_NOT_DUE, false));
            }
            lastAttemptAt = startedAt;
            samplesAtLastAttempt = available;
            return finish(train(startedAt));
        } finally {
            running.set(false);
        }
    }

    /**
     * Record a trigger that arrived while a job is running or pending. Nothing is trained.
     */
    public TrainingJob rejectConcurrentTrigger() {
        final Instant now = clock.instant();
        logger.info("Training trigger ignored, another job is running");
        return finish(new TrainingJob(newId(), JobStatus.SKIPPED, now, now,
                feedbackStore.size(), null, false, null, TrainingJob.REASON_ALREADY_RUNNING, false));
    }

    private TrainingJob train(final Instant startedAt) {
        final String id = newId();
        final List<CalibrationPair> pairs = feedbackStore.toPairs();
        logger.info("Training job {} started with {} feedback samples", id, pairs.size());

        final FitResult fit;
        try {
            final ConfidenceCalibrator.Split split = calibrator.split(pairs);
            fit = calibrator.fit(split.train(), split.validation());
        } catch (final InsufficientDataException e) {
            logger.info("Training job {} skipped: {} samples available, {} required", id, e.getAvailable(), e.getRequired());
            return new TrainingJob(id, JobStatus.SKIPPED, startedAt, clock.instant(), pairs.size(),
                    null, false, null, TrainingJob.REASON_INSUFFICIENT_DATA, true);
        } catch (final CalibrationFailedException e) {
            logger.error("Training job {} failed: {}", id, e.getMessage(), e);
            return new TrainingJob(id, JobStatus.FAILED, startedAt, clock.instant(), pairs.size(),
                    null, false, null, e.getMessage(), true);
        } catch (final RuntimeException e) {
            logger.error("Training job {} failed unexpectedly", id, e);
            return new TrainingJob(id, JobStatus.FAILED, startedAt, clock.instant(), pairs.size(),
                    null, false, null, String.valueOf(e.getMessage()), true);
        }

        final CalibrationModel candidate = fit.selected();
        final CalibrationEvaluation active = calibrator.evaluate(activeModel.get(), fit.validation());
        final GateComparison gate = GateComparison.evaluate(candidate.ece(), active.ece(), improvementThreshold);
        logger.info("Training job {}: candidate {} ECE={} vs active {} ECE={} (improvement {}%)",
                id, candidate.method(), candidate.ece(), activeModel.get().method(), active.ece(),
                Math.round(gate.relativeImprovement() * 1000.0) / 10.0);

        if (!gate.passed()) {
            return new TrainingJob(id, JobStatus.SUCCEEDED, startedAt, clock.instant(), pairs.size(),
                    candidate, false, gate, TrainingJob.REASON_GATE_NOT_PASSED, true);
        }
        try {
            modelRepository.save(candidate);
        } catch (final IOException e) {
            logger.error("Training job {}: cannot persist model, keeping the active model", id, e);
            return new TrainingJob(id, JobStatus.FAILED, startedAt, clock.instant(), pairs.size(),
                    candidate, false, gate, "cannot persist model: " + e.getMessage(), true);
        }
        final CalibrationModel previous = activeModel.swap(candidate);
        logger.info("Deployed calibration model {} (replacing {})", candidate.method(), previous.method());
        return new TrainingJob(id, JobStatus.SUCCEEDED, startedAt, clock.instant(), pairs.size(),
                candidate, true, gate, null, true);
    }

    private boolean isDue(final Instant now, final int available) {
        if (available - samplesAtLastAttempt >= feedbackDelta) {
            return true;
        }
        final Instant reference = latest(activeModel.get().trainedAt(), lastAttemptAt);
        return reference == null || !now.isBefore(reference.plus(trainingInterval));
    }

    private static @Nullable Instant latest(final @Nullable Instant a, final @Nullable Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isAfter(b) ? a : b;
    }

    private TrainingJob finish(final TrainingJob job) {
        remember(job);
        try {
            jobLog.append(job);
        } catch (final IOException e) {
            logger.warn("Cannot append training job {} to {}", job.id(), jobLog.getFile(), e);
        }
        return job;
    }

    private void remember(final TrainingJob job) {
        synchronized (history) {
            history.addLast(job);
            while (history.size() > MAX_HISTORY) {
                history.removeFirst();
            }
        }
    }

    /**
     * Current state of calibration. Reads only.
     */
    public CalibrationHealth health() {
        final CalibrationModel model = activeModel.get();
        final Instant now = clock.instant();
        final int total = feedbackStore.size();
        final Double modelAgeDays = model.trainedAt() != null ? daysBetween(model.trainedAt(), now) : null;
        final Optional<TrainingJob> last = lastJob();

        final List<String> warnings = new ArrayList<>();
        if (modelAgeDays != null && modelAgeDays > STALE_MODEL_DAYS) {
            warnings.add("Model is " + (long) Math.floor(modelAgeDays) + " days old");
        }
        final Instant attempt = lastAttemptAt;
        if (attempt != null && daysBetween(attempt, now) > STALE_TRAINING_DAYS) {
            warnings.add("No training for " + (long) Math.floor(daysBetween(attempt, now)) + " days");
        }
        if (last.isPresent() && last.get().status() == JobStatus.FAILED) {
            warnings.add("Last training job failed: " + last.get().reason());
        }

        return new CalibrationHealth(
                model.method(),
                model.ece(),
                model.brier(),
                total,
                Math.max(0, total - samplesAtLastAttempt),
                modelAgeDays,
                last.map(TrainingJob::status).orElse(null),
                last.map(TrainingJob::reason).orElse(null),
                warnings);
    }

    private static double daysBetween(final Instant from, final Instant to) {
        return Duration.between(from, to).toMillis() / (double) Duration.ofDays(1).toMillis();
    }

    public Optional<TrainingJob> lastJob() {
        synchronized (history) {
            return Optional.ofNullable(history.peekLast());
        }
    }

    /**
     * @return recent jobs, newest first
     */
    public List<TrainingJob> jobHistory() {
        synchronized (history) {
            final List<TrainingJob> jobs = new ArrayList<>(history);
            Collections.reverse(jobs);
            return jobs;
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
