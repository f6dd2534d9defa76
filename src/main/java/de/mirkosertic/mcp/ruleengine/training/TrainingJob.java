package de.mirkosertic.mcp.ruleengine.training;

import de.mirkosertic.mcp.ruleengine.calibration.CalibrationModel;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Record of one training run.
 *
 * @param id          unique job id
 * @param status      final status
 * @param startedAt   start of the run
 * @param finishedAt  end of the run
 * @param sampleCount feedback samples available when the run started
 * @param model       fitted model, present for SUCCEEDED jobs
 * @param deployed    whether {@code model} became the active model
 * @param gate        quality gate outcome, present for SUCCEEDED jobs
 * @param reason      why the job was skipped, failed or not deployed
 * @param attempt     whether the run counts as a training attempt for scheduling
 */
public record TrainingJob(
        String id,
        JobStatus status,
        Instant startedAt,
        @Nullable Instant finishedAt,
        int sampleCount,
        @Nullable CalibrationModel model,
        boolean deployed,
        @Nullable GateComparison gate,
        @Nullable String reason,
        boolean attempt
) {

    public static final String REASON_ALREADY_RUNNING = "training already running";
    public static final String REASON_NOT_DUE = "training not due";
    public static final String REASON_INSUFFICIENT_DATA = "insufficient data";
    public static final String REASON_GATE_NOT_PASSED = "candidate did not improve ECE enough";

    Map<String, Object> toMap() {
        final Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("status", status.name());
        map.put("startedAt", startedAt.toString());
        if (finishedAt != null) {
            map.put("finishedAt", finishedAt.toString());
        }
        map.put("sampleCount", sampleCount);
        if (model != null) {
            map.put("model", model.toMap());
        }
        map.put("deployed", deployed);
        if (gate != null) {
            map.put("gate", gate.toMap());
        }
        if (reason != null) {
            map.put("reason", reason);
        }
        map.put("attempt", attempt);
        return map;
    }

    @SuppressWarnings("unchecked")
    static TrainingJob fromMap(final Map<String, Object> map) {
        final Object finishedAt = map.get("finishedAt");
        final Object model = map.get("model");
        final Object gate = map.get("gate");
        final Object reason = map.get("reason");
        return new TrainingJob(
                String.valueOf(map.get("id")),
                JobStatus.valueOf(String.valueOf(map.get("status"))),
                Instant.parse(String.valueOf(map.get("startedAt"))),
                finishedAt != null ? Instant.parse(finishedAt.toString()) : null,
                map.get("sampleCount") instanceof Number n ? n.intValue() : 0,
                model != null ? CalibrationModel.fromMap((Map<String, Object>) model) : null,
                Boolean.TRUE.equals(map.get("deployed")),
                gate != null ? GateComparison.fromMap((Map<String, Object>) gate) : null,
                reason != null ? reason.toString() : null,
                Boolean.TRUE.equals(map.get("attempt")));
    }
}
