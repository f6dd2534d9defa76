package de.mirkosertic.mcp.ruleengine.feedback;

import de.mirkosertic.mcp.ruleengine.calibration.CalibrationPair;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * One user verdict on a finding: the raw confidence the generator reported and whether the
 * finding turned out to be correct.
 *
 * @param findingId     id of the judged finding
 * @param rawConfidence uncalibrated confidence, within [0, 1]
 * @param correct       user verdict
 * @param metadata      optional context of the finding
 * @param recordedAt    when the verdict was recorded
 */
public record FeedbackSample(
        String findingId,
        double rawConfidence,
        boolean correct,
        FeedbackMetadata metadata,
        Instant recordedAt
) {

    public CalibrationPair toPair() {
        return new CalibrationPair(rawConfidence, correct);
    }

    /**
     * Context a finding was produced in. Every part is optional.
     */
    public record FeedbackMetadata(@Nullable String discipline, @Nullable String documentType, @Nullable String ruleId) {

        public static final FeedbackMetadata NONE = new FeedbackMetadata(null, null, null);
    }
}
