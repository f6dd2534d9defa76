package de.mirkosertic.mcp.ruleengine.feedback;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.mirkosertic.mcp.ruleengine.calibration.CalibrationPair;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Append-only collection of user feedback on findings.
 * <p>
 * A sample is written to the {@link FeedbackLog} first and only then becomes visible in memory,
 * so every sample a reader sees is durable. Writers are serialized; readers get snapshots.
 */
public class FeedbackStore {

    private static final Logger logger = LoggerFactory.getLogger(FeedbackStore.class);

    private static final String UNKNOWN_DISCIPLINE = "unknown";

    private final FeedbackLog log;
    private final Clock clock;
    private final List<FeedbackSample> samples = new ArrayList<>();

    public FeedbackStore(final FeedbackLog log) {
        this(log, Clock.systemUTC());
    }

    public FeedbackStore(final FeedbackLog log, final Clock clock) {
        this.log = log;
        this.clock = clock;
        try {
            samples.addAll(log.readAll());
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot read feedback log", e);
        }
        logger.info("Feedback store initialized with {} samples", samples.size());
    }

    public FeedbackSample record(final String findingId, final double rawConfidence, final boolean correct) {
        return record(findingId, rawConfidence, correct, null);
    }

    /**
     * Validate and persist one sample.
     *
     * @throws IllegalArgumentException if the finding id is blank or the confidence is outside [0, 1]
     * @throws UncheckedIOException     if the log cannot be written; the sample is then not recorded
     */
    public FeedbackSample record(final String findingId, final double rawConfidence, final boolean correct,
                                 final FeedbackSample.@Nullable FeedbackMetadata metadata) {
        if (findingId == null || findingId.isBlank()) {
            throw new IllegalArgumentException("findingId must not be blank");
        }
        if (!(rawConfidence >= 0.0 && rawConfidence <= 1.0)) {
            throw new IllegalArgumentException("rawConfidence must be within [0, 1], was " + rawConfidence);
        }
        final FeedbackSample sample = new FeedbackSample(findingId.trim(), rawConfidence, correct,
                metadata != null ? metadata : FeedbackSample.FeedbackMetadata.NONE, clock.instant());
        synchronized (samples) {
            try {
                log.append(sample);
            } catch (final IOException e) {
                throw new UncheckedIOException("Cannot persist feedback for finding " + findingId, e);
            }
            samples.add(sample);
        }
        logger.debug("Recorded feedback for finding {} (confidence={}, correct={})", findingId, rawConfidence, correct);
        return sample;
    }

    /**
     * @return all samples when at least {@code minCount} exist, otherwise an empty list
     */
    public List<FeedbackSample> sample(final int minCount) {
        final List<FeedbackSample> snapshot = snapshot();
        return snapshot.size() >= minCount ? snapshot : List.of();
    }

    public List<FeedbackSample> snapshot() {
        synchronized (samples) {
            return List.copyOf(samples);
        }
    }

    public List<CalibrationPair> toPairs() {
        return snapshot().stream().map(FeedbackSample::toPair).toList();
    }

    public int size() {
        synchronized (samples) {
            return samples.size();
        }
    }

    public FeedbackStats stats() {
        final List<FeedbackSample> snapshot = snapshot();
        final Map<String, Integer> byDiscipline = new TreeMap<>();
        int correct = 0;
        double correctSum = 0.0;
        double incorrectSum = 0.0;
        for (final FeedbackSample sample : snapshot) {
            final String discipline = sample.metadata().discipline();
            byDiscipline.merge(discipline != null ? discipline : UNKNOWN_DISCIPLINE, 1, Integer::sum);
            if (sample.correct()) {
                correct++;
                correctSum += sample.rawConfidence();
            } else {
                incorrectSum += sample.rawConfidence();
            }
        }
        final int incorrect = snapshot.size() - correct;
        return new FeedbackStats(
                snapshot.size(),
                correct,
                incorrect,
                byDiscipline,
                correct == 0 ? Double.NaN : correctSum / correct,
                incorrect == 0 ? Double.NaN : incorrectSum / incorrect);
    }

    /**
     * Write all samples as one pretty-printed JSON array.
     */
    public void exportTo(final Path target) throws IOException {
        final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        final ArrayNode array = objectMapper.createArrayNode();
        final List<FeedbackSample> snapshot = snapshot();
        for (final FeedbackSample sample : snapshot) {
            final ObjectNode node = array.addObject();
            node.put("findingId", sample.findingId());
            node.put("rawConfidence", sample.rawConfidence());
            node.put("correct", sample.correct());
            node.put("discipline", sample.metadata().discipline());
            node.put("documentType", sample.metadata().documentType());
            node.put("ruleId", sample.metadata().ruleId());
            node.put("recordedAt", sample.recordedAt().toString());
        }
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        objectMapper.writeValue(target.toFile(), array);
        logger.info("Exported {} feedback samples to {}", snapshot.size(), target);
    }
}
