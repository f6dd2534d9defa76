package de.mirkosertic.mcp.ruleengine.feedback;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Feedback log stored as JSON Lines, one sample per line. Lines that cannot be parsed are skipped
 * with a warning so a torn last write does not lose the rest of the history.
 */
public class JsonLinesFeedbackLog implements FeedbackLog {

    private static final Logger logger = LoggerFactory.getLogger(JsonLinesFeedbackLog.class);

    public static final String FILE_NAME = "feedback.jsonl";

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonLinesFeedbackLog(final Path dataDirectory) {
        this(dataDirectory, new ObjectMapper());
    }

    JsonLinesFeedbackLog(final Path dataDirectory, final ObjectMapper objectMapper) {
        this.file = dataDirectory.resolve(FILE_NAME);
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized void append(final FeedbackSample sample) throws IOException {
        Files.createDirectories(file.getParent());
        final String line = objectMapper.writeValueAsString(toJson(sample));
        try (final Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            writer.write(line);
            writer.write('\n');
        }
    }

    @Override
    public synchronized List<FeedbackSample> readAll() throws IOException {
        if (!Files.exists(file)) {
            return List.of();
        }
        final List<FeedbackSample> samples = new ArrayList<>();
        try (final BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    samples.add(fromJson(objectMapper.readTree(line)));
                } catch (final JsonProcessingException | DateTimeParseException | IllegalArgumentException e) {
                    logger.warn("Skipping unreadable feedback entry at {}:{}: {}", file, lineNumber, e.getMessage());
                }
            }
        }
        logger.debug("Read {} feedback samples from {}", samples.size(), file);
        return samples;
    }

    public Path getFile() {
        return file;
    }

    private ObjectNode toJson(final FeedbackSample sample) {
        final ObjectNode node = objectMapper.createObjectNode();
        node.put("findingId", sample.findingId());
        node.put("rawConfidence", sample.rawConfidence());
        node.put("correct", sample.correct());
        final FeedbackSample.FeedbackMetadata metadata = sample.metadata();
        if (metadata.discipline() != null) {
            node.put("discipline", metadata.discipline());
        }
        if (metadata.documentType() != null) {
            node.put("documentType", metadata.documentType());
        }
        if (metadata.ruleId() != null) {
            node.put("ruleId", metadata.ruleId());
        }
        node.put("recordedAt", sample.recordedAt().toString());
        return node;
    }

    private static FeedbackSample fromJson(final JsonNode node) {
        final JsonNode findingId = node.get("findingId");
        final JsonNode rawConfidence = node.get("rawConfidence");
        final JsonNode correct = node.get("correct");
        final JsonNode recordedAt = node.get("recordedAt");
        if (findingId == null || rawConfidence == null || correct == null || recordedAt == null) {
            throw new IllegalArgumentException("missing required field");
        }
        return new FeedbackSample(
                findingId.asText(),
                rawConfidence.asDouble(),
                correct.asBoolean(),
                new FeedbackSample.FeedbackMetadata(
                        textOrNull(node, "discipline"),
                        textOrNull(node, "documentType"),
                        textOrNull(node, "ruleId")),
                Instant.parse(recordedAt.asText()));
    }

    private static @Nullable String textOrNull(final JsonNode node, final String field) {
        final JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
