package de.mirkosertic.mcp.ruleengine.training;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Job history as JSON Lines ({@code training-jobs.jsonl} in the data directory).
 */
public class TrainingJobLog {

    private static final Logger logger = LoggerFactory.getLogger(TrainingJobLog.class);

    public static final String FILE_NAME = "training-jobs.jsonl";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public TrainingJobLog(final Path dataDirectory) {
        this.file = dataDirectory.resolve(FILE_NAME);
    }

    public synchronized void append(final TrainingJob job) throws IOException {
        Files.createDirectories(file.getParent());
        try (final Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            writer.write(objectMapper.writeValueAsString(job.toMap()));
            writer.write('\n');
        }
    }

    /**
     * @return persisted jobs, oldest first; unreadable lines are skipped
     */
    public synchronized List<TrainingJob> readAll() throws IOException {
        if (!Files.exists(file)) {
            return List.of();
        }
        final List<TrainingJob> jobs = new ArrayList<>();
        try (final BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    jobs.add(TrainingJob.fromMap(objectMapper.readValue(line, MAP_TYPE)));
                } catch (final JsonProcessingException | RuntimeException e) {
                    logger.warn("Skipping unreadable training job entry in {}: {}", file, e.getMessage());
                }
            }
        }
        return jobs;
    }

    public Path getFile() {
        return file;
    }
}
