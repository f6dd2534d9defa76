package de.mirkosertic.mcp.ruleengine.calibration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;

/**
 * Persists the deployed calibration model as YAML ({@code active-model.yaml} in the data directory).
 * The file is written to a temporary sibling first and then moved into place.
 */
public class CalibrationModelRepository {

    private static final Logger logger = LoggerFactory.getLogger(CalibrationModelRepository.class);

    public static final String FILE_NAME = "active-model.yaml";

    private final Path file;
    private final Yaml yaml;

    public CalibrationModelRepository(final Path dataDirectory) {
        this.file = dataDirectory.resolve(FILE_NAME);
        final DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);
        this.yaml = new Yaml(options);
    }

    /**
     * @return the persisted model; empty when none was saved or the file is unreadable
     */
    public synchronized Optional<CalibrationModel> load() {
        if (!Files.exists(file)) {
            logger.debug("No persisted calibration model at {}", file);
            return Optional.empty();
        }
        try (final Reader reader = Files.newBufferedReader(file)) {
            final Map<String, Object> document = yaml.load(reader);
            if (document == null) {
                return Optional.empty();
            }
            final CalibrationModel model = CalibrationModel.fromMap(document);
            logger.info("Loaded calibration model {} (ECE={}) from {}", model.method(), model.ece(), file);
            return Optional.of(model);
        } catch (final IOException | YAMLException | IllegalArgumentException | ClassCastException e) {
            logger.error("Failed to load calibration model from {}, starting with identity", file, e);
            return Optional.empty();
        }
    }

    public synchronized void save(final CalibrationModel model) throws IOException {
        Files.createDirectories(file.getParent());
        final Path temp = file.resolveSibling(FILE_NAME + ".tmp");
        try (final Writer writer = Files.newBufferedWriter(temp)) {
            yaml.dump(model.toMap(), writer);
        }
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        logger.info("Saved calibration model {} to {}", model.method(), file);
    }

    public Path getFile() {
        return file;
    }
}
