package de.mirkosertic.mcp.ruleengine.config;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Central configuration for the rule engine.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.ruleengine/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 * <p>
 * All values are validated once by {@link #validate()}; components never re-check them per call.
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_DATA_DIR = "RULEENGINE_DATA_DIR";
    private static final String ENV_CATALOG_PATH = "RULEENGINE_CATALOG_PATH";
    private static final String ENV_VOCABULARY_PATH = "RULEENGINE_VOCABULARY_PATH";
    public static final String PROP_PROFILE = "ruleengine.profile";
    private static final String CONFIG_DIR = ".ruleengine";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Storage
    private String dataDir;
    private @Nullable String vocabularyPath;
    private @Nullable String catalogPath;

    // Query expansion
    private int maxExpansionTerms = 10;
    private double synonymWeight = 0.9;
    private double abbreviationWeight = 0.8;
    private double specialtyWeight = 0.7;
    private double contextWeight = 0.6;
    private double documentTypeWeight = 0.6;
    private int specialtyLimit = 3;
    private int contextEntityLimit = 5;

    // Retrieval
    private int rrfK = 60;
    private double lexicalWeight = 1.0;
    private double denseWeight = 1.0;
    private int candidateDepth = 100;
    private int defaultTopK = 10;
    private boolean rerankEnabled = false;
    private int rerankDepth = 20;
    private int embeddingDimension = 256;
    private double denseMinSimilarity = 0.0;
    private long embeddingCacheSize = 10_000;

    // Calibration
    private int minCalibrationSamples = 50;
    private int eceBins = 10;
    private double validationFraction = 0.2;
    private long randomSeed = 42L;

    // Training
    private boolean trainingScheduleEnabled = true;
    private int trainingIntervalDays = 7;
    private int feedbackDelta = 100;
    private double improvementThreshold = 0.05;
    private long scheduleIntervalHours = 24;

    // Profile settings
    private boolean deployedMode = false;

    private ApplicationConfig() {
        this.dataDir = getConfigDirectory().resolve("data").toString();
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        config.loadFromClasspath();
        config.loadFromUserConfig();
        config.applyEnvironmentOverrides();
        config.determineProfile();
        config.validate();

        logger.info("Configuration loaded: dataDir={}, catalogPath={}, vocabularyPath={}, rerank={}, deployedMode={}",
                config.dataDir, config.catalogPath, config.vocabularyPath, config.rerankEnabled, config.deployedMode);

        return config;
    }

    /**
     * Built-in defaults only, without reading any file or environment variable.
     */
    public static ApplicationConfig defaults() {
        return new ApplicationConfig();
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    /**
     * Apply a parsed YAML document. Unknown keys are ignored; missing keys keep their current value.
     */
    @SuppressWarnings("unchecked")
    public void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> engineConfig = (Map<String, Object>) config.get("engine");
        if (engineConfig == null) {
            return;
        }

        if (engineConfig.get("data-dir") != null) {
            this.dataDir = resolveVariables(engineConfig.get("data-dir").toString());
        }

        final Map<String, Object> vocabularyConfig = (Map<String, Object>) engineConfig.get("vocabulary");
        if (vocabularyConfig != null && vocabularyConfig.get("path") != null) {
            this.vocabularyPath = blankToNull(resolveVariables(vocabularyConfig.get("path").toString()));
        }

        final Map<String, Object> catalogConfig = (Map<String, Object>) engineConfig.get("catalog");
        if (catalogConfig != null && catalogConfig.get("path") != null) {
            this.catalogPath = blankToNull(resolveVariables(catalogConfig.get("path").toString()));
        }

        final Map<String, Object> expansionConfig = (Map<String, Object>) engineConfig.get("expansion");
        if (expansionConfig != null) {
            applyExpansionConfig(expansionConfig);
        }

        final Map<String, Object> retrievalConfig = (Map<String, Object>) engineConfig.get("retrieval");
        if (retrievalConfig != null) {
            applyRetrievalConfig(retrievalConfig);
        }

        final Map<String, Object> calibrationConfig = (Map<String, Object>) engineConfig.get("calibration");
        if (calibrationConfig != null) {
            applyCalibrationConfig(calibrationConfig);
        }

        final Map<String, Object> trainingConfig = (Map<String, Object>) engineConfig.get("training");
        if (trainingConfig != null) {
            applyTrainingConfig(trainingConfig);
        }
    }

    private void applyExpansionConfig(final Map<String, Object> expansionConfig) {
        if (expansionConfig.containsKey("max-terms")) {
            this.maxExpansionTerms = ((Number) expansionConfig.get("max-terms")).intValue();
        }
        if (expansionConfig.containsKey("synonym-weight")) {
            this.synonymWeight = ((Number) expansionConfig.get("synonym-weight")).doubleValue();
        }
        if (expansionConfig.containsKey("abbreviation-weight")) {
            this.abbreviationWeight = ((Number) expansionConfig.get("abbreviation-weight")).doubleValue();
        }
        if (expansionConfig.containsKey("specialty-weight")) {
            this.specialtyWeight = ((Number) expansionConfig.get("specialty-weight")).doubleValue();
        }
        if (expansionConfig.containsKey("context-weight")) {
            this.contextWeight = ((Number) expansionConfig.get("context-weight")).doubleValue();
        }
        if (expansionConfig.containsKey("document-type-weight")) {
            this.documentTypeWeight = ((Number) expansionConfig.get("document-type-weight")).doubleValue();
        }
        if (expansionConfig.containsKey("specialty-limit")) {
            this.specialtyLimit = ((Number) expansionConfig.get("specialty-limit")).intValue();
        }
        if (expansionConfig.containsKey("context-entity-limit")) {
            this.contextEntityLimit = ((Number) expansionConfig.get("context-entity-limit")).intValue();
        }
    }

    private void applyRetrievalConfig(final Map<String, Object> retrievalConfig) {
        if (retrievalConfig.containsKey("rrf-k")) {
            this.rrfK = ((Number) retrievalConfig.get("rrf-k")).intValue();
        }
        if (retrievalConfig.containsKey("lexical-weight")) {
            this.lexicalWeight = ((Number) retrievalConfig.get("lexical-weight")).doubleValue();
        }
        if (retrievalConfig.containsKey("dense-weight")) {
            this.denseWeight = ((Number) retrievalConfig.get("dense-weight")).doubleValue();
        }
        if (retrievalConfig.containsKey("candidate-depth")) {
            this.candidateDepth = ((Number) retrievalConfig.get("candidate-depth")).intValue();
        }
        if (retrievalConfig.containsKey("top-k")) {
            this.defaultTopK = ((Number) retrievalConfig.get("top-k")).intValue();
        }
        if (retrievalConfig.containsKey("rerank-enabled")) {
            this.rerankEnabled = (Boolean) retrievalConfig.get("rerank-enabled");
        }
        if (retrievalConfig.containsKey("rerank-depth")) {
            this.rerankDepth = ((Number) retrievalConfig.get("rerank-depth")).intValue();
        }
        if (retrievalConfig.containsKey("embedding-dimension")) {
            this.embeddingDimension = ((Number) retrievalConfig.get("embedding-dimension")).intValue();
        }
        if (retrievalConfig.containsKey("dense-min-similarity")) {
            this.denseMinSimilarity = ((Number) retrievalConfig.get("dense-min-similarity")).doubleValue();
        }
        if (retrievalConfig.containsKey("embedding-cache-size")) {
            this.embeddingCacheSize = ((Number) retrievalConfig.get("embedding-cache-size")).longValue();
        }
    }

    private void applyCalibrationConfig(final Map<String, Object> calibrationConfig) {
        if (calibrationConfig.containsKey("min-samples")) {
            this.minCalibrationSamples = ((Number) calibrationConfig.get("min-samples")).intValue();
        }
        if (calibrationConfig.containsKey("ece-bins")) {
            this.eceBins = ((Number) calibrationConfig.get("ece-bins")).intValue();
        }
        if (calibrationConfig.containsKey("validation-fraction")) {
            this.validationFraction = ((Number) calibrationConfig.get("validation-fraction")).doubleValue();
        }
        if (calibrationConfig.containsKey("random-seed")) {
            this.randomSeed = ((Number) calibrationConfig.get("random-seed")).longValue();
        }
    }

    private void applyTrainingConfig(final Map<String, Object> trainingConfig) {
        if (trainingConfig.containsKey("schedule-enabled")) {
            this.trainingScheduleEnabled = (Boolean) trainingConfig.get("schedule-enabled");
        }
        if (trainingConfig.containsKey("interval-days")) {
            this.trainingIntervalDays = ((Number) trainingConfig.get("interval-days")).intValue();
        }
        if (trainingConfig.containsKey("feedback-delta")) {
            this.feedbackDelta = ((Number) trainingConfig.get("feedback-delta")).intValue();
        }
        if (trainingConfig.containsKey("improvement-threshold")) {
            this.improvementThreshold = ((Number) trainingConfig.get("improvement-threshold")).doubleValue();
        }
        if (trainingConfig.containsKey("schedule-interval-hours")) {
            this.scheduleIntervalHours = ((Number) trainingConfig.get("schedule-interval-hours")).longValue();
        }
    }

    private void applyEnvironmentOverrides() {
        final String envDataDir = System.getenv(ENV_DATA_DIR);
        if (envDataDir != null && !envDataDir.trim().isEmpty()) {
            this.dataDir = envDataDir.trim();
            logger.info("Data directory from environment: {}", this.dataDir);
        }

        final String envCatalog = System.getenv(ENV_CATALOG_PATH);
        if (envCatalog != null && !envCatalog.trim().isEmpty()) {
            this.catalogPath = envCatalog.trim();
            logger.info("Rule catalog from environment: {}", this.catalogPath);
        }

        final String envVocabulary = System.getenv(ENV_VOCABULARY_PATH);
        if (envVocabulary != null && !envVocabulary.trim().isEmpty()) {
            this.vocabularyPath = envVocabulary.trim();
            logger.info("Vocabulary from environment: {}", this.vocabularyPath);
        }

        final String propDataDir = System.getProperty("ruleengine.data.dir");
        if (propDataDir != null && !propDataDir.isEmpty()) {
            this.dataDir = propDataDir;
        }
        final String propCatalog = System.getProperty("ruleengine.catalog.path");
        if (propCatalog != null && !propCatalog.isEmpty()) {
            this.catalogPath = propCatalog;
        }
    }

    private void determineProfile() {
        final String profile = System.getProperty(PROP_PROFILE,
                System.getProperty("profile", "default"));
        this.deployedMode = "deployed".equalsIgnoreCase(profile);
    }

    /**
     * Check every tuning value. Called once at startup.
     *
     * @throws ConfigurationException describing the first invalid value found
     */
    public void validate() {
        if (maxExpansionTerms < 0) {
            throw new ConfigurationException("expansion.max-terms must not be negative, was " + maxExpansionTerms);
        }
        requireWeight("expansion.synonym-weight", synonymWeight);
        requireWeight("expansion.abbreviation-weight", abbreviationWeight);
        requireWeight("expansion.specialty-weight", specialtyWeight);
        requireWeight("expansion.context-weight", contextWeight);
        requireWeight("expansion.document-type-weight", documentTypeWeight);
        if (specialtyLimit < 0 || contextEntityLimit < 0) {
            throw new ConfigurationException("expansion limits must not be negative");
        }
        if (rrfK <= 0) {
            throw new ConfigurationException("retrieval.rrf-k must be positive, was " + rrfK);
        }
        if (lexicalWeight <= 0 || denseWeight <= 0) {
            throw new ConfigurationException("retrieval fusion weights must be positive");
        }
        if (candidateDepth <= 0 || defaultTopK <= 0 || rerankDepth <= 0) {
            throw new ConfigurationException("retrieval depths and top-k must be positive");
        }
        if (embeddingDimension <= 0 || embeddingDimension > 1024) {
            throw new ConfigurationException("retrieval.embedding-dimension must be in 1..1024, was " + embeddingDimension);
        }
        if (denseMinSimilarity < -1.0 || denseMinSimilarity >= 1.0) {
            throw new ConfigurationException("retrieval.dense-min-similarity must be in [-1, 1), was " + denseMinSimilarity);
        }
        if (embeddingCacheSize < 0) {
            throw new ConfigurationException("retrieval.embedding-cache-size must not be negative");
        }
        if (minCalibrationSamples < 2) {
            throw new ConfigurationException("calibration.min-samples must be at least 2, was " + minCalibrationSamples);
        }
        if (eceBins < 1) {
            throw new ConfigurationException("calibration.ece-bins must be positive, was " + eceBins);
        }
        if (validationFraction <= 0.0 || validationFraction >= 1.0) {
            throw new ConfigurationException("calibration.validation-fraction must be in (0, 1), was " + validationFraction);
        }
        if (trainingIntervalDays < 0 || feedbackDelta < 1) {
            throw new ConfigurationException("training.interval-days must not be negative and training.feedback-delta must be positive");
        }
        if (improvementThreshold < 0.0 || improvementThreshold >= 1.0) {
            throw new ConfigurationException("training.improvement-threshold must be in [0, 1), was " + improvementThreshold);
        }
        if (scheduleIntervalHours <= 0) {
            throw new ConfigurationException("training.schedule-interval-hours must be positive");
        }
    }

    private static void requireWeight(final String name, final double value) {
        if (!(value > 0.0 && value <= 1.0)) {
            throw new ConfigurationException(name + " must be in (0, 1], was " + value);
        }
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    private static @Nullable String blankToNull(final String value) {
        return value.isBlank() ? null : value;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    // Getters and setters

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(final String dataDir) {
        this.dataDir = dataDir;
    }

    public @Nullable String getVocabularyPath() {
        return vocabularyPath;
    }

    public void setVocabularyPath(final @Nullable String vocabularyPath) {
        this.vocabularyPath = vocabularyPath;
    }

    public @Nullable String getCatalogPath() {
        return catalogPath;
    }

    public void setCatalogPath(final @Nullable String catalogPath) {
        this.catalogPath = catalogPath;
    }

    public int getMaxExpansionTerms() {
        return maxExpansionTerms;
    }

    public void setMaxExpansionTerms(final int maxExpansionTerms) {
        this.maxExpansionTerms = maxExpansionTerms;
    }

    public double getSynonymWeight() {
        return synonymWeight;
    }

    public double getAbbreviationWeight() {
        return abbreviationWeight;
    }

    public double getSpecialtyWeight() {
        return specialtyWeight;
    }

    public double getContextWeight() {
        return contextWeight;
    }

    public double getDocumentTypeWeight() {
        return documentTypeWeight;
    }

    public int getSpecialtyLimit() {
        return specialtyLimit;
    }

    public int getContextEntityLimit() {
        return contextEntityLimit;
    }

    public int getRrfK() {
        return rrfK;
    }

    public void setRrfK(final int rrfK) {
        this.rrfK = rrfK;
    }

    public double getLexicalWeight() {
        return lexicalWeight;
    }

    public double getDenseWeight() {
        return denseWeight;
    }

    public int getCandidateDepth() {
        return candidateDepth;
    }

    public int getDefaultTopK() {
        return defaultTopK;
    }

    public boolean isRerankEnabled() {
        return rerankEnabled;
    }

    public void setRerankEnabled(final boolean rerankEnabled) {
        this.rerankEnabled = rerankEnabled;
    }

    public int getRerankDepth() {
        return rerankDepth;
    }

    public int getEmbeddingDimension() {
        return embeddingDimension;
    }

    public double getDenseMinSimilarity() {
        return denseMinSimilarity;
    }

    public long getEmbeddingCacheSize() {
        return embeddingCacheSize;
    }

    public int getMinCalibrationSamples() {
        return minCalibrationSamples;
    }

    public void setMinCalibrationSamples(final int minCalibrationSamples) {
        this.minCalibrationSamples = minCalibrationSamples;
    }

    public int getEceBins() {
        return eceBins;
    }

    public double getValidationFraction() {
        return validationFraction;
    }

    public void setValidationFraction(final double validationFraction) {
        this.validationFraction = validationFraction;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    public boolean isTrainingScheduleEnabled() {
        return trainingScheduleEnabled;
    }

    public void setTrainingScheduleEnabled(final boolean trainingScheduleEnabled) {
        this.trainingScheduleEnabled = trainingScheduleEnabled;
    }

    public int getTrainingIntervalDays() {
        return trainingIntervalDays;
    }

    public int getFeedbackDelta() {
        return feedbackDelta;
    }

    public void setFeedbackDelta(final int feedbackDelta) {
        this.feedbackDelta = feedbackDelta;
    }

    public double getImprovementThreshold() {
        return improvementThreshold;
    }

    public void setImprovementThreshold(final double improvementThreshold) {
        this.improvementThreshold = improvementThreshold;
    }

    public long getScheduleIntervalHours() {
        return scheduleIntervalHours;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
