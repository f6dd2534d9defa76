package de.mirkosertic.mcp.ruleengine;

import de.mirkosertic.mcp.ruleengine.calibration.ActiveCalibrationModel;
import de.mirkosertic.mcp.ruleengine.calibration.CalibrationModelRepository;
import de.mirkosertic.mcp.ruleengine.calibration.ConfidenceCalibrator;
import de.mirkosertic.mcp.ruleengine.config.ApplicationConfig;
import de.mirkosertic.mcp.ruleengine.expansion.ExpansionResult;
import de.mirkosertic.mcp.ruleengine.expansion.QueryExpander;
import de.mirkosertic.mcp.ruleengine.feedback.FeedbackSample;
import de.mirkosertic.mcp.ruleengine.feedback.FeedbackStats;
import de.mirkosertic.mcp.ruleengine.feedback.FeedbackStore;
import de.mirkosertic.mcp.ruleengine.feedback.JsonLinesFeedbackLog;
import de.mirkosertic.mcp.ruleengine.retrieval.CachingEmbeddingProvider;
import de.mirkosertic.mcp.ruleengine.retrieval.EmbeddingCacheStats;
import de.mirkosertic.mcp.ruleengine.retrieval.HashingEmbeddingProvider;
import de.mirkosertic.mcp.ruleengine.retrieval.HybridRetriever;
import de.mirkosertic.mcp.ruleengine.retrieval.MemoryIndexRelevanceScorer;
import de.mirkosertic.mcp.ruleengine.retrieval.RetrievalRuntimeStats;
import de.mirkosertic.mcp.ruleengine.retrieval.RetrievedRule;
import de.mirkosertic.mcp.ruleengine.retrieval.RuleCatalog;
import de.mirkosertic.mcp.ruleengine.training.CalibrationHealth;
import de.mirkosertic.mcp.ruleengine.training.TrainingJob;
import de.mirkosertic.mcp.ruleengine.training.TrainingJobLog;
import de.mirkosertic.mcp.ruleengine.training.TrainingOrchestrator;
import de.mirkosertic.mcp.ruleengine.training.TrainingScheduler;
import de.mirkosertic.mcp.ruleengine.vocabulary.VocabularyStore;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point to the engine: query expansion with rule retrieval on the request path, confidence
 * calibration with feedback-driven retraining beside it.
 * <p>
 * Retrieval and calibration never wait for training. Training runs on the scheduler thread and
 * only becomes visible through the atomic swap of the active calibration model.
 */
public class ComplianceRuleEngine implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ComplianceRuleEngine.class);

    private final ApplicationConfig config;
    private final VocabularyStore vocabulary;
    private final QueryExpander expander;
    private final HybridRetriever retriever;
    private final FeedbackStore feedbackStore;
    private final ConfidenceCalibrator calibrator;
    private final TrainingOrchestrator orchestrator;
    private final TrainingScheduler scheduler;

    public ComplianceRuleEngine(final ApplicationConfig config,
                                final VocabularyStore vocabulary,
                                final QueryExpander expander,
                                final HybridRetriever retriever,
                                final FeedbackStore feedbackStore,
                                final ConfidenceCalibrator calibrator,
                                final TrainingOrchestrator orchestrator) {
        this.config = config;
        this.vocabulary = vocabulary;
        this.expander = expander;
        this.retriever = retriever;
        this.feedbackStore = feedbackStore;
        this.calibrator = calibrator;
        this.orchestrator = orchestrator;
        this.scheduler = new TrainingScheduler(orchestrator, Duration.ofHours(config.getScheduleIntervalHours()));
    }

    /**
     * Wire the engine from configuration: vocabulary and catalog from the configured paths (or the
     * bundled defaults), state files in the data directory.
     *
     * @throws de.mirkosertic.mcp.ruleengine.config.ConfigurationException if a source cannot be loaded
     * @throws de.mirkosertic.mcp.ruleengine.retrieval.IndexUnavailableException if the catalog cannot be indexed
     */
    public static ComplianceRuleEngine create(final ApplicationConfig config) {
        final VocabularyStore vocabulary = new VocabularyStore();
        if (config.getVocabularyPath() != null) {
            vocabulary.load(Path.of(config.getVocabularyPath()));
        } else {
            vocabulary.loadDefaults();
        }
        final RuleCatalog catalog = config.getCatalogPath() != null
                ? RuleCatalog.load(Path.of(config.getCatalogPath()))
                : RuleCatalog.loadDefault();

        final HybridRetriever retriever = new HybridRetriever(config,
                new CachingEmbeddingProvider(new HashingEmbeddingProvider(config.getEmbeddingDimension()),
                        config.getEmbeddingCacheSize()),
                new MemoryIndexRelevanceScorer());
        retriever.rebuildIndexes(catalog);

        final Path dataDir = Path.of(config.getDataDir());
        final CalibrationModelRepository modelRepository = new CalibrationModelRepository(dataDir);
        final ConfidenceCalibrator calibrator = new ConfidenceCalibrator(config,
                ActiveCalibrationModel.initialize(modelRepository));
        final FeedbackStore feedbackStore = new FeedbackStore(new JsonLinesFeedbackLog(dataDir));
        final TrainingOrchestrator orchestrator = new TrainingOrchestrator(config, feedbackStore, calibrator,
                modelRepository, new TrainingJobLog(dataDir), Clock.systemUTC());

        logger.info("Rule engine ready: {} vocabulary entries, {} rules, {} feedback samples, calibration {}",
                vocabulary.size(), catalog.size(), feedbackStore.size(), calibrator.metrics().method());
        return new ComplianceRuleEngine(config, vocabulary, new QueryExpander(vocabulary, config), retriever,
                feedbackStore, calibrator, orchestrator);
    }

    /**
     * Start periodic training checks when enabled.
     */
    public void start() {
        if (config.isTrainingScheduleEnabled()) {
            scheduler.start();
        } else {
            logger.info("Scheduled calibration training is disabled");
        }
    }

    public ExpansionResult expandQuery(final String query,
                                       final @Nullable String discipline,
                                       final @Nullable String documentType,
                                       final @Nullable Collection<String> contextEntities) {
        return expander.expand(query, discipline, documentType, contextEntities);
    }

    public RetrievalResult expandAndRetrieve(final String query, final @Nullable String discipline, final int topK) {
        return expandAndRetrieve(query, discipline, null, null, topK);
    }

    /**
     * Expand {@code query} and retrieve matching rules. The expanded query drives both indexes, the
     * reranker (when enabled) scores against the original query.
     *
     * @param discipline discipline code or alias; rules of other disciplines are excluded
     * @param topK       maximum number of rules, must be positive
     */
    public RetrievalResult expandAndRetrieve(final String query,
                                             final @Nullable String discipline,
                                             final @Nullable String documentType,
                                             final @Nullable Collection<String> contextEntities,
                                             final int topK) {
        final ExpansionResult expansion = expander.expand(query, discipline, documentType, contextEntities);
        final String disciplineCode = discipline == null || discipline.isBlank()
                ? null
                : vocabulary.resolveDiscipline(discipline);
        final List<RetrievedRule> rules = retriever.retrieve(expansion.expandedQuery(), query,
                disciplineCode, documentType, topK);
        return new RetrievalResult(expansion, disciplineCode, rules);
    }

    public double calibrateConfidence(final double rawConfidence) {
        return calibrator.calibrate(rawConfidence);
    }

    public double calibrateConfidence(final double rawConfidence, final @Nullable Double rawLogit) {
        return calibrator.calibrate(rawConfidence, rawLogit);
    }

    public FeedbackSample submitFeedback(final String findingId, final double rawConfidence, final boolean correct,
                                         final FeedbackSample.@Nullable FeedbackMetadata metadata) {
        return feedbackStore.record(findingId, rawConfidence, correct, metadata);
    }

    public CalibrationHealth getCalibrationHealth() {
        return orchestrator.health();
    }

    public FeedbackStats feedbackStats() {
        return feedbackStore.stats();
    }

    /**
     * Queue a training job on the training thread.
     */
    public CompletableFuture<TrainingJob> triggerTraining(final boolean force) {
        return scheduler.trigger(force);
    }

    public void rebuildIndexes(final RuleCatalog catalog) {
        retriever.rebuildIndexes(catalog);
    }

    public RetrievalRuntimeStats retrievalStats() {
        return retriever.getStats();
    }

    public @Nullable EmbeddingCacheStats embeddingCacheStats() {
        return retriever.getEmbeddings() instanceof CachingEmbeddingProvider caching ? caching.getStats() : null;
    }

    public List<TrainingJob> jobHistory() {
        return orchestrator.jobHistory();
    }

    public int indexedRuleCount() {
        return retriever.getIndexedRuleCount();
    }

    public VocabularyStore getVocabulary() {
        return vocabulary;
    }

    public TrainingScheduler getScheduler() {
        return scheduler;
    }

    @Override
    public void close() {
        scheduler.close();
        retriever.close();
        logger.info("Rule engine closed");
    }
}
