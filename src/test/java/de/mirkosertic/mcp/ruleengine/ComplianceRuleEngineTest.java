package de.mirkosertic.mcp.ruleengine;

import de.mirkosertic.mcp.ruleengine.calibration.ActiveCalibrationModel;
import de.mirkosertic.mcp.ruleengine.calibration.CalibrationMethod;
import de.mirkosertic.mcp.ruleengine.calibration.CalibrationModelRepository;
import de.mirkosertic.mcp.ruleengine.calibration.ConfidenceCalibrator;
import de.mirkosertic.mcp.ruleengine.config.ApplicationConfig;
import de.mirkosertic.mcp.ruleengine.expansion.ExpansionTerm;
import de.mirkosertic.mcp.ruleengine.expansion.QueryExpander;
import de.mirkosertic.mcp.ruleengine.expansion.SourceKind;
import de.mirkosertic.mcp.ruleengine.feedback.FeedbackSample;
import de.mirkosertic.mcp.ruleengine.feedback.FeedbackStore;
import de.mirkosertic.mcp.ruleengine.feedback.InMemoryFeedbackLog;
import de.mirkosertic.mcp.ruleengine.retrieval.EmbeddingProvider;
import de.mirkosertic.mcp.ruleengine.retrieval.HybridRetriever;
import de.mirkosertic.mcp.ruleengine.retrieval.MemoryIndexRelevanceScorer;
import de.mirkosertic.mcp.ruleengine.retrieval.RetrievedRule;
import de.mirkosertic.mcp.ruleengine.retrieval.Rule;
import de.mirkosertic.mcp.ruleengine.retrieval.RuleCatalog;
import de.mirkosertic.mcp.ruleengine.training.JobStatus;
import de.mirkosertic.mcp.ruleengine.training.TrainingJob;
import de.mirkosertic.mcp.ruleengine.training.TrainingJobLog;
import de.mirkosertic.mcp.ruleengine.training.TrainingOrchestrator;
import de.mirkosertic.mcp.ruleengine.vocabulary.TermEntry;
import de.mirkosertic.mcp.ruleengine.vocabulary.VocabularyStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Engine wired from configuration with the bundled vocabulary and rule catalog.
 */
@DisplayName("ComplianceRuleEngine Integration Tests")
class ComplianceRuleEngineTest {

    @TempDir
    Path dataDir;

    private ApplicationConfig config;
    private ComplianceRuleEngine engine;

    @BeforeEach
    void setUp() {
        config = ApplicationConfig.defaults();
        config.setDataDir(dataDir.toString());
        config.setTrainingScheduleEnabled(false);
        config.setValidationFraction(0.5);
        engine = ComplianceRuleEngine.create(config);
        engine.start();
    }

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    private void submitOverconfidentFeedback() {
        final double[] confidences = {0.3, 0.4, 0.5, 0.6, 0.7, 0.8, 0.9, 1.0};
        final int[] correct = {3, 5, 8, 10, 13, 15, 18, 20};
        int id = 0;
        for (int level = 0; level < confidences.length; level++) {
            for (int i = 0; i < 25; i++) {
                engine.submitFeedback("F-" + id++, confidences[level], i < correct[level], null);
            }
        }
    }

    @Test
    @DisplayName("Bundled catalog should be indexed and the schedule stay off when disabled")
    void shouldStartWithBundledSources() {
        assertThat(engine.indexedRuleCount()).isEqualTo(20);
        assertThat(engine.getVocabulary().size()).isPositive();
        assertThat(engine.getScheduler().isStarted()).isFalse();
        assertThat(engine.getCalibrationHealth().activeMethod()).isEqualTo(CalibrationMethod.IDENTITY);
    }

    @Test
    @DisplayName("Abbreviated query with a discipline alias should return only physical therapy rules")
    void shouldExpandAndRetrieveForDisciplineAlias() {
        // When
        final RetrievalResult result = engine.expandAndRetrieve("PT gait documentation", "Physical Therapy", 5);

        // Then
        assertThat(result.discipline()).isEqualTo("pt");
        assertThat(result.expansion().expandedQuery()).startsWith("PT gait documentation");
        assertThat(result.expansion().terms())
                .contains(new ExpansionTerm("physical therapy", SourceKind.SYNONYM, 0.9));
        assertThat(result.rules()).isNotEmpty().hasSizeLessThanOrEqualTo(5);
        assertThat(result.rules()).extracting(RetrievedRule::discipline).containsOnly("pt");
        assertThat(result.rules()).extracting(RetrievedRule::ruleId).contains("PT-GAIT-001");
        assertThat(engine.retrievalStats().getRetrievals()).isEqualTo(1);
    }

    @Test
    @DisplayName("Calibration should be the identity until a model has been trained")
    void shouldPassThroughConfidenceWithoutModel() {
        // When
        final FeedbackSample sample = engine.submitFeedback("F-1", 0.7, true,
                new FeedbackSample.FeedbackMetadata("pt", "progress_note", "PT-GAIT-001"));

        // Then
        assertThat(sample.findingId()).isEqualTo("F-1");
        assertThat(engine.feedbackStats().total()).isEqualTo(1);
        assertThat(engine.feedbackStats().byDiscipline()).containsEntry("pt", 1);
        assertThat(engine.calibrateConfidence(0.7)).isEqualTo(0.7);
        assertThat(engine.calibrateConfidence(1.5)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Training on overconfident feedback should deploy a model that survives a restart")
    void shouldTrainDeployAndRestore() throws Exception {
        // Given
        submitOverconfidentFeedback();

        // When
        final TrainingJob job = engine.triggerTraining(true).get(60, TimeUnit.SECONDS);

        // Then
        assertThat(job.status()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(job.deployed()).isTrue();
        final double calibrated = engine.calibrateConfidence(0.9);
        assertThat(calibrated).isLessThan(0.9);
        assertThat(engine.getCalibrationHealth().sampleBacklog()).isZero();

        // When
        engine.close();
        engine = ComplianceRuleEngine.create(config);

        // Then
        assertThat(engine.feedbackStats().total()).isEqualTo(200);
        assertThat(engine.calibrateConfidence(0.9)).isEqualTo(calibrated);
        assertThat(engine.jobHistory()).hasSize(1);
        assertThat(engine.getCalibrationHealth().activeMethod()).isNotEqualTo(CalibrationMethod.IDENTITY);
    }

    @Test
    @DisplayName("Abbreviation expansion should surface a rule the bare abbreviation misses")
    void shouldFindRuleOnlyThroughExpansion() {
        // Given
        final VocabularyStore vocabulary = new VocabularyStore();
        vocabulary.replace(List.of(new TermEntry("PT", Set.of(), Set.of("physical therapy", "physiotherapy"), null)),
                Map.of(), Map.of());
        final RuleCatalog catalog = RuleCatalog.of(List.of(
                Rule.of("SLP-FREQ", "Speech session frequency", "Session frequency and frequency changes are recorded.", null),
                Rule.of("OT-FREQ", "Home visit frequency", "Frequency of sessions and frequency of home visits.", null),
                Rule.of("GEN-REASSESS", "Frequency of reassessment", "Reassessment frequency follows payer frequency rules.", null),
                Rule.of("GEN-ORDER", "Treatment frequency", "Frequency must match the frequency in the order.", null),
                Rule.of("PT-FREQ", "Physical Therapy Visit Frequency Requirements",
                        "The plan of care states how many visits per week are planned and the expected duration of "
                                + "the episode, and is updated whenever the number of weekly visits changes.", null)));
        final EmbeddingProvider noEmbeddings = new EmbeddingProvider() {
            @Override
            public float[] embed(final String text) {
                return new float[8];
            }

            @Override
            public int dimension() {
                return 8;
            }
        };
        final HybridRetriever retriever = new HybridRetriever(config, noEmbeddings, new MemoryIndexRelevanceScorer());
        retriever.rebuildIndexes(catalog);
        final CalibrationModelRepository repository = new CalibrationModelRepository(dataDir.resolve("scenario"));
        final ConfidenceCalibrator calibrator = new ConfidenceCalibrator(config, ActiveCalibrationModel.initialize(repository));
        final FeedbackStore feedbackStore = new FeedbackStore(new InMemoryFeedbackLog());
        final TrainingOrchestrator orchestrator = new TrainingOrchestrator(config, feedbackStore, calibrator, repository,
                new TrainingJobLog(dataDir.resolve("scenario")), Clock.systemUTC());

        try (ComplianceRuleEngine scenario = new ComplianceRuleEngine(config, vocabulary,
                new QueryExpander(vocabulary, config), retriever, feedbackStore, calibrator, orchestrator)) {

            // When
            final List<RetrievedRule> unexpanded = retriever.retrieve("PT frequency", null, null, 3);
            final RetrievalResult expanded = scenario.expandAndRetrieve("PT frequency", null, 3);

            // Then
            assertThat(expanded.expansion().terms()).extracting(ExpansionTerm::term)
                    .contains("physical therapy", "physiotherapy");
            assertThat(expanded.rules()).extracting(RetrievedRule::ruleId).contains("PT-FREQ");
            assertThat(unexpanded).extracting(RetrievedRule::ruleId).doesNotContain("PT-FREQ");
        }
    }
}
