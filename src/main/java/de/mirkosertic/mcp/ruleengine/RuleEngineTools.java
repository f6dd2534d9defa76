package de.mirkosertic.mcp.ruleengine;

import de.mirkosertic.mcp.ruleengine.config.ApplicationConfig;
import de.mirkosertic.mcp.ruleengine.expansion.ExpansionResult;
import de.mirkosertic.mcp.ruleengine.feedback.FeedbackSample;
import de.mirkosertic.mcp.ruleengine.mcp.SchemaGenerator;
import de.mirkosertic.mcp.ruleengine.mcp.ToolResultHelper;
import de.mirkosertic.mcp.ruleengine.mcp.dto.CalibrateConfidenceRequest;
import de.mirkosertic.mcp.ruleengine.mcp.dto.CalibrateConfidenceResponse;
import de.mirkosertic.mcp.ruleengine.mcp.dto.CalibrationHealthResponse;
import de.mirkosertic.mcp.ruleengine.mcp.dto.ExpandQueryRequest;
import de.mirkosertic.mcp.ruleengine.mcp.dto.ExpandQueryResponse;
import de.mirkosertic.mcp.ruleengine.mcp.dto.FeedbackStatsResponse;
import de.mirkosertic.mcp.ruleengine.mcp.dto.RetrievalStatsResponse;
import de.mirkosertic.mcp.ruleengine.mcp.dto.RetrieveRulesRequest;
import de.mirkosertic.mcp.ruleengine.mcp.dto.RetrieveRulesResponse;
import de.mirkosertic.mcp.ruleengine.mcp.dto.SubmitFeedbackRequest;
import de.mirkosertic.mcp.ruleengine.mcp.dto.SubmitFeedbackResponse;
import de.mirkosertic.mcp.ruleengine.mcp.dto.TriggerTrainingRequest;
import de.mirkosertic.mcp.ruleengine.mcp.dto.TriggerTrainingResponse;
import de.mirkosertic.mcp.ruleengine.retrieval.IndexUnavailableException;
import de.mirkosertic.mcp.ruleengine.training.TrainingJob;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * MCP tools over the {@link ComplianceRuleEngine}: query expansion, rule retrieval, confidence
 * calibration, feedback and training.
 */
public class RuleEngineTools {

    private static final Logger logger = LoggerFactory.getLogger(RuleEngineTools.class);

    private static final String RETRIEVE_DESCRIPTION = """
            Find the compliance rules relevant to an analysis query. The query is expanded with \
            therapy vocabulary (synonyms, abbreviations such as PT/OT/SLP, discipline specific terms, \
            document type terms), then searched in a BM25 keyword index and a vector index whose rankings \
            are fused. Filter by discipline (pt, ot, slp) and document type to restrict the candidate rules. \
            Returns: ranked rules with lexical/dense ranks and fused score, plus the expansion that was used.""";

    private static final long TRAINING_TIMEOUT_SECONDS = 120;

    private final ComplianceRuleEngine engine;
    private final int defaultTopK;

    public RuleEngineTools(final ComplianceRuleEngine engine, final ApplicationConfig config) {
        this.engine = engine;
        this.defaultTopK = config.getDefaultTopK();
    }

    /**
     * Returns all MCP tool specifications for registration with the MCP server.
     */
    public List<McpServerFeatures.SyncToolSpecification> getToolSpecifications() {
        final List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("expandQuery")
                        .description("Expand an analysis query with weighted domain terms (synonyms 0.9, abbreviations 0.8, "
                                + "specialty terms 0.7, context and document type terms 0.6). The original query is kept verbatim.")
                        .inputSchema(SchemaGenerator.generateSchema(ExpandQueryRequest.class))
                        .build())
                .callHandler((exchange, request) -> expandQuery(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("retrieveRules")
                        .description(RETRIEVE_DESCRIPTION)
                        .inputSchema(SchemaGenerator.generateSchema(RetrieveRulesRequest.class))
                        .build())
                .callHandler((exchange, request) -> retrieveRules(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("calibrateConfidence")
                        .description("Map a raw finding confidence to a calibrated probability using the active calibration model.")
                        .inputSchema(SchemaGenerator.generateSchema(CalibrateConfidenceRequest.class))
                        .build())
                .callHandler((exchange, request) -> calibrateConfidence(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("submitFeedback")
                        .description("Record whether a finding was correct. Feedback is used to retrain the confidence calibration.")
                        .inputSchema(SchemaGenerator.generateSchema(SubmitFeedbackRequest.class))
                        .build())
                .callHandler((exchange, request) -> submitFeedback(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("getCalibrationHealth")
                        .description("Get the active calibration method, its ECE and Brier score, feedback backlog, model age and the last training outcome.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> getCalibrationHealth())
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("getFeedbackStats")
                        .description("Get feedback counts, accuracy, per discipline counts and mean raw confidence of correct and incorrect findings.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> getFeedbackStats())
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("triggerTraining")
                        .description("Retrain the calibration model from feedback. The new model is deployed only if it lowers the "
                                + "expected calibration error by the configured margin.")
                        .inputSchema(SchemaGenerator.generateSchema(TriggerTrainingRequest.class))
                        .build())
                .callHandler((exchange, request) -> triggerTraining(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("getRetrievalStats")
                        .description("Get retrieval runtime statistics (latency percentiles, hit counts) and query embedding cache statistics.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> getRetrievalStats())
                .build());

        return tools;
    }

    // Tool implementation methods
    McpSchema.CallToolResult expandQuery(final Map<String, Object> args) {
        final ExpandQueryRequest request = ExpandQueryRequest.fromMap(args);
        logger.info("Expand query request: query='{}', discipline='{}', documentType='{}'",
                request.query(), request.discipline(), request.documentType());
        try {
            final ExpansionResult result = engine.expandQuery(request.query(), request.discipline(),
                    request.documentType(), request.contextEntities());
            return ToolResultHelper.createResult(ExpandQueryResponse.success(result));
        } catch (final RuntimeException e) {
            logger.error("Error expanding query", e);
            return ToolResultHelper.createResult(ExpandQueryResponse.error("Error expanding query: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult retrieveRules(final Map<String, Object> args) {
        final RetrieveRulesRequest request = RetrieveRulesRequest.fromMap(args);
        logger.info("Retrieve rules request: query='{}', discipline='{}', documentType='{}', topK={}",
                request.query(), request.discipline(), request.documentType(), request.topK());
        if (request.query().isBlank()) {
            return ToolResultHelper.createResult(RetrieveRulesResponse.error("Missing required parameter: query"));
        }
        try {
            final long startTime = System.nanoTime();
            final RetrievalResult result = engine.expandAndRetrieve(request.query(), request.discipline(),
                    request.documentType(), request.contextEntities(), request.effectiveTopK(defaultTopK));
            final long durationMs = (System.nanoTime() - startTime) / 1_000_000;
            logger.info("Retrieved {} rules in {}ms", result.rules().size(), durationMs);
            return ToolResultHelper.createResult(RetrieveRulesResponse.success(result, durationMs));
        } catch (final IndexUnavailableException e) {
            logger.error("Rule index unavailable", e);
            return ToolResultHelper.createResult(RetrieveRulesResponse.error("Rule index unavailable: " + e.getMessage()));
        } catch (final RuntimeException e) {
            logger.error("Error retrieving rules", e);
            return ToolResultHelper.createResult(RetrieveRulesResponse.error("Error retrieving rules: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult calibrateConfidence(final Map<String, Object> args) {
        try {
            final CalibrateConfidenceRequest request = CalibrateConfidenceRequest.fromMap(args);
            if (request.rawConfidence() == null) {
                return ToolResultHelper.createResult(CalibrateConfidenceResponse.error("Missing required parameter: rawConfidence"));
            }
            final double calibrated = engine.calibrateConfidence(request.rawConfidence(), request.rawLogit());
            return ToolResultHelper.createResult(CalibrateConfidenceResponse.success(request.rawConfidence(), calibrated,
                    engine.getCalibrationHealth().activeMethod()));
        } catch (final RuntimeException e) {
            logger.error("Error calibrating confidence", e);
            return ToolResultHelper.createResult(CalibrateConfidenceResponse.error("Error calibrating confidence: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult submitFeedback(final Map<String, Object> args) {
        try {
            final SubmitFeedbackRequest request = SubmitFeedbackRequest.fromMap(args);
            if (request.findingId() == null || request.rawConfidence() == null || request.correct() == null) {
                return ToolResultHelper.createResult(SubmitFeedbackResponse.error(
                        "Missing required parameters: findingId, rawConfidence and correct are required"));
            }
            final FeedbackSample sample = engine.submitFeedback(request.findingId(), request.rawConfidence(),
                    request.correct(), request.metadata());
            logger.info("Feedback recorded for finding {}", sample.findingId());
            return ToolResultHelper.createResult(SubmitFeedbackResponse.success(sample.findingId(),
                    sample.recordedAt().toString(), engine.feedbackStats().total()));
        } catch (final IllegalArgumentException e) {
            logger.warn("Invalid feedback: {}", e.getMessage());
            return ToolResultHelper.createResult(SubmitFeedbackResponse.error("Invalid feedback: " + e.getMessage()));
        } catch (final RuntimeException e) {
            logger.error("Error recording feedback", e);
            return ToolResultHelper.createResult(SubmitFeedbackResponse.error("Error recording feedback: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult getCalibrationHealth() {
        try {
            final Instant nextRun = engine.getScheduler().getNextRunAt();
            return ToolResultHelper.createResult(CalibrationHealthResponse.success(engine.getCalibrationHealth(),
                    nextRun != null ? nextRun.toString() : null));
        } catch (final RuntimeException e) {
            logger.error("Error getting calibration health", e);
            return ToolResultHelper.createResult(CalibrationHealthResponse.error("Error getting calibration health: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult getFeedbackStats() {
        try {
            return ToolResultHelper.createResult(FeedbackStatsResponse.success(engine.feedbackStats()));
        } catch (final RuntimeException e) {
            logger.error("Error getting feedback stats", e);
            return ToolResultHelper.createResult(FeedbackStatsResponse.error("Error getting feedback stats: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult triggerTraining(final Map<String, Object> args) {
        final TriggerTrainingRequest request = TriggerTrainingRequest.fromMap(args);
        logger.info("Trigger training request: force={}", request.effectiveForce());
        try {
            final TrainingJob job = engine.triggerTraining(request.effectiveForce())
                    .get(TRAINING_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            logger.info("Training job {} finished with {}", job.id(), job.status());
            return ToolResultHelper.createResult(TriggerTrainingResponse.success(job));
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResultHelper.createResult(TriggerTrainingResponse.error("Interrupted while waiting for training"));
        } catch (final TimeoutException e) {
            return ToolResultHelper.createResult(TriggerTrainingResponse.error(
                    "Training still running after " + TRAINING_TIMEOUT_SECONDS + "s, check getCalibrationHealth later"));
        } catch (final ExecutionException e) {
            logger.error("Training job failed", e.getCause());
            return ToolResultHelper.createResult(TriggerTrainingResponse.error("Training failed: " + e.getCause().getMessage()));
        }
    }

    McpSchema.CallToolResult getRetrievalStats() {
        try {
            return ToolResultHelper.createResult(RetrievalStatsResponse.success(engine.indexedRuleCount(),
                    engine.retrievalStats(), engine.embeddingCacheStats()));
        } catch (final RuntimeException e) {
            logger.error("Error getting retrieval stats", e);
            return ToolResultHelper.createResult(RetrievalStatsResponse.error("Error getting retrieval stats: " + e.getMessage()));
        }
    }
}
