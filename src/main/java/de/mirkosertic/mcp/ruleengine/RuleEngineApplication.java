package de.mirkosertic.mcp.ruleengine;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.ruleengine.config.ApplicationConfig;
import de.mirkosertic.mcp.ruleengine.config.BuildInfo;
import de.mirkosertic.mcp.ruleengine.config.LoggingConfigurator;
import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.ProtocolVersions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Main entry point of the MCP rule engine server. Wires the engine and serves its tools over STDIO.
 */
public class RuleEngineApplication {

    private static final Logger logger = LoggerFactory.getLogger(RuleEngineApplication.class);

    private static final String SERVER_NAME = "MCP Compliance Rule Engine";

    // newest first; the SDK transport alone only offers 2024-11-05
    static final List<String> PROTOCOL_VERSIONS = List.of(
            ProtocolVersions.MCP_2025_06_18,
            ProtocolVersions.MCP_2025_03_26,
            ProtocolVersions.MCP_2024_11_05);

    private final ComplianceRuleEngine engine;
    private final RuleEngineTools tools;
    private McpSyncServer mcpServer;

    public RuleEngineApplication(final ApplicationConfig config) {
        this.engine = ComplianceRuleEngine.create(config);
        this.tools = new RuleEngineTools(engine, config);
    }

    /**
     * Start the MCP server and block until the process is stopped.
     */
    public void start() {
        logger.info("Starting MCP server with STDIO transport...");

        engine.start();

        final McpSchema.ServerCapabilities capabilities = McpSchema.ServerCapabilities.builder()
                .tools(true)
                .build();

        final McpSchema.Implementation serverInfo = new McpSchema.Implementation(SERVER_NAME, BuildInfo.getVersion());

        mcpServer = McpServer.sync(stdioTransport(new JacksonMcpJsonMapper(new ObjectMapper())))
                .serverInfo(serverInfo)
                .capabilities(capabilities)
                .tools(tools.getToolSpecifications())
                .build();

        logger.info("MCP server started ({})", BuildInfo.describe());

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));

        // The STDIO transport runs on its own threads
        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }
    }

    static StdioServerTransportProvider stdioTransport(final McpJsonMapper jsonMapper) {
        return new StdioServerTransportProvider(jsonMapper) {
            @Override
            public List<String> protocolVersions() {
                return PROTOCOL_VERSIONS;
            }
        };
    }

    public void shutdown() {
        logger.info("Shutting down {}...", SERVER_NAME);
        try {
            if (mcpServer != null) {
                mcpServer.close();
            }
        } catch (final Exception e) {
            logger.error("Error closing MCP server", e);
        }
        try {
            engine.close();
        } catch (final Exception e) {
            logger.error("Error closing rule engine", e);
        }
        logger.info("{} shutdown complete", SERVER_NAME);
    }

    public static void main(final String[] args) {
        try {
            // Logging must be configured before anything logs
            final boolean deployedMode = "deployed".equalsIgnoreCase(System.getProperty(ApplicationConfig.PROP_PROFILE));
            LoggingConfigurator.configure(deployedMode);

            final ApplicationConfig config = ApplicationConfig.load();
            if (!deployedMode) {
                logger.info("Running in development mode (console logging enabled)");
                logger.info("Data directory: {}", config.getDataDir());
            }

            new RuleEngineApplication(config).start();
        } catch (final Exception e) {
            // in deployed mode there is no console appender
            System.err.println("Failed to start " + SERVER_NAME + ": " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
