package de.mirkosertic.mcp.ruleengine.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Switches Logback to the file-only configuration when the engine runs as an MCP STDIO server.
 * <p>
 * STDOUT carries JSON-RPC frames in that mode, so nothing may be logged to the console.
 * Development runs keep the automatically loaded logback.xml.
 */
public final class LoggingConfigurator {

    static final String DEPLOYED_CONFIG = "logback-deployed.xml";

    private LoggingConfigurator() {
    }

    /**
     * Must be called before the first logger is used.
     *
     * @param deployedMode true when running as STDIO MCP server
     */
    public static void configure(final boolean deployedMode) {
        if (!deployedMode) {
            return;
        }
        final Path logDirectory = logDirectory();
        try {
            Files.createDirectories(logDirectory);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory " + logDirectory + ": " + e.getMessage());
        }
        reconfigure(DEPLOYED_CONFIG);
    }

    /**
     * Directory the deployed configuration writes its rolling log files to.
     */
    public static Path logDirectory() {
        return ApplicationConfig.getConfigDirectory().resolve("log");
    }

    private static void reconfigure(final String configFile) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try (final InputStream configStream = LoggingConfigurator.class.getClassLoader().getResourceAsStream(configFile)) {
            if (configStream == null) {
                System.err.println("Warning: " + configFile + " not found on classpath, keeping default logging");
                return;
            }
            context.reset();
            context.putProperty("LOG_DIR", logDirectory().toString());
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(configStream);
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Error loading logback configuration " + configFile + ": " + e.getMessage());
        }
    }
}
