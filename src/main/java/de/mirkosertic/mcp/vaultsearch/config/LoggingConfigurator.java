package de.mirkosertic.mcp.vaultsearch.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configures logging based on the active profile.
 * <p>
 * In deployed mode (STDIO transport), loads logback-deployed.xml which
 * writes to a rolling file only, so nothing interferes with MCP JSON-RPC on stdout.
 * <p>
 * In default mode (development), logback.xml logs to stderr.
 */
public final class LoggingConfigurator {

    private static final String ENV_LOG_FILE_PATH = "LOG_FILE_PATH";
    private static final String DEPLOYED_CONFIG = "logback-deployed.xml";

    private LoggingConfigurator() {
    }

    /**
     * Must be called before anything logs.
     *
     * @param deployedMode true if running in deployed mode (STDIO transport)
     */
    public static void configure(final boolean deployedMode) {
        if (deployedMode) {
            ensureLogDirectoryExists(logDirectory());
            loadConfiguration(DEPLOYED_CONFIG);
        }
    }

    static Path logDirectory() {
        final String logFile = System.getenv(ENV_LOG_FILE_PATH);
        if (logFile != null && !logFile.isBlank()) {
            final Path parent = Paths.get(logFile.trim()).toAbsolutePath().getParent();
            if (parent != null) {
                return parent;
            }
        }
        return ApplicationConfig.getConfigDirectory().resolve("log");
    }

    private static void ensureLogDirectoryExists(final Path logDir) {
        try {
            if (!Files.exists(logDir)) {
                Files.createDirectories(logDir);
            }
        } catch (final Exception e) {
            System.err.println("Warning: Could not create log directory: " + logDir);
        }
    }

    private static void loadConfiguration(final String configFile) {
        try {
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            context.reset();

            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);

            try (InputStream configStream = LoggingConfigurator.class.getClassLoader()
                    .getResourceAsStream(configFile)) {
                if (configStream != null) {
                    configurator.doConfigure(configStream);
                } else {
                    System.err.println("Warning: Could not find " + configFile + " on classpath");
                }
            }
        } catch (final JoranException e) {
            System.err.println("Warning: Error loading logback configuration: " + e.getMessage());
        } catch (final Exception e) {
            System.err.println("Warning: Unexpected error configuring logging: " + e.getMessage());
        }
    }
}
