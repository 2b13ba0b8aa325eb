package de.mirkosertic.corpuscoverage.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Configures logging based on the active profile.
 * <p>
 * In batch mode, loads logback-batch.xml which writes to
 * ~/.corpuscoverage/log only, so that stdout carries nothing but the result summary.
 * <p>
 * In default mode, uses logback.xml with console output on stderr.
 */
public final class LoggingConfigurator {

    private static final String BATCH_CONFIG = "logback-batch.xml";

    private LoggingConfigurator() {
    }

    /**
     * Configure logging based on the active profile.
     * Must be called early in application startup, before logging is used.
     *
     * @param batchMode true if running with the batch profile
     */
    public static void configure(final boolean batchMode) {
        if (batchMode) {
            ensureLogDirectoryExists();
            loadConfiguration(BATCH_CONFIG);
        }
        // Default mode uses logback.xml which is loaded automatically
    }

    static Path logDirectory() {
        return ApplicationConfig.getConfigDirectory().resolve("log");
    }

    private static void ensureLogDirectoryExists() {
        final Path logDir = logDirectory();
        try {
            if (!Files.exists(logDir)) {
                Files.createDirectories(logDir);
            }
        } catch (final IOException e) {
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
        } catch (final IOException e) {
            System.err.println("Warning: Could not read " + configFile + ": " + e.getMessage());
        }
    }
}
