package de.mirkosertic.corpuscoverage;

import de.mirkosertic.corpuscoverage.config.ApplicationConfig;
import de.mirkosertic.corpuscoverage.config.BuildInfo;
import de.mirkosertic.corpuscoverage.config.ConfigurationException;
import de.mirkosertic.corpuscoverage.config.LoggingConfigurator;
import de.mirkosertic.corpuscoverage.corpus.CorpusLoader;
import de.mirkosertic.corpuscoverage.corpus.SourceCorpus;
import de.mirkosertic.corpuscoverage.frequency.CoverageSet;
import de.mirkosertic.corpuscoverage.report.AnalysisReport;
import de.mirkosertic.corpuscoverage.report.CoverageReportWriter;
import de.mirkosertic.corpuscoverage.report.GranularityResult;
import de.mirkosertic.corpuscoverage.text.ExclusionWordLists;
import de.mirkosertic.corpuscoverage.text.WordListLoader;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command line entry point. Loads the configured corpus sources, runs the pipeline and
 * writes the coverage tables to the output directory.
 *
 * <p>Usage: {@code java -jar corpus-coverage.jar [--config <file.yaml>]}</p>
 */
public class CorpusCoverageApplication {

    private static final Logger logger = LoggerFactory.getLogger(CorpusCoverageApplication.class);

    private final ApplicationConfig config;
    private final CorpusLoader corpusLoader;
    private final CoverageReportWriter reportWriter;
    private final AnalysisExecutorService executor;
    private final CorpusCoveragePipeline pipeline;

    public CorpusCoverageApplication(final ApplicationConfig config) {
        this.config = config;

        // Word lists are loaded eagerly: a missing list must fail before any corpus is read
        final ExclusionWordLists exclusions = WordListLoader.loadExclusions(
                config.getStopwordsLocation(), config.getProfanityLocation());

        this.corpusLoader = new CorpusLoader();
        this.reportWriter = new CoverageReportWriter();
        this.executor = new AnalysisExecutorService(config.getThreadPoolSize());
        this.pipeline = new CorpusCoveragePipeline(config, exclusions, executor);
    }

    /**
     * Run the analysis and persist its results.
     */
    public AnalysisReport run() throws IOException {
        logger.info("Corpus Coverage {} (built {})", BuildInfo.getVersion(), BuildInfo.getBuildTimestamp());

        final List<SourceCorpus> corpora = corpusLoader.loadAll(config.getSources());
        final AnalysisReport report = pipeline.analyze(corpora);
        reportWriter.write(report, Paths.get(config.getOutputDirectory()));
        return report;
    }

    public void shutdown() {
        try {
            executor.shutdown();
        } catch (final RuntimeException e) {
            logger.error("Error shutting down analysis executor", e);
        }
    }

    static void printSummary(final AnalysisReport report, final PrintStream out) {
        for (final GranularityResult granularity : report.granularities()) {
            for (final CoverageSet coverageSet : granularity.coverageSets()) {
                out.printf("%-10s n=%d  %6.2f%% coverage: %d of %d distinct tokens%n",
                        granularity.name(), granularity.n(), coverageSet.threshold() * 100,
                        coverageSet.size(), granularity.distinctTokens());
            }
        }
        out.printf("Analyzed %d sampled lines in %d ms%n", report.nonEmptyRecords(), report.elapsedMs());
    }

    static @Nullable Path configFileArgument(final String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new ConfigurationException("--config requires a file argument");
                }
                return Paths.get(args[i + 1]);
            }
        }
        return null;
    }

    public static void main(final String[] args) {
        try {
            // Configure logging FIRST, before any other code that might log
            final boolean batchMode = "batch".equalsIgnoreCase(System.getProperty("profile"));
            LoggingConfigurator.configure(batchMode);

            final ApplicationConfig config = ApplicationConfig.load(configFileArgument(args));

            if (!config.isBatchMode()) {
                logger.info("Running in console mode (logging to stderr)");
                logger.info("Sources: {}", config.getSources());
                logger.info("Output directory: {}", config.getOutputDirectory());
            }

            final CorpusCoverageApplication app = new CorpusCoverageApplication(config);
            try {
                final AnalysisReport report = app.run();
                printSummary(report, System.out);
            } finally {
                app.shutdown();
            }

        } catch (final ConfigurationException e) {
            logger.error("Invalid configuration: {}", e.getMessage(), e);
            System.err.println("Invalid configuration: " + e.getMessage());
            System.exit(2);
        } catch (final Exception e) {
            logger.error("Corpus analysis failed", e);
            System.err.println("Corpus analysis failed: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
