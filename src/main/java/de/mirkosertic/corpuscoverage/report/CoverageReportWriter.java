package de.mirkosertic.corpuscoverage.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.mirkosertic.corpuscoverage.frequency.CoverageSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Persists an {@link AnalysisReport} as JSON files in an output directory.
 *
 * <ul>
 *   <li>{@code corpus-summary.json}: per-source summaries</li>
 *   <li>{@code <granularity>-cover-<percent>.json}: one file per coverage set, e.g.
 *       {@code words-cover-90.json}</li>
 *   <li>{@code analysis-report.json}: run metadata, coverage set sizes and per-source top words</li>
 * </ul>
 */
public class CoverageReportWriter {

    private static final Logger logger = LoggerFactory.getLogger(CoverageReportWriter.class);

    static final String SUMMARY_FILE = "corpus-summary.json";
    static final String REPORT_FILE = "analysis-report.json";

    private final ObjectMapper objectMapper;
    private final ObjectWriter writer;

    public CoverageReportWriter() {
        this.objectMapper = new ObjectMapper();
        this.writer = objectMapper.writer().with(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Writes all files and returns their paths.
     */
    public List<Path> write(final AnalysisReport report, final Path outputDirectory) throws IOException {
        Files.createDirectories(outputDirectory);
        final List<Path> written = new ArrayList<>();

        final Path summaryFile = outputDirectory.resolve(SUMMARY_FILE);
        writer.writeValue(summaryFile.toFile(), report.corpusSummaries());
        written.add(summaryFile);

        for (final GranularityResult granularity : report.granularities()) {
            for (final CoverageSet coverageSet : granularity.coverageSets()) {
                final Path coverageFile = outputDirectory.resolve(coverageFileName(granularity.name(), coverageSet.threshold()));
                writer.writeValue(coverageFile.toFile(), coverageSet);
                written.add(coverageFile);
            }
        }

        final Path reportFile = outputDirectory.resolve(REPORT_FILE);
        writer.writeValue(reportFile.toFile(), overview(report));
        written.add(reportFile);

        logger.info("Wrote {} report files to {}", written.size(), outputDirectory.toAbsolutePath());
        return written;
    }

    static String coverageFileName(final String granularity, final double threshold) {
        final String percent = BigDecimal.valueOf(threshold).movePointRight(2).stripTrailingZeros().toPlainString();
        return granularity + "-cover-" + percent + ".json";
    }

    ObjectNode overview(final AnalysisReport report) {
        final ObjectNode root = objectMapper.createObjectNode();
        root.put("generatorVersion", report.generatorVersion());
        root.put("sampleFraction", report.sampleFraction());
        root.put("sampleSeed", report.sampleSeed());
        root.put("sampledRecords", report.sampledRecords());
        root.put("nonEmptyRecords", report.nonEmptyRecords());
        root.put("elapsedMs", report.elapsedMs());

        final ArrayNode granularities = root.putArray("granularities");
        for (final GranularityResult granularity : report.granularities()) {
            final ObjectNode node = granularities.addObject();
            node.put("name", granularity.name());
            node.put("n", granularity.n());
            node.put("filtered", granularity.filtered());
            node.put("totalTokens", granularity.totalTokens());
            node.put("distinctTokens", granularity.distinctTokens());
            final ArrayNode coverage = node.putArray("coverage");
            for (final CoverageSet coverageSet : granularity.coverageSets()) {
                final ObjectNode entry = coverage.addObject();
                entry.put("threshold", coverageSet.threshold());
                entry.put("size", coverageSet.size());
                entry.put("coveredProportion", coverageSet.coveredProportion());
            }
        }

        root.set("sourceWordFrequencies", objectMapper.valueToTree(report.sourceWordFrequencies()));
        return root;
    }
}
