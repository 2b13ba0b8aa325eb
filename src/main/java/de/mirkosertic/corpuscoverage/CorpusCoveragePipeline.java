package de.mirkosertic.corpuscoverage;

import de.mirkosertic.corpuscoverage.config.ApplicationConfig;
import de.mirkosertic.corpuscoverage.config.BuildInfo;
import de.mirkosertic.corpuscoverage.config.GranularitySettings;
import de.mirkosertic.corpuscoverage.corpus.CorpusRecord;
import de.mirkosertic.corpuscoverage.corpus.CorpusSampler;
import de.mirkosertic.corpuscoverage.corpus.CorpusSummarizer;
import de.mirkosertic.corpuscoverage.corpus.CorpusSummary;
import de.mirkosertic.corpuscoverage.corpus.SourceCorpus;
import de.mirkosertic.corpuscoverage.frequency.CoverageSelector;
import de.mirkosertic.corpuscoverage.frequency.CoverageSet;
import de.mirkosertic.corpuscoverage.frequency.FrequencyCounter;
import de.mirkosertic.corpuscoverage.frequency.FrequencyTable;
import de.mirkosertic.corpuscoverage.report.AnalysisReport;
import de.mirkosertic.corpuscoverage.report.GranularityResult;
import de.mirkosertic.corpuscoverage.report.SourceWordFrequencies;
import de.mirkosertic.corpuscoverage.text.ExclusionWordLists;
import de.mirkosertic.corpuscoverage.text.TextNormalizer;
import de.mirkosertic.corpuscoverage.text.WordNGramTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the corpus analysis: summarize, sample, normalize, then count and select coverage sets
 * for every configured granularity.
 *
 * <p>Everything the run depends on (sampling fraction and seed, exclusion lists, granularities)
 * is passed in explicitly. Granularities are processed one after another; the counting of
 * each one is spread over the executor's threads.</p>
 */
public class CorpusCoveragePipeline {

    private static final Logger logger = LoggerFactory.getLogger(CorpusCoveragePipeline.class);

    private final ApplicationConfig config;
    private final ExclusionWordLists exclusions;
    private final CorpusSummarizer summarizer;
    private final CorpusSampler sampler;
    private final TextNormalizer normalizer;
    private final FrequencyCounter counter;
    private final CoverageSelector selector;

    public CorpusCoveragePipeline(final ApplicationConfig config,
                                  final ExclusionWordLists exclusions,
                                  final AnalysisExecutorService executor) {
        this.config = config;
        this.exclusions = exclusions;
        this.summarizer = new CorpusSummarizer();
        this.sampler = new CorpusSampler(config.getSampleFraction(), config.getSampleSeed());
        this.normalizer = new TextNormalizer();
        this.counter = new FrequencyCounter(executor, config.getPartitions());
        this.selector = new CoverageSelector();
    }

    public AnalysisReport analyze(final List<SourceCorpus> corpora) {
        final long startTime = System.currentTimeMillis();
        logger.info("Analyzing {} sources", corpora.size());

        final List<CorpusSummary> summaries = summarizer.summarize(corpora);
        for (final CorpusSummary summary : summaries) {
            logger.info("Source '{}': {} lines, {} chars, {} words, {} bytes",
                    summary.source(), summary.lineCount(), summary.charCount(), summary.wordCount(), summary.sizeBytes());
        }

        final List<CorpusRecord> sample = sampler.sample(corpora);
        final List<CorpusRecord> cleaned = normalize(sample);
        final List<String> lines = new ArrayList<>(cleaned.size());
        for (final CorpusRecord record : cleaned) {
            lines.add(record.text());
        }

        final List<GranularityResult> results = new ArrayList<>();
        for (final GranularitySettings granularity : config.getGranularities()) {
            results.add(analyzeGranularity(granularity, lines));
        }

        final List<SourceWordFrequencies> perSource = sourceWordFrequencies(cleaned);

        final long elapsedMs = System.currentTimeMillis() - startTime;
        logger.info("Analysis finished in {}ms", elapsedMs);

        return new AnalysisReport(
                BuildInfo.getVersion(),
                config.getSampleFraction(),
                config.getSampleSeed(),
                summaries,
                sample.size(),
                cleaned.size(),
                results,
                perSource,
                elapsedMs);
    }

    /**
     * Normalizes every record and drops those left empty.
     */
    List<CorpusRecord> normalize(final List<CorpusRecord> sample) {
        final long startTime = System.currentTimeMillis();
        final List<CorpusRecord> cleaned = new ArrayList<>(sample.size());
        for (final CorpusRecord record : sample) {
            final String text = normalizer.normalize(record.text());
            if (!text.isEmpty()) {
                cleaned.add(record.withText(text));
            }
        }
        logger.info("Normalized {} records, {} non-empty, in {}ms",
                sample.size(), cleaned.size(), System.currentTimeMillis() - startTime);
        return cleaned;
    }

    GranularityResult analyzeGranularity(final GranularitySettings granularity, final List<String> lines) {
        final long startTime = System.currentTimeMillis();
        final FrequencyTable table;
        try (final WordNGramTokenizer tokenizer = tokenizerFor(granularity.n(), granularity.filtered())) {
            table = counter.count(lines, tokenizer);
        }
        final List<CoverageSet> coverageSets = selector.selectAll(table, granularity.thresholds());
        final long elapsedMs = System.currentTimeMillis() - startTime;

        for (final CoverageSet coverageSet : coverageSets) {
            logger.info("{}: {} of {} distinct tokens cover {} of {} occurrences (threshold {})",
                    granularity.name(), coverageSet.size(), table.distinctCount(),
                    String.format("%.4f", coverageSet.coveredProportion()), table.totalCount(), coverageSet.threshold());
        }

        return new GranularityResult(
                granularity.name(),
                granularity.n(),
                granularity.filtered(),
                table.totalCount(),
                table.distinctCount(),
                coverageSets,
                elapsedMs);
    }

    List<SourceWordFrequencies> sourceWordFrequencies(final List<CorpusRecord> cleaned) {
        final int topWords = config.getTopWordsPerSource();
        if (topWords <= 0) {
            return List.of();
        }

        final Map<String, List<String>> linesBySource = new LinkedHashMap<>();
        for (final CorpusRecord record : cleaned) {
            linesBySource.computeIfAbsent(record.source(), k -> new ArrayList<>()).add(record.text());
        }

        final List<SourceWordFrequencies> result = new ArrayList<>(linesBySource.size());
        try (final WordNGramTokenizer tokenizer = tokenizerFor(1, true)) {
            for (final Map.Entry<String, List<String>> entry : linesBySource.entrySet()) {
                final FrequencyTable table = counter.count(entry.getValue(), tokenizer);
                result.add(new SourceWordFrequencies(
                        entry.getKey(), table.totalCount(), table.distinctCount(), table.top(topWords)));
            }
        }
        return result;
    }

    private WordNGramTokenizer tokenizerFor(final int n, final boolean filtered) {
        return new WordNGramTokenizer(n, filtered ? exclusions : null);
    }
}
