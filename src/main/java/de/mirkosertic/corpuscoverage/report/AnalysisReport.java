package de.mirkosertic.corpuscoverage.report;

import de.mirkosertic.corpuscoverage.corpus.CorpusSummary;

import java.util.List;
import java.util.Optional;

/**
 * Everything one pipeline run produced.
 */
public record AnalysisReport(
        String generatorVersion,
        double sampleFraction,
        long sampleSeed,
        List<CorpusSummary> corpusSummaries,
        int sampledRecords,
        int nonEmptyRecords,
        List<GranularityResult> granularities,
        List<SourceWordFrequencies> sourceWordFrequencies,
        long elapsedMs
) {
    public AnalysisReport {
        corpusSummaries = List.copyOf(corpusSummaries);
        granularities = List.copyOf(granularities);
        sourceWordFrequencies = List.copyOf(sourceWordFrequencies);
    }

    public Optional<GranularityResult> granularity(final String name) {
        return granularities.stream()
                .filter(g -> g.name().equals(name))
                .findFirst();
    }
}
