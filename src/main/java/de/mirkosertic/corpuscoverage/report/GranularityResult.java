package de.mirkosertic.corpuscoverage.report;

import de.mirkosertic.corpuscoverage.frequency.CoverageSet;

import java.util.List;

/**
 * Counting and coverage results of one token population.
 */
public record GranularityResult(
        String name,
        int n,
        boolean filtered,
        long totalTokens,
        int distinctTokens,
        List<CoverageSet> coverageSets,
        long elapsedMs
) {
    public GranularityResult {
        coverageSets = List.copyOf(coverageSets);
    }
}
