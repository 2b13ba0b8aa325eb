package de.mirkosertic.corpuscoverage.frequency;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;

/**
 * The most frequent tokens of a population whose cumulative proportion stays within a
 * threshold.
 *
 * @param threshold      the coverage threshold the set was cut at
 * @param entries        kept entries in rank order
 * @param totalTokens    total token occurrences of the source table
 * @param distinctTokens distinct tokens of the source table
 */
public record CoverageSet(double threshold, List<CoverageEntry> entries, long totalTokens, int distinctTokens) {

    public CoverageSet {
        entries = List.copyOf(entries);
    }

    /**
     * Number of distinct tokens needed to reach the threshold.
     */
    public int size() {
        return entries.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Frequency mass actually covered by the kept entries.
     */
    public double coveredProportion() {
        return entries.isEmpty() ? 0.0 : entries.get(entries.size() - 1).cumulativeProportion();
    }

    public List<CoverageEntry> top(final int k) {
        return entries.subList(0, Math.min(Math.max(k, 0), entries.size()));
    }

    public List<String> tokens() {
        final List<String> tokens = new ArrayList<>(entries.size());
        for (final CoverageEntry entry : entries) {
            tokens.add(entry.token());
        }
        return tokens;
    }
}
