package de.mirkosertic.corpuscoverage.frequency;

import java.util.ArrayList;
import java.util.List;

/**
 * Selects the minimal set of most frequent tokens that covers a share of the frequency mass.
 *
 * <p>Walks {@link FrequencyTable#rankedEntries()} in rank order, summing proportions in that
 * same order, and keeps the longest prefix whose running sum is {@code <= threshold}. The
 * comparison is strict: no rounding is applied before it, so an entry whose cumulative
 * proportion lands a rounding error above the threshold is dropped.</p>
 *
 * <ul>
 *   <li>Empty table: empty set.</li>
 *   <li>{@code threshold >= 1.0}: the whole ranked table, even if accumulated rounding
 *       pushes the final sum slightly above 1.0.</li>
 *   <li>{@code threshold <= 0.0}: empty set, as no token has a non-positive proportion.</li>
 * </ul>
 */
public class CoverageSelector {

    public CoverageSet select(final FrequencyTable table, final double threshold) {
        if (table.isEmpty() || threshold <= 0.0 || Double.isNaN(threshold)) {
            return new CoverageSet(threshold, List.of(), table.totalCount(), table.distinctCount());
        }

        final boolean keepAll = threshold >= 1.0;
        final List<FrequencyEntry> ranked = table.rankedEntries();
        final List<CoverageEntry> kept = new ArrayList<>();
        double cumulative = 0.0;
        for (final FrequencyEntry entry : ranked) {
            cumulative += entry.proportion();
            if (!keepAll && cumulative > threshold) {
                break;
            }
            kept.add(new CoverageEntry(entry.token(), entry.count(), entry.proportion(), cumulative));
        }
        return new CoverageSet(threshold, kept, table.totalCount(), table.distinctCount());
    }

    /**
     * Selects one coverage set per threshold, in the order given.
     */
    public List<CoverageSet> selectAll(final FrequencyTable table, final List<Double> thresholds) {
        final List<CoverageSet> sets = new ArrayList<>(thresholds.size());
        for (final double threshold : thresholds) {
            sets.add(select(table, threshold));
        }
        return sets;
    }
}
