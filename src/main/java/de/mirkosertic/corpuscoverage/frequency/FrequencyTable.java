package de.mirkosertic.corpuscoverage.frequency;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Occurrence counts of the distinct tokens of one token population.
 *
 * <p>Immutable. The ranked entry list is computed once at construction, sorted by
 * {@link FrequencyEntry#RANK_ORDER}. Proportions of all entries sum to 1.0 up to floating
 * point error for any non-empty table.</p>
 */
public final class FrequencyTable {

    private static final FrequencyTable EMPTY = new FrequencyTable(Map.of(), 0L);

    private final Map<String, Long> counts;
    private final long totalCount;
    private final List<FrequencyEntry> rankedEntries;

    private FrequencyTable(final Map<String, Long> counts, final long totalCount) {
        this.counts = counts;
        this.totalCount = totalCount;
        this.rankedEntries = rank(counts, totalCount);
    }

    public static FrequencyTable empty() {
        return EMPTY;
    }

    /**
     * Creates a table from token counts. Tokens with a count below 1 are ignored.
     */
    public static FrequencyTable of(final Map<String, Long> counts) {
        final Map<String, Long> positive = new HashMap<>(Math.max(16, (int) (counts.size() / 0.75f) + 1));
        long total = 0;
        for (final Map.Entry<String, Long> entry : counts.entrySet()) {
            final long count = entry.getValue();
            if (count > 0) {
                positive.put(entry.getKey(), count);
                total += count;
            }
        }
        if (positive.isEmpty()) {
            return EMPTY;
        }
        return new FrequencyTable(Collections.unmodifiableMap(positive), total);
    }

    private static List<FrequencyEntry> rank(final Map<String, Long> counts, final long totalCount) {
        if (counts.isEmpty()) {
            return List.of();
        }
        final List<FrequencyEntry> entries = new ArrayList<>(counts.size());
        final double total = totalCount;
        for (final Map.Entry<String, Long> entry : counts.entrySet()) {
            entries.add(new FrequencyEntry(entry.getKey(), entry.getValue(), entry.getValue() / total));
        }
        entries.sort(FrequencyEntry.RANK_ORDER);
        return Collections.unmodifiableList(entries);
    }

    public long count(final String token) {
        return counts.getOrDefault(token, 0L);
    }

    public double proportion(final String token) {
        return totalCount == 0 ? 0.0 : count(token) / (double) totalCount;
    }

    /**
     * Total number of token occurrences.
     */
    public long totalCount() {
        return totalCount;
    }

    /**
     * Number of distinct tokens.
     */
    public int distinctCount() {
        return counts.size();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    public Map<String, Long> counts() {
        return counts;
    }

    /**
     * All entries, most frequent first.
     */
    public List<FrequencyEntry> rankedEntries() {
        return rankedEntries;
    }

    public List<FrequencyEntry> top(final int k) {
        return rankedEntries.subList(0, Math.min(Math.max(k, 0), rankedEntries.size()));
    }
}
