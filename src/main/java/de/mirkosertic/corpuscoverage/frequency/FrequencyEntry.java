package de.mirkosertic.corpuscoverage.frequency;

import java.util.Comparator;

/**
 * One distinct token of a {@link FrequencyTable}.
 *
 * @param token      the word or n-gram
 * @param count      number of occurrences
 * @param proportion count divided by the table's total token count
 */
public record FrequencyEntry(String token, long count, double proportion) {

    /**
     * Ranking order: descending proportion, then descending count, then token in ascending
     * {@link String#compareTo} order. Total on distinct tokens, so the ranking never depends on
     * hash iteration order or sort stability.
     */
    public static final Comparator<FrequencyEntry> RANK_ORDER =
            Comparator.comparingDouble(FrequencyEntry::proportion).reversed()
                    .thenComparing(Comparator.comparingLong(FrequencyEntry::count).reversed())
                    .thenComparing(FrequencyEntry::token);
}
