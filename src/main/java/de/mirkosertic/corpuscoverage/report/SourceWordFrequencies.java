package de.mirkosertic.corpuscoverage.report;

import de.mirkosertic.corpuscoverage.frequency.FrequencyEntry;

import java.util.List;

/**
 * The most frequent filtered words of one source, with proportions relative to that source.
 */
public record SourceWordFrequencies(String source, long totalWords, int distinctWords, List<FrequencyEntry> topWords) {

    public SourceWordFrequencies {
        topWords = List.copyOf(topWords);
    }
}
