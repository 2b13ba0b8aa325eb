package de.mirkosertic.corpuscoverage.corpus;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Descriptive statistics of one corpus source.
 *
 * <p>The share columns give this source's fraction of the whole corpus, rounded to two
 * decimals.</p>
 */
public record CorpusSummary(
        String source,
        long sizeBytes,
        long lineCount,
        long charCount,      // Unicode code points
        long wordCount,      // whitespace-delimited
        double charShare,
        double lineShare,
        double wordShare
) {
    @JsonProperty("sizeMegabytes")
    public double sizeMegabytes() {
        return sizeBytes / (1024.0 * 1024.0);
    }
}
