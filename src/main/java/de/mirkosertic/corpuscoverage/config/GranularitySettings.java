package de.mirkosertic.corpuscoverage.config;

import java.util.List;

/**
 * One token population to count: words ({@code n = 1}) or n-grams.
 *
 * @param name       label used in logs and output file names, e.g. {@code "bigrams"}
 * @param n          window size in words
 * @param filtered   whether stopwords and profanity are removed before counting
 * @param thresholds coverage thresholds to select for this population
 */
public record GranularitySettings(String name, int n, boolean filtered, List<Double> thresholds) {

    public GranularitySettings {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Granularity name must not be empty");
        }
        if (n < 1) {
            throw new ConfigurationException("Granularity '" + name + "' needs n >= 1, got " + n);
        }
        if (filtered && n > 1) {
            throw new ConfigurationException(
                    "Granularity '" + name + "': stopword/profanity filtering is only supported for words (n = 1)");
        }
        thresholds = List.copyOf(thresholds);
    }

    public static List<GranularitySettings> defaults() {
        return List.of(
                new GranularitySettings("words", 1, true, List.of(0.5, 0.9)),
                new GranularitySettings("bigrams", 2, false, List.of(0.9)),
                new GranularitySettings("trigrams", 3, false, List.of(0.9)),
                new GranularitySettings("quadgrams", 4, false, List.of(0.9))
        );
    }
}
