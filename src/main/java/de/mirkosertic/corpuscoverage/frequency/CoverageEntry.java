package de.mirkosertic.corpuscoverage.frequency;

import de.mirkosertic.corpuscoverage.text.WordNGramAnalyzer;

import java.util.List;

/**
 * A ranked token together with the frequency mass covered up to and including it.
 */
public record CoverageEntry(String token, long count, double proportion, double cumulativeProportion) {

    /**
     * The words of an n-gram token in order; a single word for unigrams.
     */
    public List<String> words() {
        return List.of(token.split(WordNGramAnalyzer.TOKEN_SEPARATOR));
    }
}
