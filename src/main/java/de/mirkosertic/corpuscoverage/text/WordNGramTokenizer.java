package de.mirkosertic.corpuscoverage.text;

import org.jspecify.annotations.Nullable;

import java.io.Closeable;

/**
 * Splits normalized text into words or word n-grams.
 *
 * <p>One tokenizer serves one granularity. It is safe to use from several threads at once;
 * the underlying analyzer keeps its token chain per thread.</p>
 */
public class WordNGramTokenizer implements Closeable {

    private final int n;
    private final boolean filtered;
    private final WordNGramAnalyzer analyzer;

    public WordNGramTokenizer(final int n) {
        this(n, null);
    }

    /**
     * @param n          window size in words
     * @param exclusions stopword and profanity lists to drop first, or null; words only
     */
    public WordNGramTokenizer(final int n, final @Nullable ExclusionWordLists exclusions) {
        this.n = n;
        this.filtered = exclusions != null;
        this.analyzer = new WordNGramAnalyzer(n, exclusions);
    }

    public TokenSequence tokenize(final @Nullable String text) {
        return new TokenSequence(analyzer, text == null ? "" : text);
    }

    public int n() {
        return n;
    }

    public boolean isFiltered() {
        return filtered;
    }

    @Override
    public void close() {
        analyzer.close();
    }
}
