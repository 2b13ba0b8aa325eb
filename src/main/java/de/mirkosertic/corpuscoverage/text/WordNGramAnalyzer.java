package de.mirkosertic.corpuscoverage.text;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.core.WhitespaceTokenizer;
import org.apache.lucene.analysis.shingle.ShingleFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.jspecify.annotations.Nullable;

/**
 * Analyzer producing word n-grams from normalized text.
 *
 * <p>Token chain: {@code WhitespaceTokenizer -> [ExclusionFilter] -> [ShingleFilter(n, n)]}</p>
 *
 * <p>Case is preserved. For {@code n = 1} the chain emits the words themselves; for larger
 * {@code n} it emits only the windows of exactly {@code n} consecutive words, joined by a
 * single space, and nothing when the text has fewer than {@code n} words.</p>
 */
public class WordNGramAnalyzer extends Analyzer {

    public static final String TOKEN_SEPARATOR = " ";

    private final int n;
    private final @Nullable ExclusionWordLists exclusions;

    /**
     * @param n          window size in words, at least 1
     * @param exclusions word lists to drop before windowing, or null for none; only allowed for {@code n = 1}
     */
    public WordNGramAnalyzer(final int n, final @Nullable ExclusionWordLists exclusions) {
        if (n < 1) {
            throw new IllegalArgumentException("n must be at least 1, got " + n);
        }
        if (exclusions != null && n > 1) {
            throw new IllegalArgumentException("Exclusion filtering is only supported for single words");
        }
        this.n = n;
        this.exclusions = exclusions;
    }

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer tokenizer = new WhitespaceTokenizer(
                TokenStream.DEFAULT_TOKEN_ATTRIBUTE_FACTORY, StandardTokenizer.MAX_TOKEN_LENGTH_LIMIT);
        TokenStream stream = tokenizer;
        if (exclusions != null) {
            stream = new ExclusionFilter(stream, exclusions);
        }
        if (n > 1) {
            final ShingleFilter shingles = new ShingleFilter(stream, n, n);
            shingles.setOutputUnigrams(false);
            shingles.setTokenSeparator(TOKEN_SEPARATOR);
            stream = shingles;
        }
        return new TokenStreamComponents(tokenizer, stream);
    }
}
