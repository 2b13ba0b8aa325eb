package de.mirkosertic.corpuscoverage.text;

import org.apache.lucene.analysis.CharArraySet;

import java.util.ArrayList;
import java.util.List;

/**
 * Stopwords and profanity excluded from the word population.
 *
 * <p>Both sets compare case-insensitively and by exact string only. They are read-only once
 * constructed and can be shared between threads.</p>
 */
public final class ExclusionWordLists {

    private final CharArraySet stopwords;
    private final CharArraySet profanity;

    public ExclusionWordLists(final CharArraySet stopwords, final CharArraySet profanity) {
        this.stopwords = CharArraySet.unmodifiableSet(ignoringCase(stopwords));
        this.profanity = CharArraySet.unmodifiableSet(ignoringCase(profanity));
    }

    public static ExclusionWordLists of(final List<String> stopwords, final List<String> profanity) {
        return new ExclusionWordLists(new CharArraySet(stopwords, true), new CharArraySet(profanity, true));
    }

    private static CharArraySet ignoringCase(final CharArraySet words) {
        final CharArraySet copy = new CharArraySet(words.size(), true);
        copy.addAll(words);
        return copy;
    }

    public boolean isExcluded(final char[] text, final int offset, final int length) {
        return stopwords.contains(text, offset, length) || profanity.contains(text, offset, length);
    }

    public boolean isExcluded(final CharSequence token) {
        return stopwords.contains(token) || profanity.contains(token);
    }

    /**
     * Returns the tokens of {@code words} that are in neither list, in their original order.
     */
    public List<String> filter(final Iterable<String> words) {
        final List<String> kept = new ArrayList<>();
        for (final String word : words) {
            if (!isExcluded(word)) {
                kept.add(word);
            }
        }
        return kept;
    }

    public int stopwordCount() {
        return stopwords.size();
    }

    public int profanityCount() {
        return profanity.size();
    }
}
