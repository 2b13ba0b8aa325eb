package de.mirkosertic.corpuscoverage.text;

import org.apache.lucene.analysis.FilteringTokenFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

/**
 * Token filter that drops every token found in the stopword or profanity list.
 *
 * <p>Matching is case-insensitive and exact; no stemming. Used on the word path only.</p>
 */
public final class ExclusionFilter extends FilteringTokenFilter {

    private final CharTermAttribute termAtt = addAttribute(CharTermAttribute.class);
    private final ExclusionWordLists wordLists;

    public ExclusionFilter(final TokenStream input, final ExclusionWordLists wordLists) {
        super(input);
        this.wordLists = wordLists;
    }

    @Override
    protected boolean accept() {
        return !wordLists.isExcluded(termAtt.buffer(), 0, termAtt.length());
    }
}
