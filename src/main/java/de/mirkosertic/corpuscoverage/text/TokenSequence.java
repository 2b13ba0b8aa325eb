package de.mirkosertic.corpuscoverage.text;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * The tokens of one text, produced on demand.
 *
 * <p>Nothing is analyzed until the sequence is iterated, and every iteration re-runs the
 * analyzer over the same text, so the sequence can be consumed any number of times.</p>
 */
public final class TokenSequence implements Iterable<String> {

    private static final String FIELD = "text";

    private final Analyzer analyzer;
    private final String text;

    TokenSequence(final Analyzer analyzer, final String text) {
        this.analyzer = analyzer;
        this.text = text;
    }

    /**
     * Streams every token to {@code action} without materializing the sequence.
     */
    @Override
    public void forEach(final Consumer<? super String> action) {
        if (text.isEmpty()) {
            return;
        }
        try (final TokenStream tokenStream = analyzer.tokenStream(FIELD, text)) {
            final CharTermAttribute termAttr = tokenStream.addAttribute(CharTermAttribute.class);
            tokenStream.reset();
            while (tokenStream.incrementToken()) {
                action.accept(termAttr.toString());
            }
            tokenStream.end();
        } catch (final IOException e) {
            // StringReader input, so only a broken analyzer chain ends up here
            throw new UncheckedIOException("Failed to tokenize text", e);
        }
    }

    @Override
    public Iterator<String> iterator() {
        return toList().iterator();
    }

    public List<String> toList() {
        final List<String> tokens = new ArrayList<>();
        forEach(tokens::add);
        return tokens;
    }

    public Stream<String> stream() {
        return toList().stream();
    }

    public int count() {
        final int[] count = new int[1];
        forEach(token -> count[0]++);
        return count[0];
    }
}
