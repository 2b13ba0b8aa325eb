package de.mirkosertic.corpuscoverage.corpus;

/**
 * One line of corpus text tagged with the source it was sampled from.
 */
public record CorpusRecord(String source, String text) {

    public CorpusRecord withText(final String newText) {
        return new CorpusRecord(source, newText);
    }
}
