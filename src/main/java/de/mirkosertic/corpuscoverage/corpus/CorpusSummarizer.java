package de.mirkosertic.corpuscoverage.corpus;

import de.mirkosertic.corpuscoverage.util.TextCleaner;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes per-source line, character and word counts and each source's share of the total.
 */
public class CorpusSummarizer {

    public List<CorpusSummary> summarize(final List<SourceCorpus> corpora) {
        final int sources = corpora.size();
        final long[] chars = new long[sources];
        final long[] words = new long[sources];
        long totalChars = 0;
        long totalWords = 0;
        long totalLines = 0;

        for (int i = 0; i < sources; i++) {
            for (final String line : corpora.get(i).lines()) {
                chars[i] += line.codePointCount(0, line.length());
                words[i] += TextCleaner.countWords(line);
            }
            totalChars += chars[i];
            totalWords += words[i];
            totalLines += corpora.get(i).lineCount();
        }

        final List<CorpusSummary> summaries = new ArrayList<>(sources);
        for (int i = 0; i < sources; i++) {
            final SourceCorpus corpus = corpora.get(i);
            summaries.add(new CorpusSummary(
                    corpus.name(),
                    corpus.sizeBytes(),
                    corpus.lineCount(),
                    chars[i],
                    words[i],
                    share(chars[i], totalChars),
                    share(corpus.lineCount(), totalLines),
                    share(words[i], totalWords)));
        }
        return summaries;
    }

    static double share(final long part, final long total) {
        if (total == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf((double) part / total)
                .setScale(2, RoundingMode.HALF_EVEN)
                .doubleValue();
    }
}
