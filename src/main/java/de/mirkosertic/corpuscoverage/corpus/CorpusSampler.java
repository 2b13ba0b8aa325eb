package de.mirkosertic.corpuscoverage.corpus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Reproducible uniform sampling without replacement, done separately for every source.
 *
 * <p>Each source contributes {@code floor(lines * fraction)} of its lines. The random
 * generator of a source is seeded from the configured seed and the source name, so a source
 * always yields the same sample no matter which other sources are present or in which order
 * they are listed. Sampled lines keep their file order.</p>
 */
public class CorpusSampler {

    private static final Logger logger = LoggerFactory.getLogger(CorpusSampler.class);

    private final double fraction;
    private final long seed;

    public CorpusSampler(final double fraction, final long seed) {
        if (!(fraction > 0.0 && fraction <= 1.0)) {
            throw new IllegalArgumentException("Sampling fraction must be in (0, 1], got " + fraction);
        }
        this.fraction = fraction;
        this.seed = seed;
    }

    /**
     * Samples every source and concatenates the tagged records in source order.
     */
    public List<CorpusRecord> sample(final List<SourceCorpus> corpora) {
        final List<CorpusRecord> records = new ArrayList<>();
        for (final SourceCorpus corpus : corpora) {
            final List<String> lines = sampleLines(corpus);
            for (final String line : lines) {
                records.add(new CorpusRecord(corpus.name(), line));
            }
            logger.info("Sampled {} of {} lines from '{}'", lines.size(), corpus.lineCount(), corpus.name());
        }
        return records;
    }

    public List<String> sampleLines(final SourceCorpus corpus) {
        final List<String> lines = corpus.lines();
        final int sampleSize = sampleSize(lines.size());
        if (sampleSize == 0) {
            return List.of();
        }

        final int[] indices = chooseIndices(lines.size(), sampleSize, new Random(sourceSeed(corpus.name())));
        final List<String> sample = new ArrayList<>(sampleSize);
        for (final int index : indices) {
            sample.add(lines.get(index));
        }
        return sample;
    }

    int sampleSize(final int population) {
        return (int) Math.floor(population * fraction);
    }

    long sourceSeed(final String sourceName) {
        return seed * 31 + sourceName.hashCode();
    }

    // Partial Fisher-Yates shuffle; the first k slots end up holding a uniform k-subset
    private static int[] chooseIndices(final int population, final int k, final Random random) {
        final int[] pool = new int[population];
        for (int i = 0; i < population; i++) {
            pool[i] = i;
        }
        for (int i = 0; i < k; i++) {
            final int j = i + random.nextInt(population - i);
            final int tmp = pool[i];
            pool[i] = pool[j];
            pool[j] = tmp;
        }
        final int[] chosen = Arrays.copyOf(pool, k);
        Arrays.sort(chosen);
        return chosen;
    }
}
