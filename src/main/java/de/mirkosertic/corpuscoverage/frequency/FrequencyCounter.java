package de.mirkosertic.corpuscoverage.frequency;

import de.mirkosertic.corpuscoverage.AnalysisExecutorService;
import de.mirkosertic.corpuscoverage.text.WordNGramTokenizer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Builds {@link FrequencyTable}s from token populations.
 *
 * <p>Line-based counting splits the lines into contiguous partitions, counts each partition
 * into its own map on the executor and merges the partial maps afterwards. Counts are sums,
 * so the merged table and its ranking are identical for any partition or thread count.</p>
 */
public class FrequencyCounter {

    private static final Logger logger = LoggerFactory.getLogger(FrequencyCounter.class);

    private final @Nullable AnalysisExecutorService executor;
    private final int partitions;

    /**
     * Counter that works on the calling thread only.
     */
    public FrequencyCounter() {
        this(null, 1);
    }

    public FrequencyCounter(final @Nullable AnalysisExecutorService executor, final int partitions) {
        if (partitions < 1) {
            throw new IllegalArgumentException("partitions must be positive, got " + partitions);
        }
        this.executor = executor;
        this.partitions = partitions;
    }

    /**
     * Counts a token multiset.
     */
    public FrequencyTable count(final Iterable<String> tokens) {
        final Map<String, long[]> counts = new HashMap<>();
        for (final String token : tokens) {
            increment(counts, token);
        }
        return toTable(counts);
    }

    /**
     * Counts the tokens {@code tokenizer} produces for every line.
     */
    public FrequencyTable count(final List<String> lines, final WordNGramTokenizer tokenizer) {
        if (lines.isEmpty()) {
            return FrequencyTable.empty();
        }
        final long startTime = System.currentTimeMillis();

        final int partitionCount = executor == null ? 1 : Math.min(partitions, lines.size());
        final Map<String, long[]> counts;
        if (partitionCount == 1) {
            counts = countPartition(lines, tokenizer);
        } else {
            counts = countPartitioned(lines, tokenizer, partitionCount);
        }

        final FrequencyTable table = toTable(counts);
        logger.debug("Counted {} tokens ({} distinct, n={}) over {} lines in {} partitions in {}ms",
                table.totalCount(), table.distinctCount(), tokenizer.n(), lines.size(), partitionCount,
                System.currentTimeMillis() - startTime);
        return table;
    }

    private Map<String, long[]> countPartitioned(final List<String> lines, final WordNGramTokenizer tokenizer,
                                                 final int partitionCount) {
        final int chunkSize = (lines.size() + partitionCount - 1) / partitionCount;
        final List<Future<Map<String, long[]>>> futures = new ArrayList<>(partitionCount);
        for (int from = 0; from < lines.size(); from += chunkSize) {
            final List<String> partition = lines.subList(from, Math.min(from + chunkSize, lines.size()));
            futures.add(executor.submit(() -> countPartition(partition, tokenizer)));
        }

        Map<String, long[]> merged = null;
        try {
            for (final Future<Map<String, long[]>> future : futures) {
                final Map<String, long[]> partial = future.get();
                if (merged == null) {
                    merged = partial;
                } else {
                    mergeInto(merged, partial);
                }
            }
        } catch (final InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while counting tokens", e);
        } catch (final ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Token counting failed", e.getCause());
        }
        return merged;
    }

    private static Map<String, long[]> countPartition(final List<String> lines, final WordNGramTokenizer tokenizer) {
        final Map<String, long[]> counts = new HashMap<>();
        for (final String line : lines) {
            tokenizer.tokenize(line).forEach(token -> increment(counts, token));
        }
        return counts;
    }

    private static void increment(final Map<String, long[]> counts, final String token) {
        counts.computeIfAbsent(token, k -> new long[1])[0]++;
    }

    private static void mergeInto(final Map<String, long[]> target, final Map<String, long[]> partial) {
        for (final Map.Entry<String, long[]> entry : partial.entrySet()) {
            final long[] existing = target.putIfAbsent(entry.getKey(), entry.getValue());
            if (existing != null) {
                existing[0] += entry.getValue()[0];
            }
        }
    }

    private static FrequencyTable toTable(final Map<String, long[]> counts) {
        final Map<String, Long> boxed = new HashMap<>(Math.max(16, (int) (counts.size() / 0.75f) + 1));
        for (final Map.Entry<String, long[]> entry : counts.entrySet()) {
            boxed.put(entry.getKey(), entry.getValue()[0]);
        }
        return FrequencyTable.of(boxed);
    }
}
