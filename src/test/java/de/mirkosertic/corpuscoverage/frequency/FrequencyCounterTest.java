package de.mirkosertic.corpuscoverage.frequency;

import de.mirkosertic.corpuscoverage.AnalysisExecutorService;
import de.mirkosertic.corpuscoverage.text.WordNGramTokenizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FrequencyCounter")
class FrequencyCounterTest {

    private AnalysisExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = new AnalysisExecutorService(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private static List<String> randomLines(final int count) {
        final String[] vocabulary = {"cat", "dog", "sat", "on", "mat", "ran", "far", "red", "big", "sun"};
        final Random random = new Random(17);
        final List<String> lines = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            final int words = random.nextInt(12);
            final StringBuilder line = new StringBuilder();
            for (int w = 0; w < words; w++) {
                if (w > 0) {
                    line.append(' ');
                }
                line.append(vocabulary[random.nextInt(vocabulary.length)]);
            }
            lines.add(line.toString());
        }
        return lines;
    }

    @Test
    @DisplayName("Counts a token multiset")
    void shouldCountTokens() {
        final FrequencyTable table = new FrequencyCounter().count(List.of("cat", "dog", "cat", "cat"));

        assertThat(table.count("cat")).isEqualTo(3);
        assertThat(table.count("dog")).isEqualTo(1);
        assertThat(table.totalCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("N-grams never span two lines")
    void shouldNotCrossLineBoundaries() {
        try (WordNGramTokenizer bigrams = new WordNGramTokenizer(2)) {
            final FrequencyTable table = new FrequencyCounter().count(List.of("big red", "sun far"), bigrams);

            assertThat(table.counts()).containsOnlyKeys("big red", "sun far");
        }
    }

    @Test
    @DisplayName("Partitioned counting matches sequential counting")
    void shouldMatchSequentialCounts() {
        final List<String> lines = randomLines(2_000);

        for (int n = 1; n <= 4; n++) {
            try (WordNGramTokenizer tokenizer = new WordNGramTokenizer(n)) {
                final FrequencyTable sequential = new FrequencyCounter().count(lines, tokenizer);
                final FrequencyTable partitioned = new FrequencyCounter(executor, 7).count(lines, tokenizer);

                assertThat(partitioned.counts()).isEqualTo(sequential.counts());
                assertThat(partitioned.rankedEntries()).isEqualTo(sequential.rankedEntries());
            }
        }
    }

    @Test
    @DisplayName("More partitions than lines still counts every line once")
    void shouldHandleMorePartitionsThanLines() {
        try (WordNGramTokenizer words = new WordNGramTokenizer(1)) {
            final FrequencyTable table = new FrequencyCounter(executor, 16).count(List.of("cat dog", "cat"), words);

            assertThat(table.count("cat")).isEqualTo(2);
            assertThat(table.totalCount()).isEqualTo(3);
        }
    }

    @Test
    @DisplayName("No lines give an empty table")
    void shouldReturnEmptyTableForNoLines() {
        try (WordNGramTokenizer words = new WordNGramTokenizer(1)) {
            assertThat(new FrequencyCounter(executor, 4).count(List.of(), words).isEmpty()).isTrue();
            assertThat(new FrequencyCounter().count(List.of("", ""), words).isEmpty()).isTrue();
        }
    }

    @Test
    @DisplayName("Partition count must be positive")
    void shouldRejectNonPositivePartitions() {
        assertThatThrownBy(() -> new FrequencyCounter(executor, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
