package de.mirkosertic.corpuscoverage.text;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("WordNGramTokenizer")
class WordNGramTokenizerTest {

    private static final ExclusionWordLists EXCLUSIONS =
            ExclusionWordLists.of(List.of("the", "a", "and"), List.of("damn"));

    private final List<WordNGramTokenizer> opened = new ArrayList<>();

    private WordNGramTokenizer tokenizer(final int n) {
        final WordNGramTokenizer tokenizer = new WordNGramTokenizer(n);
        opened.add(tokenizer);
        return tokenizer;
    }

    private WordNGramTokenizer filteredWords() {
        final WordNGramTokenizer tokenizer = new WordNGramTokenizer(1, EXCLUSIONS);
        opened.add(tokenizer);
        return tokenizer;
    }

    @AfterEach
    void closeTokenizers() {
        opened.forEach(WordNGramTokenizer::close);
    }

    @Nested
    @DisplayName("Windowing")
    class Windowing {

        @Test
        @DisplayName("Words are split on whitespace")
        void shouldEmitWords() {
            assertThat(tokenizer(1).tokenize("the cat sat on the mat").toList())
                    .containsExactly("the", "cat", "sat", "on", "the", "mat");
        }

        @Test
        @DisplayName("Bigrams are consecutive word pairs joined by one space")
        void shouldEmitBigrams() {
            assertThat(tokenizer(2).tokenize("the cat sat on the mat").toList())
                    .containsExactly("the cat", "cat sat", "sat on", "on the", "the mat");
        }

        @Test
        @DisplayName("Three words give two bigrams")
        void shouldEmitTwoBigramsForThreeWords() {
            assertThat(tokenizer(2).tokenize("the quick fox").toList())
                    .containsExactly("the quick", "quick fox");
        }

        @Test
        @DisplayName("Quadgrams contain exactly four words")
        void shouldEmitQuadgrams() {
            assertThat(tokenizer(4).tokenize("one two six ten fox").toList())
                    .containsExactly("one two six ten", "two six ten fox");
        }

        @Test
        @DisplayName("Text shorter than the window yields no tokens")
        void shouldEmitNothingForShortText() {
            assertThat(tokenizer(3).tokenize("only two").toList()).isEmpty();
            assertThat(tokenizer(2).tokenize("single").toList()).isEmpty();
        }

        @ParameterizedTest(name = "{0} words, n={1} -> {2} tokens")
        @CsvSource({
                "0, 1, 0",
                "1, 1, 1",
                "5, 1, 5",
                "1, 2, 0",
                "2, 2, 1",
                "5, 2, 4",
                "5, 3, 3",
                "3, 4, 0",
                "4, 4, 1",
                "9, 4, 6"
        })
        @DisplayName("Window count is max(0, words - n + 1)")
        void shouldProduceExpectedWindowCount(final int words, final int n, final int expected) {
            final StringBuilder text = new StringBuilder();
            for (int i = 0; i < words; i++) {
                text.append("word").append(i).append(' ');
            }
            assertThat(tokenizer(n).tokenize(text.toString()).count()).isEqualTo(expected);
        }

        @Test
        @DisplayName("Empty and null text yield no tokens")
        void shouldHandleEmptyText() {
            assertThat(tokenizer(1).tokenize("").toList()).isEmpty();
            assertThat(tokenizer(2).tokenize(null).toList()).isEmpty();
        }

        @Test
        @DisplayName("Case is preserved")
        void shouldPreserveCase() {
            assertThat(tokenizer(2).tokenize("New York Times").toList())
                    .containsExactly("New York", "York Times");
        }
    }

    @Nested
    @DisplayName("Exclusion filtering")
    class Filtering {

        @Test
        @DisplayName("Stopwords and profanity are dropped, case-insensitively")
        void shouldDropExcludedWords() {
            assertThat(filteredWords().tokenize("The cat and A damn DAMN dog").toList())
                    .containsExactly("cat", "dog");
        }

        @Test
        @DisplayName("Matching is exact, no partial matches")
        void shouldOnlyDropExactMatches() {
            assertThat(filteredWords().tokenize("there theme andes damned").toList())
                    .containsExactly("there", "theme", "andes", "damned");
        }

        @Test
        @DisplayName("Filtered tokenizer reports its mode")
        void shouldReportFilteredMode() {
            assertThat(filteredWords().isFiltered()).isTrue();
            assertThat(tokenizer(1).isFiltered()).isFalse();
            assertThat(tokenizer(3).n()).isEqualTo(3);
        }

        @Test
        @DisplayName("Filtering is rejected for n-grams")
        void shouldRejectFilteringForNGrams() {
            assertThatThrownBy(() -> new WordNGramTokenizer(2, EXCLUSIONS))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Window size below one is rejected")
        void shouldRejectNonPositiveN() {
            assertThatThrownBy(() -> new WordNGramTokenizer(0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Token sequences")
    class Sequences {

        @Test
        @DisplayName("A sequence can be iterated more than once")
        void shouldBeRestartable() {
            final TokenSequence tokens = tokenizer(2).tokenize("a b c d");

            final List<String> first = new ArrayList<>();
            for (final String token : tokens) {
                first.add(token);
            }
            final List<String> second = new ArrayList<>();
            tokens.forEach(second::add);

            assertThat(first).containsExactly("a b", "b c", "c d");
            assertThat(second).isEqualTo(first);
            assertThat(tokens.stream().count()).isEqualTo(3);
        }

        @Test
        @DisplayName("One tokenizer serves several texts in a row")
        void shouldReuseTokenizer() {
            final WordNGramTokenizer bigrams = tokenizer(2);
            assertThat(bigrams.tokenize("x y z").toList()).containsExactly("x y", "y z");
            assertThat(bigrams.tokenize("p q").toList()).containsExactly("p q");
        }
    }
}
