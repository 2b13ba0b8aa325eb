package de.mirkosertic.corpuscoverage.text;

import org.apache.lucene.analysis.CharArraySet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ExclusionWordLists")
class ExclusionWordListsTest {

    private final ExclusionWordLists lists = ExclusionWordLists.of(List.of("the", "of"), List.of("damn"));

    @Test
    @DisplayName("Words from either list are excluded")
    void shouldExcludeFromBothLists() {
        assertThat(lists.isExcluded("the")).isTrue();
        assertThat(lists.isExcluded("damn")).isTrue();
        assertThat(lists.isExcluded("cat")).isFalse();
    }

    @Test
    @DisplayName("Lookup ignores case")
    void shouldIgnoreCase() {
        assertThat(lists.isExcluded("The")).isTrue();
        assertThat(lists.isExcluded("DAMN")).isTrue();
    }

    @Test
    @DisplayName("Char buffer lookup honours offset and length")
    void shouldMatchCharBuffers() {
        final char[] buffer = "xxofyy".toCharArray();
        assertThat(lists.isExcluded(buffer, 2, 2)).isTrue();
        assertThat(lists.isExcluded(buffer, 1, 3)).isFalse();
    }

    @Test
    @DisplayName("Case-sensitive input sets are copied as case-insensitive")
    void shouldCopyAsCaseInsensitive() {
        final CharArraySet stopwords = new CharArraySet(List.of("and"), false);
        final ExclusionWordLists copied = new ExclusionWordLists(stopwords, CharArraySet.EMPTY_SET);

        assertThat(copied.isExcluded("AND")).isTrue();
        assertThat(copied.stopwordCount()).isEqualTo(1);
        assertThat(copied.profanityCount()).isZero();
    }

    @Test
    @DisplayName("Filtering keeps the order of the surviving words")
    void shouldFilterInOrder() {
        assertThat(lists.filter(List.of("The", "end", "of", "damn", "days")))
                .containsExactly("end", "days");
    }

    @Test
    @DisplayName("Filtered output never contains an excluded word")
    void filteredOutputShouldBeDisjointFromLists() {
        final List<String> kept = lists.filter(List.of("of", "mice", "and", "THE", "men", "Damn"));
        assertThat(kept).noneMatch(lists::isExcluded);
        assertThat(kept).containsExactly("mice", "and", "men");
    }
}
