package de.mirkosertic.corpuscoverage;

import de.mirkosertic.corpuscoverage.config.ApplicationConfig;
import de.mirkosertic.corpuscoverage.config.GranularitySettings;
import de.mirkosertic.corpuscoverage.corpus.CorpusRecord;
import de.mirkosertic.corpuscoverage.corpus.SourceCorpus;
import de.mirkosertic.corpuscoverage.frequency.CoverageSet;
import de.mirkosertic.corpuscoverage.frequency.FrequencyEntry;
import de.mirkosertic.corpuscoverage.report.AnalysisReport;
import de.mirkosertic.corpuscoverage.report.GranularityResult;
import de.mirkosertic.corpuscoverage.report.SourceWordFrequencies;
import de.mirkosertic.corpuscoverage.text.ExclusionWordLists;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * End-to-end runs of the pipeline over a small in-memory corpus.
 */
@DisplayName("CorpusCoveragePipeline Tests")
class CorpusCoveragePipelineTest {

    private static final List<SourceCorpus> CORPORA = List.of(
            SourceCorpus.of("blogs", List.of(
                    "The cat sat on the mat",
                    "The dog ate the cat food",
                    "A cat is a cat!!")),
            SourceCorpus.of("news", List.of(
                    "Breaking: the cat won 2 awards",
                    "http://news.example.com the cat news")));

    private ApplicationConfig config;
    private AnalysisExecutorService executor;
    private CorpusCoveragePipeline pipeline;

    @BeforeEach
    void setUp() {
        config = mock(ApplicationConfig.class);
        when(config.getSampleFraction()).thenReturn(1.0);
        when(config.getSampleSeed()).thenReturn(1001L);
        when(config.getPartitions()).thenReturn(3);
        when(config.getTopWordsPerSource()).thenReturn(3);
        when(config.getGranularities()).thenReturn(List.of(
                new GranularitySettings("words", 1, true, List.of(0.5, 1.0)),
                new GranularitySettings("bigrams", 2, false, List.of(0.9))));

        executor = new AnalysisExecutorService(2);
        pipeline = new CorpusCoveragePipeline(
                config, ExclusionWordLists.of(List.of("the", "a"), List.of("damn")), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    @DisplayName("Should count filtered words and select the coverage prefix")
    void shouldAnalyzeWords() {
        final AnalysisReport report = pipeline.analyze(CORPORA);

        final GranularityResult words = report.granularity("words").orElseThrow();
        assertThat(words.totalTokens()).isEqualTo(16);
        assertThat(words.distinctTokens()).isEqualTo(11);
        assertThat(words.filtered()).isTrue();

        final CoverageSet half = words.coverageSets().get(0);
        assertThat(half.tokens()).containsExactly("cat", "Breaking", "ate");
        assertThat(half.entries().get(0).count()).isEqualTo(6);
        assertThat(half.coveredProportion()).isEqualTo(0.5);

        final CoverageSet all = words.coverageSets().get(1);
        assertThat(all.size()).isEqualTo(11);
        assertThat(all.tokens()).doesNotContain("the", "The", "a", "A", "food");
    }

    @Test
    @DisplayName("Should count unfiltered bigrams within lines")
    void shouldAnalyzeBigrams() {
        final AnalysisReport report = pipeline.analyze(CORPORA);

        final GranularityResult bigrams = report.granularity("bigrams").orElseThrow();
        assertThat(bigrams.totalTokens()).isEqualTo(19);
        assertThat(bigrams.coverageSets().get(0).tokens()).startsWith("the cat");
        assertThat(bigrams.coverageSets().get(0).entries().get(0).count()).isEqualTo(3);
        assertThat(bigrams.coverageSets().get(0).tokens()).doesNotContain("mat The", "cat Breaking");
    }

    @Test
    @DisplayName("Should report sampling and per-source statistics")
    void shouldReportRunStatistics() {
        final AnalysisReport report = pipeline.analyze(CORPORA);

        assertThat(report.sampledRecords()).isEqualTo(5);
        assertThat(report.nonEmptyRecords()).isEqualTo(5);
        assertThat(report.sampleFraction()).isEqualTo(1.0);
        assertThat(report.corpusSummaries()).hasSize(2);
        assertThat(report.corpusSummaries().get(0).lineShare()).isEqualTo(0.6);

        final SourceWordFrequencies blogs = report.sourceWordFrequencies().get(0);
        assertThat(blogs.source()).isEqualTo("blogs");
        assertThat(blogs.totalWords()).isEqualTo(10);
        assertThat(blogs.topWords()).extracting(FrequencyEntry::token).containsExactly("cat", "ate", "dog");
        assertThat(blogs.topWords().get(0).proportion()).isEqualTo(0.4);

        final SourceWordFrequencies news = report.sourceWordFrequencies().get(1);
        assertThat(news.topWords()).extracting(FrequencyEntry::token).containsExactly("cat", "Breaking", "awards");
    }

    @Test
    @DisplayName("Should produce identical tables on repeated runs")
    void shouldBeReproducible() {
        when(config.getSampleFraction()).thenReturn(0.5);
        final List<SourceCorpus> corpora = new ArrayList<>();
        final List<String> lines = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            lines.add("line number " + (char) ('a' + i % 26) + " with words " + (char) ('a' + i % 7));
        }
        corpora.add(SourceCorpus.of("twitter", lines));

        final CorpusCoveragePipeline first = new CorpusCoveragePipeline(
                config, ExclusionWordLists.of(List.of("with"), List.of()), executor);
        final CorpusCoveragePipeline second = new CorpusCoveragePipeline(
                config, ExclusionWordLists.of(List.of("with"), List.of()), executor);

        final AnalysisReport a = first.analyze(corpora);
        final AnalysisReport b = second.analyze(corpora);

        assertThat(a.sampledRecords()).isEqualTo(100);
        for (int i = 0; i < a.granularities().size(); i++) {
            assertThat(a.granularities().get(i).coverageSets()).isEqualTo(b.granularities().get(i).coverageSets());
        }
    }

    @Test
    @DisplayName("Should drop records that normalize to nothing")
    void shouldDropEmptyRecords() {
        final List<CorpusRecord> cleaned = pipeline.normalize(List.of(
                new CorpusRecord("blogs", "!!! 123 :-)"),
                new CorpusRecord("blogs", "good night"),
                new CorpusRecord("news", "http://example.com")));

        assertThat(cleaned).containsExactly(new CorpusRecord("blogs", "night"));
    }

    @Test
    @DisplayName("Should skip per-source words when disabled")
    void shouldSkipSourceWordsWhenDisabled() {
        when(config.getTopWordsPerSource()).thenReturn(0);

        assertThat(pipeline.sourceWordFrequencies(List.of(new CorpusRecord("blogs", "cat")))).isEmpty();
    }
}
