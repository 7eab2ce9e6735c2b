package com.example.DmOracle.service;

import com.example.DmOracle.OracleFixtures;
import com.example.DmOracle.exception.CorpusSearchException;
import com.example.DmOracle.model.Passage;
import com.example.DmOracle.model.ScoredPassage;
import com.example.DmOracle.model.SrdPassage;
import com.example.DmOracle.repository.SrdPassageRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.embedding.EmbeddingModel;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class VectorCorpusSearchTest {

    private static final float[] EMBEDDING = {0.1f, 0.2f, 0.3f};

    private EmbeddingModel embeddingModel;
    private SrdPassageRepository repository;
    private VectorCorpusSearch search;

    @BeforeEach
    void setUp() {
        embeddingModel = mock(EmbeddingModel.class);
        repository = mock(SrdPassageRepository.class);
        search = new VectorCorpusSearch(embeddingModel, repository, OracleFixtures.properties());
        when(embeddingModel.embed("How does grappling work?")).thenReturn(EMBEDDING);
    }

    @Test
    void keepsPassagesCloseToTheBestScore() {
        when(repository.findNearest(EMBEDDING, 3)).thenReturn(List.of(
                scored(3L, "Basic Rules", 0.82),
                scored(4L, "SRD 5.1 Conditions", 0.75),
                scored(1L, "Player's Handbook", 0.61)));

        List<Passage> passages = search.search("How does grappling work?", 3);

        assertThat(passages).extracting(Passage::source).containsExactly("Basic Rules", "SRD 5.1 Conditions");
    }

    @Test
    void keepsBestPassageWhenAllScoresAreLow() {
        when(repository.findNearest(EMBEDDING, 3)).thenReturn(List.of(
                scored(3L, null, 0.20),
                scored(4L, "SRD 5.1 Conditions", 0.05)));

        List<Passage> passages = search.search("How does grappling work?", 3);

        assertThat(passages).singleElement()
                .satisfies(p -> assertThat(p.source()).isEqualTo("D&D SRD"));
    }

    @Test
    void noNeighboursIsAnEmptySuccess() {
        when(repository.findNearest(EMBEDDING, 3)).thenReturn(List.of());

        assertThat(search.search("How does grappling work?", 3)).isEmpty();
    }

    @Test
    void embeddingFailureIsACorpusError() {
        when(embeddingModel.embed("How does grappling work?")).thenThrow(new IllegalStateException("quota"));

        assertThatThrownBy(() -> search.search("How does grappling work?", 3))
                .isInstanceOf(CorpusSearchException.class)
                .hasMessage("Vector search unavailable: quota");
    }

    @Test
    void repositoryFailureIsACorpusError() {
        when(repository.findNearest(any(float[].class), anyInt())).thenThrow(new IllegalStateException("no pgvector"));

        assertThatThrownBy(() -> search.search("How does grappling work?", 3))
                .isInstanceOf(CorpusSearchException.class);
    }

    @Test
    void dynamicMinScore() {
        assertThat(VectorCorpusSearch.computeDynamicMinScore(0.60, 0.82)).isCloseTo(0.72, within(1e-9));
        assertThat(VectorCorpusSearch.computeDynamicMinScore(0.60, 0.65)).isCloseTo(0.60, within(1e-9));
        assertThat(VectorCorpusSearch.computeDynamicMinScore(0.60, 0.50)).isCloseTo(0.40, within(1e-9));
        assertThat(VectorCorpusSearch.computeDynamicMinScore(0.60, 0.20)).isCloseTo(0.20, within(1e-9));
    }

    private static ScoredPassage scored(long id, String source, double score) {
        return new ScoredPassage(new SrdPassage(id, source, "chunk_" + id, "content " + id), score);
    }
}
