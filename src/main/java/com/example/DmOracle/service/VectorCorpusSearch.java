package com.example.DmOracle.service;

import com.example.DmOracle.config.OracleProperties;
import com.example.DmOracle.exception.CorpusSearchException;
import com.example.DmOracle.model.Passage;
import com.example.DmOracle.model.ScoredPassage;
import com.example.DmOracle.repository.SrdPassageRepository;
import com.example.DmOracle.retrieval.CorpusSearch;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * pgvector corpus backend:
 * - Embed the question
 * - Query srd_passages for the topK nearest passages
 * - Filter with a dynamic minimum score
 *
 * Enabled by the "vector" profile, which also runs db/schema-pgvector.sql
 * to add the embedding column this search reads.
 */
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "oracle.corpus.search", havingValue = "vector")
public class VectorCorpusSearch implements CorpusSearch {

    private static final Logger log = LoggerFactory.getLogger(VectorCorpusSearch.class);

    /**
     * Margin from the top score used for dynamic thresholding.
     * Example: if topScore = 0.82 and margin = 0.10, dynamic threshold ~0.72.
     */
    private static final double TOP_SCORE_MARGIN = 0.10;

    /**
     * Absolute lower bound when all scores are low.
     */
    private static final double ABSOLUTE_FLOOR_SCORE = 0.25;

    private final EmbeddingModel embeddingModel;
    private final SrdPassageRepository passageRepository;
    private final OracleProperties props;

    @Override
    public List<Passage> search(String question, int topK) {
        List<ScoredPassage> retrieved;
        try {
            float[] queryEmbedding = embeddingModel.embed(question);
            retrieved = passageRepository.findNearest(queryEmbedding, topK);
        } catch (RuntimeException e) {
            throw new CorpusSearchException("Vector search unavailable: " + e.getMessage(), e);
        }

        if (retrieved == null || retrieved.isEmpty()) {
            log.debug("Vector search: no passages found for question='{}'", question);
            return List.of();
        }

        double topScore = retrieved.stream()
                .mapToDouble(ScoredPassage::score)
                .max()
                .orElse(0.0);
        double effectiveMinScore = computeDynamicMinScore(props.corpus().minScore(), topScore);

        List<ScoredPassage> filtered = retrieved.stream()
                .filter(p -> p.score() >= effectiveMinScore)
                .toList();

        // Keep at least the best passage when everything was filtered out
        if (filtered.isEmpty()) {
            log.debug("Vector search: all passages filtered out (topScore={}, effectiveMinScore={})",
                    topScore, effectiveMinScore);
            filtered = List.of(retrieved.get(0));
        }

        return filtered.stream()
                .map(p -> p.passage().toPassage(props.corpus().defaultSource()))
                .toList();
    }

    /**
     * - topScore >= requested: max(requested, topScore - margin)
     * - topScore < requested:  max(floor, topScore - margin)
     * Never above topScore.
     */
    static double computeDynamicMinScore(double requestedMinScore, double topScore) {
        double dynamicMinScore;
        if (topScore >= requestedMinScore) {
            dynamicMinScore = Math.max(requestedMinScore, topScore - TOP_SCORE_MARGIN);
        } else {
            dynamicMinScore = Math.max(ABSOLUTE_FLOOR_SCORE, topScore - TOP_SCORE_MARGIN);
        }
        return Math.min(dynamicMinScore, topScore);
    }
}
