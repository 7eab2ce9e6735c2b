package com.example.DmOracle.service;

import com.example.DmOracle.config.OracleProperties;
import com.example.DmOracle.exception.CorpusSearchException;
import com.example.DmOracle.model.Passage;
import com.example.DmOracle.model.SrdPassage;
import com.example.DmOracle.repository.SrdPassageRepository;
import com.example.DmOracle.retrieval.CorpusSearch;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Default corpus backend: term-overlap ranking over the srd_passages table.
 *
 * Score = number of distinct question terms found in the passage.
 * Ties are broken by passage id, so results are stable for a given corpus.
 */
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "oracle.corpus.search", havingValue = "keyword", matchIfMissing = true)
public class KeywordCorpusSearch implements CorpusSearch {

    private static final Logger log = LoggerFactory.getLogger(KeywordCorpusSearch.class);

    private static final int MIN_TERM_LENGTH = 3;

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "are", "but", "not", "you", "your", "with", "does", "how",
            "what", "when", "where", "which", "who", "why", "can", "this", "that", "from",
            "into", "about", "work", "works", "explain", "tell", "describe"
    );

    private final SrdPassageRepository passageRepository;
    private final OracleProperties props;

    @Override
    public List<Passage> search(String question, int topK) {
        List<SrdPassage> corpus;
        try {
            corpus = passageRepository.findAll();
        } catch (DataAccessException e) {
            throw new CorpusSearchException("Corpus index unavailable: " + e.getMostSpecificCause().getMessage(), e);
        }
        if (corpus.isEmpty()) {
            throw new CorpusSearchException("Corpus is empty");
        }

        Set<String> terms = terms(question);
        if (terms.isEmpty()) {
            log.debug("No searchable terms in question='{}'", question);
            return List.of();
        }

        List<Passage> ranked = corpus.stream()
                .map(p -> new Ranked(p, score(p, terms)))
                .filter(r -> r.score() > 0)
                .sorted(Comparator.comparingInt(Ranked::score).reversed()
                        .thenComparing(r -> r.passage().getId(), Comparator.nullsLast(Comparator.<Long>naturalOrder())))
                .limit(Math.max(0, topK))
                .map(r -> r.passage().toPassage(props.corpus().defaultSource()))
                .toList();

        log.debug("Keyword search: terms={} matched={}", terms, ranked.size());
        return ranked;
    }

    static Set<String> terms(String text) {
        if (text == null) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
                .filter(t -> t.length() >= MIN_TERM_LENGTH)
                .filter(t -> !STOP_WORDS.contains(t))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static int score(SrdPassage passage, Set<String> terms) {
        Set<String> passageTerms = terms(passage.getContent());
        int score = 0;
        for (String term : terms) {
            if (passageTerms.contains(term) || containsPrefix(passageTerms, term)) {
                score++;
            }
        }
        return score;
    }

    /**
     * Lets "grappling" match "grappled"/"grapple" by sharing a stem-like prefix.
     */
    private static boolean containsPrefix(Set<String> passageTerms, String term) {
        if (term.length() < 5) {
            return false;
        }
        String stem = term.substring(0, term.length() - Math.min(3, term.length() - 4));
        return passageTerms.stream().anyMatch(t -> t.startsWith(stem));
    }

    private record Ranked(SrdPassage passage, int score) {
    }
}
