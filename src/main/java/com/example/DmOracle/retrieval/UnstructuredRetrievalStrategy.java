package com.example.DmOracle.retrieval;

import com.example.DmOracle.config.OracleProperties;
import com.example.DmOracle.model.Passage;
import com.example.DmOracle.model.RetrievalOutcome;
import com.example.DmOracle.model.RouteDecision;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Passage retrieval from the rules corpus. A backend failure is terminal for the request.
 */
@Component
@RequiredArgsConstructor
public class UnstructuredRetrievalStrategy implements RetrievalStrategy {

    private static final Logger log = LoggerFactory.getLogger(UnstructuredRetrievalStrategy.class);

    private final CorpusSearch corpusSearch;
    private final OracleProperties props;

    @Override
    public RouteDecision kind() {
        return RouteDecision.UNSTRUCTURED;
    }

    @Override
    public RetrievalOutcome retrieve(String question) {
        try {
            List<Passage> passages = corpusSearch.search(question, props.corpus().topK());
            log.info("Corpus search returned {} passage(s)", passages.size());
            return RetrievalOutcome.unstructuredSuccess(passages, "document_count=" + passages.size());
        } catch (Exception e) {
            log.warn("Corpus search failed: {}", e.getMessage());
            return RetrievalOutcome.unstructuredFailure(
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }
}
