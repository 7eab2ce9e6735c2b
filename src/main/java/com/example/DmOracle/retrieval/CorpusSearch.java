package com.example.DmOracle.retrieval;

import com.example.DmOracle.model.Passage;

import java.util.List;

/**
 * Passage search over the rules corpus. Result order is deterministic
 * for a given question and corpus.
 */
public interface CorpusSearch {

    /**
     * @throws com.example.DmOracle.exception.CorpusSearchException when the backing
     *         index is unavailable or empty
     */
    List<Passage> search(String question, int topK);
}
