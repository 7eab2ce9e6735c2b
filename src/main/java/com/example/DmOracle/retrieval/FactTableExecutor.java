package com.example.DmOracle.retrieval;

import com.example.DmOracle.model.TabularResult;

/**
 * Executes query text against the fact table.
 */
public interface FactTableExecutor {

    /**
     * @throws com.example.DmOracle.exception.QueryExecutionException when the query is
     *         rejected, malformed, or fails in the database
     */
    TabularResult execute(String queryText);
}
