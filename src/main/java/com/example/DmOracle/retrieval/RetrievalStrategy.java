package com.example.DmOracle.retrieval;

import com.example.DmOracle.model.RetrievalOutcome;
import com.example.DmOracle.model.RouteDecision;

/**
 * One way of gathering evidence for a question.
 *
 * Implementations never throw: every failure is reported through
 * {@link RetrievalOutcome#succeeded()} and {@link RetrievalOutcome#diagnostic()}.
 */
public interface RetrievalStrategy {

    /** Route this strategy serves. */
    RouteDecision kind();

    RetrievalOutcome retrieve(String question);
}
