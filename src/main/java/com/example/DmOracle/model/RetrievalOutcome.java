package com.example.DmOracle.model;

import java.util.List;

/**
 * Result of one retrieval strategy execution.
 *
 * kind         - strategy that produced it
 * succeeded    - whether evidence was retrieved
 * table        - rows for STRUCTURED success, otherwise null
 * passages     - ordered passages for UNSTRUCTURED success, otherwise empty
 * diagnostic   - executed query text, or the failure cause
 * attemptsUsed - number of attempts made, at least 1
 */
public record RetrievalOutcome(
        RouteDecision kind,
        boolean succeeded,
        TabularResult table,
        List<Passage> passages,
        String diagnostic,
        int attemptsUsed
) {

    public RetrievalOutcome {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        if (attemptsUsed < 1) {
            throw new IllegalArgumentException("attemptsUsed must be >= 1, was " + attemptsUsed);
        }
        passages = passages == null ? List.of() : List.copyOf(passages);
        if (!succeeded && (table != null || !passages.isEmpty())) {
            throw new IllegalArgumentException("a failed outcome carries no evidence");
        }
        diagnostic = diagnostic == null ? "" : diagnostic;
    }

    public static RetrievalOutcome structuredSuccess(TabularResult table, String query, int attemptsUsed) {
        return new RetrievalOutcome(RouteDecision.STRUCTURED, true, table, List.of(), query, attemptsUsed);
    }

    public static RetrievalOutcome structuredFailure(String diagnostic, int attemptsUsed) {
        return new RetrievalOutcome(RouteDecision.STRUCTURED, false, null, List.of(), diagnostic, attemptsUsed);
    }

    public static RetrievalOutcome unstructuredSuccess(List<Passage> passages, String diagnostic) {
        return new RetrievalOutcome(RouteDecision.UNSTRUCTURED, true, null, passages, diagnostic, 1);
    }

    public static RetrievalOutcome unstructuredFailure(String diagnostic) {
        return new RetrievalOutcome(RouteDecision.UNSTRUCTURED, false, null, List.of(), diagnostic, 1);
    }
}
