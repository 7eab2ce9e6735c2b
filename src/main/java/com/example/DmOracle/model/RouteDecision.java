package com.example.DmOracle.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Which retrieval strategy answers a question.
 */
public enum RouteDecision {
    STRUCTURED("structured"),
    UNSTRUCTURED("unstructured");

    private final String label;

    RouteDecision(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Exact, case-sensitive match on the label. Callers normalize first.
     */
    public static Optional<RouteDecision> fromLabel(String label) {
        return Arrays.stream(values())
                .filter(r -> r.label.equals(label))
                .findFirst();
    }
}
