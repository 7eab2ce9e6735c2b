package com.example.DmOracle.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Route reported back to callers; ERROR marks a request that failed outside
 * the per-component error handling.
 */
public enum AnswerRoute {
    STRUCTURED("structured"),
    UNSTRUCTURED("unstructured"),
    ERROR("error");

    private final String label;

    AnswerRoute(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static AnswerRoute of(RouteDecision decision) {
        return decision == RouteDecision.STRUCTURED ? STRUCTURED : UNSTRUCTURED;
    }
}
