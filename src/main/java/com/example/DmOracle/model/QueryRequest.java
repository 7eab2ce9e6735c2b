package com.example.DmOracle.model;

/**
 * Request payload for asking the oracle a question.
 *
 * @param query     the D&D question, e.g. "What is a Beholder's armor class?"
 * @param sessionId optional session identifier, echoed back in the response
 */
public record QueryRequest(
        String query,
        String sessionId
) {
}
