package com.example.DmOracle.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response of the oracle for one question.
 *
 * @param answer             user-facing answer text, never empty
 * @param route              routing decision, or ERROR
 * @param sources            distinct provenance labels in first-seen order
 * @param retrievalSucceeded whether the selected strategy retrieved evidence
 * @param sessionId          caller-supplied session id, passed through untouched
 * @param metadata           attempts used, generated query, timing added by the web layer
 */
public record AnswerResult(
        String answer,
        AnswerRoute route,
        List<String> sources,
        boolean retrievalSucceeded,
        String sessionId,
        Map<String, Object> metadata
) {

    public AnswerResult {
        sources = sources == null ? List.of() : List.copyOf(sources);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static AnswerResult error(String answer, String sessionId, String error) {
        return new AnswerResult(answer, AnswerRoute.ERROR, List.of(), false, sessionId, Map.of("error", error));
    }

    public AnswerResult withMetadata(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return new AnswerResult(answer, route, sources, retrievalSucceeded, sessionId, copy);
    }
}
