package com.example.DmOracle.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * @param text    narrative, or a user-facing error message when generation failed
 * @param style   style used
 * @param success whether the model produced the narrative
 * @param error   raw failure cause, null on success
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NarrationResult(
        String text,
        NarrativeStyle style,
        boolean success,
        String error
) {
}
