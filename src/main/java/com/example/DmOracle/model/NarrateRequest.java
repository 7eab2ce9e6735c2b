package com.example.DmOracle.model;

/**
 * @param prompt creative prompt, e.g. "Describe a spooky, abandoned tavern"
 * @param style  descriptive | action | mysterious | dramatic (defaults to descriptive)
 */
public record NarrateRequest(
        String prompt,
        String style
) {
}
