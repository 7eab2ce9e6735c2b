package com.example.DmOracle.model;

/**
 * A text passage handed to the synthesizer as unstructured evidence.
 *
 * @param content passage text
 * @param source  provenance label, e.g. "Player's Handbook"
 * @param chunkId identifier of the chunk inside its source
 */
public record Passage(
        String content,
        String source,
        String chunkId
) {
}
