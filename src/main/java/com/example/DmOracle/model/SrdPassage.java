package com.example.DmOracle.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Row of the srd_passages corpus table.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SrdPassage {
    private Long id;
    private String source;
    private String chunkId;
    private String content;

    public Passage toPassage(String defaultSource) {
        String label = source == null || source.isBlank() ? defaultSource : source;
        return new Passage(content, label, chunkId);
    }
}
