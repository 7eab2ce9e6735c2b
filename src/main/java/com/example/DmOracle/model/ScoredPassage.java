package com.example.DmOracle.model;

public record ScoredPassage(
        SrdPassage passage,
        double score
) {
}
