package com.example.DmOracle.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Oracle settings bound once at startup from the "oracle" prefix.
 * Immutable for the lifetime of the application.
 */
@ConfigurationProperties(prefix = "oracle")
public record OracleProperties(
        @DefaultValue("1.0.0") String version,
        @DefaultValue Llm llm,
        @DefaultValue Structured structured,
        @DefaultValue Corpus corpus
) {

    /**
     * @param timeout             upper bound for a single model call
     * @param preciseTemperature  used for routing and SQL generation
     * @param creativeTemperature used for answer synthesis and narration
     */
    public record Llm(
            @DefaultValue("30s") Duration timeout,
            @DefaultValue("0.1") double preciseTemperature,
            @DefaultValue("0.7") double creativeTemperature
    ) {
    }

    /**
     * @param table         fact table the generated SQL must target
     * @param sourceLabel   provenance label reported for fact-table answers
     * @param maxRetries    retries after the first attempt
     * @param errorFeedback include the previous query and its error in the retry prompt
     * @param queryTimeout  JDBC query timeout
     * @param maxRows       row cap applied to every query
     */
    public record Structured(
            @DefaultValue("monsters") String table,
            @DefaultValue("D&D Monster Database") String sourceLabel,
            @DefaultValue("2") int maxRetries,
            @DefaultValue("true") boolean errorFeedback,
            @DefaultValue("10s") Duration queryTimeout,
            @DefaultValue("50") int maxRows
    ) {
        public int maxAttempts() {
            return Math.max(0, maxRetries) + 1;
        }
    }

    /**
     * @param search        corpus backend: keyword | vector
     * @param topK          passages handed to the synthesizer
     * @param minScore      preferred similarity floor for the vector backend
     * @param defaultSource label used for passages without a source
     */
    public record Corpus(
            @DefaultValue("keyword") String search,
            @DefaultValue("3") int topK,
            @DefaultValue("0.60") double minScore,
            @DefaultValue("D&D SRD") String defaultSource
    ) {
    }
}
