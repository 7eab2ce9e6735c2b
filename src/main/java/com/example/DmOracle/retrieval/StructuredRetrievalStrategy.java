package com.example.DmOracle.retrieval;

import com.example.DmOracle.config.AiConfig;
import com.example.DmOracle.config.OracleProperties;
import com.example.DmOracle.exception.QueryExecutionException;
import com.example.DmOracle.llm.LanguageModelClient;
import com.example.DmOracle.model.RetrievalOutcome;
import com.example.DmOracle.model.RouteDecision;
import com.example.DmOracle.model.TabularResult;
import com.example.DmOracle.prompt.OraclePrompts;
import com.example.DmOracle.util.SqlTextExtractor;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Text-to-SQL retrieval with bounded self-correction:
 * - Ask the model for a SELECT over the fact table
 * - Execute it
 * - On failure regenerate, up to maxRetries more times
 *
 * The first successful execution ends the loop. When error feedback is enabled
 * the retry prompt carries the failed query and its error.
 */
@Component
@RequiredArgsConstructor
public class StructuredRetrievalStrategy implements RetrievalStrategy {

    private static final Logger log = LoggerFactory.getLogger(StructuredRetrievalStrategy.class);

    public static final String ATTEMPT_METRIC = "oracle.structured.attempts";

    @Qualifier(AiConfig.PRECISE_MODEL)
    private final LanguageModelClient preciseModel;
    private final FactTableExecutor factTableExecutor;
    private final OracleProperties props;
    private final MeterRegistry meterRegistry;

    @Override
    public RouteDecision kind() {
        return RouteDecision.STRUCTURED;
    }

    @Override
    public RetrievalOutcome retrieve(String question) {
        OracleProperties.Structured config = props.structured();
        int maxAttempts = config.maxAttempts();

        String lastQuery = null;
        String lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String sql = null;
            try {
                String prompt = (config.errorFeedback() && lastError != null)
                        ? OraclePrompts.sqlCorrection(config.table(), question, lastQuery, lastError)
                        : OraclePrompts.sqlGeneration(config.table(), question);

                sql = SqlTextExtractor.extract(preciseModel.generate(prompt));
                if (sql.isEmpty()) {
                    throw new QueryExecutionException("Model returned an empty query");
                }

                TabularResult result = factTableExecutor.execute(sql);
                log.info("SQL attempt {}/{} succeeded with {} row(s)", attempt, maxAttempts, result.rows().size());
                count("success");
                return RetrievalOutcome.structuredSuccess(result, sql, attempt);
            } catch (Exception e) {
                lastQuery = sql;
                lastError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.warn("SQL attempt {}/{} failed: {}", attempt, maxAttempts, lastError);
                count("failure");
            }

            if (attempt < maxAttempts && Thread.currentThread().isInterrupted()) {
                log.info("Request cancelled after {} SQL attempt(s), not retrying", attempt);
                return RetrievalOutcome.structuredFailure(
                        "Cancelled after " + attempt + " attempts: " + lastError, attempt);
            }
        }

        return RetrievalOutcome.structuredFailure(
                "Error after " + maxAttempts + " attempts: " + lastError, maxAttempts);
    }

    private void count(String outcome) {
        meterRegistry.counter(ATTEMPT_METRIC, "outcome", outcome).increment();
    }
}
