package com.example.DmOracle.service;

import com.example.DmOracle.config.AiConfig;
import com.example.DmOracle.config.OracleProperties;
import com.example.DmOracle.exception.InvalidRequestException;
import com.example.DmOracle.llm.LanguageModelClient;
import com.example.DmOracle.model.AnswerResult;
import com.example.DmOracle.model.AnswerRoute;
import com.example.DmOracle.model.NarrationResult;
import com.example.DmOracle.model.NarrativeStyle;
import com.example.DmOracle.model.Passage;
import com.example.DmOracle.model.RetrievalOutcome;
import com.example.DmOracle.model.RouteDecision;
import com.example.DmOracle.prompt.OraclePrompts;
import com.example.DmOracle.retrieval.RetrievalStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Hybrid RAG pipeline for one question:
 *  1. Route the question (structured / unstructured)
 *  2. Retrieve evidence with the selected strategy
 *  3. Synthesize the answer
 *  4. Assemble sources + metadata and record the turn
 *
 * Also owns {@link #narrate(String, String)}, which bypasses routing and retrieval.
 */
@Service
public class HybridOracleService {

    private static final Logger log = LoggerFactory.getLogger(HybridOracleService.class);

    public static final String META_QUERY_TYPE = "query_type";
    public static final String META_ATTEMPTS = "attempts_used";
    public static final String META_QUERY = "generated_query";
    public static final String META_DOCUMENT_COUNT = "document_count";
    public static final String META_DIAGNOSTIC = "diagnostic";

    private final QueryRouter router;
    private final Map<RouteDecision, RetrievalStrategy> strategies;
    private final AnswerSynthesizer synthesizer;
    private final LanguageModelClient creativeModel;
    private final ChatLogService chatLogService;
    private final OracleProperties props;

    public HybridOracleService(QueryRouter router,
                               List<RetrievalStrategy> strategies,
                               AnswerSynthesizer synthesizer,
                               @Qualifier(AiConfig.CREATIVE_MODEL) LanguageModelClient creativeModel,
                               ChatLogService chatLogService,
                               OracleProperties props) {
        this.router = router;
        this.strategies = new EnumMap<>(RouteDecision.class);
        for (RetrievalStrategy strategy : strategies) {
            this.strategies.put(strategy.kind(), strategy);
        }
        for (RouteDecision route : RouteDecision.values()) {
            if (!this.strategies.containsKey(route)) {
                throw new IllegalStateException("No retrieval strategy registered for route: " + route.label());
            }
        }
        this.synthesizer = synthesizer;
        this.creativeModel = creativeModel;
        this.chatLogService = chatLogService;
        this.props = props;
    }

    /**
     * Answer a question. Never throws for a non-blank question: every failure
     * comes back as an {@link AnswerResult} with explanatory text.
     *
     * @throws InvalidRequestException if the question is blank
     */
    public AnswerResult answer(String question, String sessionId) {
        if (question == null || question.isBlank()) {
            throw new InvalidRequestException("query must not be empty");
        }

        try {
            RouteDecision route = router.classify(question);
            log.info("Query routed to: {}", route.label());

            RetrievalOutcome outcome = strategies.get(route).retrieve(question);
            String answer = synthesizer.compose(question, outcome);

            AnswerResult result = new AnswerResult(
                    answer,
                    AnswerRoute.of(route),
                    sourcesOf(outcome),
                    outcome.succeeded(),
                    sessionId,
                    metadataOf(outcome)
            );
            chatLogService.recordAnswer(question, result);
            return result;
        } catch (Exception e) {
            log.error("Error in hybrid RAG query", e);
            return AnswerResult.error(
                    "I encountered an error: " + e.getMessage() + ". Please try rephrasing your question.",
                    sessionId,
                    String.valueOf(e.getMessage()));
        }
    }

    /**
     * Generate creative narrative content in the requested style.
     * Null or blank style selects {@link NarrativeStyle#DEFAULT}.
     *
     * @throws InvalidRequestException for a blank prompt or an unknown style
     */
    public NarrationResult narrate(String prompt, String style) {
        NarrativeStyle narrativeStyle = NarrativeStyle.fromValue(style);
        if (prompt == null || prompt.isBlank()) {
            throw new InvalidRequestException("prompt must not be empty");
        }

        try {
            String text = creativeModel.generate(OraclePrompts.narration(prompt, narrativeStyle.tone()));
            if (text == null || text.isBlank()) {
                return new NarrationResult("Error creating narrative: the model returned no text",
                        narrativeStyle, false, "empty model reply");
            }
            return new NarrationResult(text.trim(), narrativeStyle, true, null);
        } catch (Exception e) {
            log.warn("Narration failed: {}", e.getMessage());
            return new NarrationResult("Error creating narrative: " + e.getMessage(),
                    narrativeStyle, false, String.valueOf(e.getMessage()));
        }
    }

    /**
     * Structured success -> the fact-table label.
     * Unstructured -> distinct passage sources, first-seen order.
     */
    List<String> sourcesOf(RetrievalOutcome outcome) {
        if (outcome.kind() == RouteDecision.STRUCTURED) {
            return outcome.succeeded() ? List.of(props.structured().sourceLabel()) : List.of();
        }
        Set<String> sources = new LinkedHashSet<>();
        for (Passage passage : outcome.passages()) {
            String source = passage.source();
            sources.add(source == null || source.isBlank() ? props.corpus().defaultSource() : source);
        }
        return new ArrayList<>(sources);
    }

    private Map<String, Object> metadataOf(RetrievalOutcome outcome) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(META_QUERY_TYPE, outcome.kind().label());
        metadata.put(META_ATTEMPTS, outcome.attemptsUsed());
        if (outcome.kind() == RouteDecision.STRUCTURED && outcome.succeeded()) {
            metadata.put(META_QUERY, outcome.diagnostic());
        }
        if (outcome.kind() == RouteDecision.UNSTRUCTURED) {
            metadata.put(META_DOCUMENT_COUNT, outcome.passages().size());
        }
        if (!outcome.succeeded()) {
            metadata.put(META_DIAGNOSTIC, outcome.diagnostic());
        }
        return metadata;
    }
}
