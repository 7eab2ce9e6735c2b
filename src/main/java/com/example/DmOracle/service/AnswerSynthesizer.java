package com.example.DmOracle.service;

import com.example.DmOracle.config.AiConfig;
import com.example.DmOracle.llm.LanguageModelClient;
import com.example.DmOracle.model.Passage;
import com.example.DmOracle.model.RetrievalOutcome;
import com.example.DmOracle.model.RouteDecision;
import com.example.DmOracle.prompt.OraclePrompts;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns retrieved evidence into the final answer text.
 *
 * Failed retrievals are answered with a fixed message and no model call.
 * Never throws and never returns blank text.
 */
@Service
@RequiredArgsConstructor
public class AnswerSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(AnswerSynthesizer.class);

    static final String NO_DOCUMENTS = "No relevant information found.";
    static final String EMPTY_REPLY = "The Oracle could not find the words to answer that. Please try rephrasing your question.";

    @Qualifier(AiConfig.CREATIVE_MODEL)
    private final LanguageModelClient creativeModel;

    public String compose(String question, RetrievalOutcome outcome) {
        if (outcome.kind() == RouteDecision.STRUCTURED) {
            if (!outcome.succeeded()) {
                return "Database error: " + outcome.diagnostic();
            }
            return generate(OraclePrompts.structuredAnswer(question, outcome.table().describe()));
        }

        if (!outcome.succeeded()) {
            return "Knowledge base error: " + outcome.diagnostic();
        }
        String documents = renderPassages(outcome.passages());
        return generate(OraclePrompts.unstructuredAnswer(question, documents.isEmpty() ? NO_DOCUMENTS : documents));
    }

    /**
     * Example format:
     *   Source: Player's Handbook
     *   Content: passage text...
     *
     *   Source: Basic Rules
     *   Content: passage text...
     */
    static String renderPassages(List<Passage> passages) {
        return passages.stream()
                .map(p -> "Source: " + p.source() + "\nContent: " + p.content())
                .collect(Collectors.joining("\n\n"));
    }

    private String generate(String prompt) {
        try {
            String reply = creativeModel.generate(prompt);
            if (reply == null || reply.isBlank()) {
                log.warn("Answer model returned an empty reply");
                return EMPTY_REPLY;
            }
            return reply.trim();
        } catch (Exception e) {
            log.warn("Answer synthesis failed: {}", e.getMessage());
            return "Error generating response: " + e.getMessage();
        }
    }
}
