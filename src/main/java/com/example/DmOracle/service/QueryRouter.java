package com.example.DmOracle.service;

import com.example.DmOracle.config.AiConfig;
import com.example.DmOracle.llm.LanguageModelClient;
import com.example.DmOracle.model.RouteDecision;
import com.example.DmOracle.prompt.OraclePrompts;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;

/**
 * Classifies a question as structured (fact table) or unstructured (rules corpus).
 *
 * One model call per question. An unrecognized reply or a failed call resolves to
 * {@link RouteDecision#UNSTRUCTURED}; both cases are logged and counted on
 * {@value #FALLBACK_METRIC} so the default stays visible.
 */
@Service
@RequiredArgsConstructor
public class QueryRouter {

    private static final Logger log = LoggerFactory.getLogger(QueryRouter.class);

    public static final String FALLBACK_METRIC = "oracle.router.fallback";

    static final RouteDecision DEFAULT_ROUTE = RouteDecision.UNSTRUCTURED;

    @Qualifier(AiConfig.PRECISE_MODEL)
    private final LanguageModelClient preciseModel;
    private final MeterRegistry meterRegistry;

    public RouteDecision classify(String question) {
        String reply;
        try {
            reply = preciseModel.generate(OraclePrompts.routing(question));
        } catch (Exception e) {
            log.warn("Query routing failed, defaulting to '{}': {}", DEFAULT_ROUTE.label(), e.getMessage());
            countFallback("model_error");
            return DEFAULT_ROUTE;
        }

        Optional<RouteDecision> decision = parse(reply);
        if (decision.isEmpty()) {
            log.warn("Unclear classification '{}', defaulting to '{}'", reply, DEFAULT_ROUTE.label());
            countFallback("unrecognized");
            return DEFAULT_ROUTE;
        }
        log.debug("Classified question as '{}'", decision.get().label());
        return decision.get();
    }

    /**
     * Accepts only an exact "structured" / "unstructured" after trimming and lower-casing.
     */
    static Optional<RouteDecision> parse(String reply) {
        if (reply == null) {
            return Optional.empty();
        }
        return RouteDecision.fromLabel(reply.trim().toLowerCase(Locale.ROOT));
    }

    private void countFallback(String reason) {
        Counter.builder(FALLBACK_METRIC)
                .description("Questions routed to the default strategy")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }
}
