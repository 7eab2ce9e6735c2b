package com.example.DmOracle.controller;

import com.example.DmOracle.config.OracleProperties;
import com.example.DmOracle.model.AnswerResult;
import com.example.DmOracle.model.HealthResponse;
import com.example.DmOracle.model.NarrateRequest;
import com.example.DmOracle.model.NarrationResult;
import com.example.DmOracle.model.QueryRequest;
import com.example.DmOracle.model.ServiceInfo;
import com.example.DmOracle.service.HybridOracleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/oracle")
@RequiredArgsConstructor
@Tag(name = "Oracle", description = "Ask D&D questions and generate narrative content")
public class OracleController {

    private final HybridOracleService oracleService;
    private final OracleProperties props;

    /**
     * Example:
     *   POST /api/oracle/query
     *   {
     *     "query": "What is a Beholder's armor class?",
     *     "sessionId": "session_123456"
     *   }
     */
    @PostMapping("/query")
    @Operation(
            summary = "Ask the oracle",
            description = "Routes the question to the monster fact table or the rules corpus and answers it"
    )
    public AnswerResult query(@RequestBody QueryRequest request) {
        long start = System.nanoTime();
        AnswerResult result = oracleService.answer(request.query(), request.sessionId());
        double elapsedMs = Math.round((System.nanoTime() - start) / 10_000.0) / 100.0;
        return result.withMetadata("processing_time_ms", elapsedMs);
    }

    /**
     * Example:
     *   POST /api/oracle/narrate
     *   {
     *     "prompt": "Describe a spooky, abandoned tavern",
     *     "style": "mysterious"
     *   }
     */
    @PostMapping("/narrate")
    @Operation(
            summary = "Generate narrative content",
            description = "Styles: descriptive (default), action, mysterious, dramatic"
    )
    public NarrationResult narrate(@RequestBody NarrateRequest request) {
        return oracleService.narrate(request.prompt(), request.style());
    }

    @GetMapping
    @Operation(summary = "Describe the service and its endpoints")
    public ServiceInfo root() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("query", "/api/oracle/query - Ask questions about D&D rules, lore, and monsters");
        endpoints.put("narrate", "/api/oracle/narrate - Generate creative D&D narrative content");
        endpoints.put("health", "/api/oracle/health - Service health check");
        endpoints.put("docs", "/swagger-ui.html - Interactive API documentation");
        return new ServiceInfo(
                "Dungeon Master's Oracle",
                props.version(),
                "A hybrid RAG system for D&D Dungeon Masters",
                endpoints,
                "operational"
        );
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse(
                "healthy",
                Instant.now().toString(),
                props.version(),
                Map.of(
                        "rag_engine", Map.of("status", "healthy"),
                        "corpus_search", props.corpus().search(),
                        "fact_table", props.structured().table()
                )
        );
    }
}
