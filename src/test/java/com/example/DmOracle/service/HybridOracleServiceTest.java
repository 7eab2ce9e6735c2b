package com.example.DmOracle.service;

import com.example.DmOracle.OracleFixtures;
import com.example.DmOracle.RecordingModel;
import com.example.DmOracle.config.OracleProperties;
import com.example.DmOracle.exception.CorpusSearchException;
import com.example.DmOracle.exception.InvalidRequestException;
import com.example.DmOracle.exception.LanguageModelException;
import com.example.DmOracle.exception.QueryExecutionException;
import com.example.DmOracle.model.AnswerResult;
import com.example.DmOracle.model.AnswerRoute;
import com.example.DmOracle.model.NarrationResult;
import com.example.DmOracle.model.NarrativeStyle;
import com.example.DmOracle.model.Passage;
import com.example.DmOracle.model.RouteDecision;
import com.example.DmOracle.retrieval.CorpusSearch;
import com.example.DmOracle.retrieval.FactTableExecutor;
import com.example.DmOracle.retrieval.RetrievalStrategy;
import com.example.DmOracle.retrieval.StructuredRetrievalStrategy;
import com.example.DmOracle.retrieval.UnstructuredRetrievalStrategy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * End-to-end pipeline tests with scripted model, fact table and corpus.
 */
class HybridOracleServiceTest {

    private static final String BEHOLDER_SQL = "SELECT name, armor_class FROM monsters WHERE LOWER(name) = 'beholder'";

    private final OracleProperties props = OracleFixtures.properties();

    private SimpleMeterRegistry registry;
    private ChatLogService chatLogService;
    private AtomicInteger factTableCalls;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        chatLogService = mock(ChatLogService.class);
        factTableCalls = new AtomicInteger();
    }

    @Test
    void structuredQuestionIsAnsweredFromFactTable() {
        RecordingModel precise = precise("structured", BEHOLDER_SQL);
        RecordingModel creative = RecordingModel.replying("A Beholder has an armor class of 18.");
        HybridOracleService service = service(precise, creative,
                sql -> OracleFixtures.beholderRow(), (q, k) -> List.of());

        AnswerResult result = service.answer("What is a Beholder's armor class?", "session_123456");

        assertThat(result.route()).isEqualTo(AnswerRoute.STRUCTURED);
        assertThat(result.retrievalSucceeded()).isTrue();
        assertThat(result.sources()).containsExactly(OracleFixtures.FACT_TABLE_LABEL);
        assertThat(result.answer()).isEqualTo("A Beholder has an armor class of 18.");
        assertThat(result.sessionId()).isEqualTo("session_123456");
        assertThat(result.metadata())
                .containsEntry(HybridOracleService.META_QUERY_TYPE, "structured")
                .containsEntry(HybridOracleService.META_ATTEMPTS, 1)
                .containsEntry(HybridOracleService.META_QUERY, BEHOLDER_SQL);
        verify(chatLogService).recordAnswer(eq("What is a Beholder's armor class?"), eq(result));
    }

    @Test
    void unstructuredQuestionReportsDistinctSourcesInFirstSeenOrder() {
        List<Passage> passages = List.of(
                OracleFixtures.passage("Basic Rules", "Grappling: use the Attack action."),
                OracleFixtures.passage("SRD 5.1 Conditions", "Grappled: speed becomes 0."));
        HybridOracleService service = service(precise("unstructured", null),
                RecordingModel.replying("To grapple, use the Attack action."),
                sql -> OracleFixtures.beholderRow(), (q, k) -> passages);

        AnswerResult result = service.answer("How does grappling work?", null);

        assertThat(result.route()).isEqualTo(AnswerRoute.UNSTRUCTURED);
        assertThat(result.retrievalSucceeded()).isTrue();
        assertThat(result.sources()).containsExactly("Basic Rules", "SRD 5.1 Conditions");
        assertThat(result.metadata()).containsEntry(HybridOracleService.META_DOCUMENT_COUNT, 2);
        assertThat(factTableCalls.get()).isZero();
    }

    @Test
    void repeatedSourceLabelsAreDeduplicated() {
        List<Passage> passages = List.of(
                OracleFixtures.passage("Player's Handbook", "d20 system"),
                OracleFixtures.passage("Basic Rules", "advantage"),
                OracleFixtures.passage("Player's Handbook", "spell slots"),
                new Passage("untitled", " ", "x1"),
                OracleFixtures.passage("Basic Rules", "disadvantage"));
        HybridOracleService service = service(precise("unstructured", null), RecordingModel.replying("ok"),
                sql -> OracleFixtures.beholderRow(), (q, k) -> passages);

        AnswerResult result = service.answer("Explain the core rules", null);

        assertThat(result.sources()).containsExactly("Player's Handbook", "Basic Rules", "D&D SRD");
    }

    @Test
    void exhaustedSqlRetriesProduceDeterministicMessageWithoutModelAnswer() {
        RecordingModel creative = RecordingModel.replying("MODEL TEXT");
        HybridOracleService service = service(precise("structured", "SELECT ac FROM monsters"), creative,
                sql -> {
                    throw new QueryExecutionException("Column \"AC\" not found");
                }, (q, k) -> List.of());

        AnswerResult result = service.answer("What is a Beholder's armor class?", "s1");

        assertThat(result.route()).isEqualTo(AnswerRoute.STRUCTURED);
        assertThat(result.retrievalSucceeded()).isFalse();
        assertThat(result.sources()).isEmpty();
        assertThat(result.metadata()).containsEntry(HybridOracleService.META_ATTEMPTS, 3);
        assertThat(result.metadata()).doesNotContainKey(HybridOracleService.META_QUERY);
        assertThat(result.answer())
                .isEqualTo("Database error: Error after 3 attempts: Column \"AC\" not found")
                .doesNotContain("MODEL TEXT");
        assertThat(creative.calls()).isZero();
        assertThat(factTableCalls.get()).isEqualTo(3);
    }

    @Test
    void classificationTimeoutFallsBackToUnstructuredAndCompletes() {
        RecordingModel precise = new RecordingModel(prompt -> {
            throw new LanguageModelException("The precise model call timed out after 30000 ms");
        });
        HybridOracleService service = service(precise, RecordingModel.replying("Spell slots are..."),
                sql -> OracleFixtures.beholderRow(),
                (q, k) -> List.of(OracleFixtures.passage("Player's Handbook", "Spellcasting uses spell slots.")));

        AnswerResult result = service.answer("How do spell slots work?", null);

        assertThat(result.route()).isEqualTo(AnswerRoute.UNSTRUCTURED);
        assertThat(result.retrievalSucceeded()).isTrue();
        assertThat(result.answer()).isEqualTo("Spell slots are...");
        assertThat(registry.find(QueryRouter.FALLBACK_METRIC).tag("reason", "model_error").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void corpusFailureIsReportedNotThrown() {
        RecordingModel creative = RecordingModel.replying("unused");
        HybridOracleService service = service(precise("unstructured", null), creative,
                sql -> OracleFixtures.beholderRow(), (q, k) -> {
                    throw new CorpusSearchException("Corpus is empty");
                });

        AnswerResult result = service.answer("How does grappling work?", null);

        assertThat(result.route()).isEqualTo(AnswerRoute.UNSTRUCTURED);
        assertThat(result.retrievalSucceeded()).isFalse();
        assertThat(result.answer()).isEqualTo("Knowledge base error: Corpus is empty");
        assertThat(result.metadata()).containsEntry(HybridOracleService.META_DIAGNOSTIC, "Corpus is empty");
        assertThat(creative.calls()).isZero();
    }

    @Test
    void unexpectedFailureIsReportedAsErrorRoute() {
        RetrievalStrategy broken = mock(RetrievalStrategy.class);
        when(broken.kind()).thenReturn(RouteDecision.UNSTRUCTURED);
        when(broken.retrieve(anyString())).thenThrow(new IllegalStateException("index corrupted"));
        RecordingModel precise = precise("unstructured", null);
        StructuredRetrievalStrategy structured = new StructuredRetrievalStrategy(
                precise, sql -> OracleFixtures.beholderRow(), props, registry);
        HybridOracleService service = new HybridOracleService(new QueryRouter(precise, registry),
                List.of(structured, broken), new AnswerSynthesizer(RecordingModel.replying("unused")),
                RecordingModel.replying("unused"), chatLogService, props);

        AnswerResult result = service.answer("How does grappling work?", "s9");

        assertThat(result.route()).isEqualTo(AnswerRoute.ERROR);
        assertThat(result.retrievalSucceeded()).isFalse();
        assertThat(result.sources()).isEmpty();
        assertThat(result.sessionId()).isEqualTo("s9");
        assertThat(result.answer())
                .isEqualTo("I encountered an error: index corrupted. Please try rephrasing your question.");
        verify(chatLogService, never()).recordAnswer(anyString(), any());
    }

    @Test
    void blankQuestionIsRejectedBeforeAnyModelCall() {
        RecordingModel precise = precise("structured", BEHOLDER_SQL);
        RecordingModel creative = RecordingModel.replying("unused");
        HybridOracleService service = service(precise, creative,
                sql -> OracleFixtures.beholderRow(), (q, k) -> List.of());

        assertThatThrownBy(() -> service.answer("   ", null)).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> service.answer(null, null)).isInstanceOf(InvalidRequestException.class);
        assertThat(precise.calls()).isZero();
        assertThat(creative.calls()).isZero();
    }

    @Test
    void sameQuestionAgainstDeterministicBackendsGivesSameRouteAndStatus() {
        HybridOracleService service = service(precise("structured", BEHOLDER_SQL),
                RecordingModel.replying("AC 18"), sql -> OracleFixtures.beholderRow(), (q, k) -> List.of());

        AnswerResult first = service.answer("What is a Beholder's armor class?", null);
        AnswerResult second = service.answer("What is a Beholder's armor class?", null);

        assertThat(second.route()).isEqualTo(first.route());
        assertThat(second.retrievalSucceeded()).isEqualTo(first.retrievalSucceeded());
        assertThat(second.sources()).isEqualTo(first.sources());
    }

    @Test
    void answerTextIsNeverEmpty() {
        HybridOracleService blankModels = service(precise("structured", BEHOLDER_SQL),
                RecordingModel.replying(""), sql -> OracleFixtures.beholderRow(), (q, k) -> List.of());
        HybridOracleService blankUnstructured = service(precise("unstructured", null),
                RecordingModel.replying(null), sql -> OracleFixtures.beholderRow(), (q, k) -> List.of());

        assertThat(blankModels.answer("What is a Beholder's armor class?", null).answer()).isNotBlank();
        assertThat(blankUnstructured.answer("Who is Elminster?", null).answer()).isNotBlank();
    }

    @Test
    void narrateUsesStyleToneAndTrimsText() {
        RecordingModel creative = RecordingModel.replying("\n The tavern door creaks open... \n");
        HybridOracleService service = service(precise("unstructured", null), creative,
                sql -> OracleFixtures.beholderRow(), (q, k) -> List.of());

        NarrationResult result = service.narrate("Describe a spooky, abandoned tavern", "Mysterious");

        assertThat(result.success()).isTrue();
        assertThat(result.style()).isEqualTo(NarrativeStyle.MYSTERIOUS);
        assertThat(result.text()).isEqualTo("The tavern door creaks open...");
        assertThat(result.error()).isNull();
        assertThat(creative.prompts()).singleElement().asString()
                .contains("Describe a spooky, abandoned tavern")
                .contains(NarrativeStyle.MYSTERIOUS.tone());
    }

    @Test
    void narrateDefaultsToDescriptive() {
        HybridOracleService service = service(precise("unstructured", null), RecordingModel.replying("Once..."),
                sql -> OracleFixtures.beholderRow(), (q, k) -> List.of());

        assertThat(service.narrate("A dragon's lair", null).style()).isEqualTo(NarrativeStyle.DESCRIPTIVE);
    }

    @Test
    void narrateRejectsUnknownStyleBeforeAnyModelCall() {
        RecordingModel precise = precise("unstructured", null);
        RecordingModel creative = RecordingModel.replying("unused");
        HybridOracleService service = service(precise, creative,
                sql -> OracleFixtures.beholderRow(), (q, k) -> List.of());

        assertThatThrownBy(() -> service.narrate("Describe a tavern", "invalid-style"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("invalid-style");
        assertThatThrownBy(() -> service.narrate(" ", "dramatic"))
                .isInstanceOf(InvalidRequestException.class);
        assertThat(creative.calls()).isZero();
        assertThat(precise.calls()).isZero();
    }

    @Test
    void narrateFailureCarriesUserFacingTextAndRawCause() {
        HybridOracleService service = service(precise("unstructured", null),
                RecordingModel.failing(new LanguageModelException("quota exceeded")),
                sql -> OracleFixtures.beholderRow(), (q, k) -> List.of());

        NarrationResult result = service.narrate("An epic battle", "action");

        assertThat(result.success()).isFalse();
        assertThat(result.style()).isEqualTo(NarrativeStyle.ACTION);
        assertThat(result.text()).isEqualTo("Error creating narrative: quota exceeded");
        assertThat(result.error()).isEqualTo("quota exceeded");
    }

    @Test
    void missingStrategyFailsAtStartup() {
        RecordingModel precise = precise("structured", BEHOLDER_SQL);
        StructuredRetrievalStrategy structured = new StructuredRetrievalStrategy(
                precise, sql -> OracleFixtures.beholderRow(), props, registry);

        assertThatThrownBy(() -> new HybridOracleService(new QueryRouter(precise, registry), List.of(structured),
                new AnswerSynthesizer(precise), precise, chatLogService, props))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("unstructured");
    }

    @Test
    void chatLogReceivesTheAssembledResult() {
        HybridOracleService service = service(precise("structured", BEHOLDER_SQL),
                RecordingModel.replying("AC 18"), sql -> OracleFixtures.beholderRow(), (q, k) -> List.of());

        AnswerResult result = service.answer("What is a Beholder's armor class?", "s2");

        ArgumentCaptor<AnswerResult> captor = ArgumentCaptor.forClass(AnswerResult.class);
        verify(chatLogService).recordAnswer(eq("What is a Beholder's armor class?"), captor.capture());
        assertThat(captor.getValue()).isSameAs(result);
    }

    /**
     * Precise model that answers the routing prompt with {@code route} and SQL prompts with {@code sql}.
     */
    private static RecordingModel precise(String route, String sql) {
        return new RecordingModel(prompt -> prompt.contains("Classification:") ? route : sql);
    }

    private HybridOracleService service(RecordingModel precise, RecordingModel creative,
                                        FactTableExecutor executor, CorpusSearch corpus) {
        FactTableExecutor counting = sql -> {
            factTableCalls.incrementAndGet();
            return executor.execute(sql);
        };
        return new HybridOracleService(
                new QueryRouter(precise, registry),
                List.of(new StructuredRetrievalStrategy(precise, counting, props, registry),
                        new UnstructuredRetrievalStrategy(corpus, props)),
                new AnswerSynthesizer(creative),
                creative,
                chatLogService,
                props
        );
    }
}
