package com.example.DmOracle.model;

import com.example.DmOracle.OracleFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetrievalOutcomeTest {

    @Test
    void failedOutcomeMayNotCarryEvidence() {
        assertThatThrownBy(() -> new RetrievalOutcome(RouteDecision.STRUCTURED, false,
                OracleFixtures.beholderRow(), List.of(), "boom", 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetrievalOutcome(RouteDecision.UNSTRUCTURED, false, null,
                List.of(OracleFixtures.passage("Basic Rules", "text")), "boom", 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void atLeastOneAttemptIsRecorded() {
        assertThatThrownBy(() -> RetrievalOutcome.structuredFailure("boom", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void successWithNoPassagesIsAllowed() {
        RetrievalOutcome outcome = RetrievalOutcome.unstructuredSuccess(null, "document_count=0");

        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.passages()).isEmpty();
        assertThat(outcome.attemptsUsed()).isEqualTo(1);
    }
}
