package com.example.DmOracle.model;

import com.example.DmOracle.exception.InvalidRequestException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NarrativeStyleTest {

    @Test
    void resolvesNamesCaseInsensitively() {
        assertThat(NarrativeStyle.fromValue("Dramatic")).isEqualTo(NarrativeStyle.DRAMATIC);
        assertThat(NarrativeStyle.fromValue(" action ")).isEqualTo(NarrativeStyle.ACTION);
    }

    @Test
    void missingStyleIsDescriptive() {
        assertThat(NarrativeStyle.fromValue(null)).isEqualTo(NarrativeStyle.DESCRIPTIVE);
        assertThat(NarrativeStyle.fromValue("")).isEqualTo(NarrativeStyle.DESCRIPTIVE);
    }

    @Test
    void unknownStyleListsTheValidOnes() {
        assertThatThrownBy(() -> NarrativeStyle.fromValue("invalid-style"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("invalid-style")
                .hasMessageContaining("descriptive, action, mysterious, dramatic");
    }
}
