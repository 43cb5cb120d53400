package com.example.guardianintake.service.extraction;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class NameHeuristicsTest {

    @ParameterizedTest
    @ValueSource(strings = {"Mary Park", "Joslyn Mogonye", "Cher", "Anne O'Brien-Smith"})
    void acceptsNames(String value) {
        assertThat(NameHeuristics.looksLikeHumanName(value)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"200 Elm Street", "Elm Street", "Name(s):", "Daughter", "mary park",
        "One Two Three Four Five"})
    void rejectsNonNames(String value) {
        assertThat(NameHeuristics.looksLikeHumanName(value)).isFalse();
    }

    @Test
    void stripsCaptionQualifiers() {
        assertThat(NameHeuristics.stripQualifiers("HAROLD JAMES PARK, AN INCAPACITATED PERSON"))
            .isEqualTo("HAROLD JAMES PARK");
        assertThat(NameHeuristics.stripQualifiers("Estate of Harold Park")).isEqualTo("Harold Park");
        assertThat(NameHeuristics.stripQualifiers("The Person and Estate of Anna Mogonye, a minor"))
            .isEqualTo("Anna Mogonye");
    }

    @Test
    void titleCasesOnlyUniformCase() {
        assertThat(NameHeuristics.normalizeCase("HAROLD JAMES PARK")).isEqualTo("Harold James Park");
        assertThat(NameHeuristics.normalizeCase("o'brien")).isEqualTo("O'Brien");
        assertThat(NameHeuristics.normalizeCase("McDonald")).isEqualTo("McDonald");
    }

    @Test
    void splitsFirstMiddleLast() {
        assertThat(NameHeuristics.splitFirstMiddleLast("Harold James Park")).containsExactly("Harold", "James", "Park");
        assertThat(NameHeuristics.splitFirstMiddleLast("Park, Harold James")).containsExactly("Harold", "James", "Park");
        assertThat(NameHeuristics.splitFirstMiddleLast("Cher")).containsExactly("Cher", "", "");
    }

    @Test
    void suffixStaysWithSurname() {
        assertThat(NameHeuristics.splitFirstMiddleLast("John Smith Jr.")).containsExactly("John", "", "Smith Jr.");
        assertThat(NameHeuristics.splitFirstMiddleLast("Smith, Jr., John")).containsExactly("John", "", "Smith Jr.");
        assertThat(NameHeuristics.surnameOf("John Smith III")).isEqualTo("Smith");
    }
}
