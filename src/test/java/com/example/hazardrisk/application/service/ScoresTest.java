package com.example.hazardrisk.application.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ScoresTest {

    @Test
    void roundsHalfToEvenOnTheStoredValue() {
        assertThat(Scores.round1(0.25)).isEqualTo(0.2);
        assertThat(Scores.round1(0.75)).isEqualTo(0.8);
        // 0.35 is stored just below the midpoint
        assertThat(Scores.round1(0.35)).isEqualTo(0.3);
        assertThat(Scores.round3(0.0625)).isEqualTo(0.062);
        assertThat(Scores.round1(31.46)).isEqualTo(31.5);
    }

    @Test
    void fixedPointTextUsesTheSameRounding() {
        assertThat(Scores.fixed(24.5, 0)).isEqualTo("24");
        assertThat(Scores.fixed(25.5, 0)).isEqualTo("26");
        assertThat(Scores.fixed(0.15, 1)).isEqualTo("0.1");
        assertThat(Scores.fixed(40.0, 1)).isEqualTo("40.0");
        assertThat(Scores.fixed(-0.0, 1)).isEqualTo("0.0");
    }

    @Test
    void nonFiniteValuesPassThrough() {
        assertThat(Scores.round1(Double.NaN)).isNaN();
        assertThat(Scores.fixed(Double.POSITIVE_INFINITY, 1)).isEqualTo("Infinity");
    }
}
