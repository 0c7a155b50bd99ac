package com.kpisentinel.core.risk;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RiskScorer}.
 */
class RiskScorerTest {

    @Test
    @DisplayName("Score should be the product of impact, confidence and persistence")
    void shouldMultiplyFactors() {
        assertThat(RiskScorer.score(2.0, 0.5, 1.3)).isCloseTo(1.3, within(1e-12));
    }

    @Test
    @DisplayName("Score should never be negative")
    void shouldClampNegativeFactors() {
        assertThat(RiskScorer.score(-3.0, 0.8, 1.0)).isZero();
        assertThat(RiskScorer.score(3.0, -0.8, 1.0)).isZero();
        assertThat(RiskScorer.score(3.0, 0.8, -1.0)).isZero();
    }

    @Test
    @DisplayName("Score should grow with each factor")
    void shouldBeMonotonic() {
        double base = RiskScorer.score(1.0, 0.5, 1.0);

        assertThat(RiskScorer.score(2.0, 0.5, 1.0)).isGreaterThan(base);
        assertThat(RiskScorer.score(1.0, 0.9, 1.0)).isGreaterThan(base);
        assertThat(RiskScorer.score(1.0, 0.5, 1.3)).isGreaterThan(base);
    }

    @Test
    @DisplayName("Confidence should scale with |z| and saturate at 1")
    void confidenceShouldSaturate() {
        assertThat(RiskScorer.confidenceFromZ(2.5)).isCloseTo(0.5, within(1e-12));
        assertThat(RiskScorer.confidenceFromZ(-2.5)).isCloseTo(0.5, within(1e-12));
        assertThat(RiskScorer.confidenceFromZ(5.0)).isEqualTo(1.0);
        assertThat(RiskScorer.confidenceFromZ(40.0)).isEqualTo(1.0);
        assertThat(RiskScorer.confidenceFromZ(Double.POSITIVE_INFINITY)).isEqualTo(1.0);
    }
}
