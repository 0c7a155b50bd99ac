package com.kpisentinel.core.detection;

import com.kpisentinel.core.model.AlertDraft;
import com.kpisentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SeasonalDetector}.
 */
class SeasonalDetectorTest {

    private final SeasonalDetector detector = new SeasonalDetector();

    @Test
    @DisplayName("Should fire when the value departs from the same weekday of previous weeks")
    void shouldFireOnSeasonalDeviation() {
        Optional<AlertDraft> draft = detector.evaluate(TestSeries.input(
                weeks(29, new double[] {100, 104, 96, 100}, 150)));

        assertThat(draft).isPresent();
        AlertDraft alert = draft.get();
        assertThat(alert.getMethod()).isEqualTo(SeasonalDetector.METHOD);
        assertThat(alert.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(alert.getContext()).containsEntry("seasonal_points", 4);
        assertThat((double) alert.getContext().get("seasonal_mean")).isCloseTo(100.0, within(1e-9));
    }

    @Test
    @DisplayName("Should use at most the four most recent same-weekday values")
    void shouldCapSeasonalHistory() {
        // five earlier Wednesdays; the oldest (1000) must be ignored
        Optional<AlertDraft> draft = detector.evaluate(TestSeries.input(
                weeks(36, new double[] {1000, 100, 104, 96, 100}, 150)));

        assertThat(draft).isPresent();
        assertThat(draft.get().getContext()).containsEntry("seasonal_points", 4);
        assertThat((double) draft.get().getContext().get("seasonal_mean")).isCloseTo(100.0, within(1e-9));
    }

    @Test
    @DisplayName("Should NOT fire with fewer same-weekday points than configured")
    void shouldNotFireWithFewWeeks() {
        assertThat(detector.evaluate(TestSeries.input(weeks(15, new double[] {100, 104}, 150)))).isEmpty();
    }

    @Test
    @DisplayName("Should NOT fire when past same-weekday values are identical")
    void shouldNotFireOnFlatSeasonalHistory() {
        assertThat(detector.evaluate(TestSeries.input(
                weeks(29, new double[] {100, 100, 100, 100}, 150)))).isEmpty();
    }

    @Test
    @DisplayName("Should NOT fire on a value in line with previous weeks")
    void shouldNotFireOnNormalValue() {
        assertThat(detector.evaluate(TestSeries.input(
                weeks(29, new double[] {100, 104, 96, 100}, 102)))).isEmpty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * {@code days} values ending on the target; every seventh day counting
     * back from the target takes the next of {@code sameWeekday} (oldest
     * first), other days alternate 99/101.
     */
    private static double[] weeks(int days, double[] sameWeekday, double observed) {
        double[] values = TestSeries.alternating(days, 99, 101);
        int first = days - 1 - 7 * sameWeekday.length;
        for (int i = 0; i < sameWeekday.length; i++) {
            values[first + 7 * i] = sameWeekday[i];
        }
        values[days - 1] = observed;
        return values;
    }
}
