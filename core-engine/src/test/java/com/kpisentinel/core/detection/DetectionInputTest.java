package com.kpisentinel.core.detection;

import com.kpisentinel.core.config.RuleConfig;
import com.kpisentinel.core.model.MetricPoint;
import com.kpisentinel.core.model.MetricSeries;
import com.kpisentinel.core.risk.ImpactProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.kpisentinel.core.detection.TestSeries.TARGET;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link DetectionInput}.
 */
class DetectionInputTest {

    @Test
    @DisplayName("Should skip a metric with fewer than six history points")
    void shouldSkipShortHistory() {
        assertThat(prepare(TestSeries.endingOnTarget("dau", 1, 2, 3, 4, 5))).isEmpty();
    }

    @Test
    @DisplayName("Should skip a metric with no value on the target day")
    void shouldSkipMissingObservation() {
        MetricSeries series = new MetricSeries("dau", List.of(
                point(8, 100), point(7, 100), point(6, 100), point(5, 100),
                point(4, 100), point(3, 100), point(2, 100), point(1, 100)));

        assertThat(prepare(series)).isEmpty();
    }

    @Test
    @DisplayName("Should skip a metric whose trailing week has fewer than five points")
    void shouldSkipSparseBaseline() {
        MetricSeries series = new MetricSeries("dau", List.of(
                point(20, 100), point(19, 100), point(18, 100), point(17, 100),
                point(3, 100), point(2, 100), point(0, 100)));

        assertThat(series.size()).isEqualTo(7);
        assertThat(prepare(series)).isEmpty();
    }

    @Test
    @DisplayName("Baseline should cover the seven days before the target, excluding the target")
    void shouldBuildBaselineFromTrailingWeek() {
        DetectionInput input = TestSeries.input(1, 1, 1, 10, 20, 30, 40, 50, 60, 70, 999);

        assertThat(input.getBaseline()).containsExactly(10.0, 20.0, 30.0, 40.0, 50.0, 60.0, 70.0);
        assertThat(input.getObserved()).isEqualTo(999.0);
        assertThat(input.getBaselineMean()).isCloseTo(40.0, within(1e-9));
    }

    @Test
    @DisplayName("Persistence should be 1.3 when the previous day already deviated")
    void shouldRewardPersistentDeviation() {
        DetectionInput input = TestSeries.input(100, 101, 99, 100, 101, 99, 130, 131);

        assertThat(input.getPersistence()).isEqualTo(DetectionInput.PERSISTENT);
    }

    @Test
    @DisplayName("Persistence should be 1.0 when the previous day was normal")
    void shouldNotRewardIsolatedDeviation() {
        DetectionInput input = TestSeries.input(100, 101, 99, 100, 101, 99, 100, 131);

        assertThat(input.getPersistence()).isEqualTo(DetectionInput.NOT_PERSISTENT);
    }

    @Test
    @DisplayName("Persistence should be 1.0 when the previous day is missing")
    void shouldNotRewardWithoutPreviousDay() {
        MetricSeries series = new MetricSeries("dau", List.of(
                point(7, 100), point(6, 101), point(5, 99), point(4, 100),
                point(3, 101), point(2, 99), point(0, 131)));

        DetectionInput input = prepare(series).orElseThrow();

        assertThat(input.getPersistence()).isEqualTo(DetectionInput.NOT_PERSISTENT);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Optional<DetectionInput> prepare(MetricSeries series) {
        return DetectionInput.prepare(series, TARGET, RuleConfig.defaults(), ImpactProfile.ACTIVITY_DROP);
    }

    private static MetricPoint point(int daysBeforeTarget, double value) {
        return new MetricPoint(TARGET.minusDays(daysBeforeTarget), value);
    }
}
