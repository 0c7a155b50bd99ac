package com.kpisentinel.core.detection;

import com.kpisentinel.core.model.AlertDraft;
import com.kpisentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RegimeShiftDetector}.
 */
class RegimeShiftDetectorTest {

    private static final double[] PRIOR = TestSeries.alternating(14, 99, 101);

    private final RegimeShiftDetector detector = new RegimeShiftDetector();

    @Test
    @DisplayName("Should fire on a shift of the recent mean")
    void shouldFireOnMeanShift() {
        Optional<AlertDraft> draft = detector.evaluate(
                TestSeries.input(TestSeries.concat(PRIOR, TestSeries.alternating(7, 109, 111))));

        assertThat(draft).isPresent();
        AlertDraft alert = draft.get();
        assertThat(alert.getMethod()).isEqualTo(RegimeShiftDetector.METHOD);
        assertThat(alert.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(alert.getContext())
                .containsEntry("mean_shift", true)
                .containsEntry("variance_shift", false);
        assertThat((double) alert.getContext().get("prior_mean")).isCloseTo(100.0, within(1e-9));
    }

    @Test
    @DisplayName("Should fire on a variance blow-up without a mean shift")
    void shouldFireOnVarianceIncrease() {
        Optional<AlertDraft> draft = detector.evaluate(
                TestSeries.input(TestSeries.concat(PRIOR, TestSeries.alternating(7, 95, 105))));

        assertThat(draft).isPresent();
        AlertDraft alert = draft.get();
        assertThat(alert.getContext())
                .containsEntry("mean_shift", false)
                .containsEntry("variance_shift", true);
        assertThat((double) alert.getContext().get("var_ratio")).isGreaterThan(2.0);
        // severity follows the mean statistic, which stays small here
        assertThat(alert.getSeverity()).isEqualTo(Severity.INFO);
    }

    @Test
    @DisplayName("Should fire when the recent window collapses to a constant")
    void shouldFireOnVarianceCollapse() {
        Optional<AlertDraft> draft = detector.evaluate(
                TestSeries.input(TestSeries.concat(PRIOR, 100, 100, 100, 100, 100, 100, 100)));

        assertThat(draft).isPresent();
        assertThat((double) draft.get().getContext().get("var_ratio")).isZero();
    }

    @Test
    @DisplayName("Should NOT fire when the recent window behaves like the prior one")
    void shouldNotFireWithoutShift() {
        assertThat(detector.evaluate(
                TestSeries.input(TestSeries.concat(PRIOR, TestSeries.alternating(7, 99, 101))))).isEmpty();
    }

    @Test
    @DisplayName("Should fire as a variance shift when the prior window is flat")
    void shouldFireOnFlatPriorWindow() {
        double[] flat = new double[21];
        Arrays.fill(flat, 42.0);

        Optional<AlertDraft> draft = detector.evaluate(TestSeries.input(flat));

        assertThat(draft).isPresent();
        assertThat(draft.get().getSeverity()).isEqualTo(Severity.INFO);
        assertThat(draft.get().getContext())
                .containsEntry("mean_z", 0.0)
                .containsEntry("var_ratio", Double.POSITIVE_INFINITY)
                .containsEntry("variance_shift", true);
    }

    @Test
    @DisplayName("Should NOT fire with less history than both windows need")
    void shouldNotFireWithShortHistory() {
        double[] values = TestSeries.concat(TestSeries.alternating(13, 99, 101), TestSeries.alternating(7, 109, 111));

        assertThat(detector.evaluate(TestSeries.input(values))).isEmpty();
    }

    @Test
    @DisplayName("Variance ratio should be infinite only for a prior variance of zero")
    void varianceRatioEdgeCases() {
        assertThat(RegimeShiftDetector.varianceRatio(0.0, 0.0)).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(RegimeShiftDetector.varianceRatio(4.0, 0.0)).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(RegimeShiftDetector.varianceRatio(4e-20, 1e-20)).isCloseTo(4.0, within(1e-12));
        assertThat(RegimeShiftDetector.varianceRatio(0.0, 4.0)).isZero();
        assertThat(RegimeShiftDetector.varianceRatio(8.0, 2.0)).isEqualTo(4.0);
    }
}
