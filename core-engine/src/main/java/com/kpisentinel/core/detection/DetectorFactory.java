package com.kpisentinel.core.detection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Factory for the built-in {@link AnomalyDetector} implementations.
 *
 * <p>
 * This is the single point of extension when adding new methods: register
 * the method name here and add it to the ordered list in
 * {@link #createAll()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    /** Method names in evaluation order. */
    public static final List<String> METHODS = List.of(
            ZScoreDetector.METHOD,
            EwmaDetector.METHOD,
            ChangePointDetector.METHOD,
            SeasonalDetector.METHOD,
            RegimeShiftDetector.METHOD);

    private DetectorFactory() {
        // utility class
    }

    /**
     * Create the detector for a method name.
     *
     * @param method method name, e.g. {@code z_score}; must not be {@code null}
     * @return the detector
     * @throws NullPointerException     if {@code method} is {@code null}
     * @throws IllegalArgumentException if the method is unknown
     */
    public static AnomalyDetector create(String method) {
        Objects.requireNonNull(method, "Detection method must not be null");

        return switch (method.trim().toLowerCase(Locale.ROOT)) {
            case ZScoreDetector.METHOD -> new ZScoreDetector();
            case EwmaDetector.METHOD -> new EwmaDetector();
            case ChangePointDetector.METHOD -> new ChangePointDetector();
            case SeasonalDetector.METHOD -> new SeasonalDetector();
            case RegimeShiftDetector.METHOD -> new RegimeShiftDetector();
            default -> throw new IllegalArgumentException(
                    "Unknown detection method: '" + method
                            + "'. Supported methods: " + String.join(", ", METHODS));
        };
    }

    /**
     * Create every built-in detector, in evaluation order.
     *
     * @return unmodifiable list of detectors
     */
    public static List<AnomalyDetector> createAll() {
        LOG.info("Creating {} detector(s)", METHODS.size());
        return METHODS.stream()
                .map(DetectorFactory::create)
                .toList();
    }
}
