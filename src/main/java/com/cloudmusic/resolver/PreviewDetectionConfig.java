package com.cloudmusic.resolver;

import java.time.Duration;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Calibration constants for preview detection and cross-source recovery.
 * <p>
 * The typical preview lengths and tolerance were tuned empirically against the upstream
 * catalogs and drift over time, so every value here can be overridden through the environment
 * (see {@link #fromEnvironment()}):
 * <ul>
 *   <li>{@code PREVIEW_MIN_DURATION_SEC}, {@code PREVIEW_MAX_DURATION_SEC}: the preview band.</li>
 *   <li>{@code PREVIEW_TYPICAL_DURATIONS_SEC}: comma-separated truncation points.</li>
 *   <li>{@code PREVIEW_DURATION_TOLERANCE_SEC}: allowed distance from a truncation point.</li>
 *   <li>{@code PREVIEW_MIN_FILE_SIZE_BYTES}: smallest size accepted as a full track.</li>
 *   <li>{@code PREVIEW_URL_PATTERN}: regex matched against the asset URL.</li>
 *   <li>{@code CROSS_SOURCE_TIMEOUT_MS}, {@code CROSS_SOURCE_MAX_ATTEMPTS}, {@code CROSS_SOURCE_CANDIDATES_PER_SOURCE}.</li>
 *   <li>{@code SIMILARITY_THRESHOLD}, {@code ARTIST_MATCH_BONUS}.</li>
 * </ul>
 *
 * @author Music Resolver Team
 * @since 1.0
 */
public record PreviewDetectionConfig(
    double minDurationSec,
    double maxDurationSec,
    List<Double> typicalDurationsSec,
    double durationToleranceSec,
    long minFileSizeBytes,
    Pattern urlMarkerPattern,
    Duration crossSourceTimeout,
    int maxCrossSourceAttempts,
    int candidatesPerSource,
    double similarityThreshold,
    double artistMatchBonus
) {
    static final String DEFAULT_URL_PATTERN = "(?i)(preview|trial|audition|[/_.=-]clip[/_.-]|[/_-]try[/_.-])";

    public PreviewDetectionConfig {
        typicalDurationsSec = typicalDurationsSec == null ? List.of() : List.copyOf(typicalDurationsSec);
        if (minDurationSec > maxDurationSec) {
            throw new IllegalArgumentException("Preview band is inverted: " + minDurationSec + " > " + maxDurationSec);
        }
    }

    public static PreviewDetectionConfig defaults() {
        return new PreviewDetectionConfig(
            20, 70, List.of(30.0, 60.0), 3,
            800L * 1024,
            Pattern.compile(DEFAULT_URL_PATTERN),
            Duration.ofSeconds(10), 3, 3,
            0.5, 0.2
        );
    }

    public static PreviewDetectionConfig fromEnvironment() {
        PreviewDetectionConfig d = defaults();
        return new PreviewDetectionConfig(
            Utils.envDouble("PREVIEW_MIN_DURATION_SEC", d.minDurationSec()),
            Utils.envDouble("PREVIEW_MAX_DURATION_SEC", d.maxDurationSec()),
            Utils.envDoubleList("PREVIEW_TYPICAL_DURATIONS_SEC", d.typicalDurationsSec()),
            Utils.envDouble("PREVIEW_DURATION_TOLERANCE_SEC", d.durationToleranceSec()),
            Utils.envLong("PREVIEW_MIN_FILE_SIZE_BYTES", d.minFileSizeBytes()),
            Pattern.compile(Utils.envOrProp("PREVIEW_URL_PATTERN", DEFAULT_URL_PATTERN)),
            Duration.ofMillis(Utils.envLong("CROSS_SOURCE_TIMEOUT_MS", d.crossSourceTimeout().toMillis())),
            (int) Utils.envLong("CROSS_SOURCE_MAX_ATTEMPTS", d.maxCrossSourceAttempts()),
            (int) Utils.envLong("CROSS_SOURCE_CANDIDATES_PER_SOURCE", d.candidatesPerSource()),
            Utils.envDouble("SIMILARITY_THRESHOLD", d.similarityThreshold()),
            Utils.envDouble("ARTIST_MATCH_BONUS", d.artistMatchBonus())
        );
    }
}
