package com.cloudmusic.resolver;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

/**
 * Runtime configuration of the resolver.
 * <p>
 * Values come from {@link #defaults()} or {@link #fromEnvironment()}; in the latter every key is
 * looked up as an environment variable first and then as a JVM system property (same lookup the
 * CLI uses). Tests build variants through {@link Builder}.
 * <p>
 * Keys:
 * <ul>
 *   <li>{@code TIMEOUT_PROBE_MS}, {@code TIMEOUT_SEARCH_MS}, {@code TIMEOUT_SONG_URL_MS}, {@code TIMEOUT_LYRICS_MS}, {@code TIMEOUT_PLAYLIST_MS}</li>
 *   <li>{@code HTTP_RETRIES}, {@code HTTP_RETRY_BACKOFF_MS}</li>
 *   <li>{@code PROXY_ENDPOINT} (blank disables rewriting), {@code PROXY_DOMAINS} (comma-separated audio CDN hosts)</li>
 *   <li>{@code DEFAULT_QUALITY}</li>
 *   <li>{@code FADE_DURATION_MS}, {@code FADE_STEPS}</li>
 *   <li>{@code BREAKER_FAILURE_THRESHOLD}, {@code BREAKER_COOLDOWN_MS}</li>
 *   <li>{@code CROSS_SOURCE_PARALLEL}, {@code CROSS_SOURCE_SOURCES}</li>
 *   <li>{@code STATS_FILE}</li>
 *   <li>{@code MAX_SEEK_ON_SWITCH_SEC}, {@code AUTO_ADVANCE_DELAY_MS}, {@code MAX_FULL_VERSION_SEARCHES}</li>
 * </ul>
 *
 * @author Music Resolver Team
 * @since 1.0
 */
public record ResolverConfig(
    Duration probeTimeout,
    Duration searchTimeout,
    Duration songUrlTimeout,
    Duration lyricsTimeout,
    Duration playlistTimeout,
    int httpRetries,
    Duration retryBackoff,
    String proxyEndpoint,
    List<String> proxyDomains,
    String defaultQuality,
    Duration fadeDuration,
    int fadeSteps,
    int breakerFailureThreshold,
    Duration breakerCooldown,
    boolean parallelCrossSearch,
    List<String> crossSourceCandidates,
    Path statsFile,
    double maxSeekOnSwitchSec,
    Duration autoAdvanceDelay,
    int maxFullVersionSearches,
    PreviewDetectionConfig preview
) {
    /** Audio CDN hosts that must be reached through the proxy. */
    public static final List<String> DEFAULT_PROXY_DOMAINS = List.of(
        "music.126.net",
        "stream.qqmusic.qq.com",
        "kugou.com",
        "migu.cn",
        "kuwo.cn",
        "joox.com",
        "xmcdn.com",
        "ximalaya.com"
    );

    /** Catalog sources searched when recovering a full version. */
    public static final List<String> DEFAULT_CROSS_SOURCES = List.of("kuwo", "kugou", "migu", "netease", "tencent", "joox");

    public ResolverConfig {
        proxyEndpoint = proxyEndpoint == null ? "" : proxyEndpoint.trim();
        proxyDomains = proxyDomains == null ? List.of() : List.copyOf(proxyDomains);
        crossSourceCandidates = crossSourceCandidates == null ? List.of() : List.copyOf(crossSourceCandidates);
        if (fadeSteps < 1) {
            throw new IllegalArgumentException("fadeSteps must be at least 1");
        }
        if (breakerFailureThreshold < 1) {
            throw new IllegalArgumentException("breakerFailureThreshold must be at least 1");
        }
        if (httpRetries < 0) {
            throw new IllegalArgumentException("httpRetries cannot be negative");
        }
        if (preview == null) {
            preview = PreviewDetectionConfig.defaults();
        }
    }

    public static ResolverConfig defaults() {
        return builder().build();
    }

    public static ResolverConfig fromEnvironment() {
        ResolverConfig d = defaults();
        return new ResolverConfig(
            Duration.ofMillis(Utils.envLong("TIMEOUT_PROBE_MS", d.probeTimeout().toMillis())),
            Duration.ofMillis(Utils.envLong("TIMEOUT_SEARCH_MS", d.searchTimeout().toMillis())),
            Duration.ofMillis(Utils.envLong("TIMEOUT_SONG_URL_MS", d.songUrlTimeout().toMillis())),
            Duration.ofMillis(Utils.envLong("TIMEOUT_LYRICS_MS", d.lyricsTimeout().toMillis())),
            Duration.ofMillis(Utils.envLong("TIMEOUT_PLAYLIST_MS", d.playlistTimeout().toMillis())),
            (int) Utils.envLong("HTTP_RETRIES", d.httpRetries()),
            Duration.ofMillis(Utils.envLong("HTTP_RETRY_BACKOFF_MS", d.retryBackoff().toMillis())),
            Utils.envOrProp("PROXY_ENDPOINT", d.proxyEndpoint()),
            Utils.envList("PROXY_DOMAINS", d.proxyDomains()),
            Utils.envOrProp("DEFAULT_QUALITY", d.defaultQuality()),
            Duration.ofMillis(Utils.envLong("FADE_DURATION_MS", d.fadeDuration().toMillis())),
            (int) Utils.envLong("FADE_STEPS", d.fadeSteps()),
            (int) Utils.envLong("BREAKER_FAILURE_THRESHOLD", d.breakerFailureThreshold()),
            Duration.ofMillis(Utils.envLong("BREAKER_COOLDOWN_MS", d.breakerCooldown().toMillis())),
            Boolean.parseBoolean(Utils.envOrProp("CROSS_SOURCE_PARALLEL", Boolean.toString(d.parallelCrossSearch()))),
            Utils.envList("CROSS_SOURCE_SOURCES", d.crossSourceCandidates()),
            Paths.get(Utils.envOrProp("STATS_FILE", d.statsFile().toString())),
            Utils.envDouble("MAX_SEEK_ON_SWITCH_SEC", d.maxSeekOnSwitchSec()),
            Duration.ofMillis(Utils.envLong("AUTO_ADVANCE_DELAY_MS", d.autoAdvanceDelay().toMillis())),
            (int) Utils.envLong("MAX_FULL_VERSION_SEARCHES", d.maxFullVersionSearches()),
            PreviewDetectionConfig.fromEnvironment()
        );
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mutable builder pre-populated with the default values.
     */
    public static final class Builder {
        private Duration probeTimeout = Duration.ofSeconds(8);
        private Duration searchTimeout = Duration.ofSeconds(20);
        private Duration songUrlTimeout = Duration.ofSeconds(15);
        private Duration lyricsTimeout = Duration.ofSeconds(10);
        private Duration playlistTimeout = Duration.ofSeconds(30);
        private int httpRetries = 2;
        private Duration retryBackoff = Duration.ofMillis(300);
        private String proxyEndpoint = "";
        private List<String> proxyDomains = DEFAULT_PROXY_DOMAINS;
        private String defaultQuality = "320";
        private Duration fadeDuration = Duration.ofMillis(400);
        private int fadeSteps = 10;
        private int breakerFailureThreshold = 3;
        private Duration breakerCooldown = Duration.ofSeconds(60);
        private boolean parallelCrossSearch = true;
        private List<String> crossSourceCandidates = DEFAULT_CROSS_SOURCES;
        private Path statsFile = Paths.get("player-data", "source-stats.json");
        private double maxSeekOnSwitchSec = 10;
        private Duration autoAdvanceDelay = Duration.ofMillis(1500);
        private int maxFullVersionSearches = 2;
        private PreviewDetectionConfig preview = PreviewDetectionConfig.defaults();

        private Builder() {}

        public Builder timeouts(Duration probe, Duration search, Duration songUrl, Duration lyrics, Duration playlist) {
            this.probeTimeout = probe;
            this.searchTimeout = search;
            this.songUrlTimeout = songUrl;
            this.lyricsTimeout = lyrics;
            this.playlistTimeout = playlist;
            return this;
        }

        public Builder httpRetries(int retries, Duration backoff) {
            this.httpRetries = retries;
            this.retryBackoff = backoff;
            return this;
        }

        public Builder proxy(String endpoint, List<String> domains) {
            this.proxyEndpoint = endpoint;
            this.proxyDomains = domains;
            return this;
        }

        public Builder defaultQuality(String quality) {
            this.defaultQuality = quality;
            return this;
        }

        public Builder fade(Duration duration, int steps) {
            this.fadeDuration = duration;
            this.fadeSteps = steps;
            return this;
        }

        public Builder breaker(int failureThreshold, Duration cooldown) {
            this.breakerFailureThreshold = failureThreshold;
            this.breakerCooldown = cooldown;
            return this;
        }

        public Builder crossSource(boolean parallel, List<String> candidates) {
            this.parallelCrossSearch = parallel;
            this.crossSourceCandidates = candidates;
            return this;
        }

        public Builder statsFile(Path file) {
            this.statsFile = file;
            return this;
        }

        public Builder playback(double maxSeekOnSwitchSec, Duration autoAdvanceDelay, int maxFullVersionSearches) {
            this.maxSeekOnSwitchSec = maxSeekOnSwitchSec;
            this.autoAdvanceDelay = autoAdvanceDelay;
            this.maxFullVersionSearches = maxFullVersionSearches;
            return this;
        }

        public Builder preview(PreviewDetectionConfig preview) {
            this.preview = preview;
            return this;
        }

        public ResolverConfig build() {
            return new ResolverConfig(probeTimeout, searchTimeout, songUrlTimeout, lyricsTimeout, playlistTimeout,
                httpRetries, retryBackoff, proxyEndpoint, proxyDomains, defaultQuality, fadeDuration, fadeSteps,
                breakerFailureThreshold, breakerCooldown, parallelCrossSearch, crossSourceCandidates, statsFile,
                maxSeekOnSwitchSec, autoAdvanceDelay, maxFullVersionSearches, preview);
        }
    }
}
