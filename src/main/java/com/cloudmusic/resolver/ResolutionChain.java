package com.cloudmusic.resolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered, breaker-aware attempt of one operation across the configured providers.
 * <p>
 * Workflow for every operation:
 * <ul>
 *   <li>Providers are walked in registry order. A provider that does not support the operation for the
 *       requested source is skipped without recording anything.</li>
 *   <li>A guarded provider whose {@link CircuitBreaker} denies execution is skipped without being called.</li>
 *   <li>A thrown {@link MusicResolutionException} records a failure (breaker and {@link SourceStats}) and the
 *       walk continues; a well-formed answer records a success.</li>
 *   <li>The first usable answer wins. Only exhaustion of every provider surfaces an error to the caller.</li>
 * </ul>
 * URL resolution additionally runs every candidate through the {@link PreviewDetector}; see
 * {@link #resolveUrl(Song, String)}.
 *
 * @author Music Resolver Team
 * @since 1.0
 */
public class ResolutionChain {
    private static final Logger logger = LoggerFactory.getLogger(ResolutionChain.class);

    /** Bitrate ladder walked when the preferred quality yields nothing. */
    static final List<String> QUALITY_LADDER = List.of("128", "192", "320", "740", "999");
    static final int COVER_SIZE = 300;
    static final String PLACEHOLDER_COVER = "data:image/svg+xml;base64,"
        + "PHN2ZyB3aWR0aD0iNTUiIGhlaWdodD0iNTUiIHZpZXdCb3g9IjAgMCA1NSA1NSIgZmlsbD0ibm9uZSIgeG1sbnM9Imh0dHA6Ly93d3cudzMub3JnLzIwMDAvc3ZnIj4K"
        + "PHJlY3Qgd2lkdGg9IjU1IiBoZWlnaHQ9IjU1IiBmaWxsPSJyZ2JhKDI1NSwyNTUsMjU1LDAuMSkiIHJ4PSI4Ii8+CjxwYXRoIGQ9Ik0yNy41IDE4TDM1IDI3LjVIMzBW"
        + "MzdIMjVWMjcuNUgyMEwyNy41IDE4WiIgZmlsbD0icmdiYSgyNTUsMjU1LDI1NSwwLjMpIi8+Cjwvc3ZnPgo=";

    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final List<Pattern> PLAYLIST_ID_PATTERNS = List.of(
        Pattern.compile("id=(\\d+)"),
        Pattern.compile("playlist/(\\d+)"),
        Pattern.compile("/(\\d+)\\?"),
        Pattern.compile("/(\\d+)$")
    );

    /**
     * One provider call inside the driver loop.
     */
    @FunctionalInterface
    interface ProviderCall<T> {
        T call(ProviderClient client) throws MusicResolutionException;
    }

    private final List<ProviderClient> clients;
    private final Map<String, CircuitBreaker> breakers = new LinkedHashMap<>();
    private final ResolverConfig config;
    private final PreviewDetector detector;
    private final SourceStats stats;
    private volatile CrossSourceMatcher crossSourceMatcher;

    public ResolutionChain(List<ProviderClient> clients, ResolverConfig config, PreviewDetector detector, SourceStats stats, Clock clock) {
        if (clients == null || clients.isEmpty()) {
            throw new IllegalArgumentException("At least one provider client is required");
        }
        this.clients = List.copyOf(clients);
        this.config = config;
        this.detector = detector;
        this.stats = stats;
        for (ProviderClient client : this.clients) {
            ProviderDescriptor descriptor = client.descriptor();
            if (descriptor.guarded()) {
                breakers.put(descriptor.name(), new CircuitBreaker(descriptor.name(), config, clock));
            }
        }
    }

    /**
     * Builds one client per registered provider.
     */
    public static ResolutionChain create(ProviderRegistry registry, HttpFetcher fetcher, ResolverConfig config, SourceStats stats, Clock clock) {
        List<ProviderClient> clients = new ArrayList<>();
        for (ProviderDescriptor descriptor : registry.providers()) {
            clients.add(ProviderClients.create(descriptor, fetcher, config));
        }
        return new ResolutionChain(clients, config, new PreviewDetector(config.preview()), stats, clock);
    }

    /**
     * Enables background cross-source recovery when a preview is detected.
     */
    public void setCrossSourceMatcher(CrossSourceMatcher matcher) {
        this.crossSourceMatcher = matcher;
    }

    public Optional<CircuitBreaker> breaker(String providerName) {
        return Optional.ofNullable(breakers.get(providerName));
    }

    public Map<String, CircuitBreaker> breakers() {
        return Collections.unmodifiableMap(breakers);
    }

    public List<ProviderDescriptor> providers() {
        return clients.stream().map(ProviderClient::descriptor).toList();
    }

    /**
     * Searches a catalog source.
     * @param keyword Search text
     * @param source Catalog source tag, e.g. "netease"
     * @return Songs from the first provider with a non-empty answer; empty when every provider answered empty
     * @throws MusicResolutionException if every eligible provider failed
     */
    public List<Song> search(String keyword, String source) throws MusicResolutionException {
        if (keyword == null || keyword.isBlank()) {
            throw new IllegalArgumentException("Search keyword cannot be blank");
        }
        Optional<Resolution<List<Song>>> result = attempt(Operation.SEARCH, source, c -> c.search(keyword.trim(), source), list -> !list.isEmpty());
        return result.map(Resolution::value).orElse(List.of());
    }

    /**
     * Resolves a playable URL with quality fallback and preview reconciliation.
     * <p>
     * Workflow:
     * <ul>
     *   <li>Per provider: the preferred quality first, then the lower rungs of the ladder in ascending order.</li>
     *   <li>A candidate the detector does not flag is returned immediately.</li>
     *   <li>The first flagged candidate is kept as a fallback, a cross-source search is started in the
     *       background, and the walk continues with the next provider.</li>
     *   <li>With no full-length candidate left, the cross-source result is awaited for up to the cross-source
     *       timeout and preferred; otherwise the preview is returned flagged.</li>
     * </ul>
     * @param song Song to resolve
     * @param preferredQuality Requested bitrate label, e.g. "320"
     * @return Resolution describing the accepted asset
     * @throws MusicResolutionException NETWORK/UPSTREAM if every attempt failed, UNRESOLVED if nothing usable was found
     */
    public UrlResolution resolveUrl(Song song, String preferredQuality) throws MusicResolutionException {
        String quality = preferredQuality == null || preferredQuality.isBlank() ? config.defaultQuality() : preferredQuality;
        List<String> qualities = qualityOrder(quality);
        Outcome outcome = new Outcome();
        UrlResolution previewCandidate = null;
        CompletableFuture<Optional<UrlResolution>> crossSource = null;

        for (ProviderClient client : clients) {
            if (!isEligible(client, Operation.URL, song.source())) continue;
            String provider = client.descriptor().name();
            for (String q : qualities) {
                ResolvedUrl url;
                try {
                    url = client.songUrl(song, q);
                    outcome.answered = true;
                    recordSuccess(provider);
                } catch (MusicResolutionException e) {
                    if (isCancellation(e)) {
                        releaseTrial(provider);
                        logger.debug("URL lookup for '{}' cancelled at {}", song.name(), provider);
                        throw e;
                    }
                    outcome.lastFailure = e;
                    recordFailure(provider, Operation.URL, e);
                    break;
                }
                if (url.isEmpty()) {
                    logger.debug("{} has no {} URL for '{}'", provider, q, song.name());
                    continue;
                }
                UrlResolution candidate = new UrlResolution(url, song, provider, quality, q, false, false);
                if (!detector.isLikelyPreview(url, song)) {
                    logger.info("Resolved '{}' via {} at {}", song.name(), provider, q);
                    return candidate;
                }
                logger.info("{} returned a likely preview for '{}'", provider, song.name());
                if (previewCandidate == null) {
                    previewCandidate = new UrlResolution(url, song, provider, quality, q, true, false);
                    crossSource = startCrossSource(song, quality);
                }
                break;
            }
        }

        if (previewCandidate != null) {
            Optional<UrlResolution> recovered = awaitCrossSource(crossSource, song);
            return recovered.orElse(previewCandidate);
        }
        throw exhausted(Operation.URL, song, outcome);
    }

    /**
     * Single-quality URL lookup without preview handling, used by the cross-source matcher.
     * @return The first non-empty URL and the provider that returned it, or empty
     * @throws MusicResolutionException if every eligible provider failed
     */
    public Optional<Resolution<ResolvedUrl>> resolveDirect(Song song, String quality) throws MusicResolutionException {
        return attempt(Operation.URL, song.source(), c -> c.songUrl(song, quality), url -> !url.isEmpty());
    }

    /**
     * @return Lyrics from the first provider with a non-empty answer, or {@link LyricResult#EMPTY}
     * @throws MusicResolutionException if every eligible provider failed
     */
    public LyricResult lyrics(Song song) throws MusicResolutionException {
        return attempt(Operation.LYRICS, song.source(), c -> c.lyrics(song), r -> !r.isEmpty())
            .map(Resolution::value)
            .orElse(LyricResult.EMPTY);
    }

    /**
     * Cover image URL. Known cover URLs short-circuit the chain; netease CDN URLs get a size parameter.
     * Songs without a picture reference, and lookups that yield nothing, get the built-in placeholder.
     */
    public String cover(Song song) {
        if (!song.picUrl().isEmpty()) {
            if (song.picUrl().contains("music.126.net") && !song.picUrl().contains("param=")) {
                return song.picUrl() + (song.picUrl().contains("?") ? "&" : "?") + "param=" + COVER_SIZE + "y" + COVER_SIZE;
            }
            return song.picUrl();
        }
        if (song.picId().isEmpty()) {
            return PLACEHOLDER_COVER;
        }
        try {
            return attempt(Operation.COVER, song.source(), c -> c.cover(song, COVER_SIZE), url -> url != null && !url.isBlank())
                .map(Resolution::value)
                .orElse(PLACEHOLDER_COVER);
        } catch (MusicResolutionException e) {
            logger.warn("Cover lookup for '{}' failed on every provider: {}", song.name(), e.getMessage());
            return PLACEHOLDER_COVER;
        }
    }

    /**
     * Parses a netease playlist.
     * @param urlOrId Numeric playlist id or a netease playlist URL
     * @throws IllegalArgumentException if no playlist id can be extracted
     * @throws MusicResolutionException if every eligible provider failed
     */
    public Playlist parsePlaylist(String urlOrId) throws MusicResolutionException {
        String playlistId = extractPlaylistId(urlOrId);
        Optional<Resolution<Playlist>> result = attempt(Operation.PLAYLIST, NecProviderClient.NETEASE,
            c -> c.playlist(playlistId), p -> !p.songs().isEmpty());
        if (result.isEmpty()) {
            logger.warn("Playlist {} resolved to no songs on every provider", playlistId);
            return new Playlist("", playlistId, List.of());
        }
        Playlist playlist = result.get().value();
        logger.info("Parsed playlist '{}' ({} songs) via {}", playlist.name(), playlist.songs().size(), result.get().providerName());
        return playlist;
    }

    /**
     * Probes every provider once, respecting the breakers.
     */
    public List<ProviderStatus> probeProviders() {
        List<ProviderStatus> report = new ArrayList<>();
        for (ProviderClient client : clients) {
            String provider = client.descriptor().name();
            CircuitBreaker breaker = breakers.get(provider);
            if (breaker != null && !breaker.tryAcquire()) {
                report.add(new ProviderStatus(provider, false, -1, CircuitState.OPEN, "circuit open"));
                continue;
            }
            long start = System.nanoTime();
            try {
                client.probe();
                recordSuccess(provider);
                long latency = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                report.add(new ProviderStatus(provider, true, latency, stateOf(provider), ""));
            } catch (MusicResolutionException e) {
                recordFailure(provider, Operation.PROBE, e);
                long latency = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                report.add(new ProviderStatus(provider, false, latency, stateOf(provider), e.getMessage()));
            }
        }
        return report;
    }

    /**
     * Extracts a playlist id from a numeric id or a music.163.com / 163cn.tv URL.
     */
    static String extractPlaylistId(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Playlist URL or id cannot be blank");
        }
        String value = input.trim();
        if (value.contains("music.163.com") || value.contains("163cn.tv")) {
            for (Pattern pattern : PLAYLIST_ID_PATTERNS) {
                Matcher m = pattern.matcher(value);
                if (m.find()) {
                    return m.group(1);
                }
            }
            throw new IllegalArgumentException("Cannot find a playlist id in " + value);
        }
        if (DIGITS.matcher(value).matches()) {
            return value;
        }
        throw new IllegalArgumentException("Not a playlist id or netease playlist URL: " + value);
    }

    /**
     * Preferred quality first, then the ladder rungs below it in ascending order.
     */
    static List<String> qualityOrder(String preferred) {
        List<String> order = new ArrayList<>();
        order.add(preferred);
        int cap;
        try {
            cap = Integer.parseInt(preferred);
        } catch (NumberFormatException e) {
            cap = Integer.MAX_VALUE;
        }
        for (String rung : QUALITY_LADDER) {
            if (!rung.equals(preferred) && Integer.parseInt(rung) < cap) {
                order.add(rung);
            }
        }
        return order;
    }

    /**
     * Driver loop shared by every single-answer operation.
     * @return The first usable answer, or empty when providers answered but nothing was usable
     * @throws MusicResolutionException if no provider answered and at least one attempt failed
     */
    <T> Optional<Resolution<T>> attempt(Operation operation, String source, ProviderCall<T> call, Predicate<T> usable)
            throws MusicResolutionException {
        Outcome outcome = new Outcome();
        for (ProviderClient client : clients) {
            if (!isEligible(client, operation, source)) continue;
            String provider = client.descriptor().name();
            T value;
            try {
                value = call.call(client);
            } catch (MusicResolutionException e) {
                if (isCancellation(e)) {
                    releaseTrial(provider);
                    logger.debug("{} {} cancelled at {}", operation, source, provider);
                    throw e;
                }
                outcome.lastFailure = e;
                recordFailure(provider, operation, e);
                continue;
            }
            outcome.answered = true;
            recordSuccess(provider);
            if (value != null && usable.test(value)) {
                logger.debug("{} {} satisfied by {}", operation, source, provider);
                return Optional.of(new Resolution<>(value, provider));
            }
            logger.debug("{} returned nothing usable for {} {}", provider, operation, source);
        }
        if (!outcome.answered && outcome.lastFailure != null) {
            throw new MusicResolutionException(outcome.lastFailure.getKind(),
                "All providers failed for " + operation + ": " + outcome.lastFailure.getMessage(), outcome.lastFailure);
        }
        return Optional.empty();
    }

    private boolean isEligible(ProviderClient client, Operation operation, String source) {
        String provider = client.descriptor().name();
        if (!client.supports(operation, source)) {
            logger.debug("{} does not support {} for source {}", provider, operation, source);
            return false;
        }
        CircuitBreaker breaker = breakers.get(provider);
        if (breaker != null && !breaker.tryAcquire()) {
            logger.debug("Skipping {}: circuit {}", provider, breaker.getState());
            return false;
        }
        return true;
    }

    /**
     * True when a failure was caused by the calling thread being interrupted rather than by the provider.
     * Such attempts have no outcome and are never recorded against the provider or a source.
     */
    static boolean isCancellation(MusicResolutionException e) {
        if (Thread.currentThread().isInterrupted()) {
            return true;
        }
        for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof InterruptedIOException && !(cause instanceof SocketTimeoutException)) {
                return true;
            }
        }
        return false;
    }

    private void releaseTrial(String provider) {
        CircuitBreaker breaker = breakers.get(provider);
        if (breaker != null) breaker.releaseTrial();
    }

    private void recordSuccess(String provider) {
        CircuitBreaker breaker = breakers.get(provider);
        if (breaker != null) breaker.recordSuccess();
        stats.recordSuccess(provider);
    }

    private void recordFailure(String provider, Operation operation, MusicResolutionException e) {
        CircuitBreaker breaker = breakers.get(provider);
        if (breaker != null) breaker.recordFailure();
        stats.recordFailure(provider);
        logger.warn("{} {} failed ({}): {}", provider, operation, e.getKind(), e.getMessage());
    }

    private CircuitState stateOf(String provider) {
        CircuitBreaker breaker = breakers.get(provider);
        return breaker == null ? CircuitState.CLOSED : breaker.getState();
    }

    private CompletableFuture<Optional<UrlResolution>> startCrossSource(Song song, String quality) {
        CrossSourceMatcher matcher = crossSourceMatcher;
        if (matcher == null) {
            return null;
        }
        logger.info("Starting cross-source search for '{}'", song.name());
        return matcher.findFullVersionAsync(song, quality);
    }

    private Optional<UrlResolution> awaitCrossSource(CompletableFuture<Optional<UrlResolution>> future, Song song) {
        if (future == null) {
            return Optional.empty();
        }
        long timeoutMs = config.preview().crossSourceTimeout().toMillis();
        try {
            Optional<UrlResolution> result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            result.ifPresent(r -> logger.info("Using full version of '{}' from {} ({})", song.name(), r.song().source(), r.providerName()));
            return result;
        } catch (TimeoutException e) {
            logger.warn("Cross-source search for '{}' did not finish within {} ms", song.name(), timeoutMs);
        } catch (ExecutionException e) {
            logger.warn("Cross-source search for '{}' failed: {}", song.name(), e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for cross-source search of '{}'", song.name());
        }
        return Optional.empty();
    }

    private static MusicResolutionException exhausted(Operation operation, Song song, Outcome outcome) {
        if (!outcome.answered && outcome.lastFailure != null) {
            return new MusicResolutionException(outcome.lastFailure.getKind(),
                "All providers failed for " + operation + " of '" + song.name() + "': " + outcome.lastFailure.getMessage(),
                outcome.lastFailure);
        }
        return new MusicResolutionException(ErrorKind.UNRESOLVED, "No provider returned a URL for '" + song.name() + "'");
    }

    private static final class Outcome {
        boolean answered;
        MusicResolutionException lastFailure;
    }
}
