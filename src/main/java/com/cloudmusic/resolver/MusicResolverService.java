package com.cloudmusic.resolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default {@link MusicResolverServiceInterface}: a {@link ResolutionChain} wired to a {@link CrossSourceMatcher}.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@link #create(ResolverConfig)} builds the registry, HTTP fetcher, clients, breakers, detector, stats and
 *       matcher.</li>
 *   <li>Resolved URLs are rewritten for playback (https upgrade, proxy for allowlisted CDN hosts).</li>
 *   <li>{@link #close()} persists the source stats and stops the background executor.</li>
 * </ul>
 *
 * @author Music Resolver Team
 * @since 1.0
 */
public class MusicResolverService implements MusicResolverServiceInterface, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(MusicResolverService.class);
    static final String DEFAULT_SEARCH_SOURCE = "netease";
    static final List<String> EXPLORE_KEYWORDS = List.of("周杰伦", "林俊杰", "邓紫棋", "薛之谦", "陈奕迅", "五月天");

    private final ResolutionChain chain;
    private final CrossSourceMatcher matcher;
    private final SourceStats stats;
    private final ResolverConfig config;
    private final ExecutorService executor;

    public MusicResolverService(ResolutionChain chain, CrossSourceMatcher matcher, SourceStats stats,
                                ResolverConfig config, ExecutorService executor) {
        this.chain = chain;
        this.matcher = matcher;
        this.stats = stats;
        this.config = config;
        this.executor = executor;
    }

    public static MusicResolverService create(ResolverConfig config) {
        return create(config, ProviderRegistry.defaults(), new ProxiedHttpFetcher(config), Clock.systemUTC());
    }

    public static MusicResolverService create(ResolverConfig config, ProviderRegistry registry, HttpFetcher fetcher, Clock clock) {
        SourceStats stats = SourceStats.load(new JsonFileSourceStatsStore(config.statsFile()));
        ResolutionChain chain = ResolutionChain.create(registry, fetcher, config, stats, clock);
        ExecutorService executor = Executors.newCachedThreadPool(daemonThreads());
        PreviewDetector detector = new PreviewDetector(config.preview());
        CrossSourceMatcher matcher = new CrossSourceMatcher(chain, detector, new SimilarityScorer(config.preview()), stats, config, executor);
        chain.setCrossSourceMatcher(matcher);
        logger.info("Resolver ready with providers {}", registry.providers().stream().map(ProviderDescriptor::name).toList());
        return new MusicResolverService(chain, matcher, stats, config, executor);
    }

    @Override
    public UrlResolution resolvePlayableUrl(Song song, String preferredQuality) throws MusicResolutionException {
        return playable(chain.resolveUrl(song, preferredQuality));
    }

    @Override
    public List<Song> search(String keyword, String providerHint) throws MusicResolutionException {
        String source = providerHint == null || providerHint.isBlank() ? DEFAULT_SEARCH_SOURCE : providerHint.trim();
        List<Song> songs = chain.search(keyword, source);
        logger.info("Search '{}' on {} returned {} songs", keyword, source, songs.size());
        return songs;
    }

    @Override
    public List<Song> explore() {
        return explore(EXPLORE_KEYWORDS.get(ThreadLocalRandom.current().nextInt(EXPLORE_KEYWORDS.size())));
    }

    List<Song> explore(String keyword) {
        try {
            return search(keyword, DEFAULT_SEARCH_SOURCE);
        } catch (MusicResolutionException e) {
            logger.warn("Explore search for '{}' failed: {}", keyword, e.getMessage());
            return List.of();
        }
    }

    @Override
    public LyricResult getLyrics(Song song) throws MusicResolutionException {
        return chain.lyrics(song);
    }

    @Override
    public String getCover(Song song) {
        return chain.cover(song);
    }

    @Override
    public Playlist parsePlaylist(String urlOrId) throws MusicResolutionException {
        return chain.parsePlaylist(urlOrId);
    }

    @Override
    public List<ProviderStatus> probeProviders() {
        return chain.probeProviders();
    }

    @Override
    public Optional<UrlResolution> findFullVersion(Song song, String quality) {
        return matcher.findFullVersion(song, quality).map(this::playable);
    }

    @Override
    public Map<String, SourceStats.Counter> sourceStats() {
        return stats.snapshot();
    }

    public ResolutionChain chain() {
        return chain;
    }

    public ResolverConfig config() {
        return config;
    }

    @Override
    public void close() {
        stats.persist();
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                logger.warn("Background resolver tasks did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private UrlResolution playable(UrlResolution resolution) {
        ResolvedUrl raw = resolution.resolvedUrl();
        ResolvedUrl rewritten = new ResolvedUrl(Utils.toPlayableUrl(raw.url(), config), raw.bitrateLabel(), raw.sizeBytes());
        return new UrlResolution(rewritten, resolution.song(), resolution.providerName(), resolution.requestedQuality(),
            resolution.obtainedQuality(), resolution.preview(), resolution.crossSource());
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "resolver-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
