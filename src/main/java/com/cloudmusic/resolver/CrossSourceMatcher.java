package com.cloudmusic.resolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Recovers a full-length asset for a song whose resolved URL looks like a preview.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Candidate catalog sources are the configured ones minus the song's own source, ranked by
 *       {@link SourceStats} success rate and capped at the configured attempt count.</li>
 *   <li>Each source is searched for {@code name + " " + primaryArtist}; in parallel on the executor when enabled
 *       (first satisfying source wins, bounded by the cross-source timeout), otherwise one after another.</li>
 *   <li>Hits are scored by {@link SimilarityScorer}; those below the floor are dropped.</li>
 *   <li>For the best few hits a URL is resolved from the lowest bitrate upward; the first URL the
 *       {@link PreviewDetector} does not flag is accepted.</li>
 *   <li>Each searched source records one success or failure and the stats are persisted.</li>
 * </ul>
 * At most one search per song identity runs at a time; a concurrent request for the same song returns empty
 * immediately.
 *
 * @author Music Resolver Team
 * @since 1.0
 */
public class CrossSourceMatcher {
    private static final Logger logger = LoggerFactory.getLogger(CrossSourceMatcher.class);

    /** Bitrates tried for a matched candidate, lowest first. */
    static final List<String> CANDIDATE_QUALITIES = List.of("128", "192", "320");

    private final ResolutionChain chain;
    private final PreviewDetector detector;
    private final SimilarityScorer scorer;
    private final SourceStats stats;
    private final ResolverConfig config;
    private final ExecutorService executor;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public CrossSourceMatcher(ResolutionChain chain, PreviewDetector detector, SimilarityScorer scorer,
                              SourceStats stats, ResolverConfig config, ExecutorService executor) {
        this.chain = chain;
        this.detector = detector;
        this.scorer = scorer;
        this.stats = stats;
        this.config = config;
        this.executor = executor;
    }

    /**
     * Runs {@link #findFullVersion(Song, String)} on the executor.
     */
    public CompletableFuture<Optional<UrlResolution>> findFullVersionAsync(Song song, String quality) {
        if (inFlight.contains(song.identityKey())) {
            logger.debug("Cross-source search for {} already running", song.identityKey());
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return CompletableFuture.supplyAsync(() -> findFullVersion(song, quality), executor);
    }

    /**
     * @param song Song whose asset was flagged as a preview
     * @param quality Quality requested by the caller, reported on the result
     * @return Full-length asset from another source, or empty
     */
    public Optional<UrlResolution> findFullVersion(Song song, String quality) {
        String key = song.identityKey();
        if (!inFlight.add(key)) {
            logger.debug("Cross-source search for {} already running", key);
            return Optional.empty();
        }
        try {
            List<String> sources = candidateSources(song);
            if (sources.isEmpty()) {
                logger.info("No alternate sources configured for '{}'", song.name());
                return Optional.empty();
            }
            String query = (song.name() + " " + song.primaryArtist()).trim();
            logger.info("Searching {} for a full version of '{}'", sources, query);
            long deadline = System.nanoTime() + config.preview().crossSourceTimeout().toNanos();
            Optional<UrlResolution> result = config.parallelCrossSearch() && sources.size() > 1
                ? searchParallel(song, query, quality, sources, deadline)
                : searchSequential(song, query, quality, sources, deadline);
            if (result.isEmpty()) {
                logger.info("No full version found for '{}'", song.name());
            }
            return result;
        } finally {
            stats.persist();
            inFlight.remove(key);
        }
    }

    public boolean isInFlight(Song song) {
        return inFlight.contains(song.identityKey());
    }

    /**
     * Configured sources except the song's own, ranked by success rate and capped.
     */
    List<String> candidateSources(Song song) {
        List<String> sources = new ArrayList<>();
        for (String source : config.crossSourceCandidates()) {
            if (!source.equalsIgnoreCase(song.source()) && !sources.contains(source)) {
                sources.add(source);
            }
        }
        List<String> ranked = stats.rank(sources);
        int max = Math.max(0, config.preview().maxCrossSourceAttempts());
        return ranked.size() > max ? new ArrayList<>(ranked.subList(0, max)) : ranked;
    }

    /**
     * Matching hits sorted by descending score.
     */
    List<MatchCandidate> rankCandidates(Song target, List<Song> hits) {
        List<MatchCandidate> candidates = new ArrayList<>();
        for (Song hit : hits) {
            if (hit.identityKey().equals(target.identityKey())) continue;
            double score = scorer.scoreCandidate(target, hit);
            if (score >= 0) {
                candidates.add(new MatchCandidate(hit, score));
            }
        }
        candidates.sort(Comparator.comparingDouble(MatchCandidate::score).reversed());
        return candidates;
    }

    private Optional<UrlResolution> searchSequential(Song song, String query, String quality, List<String> sources, long deadline) {
        for (String source : sources) {
            if (System.nanoTime() > deadline) {
                logger.warn("Cross-source search for '{}' ran out of time before {}", song.name(), source);
                break;
            }
            Optional<UrlResolution> found = trySource(song, query, quality, source);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    private Optional<UrlResolution> searchParallel(Song song, String query, String quality, List<String> sources, long deadline) {
        CompletionService<Optional<UrlResolution>> completion = new ExecutorCompletionService<>(executor);
        List<Future<Optional<UrlResolution>>> futures = new ArrayList<>();
        for (String source : sources) {
            futures.add(completion.submit(() -> trySource(song, query, quality, source)));
        }
        try {
            for (int i = 0; i < futures.size(); i++) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    logger.warn("Parallel cross-source search for '{}' timed out", song.name());
                    break;
                }
                Future<Optional<UrlResolution>> done = completion.poll(remaining, TimeUnit.NANOSECONDS);
                if (done == null) {
                    logger.warn("Parallel cross-source search for '{}' timed out", song.name());
                    break;
                }
                Optional<UrlResolution> found = done.get();
                if (found.isPresent()) {
                    return found;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted during cross-source search for '{}'", song.name());
        } catch (ExecutionException e) {
            logger.warn("Cross-source task for '{}' failed: {}", song.name(), e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
        } finally {
            futures.forEach(f -> f.cancel(true));
        }
        return Optional.empty();
    }

    /**
     * Searches one source and tries its best candidates; records one stats outcome for the source.
     */
    private Optional<UrlResolution> trySource(Song song, String query, String quality, String source) {
        List<Song> hits;
        try {
            hits = chain.search(query, source);
        } catch (MusicResolutionException e) {
            if (ResolutionChain.isCancellation(e)) {
                Thread.currentThread().interrupt();
                logger.debug("Cross-source search on {} cancelled", source);
                return Optional.empty();
            }
            logger.warn("Cross-source search on {} failed: {}", source, e.getMessage());
            stats.recordFailure(source);
            return Optional.empty();
        }
        List<MatchCandidate> candidates = rankCandidates(song, hits);
        logger.debug("{} returned {} hits, {} above the similarity floor", source, hits.size(), candidates.size());
        int limit = Math.min(candidates.size(), config.preview().candidatesPerSource());
        for (MatchCandidate candidate : candidates.subList(0, limit)) {
            if (Thread.currentThread().isInterrupted()) break;
            Optional<UrlResolution> full = resolveCandidate(candidate, quality);
            if (full.isPresent()) {
                stats.recordSuccess(source);
                logger.info("Full version of '{}' found on {}: '{}' (score {})", song.name(), source,
                    candidate.song().name(), String.format("%.2f", candidate.score()));
                return full;
            }
        }
        if (Thread.currentThread().isInterrupted()) {
            logger.debug("Cross-source search on {} cancelled before a result", source);
            return Optional.empty();
        }
        stats.recordFailure(source);
        return Optional.empty();
    }

    private Optional<UrlResolution> resolveCandidate(MatchCandidate candidate, String quality) {
        Song match = candidate.song();
        for (String q : CANDIDATE_QUALITIES) {
            Optional<Resolution<ResolvedUrl>> resolved;
            try {
                resolved = chain.resolveDirect(match, q);
            } catch (MusicResolutionException e) {
                if (ResolutionChain.isCancellation(e)) {
                    Thread.currentThread().interrupt();
                    return Optional.empty();
                }
                logger.debug("No URL for candidate '{}' on {}: {}", match.name(), match.source(), e.getMessage());
                return Optional.empty();
            }
            if (resolved.isEmpty()) continue;
            ResolvedUrl url = resolved.get().value();
            if (detector.isLikelyPreview(url, match)) {
                logger.debug("Candidate '{}' on {} is also a preview at {}", match.name(), match.source(), q);
                return Optional.empty();
            }
            return Optional.of(new UrlResolution(url, match, resolved.get().providerName(), quality, q, false, true));
        }
        return Optional.empty();
    }
}
