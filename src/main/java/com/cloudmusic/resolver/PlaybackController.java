package com.cloudmusic.resolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives the audio sink through song changes without audible glitches.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Every user-initiated play takes a new generation id. After each blocking call the id is compared with
 *       the live counter; a stale continuation returns without touching the sink or the view.</li>
 *   <li>Source changes happen under one sink lock: fade out, attach, play, fade in to the listening volume.
 *       The generation is checked again inside the lock.</li>
 *   <li>A failed resolution or playback shows the error's user message and advances to the next track after the
 *       configured delay, unless the user has moved on.</li>
 *   <li>When the loaded asset turns out to be a preview, a full version is searched in the background and
 *       swapped in mid-playback, keeping the play head at {@code min(position, maxSeekOnSwitch)}.</li>
 * </ul>
 *
 * @author Music Resolver Team
 * @since 1.0
 */
public class PlaybackController implements AudioSinkListener {
    private static final Logger logger = LoggerFactory.getLogger(PlaybackController.class);
    static final double DEFAULT_VOLUME = 0.8;

    private final MusicResolverServiceInterface resolver;
    private final AudioSink sink;
    private final PlayerView view;
    private final VolumeFader fader;
    private final PreviewDetector detector;
    private final ResolverConfig config;
    private final ScheduledExecutorService executor;
    private final Random random;

    private final Object sinkLock = new Object();
    private final AtomicLong generation = new AtomicLong();
    private final AtomicBoolean swapInProgress = new AtomicBoolean();
    private final AtomicInteger fullVersionSearches = new AtomicInteger();
    private final Object historyLock = new Object();
    private final List<Song> history = new ArrayList<>();
    private int historyPosition = -1;

    private volatile List<Song> queue = List.of();
    private volatile int currentIndex = -1;
    private volatile Song currentSong;
    private volatile double listeningVolume = DEFAULT_VOLUME;
    private volatile double lastPosition;
    private volatile PlayMode playMode = PlayMode.LOOP;
    private volatile String quality;

    public PlaybackController(MusicResolverServiceInterface resolver, AudioSink sink, PlayerView view, VolumeFader fader,
                              PreviewDetector detector, ResolverConfig config, ScheduledExecutorService executor, Random random) {
        this.resolver = resolver;
        this.sink = sink;
        this.view = view;
        this.fader = fader;
        this.detector = detector;
        this.config = config;
        this.executor = executor;
        this.random = random;
        this.quality = config.defaultQuality();
        sink.addListener(this);
    }

    public PlaybackController(MusicResolverServiceInterface resolver, AudioSink sink, PlayerView view,
                              ResolverConfig config, ScheduledExecutorService executor) {
        this(resolver, sink, view, new VolumeFader(config, Sleeper.SYSTEM), new PreviewDetector(config.preview()),
            config, executor, new Random());
    }

    /**
     * Plays the song at {@code index} of {@code playlist}; blocks until the source is attached or the attempt is
     * abandoned.
     * @return true if this call attached the new source
     */
    public boolean playSong(int index, List<Song> playlist) {
        return play(index, playlist, false);
    }

    private boolean play(int index, List<Song> playlist, boolean fromHistory) {
        if (playlist == null || index < 0 || index >= playlist.size()) {
            throw new IllegalArgumentException("No song at index " + index);
        }
        long gen = generation.incrementAndGet();
        List<Song> songs = List.copyOf(playlist);
        Song song = songs.get(index);
        if (!fromHistory) {
            remember(song);
        }
        queue = songs;
        currentIndex = index;
        currentSong = song;
        fullVersionSearches.set(0);
        view.showSong(song);
        logger.info("Playing '{}' ({} of {}), generation {}", song.name(), index + 1, songs.size(), gen);

        UrlResolution resolution;
        try {
            resolution = resolver.resolvePlayableUrl(song, quality);
        } catch (MusicResolutionException e) {
            handleFailure(gen, song, e);
            return false;
        }
        if (isStale(gen)) {
            logger.debug("Discarding URL for '{}': generation {} superseded", song.name(), gen);
            return false;
        }
        try {
            if (!attach(gen, resolution.url(), -1)) {
                return false;
            }
        } catch (MusicResolutionException e) {
            handleFailure(gen, song, e);
            return false;
        }
        notifyResolution(resolution);
        loadExtras(gen, resolution.song());
        return true;
    }

    public void nextSong() {
        List<Song> songs = queue;
        if (songs.isEmpty()) return;
        int next = playMode == PlayMode.RANDOM ? randomIndex(songs.size()) : (currentIndex + 1) % songs.size();
        playSong(next, songs);
    }

    /**
     * Steps back through the play history. A remembered song that is no longer in the queue is played on its own;
     * with no history to go back to, the previous queue entry is played.
     */
    public void previousSong() {
        Song previous = null;
        synchronized (historyLock) {
            if (history.size() > 1 && historyPosition > 0) {
                historyPosition--;
                previous = history.get(historyPosition);
            }
        }
        List<Song> songs = queue;
        if (previous != null) {
            int index = indexOf(songs, previous);
            if (index >= 0) {
                play(index, songs, true);
            } else {
                play(0, List.of(previous), true);
            }
            return;
        }
        if (songs.isEmpty()) return;
        playSong((currentIndex - 1 + songs.size()) % songs.size(), songs);
    }

    /**
     * Played songs, most recent first.
     */
    public List<Song> playHistory() {
        synchronized (historyLock) {
            List<Song> songs = new ArrayList<>(history);
            Collections.reverse(songs);
            return songs;
        }
    }

    public void clearPlayHistory() {
        synchronized (historyLock) {
            history.clear();
            historyPosition = -1;
        }
    }

    public void togglePlay() {
        synchronized (sinkLock) {
            if (currentSong == null) return;
            if (!sink.isPaused()) {
                sink.pause();
                return;
            }
            try {
                sink.play();
            } catch (MusicResolutionException e) {
                logger.warn("Resume failed: {}", e.getMessage());
                view.showNotification(e.getUserMessage(), NotificationType.ERROR);
            }
        }
    }

    /**
     * Sets the listening volume that every fade-in ramps back up to.
     */
    public void setVolume(double level) {
        double volume = VolumeFader.clamp(level);
        listeningVolume = volume;
        synchronized (sinkLock) {
            sink.setVolume(volume);
        }
    }

    public void setPlayMode(PlayMode mode) {
        this.playMode = mode;
    }

    public void setQuality(String quality) {
        this.quality = quality;
    }

    @Override
    public void onLoadedMetadata(double durationSeconds) {
        Song song = currentSong;
        long gen = generation.get();
        if (song == null || !detector.isPreviewDuration(durationSeconds)) {
            return;
        }
        if (fullVersionSearches.get() >= config.maxFullVersionSearches()) {
            logger.debug("Full-version search limit reached for '{}'", song.name());
            return;
        }
        if (!swapInProgress.compareAndSet(false, true)) {
            return;
        }
        fullVersionSearches.incrementAndGet();
        logger.info("Loaded asset of '{}' is {} s long; looking for the full version", song.name(), durationSeconds);
        view.showNotification("Only a preview is playing, looking for the full version", NotificationType.INFO);
        try {
            executor.execute(() -> swapInFullVersion(gen, song));
        } catch (RuntimeException e) {
            swapInProgress.set(false);
            logger.warn("Could not schedule full-version search: {}", e.getMessage());
        }
    }

    @Override
    public void onEnded() {
        if (currentSong == null) return;
        if (playMode == PlayMode.SINGLE) {
            synchronized (sinkLock) {
                sink.setCurrentTime(0);
                try {
                    sink.play();
                } catch (MusicResolutionException e) {
                    handleFailure(generation.get(), currentSong, e);
                }
            }
            return;
        }
        nextSong();
    }

    @Override
    public void onError(String message) {
        Song song = currentSong;
        if (song == null) return;
        handleFailure(generation.get(), song, new MusicResolutionException(ErrorKind.PLAYBACK, "Audio sink error: " + message));
    }

    @Override
    public void onTimeUpdate(double positionSeconds) {
        lastPosition = positionSeconds;
    }

    public long generation() {
        return generation.get();
    }

    public Song currentSong() {
        return currentSong;
    }

    public int currentIndex() {
        return currentIndex;
    }

    public PlayMode playMode() {
        return playMode;
    }

    public double listeningVolume() {
        return listeningVolume;
    }

    public boolean isSwapInProgress() {
        return swapInProgress.get();
    }

    private boolean isStale(long gen) {
        return generation.get() != gen;
    }

    /**
     * Fades out, attaches the new source, optionally seeks, plays and fades back in.
     * @param seekTo Position to restore, or a negative value to start from the beginning
     * @return false if the generation moved on before the sink was touched
     */
    private boolean attach(long gen, String url, double seekTo) throws MusicResolutionException {
        synchronized (sinkLock) {
            if (isStale(gen)) {
                return false;
            }
            fader.fadeOut(sink);
            sink.setSource(url);
            if (seekTo > 0) {
                sink.setCurrentTime(seekTo);
            }
            sink.play();
            fader.fadeIn(sink, listeningVolume);
            return true;
        }
    }

    private void swapInFullVersion(long gen, Song song) {
        try {
            Optional<UrlResolution> full = resolver.findFullVersion(song, quality);
            if (full.isEmpty()) {
                if (!isStale(gen)) {
                    view.showNotification("No full version found, continuing with the preview", NotificationType.WARNING);
                }
                return;
            }
            if (isStale(gen)) {
                logger.debug("Discarding full version of '{}': generation {} superseded", song.name(), gen);
                return;
            }
            double position;
            synchronized (sinkLock) {
                position = sink.getCurrentTime();
            }
            if (Double.isNaN(position) || position <= 0) {
                position = lastPosition;
            }
            double seekTo = Math.min(position, config.maxSeekOnSwitchSec());
            if (attach(gen, full.get().url(), seekTo)) {
                logger.info("Swapped '{}' to the full version from {}", song.name(), full.get().song().source());
                view.showNotification("Switched to the full version from " + full.get().song().source(), NotificationType.SUCCESS);
            }
        } catch (MusicResolutionException e) {
            logger.warn("Mid-playback swap for '{}' failed: {}", song.name(), e.getMessage());
            if (!isStale(gen)) {
                view.showNotification(e.getUserMessage(), NotificationType.ERROR);
            }
        } finally {
            swapInProgress.set(false);
        }
    }

    private void notifyResolution(UrlResolution resolution) {
        if (resolution.crossSource()) {
            view.showNotification("Playing the full version from " + resolution.song().source(), NotificationType.SUCCESS);
        } else if (resolution.isDowngraded()) {
            view.showNotification("Quality " + resolution.requestedQuality() + " unavailable, playing "
                + resolution.obtainedQuality(), NotificationType.INFO);
        }
        if (resolution.preview()) {
            view.showNotification("Only a preview of this song is available", NotificationType.WARNING);
        }
    }

    private void loadExtras(long gen, Song song) {
        String cover = resolver.getCover(song);
        if (isStale(gen)) return;
        view.showCover(cover);
        try {
            LyricResult lyrics = resolver.getLyrics(song);
            if (isStale(gen)) return;
            view.showLyrics(LyricParser.parse(lyrics.text()));
        } catch (MusicResolutionException e) {
            logger.warn("Lyrics for '{}' unavailable: {}", song.name(), e.getMessage());
            if (!isStale(gen)) view.showLyrics(List.of());
        }
    }

    private void handleFailure(long gen, Song song, MusicResolutionException e) {
        if (isStale(gen)) {
            logger.debug("Ignoring failure of superseded generation {}: {}", gen, e.getMessage());
            return;
        }
        logger.warn("Playback of '{}' failed ({}): {}", song.name(), e.getKind(), e.getMessage());
        view.showNotification(e.getUserMessage(), NotificationType.ERROR);
        if (queue.size() < 2) return;
        try {
            executor.schedule(() -> {
                if (!isStale(gen)) {
                    nextSong();
                }
            }, config.autoAdvanceDelay().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RuntimeException ex) {
            logger.warn("Could not schedule auto-advance: {}", ex.getMessage());
        }
    }

    private void remember(Song song) {
        synchronized (historyLock) {
            if (historyPosition < history.size() - 1) {
                history.subList(historyPosition + 1, history.size()).clear();
            }
            history.add(song);
            historyPosition = history.size() - 1;
        }
    }

    private static int indexOf(List<Song> songs, Song song) {
        for (int i = 0; i < songs.size(); i++) {
            if (songs.get(i).identityKey().equals(song.identityKey())) {
                return i;
            }
        }
        return -1;
    }

    private int randomIndex(int size) {
        if (size < 2) return 0;
        int next;
        do {
            next = random.nextInt(size);
        } while (next == currentIndex);
        return next;
    }
}
