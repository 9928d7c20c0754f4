package com.cloudmusic.resolver;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

public class PlaybackControllerTest {
    private static final List<Song> QUEUE = List.of(
        new Song("1", "First", List.of("A"), "netease"),
        new Song("2", "Second", List.of("B"), "netease"),
        new Song("3", "Third", List.of("C"), "netease")
    );

    private FakeResolver resolver;
    private FakeAudioSink sink;
    private RecordingView view;
    private ScheduledExecutorService scheduler;
    private ResolverConfig config;
    private PlaybackController controller;

    @BeforeEach
    void setUp() {
        resolver = new FakeResolver();
        sink = new FakeAudioSink();
        view = new RecordingView();
        scheduler = Executors.newScheduledThreadPool(2);
        config = ResolverConfig.builder()
            .fade(Duration.ofMillis(40), 4)
            .playback(10, Duration.ofMillis(50), 2)
            .build();
        controller = new PlaybackController(resolver, sink, view, new VolumeFader(config, d -> { }),
            new PreviewDetector(config.preview()), config, scheduler, new Random(7));
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void playSongFadesOutSwapsAndFadesBackIn() {
        assertTrue(controller.playSong(0, QUEUE));

        assertEquals(List.of("https://cdn.example/1.mp3"), sink.sources());
        assertTrue(sink.events.indexOf("source:https://cdn.example/1.mp3") < sink.events.indexOf("play"));
        assertEquals(List.of(0.6, 0.4, 0.2, 0.0, 0.2, 0.4, 0.6, 0.8), roundedVolumes());
        assertEquals(0.8, sink.volume, 1e-9);
        assertEquals(1, controller.generation());
        assertEquals(QUEUE.get(0), view.songs.get(0));
    }

    @Test
    void coverAndLyricsAreShownAfterPlaybackStarts() {
        resolver.lyrics = new LyricResult("[00:01.00]one\n[00:02.50]two", "");

        controller.playSong(0, QUEUE);

        assertEquals(List.of("cover:1"), view.covers);
        assertEquals(2, view.lyrics.get(0).size());
        assertEquals(2.5, view.lyrics.get(0).get(1).time(), 1e-9);
    }

    @Test
    void staleResolutionNeverTouchesTheSink() throws Exception {
        CountDownLatch firstRequested = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        resolver.beforeResolve = song -> {
            if (song.id().equals("1")) {
                firstRequested.countDown();
                releaseFirst.await(5, TimeUnit.SECONDS);
            }
        };
        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> first = caller.submit(() -> controller.playSong(0, QUEUE));
            assertTrue(firstRequested.await(5, TimeUnit.SECONDS));

            assertTrue(controller.playSong(1, QUEUE));
            releaseFirst.countDown();

            assertFalse(first.get(5, TimeUnit.SECONDS));
            assertEquals(List.of("https://cdn.example/2.mp3"), sink.sources());
            assertEquals(QUEUE.get(1), controller.currentSong());
            assertEquals(List.of("cover:2"), view.covers);
        } finally {
            caller.shutdownNow();
        }
    }

    @Test
    void downgradeIsReported() {
        resolver.obtainedQuality = "128";

        controller.playSong(0, QUEUE);

        assertTrue(view.notifications.stream().anyMatch(n -> n.type() == NotificationType.INFO && n.message().contains("128")));
    }

    @Test
    void previewOnlyResultIsReported() {
        resolver.preview = true;

        controller.playSong(0, QUEUE);

        assertTrue(view.hasNotification(NotificationType.WARNING));
    }

    @Test
    void resolutionFailureShowsUserMessageAndAdvances() {
        resolver.failures.put("1", new MusicResolutionException(ErrorKind.UNRESOLVED, "nothing"));

        assertFalse(controller.playSong(0, QUEUE));

        assertTrue(view.notifications.stream().anyMatch(n -> n.type() == NotificationType.ERROR
            && n.message().equals(ErrorKind.UNRESOLVED.defaultUserMessage())));
        waitFor(() -> sink.sources().contains("https://cdn.example/2.mp3"));
        assertEquals(1, controller.currentIndex());
    }

    @Test
    void autoAdvanceIsCancelledWhenUserMovesOn() throws Exception {
        config = ResolverConfig.builder().fade(Duration.ofMillis(40), 4).playback(10, Duration.ofMillis(200), 2).build();
        controller = new PlaybackController(resolver, sink, view, new VolumeFader(config, d -> { }),
            new PreviewDetector(config.preview()), config, scheduler, new Random(7));
        resolver.failures.put("1", new MusicResolutionException(ErrorKind.NETWORK, "reset"));

        controller.playSong(0, QUEUE);
        controller.playSong(2, QUEUE);
        Thread.sleep(400);

        assertEquals(List.of("https://cdn.example/3.mp3"), sink.sources());
    }

    @Test
    void sinkPlaybackFailureIsReportedAsPlaybackError() {
        sink.playFailure = new MusicResolutionException(ErrorKind.PLAYBACK, "decode error");

        assertFalse(controller.playSong(0, QUEUE));

        assertTrue(view.notifications.stream().anyMatch(n -> n.message().equals(ErrorKind.PLAYBACK.defaultUserMessage())));
    }

    @Test
    void previewDetectedAfterLoadSwapsInFullVersionKeepingPosition() {
        controller.playSong(0, QUEUE);
        sink.currentTime = 25;
        resolver.fullVersion = Optional.of(resolution(new Song("k1", "First", List.of("A"), "kuwo"), "https://cdn.example/kuwo/k1.mp3", false, true));

        controller.onLoadedMetadata(30);

        waitFor(() -> sink.sources().size() == 2 && !controller.isSwapInProgress());
        assertEquals("https://cdn.example/kuwo/k1.mp3", sink.source);
        assertTrue(sink.events.contains("seek:10.0"));
        assertEquals(0.8, sink.volume, 1e-9);
        assertTrue(view.hasNotification(NotificationType.SUCCESS));
    }

    @Test
    void swapKeepsShortPosition() {
        controller.playSong(0, QUEUE);
        sink.currentTime = 4;
        resolver.fullVersion = Optional.of(resolution(QUEUE.get(0), "https://cdn.example/full.mp3", false, true));

        controller.onLoadedMetadata(60);

        waitFor(() -> sink.sources().size() == 2 && !controller.isSwapInProgress());
        assertTrue(sink.events.contains("seek:4.0"));
    }

    @Test
    void fullLengthAssetDoesNotTriggerSearch() {
        controller.playSong(0, QUEUE);

        controller.onLoadedMetadata(240);

        assertEquals(0, resolver.fullVersionCalls.get());
    }

    @Test
    void fullVersionSearchesAreLimitedPerTrack() {
        controller.playSong(0, QUEUE);

        for (int i = 0; i < 4; i++) {
            controller.onLoadedMetadata(30);
            waitFor(() -> !controller.isSwapInProgress());
        }

        assertEquals(2, resolver.fullVersionCalls.get());
        assertEquals(1, sink.sources().size());
    }

    @Test
    void staleFullVersionIsDiscarded() throws Exception {
        CountDownLatch searching = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        resolver.beforeFullVersion = () -> {
            searching.countDown();
            release.await(5, TimeUnit.SECONDS);
        };
        resolver.fullVersion = Optional.of(resolution(QUEUE.get(0), "https://cdn.example/late.mp3", false, true));
        controller.playSong(0, QUEUE);
        controller.onLoadedMetadata(30);
        assertTrue(searching.await(5, TimeUnit.SECONDS));

        controller.playSong(1, QUEUE);
        release.countDown();
        waitFor(() -> !controller.isSwapInProgress());

        assertFalse(sink.sources().contains("https://cdn.example/late.mp3"));
        assertEquals("https://cdn.example/2.mp3", sink.source);
    }

    @Test
    void endedTrackFollowsPlayMode() {
        controller.playSong(0, QUEUE);
        controller.setPlayMode(PlayMode.SINGLE);
        controller.onEnded();
        assertTrue(sink.events.contains("seek:0.0"));
        assertEquals(0, controller.currentIndex());

        controller.setPlayMode(PlayMode.LOOP);
        controller.onEnded();
        assertEquals(1, controller.currentIndex());

        controller.setPlayMode(PlayMode.RANDOM);
        controller.onEnded();
        assertNotEquals(1, controller.currentIndex());
    }

    @Test
    void nextAndPreviousWrapAround() {
        controller.playSong(2, QUEUE);
        controller.nextSong();
        assertEquals(0, controller.currentIndex());
        controller.previousSong();
        assertEquals(2, controller.currentIndex());
    }

    @Test
    void previousWalksPlayHistoryInRandomMode() {
        controller.setPlayMode(PlayMode.RANDOM);
        controller.playSong(0, QUEUE);
        controller.playSong(2, QUEUE);
        controller.playSong(1, QUEUE);

        controller.previousSong();
        assertEquals(2, controller.currentIndex());
        controller.previousSong();
        assertEquals(0, controller.currentIndex());
        assertEquals(List.of("2", "3", "1"), controller.playHistory().stream().map(Song::id).toList());
    }

    @Test
    void playingAfterSteppingBackDropsForwardHistory() {
        controller.playSong(0, QUEUE);
        controller.playSong(1, QUEUE);
        controller.previousSong();

        controller.playSong(2, QUEUE);

        assertEquals(List.of("3", "1"), controller.playHistory().stream().map(Song::id).toList());
    }

    @Test
    void rememberedSongOutsideQueueIsPlayedAlone() {
        Song elsewhere = new Song("9", "Elsewhere", List.of("Z"), "kuwo");
        controller.playSong(0, List.of(elsewhere));
        controller.playSong(1, QUEUE);

        controller.previousSong();

        assertEquals(elsewhere, controller.currentSong());
        assertEquals("https://cdn.example/9.mp3", sink.source);
    }

    @Test
    void previousWithoutHistoryStepsBackInQueue() {
        controller.playSong(0, QUEUE);
        controller.clearPlayHistory();

        controller.previousSong();

        assertEquals(2, controller.currentIndex());
    }

    @Test
    void volumeIsClampedAndUsedAsFadeTarget() {
        controller.setVolume(1.7);
        assertEquals(1.0, controller.listeningVolume(), 1e-9);
        controller.setVolume(0.5);

        controller.playSong(0, QUEUE);

        assertEquals(0.5, sink.volume, 1e-9);
    }

    @Test
    void togglePlayPausesAndResumes() {
        controller.playSong(0, QUEUE);
        controller.togglePlay();
        assertTrue(sink.isPaused());
        controller.togglePlay();
        assertFalse(sink.isPaused());
    }

    @Test
    void sinkErrorEventIsReported() {
        controller.playSong(0, QUEUE);

        sink.listeners.forEach(l -> l.onError("MEDIA_ERR_SRC_NOT_SUPPORTED"));

        assertTrue(view.notifications.stream().anyMatch(n -> n.message().equals(ErrorKind.PLAYBACK.defaultUserMessage())));
        waitFor(() -> controller.currentIndex() == 1);
    }

    private List<Double> roundedVolumes() {
        synchronized (sink.volumes) {
            return sink.volumes.stream().map(v -> Math.round(v * 100) / 100.0).toList();
        }
    }

    private static UrlResolution resolution(Song song, String url, boolean preview, boolean crossSource) {
        return new UrlResolution(new ResolvedUrl(url, "320", 8_000_000L), song, "fake", "320", "320", preview, crossSource);
    }

    private static void waitFor(BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within 5 seconds");
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted");
            }
        }
    }

    /**
     * Resolver returning {@code https://cdn.example/<id>.mp3} for every song unless told otherwise.
     */
    static class FakeResolver implements MusicResolverServiceInterface {
        interface Hook {
            void run(Song song) throws Exception;
        }

        interface Blocker {
            void run() throws Exception;
        }

        final Map<String, MusicResolutionException> failures = new ConcurrentHashMap<>();
        final AtomicInteger fullVersionCalls = new AtomicInteger();
        volatile Hook beforeResolve = song -> { };
        volatile Blocker beforeFullVersion = () -> { };
        volatile String obtainedQuality = "320";
        volatile boolean preview;
        volatile LyricResult lyrics = LyricResult.EMPTY;
        volatile Optional<UrlResolution> fullVersion = Optional.empty();

        @Override
        public UrlResolution resolvePlayableUrl(Song song, String preferredQuality) throws MusicResolutionException {
            try {
                beforeResolve.run(song);
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
            MusicResolutionException failure = failures.get(song.id());
            if (failure != null) throw failure;
            return new UrlResolution(new ResolvedUrl("https://cdn.example/" + song.id() + ".mp3", obtainedQuality, 8_000_000L),
                song, "fake", preferredQuality, obtainedQuality, preview, false);
        }

        @Override
        public List<Song> search(String keyword, String providerHint) {
            return List.of();
        }

        @Override
        public List<Song> explore() {
            return List.of();
        }

        @Override
        public LyricResult getLyrics(Song song) {
            return lyrics;
        }

        @Override
        public String getCover(Song song) {
            return "cover:" + song.id();
        }

        @Override
        public Playlist parsePlaylist(String urlOrId) {
            return new Playlist("", urlOrId, List.of());
        }

        @Override
        public List<ProviderStatus> probeProviders() {
            return List.of();
        }

        @Override
        public Optional<UrlResolution> findFullVersion(Song song, String quality) {
            fullVersionCalls.incrementAndGet();
            try {
                beforeFullVersion.run();
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
            return fullVersion;
        }

        @Override
        public Map<String, SourceStats.Counter> sourceStats() {
            return Map.of();
        }
    }
}
