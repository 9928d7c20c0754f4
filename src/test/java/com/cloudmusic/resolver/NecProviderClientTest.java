package com.cloudmusic.resolver;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NecProviderClientTest {
    private static final ResolverConfig CONFIG = ResolverConfig.defaults();
    private static final ProviderDescriptor NEC = new ProviderDescriptor("nec", "https://nec.example", ProviderKind.NEC, true, false);
    private static final Song SONG = new Song("186016", "Sunny Day", List.of("Jay"), "netease");

    private final FakeHttpFetcher fetcher = new FakeHttpFetcher();
    private final ProviderClient client = ProviderClients.create(NEC, fetcher, CONFIG);

    @Test
    void servesOnlyTheNeteaseCatalog() {
        assertTrue(client.supports(Operation.SEARCH, "netease"));
        assertFalse(client.supports(Operation.SEARCH, "kuwo"));
        assertFalse(client.supports(Operation.URL, "tencent"));
        assertTrue(client.supports(Operation.PLAYLIST, null));
        assertTrue(client.supports(Operation.PROBE, null));
    }

    @Test
    void searchMapsResultSongs() throws Exception {
        fetcher.json("/search?", "{\"code\": 200, \"result\": {\"songs\": ["
            + "{\"id\": 186016, \"name\": \"Sunny Day\", \"artists\": [{\"name\": \"Jay\"}], \"album\": {\"id\": 18905, \"name\": \"Ye Hui Mei\"}, \"duration\": 269000}"
            + "]}}");

        List<Song> songs = client.search("sunny", "netease");

        Song song = songs.get(0);
        assertEquals("186016", song.id());
        assertEquals(List.of("Jay"), song.artists());
        assertEquals("Ye Hui Mei", song.album());
        assertEquals(269_000L, song.durationMs());
        assertEquals("netease", song.source());
    }

    @Test
    void searchWithoutResultIsEmpty() throws Exception {
        fetcher.json("/search?", "{\"code\": 200, \"result\": {}}");
        assertTrue(client.search("nothing", "netease").isEmpty());
    }

    @Test
    void nonOkCodeIsUpstreamError() {
        fetcher.json("/search?", "{\"code\": 405, \"msg\": \"too frequent\"}");

        MusicResolutionException e = assertThrows(MusicResolutionException.class, () -> client.search("x", "netease"));
        assertEquals(ErrorKind.UPSTREAM, e.getKind());
    }

    @Test
    void songUrlMapsQualityToLevel() throws Exception {
        fetcher.json("/song/url/v1", "{\"code\": 200, \"data\": [{\"url\": \"http://m701.music.126.net/x.mp3\", \"br\": 320000, \"size\": 10000000}]}");

        ResolvedUrl url = client.songUrl(SONG, "320");

        assertEquals("320", url.bitrateLabel());
        assertEquals(10_000_000L, url.sizeBytes());
        assertTrue(fetcher.requests.get(0).endsWith("/song/url/v1?id=186016&level=exhigh"));
    }

    @Test
    void levelMapping() {
        assertEquals("hires", NecProviderClient.levelFor("999"));
        assertEquals("lossless", NecProviderClient.levelFor("740"));
        assertEquals("exhigh", NecProviderClient.levelFor("320"));
        assertEquals("standard", NecProviderClient.levelFor("128"));
        assertEquals("standard", NecProviderClient.levelFor(null));
    }

    @Test
    void missingUrlInDataIsEmptyResult() throws Exception {
        fetcher.json("/song/url/v1", "{\"code\": 200, \"data\": [{\"url\": null, \"br\": 0}]}");
        assertTrue(client.songUrl(SONG, "999").isEmpty());
    }

    @Test
    void coverIsBuiltFromPicId() throws Exception {
        Song song = new Song("1", "x", List.of(), "", "109951163", "1", "netease", "", null);
        assertEquals("https://p1.music.126.net/109951163/109951163.jpg?param=300y300", client.cover(song, 300));
        assertTrue(fetcher.requests.isEmpty());
    }

    @Test
    void lyricsReadLrcAndTranslation() throws Exception {
        fetcher.json("/lyric?", "{\"code\": 200, \"lrc\": {\"lyric\": \"[00:00.50]a\"}, \"tlyric\": {\"lyric\": \"\"}}");

        LyricResult lyrics = client.lyrics(SONG);

        assertEquals("[00:00.50]a", lyrics.text());
        assertFalse(lyrics.hasTranslation());
    }

    @Test
    void playlistFetchesDetailThenSongs() throws Exception {
        fetcher.json("/playlist/detail", "{\"code\": 200, \"playlist\": {\"name\": \"Road Trip\", \"trackIds\": [{\"id\": 11}, {\"id\": 12}]}}");
        fetcher.json("/song/detail", "{\"code\": 200, \"songs\": ["
            + "{\"id\": 11, \"name\": \"Eleven\", \"ar\": [{\"name\": \"A\"}], \"al\": {\"name\": \"L\", \"picUrl\": \"https://p1.music.126.net/c.jpg\"}, \"dt\": 200000},"
            + "{\"id\": 12, \"name\": \"Twelve\", \"ar\": [{\"name\": \"B\"}], \"al\": {\"name\": \"M\"}, \"dt\": 180000}"
            + "]}");

        Playlist playlist = client.playlist("77");

        assertEquals("Road Trip", playlist.name());
        assertEquals(2, playlist.songs().size());
        assertEquals("https://p1.music.126.net/c.jpg", playlist.songs().get(0).picUrl());
        assertTrue(fetcher.requests.get(1).contains("ids=11%2C12"));
        assertEquals(CONFIG.playlistTimeout(), fetcher.timeouts.get(0));
    }
}
