package com.cloudmusic.resolver;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Client for NeteaseCloudMusicApi Enhanced deployments ({@link ProviderKind#NEC}).
 * <p>
 * Only the netease catalog is served, so operations on songs from other sources are reported as
 * unsupported. Every payload carries a {@code code} field that must be 200.
 */
public class NecProviderClient extends AbstractProviderClient {
    static final String NETEASE = "netease";
    private static final int SEARCH_LIMIT = 30;
    private static final int PLAYLIST_TRACK_LIMIT = 100;

    public NecProviderClient(ProviderDescriptor descriptor, HttpFetcher fetcher, ResolverConfig config) {
        super(descriptor, fetcher, config);
    }

    @Override
    public boolean supports(Operation operation, String source) {
        return switch (operation) {
            case PROBE, PLAYLIST -> true;
            case SEARCH -> descriptor.supportsSearch() && NETEASE.equals(source);
            default -> NETEASE.equals(source);
        };
    }

    @Override
    public void probe() throws MusicResolutionException {
        requireOk(getJson(baseUrl() + "/search?keywords=test&limit=1", Operation.PROBE), "probe");
    }

    @Override
    public List<Song> search(String keyword, String source) throws MusicResolutionException {
        JsonNode root = requireOk(getJson(baseUrl() + "/search?keywords=" + enc(keyword) + "&limit=" + SEARCH_LIMIT, Operation.SEARCH), "search");
        JsonNode songs = root.path("result").path("songs");
        if (!songs.isArray()) {
            return List.of();
        }
        return mapSongs(songs, node -> toSong(node, node.path("artists"), node.path("album"), positiveLong(node, "duration")), "search result");
    }

    @Override
    public ResolvedUrl songUrl(Song song, String quality) throws MusicResolutionException {
        String url = baseUrl() + "/song/url/v1?id=" + enc(song.id()) + "&level=" + levelFor(quality);
        JsonNode root = requireOk(getJson(url, Operation.URL), "song url");
        JsonNode data = root.path("data");
        if (!data.isArray() || data.isEmpty()) {
            throw MusicResolutionException.upstream(descriptor.name() + " song url response has no data");
        }
        JsonNode first = data.get(0);
        Long br = positiveLong(first, "br");
        String bitrate = br == null ? quality : Long.toString(br >= 1000 ? br / 1000 : br);
        return new ResolvedUrl(text(first, "url"), bitrate, positiveLong(first, "size"));
    }

    @Override
    public LyricResult lyrics(Song song) throws MusicResolutionException {
        JsonNode root = requireOk(getJson(baseUrl() + "/lyric?id=" + enc(song.id()), Operation.LYRICS), "lyric");
        return new LyricResult(text(root.path("lrc"), "lyric"), text(root.path("tlyric"), "lyric"));
    }

    @Override
    public String cover(Song song, int size) {
        if (song.picId().isEmpty()) {
            return "";
        }
        return "https://p1.music.126.net/" + song.picId() + "/" + song.picId() + ".jpg?param=" + size + "y" + size;
    }

    @Override
    public Playlist playlist(String playlistId) throws MusicResolutionException {
        JsonNode detail = requireOk(getJson(baseUrl() + "/playlist/detail?id=" + enc(playlistId), Operation.PLAYLIST), "playlist detail");
        JsonNode playlist = detail.path("playlist");
        if (!playlist.isObject()) {
            throw MusicResolutionException.upstream(descriptor.name() + " playlist detail has no playlist");
        }
        List<String> trackIds = new ArrayList<>();
        for (JsonNode track : playlist.path("trackIds")) {
            String id = text(track, "id");
            if (!id.isEmpty()) trackIds.add(id);
            if (trackIds.size() >= PLAYLIST_TRACK_LIMIT) break;
        }
        if (trackIds.isEmpty()) {
            return new Playlist(text(playlist, "name"), playlistId, List.of());
        }
        JsonNode songs = requireOk(getJson(baseUrl() + "/song/detail?ids=" + enc(String.join(",", trackIds)), Operation.PLAYLIST), "song detail")
            .path("songs");
        if (!songs.isArray()) {
            throw MusicResolutionException.upstream(descriptor.name() + " song detail has no songs");
        }
        List<Song> mapped = mapSongs(songs, node -> toSong(node, node.path("ar"), node.path("al"), positiveLong(node, "dt")), "song detail");
        return new Playlist(text(playlist, "name"), playlistId, mapped);
    }

    static String levelFor(String quality) {
        return switch (quality == null ? "" : quality) {
            case "999" -> "hires";
            case "740" -> "lossless";
            case "320" -> "exhigh";
            default -> "standard";
        };
    }

    private Song toSong(JsonNode node, JsonNode artistsNode, JsonNode albumNode, Long durationMs) throws MusicResolutionException {
        String id = requireText(node, "id", "song");
        return new Song(
            id,
            requireText(node, "name", "song"),
            artists(artistsNode),
            text(albumNode, "name"),
            text(albumNode, "id"),
            id,
            NETEASE,
            text(albumNode, "picUrl"),
            durationMs
        );
    }

    private JsonNode requireOk(JsonNode root, String context) throws MusicResolutionException {
        int code = root.path("code").asInt(-1);
        if (code != 200) {
            throw MusicResolutionException.upstream(descriptor.name() + " " + context + " returned code " + code);
        }
        return root;
    }
}
