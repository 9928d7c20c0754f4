package com.cloudmusic.resolver;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Client for Meting-style aggregators ({@link ProviderKind#METING}) and GD Studio ({@link ProviderKind#GDSTUDIO}).
 * <p>
 * Both speak the {@code ?types=search|url|lyric|pic|playlist} query API:
 * <ul>
 *   <li>search: array of {@code {id, name, artist, album, pic_id, lyric_id, source}}; artist is a string or an array.</li>
 *   <li>url: {@code {url, br, size}}; GD Studio reports {@code size} in KiB, Meting mirrors in bytes.</li>
 *   <li>lyric: {@code {lyric, tlyric}}.</li>
 *   <li>pic: {@code {url}}.</li>
 *   <li>playlist: an array of songs or {@code {name, songs}}.</li>
 *   <li>Failures come back as {@code {error}} or {@code {msg}} objects with a 200 status.</li>
 * </ul>
 *
 * @author Music Resolver Team
 * @since 1.0
 */
public class MetingProviderClient extends AbstractProviderClient {
    private static final Logger logger = LoggerFactory.getLogger(MetingProviderClient.class);
    private static final int SEARCH_COUNT = 30;

    public MetingProviderClient(ProviderDescriptor descriptor, HttpFetcher fetcher, ResolverConfig config) {
        super(descriptor, fetcher, config);
    }

    @Override
    public boolean supports(Operation operation, String source) {
        return switch (operation) {
            case SEARCH -> descriptor.supportsSearch();
            default -> true;
        };
    }

    @Override
    public void probe() throws MusicResolutionException {
        JsonNode root = getJson(baseUrl() + "?types=search&source=netease&name=test&count=1", Operation.PROBE);
        rejectErrorObject(root, "probe");
    }

    @Override
    public List<Song> search(String keyword, String source) throws MusicResolutionException {
        String url = baseUrl() + "?types=search&source=" + enc(source) + "&name=" + enc(keyword) + "&count=" + SEARCH_COUNT;
        JsonNode root = getJson(url, Operation.SEARCH);
        rejectErrorObject(root, "search");
        if (!root.isArray()) {
            throw MusicResolutionException.upstream(descriptor.name() + " search returned " + root.getNodeType() + " instead of an array");
        }
        List<Song> songs = mapSongs(root, node -> toSong(node, source), "search result");
        logger.debug("{} search '{}' on {} returned {} songs", descriptor.name(), keyword, source, songs.size());
        return songs;
    }

    @Override
    public ResolvedUrl songUrl(Song song, String quality) throws MusicResolutionException {
        String url = baseUrl() + "?types=url&source=" + enc(song.source()) + "&id=" + enc(song.id()) + "&br=" + enc(quality);
        JsonNode root = getJson(url, Operation.URL);
        rejectErrorObject(root, "url");
        if (!root.isObject() || !root.has("url")) {
            throw MusicResolutionException.upstream(descriptor.name() + " url response is missing 'url'");
        }
        String bitrate = text(root, "br");
        Long size = positiveLong(root, "size");
        if (size != null && descriptor.kind() == ProviderKind.GDSTUDIO) {
            size = size * 1024;
        }
        return new ResolvedUrl(text(root, "url"), bitrate.isEmpty() ? quality : bitrate, size);
    }

    @Override
    public LyricResult lyrics(Song song) throws MusicResolutionException {
        String url = baseUrl() + "?types=lyric&source=" + enc(song.source()) + "&id=" + enc(song.lyricId());
        JsonNode root = getJson(url, Operation.LYRICS);
        rejectErrorObject(root, "lyric");
        if (!root.isObject()) {
            throw MusicResolutionException.upstream(descriptor.name() + " lyric response is not an object");
        }
        return new LyricResult(text(root, "lyric"), text(root, "tlyric"));
    }

    @Override
    public String cover(Song song, int size) throws MusicResolutionException {
        String url = baseUrl() + "?types=pic&source=" + enc(song.source()) + "&id=" + enc(song.picId()) + "&size=" + size;
        JsonNode root = getJson(url, Operation.COVER);
        rejectErrorObject(root, "pic");
        return text(root, "url");
    }

    @Override
    public Playlist playlist(String playlistId) throws MusicResolutionException {
        JsonNode root = getJson(baseUrl() + "?types=playlist&source=netease&id=" + enc(playlistId), Operation.PLAYLIST);
        rejectErrorObject(root, "playlist");
        JsonNode songsNode;
        String name = "";
        if (root.isArray()) {
            songsNode = root;
        } else if (root.path("songs").isArray()) {
            songsNode = root.path("songs");
            name = text(root, "name");
        } else {
            throw MusicResolutionException.upstream(descriptor.name() + " playlist response has no songs");
        }
        return new Playlist(name, playlistId, mapSongs(songsNode, node -> toSong(node, "netease"), "playlist entry"));
    }

    private Song toSong(JsonNode node, String requestedSource) throws MusicResolutionException {
        String id = requireText(node, "id", "song");
        String name = requireText(node, "name", "song");
        String source = text(node, "source");
        Long duration = positiveLong(node, "duration");
        return new Song(
            id,
            name,
            artists(node.path("artist")),
            text(node, "album"),
            text(node, "pic_id"),
            text(node, "lyric_id"),
            source.isEmpty() ? requestedSource : source,
            text(node, "pic"),
            duration
        );
    }

    private void rejectErrorObject(JsonNode root, String context) throws MusicResolutionException {
        if (root.isObject()) {
            String error = text(root, "error");
            if (error.isEmpty()) error = text(root, "msg");
            if (!error.isEmpty()) {
                throw MusicResolutionException.upstream(descriptor.name() + " " + context + " error: " + error);
            }
        }
    }
}
