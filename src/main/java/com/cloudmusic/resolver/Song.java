package com.cloudmusic.resolver;

import java.util.List;

/**
 * Immutable record representing a song returned by a search, playlist or catalog response.
 * <p>
 * Identity and lifecycle:
 * <ul>
 *   <li>{@code id} plus {@code source} (the catalog tag, e.g. "netease" or "kuwo") identify a track.</li>
 *   <li>Display metadata ({@code name}, {@code artists}, {@code album}) is normalized by the provider clients.</li>
 *   <li>{@code picId} and {@code lyricId} are opaque references handed back to the provider for covers and lyrics.</li>
 *   <li>{@code durationMs} is only known when the provider reports it; it feeds the preview detector.</li>
 * </ul>
 * Playlists and queues hold songs by value; there is no shared mutable song state.
 *
 * @author Music Resolver Team
 * @since 1.0
 */
public record Song(
    String id,
    String name,
    List<String> artists,
    String album,
    String picId,
    String lyricId,
    String source,
    String picUrl,
    Long durationMs
) {
    public Song {
        artists = artists == null ? List.of() : List.copyOf(artists);
        album = album == null ? "" : album;
        picId = picId == null ? "" : picId;
        lyricId = lyricId == null || lyricId.isBlank() ? id : lyricId;
        picUrl = picUrl == null ? "" : picUrl;
    }

    /**
     * Short form used by tests and callers that only know identity and display fields.
     */
    public Song(String id, String name, List<String> artists, String source) {
        this(id, name, artists, "", "", id, source, "", null);
    }

    /**
     * Returns the first listed artist, or an empty string when the provider reported none.
     */
    public String primaryArtist() {
        return artists.isEmpty() ? "" : artists.get(0);
    }

    /**
     * Artists joined for display, e.g. "A / B".
     */
    public String artistLine() {
        return String.join(" / ", artists);
    }

    /**
     * Key used to deduplicate concurrent work for the same track.
     */
    public String identityKey() {
        return id + "@" + source;
    }

    public Song withDurationMs(Long duration) {
        return new Song(id, name, artists, album, picId, lyricId, source, picUrl, duration);
    }
}
