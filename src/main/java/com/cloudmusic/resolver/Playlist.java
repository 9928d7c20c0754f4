package com.cloudmusic.resolver;

import java.util.List;

/**
 * Immutable record representing a parsed playlist and its songs.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Built by {@link ResolutionChain#parsePlaylist(String)} from a playlist URL or numeric id.</li>
 *   <li>Songs are copies; queueing a playlist never shares mutable state with the caller.</li>
 * </ul>
 */
public record Playlist(String name, String id, List<Song> songs) {
    public Playlist {
        name = name == null || name.isBlank() ? "Untitled playlist" : name;
        songs = songs == null ? List.of() : List.copyOf(songs);
    }
}
