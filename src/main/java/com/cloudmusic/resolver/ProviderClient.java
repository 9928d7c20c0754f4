package com.cloudmusic.resolver;

import java.util.List;

/**
 * Client for one upstream provider. Implementations parse the provider's payloads and validate
 * them into the internal model; nothing untyped leaves a client.
 * <p>
 * Every call is one attempt: a transport problem is reported as {@link ErrorKind#NETWORK}, an error
 * status or malformed body as {@link ErrorKind#UPSTREAM}. A well-formed answer with nothing in it is
 * not an error (empty list, empty {@link ResolvedUrl}, {@link LyricResult#EMPTY}).
 */
public interface ProviderClient {

    ProviderDescriptor descriptor();

    /**
     * Capability check. Unsupported operations are skipped by the chain without counting as failures.
     * @param operation Operation about to run
     * @param source Catalog source of the song or search ({@code null} when not applicable)
     */
    boolean supports(Operation operation, String source);

    /**
     * Cheap availability check.
     */
    void probe() throws MusicResolutionException;

    List<Song> search(String keyword, String source) throws MusicResolutionException;

    ResolvedUrl songUrl(Song song, String quality) throws MusicResolutionException;

    LyricResult lyrics(Song song) throws MusicResolutionException;

    /**
     * @return Cover image URL, or an empty string when the provider has none
     */
    String cover(Song song, int size) throws MusicResolutionException;

    Playlist playlist(String playlistId) throws MusicResolutionException;
}
