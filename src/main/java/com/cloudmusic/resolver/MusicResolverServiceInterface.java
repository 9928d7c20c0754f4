package com.cloudmusic.resolver;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Interface for the UI-facing resolver API.
 */
public interface MusicResolverServiceInterface {

    /**
     * Resolves a URL ready to attach to the audio sink (https, proxied where required).
     */
    UrlResolution resolvePlayableUrl(Song song, String preferredQuality) throws MusicResolutionException;

    /**
     * @param keyword Search text
     * @param providerHint Catalog source to search; blank means netease
     */
    List<Song> search(String keyword, String providerHint) throws MusicResolutionException;

    /**
     * Discovery search: a netease search for one of a fixed set of popular artists, picked at random.
     * @return Matching songs, or an empty list when the search fails
     */
    List<Song> explore();

    LyricResult getLyrics(Song song) throws MusicResolutionException;

    String getCover(Song song);

    Playlist parsePlaylist(String urlOrId) throws MusicResolutionException;

    List<ProviderStatus> probeProviders();

    Optional<UrlResolution> findFullVersion(Song song, String quality);

    Map<String, SourceStats.Counter> sourceStats();
}
