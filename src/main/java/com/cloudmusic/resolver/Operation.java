package com.cloudmusic.resolver;

import java.time.Duration;

/**
 * Operations the resolution chain runs against providers. Each has its own timeout.
 */
public enum Operation {
    PROBE,
    SEARCH,
    URL,
    LYRICS,
    COVER,
    PLAYLIST;

    /**
     * Per-attempt timeout for this operation.
     */
    public Duration timeout(ResolverConfig config) {
        return switch (this) {
            case PROBE -> config.probeTimeout();
            case SEARCH -> config.searchTimeout();
            case URL, COVER -> config.songUrlTimeout();
            case LYRICS -> config.lyricsTimeout();
            case PLAYLIST -> config.playlistTimeout();
        };
    }
}
