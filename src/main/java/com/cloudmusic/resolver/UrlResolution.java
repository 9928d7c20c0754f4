package com.cloudmusic.resolver;

/**
 * Outcome of resolving a playable URL for a song.
 *
 * @param resolvedUrl      the asset handed to the audio sink
 * @param song             the song the asset belongs to; differs from the requested song after a cross-source recovery
 * @param providerName     provider that produced the asset
 * @param requestedQuality quality the caller asked for
 * @param obtainedQuality  quality that actually produced the asset
 * @param preview          the asset is still believed to be a truncated preview
 * @param crossSource      the asset was recovered from an alternate source
 */
public record UrlResolution(
    ResolvedUrl resolvedUrl,
    Song song,
    String providerName,
    String requestedQuality,
    String obtainedQuality,
    boolean preview,
    boolean crossSource
) {
    /**
     * True when the caller should be told the preferred quality was unavailable.
     */
    public boolean isDowngraded() {
        return requestedQuality != null && !requestedQuality.equals(obtainedQuality);
    }

    public String url() {
        return resolvedUrl.url();
    }
}
