package com.cloudmusic.resolver;

/**
 * Error taxonomy surfaced to callers of the resolver.
 */
public enum ErrorKind {
    /** Transport failure or timeout. */
    NETWORK("Network request failed, please check your connection"),
    /** Provider answered with an error status or an unparsable body. */
    UPSTREAM("The music service returned an error, please try again later"),
    /** Every provider was tried and none produced a usable asset. */
    UNRESOLVED("No playable source could be found for this song"),
    /** The audio sink rejected or failed the asset. */
    PLAYBACK("Playback failed, skipping to the next song");

    private final String defaultUserMessage;

    ErrorKind(String defaultUserMessage) {
        this.defaultUserMessage = defaultUserMessage;
    }

    public String defaultUserMessage() {
        return defaultUserMessage;
    }
}
