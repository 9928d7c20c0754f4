package com.cloudmusic.resolver;

/**
 * What happens when a track ends.
 */
public enum PlayMode {
    /** Advance through the queue and wrap around. */
    LOOP,
    /** Pick another track at random. */
    RANDOM,
    /** Repeat the current track. */
    SINGLE
}
