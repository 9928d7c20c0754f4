package com.cloudmusic.resolver;

/**
 * One timed lyric line; {@code time} is in seconds from the start of the track.
 */
public record LyricLine(double time, String text) {}
