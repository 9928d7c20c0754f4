package com.cloudmusic.resolver;

/**
 * A search hit scored against the track being recovered. Scores are in [0.0, 1.0].
 */
public record MatchCandidate(Song song, double score) {}
