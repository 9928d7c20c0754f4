package com.cloudmusic.resolver;

/**
 * The audio element the player drives. Implementations wrap the actual audio primitive; times are in seconds
 * and volume is in [0.0, 1.0].
 */
public interface AudioSink {

    void setSource(String url);

    String getSource();

    /**
     * Starts or resumes playback.
     * @throws MusicResolutionException of kind {@link ErrorKind#PLAYBACK} if the asset cannot be played
     */
    void play() throws MusicResolutionException;

    void pause();

    boolean isPaused();

    double getCurrentTime();

    void setCurrentTime(double seconds);

    /**
     * @return Duration of the attached asset, or {@code Double.NaN} before metadata is loaded
     */
    double getDuration();

    double getVolume();

    void setVolume(double volume);

    void addListener(AudioSinkListener listener);
}
