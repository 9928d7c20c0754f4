package com.cloudmusic.resolver;

/**
 * Events raised by an {@link AudioSink}.
 */
public interface AudioSinkListener {

    /**
     * The asset's metadata is available.
     * @param durationSeconds Real duration of the attached asset
     */
    void onLoadedMetadata(double durationSeconds);

    void onEnded();

    void onError(String message);

    default void onTimeUpdate(double positionSeconds) {}
}
