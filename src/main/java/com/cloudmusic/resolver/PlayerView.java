package com.cloudmusic.resolver;

import java.util.List;

/**
 * Display surface of the player. Calls may arrive from background threads.
 */
public interface PlayerView {

    void showNotification(String message, NotificationType type);

    void showSong(Song song);

    void showCover(String coverUrl);

    void showLyrics(List<LyricLine> lines);
}
