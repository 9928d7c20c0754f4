package com.cloudmusic.resolver;

/**
 * Raw LRC lyric text with an optional translated LRC.
 */
public record LyricResult(String text, String translation) {
    public static final LyricResult EMPTY = new LyricResult("", "");

    public LyricResult {
        text = text == null ? "" : text;
        translation = translation == null ? "" : translation;
    }

    public boolean isEmpty() {
        return text.isBlank();
    }

    public boolean hasTranslation() {
        return !translation.isBlank();
    }
}
