package com.cloudmusic.resolver;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses LRC text into timed lines.
 * <p>
 * Each {@code [mm:ss.xx]} or {@code [mm:ss.xxx]} tag on a line produces one entry with the text that follows
 * the tags; two-digit fractions are hundredths. Lines without a time tag, metadata tags such as {@code [ar:...]}
 * and lines with empty text are skipped. The result is sorted by time.
 */
public final class LyricParser {
    private static final Pattern TIME_TAG = Pattern.compile("\\[(\\d{2}):(\\d{2})\\.(\\d{2,3})]");

    private LyricParser() {}

    public static List<LyricLine> parse(String lrc) {
        List<LyricLine> lines = new ArrayList<>();
        if (lrc == null || lrc.isBlank()) {
            return lines;
        }
        for (String raw : lrc.split("\\r?\\n")) {
            Matcher m = TIME_TAG.matcher(raw);
            List<Double> times = new ArrayList<>();
            int textStart = 0;
            while (m.find()) {
                int minutes = Integer.parseInt(m.group(1));
                int seconds = Integer.parseInt(m.group(2));
                String fraction = m.group(3);
                int millis = fraction.length() == 2 ? Integer.parseInt(fraction) * 10 : Integer.parseInt(fraction);
                times.add(minutes * 60 + seconds + millis / 1000.0);
                textStart = m.end();
            }
            String text = raw.substring(textStart).trim();
            if (times.isEmpty() || text.isEmpty()) continue;
            for (double time : times) {
                lines.add(new LyricLine(time, text));
            }
        }
        lines.sort(Comparator.comparingDouble(LyricLine::time));
        return lines;
    }
}
