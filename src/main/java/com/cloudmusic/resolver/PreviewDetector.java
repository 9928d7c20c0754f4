package com.cloudmusic.resolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies an audio asset as a likely truncated preview without downloading it.
 * <p>
 * Signals, any one of which flags the asset:
 * <ul>
 *   <li>the URL matches the preview marker pattern;</li>
 *   <li>the reported size is below the smallest plausible full track;</li>
 *   <li>the known track duration is inside the preview band and close to a typical truncation point.</li>
 * </ul>
 * The duration check is also re-run by the playback controller once the sink reports the real duration.
 *
 * @author Music Resolver Team
 * @since 1.0
 */
public class PreviewDetector {
    private static final Logger logger = LoggerFactory.getLogger(PreviewDetector.class);

    private final PreviewDetectionConfig config;

    public PreviewDetector(PreviewDetectionConfig config) {
        this.config = config;
    }

    /**
     * @param url Candidate asset
     * @param song Song metadata; its duration is used when known (may be null)
     * @return true if any signal marks the asset as a preview
     */
    public boolean isLikelyPreview(ResolvedUrl url, Song song) {
        if (url == null || url.isEmpty()) {
            return false;
        }
        if (config.urlMarkerPattern().matcher(url.url()).find()) {
            logger.debug("Preview marker in URL {}", url.url());
            return true;
        }
        if (url.sizeBytes() != null && url.sizeBytes() < config.minFileSizeBytes()) {
            logger.debug("Asset size {} below {} bytes", url.sizeBytes(), config.minFileSizeBytes());
            return true;
        }
        if (song != null && song.durationMs() != null && isPreviewDuration(song.durationMs() / 1000.0)) {
            logger.debug("Known duration {} ms of '{}' matches a preview length", song.durationMs(), song.name());
            return true;
        }
        return false;
    }

    /**
     * Duration rule: inside the preview band AND within tolerance of a typical preview length.
     * @param seconds Asset or track duration in seconds
     */
    public boolean isPreviewDuration(double seconds) {
        if (Double.isNaN(seconds) || Double.isInfinite(seconds)) {
            return false;
        }
        if (seconds < config.minDurationSec() || seconds > config.maxDurationSec()) {
            return false;
        }
        for (double typical : config.typicalDurationsSec()) {
            if (Math.abs(seconds - typical) <= config.durationToleranceSec()) {
                return true;
            }
        }
        return false;
    }
}
