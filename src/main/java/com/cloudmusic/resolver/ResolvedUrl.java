package com.cloudmusic.resolver;

/**
 * A playable audio URL as reported by a provider. Transient: produced per playback attempt.
 *
 * @param url          audio asset URL
 * @param bitrateLabel bitrate reported by the provider (e.g. "320"), or the requested one when absent
 * @param sizeBytes    asset size when the provider reports it, otherwise {@code null}
 */
public record ResolvedUrl(String url, String bitrateLabel, Long sizeBytes) {
    public ResolvedUrl {
        url = url == null ? "" : url.trim();
        bitrateLabel = bitrateLabel == null ? "" : bitrateLabel;
    }

    public boolean isEmpty() {
        return url.isEmpty();
    }
}
