package com.cloudmusic.resolver;

/**
 * Response-shape family of an upstream provider. Each kind has its own client that
 * parses and validates the provider's payloads into {@link Song} / {@link ResolvedUrl}.
 */
public enum ProviderKind {
    /** GD Studio aggregator: Meting-style query API, file size reported in KiB. */
    GDSTUDIO,
    /** Meting API mirrors: {@code ?types=...} query API. */
    METING,
    /** NeteaseCloudMusicApi Enhanced: REST paths, netease catalog only. */
    NEC
}
