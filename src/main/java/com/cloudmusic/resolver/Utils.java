package com.cloudmusic.resolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Utility class for configuration lookup, proxy URL rewriting and file naming.
 *
 * @author Music Resolver Team
 * @since 1.0
 */
public final class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    private Utils() {}

    /**
     * Sanitizes a filename by replacing each special character and whitespace with an underscore.
     * @param name Input filename
     * @return Sanitized filename
     */
    public static String sanitizeFilename(String name) {
        return name == null ? "" : name.replaceAll("[*?\"<>|/:\\s]", "_");
    }

    /**
     * Reads a setting from the environment, falling back to a JVM system property and then the default.
     * @param key Setting name
     * @param defaultVal Value used when neither source defines the key
     * @return Resolved value
     */
    public static String envOrProp(String key, String defaultVal) {
        try {
            String ev = System.getenv(key);
            if (ev != null) return ev;
        } catch (SecurityException e) {
            logger.debug("Environment lookup for {} denied: {}", key, e.getMessage());
        }
        String prop = System.getProperty(key);
        return prop != null ? prop : defaultVal;
    }

    static long envLong(String key, long defaultVal) {
        String raw = envOrProp(key, null);
        if (raw == null || raw.isBlank()) return defaultVal;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric value '{}' for {}; using {}", raw, key, defaultVal);
            return defaultVal;
        }
    }

    static double envDouble(String key, double defaultVal) {
        String raw = envOrProp(key, null);
        if (raw == null || raw.isBlank()) return defaultVal;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric value '{}' for {}; using {}", raw, key, defaultVal);
            return defaultVal;
        }
    }

    static List<String> envList(String key, List<String> defaultVal) {
        String raw = envOrProp(key, null);
        if (raw == null || raw.isBlank()) return defaultVal;
        List<String> values = new ArrayList<>();
        for (String part : raw.split(",")) {
            if (!part.isBlank()) values.add(part.trim());
        }
        return values;
    }

    static List<Double> envDoubleList(String key, List<Double> defaultVal) {
        List<String> raw = envList(key, null);
        if (raw == null) return defaultVal;
        List<Double> values = new ArrayList<>();
        for (String part : raw) {
            try {
                values.add(Double.parseDouble(part));
            } catch (NumberFormatException e) {
                logger.warn("Ignoring non-numeric entry '{}' in {}", part, key);
            }
        }
        return values.isEmpty() ? defaultVal : values;
    }

    /**
     * Wraps an external URL into a request to the allowlisting proxy.
     * @param proxyEndpoint Proxy endpoint, e.g. {@code /api/proxy}; blank means no proxy
     * @param url Original URL
     * @return Proxy URL, or the original URL when no proxy is configured or it is already proxied
     */
    public static String toProxyUrl(String proxyEndpoint, String url) {
        if (proxyEndpoint == null || proxyEndpoint.isBlank() || url == null || url.startsWith(proxyEndpoint)) {
            return url;
        }
        return proxyEndpoint + "?url=" + URLEncoder.encode(url, StandardCharsets.UTF_8);
    }

    /**
     * Checks whether an audio URL lives on one of the CDN hosts that must go through the proxy.
     * @param url Audio URL
     * @param domains Host suffixes from the proxy allowlist
     * @return true if the host matches one of the domains
     */
    public static boolean needsProxy(String url, List<String> domains) {
        if (url == null || url.isBlank() || domains == null) return false;
        String host;
        try {
            host = URI.create(url.trim()).getHost();
        } catch (IllegalArgumentException e) {
            logger.debug("Unparsable audio URL '{}': {}", url, e.getMessage());
            return false;
        }
        if (host == null) return false;
        String lower = host.toLowerCase(Locale.ROOT);
        for (String domain : domains) {
            String d = domain.toLowerCase(Locale.ROOT);
            if (lower.equals(d) || lower.endsWith("." + d)) return true;
        }
        return false;
    }

    /**
     * Produces the URL attached to the audio sink: plain http is upgraded to https and CDN hosts on the
     * allowlist are routed through the proxy.
     * @param url Resolved audio URL
     * @param config Resolver configuration supplying the proxy endpoint and allowlist
     * @return URL safe to hand to the audio sink
     */
    public static String toPlayableUrl(String url, ResolverConfig config) {
        if (url == null || url.isBlank()) return "";
        String audioUrl = url.trim().replaceFirst("^http:", "https:");
        if (needsProxy(audioUrl, config.proxyDomains())) {
            return toProxyUrl(config.proxyEndpoint(), audioUrl);
        }
        return audioUrl;
    }
}
