package com.cloudmusic.resolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * {@link HttpFetcher} backed by {@link HttpClient}.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Rewrites the upstream URL to {@code <proxyEndpoint>?url=<encoded>} when a proxy endpoint is configured.</li>
 *   <li>Applies the per-attempt timeout given by the caller.</li>
 *   <li>Retries transport failures and non-2xx answers up to {@code httpRetries} extra times, pausing
 *       {@code retryBackoff} between attempts.</li>
 *   <li>After the last attempt a non-2xx response is returned to the caller, a transport failure is rethrown.</li>
 * </ul>
 *
 * @author Music Resolver Team
 * @since 1.0
 */
public class ProxiedHttpFetcher implements HttpFetcher {
    private static final Logger logger = LoggerFactory.getLogger(ProxiedHttpFetcher.class);
    private static final String USER_AGENT = "MusicResolver/1.0";

    private final HttpClient client;
    private final String proxyEndpoint;
    private final int retries;
    private final Duration backoff;

    public ProxiedHttpFetcher(ResolverConfig config) {
        this(HttpClient.newBuilder()
                .connectTimeout(config.probeTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(),
            config.proxyEndpoint(), config.httpRetries(), config.retryBackoff());
    }

    ProxiedHttpFetcher(HttpClient client, String proxyEndpoint, int retries, Duration backoff) {
        this.client = client;
        this.proxyEndpoint = proxyEndpoint == null ? "" : proxyEndpoint;
        this.retries = Math.max(0, retries);
        this.backoff = backoff == null ? Duration.ZERO : backoff;
    }

    @Override
    public FetchResponse fetch(String url, Duration timeout) throws IOException {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("URL cannot be null or empty");
        }
        String requestUrl = Utils.toProxyUrl(proxyEndpoint, url);
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(requestUrl))
            .timeout(timeout)
            .header("User-Agent", USER_AGENT)
            .GET()
            .build();

        IOException lastError = null;
        FetchResponse lastResponse = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
                lastResponse = new FetchResponse(response.statusCode(), response.headers().map(), response.body());
                if (lastResponse.isOk()) {
                    return lastResponse;
                }
                lastError = null;
                logger.warn("Request to {} returned {} (attempt {}/{})", url, response.statusCode(), attempt + 1, retries + 1);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while fetching " + url);
            } catch (IOException e) {
                lastError = e;
                lastResponse = null;
                logger.warn("Request to {} failed (attempt {}/{}): {}", url, attempt + 1, retries + 1, e.getMessage());
            }
            if (attempt < retries) {
                pause();
            }
        }
        if (lastResponse != null) {
            return lastResponse;
        }
        throw lastError != null ? lastError : new IOException("All fetch attempts failed for " + url);
    }

    private void pause() throws InterruptedIOException {
        if (backoff.isZero() || backoff.isNegative()) return;
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted during retry backoff");
        }
    }
}
