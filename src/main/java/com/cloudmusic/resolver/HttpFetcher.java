package com.cloudmusic.resolver;

import java.io.IOException;
import java.time.Duration;

/**
 * The outbound HTTP capability consumed by provider clients.
 * <p>
 * Implementations route requests through the allowlisting proxy where one is configured and
 * return non-2xx responses as {@link FetchResponse}s only when they have given up retrying.
 */
public interface HttpFetcher {
    /**
     * Performs a GET request.
     * @param url Absolute upstream URL
     * @param timeout Per-attempt timeout
     * @return The response of the last attempt
     * @throws IOException on transport failure or timeout after all retries
     */
    FetchResponse fetch(String url, Duration timeout) throws IOException;
}
