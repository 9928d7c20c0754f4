package com.cloudmusic.resolver;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Status, headers and body of a completed HTTP exchange.
 */
public record FetchResponse(int status, Map<String, List<String>> headers, String body) {
    public FetchResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? "" : body;
    }

    public static FetchResponse json(int status, String body) {
        return new FetchResponse(status, Map.of("content-type", List.of("application/json")), body);
    }

    public boolean isOk() {
        return status >= 200 && status < 300;
    }

    /**
     * First Content-Type header value, lowercased, or an empty string.
     */
    public String contentType() {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase("content-type") && !entry.getValue().isEmpty()) {
                return entry.getValue().get(0).toLowerCase(Locale.ROOT);
            }
        }
        return "";
    }
}
