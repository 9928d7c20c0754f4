package com.cloudmusic.resolver;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared plumbing for provider clients: fetching, status and content-type checks, JSON parsing and
 * the field readers used while normalizing payloads.
 * <p>
 * Error handling:
 * <ul>
 *   <li>{@link IOException} from the fetcher becomes {@link ErrorKind#NETWORK}.</li>
 *   <li>Non-2xx status, HTML/text bodies, empty bodies and unparsable JSON become {@link ErrorKind#UPSTREAM}.</li>
 * </ul>
 *
 * @author Music Resolver Team
 * @since 1.0
 */
abstract class AbstractProviderClient implements ProviderClient {
    private static final Logger logger = LoggerFactory.getLogger(AbstractProviderClient.class);
    protected static final ObjectMapper MAPPER = new ObjectMapper();

    protected final ProviderDescriptor descriptor;
    protected final HttpFetcher fetcher;
    protected final ResolverConfig config;

    protected AbstractProviderClient(ProviderDescriptor descriptor, HttpFetcher fetcher, ResolverConfig config) {
        this.descriptor = descriptor;
        this.fetcher = fetcher;
        this.config = config;
    }

    @Override
    public ProviderDescriptor descriptor() {
        return descriptor;
    }

    /**
     * Fetches a URL and parses the body as JSON.
     * @param url Upstream URL
     * @param operation Operation, selects the timeout
     * @return Parsed body, never null
     */
    protected JsonNode getJson(String url, Operation operation) throws MusicResolutionException {
        FetchResponse response;
        try {
            response = fetcher.fetch(url, operation.timeout(config));
        } catch (IOException e) {
            throw new MusicResolutionException(ErrorKind.NETWORK,
                descriptor.name() + " " + operation + " request failed: " + e.getMessage(), e);
        }
        if (!response.isOk()) {
            throw MusicResolutionException.upstream(descriptor.name() + " returned HTTP " + response.status());
        }
        String contentType = response.contentType();
        if (contentType.contains("html") || contentType.startsWith("text/xml")) {
            throw MusicResolutionException.upstream(descriptor.name() + " returned unexpected content type " + contentType);
        }
        if (response.body().isBlank()) {
            throw MusicResolutionException.upstream(descriptor.name() + " returned an empty body");
        }
        try {
            JsonNode root = MAPPER.readTree(response.body());
            if (root == null || root.isMissingNode() || root.isNull()) {
                throw MusicResolutionException.upstream(descriptor.name() + " returned a null document");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new MusicResolutionException(ErrorKind.UPSTREAM,
                descriptor.name() + " returned malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    protected String baseUrl() {
        String base = descriptor.baseUrl();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    protected static String enc(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    /**
     * Text of a scalar field, or an empty string when missing or null. Numeric ids are rendered without decimals.
     */
    protected static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull() || value.isContainerNode()) return "";
        return value.asText("").trim();
    }

    /**
     * Reads a required text field.
     */
    protected String requireText(JsonNode node, String field, String context) throws MusicResolutionException {
        String value = text(node, field);
        if (value.isEmpty()) {
            throw MusicResolutionException.upstream(descriptor.name() + " " + context + " is missing '" + field + "'");
        }
        return value;
    }

    /**
     * Reads a positive number; strings holding digits are accepted too.
     */
    protected static Long positiveLong(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isNumber()) {
            long v = value.asLong();
            return v > 0 ? v : null;
        }
        if (value.isTextual()) {
            try {
                long v = Long.parseLong(value.asText().trim());
                return v > 0 ? v : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Normalizes the artist field, which providers send as a string, a string array or an array of
     * {@code {name: ...}} objects.
     */
    protected static List<String> artists(JsonNode value) {
        List<String> names = new ArrayList<>();
        if (value == null || value.isMissingNode() || value.isNull()) return names;
        if (value.isTextual()) {
            for (String part : value.asText().split("[,/、&]")) {
                if (!part.isBlank()) names.add(part.trim());
            }
            return names;
        }
        if (value.isArray()) {
            for (JsonNode item : value) {
                String name = item.isTextual() ? item.asText() : item.path("name").asText("");
                if (!name.isBlank()) names.add(name.trim());
            }
        }
        return names;
    }

    /**
     * Maps every element of an array, skipping elements the mapper rejects. An array whose elements are all
     * rejected is treated as malformed.
     */
    protected List<Song> mapSongs(JsonNode array, SongMapper mapper, String context) throws MusicResolutionException {
        List<Song> songs = new ArrayList<>();
        int rejected = 0;
        for (JsonNode item : array) {
            try {
                songs.add(mapper.map(item));
            } catch (MusicResolutionException e) {
                rejected++;
                logger.debug("Skipping malformed {} entry from {}: {}", context, descriptor.name(), e.getMessage());
            }
        }
        if (songs.isEmpty() && rejected > 0) {
            throw MusicResolutionException.upstream(descriptor.name() + " " + context + " contained no well-formed songs");
        }
        return songs;
    }

    @FunctionalInterface
    protected interface SongMapper {
        Song map(JsonNode node) throws MusicResolutionException;
    }
}
