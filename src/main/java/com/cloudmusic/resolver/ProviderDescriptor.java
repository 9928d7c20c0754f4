package com.cloudmusic.resolver;

/**
 * Static description of one upstream provider.
 *
 * @param name           display and statistics key
 * @param baseUrl        endpoint root
 * @param kind           response-shape family
 * @param supportsSearch whether the provider offers keyword search at all
 * @param guarded        whether calls to this provider go through a {@link CircuitBreaker}
 */
public record ProviderDescriptor(String name, String baseUrl, ProviderKind kind, boolean supportsSearch, boolean guarded) {
    public ProviderDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Provider name cannot be null or empty");
        }
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Provider baseUrl cannot be null or empty");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Provider kind cannot be null");
        }
    }
}
