package com.cloudmusic.resolver;

/**
 * Availability report for one provider, produced by {@link ResolutionChain#probeProviders()}.
 *
 * @param name      provider name
 * @param available the probe call succeeded
 * @param latencyMs probe round trip, or -1 when the provider was not called
 * @param state     breaker state after the probe, {@link CircuitState#CLOSED} for unguarded providers
 * @param message   failure detail, empty when available
 */
public record ProviderStatus(String name, boolean available, long latencyMs, CircuitState state, String message) {
    public ProviderStatus {
        message = message == null ? "" : message;
    }
}
