package com.cloudmusic.resolver;

/**
 * Creates the {@link ProviderClient} matching a descriptor's response-shape family.
 */
public final class ProviderClients {
    private ProviderClients() {}

    public static ProviderClient create(ProviderDescriptor descriptor, HttpFetcher fetcher, ResolverConfig config) {
        return switch (descriptor.kind()) {
            case GDSTUDIO, METING -> new MetingProviderClient(descriptor, fetcher, config);
            case NEC -> new NecProviderClient(descriptor, fetcher, config);
        };
    }
}
