package com.cloudmusic.resolver;

import java.util.List;
import java.util.Optional;

/**
 * Central registry of upstream providers, in priority order.
 * Read-only at runtime; the resolution chain walks {@link #providers()} front to back.
 */
public final class ProviderRegistry {

    /** Music catalogs the aggregator providers can search and resolve. */
    public static final List<String> CATALOG_SOURCES = List.of("netease", "tencent", "kugou", "kuwo", "migu", "joox", "ximalaya");

    private static final List<ProviderDescriptor> DEFAULT_PROVIDERS = List.of(
        new ProviderDescriptor("gdstudio", "https://music-api.gdstudio.xyz/api.php", ProviderKind.GDSTUDIO, true, true),
        new ProviderDescriptor("meting-injahow", "https://api.injahow.cn/meting", ProviderKind.METING, true, false),
        new ProviderDescriptor("meting-qjqq", "https://meting.qjqq.cn", ProviderKind.METING, true, false),
        new ProviderDescriptor("nec", "https://nec8.de5.net", ProviderKind.NEC, true, false)
    );

    private final List<ProviderDescriptor> providers;

    public ProviderRegistry(List<ProviderDescriptor> providers) {
        if (providers == null || providers.isEmpty()) {
            throw new IllegalArgumentException("At least one provider is required");
        }
        this.providers = List.copyOf(providers);
    }

    public static ProviderRegistry defaults() {
        return new ProviderRegistry(DEFAULT_PROVIDERS);
    }

    public List<ProviderDescriptor> providers() {
        return providers;
    }

    public List<ProviderDescriptor> searchProviders() {
        return providers.stream().filter(ProviderDescriptor::supportsSearch).toList();
    }

    public Optional<ProviderDescriptor> find(String name) {
        return providers.stream().filter(p -> p.name().equals(name)).findFirst();
    }
}
