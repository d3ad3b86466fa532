package org.netpreserve.newsagger.config;

/**
 * Root of the configuration tree, bound from {@code config/defaults.yaml} merged with the user's overrides.
 */
public record NewsaggerConfig(
        ApiConfig api,
        StorageConfig storage,
        DownloadConfig download,
        DiscoveryConfig discovery
) {
    public static NewsaggerConfig defaults() {
        return new NewsaggerConfig(ApiConfig.defaults(), StorageConfig.defaults(), DownloadConfig.defaults(),
                DiscoveryConfig.defaults());
    }
}
