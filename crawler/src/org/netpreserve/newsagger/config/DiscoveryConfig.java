package org.netpreserve.newsagger.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.newsagger.util.DurationDeserializer;

import java.time.Duration;

/**
 * How discovery walks the archive.
 *
 * @param batchSize                 search results requested per page
 * @param maxItems                  stop a facet after this many new pages (null for no limit)
 * @param sessionName               name of the resumable batch walk session
 * @param autoEnqueue               queue every page found by the batch walk for download
 * @param batchCaptchaPollInterval  how often a CAPTCHA-blocked batch walk re-checks the cooling-off state
 * @param recoveryBatchSize         search page size when retrying a CAPTCHA-blocked facet
 */
public record DiscoveryConfig(
        int batchSize,
        @Nullable Integer maxItems,
        String sessionName,
        boolean autoEnqueue,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration batchCaptchaPollInterval,
        int recoveryBatchSize
) {
    public static final String DEFAULT_SESSION_NAME = "batch_discovery_main";

    public static DiscoveryConfig defaults() {
        return new DiscoveryConfig(100, null, DEFAULT_SESSION_NAME, false, Duration.ofSeconds(300), 10);
    }
}
