package org.netpreserve.newsagger;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.newsagger.discovery.FacetKind;

import java.time.Instant;

/**
 * A slice of the search space (a date range, a state, or both) discovered page by page.
 */
public record SearchFacet(
        long id,
        String facetType,
        String facetValue,
        String facetQuery,
        long estimatedItems,
        long actualItems,
        long itemsDiscovered,
        long itemsDownloaded,
        @Nullable Instant discoveryStarted,
        @Nullable Instant discoveryCompleted,
        Status status,
        @Nullable String errorMessage,
        int currentPage,
        int lastBatchSize,
        int lastSuccessfulBatch,
        int resumeFromPage,
        @Nullable Instant createdAt,
        @Nullable Instant updatedAt) {

    public FacetKind kind() {
        return FacetKind.parse(facetType, facetValue);
    }

    public enum Status {
        PENDING,
        DISCOVERING,
        COMPLETED,
        ERROR,
        CAPTCHA_BLOCKED,
        /**
         * Replaced by smaller facets after repeated CAPTCHA challenges.
         */
        SPLIT_COMPLETED
    }
}
