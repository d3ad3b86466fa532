package org.netpreserve.newsagger.db;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.newsagger.SearchFacet;

/**
 * Partial update of a facet's discovery progress. Null fields leave the stored value unchanged.
 *
 * @param currentPage    next page to fetch; also becomes the resume point unless {@code resumeFromPage} is given
 * @param batchSize      size of the last successful page of results
 */
public record FacetUpdate(
        @Nullable SearchFacet.Status status,
        @Nullable Long estimatedItems,
        @Nullable Long actualItems,
        @Nullable Long itemsDiscovered,
        @Nullable Long itemsDownloaded,
        @Nullable Integer currentPage,
        @Nullable Integer resumeFromPage,
        @Nullable Integer batchSize,
        @Nullable String errorMessage) {

    public static FacetUpdate status(SearchFacet.Status status) {
        return new FacetUpdate(status, null, null, null, null, null, null, null, null);
    }

    public static FacetUpdate error(String message) {
        return new FacetUpdate(SearchFacet.Status.ERROR, null, null, null, null, null, null, null, message);
    }

    public static FacetUpdate progress(long itemsDiscovered, int currentPage, int batchSize) {
        return new FacetUpdate(null, null, null, itemsDiscovered, null, currentPage, null, batchSize, null);
    }

    public static FacetUpdate completed(long totalItems) {
        return new FacetUpdate(SearchFacet.Status.COMPLETED, null, totalItems, totalItems, null, null, null, null,
                null);
    }

    public static FacetUpdate downloaded(long itemsDownloaded) {
        return new FacetUpdate(null, null, null, null, itemsDownloaded, null, null, null, null);
    }

    public FacetUpdate withErrorMessage(String errorMessage) {
        return new FacetUpdate(status, estimatedItems, actualItems, itemsDiscovered, itemsDownloaded, currentPage,
                resumeFromPage, batchSize, errorMessage);
    }

    public FacetUpdate withItemsDiscovered(long itemsDiscovered) {
        return new FacetUpdate(status, estimatedItems, actualItems, itemsDiscovered, itemsDownloaded, currentPage,
                resumeFromPage, batchSize, errorMessage);
    }

    public FacetUpdate withPages(int currentPage, int resumeFromPage) {
        return new FacetUpdate(status, estimatedItems, actualItems, itemsDiscovered, itemsDownloaded, currentPage,
                resumeFromPage, batchSize, errorMessage);
    }
}
