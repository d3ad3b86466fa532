package org.netpreserve.newsagger.discovery;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.newsagger.SearchFacet;

/**
 * Cursor of one discovery run over a facet. A run that resumes past page 1 continues the stored item count, a run
 * from page 1 starts counting from zero.
 */
class FacetProgress {
    final int resumePage;
    final int batchSize;
    private final @Nullable Integer maxItems;
    int page;
    long discovered;

    FacetProgress(SearchFacet facet, int batchSize, @Nullable Integer maxItems) {
        this.resumePage = Math.max(1, facet.resumeFromPage());
        this.batchSize = batchSize;
        this.maxItems = maxItems;
        this.page = resumePage;
        this.discovered = resumePage > 1 ? facet.itemsDiscovered() : 0;
    }

    boolean shouldContinue() {
        return maxItems == null || discovered < maxItems;
    }

    /**
     * Items that may still be taken before reaching the limit, or -1 if unlimited.
     */
    long remaining() {
        return maxItems == null ? -1 : maxItems - discovered;
    }
}
