package org.netpreserve.newsagger;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * A unit of download work. Completed and failed items are kept for auditing.
 *
 * @param referenceId item id for pages, facet id for facets, LCCN for periodicals
 * @param priority    1 is most urgent
 */
public record QueueItem(
        long id,
        Type queueType,
        String referenceId,
        int priority,
        double estimatedSizeMb,
        double estimatedTimeHours,
        Status status,
        double progressPercent,
        @Nullable Instant startedAt,
        @Nullable Instant completedAt,
        @Nullable String errorMessage,
        @Nullable Instant createdAt,
        @Nullable Instant updatedAt) {

    public enum Type {
        PAGE, FACET, PERIODICAL
    }

    public enum Status {
        QUEUED, ACTIVE, COMPLETED, FAILED, PAUSED
    }
}
