package org.netpreserve.newsagger;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * Resume state of a walk over the batch manifest.
 *
 * @param currentBatchIndex  0-based index of the batch being walked
 * @param currentIssueIndex  1-based index of the last fully processed issue within that batch (0 = none yet)
 * @param blockedBatchIndex  batch where the last CAPTCHA block happened
 * @param blockedIssueIndex  issue where the last CAPTCHA block happened
 */
public record BatchSession(
        long id,
        String sessionName,
        int totalBatches,
        int currentBatchIndex,
        @Nullable String currentBatchName,
        int currentIssueIndex,
        int totalIssuesInBatch,
        long totalPagesDiscovered,
        long totalPagesEnqueued,
        boolean autoEnqueue,
        Status status,
        @Nullable Integer blockedBatchIndex,
        @Nullable Integer blockedIssueIndex,
        @Nullable String errorMessage,
        @Nullable Instant createdAt,
        @Nullable Instant updatedAt) {

    public enum Status {
        ACTIVE, CAPTCHA_BLOCKED, COMPLETED, ERROR
    }
}
