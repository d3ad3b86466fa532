package org.netpreserve.newsagger;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;

public record PeriodicalIssue(
        long id,
        String lccn,
        String issueDate,
        int editionCount,
        int pagesCount,
        @Nullable String issueUrl,
        @Nullable Instant createdAt) {
}
