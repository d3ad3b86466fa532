package org.netpreserve.newsagger;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * A newspaper title, keyed by its Library of Congress Control Number.
 */
public record Periodical(
        String lccn,
        String title,
        @Nullable String state,
        @Nullable String city,
        @Nullable Integer startYear,
        @Nullable Integer endYear,
        @Nullable String frequency,
        @Nullable String language,
        @Nullable String subject,
        @Nullable String url,
        int totalIssues,
        int issuesDiscovered,
        int issuesDownloaded,
        boolean discoveryComplete,
        boolean downloadComplete,
        @Nullable Instant createdAt,
        @Nullable Instant updatedAt) {

    /**
     * A periodical as first seen in the newspaper listing, with no progress yet.
     */
    public static Periodical discovered(String lccn, String title, @Nullable String state, @Nullable String city,
                                        @Nullable Integer startYear, @Nullable Integer endYear,
                                        @Nullable String frequency, @Nullable String language,
                                        @Nullable String subject, @Nullable String url) {
        return new Periodical(lccn, title, state, city, startYear, endYear, frequency, language, subject, url,
                0, 0, 0, false, false, null, null);
    }
}
