package org.netpreserve.newsagger.db;

import org.jetbrains.annotations.Nullable;

/**
 * The set of stored pages a facet covers. Null bounds are unrestricted.
 *
 * @param dateFrom inclusive {@code YYYY-MM-DD} lower bound
 * @param dateTo   inclusive {@code YYYY-MM-DD} upper bound
 * @param state    only pages of periodicals published in this state
 */
public record PageScope(@Nullable String dateFrom, @Nullable String dateTo, @Nullable String state) {
    public static final PageScope ALL = new PageScope(null, null, null);
}
