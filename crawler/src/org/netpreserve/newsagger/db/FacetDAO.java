package org.netpreserve.newsagger.db;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jdbi.v3.sqlobject.transaction.Transaction;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.newsagger.SearchFacet;
import org.netpreserve.newsagger.util.MustUpdate;

import java.time.Instant;
import java.util.List;

@RegisterConstructorMapper(SearchFacet.class)
@RegisterConstructorMapper(StatusCount.class)
public interface FacetDAO {
    @SqlUpdate("""
            INSERT INTO search_facets (facet_type, facet_value, facet_query, estimated_items, created_at, updated_at)
            VALUES (:facetType, :facetValue, :facetQuery, :estimatedItems, :now, :now)""")
    @GetGeneratedKeys
    long _insert(String facetType, String facetValue, String facetQuery, long estimatedItems, Instant now);

    /**
     * @return the new facet's id, or null if an identical facet already exists
     */
    @Transaction
    default @Nullable Long createIfAbsent(String facetType, String facetValue, @Nullable String facetQuery,
                                          long estimatedItems, Instant now) {
        String query = facetQuery == null ? "" : facetQuery;
        if (find(facetType, facetValue, query) != null) return null;
        return _insert(facetType, facetValue, query, estimatedItems, now);
    }

    @SqlQuery("SELECT * FROM search_facets WHERE id = ?")
    @Nullable SearchFacet find(long id);

    @SqlQuery("""
            SELECT * FROM search_facets
            WHERE facet_type = :facetType AND facet_value = :facetValue AND facet_query = :facetQuery""")
    @Nullable SearchFacet find(String facetType, String facetValue, String facetQuery);

    @SqlQuery("""
            SELECT * FROM search_facets
            WHERE (:facetType IS NULL OR facet_type = :facetType)
              AND (:status IS NULL OR status = :status)
            ORDER BY id""")
    List<SearchFacet> list(@Nullable String facetType, @Nullable SearchFacet.Status status);

    @SqlQuery("SELECT status, COUNT(*) AS count FROM search_facets GROUP BY status ORDER BY status")
    List<StatusCount> countByStatus();

    @SqlQuery("SELECT COALESCE(SUM(items_discovered), 0) FROM search_facets")
    long totalItemsDiscovered();

    @SqlQuery("SELECT COALESCE(SUM(items_downloaded), 0) FROM search_facets")
    long totalItemsDownloaded();

    /**
     * Applies the non-null fields of {@code update}. {@code updated_at} is always refreshed. A current page also moves
     * the resume point, a batch size is recorded as both the last and the last successful batch, and entering
     * DISCOVERING stamps the first start time and COMPLETED the completion time.
     */
    @SqlUpdate("""
            UPDATE search_facets
            SET status = COALESCE(:status, status),
                estimated_items = COALESCE(:estimatedItems, estimated_items),
                actual_items = COALESCE(:actualItems, actual_items),
                items_discovered = COALESCE(:itemsDiscovered, items_discovered),
                items_downloaded = COALESCE(:itemsDownloaded, items_downloaded),
                current_page = COALESCE(:currentPage, current_page),
                resume_from_page = COALESCE(:resumeFromPage, :currentPage, resume_from_page),
                last_batch_size = COALESCE(:batchSize, last_batch_size),
                last_successful_batch = COALESCE(:batchSize, last_successful_batch),
                error_message = COALESCE(:errorMessage, error_message),
                discovery_started = CASE WHEN :status = 'DISCOVERING' THEN COALESCE(discovery_started, :now)
                                         ELSE discovery_started END,
                discovery_completed = CASE WHEN :status = 'COMPLETED' THEN :now ELSE discovery_completed END,
                updated_at = :now
            WHERE id = :id""")
    @MustUpdate
    void update(long id, @BindMethods FacetUpdate update, Instant now);

    @SqlUpdate("UPDATE search_facets SET error_message = NULL, updated_at = :now WHERE id = :id")
    @MustUpdate
    void clearError(long id, Instant now);
}
