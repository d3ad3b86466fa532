package org.netpreserve.newsagger.db;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jdbi.v3.sqlobject.transaction.Transaction;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.newsagger.Periodical;
import org.netpreserve.newsagger.util.MustUpdate;

import java.time.Instant;
import java.util.List;

@RegisterConstructorMapper(Periodical.class)
public interface PeriodicalDAO {
    /**
     * Inserts a periodical or refreshes its descriptive fields. Discovery progress is left untouched.
     */
    @SqlUpdate("""
            INSERT INTO periodicals (lccn, title, state, city, start_year, end_year, frequency, language, subject, url,
                                     created_at, updated_at)
            VALUES (:lccn, :title, :state, :city, :startYear, :endYear, :frequency, :language, :subject, :url,
                    :now, :now)
            ON CONFLICT (lccn) DO UPDATE SET title = excluded.title,
                                             state = excluded.state,
                                             city = excluded.city,
                                             start_year = excluded.start_year,
                                             end_year = excluded.end_year,
                                             frequency = COALESCE(excluded.frequency, periodicals.frequency),
                                             language = COALESCE(excluded.language, periodicals.language),
                                             subject = COALESCE(excluded.subject, periodicals.subject),
                                             url = excluded.url,
                                             updated_at = excluded.updated_at""")
    void upsert(@BindMethods Periodical periodical, Instant now);

    @Transaction
    default int upsertAll(List<Periodical> periodicals, Instant now) {
        for (Periodical periodical : periodicals) {
            upsert(periodical, now);
        }
        return periodicals.size();
    }

    @SqlQuery("SELECT * FROM periodicals WHERE lccn = ?")
    @Nullable Periodical find(String lccn);

    @SqlQuery("""
            SELECT * FROM periodicals
            WHERE (:state IS NULL OR state = :state)
              AND (:discoveryComplete IS NULL OR discovery_complete = :discoveryComplete)
            ORDER BY lccn""")
    List<Periodical> list(@Nullable String state, @Nullable Boolean discoveryComplete);

    @SqlQuery("SELECT lccn FROM periodicals WHERE state = :state ORDER BY lccn LIMIT :limit")
    List<String> lccnsInState(String state, int limit);

    @SqlQuery("SELECT COUNT(*) FROM periodicals WHERE state = ?")
    long countInState(String state);

    @SqlQuery("SELECT DISTINCT state FROM periodicals WHERE state IS NOT NULL AND state != '' ORDER BY state")
    List<String> states();

    @SqlQuery("SELECT COUNT(*) FROM periodicals")
    long count();

    @SqlQuery("SELECT COUNT(*) FROM periodicals WHERE discovery_complete")
    long countDiscoveryComplete();

    @SqlUpdate("""
            UPDATE periodicals
            SET total_issues = :totalIssues,
                issues_discovered = :issuesDiscovered,
                discovery_complete = :complete,
                updated_at = :now
            WHERE lccn = :lccn""")
    @MustUpdate
    void updateDiscoveryProgress(String lccn, int totalIssues, int issuesDiscovered, boolean complete, Instant now);
}
