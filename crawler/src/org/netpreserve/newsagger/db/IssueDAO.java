package org.netpreserve.newsagger.db;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.newsagger.PeriodicalIssue;

import java.time.Instant;
import java.util.List;

@RegisterConstructorMapper(PeriodicalIssue.class)
public interface IssueDAO {
    /**
     * @return 1 if the issue was new, 0 if it was already known
     */
    @SqlUpdate("""
            INSERT INTO periodical_issues (lccn, issue_date, edition_count, pages_count, issue_url, created_at)
            VALUES (:lccn, :issueDate, :editionCount, :pagesCount, :issueUrl, :now)
            ON CONFLICT (lccn, issue_date) DO NOTHING""")
    int insert(String lccn, String issueDate, int editionCount, int pagesCount, @Nullable String issueUrl, Instant now);

    @SqlQuery("SELECT * FROM periodical_issues WHERE lccn = ? ORDER BY issue_date")
    List<PeriodicalIssue> listForPeriodical(String lccn);

    @SqlQuery("SELECT COUNT(*) FROM periodical_issues WHERE lccn = ?")
    int countForPeriodical(String lccn);

    @SqlQuery("SELECT COUNT(*) FROM periodical_issues")
    long count();
}
