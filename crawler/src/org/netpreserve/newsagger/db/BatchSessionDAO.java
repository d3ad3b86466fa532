package org.netpreserve.newsagger.db;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jdbi.v3.sqlobject.transaction.Transaction;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.newsagger.BatchSession;
import org.netpreserve.newsagger.util.MustUpdate;

import java.time.Instant;
import java.util.List;

@RegisterConstructorMapper(BatchSession.class)
public interface BatchSessionDAO {
    @SqlUpdate("""
            INSERT INTO batch_sessions (session_name, total_batches, auto_enqueue, created_at, updated_at)
            VALUES (:sessionName, :totalBatches, :autoEnqueue, :now, :now)
            ON CONFLICT (session_name) DO NOTHING""")
    void _create(String sessionName, int totalBatches, boolean autoEnqueue, Instant now);

    /**
     * Returns the named session, creating it if this is the first run.
     */
    @Transaction
    default BatchSession open(String sessionName, int totalBatches, boolean autoEnqueue, Instant now) {
        _create(sessionName, totalBatches, autoEnqueue, now);
        return findByName(sessionName);
    }

    @SqlQuery("SELECT * FROM batch_sessions WHERE session_name = ?")
    @Nullable BatchSession findByName(String sessionName);

    @SqlQuery("SELECT * FROM batch_sessions ORDER BY id")
    List<BatchSession> list();

    @SqlUpdate("""
            UPDATE batch_sessions
            SET total_batches = :totalBatches, status = 'ACTIVE', error_message = NULL, updated_at = :now
            WHERE id = :id""")
    @MustUpdate
    void restart(long id, int totalBatches, Instant now);

    /**
     * Moves to a new batch with no issues processed yet.
     */
    @SqlUpdate("""
            UPDATE batch_sessions
            SET current_batch_index = :batchIndex,
                current_batch_name = :batchName,
                current_issue_index = 0,
                total_issues_in_batch = 0,
                updated_at = :now
            WHERE id = :id""")
    @MustUpdate
    void startBatch(long id, int batchIndex, String batchName, Instant now);

    @SqlUpdate("UPDATE batch_sessions SET total_issues_in_batch = :totalIssues, updated_at = :now WHERE id = :id")
    @MustUpdate
    void setTotalIssuesInBatch(long id, int totalIssues, Instant now);

    /**
     * Records an issue as fully processed, adding its page counts to the running totals.
     */
    @SqlUpdate("""
            UPDATE batch_sessions
            SET current_issue_index = :issueIndex,
                total_pages_discovered = total_pages_discovered + :discoveredDelta,
                total_pages_enqueued = total_pages_enqueued + :enqueuedDelta,
                updated_at = :now
            WHERE id = :id""")
    @MustUpdate
    void finishIssue(long id, int issueIndex, long discoveredDelta, long enqueuedDelta, Instant now);

    @SqlUpdate("""
            UPDATE batch_sessions
            SET status = 'CAPTCHA_BLOCKED',
                blocked_batch_index = :batchIndex,
                blocked_issue_index = :issueIndex,
                updated_at = :now
            WHERE id = :id""")
    @MustUpdate
    void markCaptchaBlocked(long id, int batchIndex, int issueIndex, Instant now);

    /**
     * Returns a blocked session to ACTIVE once the cooling-off period is over.
     */
    @SqlUpdate("""
            UPDATE batch_sessions
            SET status = 'ACTIVE', blocked_batch_index = NULL, blocked_issue_index = NULL, updated_at = :now
            WHERE id = :id""")
    @MustUpdate
    void clearCaptchaBlock(long id, Instant now);

    @SqlUpdate("UPDATE batch_sessions SET status = :status, updated_at = :now WHERE id = :id")
    @MustUpdate
    void setStatus(long id, BatchSession.Status status, Instant now);

    @SqlUpdate("UPDATE batch_sessions SET status = 'ERROR', error_message = :message, updated_at = :now WHERE id = :id")
    @MustUpdate
    void markError(long id, String message, Instant now);
}
