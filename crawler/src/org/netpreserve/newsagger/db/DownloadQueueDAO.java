package org.netpreserve.newsagger.db;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jdbi.v3.sqlobject.transaction.Transaction;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.newsagger.QueueItem;
import org.netpreserve.newsagger.util.MustUpdate;

import java.time.Instant;
import java.util.List;

@RegisterConstructorMapper(QueueItem.class)
@RegisterConstructorMapper(DownloadQueueDAO.StatusTotals.class)
public interface DownloadQueueDAO {
    @SqlUpdate("""
            INSERT INTO download_queue (queue_type, reference_id, priority, estimated_size_mb, estimated_time_hours,
                                        created_at, updated_at)
            VALUES (:type, :referenceId, :priority, :estimatedSizeMb, :estimatedTimeHours, :now, :now)""")
    @GetGeneratedKeys
    long enqueue(QueueItem.Type type, String referenceId, int priority, double estimatedSizeMb,
                 double estimatedTimeHours, Instant now);

    @SqlQuery("""
            SELECT EXISTS (SELECT 1 FROM download_queue
                           WHERE queue_type = :type AND reference_id = :referenceId
                             AND status IN ('QUEUED', 'ACTIVE', 'PAUSED'))""")
    boolean isPending(QueueItem.Type type, String referenceId);

    /**
     * Enqueues unless the same reference is already waiting or in progress.
     *
     * @return true if a new item was added
     */
    @Transaction
    default boolean enqueueIfAbsent(QueueItem.Type type, String referenceId, int priority, double estimatedSizeMb,
                                    double estimatedTimeHours, Instant now) {
        if (isPending(type, referenceId)) return false;
        enqueue(type, referenceId, priority, estimatedSizeMb, estimatedTimeHours, now);
        return true;
    }

    @SqlQuery("SELECT * FROM download_queue WHERE id = ?")
    @Nullable QueueItem find(long id);

    /**
     * Items in the order they should be worked: most urgent first, then oldest first.
     */
    @SqlQuery("""
            SELECT * FROM download_queue
            WHERE (:status IS NULL OR status = :status)
            ORDER BY priority, created_at, id
            LIMIT :limit""")
    List<QueueItem> list(@Nullable QueueItem.Status status, int limit);

    @SqlUpdate("""
            UPDATE download_queue
            SET status = 'ACTIVE', started_at = :now, progress_percent = 0, error_message = NULL, updated_at = :now
            WHERE id = :id""")
    @MustUpdate
    void markActive(long id, Instant now);

    @SqlUpdate("""
            UPDATE download_queue
            SET status = 'COMPLETED', completed_at = :now, progress_percent = 100, updated_at = :now
            WHERE id = :id""")
    @MustUpdate
    void markCompleted(long id, Instant now);

    @SqlUpdate("""
            UPDATE download_queue
            SET status = 'FAILED', error_message = :error, updated_at = :now
            WHERE id = :id""")
    @MustUpdate
    void markFailed(long id, String error, Instant now);

    /**
     * Puts an item back in line, e.g. when a run stops while working on it.
     */
    @SqlUpdate("""
            UPDATE download_queue
            SET status = 'QUEUED', started_at = NULL, updated_at = :now
            WHERE id = :id""")
    @MustUpdate
    void markQueued(long id, Instant now);

    @SqlUpdate("UPDATE download_queue SET progress_percent = :percent, updated_at = :now WHERE id = :id")
    @MustUpdate
    void updateProgress(long id, double percent, Instant now);

    @SqlUpdate("""
            UPDATE download_queue
            SET status = 'QUEUED', error_message = NULL, updated_at = :now
            WHERE status = 'FAILED'""")
    int requeueFailed(Instant now);

    @SqlUpdate("""
            UPDATE download_queue
            SET status = 'QUEUED', error_message = NULL, progress_percent = 0, started_at = NULL, updated_at = :now
            WHERE status = 'ACTIVE'""")
    int requeueActive(Instant now);

    @SqlQuery("SELECT COUNT(*) FROM download_queue WHERE status = ?")
    long countByStatus(QueueItem.Status status);

    @SqlQuery("""
            SELECT status, COUNT(*) AS items, COALESCE(SUM(estimated_size_mb), 0) AS estimated_size_mb
            FROM download_queue
            GROUP BY status
            ORDER BY status""")
    List<StatusTotals> totalsByStatus();

    record StatusTotals(QueueItem.Status status, long items, double estimatedSizeMb) {
    }
}
