package org.netpreserve.newsagger.db;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jdbi.v3.sqlobject.transaction.Transaction;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.newsagger.Page;
import org.netpreserve.newsagger.util.MustUpdate;

import java.time.Instant;
import java.util.List;

@RegisterConstructorMapper(Page.class)
public interface PageDAO {
    /**
     * Inserts a page or refreshes the metadata of a known one. The downloaded flag of an existing page is kept.
     */
    @SqlUpdate("""
            INSERT INTO pages (item_id, lccn, title, date, edition, sequence, page_url, pdf_url, jp2_url, ocr_text,
                               word_count, downloaded, created_at)
            VALUES (:itemId, :lccn, :title, :date, :edition, :sequence, :pageUrl, :pdfUrl, :jp2Url, :ocrText,
                    :wordCount, FALSE, :now)
            ON CONFLICT (item_id) DO UPDATE SET title = excluded.title,
                                                page_url = excluded.page_url,
                                                pdf_url = COALESCE(excluded.pdf_url, pages.pdf_url),
                                                jp2_url = COALESCE(excluded.jp2_url, pages.jp2_url),
                                                ocr_text = COALESCE(excluded.ocr_text, pages.ocr_text),
                                                word_count = COALESCE(excluded.word_count, pages.word_count)""")
    void upsert(@BindMethods Page page, Instant now);

    @SqlQuery("SELECT EXISTS (SELECT 1 FROM pages WHERE item_id = ?)")
    boolean exists(String itemId);

    /**
     * Stores pages in one transaction.
     *
     * @return how many of them were not stored before
     */
    @Transaction
    default int storeAll(List<Page> pages, Instant now) {
        int added = 0;
        for (Page page : pages) {
            if (!exists(page.itemId())) added++;
            upsert(page, now);
        }
        return added;
    }

    @SqlQuery("SELECT * FROM pages WHERE item_id = ?")
    @Nullable Page find(String itemId);

    @SqlQuery("SELECT COUNT(*) FROM pages WHERE lccn = :lccn AND date = :date AND edition = :edition")
    int countForIssue(String lccn, String date, int edition);

    String SCOPE_WHERE = """
            WHERE (:dateFrom IS NULL OR date >= :dateFrom)
              AND (:dateTo IS NULL OR date <= :dateTo)
              AND (:state IS NULL OR lccn IN (SELECT lccn FROM periodicals WHERE state = :state))
            """;

    @SqlQuery("SELECT * FROM pages " + SCOPE_WHERE + """
              AND (:downloaded IS NULL OR downloaded = :downloaded)
            ORDER BY date, item_id
            LIMIT :limit""")
    List<Page> listInScope(@BindMethods PageScope scope, @Nullable Boolean downloaded, int limit);

    @SqlQuery("SELECT COUNT(*) FROM pages " + SCOPE_WHERE + "AND (:downloaded IS NULL OR downloaded = :downloaded)")
    long countInScope(@BindMethods PageScope scope, @Nullable Boolean downloaded);

    @SqlQuery("""
            SELECT * FROM pages
            WHERE lccn = :lccn AND (:downloaded IS NULL OR downloaded = :downloaded)
            ORDER BY date, edition, sequence""")
    List<Page> listForPeriodical(String lccn, @Nullable Boolean downloaded);

    @SqlUpdate("UPDATE pages SET downloaded = TRUE WHERE item_id = ?")
    @MustUpdate
    void markDownloaded(String itemId);

    @SqlQuery("SELECT COUNT(*) FROM pages")
    long count();

    @SqlQuery("SELECT COUNT(*) FROM pages WHERE downloaded")
    long countDownloaded();
}
