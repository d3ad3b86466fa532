package org.netpreserve.newsagger.db;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.netpreserve.newsagger.Database;
import org.netpreserve.newsagger.InMemoryDatabaseTestExtension;
import org.netpreserve.newsagger.Page;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.netpreserve.newsagger.Fixtures.page;
import static org.netpreserve.newsagger.Fixtures.periodical;

@ExtendWith(InMemoryDatabaseTestExtension.class)
class PageDAOTest {
    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private final Database database;

    PageDAOTest(Database database) {
        this.database = database;
    }

    @BeforeEach
    void setUp() {
        InMemoryDatabaseTestExtension.clear(database);
    }

    @Test
    void storeAllCountsOnlyNewPagesAndKeepsDownloadedFlag() {
        PageDAO pages = database.pages();
        assertEquals(2, pages.storeAll(List.of(page("sn1", "1906-04-19", 1), page("sn1", "1906-04-19", 2)), NOW));
        pages.markDownloaded("/lccn/sn1/1906-04-19/ed-1/seq-1/");
        assertEquals(1, pages.storeAll(List.of(page("sn1", "1906-04-19", 1), page("sn1", "1906-04-19", 3)), NOW));

        assertEquals(3, pages.count());
        assertEquals(1, pages.countDownloaded());
        assertTrue(pages.find("/lccn/sn1/1906-04-19/ed-1/seq-1/").downloaded());
        assertEquals(3, pages.countForIssue("sn1", "1906-04-19", 1));
    }

    @Test
    void scopeFiltersByDateAndState() {
        database.periodicals().upsert(periodical("sn1", "California"), NOW);
        database.periodicals().upsert(periodical("sn2", "Ohio"), NOW);
        PageDAO pages = database.pages();
        pages.storeAll(List.of(page("sn1", "1906-04-19", 1), page("sn1", "1910-01-01", 1),
                page("sn2", "1906-05-01", 1)), NOW);

        var scope1906 = new PageScope("1906-01-01", "1906-12-31", null);
        assertEquals(2, pages.countInScope(scope1906, null));
        assertEquals(2, pages.countInScope(new PageScope(null, null, "California"), null));
        assertEquals(1, pages.countInScope(new PageScope("1906-01-01", "1906-12-31", "Ohio"), false));

        pages.markDownloaded("/lccn/sn2/1906-05-01/ed-1/seq-1/");
        assertEquals(1, pages.countInScope(scope1906, true));
        List<Page> remaining = pages.listInScope(scope1906, false, 10);
        assertEquals(List.of("/lccn/sn1/1906-04-19/ed-1/seq-1/"), remaining.stream().map(Page::itemId).toList());
        assertEquals(2, pages.listForPeriodical("sn1", false).size());
    }
}
