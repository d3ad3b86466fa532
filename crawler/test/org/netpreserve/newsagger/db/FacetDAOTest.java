package org.netpreserve.newsagger.db;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.netpreserve.newsagger.Database;
import org.netpreserve.newsagger.InMemoryDatabaseTestExtension;
import org.netpreserve.newsagger.SearchFacet;
import org.netpreserve.newsagger.util.MustUpdate;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(InMemoryDatabaseTestExtension.class)
class FacetDAOTest {
    private static final Instant T1 = Instant.parse("2024-03-01T10:00:00Z");
    private static final Instant T2 = Instant.parse("2024-03-01T11:00:00Z");

    private final Database database;
    private FacetDAO facets;

    FacetDAOTest(Database database) {
        this.database = database;
    }

    @BeforeEach
    void setUp() {
        InMemoryDatabaseTestExtension.clear(database);
        facets = database.facets();
    }

    @Test
    void createIfAbsentSkipsDuplicates() {
        Long id = facets.createIfAbsent("date_range", "1906/1906", null, 500, T1);
        assertNotNull(id);
        assertNull(facets.createIfAbsent("date_range", "1906/1906", "", 10, T1));
        assertNotNull(facets.createIfAbsent("date_range", "1906/1906", "earthquake", 10, T1));

        SearchFacet facet = facets.find(id);
        assertEquals(SearchFacet.Status.PENDING, facet.status());
        assertEquals(500, facet.estimatedItems());
        assertEquals(1, facet.currentPage());
        assertEquals(1, facet.resumeFromPage());
        assertEquals("", facet.facetQuery());
    }

    @Test
    void nullFieldsLeaveColumnsUntouched() {
        long id = facets.createIfAbsent("state", "Ohio", null, 0, T1);
        facets.update(id, FacetUpdate.progress(200, 3, 100), T1);
        facets.update(id, FacetUpdate.status(SearchFacet.Status.ERROR).withErrorMessage("boom"), T2);

        SearchFacet facet = facets.find(id);
        assertEquals(SearchFacet.Status.ERROR, facet.status());
        assertEquals(200, facet.itemsDiscovered());
        assertEquals(3, facet.currentPage());
        assertEquals(3, facet.resumeFromPage(), "current page also moves the resume point");
        assertEquals(100, facet.lastBatchSize());
        assertEquals(100, facet.lastSuccessfulBatch());
        assertEquals("boom", facet.errorMessage());
        assertEquals(T2, facet.updatedAt());
    }

    @Test
    void discoveryTimestamps() {
        long id = facets.createIfAbsent("state", "Ohio", null, 0, T1);
        facets.update(id, FacetUpdate.status(SearchFacet.Status.DISCOVERING), T1);
        facets.update(id, FacetUpdate.status(SearchFacet.Status.DISCOVERING), T2);
        assertEquals(T1, facets.find(id).discoveryStarted(), "restarting keeps the first start time");
        assertNull(facets.find(id).discoveryCompleted());

        facets.update(id, FacetUpdate.completed(42), T2);
        SearchFacet facet = facets.find(id);
        assertEquals(SearchFacet.Status.COMPLETED, facet.status());
        assertEquals(42, facet.actualItems());
        assertEquals(T2, facet.discoveryCompleted());
    }

    @Test
    void updatingAMissingFacetFails() {
        assertThrows(MustUpdate.Exception.class, () -> facets.update(999, FacetUpdate.completed(0), T1));
    }

    @Test
    void listAndCount() {
        facets.createIfAbsent("state", "Ohio", null, 0, T1);
        long done = facets.createIfAbsent("date_range", "1900/1900", null, 0, T1);
        facets.update(done, FacetUpdate.completed(7), T1);

        assertEquals(1, facets.list("state", null).size());
        assertEquals(1, facets.list(null, SearchFacet.Status.COMPLETED).size());
        assertEquals(2, facets.countByStatus().size());
        assertEquals(7, facets.totalItemsDiscovered());
    }
}
