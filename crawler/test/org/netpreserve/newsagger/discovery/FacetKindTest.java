package org.netpreserve.newsagger.discovery;

import org.junit.jupiter.api.Test;
import org.netpreserve.newsagger.db.PageScope;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FacetKindTest {

    @Test
    void priorities() {
        assertEquals(1, FacetKind.parse("date_range", "1906/1906").priority());
        assertEquals(2, FacetKind.parse("date_range", "1917/1917").priority());
        assertEquals(2, FacetKind.parse("date_range", "1918/1918").priority());
        assertEquals(2, FacetKind.parse("date_range", "1919/1919").priority());
        assertEquals(5, FacetKind.parse("date_range", "1880/1889").priority());
        assertEquals(4, FacetKind.parse("state", "California").priority());
        assertEquals(4, FacetKind.parse("state", "New York").priority());
        assertEquals(4, FacetKind.parse("state", "Illinois").priority());
        assertEquals(5, FacetKind.parse("state", "Ohio").priority());
        assertEquals(5, FacetKind.parse("mystery", "x").priority());
        assertEquals(1, FacetKind.parse("combined", "state:California|date_range:1906/1906").priority());
    }

    @Test
    void dateRangeSearchAndScope() {
        var range = FacetKind.parse("date_range", "1906/1910");
        assertInstanceOf(FacetKind.DateRange.class, range);
        var params = range.searchParams(3, 100);
        assertEquals("3", params.get("page"));
        assertEquals("100", params.get("rows"));
        assertEquals("1906", params.get("date1"));
        assertEquals("1910", params.get("date2"));
        assertEquals(new PageScope("1906-01-01", "1910-12-31", null), range.pageScope());
    }

    @Test
    void stateFacetsUseSmallerBatches() {
        var state = FacetKind.parse("state", "Texas");
        assertEquals(50, state.adjustBatchSize(100));
        assertEquals(20, state.adjustBatchSize(20));
        assertEquals(100, FacetKind.parse("date_range", "1900/1900").adjustBatchSize(100));
        assertEquals("Texas", state.searchParams(1, 50).get("state"));
    }

    @Test
    void combinedRoundTripsThroughItsValue() {
        var combined = new FacetKind.Combined("Ohio", FacetKind.DateRange.years(1900, 1920));
        assertEquals("state:Ohio|date_range:1900/1920", combined.value());
        assertEquals(combined, FacetKind.parse("combined", combined.value()));
        assertEquals(new PageScope("1900-01-01", "1920-12-31", "Ohio"), combined.pageScope());
    }

    @Test
    void singleYearSplitsIntoQuarters() {
        List<FacetKind> parts = FacetKind.parse("date_range", "1906/1906").split(2024);
        assertEquals(List.of("1906-01-01/1906-03-31", "1906-04-01/1906-06-30", "1906-07-01/1906-09-30",
                "1906-10-01/1906-12-31"), parts.stream().map(FacetKind::value).toList());
        assertTrue(parts.get(0).split(2024).isEmpty());
    }

    @Test
    void rangeSplitsIntoYears() {
        List<FacetKind> parts = FacetKind.parse("date_range", "1900/1902").split(2024);
        assertEquals(List.of("1900/1900", "1901/1901", "1902/1902"), parts.stream().map(FacetKind::value).toList());
    }

    @Test
    void stateSplitsIntoTwentyYearSpans() {
        List<FacetKind> parts = FacetKind.parse("state", "Ohio").split(2024);
        assertEquals(6, parts.size());
        assertEquals("state:Ohio|date_range:1900/1920", parts.get(0).value());
        assertEquals("state:Ohio|date_range:2001/2024", parts.get(5).value());
        assertTrue(parts.get(0).split(2024).isEmpty());
    }

    @Test
    void unknownFacetsHaveNoScope() {
        var unknown = FacetKind.parse("newspaper", "sn123");
        assertInstanceOf(FacetKind.Unknown.class, unknown);
        assertNull(unknown.pageScope());
        assertEquals(FacetKind.parse("date_range", "garbage").getClass(), FacetKind.Unknown.class);
    }
}
