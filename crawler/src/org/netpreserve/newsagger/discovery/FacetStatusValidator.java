package org.netpreserve.newsagger.discovery;

import org.netpreserve.newsagger.SearchFacet;
import org.netpreserve.newsagger.db.FacetDAO;
import org.netpreserve.newsagger.db.FacetUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Objects;

/**
 * Reopens facets that are marked completed but still carry the cursor of an interrupted run. A facet counts as
 * interrupted if it is past page 1 with no error message, or has a resume page past 1. This is a heuristic: it can't
 * tell a crash from a facet that really ended on a later page, which is why a clean completion rewinds the cursor.
 */
public class FacetStatusValidator {
    private static final Logger log = LoggerFactory.getLogger(FacetStatusValidator.class);
    private final FacetDAO facets;
    private final Clock clock;

    public FacetStatusValidator(FacetDAO facets, Clock clock) {
        this.facets = facets;
        this.clock = clock;
    }

    /**
     * @return the facet as it should be processed, re-read from storage if it was repaired
     */
    public SearchFacet validate(SearchFacet facet) {
        if (facet.status() != SearchFacet.Status.COMPLETED) return facet;
        var indicators = new ArrayList<String>();
        if (facet.currentPage() > 1 && (facet.errorMessage() == null || facet.errorMessage().isEmpty())) {
            indicators.add("interrupted at page " + facet.currentPage() + " with no error message");
        }
        if (facet.resumeFromPage() > 1) {
            indicators.add("resume page set to " + facet.resumeFromPage());
        }
        if (indicators.isEmpty()) return facet;

        int resumePage = facet.currentPage() > 1 ? facet.currentPage() + 1 : 1;
        String reason = String.join("; ", indicators);
        log.atWarn().addKeyValue("facetId", facet.id()).addKeyValue("resumePage", resumePage)
                .log("Reopening incorrectly completed facet: {}", reason);
        facets.update(facet.id(), FacetUpdate.status(SearchFacet.Status.DISCOVERING)
                .withErrorMessage("Auto-fixed incorrectly completed facet, was interrupted (" + reason + ")")
                .withPages(resumePage, resumePage), clock.instant());
        return Objects.requireNonNull(facets.find(facet.id()));
    }
}
