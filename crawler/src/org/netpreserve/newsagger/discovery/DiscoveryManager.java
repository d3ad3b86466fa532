package org.netpreserve.newsagger.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.newsagger.*;
import org.netpreserve.newsagger.api.CaptchaDetectedException;
import org.netpreserve.newsagger.api.LocApiClient;
import org.netpreserve.newsagger.config.DiscoveryConfig;
import org.netpreserve.newsagger.db.DownloadQueueDAO;
import org.netpreserve.newsagger.db.FacetDAO;
import org.netpreserve.newsagger.db.FacetUpdate;
import org.netpreserve.newsagger.db.PageScope;
import org.netpreserve.newsagger.db.StatusCount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.Year;
import java.util.*;

/**
 * Plans and runs facet-based discovery: periodicals and their issues from the newspaper listing, then pages through
 * search facets, then queueing what was found for download.
 * <p>
 * Facet discovery is resumable. Progress is written after every page of results, so a crash loses at most the page
 * in flight. A CAPTCHA challenge marks the facet {@code CAPTCHA_BLOCKED} at the page it hit and is rethrown so the
 * caller can wait out the cooling-off period; any other failure marks the facet {@code ERROR} and is rethrown.
 */
public class DiscoveryManager {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryManager.class);
    static final int STATE_SAMPLE_LCCNS = 5;
    static final long ITEMS_PER_STATE_PERIODICAL = 1000;
    static final double PAGE_SIZE_MB = 1.0;
    static final double PAGE_TIME_HOURS = 0.1;
    static final double FACET_MB_PER_ITEM = 2.0;
    static final double FACET_SECONDS_PER_ITEM = 3.0;
    static final double PERIODICAL_MB_PER_ISSUE = 50.0;
    static final double PERIODICAL_SECONDS_PER_ISSUE = 30.0;
    private static final List<SearchFacet.Status> RUNNABLE = List.of(SearchFacet.Status.PENDING,
            SearchFacet.Status.DISCOVERING, SearchFacet.Status.ERROR, SearchFacet.Status.CAPTCHA_BLOCKED);

    private final Database db;
    private final LocApiClient api;
    private final ResponseProcessor processor;
    private final DiscoveryConfig config;
    private final Clock clock;
    private final FacetStatusValidator validator;
    private volatile boolean stopRequested;

    public DiscoveryManager(Database db, LocApiClient api, ResponseProcessor processor, DiscoveryConfig config,
                            Clock clock) {
        this.db = db;
        this.api = api;
        this.processor = processor;
        this.config = config;
        this.clock = clock;
        this.validator = new FacetStatusValidator(db.facets(), clock);
    }

    /**
     * Asks running discovery to stop after the page it is working on. The facet keeps its resume point.
     */
    public void requestStop() {
        stopRequested = true;
    }

    /**
     * Stores every newspaper in the listing.
     *
     * @param maxPages stop after this many listing pages (null for all)
     * @return number of periodicals stored or refreshed
     */
    public int discoverAllPeriodicals(@Nullable Integer maxPages) throws NewsaggerException, InterruptedException {
        int stored = 0;
        for (int page = 1; maxPages == null || page <= maxPages; page++) {
            if (stopRequested) break;
            JsonNode response = api.getNewspapers(page, LocApiClient.MAX_ROWS);
            List<Periodical> periodicals = processor.processNewspapers(response);
            if (periodicals.isEmpty()) break;
            stored += db.periodicals().upsertAll(periodicals, clock.instant());
            log.info("Stored {} periodicals from listing page {}", periodicals.size(), page);
            if (response.path("next").asText("").isEmpty()) break;
        }
        log.info("Discovered {} periodicals", stored);
        return stored;
    }

    /**
     * Stores the issues listed for one periodical and marks its issue discovery complete. Several editions on the
     * same date are stored as one issue with an edition count.
     *
     * @return number of issues not known before
     */
    public int discoverPeriodicalIssues(String lccn) throws NewsaggerException, InterruptedException {
        JsonNode response = api.getNewspaperIssues(lccn);
        var editionsByDate = new LinkedHashMap<String, List<JsonNode>>();
        for (JsonNode issue : response.path("issues")) {
            String date = issue.path("date_issued").asText("");
            if (date.isEmpty()) continue;
            editionsByDate.computeIfAbsent(ResponseProcessor.normalizeDate(date), k -> new ArrayList<>()).add(issue);
        }
        Instant now = clock.instant();
        int added = db.inTransaction(txn -> {
            if (txn.periodicals().find(lccn) == null) {
                txn.periodicals().upsert(processor.toPeriodical(response), now);
            }
            int count = 0;
            for (var entry : editionsByDate.entrySet()) {
                String url = entry.getValue().get(0).path("url").asText(null);
                count += txn.issues().insert(lccn, entry.getKey(), entry.getValue().size(), 0, url, now);
            }
            txn.periodicals().updateDiscoveryProgress(lccn, editionsByDate.size(),
                    txn.issues().countForPeriodical(lccn), true, now);
            return count;
        });
        log.atInfo().addKeyValue("lccn", lccn).log("Discovered {} new issues ({} listed)", added, editionsByDate.size());
        return added;
    }

    /**
     * Creates one facet per {@code rangeSize} years between {@code startYear} and {@code endYear} inclusive. Facets
     * that already exist are left alone.
     *
     * @param estimate ask the API for each new facet's result count (one request per facet)
     * @return ids of the facets created
     */
    public List<Long> createDateRangeFacets(int startYear, int endYear, int rangeSize, boolean estimate)
            throws NewsaggerException, InterruptedException {
        if (rangeSize < 1) throw new IllegalArgumentException("rangeSize must be positive");
        if (startYear > endYear) throw new IllegalArgumentException("startYear after endYear");
        var created = new ArrayList<Long>();
        FacetDAO facets = db.facets();
        for (int year = startYear; year <= endYear; year += rangeSize) {
            var range = FacetKind.DateRange.years(year, Math.min(year + rangeSize - 1, endYear));
            if (facets.find(range.type(), range.value(), "") != null) continue;
            long estimatedItems = estimate ? api.estimateDownloadSize(range.searchParams(1, 1)).totalPages() : 0;
            Long id = facets.createIfAbsent(range.type(), range.value(), null, estimatedItems, clock.instant());
            if (id != null) created.add(id);
        }
        log.info("Created {} date range facets for {}-{}", created.size(), startYear, endYear);
        return created;
    }

    /**
     * Creates a facet per state. Each is estimated at a thousand pages per known periodical in the state.
     *
     * @param states states to create facets for, or null for every state with a known periodical
     * @return ids of the facets created
     */
    public List<Long> createStateFacets(@Nullable List<String> states) {
        List<String> targets = states != null ? states : db.periodicals().states();
        var created = new ArrayList<Long>();
        for (String state : targets) {
            long estimatedItems = db.periodicals().countInState(state) * ITEMS_PER_STATE_PERIODICAL;
            Long id = db.facets().createIfAbsent(FacetKind.STATE, state, null, estimatedItems, clock.instant());
            if (id != null) created.add(id);
        }
        log.info("Created {} state facets", created.size());
        return created;
    }

    /**
     * Pages through a facet's search results, storing pages as it goes.
     *
     * @param maxItems stop once this many pages have been found (null for no limit)
     * @return pages found by the facet so far, including earlier runs when resuming
     */
    public long discoverFacetContent(long facetId, int batchSize, @Nullable Integer maxItems)
            throws NewsaggerException, InterruptedException {
        FacetDAO facets = db.facets();
        SearchFacet facet = facets.find(facetId);
        if (facet == null) throw new IllegalArgumentException("No such facet: " + facetId);
        facet = validator.validate(facet);
        if (facet.status() == SearchFacet.Status.COMPLETED || facet.status() == SearchFacet.Status.SPLIT_COMPLETED) {
            log.info("Facet {} is already {}", facetId, facet.status());
            return 0;
        }

        FacetKind kind = facet.kind();
        var progress = new FacetProgress(facet, kind.adjustBatchSize(batchSize), maxItems);
        if (progress.batchSize != batchSize) {
            log.info("Using batch size {} for {} facet {}", progress.batchSize, kind.type(), facetId);
        }
        log.atInfo().addKeyValue("facetId", facetId).addKeyValue("page", progress.resumePage)
                .log("Discovering {} = {}", kind.type(), kind.value());
        facets.update(facetId, FacetUpdate.status(SearchFacet.Status.DISCOVERING), clock.instant());

        String andText = null;
        if (kind instanceof FacetKind.State state) {
            List<String> lccns = db.periodicals().lccnsInState(state.name(), STATE_SAMPLE_LCCNS);
            if (lccns.isEmpty()) {
                log.warn("No periodicals known for state {}, completing facet {} with no items", state.name(), facetId);
                facets.update(facetId, FacetUpdate.completed(0).withPages(1, 1), clock.instant());
                return 0;
            }
            andText = "lccn:(" + String.join(" OR ", lccns) + ")";
        } else if (!facet.facetQuery().isEmpty()) {
            andText = facet.facetQuery();
        }

        try {
            while (progress.shouldContinue()) {
                if (stopRequested) {
                    log.info("Stopping facet {} before page {}", facetId, progress.page);
                    return progress.discovered;
                }
                Map<String, String> params = kind.searchParams(progress.page, progress.batchSize);
                if (andText != null) params.put("andtext", andText);
                JsonNode response = api.searchPages(params);
                int resultCount = response.path("items").size();
                if (resultCount == 0) break;

                List<Page> pages = processor.processSearchResults(response, true);
                long remaining = progress.remaining();
                if (remaining >= 0 && pages.size() > remaining) {
                    pages = pages.subList(0, (int) remaining);
                }
                int added = db.pages().storeAll(pages, clock.instant());
                progress.discovered += pages.size();
                facets.update(facetId, FacetUpdate.progress(progress.discovered, progress.page, progress.batchSize)
                        .withPages(progress.page, progress.page + 1), clock.instant());
                log.atDebug().addKeyValue("facetId", facetId).addKeyValue("page", progress.page)
                        .log("Stored {} pages ({} new)", pages.size(), added);
                if (progress.page % 10 == 0) {
                    log.info("Facet {} ({}): page {}, {} items so far", facetId, kind.value(), progress.page,
                            progress.discovered);
                }
                if (resultCount < progress.batchSize) break;
                progress.page++;
            }
        } catch (CaptchaDetectedException e) {
            facets.update(facetId, FacetUpdate.status(SearchFacet.Status.CAPTCHA_BLOCKED)
                    .withErrorMessage("Blocked by global CAPTCHA protection at page " + progress.page + ": "
                                      + e.reason())
                    .withItemsDiscovered(progress.discovered)
                    .withPages(progress.page, progress.page), clock.instant());
            log.atWarn().addKeyValue("facetId", facetId).addKeyValue("page", progress.page)
                    .log("CAPTCHA challenge, facet blocked");
            throw e;
        } catch (NewsaggerException | RuntimeException e) {
            facets.update(facetId, FacetUpdate.error(String.valueOf(e.getMessage()))
                    .withItemsDiscovered(progress.discovered), clock.instant());
            log.atError().addKeyValue("facetId", facetId).addKeyValue("page", progress.page)
                    .log("Facet discovery failed: {}", e.toString());
            throw e;
        }

        // a clean finish rewinds the cursor so the facet never looks like an interrupted run
        facets.update(facetId, FacetUpdate.completed(progress.discovered).withPages(1, 1), clock.instant());
        log.atInfo().addKeyValue("facetId", facetId).log("Completed discovery: {} items", progress.discovered);
        return progress.discovered;
    }

    /**
     * Runs every facet that isn't finished, in id order. A CAPTCHA challenge pauses the run until the cooling-off
     * period ends and then retries the same facet from its resume point. A facet that fails otherwise is left in
     * {@code ERROR} and the run moves on.
     *
     * @return pages found across all facets
     */
    public long discoverAllFacets(int batchSize, @Nullable Integer maxItems) throws InterruptedException {
        long total = 0;
        List<SearchFacet> pending = new ArrayList<>();
        for (SearchFacet.Status status : RUNNABLE) {
            pending.addAll(db.facets().list(null, status));
        }
        pending.sort(Comparator.comparingLong(SearchFacet::id));
        for (SearchFacet facet : pending) {
            // a resumed facet reports its stored count as well, only the pages found by this run are added
            long before = facet.resumeFromPage() > 1 ? facet.itemsDiscovered() : 0;
            long after = before;
            while (!stopRequested) {
                try {
                    after = discoverFacetContent(facet.id(), batchSize, maxItems);
                    break;
                } catch (CaptchaDetectedException e) {
                    after = storedCount(facet.id());
                    log.warn("Waiting out CAPTCHA cooling-off before resuming facet {}", facet.id());
                    api.client().awaitClearance("search/pages/results/", () -> stopRequested);
                } catch (NewsaggerException e) {
                    after = storedCount(facet.id());
                    log.error("Facet {} failed, continuing with the next one: {}", facet.id(), e.getMessage());
                    break;
                }
            }
            total += Math.max(0, after - before);
            if (stopRequested) break;
        }
        return total;
    }

    private long storedCount(long facetId) {
        SearchFacet facet = db.facets().find(facetId);
        return facet != null ? facet.itemsDiscovered() : 0;
    }

    /**
     * Queues the stored, not yet downloaded pages a facet covers.
     *
     * @param maxItems most pages to queue (null for all)
     * @return number of pages newly queued
     * @throws DataIntegrityException if the facet's type can't be matched against stored pages
     */
    public int enqueueFacetContent(long facetId, @Nullable Integer maxItems) {
        SearchFacet facet = db.facets().find(facetId);
        if (facet == null) throw new IllegalArgumentException("No such facet: " + facetId);
        FacetKind kind = facet.kind();
        PageScope scope = kind.pageScope();
        if (scope == null) {
            throw new DataIntegrityException("Facet " + facetId + " has type " + kind.type()
                                             + " which doesn't map to stored pages");
        }
        int priority = kind.priority();
        List<Page> pages = db.pages().listInScope(scope, false, maxItems != null ? maxItems : Integer.MAX_VALUE);
        Instant now = clock.instant();
        int queued = db.inTransaction(txn -> {
            DownloadQueueDAO queue = txn.queue();
            int count = 0;
            for (Page page : pages) {
                if (queue.enqueueIfAbsent(QueueItem.Type.PAGE, page.itemId(), priority, PAGE_SIZE_MB,
                        PAGE_TIME_HOURS, now)) count++;
            }
            return count;
        });
        log.atInfo().addKeyValue("facetId", facetId).addKeyValue("priority", priority)
                .log("Queued {} of {} pages", queued, pages.size());
        return queued;
    }

    /**
     * Queues whole facets and periodicals. Facets matching {@code priorityDateRanges} go first (priority 1), then
     * facets for {@code priorityStates} (priority 2), then every other completed facet (priority 5), then every
     * periodical whose issue discovery is complete at its {@linkplain #periodicalPriority computed priority}.
     *
     * @return number of items newly queued
     */
    public int populateDownloadQueue(List<String> priorityStates, List<String> priorityDateRanges) {
        Instant now = clock.instant();
        DownloadQueueDAO queue = db.queue();
        int added = 0;
        for (SearchFacet facet : db.facets().list(FacetKind.DATE_RANGE, null)) {
            if (priorityDateRanges.contains(facet.facetValue())) {
                added += enqueueFacet(queue, facet, 1, facet.estimatedItems(), now);
            }
        }
        for (SearchFacet facet : db.facets().list(FacetKind.STATE, null)) {
            if (priorityStates.contains(facet.facetValue())) {
                added += enqueueFacet(queue, facet, 2, facet.estimatedItems(), now);
            }
        }
        for (SearchFacet facet : db.facets().list(null, SearchFacet.Status.COMPLETED)) {
            added += enqueueFacet(queue, facet, FacetKind.DEFAULT_PRIORITY, facet.actualItems(), now);
        }
        for (Periodical periodical : db.periodicals().list(null, true)) {
            if (queue.enqueueIfAbsent(QueueItem.Type.PERIODICAL, periodical.lccn(), periodicalPriority(periodical),
                    periodical.totalIssues() * PERIODICAL_MB_PER_ISSUE,
                    periodical.totalIssues() * PERIODICAL_SECONDS_PER_ISSUE / 3600, now)) added++;
        }
        log.info("Added {} items to the download queue", added);
        return added;
    }

    private static int enqueueFacet(DownloadQueueDAO queue, SearchFacet facet, int priority, long items,
                                    Instant now) {
        boolean added = queue.enqueueIfAbsent(QueueItem.Type.FACET, String.valueOf(facet.id()), priority,
                items * FACET_MB_PER_ITEM, items * FACET_SECONDS_PER_ITEM / 3600, now);
        return added ? 1 : 0;
    }

    /**
     * Download priority of a whole periodical, between 1 and 10. Later titles, dailies and long runs rank higher.
     */
    public static int periodicalPriority(Periodical periodical) {
        int priority = FacetKind.DEFAULT_PRIORITY;
        Integer endYear = periodical.endYear();
        if (endYear != null) {
            if (endYear >= 1950) priority -= 1;
            else if (endYear < 1900) priority += 1;
        }
        String frequency = periodical.frequency();
        if (frequency != null && !frequency.isEmpty()) {
            String lower = frequency.toLowerCase(Locale.ROOT);
            if (lower.contains("daily")) priority -= 1;
            else if (!lower.contains("weekly")) priority += 1;
        }
        if (periodical.totalIssues() > 1000) priority -= 1;
        return Math.max(1, Math.min(10, priority));
    }

    /**
     * Replaces a facet with smaller ones covering the same results and marks it {@code SPLIT_COMPLETED}.
     *
     * @return number of facets created, 0 if the facet can't be split any further
     */
    public int splitFacetForCaptchaRecovery(long facetId) {
        SearchFacet facet = db.facets().find(facetId);
        if (facet == null) throw new IllegalArgumentException("No such facet: " + facetId);
        List<FacetKind> parts = facet.kind().split(Year.now(clock).getValue());
        if (parts.isEmpty()) {
            log.warn("Facet {} ({} = {}) can't be split further", facetId, facet.facetType(), facet.facetValue());
            return 0;
        }
        Instant now = clock.instant();
        long estimatedEach = facet.estimatedItems() / parts.size();
        int created = db.inTransaction(txn -> {
            int count = 0;
            for (FacetKind part : parts) {
                Long id = txn.facets().createIfAbsent(part.type(), part.value(), facet.facetQuery(), estimatedEach, now);
                if (id != null) {
                    count++;
                    log.info("Created {} facet {} = {} from facet {}", part.type(), id, part.value(), facetId);
                }
            }
            txn.facets().update(facetId, FacetUpdate.status(SearchFacet.Status.SPLIT_COMPLETED)
                    .withErrorMessage("Split into " + parts.size() + " smaller facets due to CAPTCHA"), now);
            return count;
        });
        log.atInfo().addKeyValue("facetId", facetId).log("Split into {} smaller facets", created);
        return created;
    }

    /**
     * Works through every {@code CAPTCHA_BLOCKED} facet. Facets that can be split are split. The rest are retried
     * from their resume point with small search pages once the cooling-off period is over; a new challenge during a
     * retry ends the recovery run.
     */
    public RecoveryStats processCaptchaRecovery() throws InterruptedException {
        int splits = 0;
        int retries = 0;
        int stillBlocked = 0;
        int errors = 0;
        List<SearchFacet> blocked = db.facets().list(null, SearchFacet.Status.CAPTCHA_BLOCKED);
        for (int i = 0; i < blocked.size(); i++) {
            SearchFacet facet = blocked.get(i);
            if (stopRequested) break;
            if (splitFacetForCaptchaRecovery(facet.id()) > 0) {
                splits++;
                continue;
            }
            if (!api.client().captchaManager().canMakeRequests().allowed()) {
                stillBlocked++;
                continue;
            }
            try {
                discoverFacetContent(facet.id(), config.recoveryBatchSize(), null);
                retries++;
            } catch (CaptchaDetectedException e) {
                log.warn("CAPTCHA challenge again while retrying facet {}, stopping recovery", facet.id());
                stillBlocked += blocked.size() - i;
                break;
            } catch (NewsaggerException e) {
                log.error("Retry of facet {} failed: {}", facet.id(), e.getMessage());
                errors++;
            }
        }
        var stats = new RecoveryStats(splits, retries, stillBlocked, errors);
        log.info("CAPTCHA recovery: {}", stats);
        return stats;
    }

    /**
     * Reopens every completed facet that still looks interrupted.
     */
    public FixStats fixIncorrectlyCompletedFacets() {
        List<SearchFacet> completed = db.facets().list(null, SearchFacet.Status.COMPLETED);
        int fixed = 0;
        for (SearchFacet facet : completed) {
            if (validator.validate(facet).status() != SearchFacet.Status.COMPLETED) fixed++;
        }
        log.info("Checked {} completed facets, reopened {}", completed.size(), fixed);
        return new FixStats(completed.size(), fixed);
    }

    public DiscoverySummary discoverySummary() {
        var facetsByStatus = new LinkedHashMap<String, Long>();
        for (StatusCount count : db.facets().countByStatus()) {
            facetsByStatus.put(count.status(), count.count());
        }
        return new DiscoverySummary(
                db.periodicals().count(),
                db.periodicals().countDiscoveryComplete(),
                db.issues().count(),
                db.pages().count(),
                db.pages().countDownloaded(),
                facetsByStatus,
                db.facets().totalItemsDiscovered(),
                db.facets().totalItemsDownloaded(),
                db.queue().totalsByStatus());
    }

    public record RecoveryStats(int facetsSplit, int facetsRetried, int facetsStillBlocked, int errors) {
    }

    public record FixStats(int facetsChecked, int facetsFixed) {
    }

    public record DiscoverySummary(long periodicals, long periodicalsComplete, long issues, long pages,
                                   long pagesDownloaded, Map<String, Long> facetsByStatus,
                                   long facetItemsDiscovered, long facetItemsDownloaded,
                                   List<DownloadQueueDAO.StatusTotals> queue) {
    }
}
