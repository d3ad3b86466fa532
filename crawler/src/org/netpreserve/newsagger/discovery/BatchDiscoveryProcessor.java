package org.netpreserve.newsagger.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.newsagger.*;
import org.netpreserve.newsagger.api.CaptchaDetectedException;
import org.netpreserve.newsagger.api.FatalRequestException;
import org.netpreserve.newsagger.api.GlobalCaptchaManager;
import org.netpreserve.newsagger.api.LocApiClient;
import org.netpreserve.newsagger.config.DiscoveryConfig;
import org.netpreserve.newsagger.db.BatchSessionDAO;
import org.netpreserve.newsagger.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Discovers pages by walking the batch manifest: every batch, every issue in it, every page of each issue.
 * <p>
 * The walk is recorded in a named {@link BatchSession} and resumes after the last fully processed issue. A CAPTCHA
 * challenge blocks the walk until the cooling-off period is over and then retries the same issue, so no issue is ever
 * skipped. Issues whose pages are already stored are not fetched again.
 */
public class BatchDiscoveryProcessor {
    private static final Logger log = LoggerFactory.getLogger(BatchDiscoveryProcessor.class);
    static final int AUTO_ENQUEUE_PRIORITY = 2;
    static final double PAGE_SIZE_MB = 1.0;
    static final double PAGE_TIME_HOURS = 0.1;

    private final Database db;
    private final LocApiClient api;
    private final ResponseProcessor processor;
    private final DiscoveryConfig config;
    private final Clock clock;
    private final Sleeper sleeper;
    private volatile boolean stopRequested;

    public BatchDiscoveryProcessor(Database db, LocApiClient api, ResponseProcessor processor, DiscoveryConfig config,
                                   Clock clock, Sleeper sleeper) {
        this.db = db;
        this.api = api;
        this.processor = processor;
        this.config = config;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Asks the walk to stop after the issue it is working on, or within a second if it is waiting out a cooling-off.
     */
    public void requestStop() {
        stopRequested = true;
    }

    /**
     * Walks the manifest from where the session left off.
     *
     * @param maxBatches  stop after this many batches (null for all)
     * @param autoEnqueue queue every discovered page for download
     */
    public BatchStats discoverAllBatches(@Nullable Integer maxBatches, boolean autoEnqueue)
            throws NewsaggerException, InterruptedException {
        List<JsonNode> batches = api.getAllBatches();
        BatchSessionDAO sessions = db.batchSessions();
        BatchSession session = sessions.open(config.sessionName(), batches.size(), autoEnqueue, clock.instant());
        sessions.restart(session.id(), batches.size(), clock.instant());
        var stats = new Counters();

        int startBatch = session.currentBatchIndex();
        log.atInfo().addKeyValue("session", session.sessionName())
                .log("Walking {} batches from batch {} issue {}", batches.size(), startBatch + 1,
                        session.currentIssueIndex() + 1);
        try {
            boolean finished = true;
            for (int batchIndex = startBatch; batchIndex < batches.size(); batchIndex++) {
                if (stopRequested || (maxBatches != null && stats.batches >= maxBatches)) {
                    finished = false;
                    break;
                }
                JsonNode batch = batches.get(batchIndex);
                boolean resuming = batchIndex == startBatch && session.currentBatchName() != null;
                int skipThrough = resuming ? session.currentIssueIndex() : 0;
                if (!resuming) {
                    sessions.startBatch(session.id(), batchIndex, batch.path("name").asText(""), clock.instant());
                }
                if (!walkBatch(session.id(), batchIndex, batch, skipThrough, autoEnqueue, stats)) {
                    finished = false;
                    break;
                }
                stats.batches++;
            }
            if (finished) sessions.setStatus(session.id(), BatchSession.Status.COMPLETED, clock.instant());
        } catch (NewsaggerException | RuntimeException e) {
            sessions.markError(session.id(), String.valueOf(e.getMessage()), clock.instant());
            log.atError().addKeyValue("session", session.sessionName()).log("Batch discovery failed: {}", e.toString());
            throw e;
        }
        BatchStats result = stats.toStats();
        log.info("Batch discovery finished: {}", result);
        return result;
    }

    /**
     * @return false if the walk was asked to stop part way through the batch
     */
    private boolean walkBatch(long sessionId, int batchIndex, JsonNode batch, int skipThrough, boolean autoEnqueue,
                              Counters stats) throws NewsaggerException, InterruptedException {
        String batchName = batch.path("name").asText("");
        String batchUrl = batch.path("url").asText("");
        JsonNode detail = untilClear(sessionId, batchIndex, 0, () -> api.getBatchDetail(batchUrl));
        if (detail == null) return false;
        JsonNode issues = detail.path("issues");
        db.batchSessions().setTotalIssuesInBatch(sessionId, issues.size(), clock.instant());
        log.atInfo().addKeyValue("batch", batchName).log("Batch has {} issues", issues.size());

        for (int issueIndex = 1; issueIndex <= issues.size(); issueIndex++) {
            if (issueIndex <= skipThrough) continue;
            if (stopRequested) return false;
            JsonNode issue = issues.get(issueIndex - 1);
            String issueUrl = issue.path("url").asText("");
            ResponseProcessor.IssueRef ref = ResponseProcessor.parseIssueUrl(issueUrl);
            if (ref != null && db.pages().countForIssue(ref.lccn(), ref.date(), ref.edition()) > 0) {
                db.batchSessions().finishIssue(sessionId, issueIndex, 0, 0, clock.instant());
                stats.skipped++;
                continue;
            }
            try {
                int index = issueIndex;
                JsonNode issueDetail = untilClear(sessionId, batchIndex, index, () -> api.getIssueDetail(issueUrl));
                if (issueDetail == null) return false;
                storeIssue(sessionId, index, issueUrl, ref, issueDetail, autoEnqueue, stats);
            } catch (FatalRequestException e) {
                log.atWarn().addKeyValue("batch", batchName).addKeyValue("issue", issueUrl)
                        .log("Skipping issue: {}", e.getMessage());
                db.batchSessions().finishIssue(sessionId, issueIndex, 0, 0, clock.instant());
                stats.errors++;
            }
        }
        return true;
    }

    private void storeIssue(long sessionId, int issueIndex, String issueUrl, ResponseProcessor.@Nullable IssueRef ref,
                            JsonNode issueDetail, boolean autoEnqueue, Counters stats) {
        var pages = new ArrayList<Page>();
        for (JsonNode pageEntry : issueDetail.path("pages")) {
            Page page = processor.processIssuePage(pageEntry, issueDetail);
            if (page != null) pages.add(page);
        }
        Instant now = clock.instant();
        int enqueued = db.inTransaction(txn -> {
            txn.pages().storeAll(pages, now);
            if (ref != null && txn.periodicals().find(ref.lccn()) != null) {
                txn.issues().insert(ref.lccn(), ref.date(), ref.edition(), pages.size(), issueUrl, now);
            }
            int count = 0;
            if (autoEnqueue) {
                for (Page page : pages) {
                    if (txn.queue().enqueueIfAbsent(QueueItem.Type.PAGE, page.itemId(), AUTO_ENQUEUE_PRIORITY,
                            PAGE_SIZE_MB, PAGE_TIME_HOURS, now)) count++;
                }
            }
            txn.batchSessions().finishIssue(sessionId, issueIndex, pages.size(), count, now);
            return count;
        });
        stats.issues++;
        stats.pages += pages.size();
        stats.enqueued += enqueued;
        log.atDebug().addKeyValue("issue", issueUrl).log("Stored {} pages, queued {}", pages.size(), enqueued);
    }

    /**
     * Runs a request, waiting out any CAPTCHA cooling-off and retrying until it gets through. The session is marked
     * blocked at the given position for as long as the wait lasts, and stays blocked if the walk is stopped during it.
     *
     * @return the response, or null if the walk was asked to stop while waiting
     */
    private @Nullable JsonNode untilClear(long sessionId, int batchIndex, int issueIndex, ApiCall call)
            throws NewsaggerException, InterruptedException {
        while (true) {
            try {
                return call.run();
            } catch (CaptchaDetectedException e) {
                db.batchSessions().markCaptchaBlocked(sessionId, batchIndex, issueIndex, clock.instant());
                log.atWarn().addKeyValue("batch", batchIndex + 1).addKeyValue("issue", issueIndex)
                        .log("CAPTCHA challenge, pausing batch discovery: {}", e.reason());
                if (!awaitCoolingOff()) {
                    log.info("Stopped during cooling-off, batch {} issue {} will be retried on resume",
                            batchIndex + 1, issueIndex);
                    return null;
                }
                db.batchSessions().clearCaptchaBlock(sessionId, clock.instant());
                log.info("Cooling-off over, retrying batch {} issue {}", batchIndex + 1, issueIndex);
            }
        }
    }

    /**
     * @return false if the walk was asked to stop before the cooling-off ended
     */
    private boolean awaitCoolingOff() throws InterruptedException {
        GlobalCaptchaManager captchaManager = api.client().captchaManager();
        while (true) {
            var gate = captchaManager.canMakeRequests();
            if (gate.allowed()) return true;
            log.info("Batch discovery blocked: {}, checking again in {}s", gate.reason(),
                    config.batchCaptchaPollInterval().toSeconds());
            if (!sleeper.sleepUnless(() -> stopRequested, config.batchCaptchaPollInterval())) return false;
        }
    }

    @FunctionalInterface
    private interface ApiCall {
        JsonNode run() throws NewsaggerException, InterruptedException;
    }

    private static class Counters {
        int batches;
        int issues;
        int skipped;
        long pages;
        long enqueued;
        int errors;

        BatchStats toStats() {
            return new BatchStats(batches, issues, skipped, pages, enqueued, errors);
        }
    }

    /**
     * Totals of one run of the walk.
     *
     * @param batchesProcessed batches fully walked in this run
     * @param issuesSkipped    issues whose pages were already stored
     * @param errors           issues that could not be fetched
     */
    public record BatchStats(int batchesProcessed, int issuesProcessed, int issuesSkipped, long pagesDiscovered,
                             long pagesEnqueued, int errors) {
    }
}
