package org.netpreserve.newsagger.download;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.newsagger.*;
import org.netpreserve.newsagger.api.CaptchaDetectedException;
import org.netpreserve.newsagger.api.LocApiClient;
import org.netpreserve.newsagger.api.RateLimitedClient;
import org.netpreserve.newsagger.config.DownloadConfig;
import org.netpreserve.newsagger.db.DownloadQueueDAO;
import org.netpreserve.newsagger.db.FacetUpdate;
import org.netpreserve.newsagger.db.PageScope;
import org.netpreserve.newsagger.discovery.FacetKind;
import org.netpreserve.newsagger.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleConsumer;
import java.util.stream.Stream;

/**
 * Works the download queue in priority order. One item is processed at a time and a failed item never stops the run.
 * <p>
 * Shutdown is cooperative: {@link #requestShutdown()} lets the current page finish and puts its item back in the
 * queue, {@link #forceQuit()} additionally interrupts the worker thread so a blocked download or wait ends at once.
 */
public class DownloadProcessor {
    private static final Logger log = LoggerFactory.getLogger(DownloadProcessor.class);
    static final long MIN_PDF_BYTES = 1024;
    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final Database db;
    private final PageFiles pageFiles;
    private final Path downloadDir;
    private final DownloadConfig config;
    private final Clock clock;
    private final Sleeper sleeper;
    private volatile boolean shutdownRequested;
    private volatile @Nullable Thread worker;

    public DownloadProcessor(Database db, LocApiClient api, DownloadConfig config, Path downloadDir, Clock clock,
                             Sleeper sleeper) {
        this.db = db;
        this.pageFiles = new PageFiles(downloadDir, config.fileTypes(), api, clock);
        this.downloadDir = downloadDir;
        this.config = config;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public void requestShutdown() {
        shutdownRequested = true;
    }

    public void forceQuit() {
        shutdownRequested = true;
        Thread thread = worker;
        if (thread != null) thread.interrupt();
    }

    public boolean isRunning() {
        return worker != null;
    }

    /**
     * Downloads queued items.
     *
     * @param maxItems   stop after this many items (null for no limit)
     * @param continuous keep polling for new items until the queue has been empty for {@code maxIdle}
     * @param maxIdle    idle limit in continuous mode, null for the configured default
     * @param dryRun     only report what would be downloaded
     * @param maxSizeMb  stop before an item whose estimated size would take the run past this (null for no limit)
     */
    public DownloadSummary processQueue(@Nullable Integer maxItems, boolean continuous, @Nullable Duration maxIdle,
                                       boolean dryRun, @Nullable Double maxSizeMb) throws InterruptedException {
        if (dryRun) return dryRun(maxItems, maxSizeMb);
        Duration idleLimit = maxIdle != null ? maxIdle : config.maxIdle();
        Instant started = clock.instant();
        var counters = new Counters();
        var buffer = new StatusBuffer();
        worker = Thread.currentThread();
        log.info("Processing download queue (continuous={}, maxItems={})", continuous, maxItems);
        try (var reporter = new ProgressReporter(counters::toString, config.progressInterval())) {
            Instant idleSince = null;
            double estimatedTaken = 0;
            cycles:
            while (!shutdownRequested) {
                int limit = config.batchUpdateSize();
                if (maxItems != null) {
                    int left = maxItems - counters.processed;
                    if (left <= 0) break;
                    limit = Math.min(limit, left);
                }
                List<QueueItem> items = db.queue().list(QueueItem.Status.QUEUED, limit);
                if (items.isEmpty()) {
                    if (!continuous) break;
                    Instant now = clock.instant();
                    if (idleSince == null) {
                        idleSince = now;
                        log.info("Queue empty, waiting up to {}s for new items", idleLimit.toSeconds());
                    }
                    Duration idle = Duration.between(idleSince, now);
                    if (idle.compareTo(idleLimit) >= 0) {
                        log.info("Queue idle for {}s, stopping", idle.toSeconds());
                        break;
                    }
                    Duration remaining = idleLimit.minus(idle);
                    sleeper.sleep(remaining.compareTo(config.idlePollInterval()) < 0 ? remaining
                            : config.idlePollInterval());
                    continue;
                }
                idleSince = null;
                counters.batches++;
                for (QueueItem item : items) {
                    if (shutdownRequested) break cycles;
                    if (maxSizeMb != null && estimatedTaken + item.estimatedSizeMb() > maxSizeMb) {
                        log.info("Size limit of {} MB reached", maxSizeMb);
                        break cycles;
                    }
                    estimatedTaken += item.estimatedSizeMb();
                    process(item, buffer, counters);
                }
                buffer.flush();
            }
        } finally {
            buffer.flush();
            worker = null;
        }
        var summary = new DownloadSummary(counters.processed, counters.completed, counters.failed, counters.batches,
                counters.bytes / BYTES_PER_MB, counters.estimatedMb, false,
                Duration.between(started, clock.instant()));
        log.info("Download run finished: {}", summary);
        return summary;
    }

    private DownloadSummary dryRun(@Nullable Integer maxItems, @Nullable Double maxSizeMb) {
        List<QueueItem> items = db.queue().list(QueueItem.Status.QUEUED,
                maxItems != null ? maxItems : Integer.MAX_VALUE);
        int count = 0;
        double estimated = 0;
        for (QueueItem item : items) {
            if (maxSizeMb != null && estimated + item.estimatedSizeMb() > maxSizeMb) break;
            estimated += item.estimatedSizeMb();
            count++;
        }
        log.info("Dry run: would download {} items, about {} MB", count, Math.round(estimated));
        return new DownloadSummary(count, 0, 0, 0, 0, estimated, true, Duration.ZERO);
    }

    private void process(QueueItem item, StatusBuffer buffer, Counters counters) throws InterruptedException {
        db.queue().markActive(item.id(), clock.instant());
        try {
            ItemResult result = switch (item.queueType()) {
                case PAGE -> downloadPageItem(item);
                case FACET -> downloadFacetItem(item);
                case PERIODICAL -> downloadPeriodicalItem(item);
            };
            if (result.stopped()) {
                buffer.requeue(item.id());
                counters.bytes += result.bytes();
                return;
            }
            counters.completed++;
            counters.bytes += result.bytes();
            buffer.complete(item.id());
            log.atInfo().addKeyValue("queueId", item.id()).addKeyValue("type", item.queueType())
                    .log("Downloaded {} ({} bytes)", item.referenceId(), result.bytes());
        } catch (CaptchaDetectedException e) {
            log.atWarn().addKeyValue("queueId", item.id())
                    .log("CAPTCHA challenge while downloading {}, item requeued", item.referenceId());
            buffer.requeue(item.id());
            return;
        } catch (NewsaggerException | IOException | RuntimeException e) {
            counters.failed++;
            buffer.fail(item.id(), String.valueOf(e.getMessage()));
            log.atWarn().addKeyValue("queueId", item.id()).addKeyValue("type", item.queueType())
                    .log("Download of {} failed: {}", item.referenceId(), e.toString());
        } catch (InterruptedException e) {
            buffer.requeue(item.id());
            throw e;
        }
        counters.processed++;
        counters.estimatedMb += item.estimatedSizeMb();
    }

    private ItemResult downloadPageItem(QueueItem item) throws NewsaggerException, IOException, InterruptedException {
        Page page = db.pages().find(item.referenceId());
        if (page == null) throw new DataIntegrityException("Page " + item.referenceId() + " not found in storage");
        if (page.downloaded()) {
            log.debug("Page {} already downloaded", page.itemId());
            return new ItemResult(0, false);
        }
        return new ItemResult(downloadPage(page, new PercentListener(
                percent -> db.queue().updateProgress(item.id(), percent, clock.instant()))), false);
    }

    private ItemResult downloadFacetItem(QueueItem item) throws NewsaggerException, IOException, InterruptedException {
        long facetId;
        try {
            facetId = Long.parseLong(item.referenceId());
        } catch (NumberFormatException e) {
            throw new DataIntegrityException("Invalid facet reference " + item.referenceId());
        }
        SearchFacet facet = db.facets().find(facetId);
        if (facet == null) throw new DataIntegrityException("Facet " + facetId + " not found in storage");
        PageScope scope = facet.kind().pageScope();
        if (scope == null) throw new DataIntegrityException("Facet " + facetId + " doesn't map to stored pages");
        ItemResult result = downloadPages(item, db.pages().listInScope(scope, false, Integer.MAX_VALUE));
        db.facets().update(facetId, FacetUpdate.downloaded(db.pages().countInScope(scope, true)), clock.instant());
        return result;
    }

    private ItemResult downloadPeriodicalItem(QueueItem item)
            throws NewsaggerException, IOException, InterruptedException {
        if (db.periodicals().find(item.referenceId()) == null) {
            throw new DataIntegrityException("Periodical " + item.referenceId() + " not found in storage");
        }
        return downloadPages(item, db.pages().listForPeriodical(item.referenceId(), false));
    }

    /**
     * Downloads the pages of a facet or periodical item. A page that fails is skipped and the item fails once the
     * rest are done; a shutdown request stops after the current page.
     */
    private ItemResult downloadPages(QueueItem item, List<Page> pages)
            throws NewsaggerException, IOException, InterruptedException {
        long bytes = 0;
        int failed = 0;
        int done = 0;
        for (Page page : pages) {
            if (shutdownRequested) return new ItemResult(bytes, true);
            try {
                bytes += downloadPage(page, null);
            } catch (CaptchaDetectedException e) {
                throw e;
            } catch (NewsaggerException | IOException | DataIntegrityException e) {
                failed++;
                log.atWarn().addKeyValue("queueId", item.id()).log("Page {} failed: {}", page.itemId(), e.toString());
            }
            done++;
            db.queue().updateProgress(item.id(), done * 100.0 / pages.size(), clock.instant());
        }
        if (failed > 0) throw new IOException(failed + " of " + pages.size() + " pages failed");
        return new ItemResult(bytes, false);
    }

    private long downloadPage(Page page, RateLimitedClient.@Nullable ProgressListener listener)
            throws NewsaggerException, IOException, InterruptedException {
        PageFiles.Result result = pageFiles.write(page, listener);
        if (result.files().isEmpty()) throw new IOException("No files were downloaded for page " + page.itemId());
        db.pages().markDownloaded(page.itemId());
        return result.bytes();
    }

    /**
     * Returns failed items to the queue.
     */
    public int resumeFailed() {
        int count = db.queue().requeueFailed(clock.instant());
        log.info("Requeued {} failed items", count);
        return count;
    }

    /**
     * Returns items left active by a run that died to the queue.
     */
    public int resetStuck() {
        int count = db.queue().requeueActive(clock.instant());
        log.info("Reset {} stuck items", count);
        return count;
    }

    public DownloadStats downloadStats() throws IOException {
        long files = 0;
        long bytes = 0;
        if (Files.isDirectory(downloadDir)) {
            try (Stream<Path> stream = Files.walk(downloadDir)) {
                for (Path path : (Iterable<Path>) stream.filter(Files::isRegularFile)::iterator) {
                    files++;
                    bytes += Files.size(path);
                }
            }
        }
        return new DownloadStats(db.queue().totalsByStatus(), db.pages().count(), db.pages().countDownloaded(),
                files, bytes / BYTES_PER_MB);
    }

    /**
     * Deletes empty files, PDFs too small to be real and leftover partial downloads.
     */
    public CleanupStats cleanupIncomplete() throws IOException {
        if (!Files.isDirectory(downloadDir)) return new CleanupStats(0, 0);
        var doomed = new ArrayList<Path>();
        try (Stream<Path> stream = Files.walk(downloadDir)) {
            for (Path path : (Iterable<Path>) stream.filter(Files::isRegularFile)::iterator) {
                String name = path.getFileName().toString().toLowerCase();
                long size = Files.size(path);
                if (size == 0 || name.endsWith(".part") || (name.endsWith(".pdf") && size < MIN_PDF_BYTES)) {
                    doomed.add(path);
                }
            }
        }
        long freed = 0;
        for (Path path : doomed) {
            freed += Files.size(path);
            Files.delete(path);
            log.debug("Removed incomplete file {}", path);
        }
        log.info("Removed {} incomplete files", doomed.size());
        return new CleanupStats(doomed.size(), freed);
    }

    /**
     * Reports byte progress of a page item's current file as a percentage, in steps of 10%. Each file of the page
     * starts again from zero, which shows as the byte count going backwards or the total changing.
     */
    static class PercentListener implements RateLimitedClient.ProgressListener {
        private final DoubleConsumer report;
        private long lastBytes;
        private long lastTotal;
        private int lastStep;

        PercentListener(DoubleConsumer report) {
            this.report = report;
        }

        @Override
        public void progress(long bytesRead, long totalBytes) {
            if (totalBytes != lastTotal || bytesRead < lastBytes) lastStep = 0;
            lastBytes = bytesRead;
            lastTotal = totalBytes;
            if (totalBytes <= 0) return;
            int step = (int) (bytesRead * 10 / totalBytes);
            if (step <= lastStep) return;
            lastStep = step;
            report.accept(Math.min(100.0, step * 10.0));
        }
    }

    /**
     * Collects queue status changes and writes them in one transaction.
     */
    private class StatusBuffer {
        private final List<Outcome> pending = new ArrayList<>();

        void complete(long id) {
            add(new Outcome(id, QueueItem.Status.COMPLETED, null));
        }

        void fail(long id, String error) {
            add(new Outcome(id, QueueItem.Status.FAILED, error));
        }

        void requeue(long id) {
            add(new Outcome(id, QueueItem.Status.QUEUED, null));
        }

        private void add(Outcome outcome) {
            pending.add(outcome);
            if (pending.size() >= config.batchUpdateSize()) flush();
        }

        void flush() {
            if (pending.isEmpty()) return;
            Instant now = clock.instant();
            db.useTransaction(txn -> {
                DownloadQueueDAO queue = txn.queue();
                for (Outcome outcome : pending) {
                    switch (outcome.status()) {
                        case COMPLETED -> queue.markCompleted(outcome.queueId(), now);
                        case FAILED -> queue.markFailed(outcome.queueId(), outcome.error(), now);
                        default -> queue.markQueued(outcome.queueId(), now);
                    }
                }
            });
            log.debug("Wrote {} queue status updates", pending.size());
            pending.clear();
        }
    }

    private record Outcome(long queueId, QueueItem.Status status, @Nullable String error) {
    }

    private record ItemResult(long bytes, boolean stopped) {
    }

    /**
     * Counters of a run. Written by the worker only, read by the progress reporter.
     */
    private static class Counters {
        volatile int processed;
        volatile int completed;
        volatile int failed;
        volatile int batches;
        volatile long bytes;
        volatile double estimatedMb;

        @Override
        public String toString() {
            return processed + " items (" + completed + " ok, " + failed + " failed), "
                   + Math.round(bytes / BYTES_PER_MB) + " MB in " + batches + " batches";
        }
    }

    /**
     * @param itemsProcessed  items completed or failed (items put back in the queue are not counted)
     * @param totalSizeMb     megabytes actually written
     * @param estimatedSizeMb sum of the processed items' estimates, or of the would-be items in a dry run
     */
    public record DownloadSummary(int itemsProcessed, int itemsCompleted, int errors, int batchesProcessed,
                                  double totalSizeMb, double estimatedSizeMb, boolean dryRun, Duration elapsed) {
    }

    public record DownloadStats(List<DownloadQueueDAO.StatusTotals> queue, long pagesKnown, long pagesDownloaded,
                                long filesOnDisk, double diskUsageMb) {
    }

    public record CleanupStats(int filesRemoved, long bytesFreed) {
    }
}
