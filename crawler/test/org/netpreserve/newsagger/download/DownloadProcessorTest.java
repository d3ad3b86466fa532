package org.netpreserve.newsagger.download;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.newsagger.*;
import org.netpreserve.newsagger.api.CaptchaDetectedException;
import org.netpreserve.newsagger.api.LocApiClient;
import org.netpreserve.newsagger.api.TransientNetworkException;
import org.netpreserve.newsagger.config.DownloadConfig;
import org.netpreserve.newsagger.config.DownloadConfig.FileType;
import org.netpreserve.newsagger.util.FakeClock;
import org.netpreserve.newsagger.util.Sleeper;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.netpreserve.newsagger.Fixtures.page;

@ExtendWith(InMemoryDatabaseTestExtension.class)
class DownloadProcessorTest {
    private static final byte[] PDF_BYTES = new byte[2048];

    private final Database database;
    @TempDir
    Path downloadDir;
    private FakeClock clock;
    private LocApiClient api;
    private DownloadConfig config;
    private DownloadProcessor processor;

    DownloadProcessorTest(Database database) {
        this.database = database;
    }

    @BeforeEach
    void setUp() throws Exception {
        InMemoryDatabaseTestExtension.clear(database);
        clock = new FakeClock();
        api = mock(LocApiClient.class);
        when(api.download(any(URI.class), any(Path.class), any())).thenAnswer(invocation -> {
            Path target = invocation.getArgument(1);
            Files.write(target, PDF_BYTES);
            return (long) PDF_BYTES.length;
        });
        config = new DownloadConfig(EnumSet.of(FileType.PDF, FileType.OCR, FileType.METADATA),
                Duration.ofMinutes(5), Duration.ofSeconds(1), 10, Duration.ofSeconds(5), Duration.ofSeconds(30));
        processor = new DownloadProcessor(database, api, config, downloadDir, clock, clock.sleeper());
    }

    private Page storedPage(String date, int sequence) {
        Page page = page("sn85066387", date, sequence);
        database.pages().storeAll(List.of(page), clock.instant());
        return page;
    }

    private void enqueue(QueueItem.Type type, String referenceId, int priority) {
        assertTrue(database.queue().enqueueIfAbsent(type, referenceId, priority, 1.0, 0.1, clock.instant()));
    }

    private QueueItem.Status statusOf(String referenceId) {
        return database.queue().list(null, 100).stream()
                .filter(item -> item.referenceId().equals(referenceId))
                .findFirst().orElseThrow().status();
    }

    @Test
    void continuousModeStopsAfterIdleTimeout() throws Exception {
        Page first = storedPage("1906-04-19", 1);
        Page second = storedPage("1906-04-19", 2);
        enqueue(QueueItem.Type.PAGE, first.itemId(), 1);
        enqueue(QueueItem.Type.PAGE, second.itemId(), 1);

        var summary = processor.processQueue(null, true, Duration.ofSeconds(3), false, null);

        assertEquals(2, summary.itemsProcessed());
        assertEquals(2, summary.itemsCompleted());
        assertEquals(0, summary.errors());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(1), Duration.ofSeconds(1)), clock.sleeps());
        assertEquals(QueueItem.Status.COMPLETED, statusOf(first.itemId()));
        assertTrue(database.pages().find(second.itemId()).downloaded());
        assertFalse(processor.isRunning());

        Path dir = downloadDir.resolve("sn85066387").resolve("1906").resolve("04");
        String base = first.safeItemId();
        assertEquals(2048, Files.size(dir.resolve(base + ".pdf")));
        assertEquals("page 1 text", Files.readString(dir.resolve(base + "_ocr.txt")));
        assertTrue(Files.readString(dir.resolve(base + "_metadata.json")).contains("\"item_id\""));

        var stats = processor.downloadStats();
        assertEquals(2, stats.pagesKnown());
        assertEquals(2, stats.pagesDownloaded());
        assertEquals(6, stats.filesOnDisk());
    }

    @Test
    void oneFailingItemDoesNotStopTheRest() throws Exception {
        Page good = storedPage("1906-04-19", 1);
        Page bad = storedPage("1906-04-19", 2);
        when(api.download(eq(URI.create(bad.pdfUrl())), any(Path.class), any()))
                .thenThrow(new TransientNetworkException(bad.pdfUrl(), new IOException("connection reset")));
        enqueue(QueueItem.Type.PAGE, bad.itemId(), 1);
        enqueue(QueueItem.Type.PAGE, "/lccn/sn0000000/1900-01-01/ed-1/seq-1/", 1);
        enqueue(QueueItem.Type.PAGE, good.itemId(), 2);

        var summary = processor.processQueue(null, false, null, false, null);

        assertEquals(3, summary.itemsProcessed());
        assertEquals(1, summary.itemsCompleted());
        assertEquals(2, summary.errors());
        assertEquals(QueueItem.Status.FAILED, statusOf(bad.itemId()));
        assertEquals(QueueItem.Status.FAILED, statusOf("/lccn/sn0000000/1900-01-01/ed-1/seq-1/"));
        assertEquals(QueueItem.Status.COMPLETED, statusOf(good.itemId()));
        assertFalse(database.pages().find(bad.itemId()).downloaded());

        assertEquals(2, processor.resumeFailed());
        assertEquals(QueueItem.Status.QUEUED, statusOf(bad.itemId()));
    }

    @Test
    void captchaPutsTheItemBackInTheQueue() throws Exception {
        Page page = storedPage("1906-04-19", 1);
        enqueue(QueueItem.Type.PAGE, page.itemId(), 1);
        when(api.download(any(URI.class), any(Path.class), any()))
                .thenThrow(new CaptchaDetectedException(page.pdfUrl(), "challenge"))
                .thenAnswer(invocation -> {
                    Files.write(invocation.<Path>getArgument(1), PDF_BYTES);
                    return (long) PDF_BYTES.length;
                });

        var summary = processor.processQueue(null, false, null, false, null);

        assertEquals(1, summary.itemsProcessed());
        assertEquals(0, summary.errors());
        assertEquals(QueueItem.Status.COMPLETED, statusOf(page.itemId()));
        verify(api, times(2)).download(any(URI.class), any(Path.class), any());
    }

    @Test
    void facetItemDownloadsThePagesInItsRange() throws Exception {
        storedPage("1906-04-18", 1);
        storedPage("1906-04-19", 1);
        Page outside = storedPage("1910-01-01", 1);
        Long facetId = database.facets().createIfAbsent("date_range", "1906/1906", null, 0, clock.instant());
        assertNotNull(facetId);
        enqueue(QueueItem.Type.FACET, String.valueOf(facetId), 1);

        var summary = processor.processQueue(null, false, null, false, null);

        assertEquals(1, summary.itemsCompleted());
        assertEquals(2, database.pages().countDownloaded());
        assertFalse(database.pages().find(outside.itemId()).downloaded());
        assertEquals(2, database.facets().find(facetId).itemsDownloaded());
    }

    @Test
    void shutdownRequestStopsAFacetItemAfterTheCurrentPage() throws Exception {
        storedPage("1906-04-18", 1);
        storedPage("1906-04-19", 1);
        storedPage("1906-04-20", 1);
        Page single = storedPage("1910-01-01", 1);
        Long facetId = database.facets().createIfAbsent("date_range", "1906/1906", null, 0, clock.instant());
        assertNotNull(facetId);
        enqueue(QueueItem.Type.FACET, String.valueOf(facetId), 1);
        enqueue(QueueItem.Type.PAGE, single.itemId(), 2);
        when(api.download(any(URI.class), any(Path.class), any())).thenAnswer(invocation -> {
            processor.requestShutdown();
            Files.write(invocation.<Path>getArgument(1), PDF_BYTES);
            return (long) PDF_BYTES.length;
        });

        var summary = processor.processQueue(null, false, null, false, null);

        assertEquals(0, summary.itemsProcessed());
        assertEquals(0, summary.errors());
        verify(api, times(1)).download(any(URI.class), any(Path.class), any());
        QueueItem facetItem = database.queue().list(null, 100).stream()
                .filter(item -> item.queueType() == QueueItem.Type.FACET).findFirst().orElseThrow();
        assertEquals(QueueItem.Status.QUEUED, facetItem.status());
        assertEquals(100.0 / 3, facetItem.progressPercent(), 0.01);
        assertEquals(1, database.pages().countDownloaded());
        assertEquals(QueueItem.Status.QUEUED, statusOf(single.itemId()));
        assertFalse(database.pages().find(single.itemId()).downloaded());
        assertFalse(processor.isRunning());
    }

    @Test
    void forceQuitInterruptsABlockedDownloadAndRequeuesTheItem() throws Exception {
        Page page = storedPage("1906-04-19", 1);
        enqueue(QueueItem.Type.PAGE, page.itemId(), 1);
        var started = new CountDownLatch(1);
        when(api.download(any(URI.class), any(Path.class), any())).thenAnswer(invocation -> {
            started.countDown();
            Thread.sleep(60_000);
            return 0L;
        });
        var blocking = new DownloadProcessor(database, api, config, downloadDir, Clock.systemUTC(), Sleeper.SYSTEM);
        var failure = new AtomicReference<Throwable>();
        var thread = new Thread(() -> {
            try {
                blocking.processQueue(null, false, null, false, null);
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        thread.start();
        assertTrue(started.await(10, TimeUnit.SECONDS));

        blocking.forceQuit();
        thread.join(5000);

        assertFalse(thread.isAlive());
        assertInstanceOf(InterruptedException.class, failure.get());
        assertEquals(QueueItem.Status.QUEUED, statusOf(page.itemId()));
        assertFalse(database.pages().find(page.itemId()).downloaded());
        assertFalse(blocking.isRunning());
    }

    @Test
    void forceQuitEndsTheIdleWait() throws Exception {
        var idle = new DownloadProcessor(database, api, config, downloadDir, Clock.systemUTC(), Sleeper.SYSTEM);
        var thread = new Thread(() -> {
            try {
                idle.processQueue(null, true, Duration.ofMinutes(10), false, null);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        thread.start();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!idle.isRunning() && thread.isAlive() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }

        idle.forceQuit();
        thread.join(5000);

        assertFalse(thread.isAlive());
        assertFalse(idle.isRunning());
    }

    @Test
    void progressRestartsForEachFileOfAPage() {
        var reported = new ArrayList<Double>();
        var listener = new DownloadProcessor.PercentListener(reported::add);

        listener.progress(500, 1000);
        listener.progress(990, 1000);
        listener.progress(1000, 1000);
        // second rendition, larger file
        listener.progress(250, 2500);
        listener.progress(2500, 2500);
        // third rendition, same size as the second
        listener.progress(500, 2500);
        // unknown length is not reported
        listener.progress(100, -1);

        assertEquals(List.of(50.0, 90.0, 100.0, 10.0, 100.0, 20.0), reported);
    }

    @Test
    void itemLimitLeavesTheRestQueued() throws Exception {
        Page urgent = storedPage("1906-04-19", 1);
        Page later = storedPage("1906-04-19", 2);
        enqueue(QueueItem.Type.PAGE, later.itemId(), 5);
        enqueue(QueueItem.Type.PAGE, urgent.itemId(), 1);

        var summary = processor.processQueue(1, false, null, false, null);

        assertEquals(1, summary.itemsProcessed());
        assertEquals(QueueItem.Status.COMPLETED, statusOf(urgent.itemId()));
        assertEquals(QueueItem.Status.QUEUED, statusOf(later.itemId()));
    }

    @Test
    void dryRunOnlyEstimates() throws Exception {
        for (int sequence = 1; sequence <= 3; sequence++) {
            enqueue(QueueItem.Type.PAGE, storedPage("1906-04-19", sequence).itemId(), 1);
        }

        var summary = processor.processQueue(null, false, null, true, 2.5);

        assertTrue(summary.dryRun());
        assertEquals(2, summary.itemsProcessed());
        assertEquals(2.0, summary.estimatedSizeMb(), 0.001);
        assertEquals(3, database.queue().countByStatus(QueueItem.Status.QUEUED));
        verifyNoInteractions(api);
    }

    @Test
    void resetStuckRequeuesActiveItems() {
        enqueue(QueueItem.Type.PAGE, storedPage("1906-04-19", 1).itemId(), 1);
        QueueItem item = database.queue().list(QueueItem.Status.QUEUED, 1).get(0);
        database.queue().markActive(item.id(), clock.instant());

        assertEquals(1, processor.resetStuck());
        assertEquals(QueueItem.Status.QUEUED, database.queue().find(item.id()).status());
    }

    @Test
    void cleanupRemovesIncompleteFiles() throws Exception {
        Path dir = Files.createDirectories(downloadDir.resolve("sn85066387/1906/04"));
        Files.write(dir.resolve("good.pdf"), PDF_BYTES);
        Files.write(dir.resolve("truncated.pdf"), new byte[100]);
        Files.write(dir.resolve("partial.jp2.part"), new byte[4096]);
        Files.createFile(dir.resolve("empty.jp2"));

        var stats = processor.cleanupIncomplete();

        assertEquals(3, stats.filesRemoved());
        assertEquals(4196, stats.bytesFreed());
        assertTrue(Files.exists(dir.resolve("good.pdf")));
        assertFalse(Files.exists(dir.resolve("truncated.pdf")));
    }
}
