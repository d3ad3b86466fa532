package org.netpreserve.newsagger.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.netpreserve.newsagger.*;
import org.netpreserve.newsagger.api.*;
import org.netpreserve.newsagger.config.ApiConfig;
import org.netpreserve.newsagger.config.DiscoveryConfig;
import org.netpreserve.newsagger.util.FakeClock;
import org.netpreserve.newsagger.util.Sleeper;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(InMemoryDatabaseTestExtension.class)
class BatchDiscoveryProcessorTest {
    private static final ObjectMapper mapper = new ObjectMapper();
    private static final String SITE = "https://chroniclingamerica.loc.gov";
    private static final String BATCH_URL = SITE + "/batches/batch_curiv_ahwahnee_ver01.json";

    private final Database database;
    private FakeClock clock;
    private GlobalCaptchaManager captchaManager;
    private LocApiClient api;
    private BatchDiscoveryProcessor processor;

    BatchDiscoveryProcessorTest(Database database) {
        this.database = database;
    }

    @BeforeEach
    void setUp() throws Exception {
        InMemoryDatabaseTestExtension.clear(database);
        clock = new FakeClock();
        captchaManager = new GlobalCaptchaManager(clock, Duration.ofMinutes(60));
        api = mock(LocApiClient.class);
        when(api.client()).thenReturn(new RateLimitedClient(ApiConfig.defaults(), captchaManager,
                HttpClient.newHttpClient(), clock, clock.sleeper()));
        ObjectNode batch = mapper.createObjectNode().put("name", "batch_curiv_ahwahnee_ver01").put("url", BATCH_URL);
        when(api.getAllBatches()).thenReturn(List.of(batch));
        ObjectNode detail = mapper.createObjectNode();
        var issues = detail.putArray("issues");
        for (int i = 1; i <= 5; i++) {
            issues.addObject().put("url", issueUrl(i)).put("date_issued", issueDate(i));
            when(api.getIssueDetail(issueUrl(i))).thenReturn(issue(i));
        }
        when(api.getBatchDetail(BATCH_URL)).thenReturn(detail);
        processor = new BatchDiscoveryProcessor(database, api, new ResponseProcessor(), DiscoveryConfig.defaults(),
                clock, clock.sleeper());
    }

    private static String issueDate(int i) {
        return "1906-04-1" + i;
    }

    private static String issueUrl(int i) {
        return SITE + "/lccn/sn85066387/" + issueDate(i) + "/ed-1.json";
    }

    private static JsonNode issue(int i) {
        ObjectNode issue = mapper.createObjectNode();
        issue.putObject("title").put("name", "The San Francisco call.").put("url", SITE + "/lccn/sn85066387.json");
        issue.put("date_issued", issueDate(i));
        var pages = issue.putArray("pages");
        for (int seq = 1; seq <= 2; seq++) {
            pages.addObject().put("sequence", seq)
                    .put("url", SITE + "/lccn/sn85066387/" + issueDate(i) + "/ed-1/seq-" + seq + ".json");
        }
        return issue;
    }

    private BatchSession session() {
        return database.batchSessions().findByName(DiscoveryConfig.DEFAULT_SESSION_NAME);
    }

    @Test
    void captchaOnOneIssueStillDiscoversEveryPage() throws Exception {
        when(api.getIssueDetail(issueUrl(3)))
                .thenAnswer(invocation -> {
                    captchaManager.recordCaptcha(issueUrl(3));
                    throw new CaptchaDetectedException(issueUrl(3), "challenge");
                })
                .thenReturn(issue(3));

        var stats = processor.discoverAllBatches(null, false);

        assertEquals(10, database.pages().count());
        assertEquals(10, stats.pagesDiscovered());
        assertEquals(5, stats.issuesProcessed());
        assertEquals(1, stats.batchesProcessed());
        verify(api, times(2)).getIssueDetail(issueUrl(3));

        BatchSession session = session();
        assertEquals(BatchSession.Status.COMPLETED, session.status());
        assertEquals(5, session.currentIssueIndex());
        assertEquals(10, session.totalPagesDiscovered());
        assertNull(session.blockedIssueIndex());
        // waited in short slices until the hour of cooling-off was over
        assertTrue(clock.sleeps().stream().mapToLong(Duration::toSeconds).sum() >= 3600);
        assertTrue(clock.sleeps().stream().allMatch(sleep -> sleep.compareTo(Duration.ofSeconds(1)) <= 0));
    }

    @Test
    void stopDuringCoolingOffLeavesTheIssueForTheNextRun() throws Exception {
        when(api.getIssueDetail(issueUrl(3)))
                .thenAnswer(invocation -> {
                    captchaManager.recordCaptcha(issueUrl(3));
                    throw new CaptchaDetectedException(issueUrl(3), "challenge");
                })
                .thenReturn(issue(3));
        var stopping = new AtomicReference<BatchDiscoveryProcessor>();
        var slept = new AtomicInteger();
        Sleeper sleeper = duration -> {
            clock.sleeper().sleep(duration);
            if (slept.incrementAndGet() == 10) stopping.get().requestStop();
        };
        stopping.set(new BatchDiscoveryProcessor(database, api, new ResponseProcessor(), DiscoveryConfig.defaults(),
                clock, sleeper));
        var start = clock.instant();

        var stats = stopping.get().discoverAllBatches(null, false);

        assertEquals(2, stats.issuesProcessed());
        assertEquals(0, stats.batchesProcessed());
        assertTrue(clock.instant().isBefore(start.plus(Duration.ofMinutes(1))));
        verify(api, never()).getIssueDetail(issueUrl(4));
        BatchSession session = session();
        assertEquals(BatchSession.Status.CAPTCHA_BLOCKED, session.status());
        assertEquals(2, session.currentIssueIndex());
        assertEquals(3, session.blockedIssueIndex());

        clock.advance(Duration.ofMinutes(60));
        var resumed = processor.discoverAllBatches(null, false);

        assertEquals(3, resumed.issuesProcessed());
        assertEquals(10, database.pages().count());
        assertEquals(BatchSession.Status.COMPLETED, session().status());
    }

    @Test
    void resumesAfterTheLastFinishedIssue() throws Exception {
        var sessions = database.batchSessions();
        BatchSession earlier = sessions.open(DiscoveryConfig.DEFAULT_SESSION_NAME, 1, false, clock.instant());
        sessions.startBatch(earlier.id(), 0, "batch_curiv_ahwahnee_ver01", clock.instant());
        sessions.finishIssue(earlier.id(), 2, 4, 0, clock.instant());

        var stats = processor.discoverAllBatches(null, false);

        verify(api, never()).getIssueDetail(issueUrl(1));
        verify(api, never()).getIssueDetail(issueUrl(2));
        verify(api).getIssueDetail(issueUrl(3));
        assertEquals(3, stats.issuesProcessed());
        assertEquals(6, stats.pagesDiscovered());
        assertEquals(10, session().totalPagesDiscovered());
    }

    @Test
    void issuesWithStoredPagesAreSkipped() throws Exception {
        database.pages().storeAll(List.of(Fixtures.page("sn85066387", issueDate(1), 1)), clock.instant());

        var stats = processor.discoverAllBatches(null, false);

        verify(api, never()).getIssueDetail(issueUrl(1));
        assertEquals(1, stats.issuesSkipped());
        assertEquals(4, stats.issuesProcessed());
    }

    @Test
    void autoEnqueueQueuesEveryPage() throws Exception {
        var stats = processor.discoverAllBatches(null, true);

        assertEquals(10, stats.pagesEnqueued());
        List<QueueItem> queued = database.queue().list(QueueItem.Status.QUEUED, 100);
        assertEquals(10, queued.size());
        assertTrue(queued.stream().allMatch(item -> item.priority() == 2));
        assertEquals(10, session().totalPagesEnqueued());
    }

    @Test
    void missingIssueIsCountedAndSkipped() throws Exception {
        when(api.getIssueDetail(issueUrl(2))).thenThrow(new FatalRequestException("HTTP 404", 404));

        var stats = processor.discoverAllBatches(null, false);

        assertEquals(1, stats.errors());
        assertEquals(8, database.pages().count());
        assertEquals(BatchSession.Status.COMPLETED, session().status());
    }

    @Test
    void networkFailureMarksTheSessionAsError() throws Exception {
        when(api.getIssueDetail(issueUrl(4)))
                .thenThrow(new TransientNetworkException(issueUrl(4), new IOException("connection reset")));

        assertThrows(TransientNetworkException.class, () -> processor.discoverAllBatches(null, false));

        BatchSession session = session();
        assertEquals(BatchSession.Status.ERROR, session.status());
        assertEquals(3, session.currentIssueIndex());
        assertNotNull(session.errorMessage());

        // the next run picks up at the failed issue
        doReturn(issue(4)).when(api).getIssueDetail(issueUrl(4));
        clearInvocations(api);
        var stats = processor.discoverAllBatches(null, false);

        assertEquals(2, stats.issuesProcessed());
        verify(api, never()).getIssueDetail(issueUrl(3));
        assertEquals(BatchSession.Status.COMPLETED, session().status());
        assertEquals(10, database.pages().count());
    }
}
