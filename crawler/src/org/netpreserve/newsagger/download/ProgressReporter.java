package org.netpreserve.newsagger.download;

import org.netpreserve.newsagger.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Periodically logs the progress of a download run.
 */
class ProgressReporter implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProgressReporter.class);
    private final ScheduledExecutorService scheduler =
            Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("download-progress"));

    ProgressReporter(Supplier<String> status, Duration interval) {
        long millis = Math.max(1, interval.toMillis());
        scheduler.scheduleAtFixedRate(() -> log.info("Download progress: {}", status.get()), millis, millis,
                TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
