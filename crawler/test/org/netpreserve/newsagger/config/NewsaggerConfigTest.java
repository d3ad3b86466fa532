package org.netpreserve.newsagger.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.newsagger.Newsagger;
import org.netpreserve.newsagger.api.GlobalCaptchaManager;
import org.netpreserve.newsagger.api.RateLimitedClient;
import org.netpreserve.newsagger.util.DurationDeserializer;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NewsaggerConfigTest {
    @TempDir
    Path dataDir;

    @Test
    void bundledDefaultsMatchTheBuiltInOnes() throws Exception {
        NewsaggerConfig config = Newsagger.loadConfig(dataDir, Map.of());
        assertEquals(NewsaggerConfig.defaults(), config);
    }

    @Test
    void userConfigOverridesOnlyWhatItNames() throws Exception {
        Files.writeString(dataDir.resolve("config.yaml"), """
                api:
                  requestDelay: 5s
                  captchaCoolingOff: 1h30m
                download:
                  fileTypes: [pdf, ocr]
                  maxIdle: PT10M
                discovery:
                  batchSize: 50
                  maxItems: 1000
                """);

        NewsaggerConfig config = Newsagger.loadConfig(dataDir, Map.of());

        assertEquals(Duration.ofSeconds(5), config.api().requestDelay());
        assertEquals(Duration.ofMinutes(90), config.api().captchaCoolingOff());
        assertEquals(3, config.api().maxRetries());
        assertEquals(EnumSet.of(DownloadConfig.FileType.PDF, DownloadConfig.FileType.OCR),
                config.download().fileTypes());
        assertEquals(Duration.ofMinutes(10), config.download().maxIdle());
        assertEquals(10, config.download().batchUpdateSize());
        assertEquals(50, config.discovery().batchSize());
        assertEquals(1000, config.discovery().maxItems());
        assertEquals(DiscoveryConfig.DEFAULT_SESSION_NAME, config.discovery().sessionName());
    }

    @Test
    void environmentOverridesTheConfigFiles() throws Exception {
        Files.writeString(dataDir.resolve("config.yaml"), """
                api:
                  maxRetries: 7
                """);

        NewsaggerConfig config = Newsagger.loadConfig(dataDir, Map.of(
                "LOC_BASE_URL", "http://localhost:8080/",
                "REQUEST_DELAY", "4.5",
                "MAX_RETRIES", "2",
                "DATABASE_PATH", "/var/lib/newsagger/state.db",
                "DOWNLOAD_DIR", "/srv/newspapers"));

        assertEquals(URI.create("http://localhost:8080/"), config.api().baseUrl());
        assertEquals(Duration.ofMillis(4500), config.api().requestDelay());
        assertEquals(2, config.api().maxRetries());
        assertEquals(Path.of("/var/lib/newsagger/state.db"), config.storage().database());
        assertEquals(Path.of("/srv/newspapers"), config.storage().downloads());
    }

    @Test
    void requestDelayBelowTheFloorIsRaised() throws Exception {
        NewsaggerConfig config = Newsagger.loadConfig(dataDir, Map.of("REQUEST_DELAY", "1"));
        assertEquals(Duration.ofSeconds(1), config.api().requestDelay());

        var client = new RateLimitedClient(config.api(), new GlobalCaptchaManager());
        assertEquals(Duration.ofSeconds(3), client.requestDelay());
    }

    @Test
    void durationForms() {
        assertEquals(Duration.ofSeconds(3), DurationDeserializer.parse("3s"));
        assertEquals(Duration.ofMillis(250), DurationDeserializer.parse("250ms"));
        assertEquals(Duration.ofMinutes(90), DurationDeserializer.parse("1h30m"));
        assertEquals(Duration.ofMinutes(5), DurationDeserializer.parse("PT5M"));
    }
}
