package org.netpreserve.newsagger.download;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.newsagger.NewsaggerException;
import org.netpreserve.newsagger.Page;
import org.netpreserve.newsagger.api.FatalRequestException;
import org.netpreserve.newsagger.api.LocApiClient;
import org.netpreserve.newsagger.api.RateLimitedClient;
import org.netpreserve.newsagger.config.DownloadConfig.FileType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Writes the files of one page under {@code root/lccn/yyyy/mm/}. Files that already exist are kept, so an
 * interrupted page can be downloaded again without fetching what it already has.
 */
class PageFiles {
    private static final Logger log = LoggerFactory.getLogger(PageFiles.class);
    private static final ObjectMapper mapper = new ObjectMapper()
            .findAndRegisterModules()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Path root;
    private final Set<FileType> fileTypes;
    private final LocApiClient api;
    private final Clock clock;

    PageFiles(Path root, Set<FileType> fileTypes, LocApiClient api, Clock clock) {
        this.root = root;
        this.fileTypes = fileTypes;
        this.api = api;
        this.clock = clock;
    }

    Path directoryFor(Page page) {
        String date = page.date();
        String year = date.length() >= 4 ? date.substring(0, 4) : "unknown";
        String month = date.length() >= 7 ? date.substring(5, 7) : "unknown";
        return root.resolve(page.lccn().isEmpty() ? "unknown" : page.lccn()).resolve(year).resolve(month);
    }

    /**
     * Writes every requested file the page has. A rendition the server doesn't have (4xx) is skipped.
     */
    Result write(Page page, @Nullable RateLimitedClient.ProgressListener listener)
            throws NewsaggerException, IOException, InterruptedException {
        Path dir = directoryFor(page);
        Files.createDirectories(dir);
        String base = page.safeItemId();
        var written = new ArrayList<Path>();
        long bytes = 0;

        if (fileTypes.contains(FileType.PDF) && page.pdfUrl() != null) {
            bytes += fetch(page.pdfUrl(), dir.resolve(base + ".pdf"), listener, written);
        }
        if (fileTypes.contains(FileType.JP2) && page.jp2Url() != null) {
            bytes += fetch(page.jp2Url(), dir.resolve(base + ".jp2"), listener, written);
        }
        if (fileTypes.contains(FileType.OCR) && page.ocrText() != null) {
            Path ocrFile = dir.resolve(base + "_ocr.txt");
            if (!Files.exists(ocrFile)) {
                Files.writeString(ocrFile, page.ocrText(), UTF_8);
                bytes += Files.size(ocrFile);
            }
            written.add(ocrFile);
        }
        if (fileTypes.contains(FileType.METADATA)) {
            Path metadataFile = dir.resolve(base + "_metadata.json");
            var metadata = new PageMetadata(page.itemId(), page.lccn(), page.title(), page.date(), page.edition(),
                    page.sequence(), page.pageUrl(), clock.instant(),
                    written.stream().map(path -> path.getFileName().toString()).toList(),
                    fileTypes.stream().map(type -> type.name().toLowerCase(Locale.ROOT)).sorted().toList());
            mapper.writeValue(metadataFile.toFile(), metadata);
            written.add(metadataFile);
        }
        return new Result(written, bytes);
    }

    private long fetch(String url, Path target, @Nullable RateLimitedClient.ProgressListener listener,
                       List<Path> written) throws NewsaggerException, IOException, InterruptedException {
        if (Files.exists(target) && Files.size(target) > 0) {
            written.add(target);
            return 0;
        }
        try {
            long bytes = api.download(URI.create(url), target, listener);
            written.add(target);
            return bytes;
        } catch (FatalRequestException e) {
            log.warn("Skipping {}: {}", url, e.getMessage());
            return 0;
        }
    }

    /**
     * @param files every file of the page now on disk
     * @param bytes bytes written by this call
     */
    record Result(List<Path> files, long bytes) {
    }

    record PageMetadata(String itemId, String lccn, String title, String date, int edition, int sequence,
                        String pageUrl, Instant downloadDate, List<String> files, List<String> fileTypesRequested) {
    }
}
