package org.netpreserve.newsagger.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.newsagger.util.DurationDeserializer;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * How the download queue is worked.
 *
 * @param fileTypes        which artifacts to write for each page
 * @param maxIdle          in continuous mode, stop once the queue has been empty this long
 * @param idlePollInterval in continuous mode, how often an empty queue is checked again
 * @param batchUpdateSize  queue status changes buffered before they are written in one transaction
 * @param shutdownGrace    how long an interrupted run may take to finish its current item before being forced
 * @param progressInterval how often progress is logged during a run
 */
public record DownloadConfig(
        Set<FileType> fileTypes,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration maxIdle,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration idlePollInterval,
        int batchUpdateSize,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration shutdownGrace,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration progressInterval
) {
    public static DownloadConfig defaults() {
        return new DownloadConfig(EnumSet.allOf(FileType.class), Duration.ofMinutes(5), Duration.ofSeconds(1), 10,
                Duration.ofSeconds(5), Duration.ofSeconds(30));
    }

    public DownloadConfig withMaxIdle(Duration maxIdle) {
        return new DownloadConfig(fileTypes, maxIdle, idlePollInterval, batchUpdateSize, shutdownGrace,
                progressInterval);
    }

    public enum FileType {
        @JsonProperty("pdf") PDF,
        @JsonProperty("jp2") JP2,
        @JsonProperty("ocr") OCR,
        @JsonProperty("metadata") METADATA
    }
}
