package org.netpreserve.newsagger;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * One scanned newspaper page, the unit of download.
 *
 * @param itemId   stable identifier, normally the API path such as {@code /lccn/sn85066387/1906-04-19/ed-1/seq-1/}
 * @param date     issue date as {@code YYYY-MM-DD}
 * @param pageUrl  JSON metadata URL of the page
 * @param pdfUrl   PDF rendition if known
 * @param jp2Url   JPEG 2000 rendition if known
 * @param ocrText  OCR text when the search result carried it
 */
public record Page(
        String itemId,
        String lccn,
        String title,
        String date,
        int edition,
        int sequence,
        String pageUrl,
        @Nullable String pdfUrl,
        @Nullable String jp2Url,
        @Nullable String ocrText,
        @Nullable Integer wordCount,
        boolean downloaded,
        @Nullable Instant createdAt) {

    /**
     * Directory-safe form of the item id.
     */
    public String safeItemId() {
        String trimmed = itemId;
        while (trimmed.startsWith("/")) trimmed = trimmed.substring(1);
        while (trimmed.endsWith("/")) trimmed = trimmed.substring(0, trimmed.length() - 1);
        return trimmed.replace('/', '_').replace('\\', '_').replace(':', '_');
    }
}
