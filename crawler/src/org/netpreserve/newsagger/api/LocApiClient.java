package org.netpreserve.newsagger.api;

import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.newsagger.NewsaggerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Typed access to the Chronicling America endpoints. All traffic goes through one {@link RateLimitedClient}.
 */
public class LocApiClient {
    private static final Logger log = LoggerFactory.getLogger(LocApiClient.class);
    public static final int MAX_ROWS = 1000;
    public static final double ESTIMATED_MB_PER_PAGE = 2.0;
    private static final Pattern ISO_DATE = Pattern.compile("(\\d{4})-(\\d{2})-(\\d{2})");
    private static final Pattern YEAR = Pattern.compile("\\d{4}");

    private final RateLimitedClient client;

    public LocApiClient(RateLimitedClient client) {
        this.client = client;
    }

    public RateLimitedClient client() {
        return client;
    }

    public JsonNode getNewspapers(int page, int rows) throws NewsaggerException, InterruptedException {
        var params = new LinkedHashMap<String, String>();
        params.put("format", "json");
        params.put("page", String.valueOf(page));
        params.put("rows", String.valueOf(Math.min(rows, MAX_ROWS)));
        return client.request("newspapers.json", params);
    }

    public JsonNode getNewspaperIssues(String lccn) throws NewsaggerException, InterruptedException {
        return client.request("lccn/" + lccn + ".json", Map.of());
    }

    /**
     * Runs a page search. {@code date1}/{@code date2} may be given as a bare year, an ISO date or already in the
     * API's {@code MM/DD/YYYY} form.
     */
    public JsonNode searchPages(Map<String, String> params) throws NewsaggerException, InterruptedException {
        var search = new LinkedHashMap<String, String>();
        search.put("format", "json");
        search.putAll(params);
        if (search.containsKey("date1") || search.containsKey("date2")) {
            search.putIfAbsent("dateFilterType", "range");
            search.computeIfPresent("date1", (k, v) -> searchDate(v, false));
            search.computeIfPresent("date2", (k, v) -> searchDate(v, true));
        }
        return client.request("search/pages/results/", search);
    }

    public JsonNode getBatches(int page) throws NewsaggerException, InterruptedException {
        return client.request("batches.json", Map.of("page", String.valueOf(page)));
    }

    /**
     * Lists every batch by following the manifest's {@code next} links.
     */
    public List<JsonNode> getAllBatches() throws NewsaggerException, InterruptedException {
        var batches = new ArrayList<JsonNode>();
        JsonNode response = client.request("batches.json", Map.of());
        while (true) {
            response.path("batches").forEach(batches::add);
            String next = response.path("next").asText(null);
            if (next == null || next.isEmpty()) break;
            response = client.request(next, Map.of());
        }
        log.info("Batch manifest lists {} batches", batches.size());
        return batches;
    }

    public JsonNode getBatchDetail(String batchUrl) throws NewsaggerException, InterruptedException {
        return client.request(jsonUrl(batchUrl), Map.of());
    }

    public JsonNode getIssueDetail(String issueUrl) throws NewsaggerException, InterruptedException {
        return client.request(jsonUrl(issueUrl), Map.of());
    }

    /**
     * Estimates the number of pages (and megabytes) a search would match using a single one-row query.
     */
    public SizeEstimate estimateDownloadSize(Map<String, String> params) throws NewsaggerException, InterruptedException {
        var query = new LinkedHashMap<>(params);
        query.put("rows", "1");
        query.put("page", "1");
        long total = searchPages(query).path("totalItems").asLong(0);
        return new SizeEstimate(total, total * ESTIMATED_MB_PER_PAGE);
    }

    public long download(URI uri, Path target, RateLimitedClient.@Nullable ProgressListener listener)
            throws NewsaggerException, InterruptedException {
        return client.download(uri, target, listener);
    }

    static String searchDate(String value, boolean end) {
        if (YEAR.matcher(value).matches()) return end ? "12/31/" + value : "01/01/" + value;
        Matcher iso = ISO_DATE.matcher(value);
        if (iso.matches()) return iso.group(2) + "/" + iso.group(3) + "/" + iso.group(1);
        return value;
    }

    /**
     * Batch and issue links are HTML pages unless suffixed with {@code .json}.
     */
    static String jsonUrl(String url) {
        if (url.endsWith(".json")) return url;
        String trimmed = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        return trimmed + ".json";
    }

    public record SizeEstimate(long totalPages, double estimatedSizeMb) {
    }
}
