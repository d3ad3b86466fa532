package org.netpreserve.newsagger;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.newsagger.config.ApiConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Turns raw API JSON into periodicals and pages. Malformed entries are mapped with defaults where possible and
 * skipped with a warning otherwise, so one bad entry never loses the rest of a response.
 * <p>
 * Search results can be deduplicated by item id for the lifetime of the processor.
 */
public class ResponseProcessor {
    private static final Logger log = LoggerFactory.getLogger(ResponseProcessor.class);
    private static final Pattern YEAR = Pattern.compile("\\b(\\d{4})\\b");
    private static final Pattern COMPACT_DATE = Pattern.compile("(\\d{4})(\\d{2})(\\d{2})");
    private static final Pattern ISSUE_PATH = Pattern.compile(
            "/lccn/([^/]+)/(\\d{4}-\\d{2}-\\d{2})/ed-(\\d+)(?:/seq-(\\d+))?");
    private static final Pattern EDITION = Pattern.compile("(?:^|/)ed-(\\d+)(?:/|$)");
    private static final Pattern SEQUENCE = Pattern.compile("(?:^|/)seq-(\\d+)(?:/|$)");
    static final int EARLIEST_YEAR = 1836;

    private final String siteRoot;
    private final Set<String> seenItems = new HashSet<>();

    public ResponseProcessor() {
        this(ApiConfig.DEFAULT_BASE_URL);
    }

    public ResponseProcessor(URI baseUrl) {
        String root = baseUrl.toString();
        this.siteRoot = root.endsWith("/") ? root.substring(0, root.length() - 1) : root;
    }

    public List<Periodical> processNewspapers(JsonNode response) {
        var periodicals = new ArrayList<Periodical>();
        for (JsonNode entry : response.path("newspapers")) {
            try {
                periodicals.add(toPeriodical(entry));
            } catch (DataIntegrityException e) {
                log.warn("Skipping newspaper entry: {}", e.getMessage());
            }
        }
        return periodicals;
    }

    public Periodical toPeriodical(JsonNode entry) {
        String lccn = text(entry, "lccn");
        if (lccn == null) throw new DataIntegrityException("newspaper entry without lccn: " + abbreviate(entry));
        String place = firstText(entry.path("place_of_publication"));
        String city = place == null ? null : StringUtils.trimToNull(StringUtils.substringBefore(place, ","));
        String title = text(entry, "title");
        if (title == null) title = text(entry, "name");
        return Periodical.discovered(lccn,
                Objects.requireNonNullElse(title, ""),
                text(entry, "state"), city,
                parseYear(text(entry, "start_year")),
                parseYear(text(entry, "end_year")),
                text(entry, "frequency"),
                firstText(entry.path("language")),
                firstText(entry.path("subject")),
                text(entry, "url"));
    }

    public List<Page> processSearchResults(JsonNode response, boolean deduplicate) {
        var pages = new ArrayList<Page>();
        for (JsonNode item : response.path("items")) {
            Page page;
            try {
                page = toPage(item);
            } catch (DataIntegrityException e) {
                log.warn("Skipping search result: {}", e.getMessage());
                continue;
            }
            if (deduplicate && !seenItems.add(page.itemId())) continue;
            pages.add(page);
        }
        return pages;
    }

    public void resetDeduplication() {
        seenItems.clear();
    }

    public int seenCount() {
        return seenItems.size();
    }

    /**
     * Maps one search result. The item id is the result's {@code id} if present, otherwise the page path of its URL
     * (or the URL's last segment if it isn't a page URL), otherwise {@code lccn_date_sequence}.
     */
    public Page toPage(JsonNode item) {
        String id = text(item, "id");
        String url = text(item, "url");
        String lccn = text(item, "lccn");
        String rawDate = Objects.requireNonNullElse(text(item, "date"), "");

        String itemId = id;
        if (itemId == null && url != null) {
            IssueRef urlRef = parseIssueUrl(url);
            if (urlRef != null && urlRef.sequence() != null) itemId = urlRef.pagePath();
        }
        if (itemId == null && url != null) {
            String[] segments = StringUtils.strip(url, "/").split("/");
            if (segments.length >= 2) {
                String last = segments[segments.length - 1];
                itemId = last.isEmpty() ? segments[segments.length - 2] : last;
            }
        }
        if (itemId == null) {
            if (lccn == null) throw new DataIntegrityException("search result without id, url or lccn: " + abbreviate(item));
            String sequence = Objects.requireNonNullElse(text(item, "sequence"), "1");
            itemId = lccn + "_" + (rawDate.isEmpty() ? "unknown" : rawDate) + "_" + sequence;
        }

        IssueRef ref = parseIssueUrl(itemId);
        if (lccn == null) lccn = ref != null ? ref.lccn() : "";

        int edition = intOrElse(item.path("edition"), -1);
        if (edition < 0) edition = pathNumber(EDITION, itemId, 1);
        int sequence = intOrElse(item.has("sequence") ? item.path("sequence") : item.path("seq"), -1);
        if (sequence < 0) sequence = pathNumber(SEQUENCE, itemId, 1);

        String pageUrl = url;
        if (pageUrl == null) pageUrl = itemId.startsWith("/") ? siteRoot + itemId : siteRoot + "/" + itemId;

        String ocrText = text(item, "ocr_eng");
        return new Page(itemId, lccn, Objects.requireNonNullElse(text(item, "title"), ""), normalizeDate(rawDate),
                edition, sequence, pageUrl, renditionUrl(pageUrl, ".pdf"), renditionUrl(pageUrl, ".jp2"),
                ocrText, ocrText == null ? null : wordCount(ocrText), false, null);
    }

    /**
     * Maps a page entry from an issue detail response. Pages found this way get the same item id form as search
     * results ({@code /lccn/.../seq-N/}) so both discovery strategies upsert the same rows.
     */
    public @Nullable Page processIssuePage(JsonNode pageEntry, JsonNode issue) {
        String url = text(pageEntry, "url");
        if (url == null) return null;
        String path = URI.create(url).getPath();
        if (path.endsWith(".json")) path = path.substring(0, path.length() - ".json".length());
        String itemId = path.endsWith("/") ? path : path + "/";

        IssueRef ref = parseIssueUrl(itemId);
        String issueDate = text(issue, "date_issued");
        String lccn = ref != null ? ref.lccn() : lccnFromTitle(issue.path("title"));
        if (lccn == null) throw new DataIntegrityException("issue page without lccn: " + url);
        String date = issueDate != null ? normalizeDate(issueDate) : ref != null ? ref.date() : "";
        int edition = intOrElse(issue.path("edition"), ref != null ? ref.edition() : 1);
        int sequence = intOrElse(pageEntry.path("sequence"),
                ref != null && ref.sequence() != null ? ref.sequence() : 1);
        String title = Objects.requireNonNullElse(text(issue.path("title"), "name"), "");
        return new Page(itemId, lccn, title, date, edition, sequence, url, renditionUrl(url, ".pdf"),
                renditionUrl(url, ".jp2"), null, null, false, null);
    }

    /**
     * Extracts the first four digit year from free text. {@code "From 1895 to 1913"} gives 1895, text without a
     * standalone four digit number gives null.
     */
    public static @Nullable Integer parseYear(@Nullable String text) {
        if (text == null) return null;
        Matcher matcher = YEAR.matcher(text);
        return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
    }

    /**
     * {@code YYYYMMDD} becomes {@code YYYY-MM-DD}; anything else is returned unchanged.
     */
    public static String normalizeDate(String date) {
        Matcher compact = COMPACT_DATE.matcher(date);
        if (compact.matches()) return compact.group(1) + "-" + compact.group(2) + "-" + compact.group(3);
        return date;
    }

    /**
     * Parses {@code .../lccn/{lccn}/{date}/ed-{n}[/seq-{m}]} out of an issue or page URL or id.
     */
    public static @Nullable IssueRef parseIssueUrl(String url) {
        Matcher matcher = ISSUE_PATH.matcher(url);
        if (!matcher.find()) return null;
        Integer sequence = matcher.group(4) == null ? null : Integer.valueOf(matcher.group(4));
        return new IssueRef(matcher.group(1), matcher.group(2), Integer.parseInt(matcher.group(3)), sequence);
    }

    /**
     * Filters by overlap: a title running 1880-1910 matches startYear 1900.
     */
    public static List<Periodical> filterPeriodicals(List<Periodical> periodicals, @Nullable String state,
                                                     @Nullable String language, @Nullable Integer startYear,
                                                     @Nullable Integer endYear) {
        return periodicals.stream()
                .filter(p -> state == null || StringUtils.containsIgnoreCase(p.state(), state))
                .filter(p -> language == null || StringUtils.containsIgnoreCase(p.language(), language))
                .filter(p -> startYear == null || (p.endYear() != null && p.endYear() >= startYear))
                .filter(p -> endYear == null || (p.startYear() != null && p.startYear() <= endYear))
                .toList();
    }

    public static NewspaperSummary summarize(List<Periodical> periodicals) {
        IntSummaryStatistics years = periodicals.stream()
                .flatMap(p -> Stream.of(p.startYear(), p.endYear()))
                .filter(Objects::nonNull)
                .mapToInt(Integer::intValue)
                .summaryStatistics();
        return new NewspaperSummary(periodicals.size(),
                topCounts(periodicals, Periodical::state),
                topCounts(periodicals, Periodical::language),
                years.getCount() == 0 ? null : years.getMin(),
                years.getCount() == 0 ? null : years.getMax(),
                periodicals.stream().limit(5).map(Periodical::title).toList());
    }

    /**
     * Checks that a {@code YYYY} or {@code YYYY-MM-DD} range lies within the archive's coverage (1836 to today) and
     * is not reversed.
     */
    public static boolean validateDateRange(String start, String end) {
        try {
            LocalDate from = LocalDate.parse(start.length() == 4 ? start + "-01-01" : start);
            LocalDate to = LocalDate.parse(end.length() == 4 ? end + "-12-31" : end);
            return !from.isBefore(LocalDate.of(EARLIEST_YEAR, 1, 1))
                   && !to.isAfter(LocalDate.now())
                   && !from.isAfter(to);
        } catch (DateTimeParseException e) {
            log.debug("Invalid date range {} - {}: {}", start, end, e.getMessage());
            return false;
        }
    }

    static @Nullable String renditionUrl(String pageUrl, String extension) {
        if (pageUrl.isEmpty()) return null;
        if (pageUrl.endsWith(".json")) return pageUrl.substring(0, pageUrl.length() - ".json".length()) + extension;
        if (pageUrl.endsWith("/")) return pageUrl.substring(0, pageUrl.length() - 1) + extension;
        return pageUrl + extension;
    }

    private static Map<String, Long> topCounts(List<Periodical> periodicals, Function<Periodical, String> key) {
        Map<String, Long> counts = periodicals.stream()
                .map(key)
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
        var top = new LinkedHashMap<String, Long>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
                .limit(10)
                .forEach(e -> top.put(e.getKey(), e.getValue()));
        return top;
    }

    private static int wordCount(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    private static int pathNumber(Pattern pattern, String path, int fallback) {
        Matcher matcher = pattern.matcher(path);
        return matcher.find() ? Integer.parseInt(matcher.group(1)) : fallback;
    }

    private static int intOrElse(JsonNode node, int fallback) {
        if (node.canConvertToInt()) return node.asInt();
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    private static @Nullable String lccnFromTitle(JsonNode title) {
        String url = text(title, "url");
        if (url == null) return null;
        Matcher matcher = Pattern.compile("/lccn/([^/.]+)").matcher(url);
        return matcher.find() ? matcher.group(1) : null;
    }

    /**
     * Non-blank text of a field, or null. Numbers are returned in their text form.
     */
    private static @Nullable String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isValueNode() || value.isNull()) return null;
        return StringUtils.trimToNull(value.asText());
    }

    /**
     * The first element of an array field, or the field itself if it's a plain value.
     */
    private static @Nullable String firstText(JsonNode node) {
        if (node.isArray()) {
            for (JsonNode element : node) {
                if (element.isValueNode() && StringUtils.isNotBlank(element.asText())) return element.asText().trim();
            }
            return null;
        }
        if (!node.isValueNode() || node.isNull()) return null;
        return StringUtils.trimToNull(node.asText());
    }

    private static String abbreviate(JsonNode node) {
        return StringUtils.abbreviate(node.toString(), 200);
    }

    /**
     * Position of an issue (and optionally a page within it) parsed from its URL.
     */
    public record IssueRef(String lccn, String date, int edition, @Nullable Integer sequence) {
        /**
         * The canonical page id, {@code /lccn/{lccn}/{date}/ed-{n}/seq-{m}/}.
         */
        public String pagePath() {
            return "/lccn/" + lccn + "/" + date + "/ed-" + edition + "/seq-" + (sequence == null ? 1 : sequence) + "/";
        }
    }

    public record NewspaperSummary(int totalNewspapers, Map<String, Long> states, Map<String, Long> languages,
                                   @Nullable Integer earliestYear, @Nullable Integer latestYear,
                                   List<String> sampleTitles) {
    }
}
