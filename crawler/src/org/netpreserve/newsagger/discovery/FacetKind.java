package org.netpreserve.newsagger.discovery;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.newsagger.ResponseProcessor;
import org.netpreserve.newsagger.db.PageScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * What a search facet partitions the archive by. Parsed from the stored {@code facet_type}/{@code facet_value} pair.
 */
public sealed interface FacetKind permits FacetKind.DateRange, FacetKind.State, FacetKind.Combined, FacetKind.Unknown {
    String DATE_RANGE = "date_range";
    String STATE = "state";
    String COMBINED = "combined";
    int DEFAULT_PRIORITY = 5;
    int MAX_STATE_BATCH_SIZE = 50;

    static FacetKind parse(String type, String value) {
        switch (type) {
            case DATE_RANGE -> {
                DateRange range = DateRange.parse(value);
                return range != null ? range : new Unknown(type, value);
            }
            case STATE -> {
                return new State(value);
            }
            case COMBINED -> {
                String state = null;
                DateRange range = null;
                for (String part : value.split("\\|")) {
                    int colon = part.indexOf(':');
                    if (colon < 0) continue;
                    String partType = part.substring(0, colon);
                    String partValue = part.substring(colon + 1);
                    if (partType.equals(STATE)) state = partValue;
                    else if (partType.equals(DATE_RANGE)) range = DateRange.parse(partValue);
                }
                return new Combined(state, range);
            }
            default -> {
                return new Unknown(type, value);
            }
        }
    }

    String type();

    String value();

    /**
     * Search query parameters for one page of this facet's results.
     */
    Map<String, String> searchParams(int page, int rows);

    /**
     * Batch size to actually request. Broad facets use smaller pages.
     */
    default int adjustBatchSize(int batchSize) {
        return batchSize;
    }

    /**
     * The stored pages this facet covers, or null if it can't be expressed as a scope.
     */
    @Nullable PageScope pageScope();

    /**
     * Download priority for pages found through this facet. Lower is more urgent.
     */
    default int priority() {
        return DEFAULT_PRIORITY;
    }

    /**
     * Smaller facets covering the same results, used when a facet keeps running into CAPTCHA challenges. Empty if
     * this facet can't be split any further.
     */
    default List<FacetKind> split(int currentYear) {
        return List.of();
    }

    private static Map<String, String> baseParams(int page, int rows) {
        var params = new LinkedHashMap<String, String>();
        params.put("page", String.valueOf(page));
        params.put("rows", String.valueOf(rows));
        return params;
    }

    /**
     * @param start {@code YYYY}, {@code YYYY-MM-DD} or {@code YYYYMMDD}
     * @param end   same forms as {@code start}
     */
    record DateRange(String start, String end) implements FacetKind {
        private static final Pattern YEAR = Pattern.compile("\\d{4}");
        private static final Set<String> WAR_YEARS = Set.of("1917", "1918", "1919");
        private static final String EARTHQUAKE_YEAR = "1906";

        static @Nullable DateRange parse(String value) {
            int slash = value.indexOf('/');
            if (slash < 0) return null;
            return new DateRange(value.substring(0, slash).trim(), value.substring(slash + 1).trim());
        }

        public static DateRange years(int startYear, int endYear) {
            return new DateRange(String.valueOf(startYear), String.valueOf(endYear));
        }

        @Override
        public String type() {
            return DATE_RANGE;
        }

        @Override
        public String value() {
            return start + "/" + end;
        }

        @Override
        public Map<String, String> searchParams(int page, int rows) {
            var params = baseParams(page, rows);
            addTo(params);
            return params;
        }

        void addTo(Map<String, String> params) {
            params.put("date1", ResponseProcessor.normalizeDate(start));
            params.put("date2", ResponseProcessor.normalizeDate(end));
        }

        @Override
        public PageScope pageScope() {
            return new PageScope(firstDay(), lastDay(), null);
        }

        String firstDay() {
            return isYear(start) ? start + "-01-01" : ResponseProcessor.normalizeDate(start);
        }

        String lastDay() {
            return isYear(end) ? end + "-12-31" : ResponseProcessor.normalizeDate(end);
        }

        @Override
        public int priority() {
            String value = value();
            if (value.contains(EARTHQUAKE_YEAR)) return 1;
            for (String year : WAR_YEARS) {
                if (value.contains(year)) return 2;
            }
            return DEFAULT_PRIORITY;
        }

        /**
         * A single year splits into quarters, a span of years into single years.
         */
        @Override
        public List<FacetKind> split(int currentYear) {
            if (!isYear(start) || !isYear(end)) return List.of();
            int from = Integer.parseInt(start);
            int to = Integer.parseInt(end);
            var parts = new ArrayList<FacetKind>();
            if (from == to) {
                parts.add(new DateRange(start + "-01-01", start + "-03-31"));
                parts.add(new DateRange(start + "-04-01", start + "-06-30"));
                parts.add(new DateRange(start + "-07-01", start + "-09-30"));
                parts.add(new DateRange(start + "-10-01", start + "-12-31"));
            } else {
                for (int year = from; year <= to; year++) {
                    parts.add(years(year, year));
                }
            }
            return parts;
        }

        private static boolean isYear(String value) {
            return YEAR.matcher(value).matches();
        }
    }

    record State(String name) implements FacetKind {
        static final Set<String> PRIORITY_STATES = Set.of("California", "New York", "Illinois");

        @Override
        public String type() {
            return STATE;
        }

        @Override
        public String value() {
            return name;
        }

        @Override
        public Map<String, String> searchParams(int page, int rows) {
            var params = baseParams(page, rows);
            params.put("state", name);
            return params;
        }

        @Override
        public int adjustBatchSize(int batchSize) {
            return Math.min(batchSize, MAX_STATE_BATCH_SIZE);
        }

        @Override
        public PageScope pageScope() {
            return new PageScope(null, null, name);
        }

        @Override
        public int priority() {
            return boost(name, DEFAULT_PRIORITY);
        }

        /**
         * One state+date facet per twenty years from 1900.
         */
        @Override
        public List<FacetKind> split(int currentYear) {
            int[][] spans = {{1900, 1920}, {1921, 1940}, {1941, 1960}, {1961, 1980}, {1981, 2000},
                    {2001, currentYear}};
            var parts = new ArrayList<FacetKind>();
            for (int[] span : spans) {
                parts.add(new Combined(name, DateRange.years(span[0], span[1])));
            }
            return parts;
        }

        static int boost(@Nullable String state, int priority) {
            return state != null && PRIORITY_STATES.contains(state) ? Math.max(1, priority - 1) : priority;
        }
    }

    /**
     * A state and a date range together, stored as {@code state:California|date_range:1906/1906}. Either part may
     * be missing.
     */
    record Combined(@Nullable String state, @Nullable DateRange dateRange) implements FacetKind {
        @Override
        public String type() {
            return COMBINED;
        }

        @Override
        public String value() {
            var parts = new ArrayList<String>();
            if (state != null) parts.add(STATE + ":" + state);
            if (dateRange != null) parts.add(DATE_RANGE + ":" + dateRange.value());
            return String.join("|", parts);
        }

        @Override
        public Map<String, String> searchParams(int page, int rows) {
            var params = baseParams(page, rows);
            if (state != null) params.put("state", state);
            if (dateRange != null) dateRange.addTo(params);
            return params;
        }

        @Override
        public PageScope pageScope() {
            return new PageScope(dateRange == null ? null : dateRange.firstDay(),
                    dateRange == null ? null : dateRange.lastDay(), state);
        }

        @Override
        public int priority() {
            int priority = dateRange == null ? DEFAULT_PRIORITY : dateRange.priority();
            return State.boost(state, priority);
        }
    }

    record Unknown(String type, String value) implements FacetKind {
        private static final Logger log = LoggerFactory.getLogger(Unknown.class);

        @Override
        public Map<String, String> searchParams(int page, int rows) {
            log.warn("Unknown facet type {}, searching without filters", type);
            return baseParams(page, rows);
        }

        @Override
        public @Nullable PageScope pageScope() {
            return null;
        }
    }
}
