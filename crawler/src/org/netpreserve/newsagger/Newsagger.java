package org.netpreserve.newsagger;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.netpreserve.newsagger.api.GlobalCaptchaManager;
import org.netpreserve.newsagger.api.LocApiClient;
import org.netpreserve.newsagger.api.RateLimitedClient;
import org.netpreserve.newsagger.config.NewsaggerConfig;
import org.netpreserve.newsagger.discovery.BatchDiscoveryProcessor;
import org.netpreserve.newsagger.discovery.DiscoveryManager;
import org.netpreserve.newsagger.download.DownloadProcessor;
import org.netpreserve.newsagger.util.Sleeper;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Command line entry point. Wires the storage, API client and processors together for one command.
 */
public class Newsagger implements AutoCloseable {
    private static final org.slf4j.Logger log = LoggerFactory.getLogger(Newsagger.class);

    private final NewsaggerConfig config;
    private final Database db;
    private final LocApiClient api;
    private final DiscoveryManager discovery;
    private final BatchDiscoveryProcessor batchDiscovery;
    private final DownloadProcessor downloads;
    private volatile boolean working;

    public Newsagger(NewsaggerConfig config) throws IOException {
        this.config = config;
        Clock clock = Clock.systemUTC();
        this.db = Database.open(config.storage().database());
        var captchaManager = new GlobalCaptchaManager(clock, config.api().captchaCoolingOff());
        this.api = new LocApiClient(new RateLimitedClient(config.api(), captchaManager));
        var processor = new ResponseProcessor(config.api().baseUrl());
        this.discovery = new DiscoveryManager(db, api, processor, config.discovery(), clock);
        this.batchDiscovery = new BatchDiscoveryProcessor(db, api, processor, config.discovery(), clock,
                Sleeper.SYSTEM);
        this.downloads = new DownloadProcessor(db, api, config.download(), config.storage().downloads(), clock,
                Sleeper.SYSTEM);
    }

    public static void main(String[] args) throws Exception {
        Path dataDir = Path.of("data");
        String logLevel = System.getenv("LOG_LEVEL");
        String logFile = null;
        boolean dumpConfig = false;
        var opts = new Options();
        var positional = new ArrayList<String>();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--dump-config" -> dumpConfig = true;
                case "--data-dir", "-d" -> dataDir = Path.of(args[++i]);
                case "--log-level" -> logLevel = args[++i];
                case "--log-file" -> logFile = args[++i];
                case "--max-items" -> opts.maxItems = Integer.parseInt(args[++i]);
                case "--max-batches" -> opts.maxBatches = Integer.parseInt(args[++i]);
                case "--max-pages" -> opts.maxPages = Integer.parseInt(args[++i]);
                case "--max-size-mb" -> opts.maxSizeMb = Double.parseDouble(args[++i]);
                case "--max-idle-minutes" -> opts.maxIdle = Duration.ofMinutes(Long.parseLong(args[++i]));
                case "--batch-size" -> opts.batchSize = Integer.parseInt(args[++i]);
                case "--start" -> opts.startYear = Integer.parseInt(args[++i]);
                case "--end" -> opts.endYear = Integer.parseInt(args[++i]);
                case "--size" -> opts.rangeSize = Integer.parseInt(args[++i]);
                case "--continuous" -> opts.continuous = true;
                case "--dry-run" -> opts.dryRun = true;
                case "--auto-enqueue" -> opts.autoEnqueue = true;
                case "--help", "-h" -> {
                    printUsage();
                    System.exit(0);
                }
                default -> {
                    if (args[i].startsWith("-")) {
                        System.err.println("Unknown option: " + args[i]);
                        System.exit(1);
                    }
                    positional.add(args[i]);
                }
            }
        }

        if (logLevel != null) setLogLevel(logLevel);
        if (logFile != null) addLogFile(logFile);

        NewsaggerConfig config = loadConfig(dataDir, System.getenv());
        if (dumpConfig) {
            System.out.println(yamlMapper().writerWithDefaultPrettyPrinter().writeValueAsString(config));
            System.exit(0);
        }
        if (positional.isEmpty()) {
            printUsage();
            System.exit(1);
        }

        String command = positional.get(0);
        List<String> operands = positional.subList(1, positional.size());

        try (var app = new Newsagger(config)) {
            app.installShutdownHook(Thread.currentThread());
            app.working = true;
            try {
                app.run(command, operands, opts);
            } finally {
                app.working = false;
            }
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            printUsage();
            System.exit(1);
        } catch (NewsaggerException | DataIntegrityException e) {
            log.error("{} failed: {}", command, e.getMessage(), e);
            System.exit(2);
        }
    }

    private void run(String command, List<String> operands, Options opts)
            throws NewsaggerException, IOException, InterruptedException {
        int facetBatchSize = opts.batchSize != null ? opts.batchSize : config.discovery().batchSize();
        Integer facetMaxItems = opts.maxItems != null ? opts.maxItems : config.discovery().maxItems();
        switch (command) {
            case "discover" -> discovery.discoverAllPeriodicals(opts.maxPages);
            case "discover-issues" -> discovery.discoverPeriodicalIssues(requireOperand(operands, "LCCN"));
            case "create-facets" -> {
                if (opts.startYear == null || opts.endYear == null) {
                    throw new IllegalArgumentException("create-facets needs --start and --end");
                }
                List<Long> ids = discovery.createDateRangeFacets(opts.startYear, opts.endYear, opts.rangeSize, true);
                System.out.println("Created " + ids.size() + " facets");
            }
            case "create-state-facets" -> {
                List<Long> ids = discovery.createStateFacets(operands.isEmpty() ? null : operands);
                System.out.println("Created " + ids.size() + " facets");
            }
            case "discover-facet" -> {
                long facetId = Long.parseLong(requireOperand(operands, "FACET_ID"));
                long found = discovery.discoverFacetContent(facetId, facetBatchSize, facetMaxItems);
                System.out.println("Discovered " + found + " pages");
            }
            case "discover-facets" -> {
                long found = discovery.discoverAllFacets(facetBatchSize, facetMaxItems);
                System.out.println("Discovered " + found + " pages");
            }
            case "enqueue-facet" -> {
                long facetId = Long.parseLong(requireOperand(operands, "FACET_ID"));
                System.out.println("Enqueued " + discovery.enqueueFacetContent(facetId, opts.maxItems) + " pages");
            }
            case "populate-queue" -> System.out.println("Enqueued "
                    + discovery.populateDownloadQueue(List.of(), List.of()) + " items");
            case "batch-discover" -> System.out.println(batchDiscovery.discoverAllBatches(opts.maxBatches,
                    opts.autoEnqueue || config.discovery().autoEnqueue()));
            case "download" -> System.out.println(downloads.processQueue(opts.maxItems, opts.continuous,
                    opts.maxIdle, opts.dryRun, opts.maxSizeMb));
            case "resume-failed" -> downloads.resumeFailed();
            case "reset-stuck" -> downloads.resetStuck();
            case "cleanup" -> System.out.println(downloads.cleanupIncomplete());
            case "captcha-recovery" -> System.out.println(discovery.processCaptchaRecovery());
            case "fix-facets" -> System.out.println(discovery.fixIncorrectlyCompletedFacets());
            case "status" -> printStatus();
            default -> throw new IllegalArgumentException("Unknown command: " + command);
        }
    }

    private static String requireOperand(List<String> operands, String name) {
        if (operands.isEmpty()) throw new IllegalArgumentException("Missing " + name);
        return operands.get(0);
    }

    private static void printUsage() {
        System.out.println("Usage: newsagger [options] COMMAND [ARGS...]");
        System.out.println("Commands:");
        System.out.println("  discover                       Discover all periodicals");
        System.out.println("  discover-issues LCCN           Discover the issues of one periodical");
        System.out.println("  create-facets --start Y --end Y [--size N]");
        System.out.println("  create-state-facets [STATE...]");
        System.out.println("  discover-facet FACET_ID        Discover (or resume) the pages of one facet");
        System.out.println("  discover-facets                Discover every unfinished facet");
        System.out.println("  enqueue-facet FACET_ID         Queue a facet's pages for download");
        System.out.println("  populate-queue                 Queue completed facets and periodicals");
        System.out.println("  batch-discover                 Walk the digitization batches");
        System.out.println("  download                       Work the download queue");
        System.out.println("  resume-failed | reset-stuck | cleanup | captcha-recovery | fix-facets | status");
        System.out.println("Options:");
        System.out.println("  -h, --help");
        System.out.println("  -d, --data-dir DIR             Directory holding config.yaml (default: data)");
        System.out.println("      --dump-config              Print the effective configuration and exit");
        System.out.println("      --log-level LEVEL          Root log level");
        System.out.println("      --log-file FILE            Also write the log to FILE");
        System.out.println("      --max-items N, --max-batches N, --max-pages N, --max-size-mb MB");
        System.out.println("      --batch-size N, --continuous, --max-idle-minutes N, --dry-run, --auto-enqueue");
    }

    private void printStatus() throws IOException {
        DiscoveryManager.DiscoverySummary summary = discovery.discoverySummary();
        System.out.println("Periodicals: " + summary.periodicals() + " (" + summary.periodicalsComplete()
                           + " with issues discovered)");
        System.out.println("Issues: " + summary.issues());
        System.out.println("Pages: " + summary.pages() + " (" + summary.pagesDownloaded() + " downloaded)");
        System.out.println("Facets: " + summary.facetsByStatus());
        for (var totals : summary.queue()) {
            System.out.printf("Queue %-10s %6d items %10.1f MB%n", totals.status(), totals.items(),
                    totals.estimatedSizeMb());
        }
        DownloadProcessor.DownloadStats stats = downloads.downloadStats();
        System.out.printf("Disk: %d files, %.1f MB%n", stats.filesOnDisk(), stats.diskUsageMb());
        var gate = api.client().captchaManager().canMakeRequests();
        if (!gate.allowed()) System.out.println("CAPTCHA cooling off: " + gate.reason());
    }

    /**
     * On SIGINT/SIGTERM asks the running work to stop, waits the grace period, then interrupts the worker and
     * finally halts the JVM if it still hasn't finished.
     */
    private void installShutdownHook(Thread mainThread) {
        Duration grace = config.download().shutdownGrace();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (!working) return;
            log.info("Shutdown requested, finishing current work");
            discovery.requestStop();
            batchDiscovery.requestStop();
            downloads.requestShutdown();
            try {
                mainThread.join(grace.toMillis());
                if (!working) return;
                log.warn("Still busy after {}s, interrupting", grace.toSeconds());
                downloads.forceQuit();
                mainThread.interrupt();
                mainThread.join(grace.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (working) {
                System.err.println("Forcing exit");
                Runtime.getRuntime().halt(130);
            }
        }, "shutdown-hook"));
    }

    private static class Options {
        Integer maxItems;
        Integer maxBatches;
        Integer maxPages;
        Double maxSizeMb;
        Duration maxIdle;
        boolean continuous;
        boolean dryRun;
        boolean autoEnqueue;
        Integer batchSize;
        Integer startYear;
        Integer endYear;
        int rangeSize = 1;
    }

    @Override
    public void close() {
        db.close();
    }

    static ObjectMapper yamlMapper() {
        return new ObjectMapper(new YAMLFactory())
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Reads the built-in defaults, merges {@code config.yaml} from the data directory over them if present and
     * applies environment overrides.
     */
    public static NewsaggerConfig loadConfig(Path dataDir, Map<String, String> env) throws IOException {
        ObjectMapper mapper = yamlMapper();
        JsonNode configTree;
        try (InputStream stream = Objects.requireNonNull(Newsagger.class.getResourceAsStream("config/defaults.yaml"),
                "missing config/defaults.yaml")) {
            configTree = mapper.readTree(stream);
        }
        Path configFile = dataDir.resolve("config.yaml");
        if (Files.exists(configFile)) {
            configTree = deepMerge(configTree, mapper.readTree(configFile.toFile()));
        }
        applyEnvironment((ObjectNode) configTree, env);
        return mapper.treeToValue(configTree, NewsaggerConfig.class);
    }

    private static void applyEnvironment(ObjectNode tree, Map<String, String> env) {
        ObjectNode api = child(tree, "api");
        ObjectNode storage = child(tree, "storage");
        String value;
        if ((value = env.get("LOC_BASE_URL")) != null) api.put("baseUrl", value);
        if ((value = env.get("REQUEST_DELAY")) != null) {
            api.put("requestDelay", new BigDecimal(value.trim()).movePointRight(3).longValue());
        }
        if ((value = env.get("MAX_RETRIES")) != null) api.put("maxRetries", Integer.parseInt(value.trim()));
        if ((value = env.get("DATABASE_PATH")) != null) storage.put("database", value);
        if ((value = env.get("DOWNLOAD_DIR")) != null) storage.put("downloads", value);
    }

    private static ObjectNode child(ObjectNode tree, String name) {
        JsonNode node = tree.get(name);
        return node instanceof ObjectNode object ? object : tree.putObject(name);
    }

    private static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (!base.isObject() || !override.isObject()) {
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode baseValue = merged.get(entry.getKey());
            merged.set(entry.getKey(), baseValue != null ? deepMerge(baseValue, entry.getValue()) : entry.getValue());
        });
        return merged;
    }

    static void setLogLevel(String level) {
        var context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(level, Level.INFO));
    }

    private static void addLogFile(String file) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        var encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss} [%thread] %-5level %logger{24} %kvp %msg%n");
        encoder.start();

        var fileAppender = new FileAppender<ILoggingEvent>();
        fileAppender.setContext(context);
        fileAppender.setEncoder(encoder);
        fileAppender.setName("FILE");
        fileAppender.setFile(file);
        fileAppender.start();

        context.getLogger(Logger.ROOT_LOGGER_NAME).addAppender(fileAppender);
    }
}
