package com.tidefeed.app;

import com.tidefeed.app.config.AppPaths;
import com.tidefeed.app.config.ConfigLoader;
import com.tidefeed.app.config.FeedConfig;
import com.tidefeed.app.config.FeedListStore;
import com.tidefeed.app.http.HttpClientFactory;
import com.tidefeed.app.http.HttpFeedTransport;
import com.tidefeed.app.logging.EventLogger;
import com.tidefeed.app.present.TimelinePrinter;
import com.tidefeed.app.store.FileCacheStore;
import com.tidefeed.core.bus.EventBus;
import com.tidefeed.core.model.FeedSpec;
import com.tidefeed.core.model.RunReport;
import com.tidefeed.feeds.FeedAggregator;
import com.tidefeed.feeds.api.CacheStore;
import com.tidefeed.feeds.api.FetchContext;
import com.tidefeed.feeds.cache.InMemoryCacheStore;
import com.tidefeed.feeds.config.FetchSettings;
import com.tidefeed.feeds.opml.OpmlImportException;
import com.tidefeed.feeds.opml.OpmlImporter;
import com.tidefeed.feeds.schedule.NoFeedsConfiguredException;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_NO_RESULTS = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: tidefeed [--no-cache] [-p|--opml FILE]",
            "",
            "  -p, --opml FILE   import the feeds of an OPML subscription list into the config file and exit",
            "      --no-cache    keep cached responses in memory for this run only",
            "  -h, --help        show this help",
            "",
            "Environment: " + AppPaths.CONFIG_ENV + ", " + AppPaths.CACHE_DIR_ENV
                    + ", TRUSTSTORE_PATH, TRUSTSTORE_PASSWORD");

    private Main() {
    }

    public static void main(String[] args) {
        configureLogging();
        int code = run(args, System.getenv(), Path.of("").toAbsolutePath(), System.out, System.err);
        System.exit(code);
    }

    public static int run(String[] args, Map<String, String> env, Path workingDir, PrintStream out, PrintStream err) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            out.println(USAGE);
            return EXIT_USAGE;
        }
        if (options.help()) {
            out.println(USAGE);
            return EXIT_OK;
        }

        AppPaths paths = AppPaths.resolve(env, workingDir);
        if (options.opmlFile() != null) {
            return importOpml(options.opmlFile(), paths, out, err);
        }

        FeedConfig config;
        try {
            config = ConfigLoader.loadFirst(paths.configCandidates());
        } catch (IllegalStateException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        }
        return aggregate(config, paths, options.noCache(), env, out, err);
    }

    private static int aggregate(FeedConfig config, AppPaths paths, boolean noCache, Map<String, String> env,
                                 PrintStream out, PrintStream err) {
        FetchSettings settings = config.settings();
        EventBus eventBus = new EventBus();
        EventLogger.attach(eventBus);

        CacheStore cacheStore = noCache ? new InMemoryCacheStore() : new FileCacheStore(paths.cacheDir());
        HttpFeedTransport transport;
        try {
            transport = new HttpFeedTransport(HttpClientFactory.create(settings.requestTimeout(), env), settings.userAgent());
        } catch (IllegalStateException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        }
        FetchContext context = new FetchContext(transport, cacheStore, eventBus, Clock.systemUTC(), settings);

        List<FeedSpec> feeds = config.feeds();
        LOGGER.info(() -> "Aggregating " + feeds.size() + " feeds from "
                + (config.source() == null ? "<no config>" : config.source()));
        RunReport report;
        try (FeedAggregator aggregator = new FeedAggregator(context)) {
            report = aggregator.run(feeds);
        } catch (NoFeedsConfiguredException e) {
            err.println(e.getMessage());
            err.println("Add feeds to " + paths.configFile() + " or import an OPML file with --opml.");
            return EXIT_NO_RESULTS;
        }

        new TimelinePrinter(ZoneId.systemDefault()).print(report, out, err);
        return report.allFailed() ? EXIT_NO_RESULTS : EXIT_OK;
    }

    private static int importOpml(Path opmlFile, AppPaths paths, PrintStream out, PrintStream err) {
        List<FeedSpec> imported;
        try {
            imported = new OpmlImporter().importFrom(Files.readAllBytes(opmlFile));
        } catch (IOException e) {
            err.println("Cannot read OPML file " + opmlFile + ": " + e.getMessage());
            return EXIT_USAGE;
        } catch (OpmlImportException e) {
            err.println("Invalid OPML file " + opmlFile + ": " + e.getMessage());
            return EXIT_USAGE;
        }

        FeedListStore.ImportSummary summary;
        try {
            summary = FeedListStore.importInto(paths.configFile(), imported);
        } catch (IllegalStateException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        }
        out.println("Imported " + summary.added() + " new feeds (" + summary.alreadyPresent()
                + " already present); " + summary.total() + " feeds in " + summary.configFile());
        return EXIT_OK;
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning(() -> "Could not load bundled logging.properties: " + e.getMessage());
        }
    }

    record CliOptions(Path opmlFile, boolean noCache, boolean help) {
        static CliOptions parse(String[] args) {
            Path opml = null;
            boolean noCache = false;
            boolean help = false;
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "-p", "--opml" -> {
                        if (i + 1 >= args.length) {
                            throw new IllegalArgumentException("Missing file after " + arg);
                        }
                        opml = Path.of(args[++i]);
                    }
                    case "--no-cache" -> noCache = true;
                    case "-h", "--help" -> help = true;
                    default -> throw new IllegalArgumentException("Unknown argument: " + arg);
                }
            }
            return new CliOptions(opml, noCache, help);
        }
    }
}
