package com.tidefeed.feeds.schedule;

import com.tidefeed.core.events.AlertRaised;
import com.tidefeed.core.events.FeedFetched;
import com.tidefeed.core.events.RunStarted;
import com.tidefeed.core.model.ErrorKind;
import com.tidefeed.core.model.FeedError;
import com.tidefeed.core.model.FeedSpec;
import com.tidefeed.core.model.FetchOutcome;
import com.tidefeed.feeds.api.FetchContext;
import com.tidefeed.feeds.parse.FeedParser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fetches every configured feed on a fixed-size worker pool. Each feed gets exactly one outcome per
 * run; a failing or hanging feed never blocks the others, and the whole run is bounded by the soft
 * run timeout.
 */
public class FetchScheduler implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(FetchScheduler.class.getName());

    private final FetchContext context;
    private final FeedParser parser;
    private final ExecutorService workers;

    public FetchScheduler(FetchContext context) {
        this(context, new FeedParser());
    }

    public FetchScheduler(FetchContext context, FeedParser parser) {
        this.context = context;
        this.parser = parser;
        this.workers = Executors.newFixedThreadPool(context.settings().maxWorkers(), new WorkerThreadFactory());
    }

    /**
     * @throws NoFeedsConfiguredException if {@code feeds} is empty; nothing is fetched in that case
     */
    public FetchBatch fetchAll(List<FeedSpec> feeds) {
        if (feeds == null || feeds.isEmpty()) {
            throw new NoFeedsConfiguredException();
        }
        List<FeedSpec> distinct = distinctByUrl(feeds);
        context.eventBus().publish(new RunStarted(context.clock().instant(), distinct.size(), context.settings().maxWorkers()));

        long startedNanos = System.nanoTime();
        long deadlineNanos = startedNanos + context.settings().runTimeout().toNanos();

        Map<FeedFetchTask, Future<FetchOutcome>> submitted = new LinkedHashMap<>();
        for (FeedSpec spec : distinct) {
            FeedFetchTask task = new FeedFetchTask(spec, context, parser);
            submitted.put(task, workers.submit(task::run));
        }

        boolean softTimeoutHit = false;
        List<FetchOutcome> outcomes = new ArrayList<>(submitted.size());
        for (Map.Entry<FeedFetchTask, Future<FetchOutcome>> entry : submitted.entrySet()) {
            FeedFetchTask task = entry.getKey();
            Future<FetchOutcome> future = entry.getValue();
            FetchOutcome outcome;
            try {
                long remaining = Math.max(0, deadlineNanos - System.nanoTime());
                outcome = future.get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                softTimeoutHit = true;
                future.cancel(true);
                outcome = task.fallback(FeedError.of(task.spec(), ErrorKind.TIMEOUT,
                        "Run timeout of " + context.settings().runTimeout().toMillis() + "ms elapsed while in state " + task.state()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                outcome = task.fallback(FeedError.of(task.spec(), ErrorKind.TIMEOUT, "Run interrupted"));
            } catch (ExecutionException e) {
                LOGGER.log(Level.WARNING, "Worker failed for " + task.spec().url(), e.getCause());
                outcome = task.fallback(FeedError.of(task.spec(), ErrorKind.NETWORK_ERROR, "Worker failed: " + e.getCause()));
            }
            long durationMillis = task.elapsedMillis() >= 0
                    ? task.elapsedMillis()
                    : TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
            report(outcome, durationMillis);
            outcomes.add(outcome);
        }
        if (softTimeoutHit) {
            LOGGER.warning(() -> "Run timeout elapsed; unfinished feeds were reported as " + ErrorKind.TIMEOUT);
        }
        return new FetchBatch(outcomes, softTimeoutHit);
    }

    @Override
    public void close() {
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                LOGGER.warning("Fetch workers did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void report(FetchOutcome outcome, long durationMillis) {
        FeedSpec spec = outcome.spec();
        FeedError error = outcome.error().orElse(null);
        if (outcome instanceof FetchOutcome.Ok ok) {
            context.eventBus().publish(new FeedFetched(
                    context.clock().instant(),
                    spec.name(),
                    spec.url(),
                    ok.freshness(),
                    error == null ? null : error.kind(),
                    ok.items().size(),
                    durationMillis
            ));
        } else {
            context.eventBus().publish(new FeedFetched(
                    context.clock().instant(),
                    spec.name(),
                    spec.url(),
                    null,
                    error.kind(),
                    0,
                    durationMillis
            ));
        }
        if (error != null && error.kind() != ErrorKind.CACHE_IO_ERROR) {
            context.eventBus().publish(new AlertRaised(
                    context.clock().instant(),
                    "fetch",
                    error.message(),
                    Map.of(
                            "name", spec.name(),
                            "url", spec.url(),
                            "kind", error.kind().name(),
                            "servedStale", error.servedStale()
                    )
            ));
        }
    }

    private static List<FeedSpec> distinctByUrl(List<FeedSpec> feeds) {
        Map<String, FeedSpec> byUrl = new LinkedHashMap<>();
        for (FeedSpec spec : feeds) {
            if (byUrl.putIfAbsent(spec.url(), spec) != null) {
                LOGGER.fine(() -> "Ignoring duplicate feed URL " + spec.url() + " (" + spec.name() + ")");
            }
        }
        return List.copyOf(byUrl.values());
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "tidefeed-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
