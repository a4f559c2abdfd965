package com.tidefeed.feeds;

import com.tidefeed.core.events.RunCompleted;
import com.tidefeed.core.model.FeedError;
import com.tidefeed.core.model.FeedItem;
import com.tidefeed.core.model.FeedSpec;
import com.tidefeed.core.model.FetchOutcome;
import com.tidefeed.core.model.RunReport;
import com.tidefeed.feeds.api.FetchContext;
import com.tidefeed.feeds.merge.TimelineMerger;
import com.tidefeed.feeds.schedule.FetchBatch;
import com.tidefeed.feeds.schedule.FetchScheduler;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * One aggregation run: fetch every feed, then merge what came back into a single timeline.
 */
public class FeedAggregator implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(FeedAggregator.class.getName());

    private final FetchContext context;
    private final FetchScheduler scheduler;
    private final TimelineMerger merger;

    public FeedAggregator(FetchContext context) {
        this(context, new FetchScheduler(context), new TimelineMerger(context.settings().maxItemAge(), context.clock()));
    }

    FeedAggregator(FetchContext context, FetchScheduler scheduler, TimelineMerger merger) {
        this.context = context;
        this.scheduler = scheduler;
        this.merger = merger;
    }

    /**
     * @throws com.tidefeed.feeds.schedule.NoFeedsConfiguredException if {@code feeds} is empty
     */
    public RunReport run(List<FeedSpec> feeds) {
        Instant startedAt = context.clock().instant();
        FetchBatch batch = scheduler.fetchAll(feeds);
        List<FetchOutcome> outcomes = batch.outcomes();
        List<FeedItem> timeline = merger.merge(outcomes);
        List<FeedError> errors = outcomes.stream()
                .map(FetchOutcome::error)
                .flatMap(Optional::stream)
                .toList();
        RunReport report = new RunReport(timeline, outcomes, errors, startedAt, context.clock().instant());

        long failures = outcomes.stream().filter(FetchOutcome.Err.class::isInstance).count();
        context.eventBus().publish(new RunCompleted(
                report.finishedAt(),
                outcomes.size(),
                (int) failures,
                timeline.size(),
                batch.softTimeoutHit(),
                report.duration().toMillis()
        ));
        LOGGER.info(() -> "Merged " + timeline.size() + " items from " + (outcomes.size() - failures) + "/" + outcomes.size()
                + " feeds; " + errors.size() + " feed errors");
        return report;
    }

    @Override
    public void close() {
        scheduler.close();
    }
}
