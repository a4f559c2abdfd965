package com.tidefeed.app.logging;

import com.tidefeed.core.bus.EventBus;
import com.tidefeed.core.events.AlertRaised;
import com.tidefeed.core.events.Event;
import com.tidefeed.core.events.FeedFetched;
import com.tidefeed.core.events.RunCompleted;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Mirrors every bus event into the log: alerts at WARNING, run summaries at INFO, per-feed detail at
 * FINE.
 */
public final class EventLogger {
    private static final Logger LOGGER = Logger.getLogger("com.tidefeed.events");

    private EventLogger() {
    }

    public static void attach(EventBus bus) {
        bus.subscribeAll(EventLogger::log);
    }

    static Level levelFor(Event event) {
        if (event instanceof AlertRaised) {
            return Level.WARNING;
        }
        if (event instanceof RunCompleted) {
            return Level.INFO;
        }
        return Level.FINE;
    }

    static String format(Event event) {
        if (event instanceof FeedFetched fetched) {
            String result = fetched.success() ? fetched.freshness().name() : "FAILED " + fetched.failure();
            return "feed " + fetched.name() + " <" + fetched.url() + "> " + result
                    + " items=" + fetched.itemCount() + " in " + fetched.durationMillis() + "ms";
        }
        if (event instanceof AlertRaised alert) {
            return "[" + alert.category() + "] " + alert.message();
        }
        if (event instanceof RunCompleted completed) {
            return "run completed: feeds=" + completed.feedCount()
                    + " failures=" + completed.failures()
                    + " items=" + completed.itemCount()
                    + (completed.softTimeoutHit() ? " (run timeout hit)" : "")
                    + " in " + completed.durationMillis() + "ms";
        }
        return event.type() + " " + event;
    }

    private static void log(Event event) {
        Level level = levelFor(event);
        if (LOGGER.isLoggable(level)) {
            LOGGER.log(level, format(event));
        }
    }
}
