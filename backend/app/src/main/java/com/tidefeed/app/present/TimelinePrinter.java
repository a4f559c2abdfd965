package com.tidefeed.app.present;

import com.tidefeed.core.model.FeedError;
import com.tidefeed.core.model.FeedItem;
import com.tidefeed.core.model.RunReport;

import java.io.PrintStream;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Plain-text rendering of a run: one line per timeline item, then one line per feed error.
 */
public class TimelinePrinter {
    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm", Locale.ROOT);

    private final ZoneId zone;

    public TimelinePrinter(ZoneId zone) {
        this.zone = zone;
    }

    public void print(RunReport report, PrintStream out, PrintStream err) {
        if (report.timeline().isEmpty()) {
            out.println("No articles found.");
        }
        for (FeedItem item : report.timeline()) {
            out.println(line(item));
        }
        for (FeedError error : report.errors()) {
            err.println(errorLine(error));
        }
    }

    String line(FeedItem item) {
        StringBuilder line = new StringBuilder()
                .append(TIME_FORMAT.format(item.publishedAt().atZone(zone)))
                .append("  ")
                .append(item.displayLine());
        if (!item.link().isEmpty()) {
            line.append("  ").append(item.link());
        }
        if (item.stale()) {
            line.append("  (stale)");
        }
        return line.toString();
    }

    static String errorLine(FeedError error) {
        return "error: " + error.name() + " " + error.kind() + " " + error.message()
                + (error.servedStale() ? " (showing cached items)" : "");
    }
}
