package com.tidefeed.feeds.parse;

import com.tidefeed.core.model.FeedItem;
import com.tidefeed.core.model.FeedSpec;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static com.tidefeed.feeds.support.FixtureUtils.fixtureBytes;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FeedParserTest {
    private static final Instant FETCHED_AT = Instant.parse("2024-03-02T00:00:00Z");

    private final FeedParser parser = new FeedParser();
    private final FeedSpec spec = new FeedSpec("Harbor", "https://harbor.example.com/feed.xml");

    @Test
    void parsesRssItemsInDocumentOrder() {
        ParseResult result = parser.parse(fixtureBytes("fixtures/sample-rss.xml"), spec, FETCHED_AT);

        assertTrue(result.ok());
        List<FeedItem> items = result.items();
        assertEquals(3, items.size());

        FeedItem first = items.get(0);
        assertEquals("Harbor", first.sourceName());
        assertEquals("Tide tables updated for spring", first.title());
        assertEquals("https://harbor.example.com/posts/tide-tables", first.link());
        assertEquals(Instant.parse("2024-03-01T18:30:00Z"), first.publishedAt());
        assertEquals("The new tables are out.", first.summary());
        assertFalse(first.stale());

        assertEquals(Instant.parse("2024-03-01T08:00:00Z"), items.get(1).publishedAt());
    }

    @Test
    void fallsBackToDublinCoreDateAndEncodedContent() {
        ParseResult result = parser.parse(fixtureBytes("fixtures/sample-rss.xml"), spec, FETCHED_AT);

        FeedItem dredging = result.items().get(2);
        assertEquals(Instant.parse("2024-02-29T12:00:00Z"), dredging.publishedAt());
        assertEquals("Expect noise near pier 4.", dredging.summary());
    }

    @Test
    void missingOrUnreadableDatesUseFetchTimeAndMissingTitleIsEmpty() {
        ParseResult result = parser.parse(fixtureBytes("fixtures/rss-variants.xml"), spec, FETCHED_AT);

        assertTrue(result.ok(), result.malformedDetail());
        List<FeedItem> items = result.items();
        assertEquals(3, items.size());
        assertEquals(FETCHED_AT, items.get(0).publishedAt());
        assertEquals("", items.get(1).title());
        assertNotEquals(FETCHED_AT, items.get(1).publishedAt());
        assertEquals(FETCHED_AT, items.get(2).publishedAt());
    }

    @Test
    void parsesAtomEntries() {
        ParseResult result = parser.parse(fixtureBytes("fixtures/sample-atom.xml"), spec, FETCHED_AT);

        assertTrue(result.ok());
        List<FeedItem> items = result.items();
        assertEquals(3, items.size());

        FeedItem lamp = items.get(0);
        assertEquals("https://lighthouse.example.org/log/lamp", lamp.link());
        assertEquals(Instant.parse("2024-03-01T20:00:00Z"), lamp.publishedAt());
        assertEquals("The old lamp finally gave out.", lamp.summary());

        FeedItem fogHorn = items.get(1);
        assertEquals("Fog horn test", fogHorn.title());
        assertEquals(Instant.parse("2024-02-28T05:45:00Z"), fogHorn.publishedAt());
        assertEquals("Three long blasts at noon.", fogHorn.summary());

        assertEquals("https://lighthouse.example.org/log/id-only", items.get(2).link());
    }

    @Test
    void parsesRdfFeeds() {
        ParseResult result = parser.parse(fixtureBytes("fixtures/sample-rdf.xml"), spec, FETCHED_AT);

        assertTrue(result.ok());
        assertEquals(2, result.items().size());
        assertEquals("Wave height 2.1m", result.items().get(0).title());
        assertEquals(Instant.parse("2024-03-01T06:00:00Z"), result.items().get(0).publishedAt());
    }

    @Test
    void longSummariesAreTruncated() {
        String body = "x".repeat(1000);
        String rss = "<rss version=\"2.0\"><channel><item><title>t</title><description>" + body
                + "</description></item></channel></rss>";

        ParseResult result = parser.parse(rss.getBytes(StandardCharsets.UTF_8), spec, FETCHED_AT);

        String summary = result.items().get(0).summary();
        assertEquals(280, summary.length());
        assertTrue(summary.endsWith("..."));
    }

    @Test
    void unreadablePubDateFallsBackToDublinCoreDate() {
        String rss = "<rss version=\"2.0\" xmlns:dc=\"http://purl.org/dc/elements/1.1/\"><channel><title>Harbor</title>"
                + "<item><title>Buoy moved</title><link>https://harbor.example.com/buoy</link>"
                + "<pubDate>sometime last week</pubDate><dc:date>2024-02-28T07:30:00Z</dc:date></item>"
                + "</channel></rss>";

        ParseResult result = parser.parse(rss.getBytes(StandardCharsets.UTF_8), spec, FETCHED_AT);

        assertTrue(result.ok(), result.malformedDetail());
        assertEquals(Instant.parse("2024-02-28T07:30:00Z"), result.items().get(0).publishedAt());
    }

    @Test
    void prefixedAtomDocumentsYieldTheirEntries() {
        String atom = "<atom:feed xmlns:atom=\"http://www.w3.org/2005/Atom\"><atom:title>Lighthouse</atom:title>"
                + "<atom:entry><atom:title>Lens polished</atom:title>"
                + "<atom:link rel=\"alternate\" href=\"https://lighthouse.example.org/lens\"/>"
                + "<atom:updated>2024-03-01T06:00:00Z</atom:updated>"
                + "<atom:summary>Shines again.</atom:summary></atom:entry>"
                + "</atom:feed>";

        ParseResult result = parser.parse(atom.getBytes(StandardCharsets.UTF_8), spec, FETCHED_AT);

        assertTrue(result.ok(), result.malformedDetail());
        assertEquals(1, result.items().size());
        FeedItem item = result.items().get(0);
        assertEquals("Lens polished", item.title());
        assertEquals("https://lighthouse.example.org/lens", item.link());
        assertEquals(Instant.parse("2024-03-01T06:00:00Z"), item.publishedAt());
        assertEquals("Shines again.", item.summary());
    }

    @Test
    void channelWithoutItemsIsAnEmptySuccess() {
        String rss = "<rss version=\"2.0\"><channel><title>Quiet</title></channel></rss>";

        ParseResult result = parser.parse(rss.getBytes(StandardCharsets.UTF_8), spec, FETCHED_AT);

        assertTrue(result.ok());
        assertTrue(result.items().isEmpty());
    }

    @Test
    void reportsMalformedPayloadsInsteadOfThrowing() {
        ParseResult broken = parser.parse(fixtureBytes("fixtures/broken.xml"), spec, FETCHED_AT);
        ParseResult html = parser.parse(fixtureBytes("fixtures/not-a-feed.html"), spec, FETCHED_AT);
        ParseResult empty = parser.parse(new byte[0], spec, FETCHED_AT);

        assertFalse(broken.ok());
        assertTrue(broken.malformedDetail().startsWith("invalid XML"));
        assertFalse(html.ok());
        assertTrue(html.malformedDetail().contains("unsupported root element"));
        assertFalse(empty.ok());
        assertTrue(broken.items().isEmpty());
    }

    @Test
    void externalEntitiesAreNotResolved() {
        String rss = "<?xml version=\"1.0\"?>"
                + "<!DOCTYPE rss [<!ENTITY xxe SYSTEM \"file:///etc/passwd\">]>"
                + "<rss version=\"2.0\"><channel><item><title>&xxe;</title></item></channel></rss>";

        ParseResult result = parser.parse(rss.getBytes(StandardCharsets.UTF_8), spec, FETCHED_AT);

        if (result.ok()) {
            assertFalse(result.items().get(0).title().contains("root:"));
        }
    }
}
