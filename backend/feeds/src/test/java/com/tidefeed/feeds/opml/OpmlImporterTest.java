package com.tidefeed.feeds.opml;

import com.tidefeed.core.model.FeedSpec;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static com.tidefeed.feeds.support.FixtureUtils.fixtureBytes;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpmlImporterTest {
    private final OpmlImporter importer = new OpmlImporter();

    @Test
    void importsNestedOutlinesWithFeedUrls() throws Exception {
        List<FeedSpec> feeds = importer.importFrom(fixtureBytes("fixtures/sample.opml"));

        assertEquals(3, feeds.size());
        assertEquals(new FeedSpec("Harbor Notes", "https://harbor.example.com/feed.xml"), feeds.get(0));
        assertEquals("Harbor Notes", feeds.get(0).name());
        assertEquals("Lighthouse Log", feeds.get(1).name());
        assertEquals("https://buoy.example.net/rss", feeds.get(2).url());
        assertEquals("https://buoy.example.net/rss", feeds.get(2).name());
    }

    @Test
    void outlineWithoutFeedsGivesEmptyList() throws Exception {
        String opml = "<opml version=\"2.0\"><head/><body><outline text=\"folder\"/></body></opml>";

        assertTrue(importer.importFrom(opml.getBytes(StandardCharsets.UTF_8)).isEmpty());
    }

    @Test
    void rejectsDocumentsThatAreNotOpml() {
        OpmlImportException notOpml = assertThrows(OpmlImportException.class,
                () -> importer.importFrom(fixtureBytes("fixtures/sample-rss.xml")));
        assertTrue(notOpml.getMessage().contains("Not an OPML document"));

        assertThrows(OpmlImportException.class, () -> importer.importFrom("<opml><body>".getBytes(StandardCharsets.UTF_8)));
        assertThrows(OpmlImportException.class, () -> importer.importFrom(new byte[0]));
    }

    @Test
    void rejectsDoctypeDeclarations() {
        String opml = "<?xml version=\"1.0\"?><!DOCTYPE opml [<!ENTITY x \"y\">]>"
                + "<opml version=\"2.0\"><body><outline xmlUrl=\"https://a.example/rss\"/></body></opml>";

        assertThrows(OpmlImportException.class, () -> importer.importFrom(opml.getBytes(StandardCharsets.UTF_8)));
    }
}
