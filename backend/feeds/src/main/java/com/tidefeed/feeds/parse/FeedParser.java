package com.tidefeed.feeds.parse;

import com.tidefeed.core.model.FeedItem;
import com.tidefeed.core.model.FeedSpec;
import com.tidefeed.core.util.TextUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXParseException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns one raw feed payload into display items. RSS 2.0, RSS 1.0 (RDF) and Atom are recognised by
 * their root element. Never throws on bad input: anything unreadable comes back as
 * {@link ParseResult#malformed(String)}.
 */
public class FeedParser {
    private static final Logger LOGGER = Logger.getLogger(FeedParser.class.getName());
    private static final int SUMMARY_LIMIT = 280;

    public ParseResult parse(byte[] rawPayload, FeedSpec spec, Instant fetchedAt) {
        if (rawPayload == null || rawPayload.length == 0) {
            return ParseResult.malformed("empty payload");
        }
        Document document;
        try {
            document = XmlDocuments.parse(rawPayload, true);
        } catch (Exception e) {
            LOGGER.log(Level.FINE, "Unparsable payload for " + spec.url(), e);
            return ParseResult.malformed("invalid XML: " + describe(e));
        }
        Element root = document.getDocumentElement();
        if (root == null) {
            return ParseResult.malformed("document has no root element");
        }
        String rootName = localName(root.getTagName());
        return switch (rootName) {
            case "rss", "rdf" -> ParseResult.success(parseRss(document, spec, fetchedAt));
            case "feed" -> ParseResult.success(parseAtom(document, prefixOf(root.getTagName()), spec, fetchedAt));
            default -> ParseResult.malformed("unsupported root element <" + root.getTagName() + ">");
        };
    }

    private static List<FeedItem> parseRss(Document document, FeedSpec spec, Instant fetchedAt) {
        NodeList items = document.getElementsByTagName("item");
        List<FeedItem> parsed = new ArrayList<>();
        for (int i = 0; i < items.getLength(); i++) {
            Node item = items.item(i);
            String title = childText(item, "title").map(TextUtils::stripTags).orElse("");
            String link = childText(item, "link").orElse("");
            Instant publishedAt = childText(item, "pubDate").flatMap(FeedDates::parse)
                    .or(() -> childText(item, "dc:date").flatMap(FeedDates::parse))
                    .orElse(fetchedAt);
            String summary = childText(item, "description")
                    .or(() -> childText(item, "content:encoded"))
                    .map(FeedParser::summarize)
                    .orElse("");
            parsed.add(new FeedItem(spec.name(), title, link, publishedAt, summary));
        }
        return parsed;
    }

    /**
     * @param prefix the root element's namespace prefix including the colon, or empty; Atom elements
     *               of a prefixed document carry the same prefix
     */
    private static List<FeedItem> parseAtom(Document document, String prefix, FeedSpec spec, Instant fetchedAt) {
        NodeList entries = document.getElementsByTagName(prefix + "entry");
        List<FeedItem> parsed = new ArrayList<>();
        for (int i = 0; i < entries.getLength(); i++) {
            Node entry = entries.item(i);
            String title = childText(entry, prefix + "title").map(TextUtils::stripTags).orElse("");
            String link = atomLink(entry, prefix + "link")
                    .or(() -> childText(entry, prefix + "id").filter(TextUtils::isHttpUrl))
                    .orElse("");
            Instant publishedAt = childText(entry, prefix + "published")
                    .flatMap(FeedDates::parse)
                    .or(() -> childText(entry, prefix + "updated").flatMap(FeedDates::parse))
                    .orElse(fetchedAt);
            String summary = childText(entry, prefix + "summary")
                    .or(() -> childText(entry, prefix + "content"))
                    .map(FeedParser::summarize)
                    .orElse("");
            parsed.add(new FeedItem(spec.name(), title, link, publishedAt, summary));
        }
        return parsed;
    }

    private static Optional<String> atomLink(Node entry, String linkTag) {
        if (!(entry instanceof Element element)) {
            return Optional.empty();
        }
        NodeList links = element.getElementsByTagName(linkTag);
        String fallback = null;
        for (int i = 0; i < links.getLength(); i++) {
            if (!(links.item(i) instanceof Element link)) {
                continue;
            }
            String href = link.getAttribute("href").trim();
            if (href.isEmpty()) {
                continue;
            }
            String rel = link.getAttribute("rel");
            if (rel.isBlank() || "alternate".equalsIgnoreCase(rel)) {
                return Optional.of(href);
            }
            if (fallback == null) {
                fallback = href;
            }
        }
        return Optional.ofNullable(fallback);
    }

    private static Optional<String> childText(Node parent, String tagName) {
        if (!(parent instanceof Element element)) {
            return Optional.empty();
        }
        NodeList children = element.getElementsByTagName(tagName);
        if (children.getLength() == 0) {
            return Optional.empty();
        }
        String text = children.item(0).getTextContent();
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(text.trim());
    }

    private static String summarize(String markup) {
        return TextUtils.truncate(TextUtils.stripTags(markup), SUMMARY_LIMIT);
    }

    private static String prefixOf(String tagName) {
        int colon = tagName.indexOf(':');
        return colon >= 0 ? tagName.substring(0, colon + 1) : "";
    }

    private static String localName(String tagName) {
        int colon = tagName.indexOf(':');
        String local = colon >= 0 ? tagName.substring(colon + 1) : tagName;
        return local.toLowerCase(Locale.ROOT);
    }

    private static String describe(Exception e) {
        if (e instanceof SAXParseException sax) {
            return sax.getMessage() + " (line " + sax.getLineNumber() + ")";
        }
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
