package com.tidefeed.feeds.opml;

import com.tidefeed.core.model.FeedSpec;
import com.tidefeed.core.util.TextUtils;
import com.tidefeed.feeds.parse.XmlDocuments;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Reads the feed subscriptions out of an OPML outline. Outlines without a usable feed URL (folders,
 * plain links) are skipped. The result is only returned; persisting it is the caller's job.
 */
public class OpmlImporter {
    private static final Logger LOGGER = Logger.getLogger(OpmlImporter.class.getName());

    public List<FeedSpec> importFrom(byte[] document) throws OpmlImportException {
        Element root = parse(document).getDocumentElement();
        if (root == null || !"opml".equalsIgnoreCase(root.getTagName())) {
            throw new OpmlImportException("Not an OPML document: root element is "
                    + (root == null ? "missing" : "<" + root.getTagName() + ">"));
        }

        Map<String, FeedSpec> byUrl = new LinkedHashMap<>();
        NodeList outlines = root.getElementsByTagName("outline");
        int skipped = 0;
        for (int i = 0; i < outlines.getLength(); i++) {
            if (!(outlines.item(i) instanceof Element outline)) {
                continue;
            }
            Optional<String> url = attribute(outline, "xmlUrl").filter(TextUtils::isHttpUrl);
            if (url.isEmpty()) {
                if (!outline.hasChildNodes()) {
                    skipped++;
                }
                continue;
            }
            String name = attribute(outline, "title")
                    .or(() -> attribute(outline, "text"))
                    .orElse(url.get());
            byUrl.putIfAbsent(url.get().trim(), new FeedSpec(name, url.get()));
        }
        int skippedCount = skipped;
        LOGGER.fine(() -> "OPML import found " + byUrl.size() + " feeds, skipped " + skippedCount + " outlines");
        return List.copyOf(byUrl.values());
    }

    private static Document parse(byte[] document) throws OpmlImportException {
        if (document == null || document.length == 0) {
            throw new OpmlImportException("OPML document is empty");
        }
        try {
            return XmlDocuments.parse(document, false);
        } catch (Exception e) {
            throw new OpmlImportException("Invalid OPML document: " + e.getMessage(), e);
        }
    }

    // Attribute names are matched case-insensitively; exporters disagree on xmlUrl vs xmlurl.
    private static Optional<String> attribute(Element element, String name) {
        NamedNodeMap attributes = element.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Node attribute = attributes.item(i);
            if (attribute.getNodeName().toLowerCase(Locale.ROOT).equals(name.toLowerCase(Locale.ROOT))) {
                String value = attribute.getNodeValue();
                return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
            }
        }
        return Optional.empty();
    }
}
