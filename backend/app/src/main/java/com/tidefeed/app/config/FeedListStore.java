package com.tidefeed.app.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tidefeed.core.model.FeedSpec;
import com.tidefeed.core.util.JsonUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes imported feeds into config.json. Imported feeds are appended to the raw {@code feeds} array
 * when their URL is not there yet, so importing the same outline twice adds nothing the second time.
 * Existing entries and keys other than {@code feeds} are written back as they were read.
 */
public final class FeedListStore {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private FeedListStore() {
    }

    public static ImportSummary importInto(Path configFile, List<FeedSpec> imported) {
        ObjectNode root = Files.exists(configFile)
                ? (ObjectNode) ConfigLoader.readTree(configFile)
                : MAPPER.createObjectNode();
        ArrayNode feeds = feedsArray(root, configFile);

        Set<String> known = new HashSet<>();
        for (JsonNode entry : feeds) {
            String url = entry.path("url").asText("").trim();
            if (!url.isEmpty()) {
                known.add(url);
            }
        }
        int added = 0;
        for (FeedSpec spec : imported) {
            if (known.add(spec.url())) {
                feeds.addObject().put("name", spec.name()).put("url", spec.url());
                added++;
            }
        }
        write(configFile, root);
        return new ImportSummary(configFile, imported.size(), added, feeds.size());
    }

    private static ArrayNode feedsArray(ObjectNode root, Path configFile) {
        JsonNode node = root.get("feeds");
        if (node == null || node.isNull()) {
            return root.putArray("feeds");
        }
        if (!node.isArray()) {
            throw new IllegalStateException("Refusing to import into " + configFile + ": 'feeds' is not an array");
        }
        return (ArrayNode) node;
    }

    private static void write(Path configFile, ObjectNode root) {
        try {
            Path parent = configFile.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, "config-", ".json.tmp");
            try {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), root);
                Files.move(temp, configFile, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing config to " + configFile, e);
        }
    }

    public record ImportSummary(Path configFile, int found, int added, int total) {
        public int alreadyPresent() {
            return found - added;
        }
    }
}
