package com.tidefeed.app.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tidefeed.core.model.FeedSpec;
import com.tidefeed.core.util.JsonUtils;
import com.tidefeed.core.util.TextUtils;
import com.tidefeed.feeds.config.FetchSettings;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Reads {@code {"feeds":[{"name":..,"url":..}], "settings":{..}}}. Entries without a usable URL are
 * dropped with a warning; a file that is not JSON at all fails the load.
 */
public final class ConfigLoader {
    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private ConfigLoader() {
    }

    /**
     * Loads the first existing candidate, or an empty config when none exists.
     */
    public static FeedConfig loadFirst(List<Path> candidates) {
        for (Path candidate : candidates) {
            if (Files.isRegularFile(candidate)) {
                return load(candidate);
            }
        }
        LOGGER.warning(() -> "No config file found; looked in " + candidates);
        return FeedConfig.empty();
    }

    public static FeedConfig load(Path path) {
        JsonNode root = readTree(path);
        return new FeedConfig(feeds(root.path("feeds"), path), settings(root.path("settings"), path), path);
    }

    static JsonNode readTree(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            JsonNode root = MAPPER.readTree(in);
            if (root == null || !root.isObject()) {
                throw new IllegalStateException("Failed loading config from " + path + ": expected a JSON object");
            }
            return root;
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }

    private static List<FeedSpec> feeds(JsonNode node, Path path) {
        List<FeedSpec> feeds = new ArrayList<>();
        if (!node.isArray()) {
            if (!node.isMissingNode()) {
                LOGGER.warning(() -> "'feeds' in " + path + " is not an array; ignoring it");
            }
            return feeds;
        }
        int index = 0;
        for (JsonNode entry : node) {
            String url = entry.path("url").asText("").trim();
            if (!TextUtils.isHttpUrl(url)) {
                int position = index;
                LOGGER.warning(() -> "Dropping feed entry #" + position + " in " + path + ": missing or unusable url");
            } else {
                feeds.add(new FeedSpec(entry.path("name").asText(null), url));
            }
            index++;
        }
        return feeds;
    }

    private static FetchSettings settings(JsonNode node, Path path) {
        if (node.isMissingNode() || node.isNull()) {
            return FetchSettings.defaults();
        }
        try {
            return MAPPER.treeToValue(node, SettingsBlock.class).toFetchSettings();
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading config from " + path + ": invalid settings: " + e.getMessage(), e);
        }
    }
}
