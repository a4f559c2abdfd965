package com.tidefeed.app.config;

import com.tidefeed.core.model.FeedSpec;
import com.tidefeed.feeds.config.FetchSettings;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @Test
    void loadsFeedsAndSettings() throws Exception {
        Path file = Files.createTempDirectory("config-loader-").resolve("config.json");
        Files.writeString(file, """
                {
                  "feeds": [
                    {"name": "HN", "url": "https://news.example.com/rss"},
                    {"url": "https://lobsters.example.com/rss"}
                  ],
                  "settings": {
                    "cacheTtl": "PT5M",
                    "runTimeout": "PT20S",
                    "maxWorkers": 3,
                    "maxItemAge": "PT24H"
                  }
                }
                """);

        FeedConfig config = ConfigLoader.load(file);

        assertEquals(List.of(
                new FeedSpec("HN", "https://news.example.com/rss"),
                new FeedSpec(null, "https://lobsters.example.com/rss")
        ), config.feeds());
        assertEquals("https://lobsters.example.com/rss", config.feeds().get(1).name());
        FetchSettings settings = config.settings();
        assertEquals(Duration.ofMinutes(5), settings.cacheTtl());
        assertEquals(Duration.ofSeconds(20), settings.runTimeout());
        assertEquals(3, settings.maxWorkers());
        assertEquals(Duration.ofHours(24), settings.maxItemAge());
        assertEquals(FetchSettings.DEFAULT_REQUEST_TIMEOUT, settings.requestTimeout());
        assertEquals(FetchSettings.DEFAULT_USER_AGENT, settings.userAgent());
        assertEquals(file, config.source());
    }

    @Test
    void dropsEntriesWithoutUsableUrl() throws Exception {
        Path file = Files.createTempDirectory("config-loader-").resolve("config.json");
        Files.writeString(file, """
                {"feeds": [
                  {"name": "no url"},
                  {"name": "ftp", "url": "ftp://files.example.com/feed"},
                  {"name": "ok", "url": "http://ok.example.com/rss"}
                ]}
                """);

        FeedConfig config = ConfigLoader.load(file);

        assertEquals(1, config.feeds().size());
        assertEquals("ok", config.feeds().get(0).name());
        assertEquals(FetchSettings.defaults(), config.settings());
    }

    @Test
    void loadFirstPicksFirstExistingCandidateOrFallsBackToEmpty() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-");
        Path missing = dir.resolve("missing.json");
        Path present = dir.resolve("present.json");
        Files.writeString(present, "{\"feeds\":[{\"name\":\"x\",\"url\":\"https://x.example.com/rss\"}]}");

        assertEquals(1, ConfigLoader.loadFirst(List.of(missing, present)).feeds().size());

        FeedConfig empty = ConfigLoader.loadFirst(List.of(missing));
        assertTrue(empty.feeds().isEmpty());
        assertNull(empty.source());
    }

    @Test
    void invalidJsonFailsWithClearMessage() throws Exception {
        Path file = Files.createTempDirectory("config-loader-").resolve("config.json");
        Files.writeString(file, "{ this is not valid json }");

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> ConfigLoader.load(file));
        assertTrue(ex.getMessage().contains("Failed loading config"));
    }

    @Test
    void invalidSettingsFailWithClearMessage() throws Exception {
        Path file = Files.createTempDirectory("config-loader-").resolve("config.json");
        Files.writeString(file, "{\"feeds\":[],\"settings\":{\"runTimeout\":\"PT0S\"}}");

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> ConfigLoader.load(file));
        assertTrue(ex.getMessage().contains("invalid settings"));
    }
}
