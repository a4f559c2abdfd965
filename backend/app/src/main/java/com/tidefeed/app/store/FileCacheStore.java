package com.tidefeed.app.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tidefeed.core.model.CacheEntry;
import com.tidefeed.core.util.HashingUtils;
import com.tidefeed.core.util.JsonUtils;
import com.tidefeed.feeds.api.CacheStore;
import com.tidefeed.feeds.api.CacheStoreException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One JSON file per feed URL, named by the SHA-256 of the URL. Each write goes to a temp file that is
 * then moved over the record, so readers never observe a partial record and writers of different
 * URLs never touch the same file.
 */
public class FileCacheStore implements CacheStore {
    private static final Logger LOGGER = Logger.getLogger(FileCacheStore.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path directory;

    public FileCacheStore(Path directory) {
        this.directory = directory;
    }

    @Override
    public Optional<CacheEntry> get(String url) {
        Path file = fileFor(url);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try (InputStream in = Files.newInputStream(file)) {
            CacheEntry entry = MAPPER.readValue(in, CacheEntry.class);
            if (!url.equals(entry.url())) {
                LOGGER.warning(() -> "Cache record " + file + " belongs to " + entry.url() + ", not " + url + "; ignoring");
                return Optional.empty();
            }
            return Optional.of(entry);
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.WARNING, "Unreadable cache record " + file + " for " + url + "; treating as miss", e);
            return Optional.empty();
        }
    }

    @Override
    public void put(CacheEntry entry) {
        Path target = fileFor(entry.url());
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                MAPPER.writeValue(out, entry);
            }
            moveIntoPlace(temp, target);
            temp = null;
        } catch (IOException e) {
            throw new CacheStoreException("Failed writing cache entry for " + entry.url() + " to " + target, e);
        } finally {
            deleteQuietly(temp);
        }
    }

    public Path directory() {
        return directory;
    }

    Path fileFor(String url) {
        return directory.resolve(HashingUtils.sha256(url) + ".json");
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Could not remove temp cache file " + temp, e);
        }
    }
}
