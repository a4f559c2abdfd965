package com.tidefeed.app.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * User-scoped locations for the feed list and the response cache.
 */
public record AppPaths(Path configFile, List<Path> configCandidates, Path cacheDir) {
    public static final String CONFIG_ENV = "TIDEFEED_CONFIG";
    public static final String CACHE_DIR_ENV = "TIDEFEED_CACHE_DIR";

    public AppPaths {
        configCandidates = List.copyOf(configCandidates);
    }

    public static AppPaths resolve(Map<String, String> environment, Path workingDir) {
        Path home = Path.of(environment.getOrDefault("HOME", System.getProperty("user.home")));

        Path configFile;
        List<Path> candidates = new ArrayList<>();
        String explicitConfig = environment.get(CONFIG_ENV);
        if (explicitConfig != null && !explicitConfig.isBlank()) {
            configFile = Path.of(explicitConfig);
            candidates.add(configFile);
        } else {
            configFile = home.resolve(".config").resolve("tidefeed").resolve("config.json");
            candidates.add(configFile);
            candidates.add(workingDir.resolve("config.json"));
        }

        Path cacheDir;
        String explicitCache = environment.get(CACHE_DIR_ENV);
        String xdgCache = environment.get("XDG_CACHE_HOME");
        if (explicitCache != null && !explicitCache.isBlank()) {
            cacheDir = Path.of(explicitCache);
        } else if (xdgCache != null && !xdgCache.isBlank()) {
            cacheDir = Path.of(xdgCache).resolve("tidefeed");
        } else {
            cacheDir = home.resolve(".cache").resolve("tidefeed");
        }
        return new AppPaths(configFile, candidates, cacheDir);
    }
}
