package com.lingplug.core.cache;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * 平台相关的用户缓存目录
 * <p>
 * Linux: $XDG_CACHE_HOME 或 ~/.cache；macOS: ~/Library/Caches；Windows: %LOCALAPPDATA%\cache
 */
public final class CacheDirectories {

    private CacheDirectories() {
    }

    public static Path userCacheDir() {
        return userCacheDir(System.getProperty("os.name", ""), System.getenv("LOCALAPPDATA"),
                System.getenv("XDG_CACHE_HOME"), System.getProperty("user.home"));
    }

    static Path userCacheDir(String osName, String localAppData, String xdgCacheHome, String userHome) {
        String os = osName.toLowerCase(Locale.ROOT);
        Path home = Paths.get(userHome);

        if (os.startsWith("windows")) {
            if (localAppData != null && !localAppData.isEmpty()) {
                return Paths.get(localAppData, "cache");
            }
            return home.resolve("AppData").resolve("Local").resolve("cache");
        }
        if (os.startsWith("mac") || os.startsWith("darwin")) {
            return home.resolve("Library").resolve("Caches");
        }
        if (os.startsWith("linux") && xdgCacheHome != null && !xdgCacheHome.isEmpty()) {
            Path xdg = Paths.get(xdgCacheHome);
            if (xdg.isAbsolute()) {
                return xdg;
            }
        }
        return home.resolve(".cache");
    }
}
