package org.netpreserve.newsagger.config;

import java.nio.file.Path;

/**
 * Where state and downloads live on disk.
 *
 * @param database  SQLite database file
 * @param downloads root directory for downloaded page files
 */
public record StorageConfig(
        Path database,
        Path downloads
) {
    public static StorageConfig defaults() {
        return new StorageConfig(Path.of("data", "newsagger.db"), Path.of("data", "downloads"));
    }
}
