package de.bsommerfeld.swiftview.core.domain;

import de.bsommerfeld.swiftview.core.util.PathKeys;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * Live file-system state a cache row is validated against.
 *
 * @param path    normalized store key
 * @param mtimeMs last modification time, epoch milliseconds
 * @param size    file size in bytes
 */
public record FileStat(String path, long mtimeMs, long size) {

    /** Stats the file and normalizes its path into a store key. */
    public static FileStat of(Path file) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
        return new FileStat(PathKeys.dbKey(file), attrs.lastModifiedTime().toMillis(), attrs.size());
    }
}
