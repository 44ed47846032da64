package de.bsommerfeld.swiftview.core.domain;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of a folder scan. Entries and image paths are sorted by lower-cased
 * file name.
 */
public record FolderSnapshot(Path folder, List<FileEntry> entries, List<Path> imagePaths) {

    public FolderSnapshot {
        entries = List.copyOf(entries);
        imagePaths = List.copyOf(imagePaths);
    }
}
