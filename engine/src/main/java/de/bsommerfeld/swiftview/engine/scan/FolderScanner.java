package de.bsommerfeld.swiftview.engine.scan;

import de.bsommerfeld.swiftview.core.domain.FileEntry;
import de.bsommerfeld.swiftview.core.domain.FolderSnapshot;
import de.bsommerfeld.swiftview.db.ThumbnailStores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Lists the regular files of one folder (not recursive). The folder's own
 * thumbnail store files are never listed.
 */
public final class FolderScanner {

    private static final Logger LOG = LoggerFactory.getLogger(FolderScanner.class);

    public static final Set<String> IMAGE_SUFFIXES = Set.of("jpg", "jpeg", "png", "bmp", "gif", "webp", "tif", "tiff");

    private FolderScanner() {
    }

    public static FolderSnapshot scan(Path folder) throws IOException {
        Path dir = folder.toAbsolutePath().normalize();
        List<FileEntry> entries = new ArrayList<>();

        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                String name = file.getFileName().toString();
                if (ThumbnailStores.isStoreArtifact(name))
                    continue;
                BasicFileAttributes attrs;
                try {
                    attrs = Files.readAttributes(file, BasicFileAttributes.class);
                } catch (IOException e) {
                    // Vanished or unreadable between list and stat
                    LOG.debug("Skipping {}: {}", file, e.getMessage());
                    continue;
                }
                if (!attrs.isRegularFile())
                    continue;
                String suffix = suffixOf(name);
                entries.add(new FileEntry(file.toString(), name, suffix, attrs.size(),
                        attrs.lastModifiedTime().toMillis(), IMAGE_SUFFIXES.contains(suffix)));
            }
        }

        entries.sort(Comparator.comparing(e -> e.name().toLowerCase(Locale.ROOT)));
        List<Path> images = entries.stream().filter(FileEntry::image).map(e -> Path.of(e.path())).toList();
        LOG.debug("Scanned {}: {} files, {} images", dir, entries.size(), images.size());
        return new FolderSnapshot(dir, entries, images);
    }

    public static boolean isImage(Path file) {
        return IMAGE_SUFFIXES.contains(suffixOf(file.getFileName().toString()));
    }

    static String suffixOf(String name) {
        int dot = name.lastIndexOf('.');
        return dot < 0 || dot == name.length() - 1 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
