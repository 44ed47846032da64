package de.bsommerfeld.swiftview.db;

import de.bsommerfeld.swiftview.core.util.StorageUtils;
import de.bsommerfeld.swiftview.db.migration.MigrationReport;
import de.bsommerfeld.swiftview.db.migration.MigrationRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Opens the thumbnail store of a browsed folder. The file sits next to the
 * images under a fixed name; an existing file is recognized regardless of the
 * case of its name.
 */
public final class ThumbnailStores {

    public static final String FILE_NAME = "SwiftView_thumbs.db";

    private static final Logger LOG = LoggerFactory.getLogger(ThumbnailStores.class);

    private ThumbnailStores() {
    }

    /**
     * Resolves, creates if needed and migrates the folder's store.
     *
     * @throws SchemaException if migration fails; the operator is closed
     *                         again before this propagates
     */
    public static ThumbnailStore open(Path folder, StoreSettings settings) {
        return open(folder, settings, new MigrationRunner());
    }

    static ThumbnailStore open(Path folder, StoreSettings settings, MigrationRunner runner) {
        Path file = resolveStoreFile(folder);
        boolean created = !Files.exists(file);

        StoreOperator operator = new StoreOperator(file, settings);
        MigrationReport report;
        try {
            report = StoreOperator.await(operator.scheduleSession(runner::migrate));
        } catch (RuntimeException e) {
            operator.close();
            throw e;
        }

        if (created) {
            hideOnWindows(file);
            LOG.info("Created thumbnail store {}", file);
        } else if (!report.isNoOp()) {
            LOG.info("Migrated thumbnail store {} from v{} to v{}", file, report.fromVersion(), report.toVersion());
        }
        return new ThumbnailStore(operator, created, report);
    }

    /**
     * The existing store file of {@code folder}, matched case-insensitively,
     * or the canonical name if there is none yet.
     */
    public static Path resolveStoreFile(Path folder) {
        return findExisting(folder).orElse(folder.resolve(FILE_NAME));
    }

    public static Optional<Path> findExisting(Path folder) {
        if (!Files.isDirectory(folder))
            return Optional.empty();
        try (Stream<Path> entries = Files.list(folder)) {
            return entries.filter(p -> p.getFileName().toString().equalsIgnoreCase(FILE_NAME))
                    .filter(Files::isRegularFile)
                    .findFirst();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + folder, e);
        }
    }

    /** Whether {@code fileName} is the store file or one of its WAL/SHM companions. */
    public static boolean isStoreArtifact(String fileName) {
        String lower = fileName.toLowerCase();
        String base = FILE_NAME.toLowerCase();
        return lower.equals(base) || lower.startsWith(base + "-") || lower.startsWith(base + ".");
    }

    private static void hideOnWindows(Path file) {
        if (!StorageUtils.isWindows())
            return;
        try {
            Files.setAttribute(file, "dos:hidden", true);
        } catch (IOException | UnsupportedOperationException e) {
            LOG.warn("Could not hide store file {}: {}", file, e.getMessage());
        }
    }
}
