package de.bsommerfeld.swiftview.engine.scan;

import de.bsommerfeld.swiftview.core.domain.FileEntry;
import de.bsommerfeld.swiftview.core.domain.FolderSnapshot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FolderScannerTest {

    @TempDir
    Path tempDir;

    @Test
    void scan_shouldListFilesSortedAndMarkImages() throws Exception {
        Files.write(tempDir.resolve("b.PNG"), new byte[] { 1, 2, 3 });
        Files.write(tempDir.resolve("a.jpg"), new byte[] { 1 });
        Files.writeString(tempDir.resolve("Notes.txt"), "hello");
        Files.createDirectory(tempDir.resolve("sub"));

        FolderSnapshot snapshot = FolderScanner.scan(tempDir);

        assertEquals(List.of("a.jpg", "b.PNG", "Notes.txt"),
                snapshot.entries().stream().map(FileEntry::name).toList());
        assertEquals(List.of(tempDir.resolve("a.jpg"), tempDir.resolve("b.PNG")), snapshot.imagePaths());

        FileEntry png = snapshot.entries().get(1);
        assertEquals("png", png.suffix());
        assertEquals(3, png.size());
        assertTrue(png.image());
        assertFalse(snapshot.entries().get(2).image());
    }

    @Test
    void scan_shouldSkipStoreFiles() throws Exception {
        Files.write(tempDir.resolve("SwiftView_thumbs.db"), new byte[] { 0 });
        Files.write(tempDir.resolve("swiftview_thumbs.db-wal"), new byte[] { 0 });
        Files.write(tempDir.resolve("SWIFTVIEW_THUMBS.DB-shm"), new byte[] { 0 });
        Files.write(tempDir.resolve("c.gif"), new byte[] { 0 });

        FolderSnapshot snapshot = FolderScanner.scan(tempDir);

        assertEquals(1, snapshot.entries().size());
        assertEquals("c.gif", snapshot.entries().get(0).name());
    }

    @Test
    void scan_emptyFolder_shouldReturnEmptySnapshot() throws Exception {
        FolderSnapshot snapshot = FolderScanner.scan(tempDir);

        assertTrue(snapshot.entries().isEmpty());
        assertEquals(tempDir.toAbsolutePath().normalize(), snapshot.folder());
    }

    @Test
    void scan_missingFolder_shouldThrow() {
        assertThrows(java.io.IOException.class, () -> FolderScanner.scan(tempDir.resolve("gone")));
    }

    @Test
    void isImage_shouldMatchSuffixCaseInsensitively() {
        assertTrue(FolderScanner.isImage(Path.of("x.TIFF")));
        assertTrue(FolderScanner.isImage(Path.of("x.webp")));
        assertFalse(FolderScanner.isImage(Path.of("x.psd")));
        assertFalse(FolderScanner.isImage(Path.of("README")));
    }

    @Test
    void suffixOf_shouldHandleTrailingDot() {
        assertEquals("", FolderScanner.suffixOf("name."));
        assertEquals("jpeg", FolderScanner.suffixOf("a.b.JPEG"));
    }
}
