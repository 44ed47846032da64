package de.bsommerfeld.swiftview.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PathKeysTest {

    @TempDir
    Path tempDir;

    @Test
    void normalize_shouldUseForwardSlashes() {
        assertEquals("C:/images/a.png", PathKeys.normalize("C:\\images\\a.png"));
    }

    @Test
    void normalize_shouldUppercaseDriveLetter() {
        assertEquals("D:/x/y.jpg", PathKeys.normalize("d:/x/y.jpg"));
    }

    @Test
    void normalize_shouldLeaveUnixPathsUntouched() {
        assertEquals("/home/user/a.png", PathKeys.normalize("/home/user/a.png"));
    }

    @Test
    void dbKey_shouldBeAbsoluteAndNormalized() {
        Path messy = tempDir.resolve("sub").resolve("..").resolve("a.png");
        String key = PathKeys.dbKey(messy);

        assertEquals(PathKeys.dbKey(tempDir.resolve("a.png")), key);
        assertFalse(key.contains("\\"));
        assertFalse(key.contains(".."));
    }

    @Test
    void toPath_shouldRoundTripDbKey() {
        Path file = tempDir.resolve("b.jpg");
        assertEquals(file.toAbsolutePath().normalize(), PathKeys.toPath(PathKeys.dbKey(file)).toAbsolutePath());
    }
}
