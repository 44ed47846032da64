package de.bsommerfeld.swiftview.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Canonical key format for everything that is cached or persisted: absolute,
 * normalized, forward slashes, upper-case drive letter. The same file must
 * map to the same key no matter how the UI spelled its path.
 */
public final class PathKeys {

    private PathKeys() {
    }

    public static String dbKey(Path path) {
        return normalize(path.toAbsolutePath().normalize().toString());
    }

    /**
     * Normalizes an already absolute path string. Separators and drive letter
     * casing are the only things touched.
     */
    public static String normalize(String path) {
        String p = path.replace('\\', '/');
        if (p.length() >= 2 && p.charAt(1) == ':' && Character.isLetter(p.charAt(0))) {
            p = Character.toUpperCase(p.charAt(0)) + p.substring(1);
        }
        return p;
    }

    /** Turns a store key back into a path on the local file system. */
    public static Path toPath(String key) {
        return Paths.get(key);
    }
}
