package de.bsommerfeld.swiftview.core.domain;

/**
 * One regular file of a scanned folder.
 *
 * @param path    absolute path as found on disk
 * @param name    file name
 * @param suffix  lower-case extension without the dot, empty if none
 * @param size    bytes
 * @param mtimeMs epoch milliseconds
 * @param image   whether the extension is a supported image type
 */
public record FileEntry(String path, String name, String suffix, long size, long mtimeMs, boolean image) {
}
