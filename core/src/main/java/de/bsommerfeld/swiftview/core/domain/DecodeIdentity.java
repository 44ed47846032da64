package de.bsommerfeld.swiftview.core.domain;

/**
 * The unit of supersession: only one in-flight job per path and mode is
 * meaningful, regardless of the exact target size.
 */
public record DecodeIdentity(String path, DecodeMode mode) {
}
