package de.bsommerfeld.swiftview.core.domain;

/**
 * What a decode request produces. A {@code FULL} result never satisfies a
 * {@code THUMBNAIL} lookup and vice versa.
 */
public enum DecodeMode {

    /** Down-sampled image, delivered as lossless encoded bytes (PNG). */
    THUMBNAIL,

    /** Displayable pixels, full resolution unless a target box is given. */
    FULL
}
