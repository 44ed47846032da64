package de.bsommerfeld.swiftview.core.domain;

import java.util.Objects;

/**
 * Typed decode failure. Travels as plain data across the worker process
 * boundary and is delivered to the one request that caused it.
 */
public record DecodeError(Kind kind, String message) {

    public enum Kind {
        /** Missing, unreadable or not a regular file. */
        UNREADABLE,
        /** No registered reader understands the format. */
        UNSUPPORTED_FORMAT,
        /** A reader accepted the file but failed to decode it. */
        CORRUPT,
        /** The isolated worker died while handling the request. */
        WORKER_CRASHED,
        /** Anything else, including failures of the dispatch machinery. */
        INTERNAL
    }

    public DecodeError {
        Objects.requireNonNull(kind, "kind");
        message = message == null ? kind.name() : message;
    }

    public static DecodeError of(Kind kind, String message) {
        return new DecodeError(kind, message);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
