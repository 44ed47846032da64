package de.bsommerfeld.swiftview.db;

/**
 * Failure of a persistent-store operation, delivered to the caller that
 * issued it.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
