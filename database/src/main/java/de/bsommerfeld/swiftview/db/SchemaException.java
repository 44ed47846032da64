package de.bsommerfeld.swiftview.db;

/**
 * A migration step failed, or the store was written by a newer engine. Fatal
 * for opening the store. The failed step was rolled back, so the file is left
 * at the last successfully applied version.
 */
public class SchemaException extends StoreException {

    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
