package de.bsommerfeld.swiftview.db;

/**
 * The store stayed locked through every retry of one operation. Only that
 * operation failed; the operator keeps serving later ones.
 */
public class StoreBusyException extends StoreException {

    private final int attempts;

    public StoreBusyException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
