package de.bsommerfeld.swiftview.decoder;

import de.bsommerfeld.swiftview.core.domain.DecodeError;

/**
 * Checked failure of a single decode. Carries the typed {@link DecodeError}
 * that is handed to the requesting caller.
 */
public class DecodeException extends Exception {

    private final DecodeError error;

    public DecodeException(DecodeError error) {
        super(error.message());
        this.error = error;
    }

    public DecodeException(DecodeError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public DecodeException(DecodeError.Kind kind, String message, Throwable cause) {
        this(DecodeError.of(kind, message), cause);
    }

    public DecodeError getError() {
        return error;
    }
}
