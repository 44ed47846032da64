package de.bsommerfeld.swiftview.engine;

import de.bsommerfeld.swiftview.engine.loader.DecodeOutcome;

import java.util.concurrent.CancellationException;

/**
 * Completes an engine future whose request will never produce a result,
 * because it was superseded, cancelled, ignored or the engine shut down.
 */
public class RequestDroppedException extends CancellationException {

    private final DecodeOutcome.Reason reason;

    public RequestDroppedException(String path, DecodeOutcome.Reason reason) {
        super("Request for " + path + " dropped: " + reason);
        this.reason = reason;
    }

    public DecodeOutcome.Reason getReason() {
        return reason;
    }
}
