package de.bsommerfeld.swiftview.engine.loader;

import de.bsommerfeld.swiftview.core.domain.DecodeError;
import de.bsommerfeld.swiftview.decoder.pool.DecodeResult;

/**
 * Terminal outcome of one {@link DecodeHandle}. Every handle receives
 * exactly one.
 */
public sealed interface DecodeOutcome permits DecodeOutcome.Decoded, DecodeOutcome.Failed, DecodeOutcome.Dropped {

    /** The decode succeeded and this request was still the current one. */
    record Decoded(DecodeResult result) implements DecodeOutcome {
        public Decoded {
            if (!result.isSuccess())
                throw new IllegalArgumentException("Decoded outcome needs a successful result");
        }
    }

    /** The decode failed and this request was still the current one. */
    record Failed(DecodeError error) implements DecodeOutcome {
    }

    /** The request will never deliver a result. */
    record Dropped(Reason reason) implements DecodeOutcome {
    }

    enum Reason {
        /** A newer request for the same path and mode was admitted. */
        SUPERSEDED,
        CANCELLED,
        /** The path is on the loader's ignore list. */
        IGNORED,
        SHUTDOWN
    }
}
