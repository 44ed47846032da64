package de.bsommerfeld.swiftview.core.event;

import de.bsommerfeld.swiftview.core.domain.CacheRow;
import de.bsommerfeld.swiftview.core.domain.DecodeError;
import de.bsommerfeld.swiftview.core.domain.DecodeMode;
import de.bsommerfeld.swiftview.core.domain.FolderSnapshot;

import java.util.List;

/**
 * Events the engine publishes on the {@link ApplicationEventBus}. Payloads are
 * plain data; nothing here holds a live engine handle.
 */
public class EngineEvents {

    /** A folder was listed. Fired before any store access. */
    public record FolderScannedEvent(FolderSnapshot snapshot) {
    }

    /** Valid, populated rows found by the bulk scan of an opened folder. */
    public record ThumbnailRowsLoadedEvent(String folder, List<CacheRow> rows) {
        public ThumbnailRowsLoadedEvent {
            rows = List.copyOf(rows);
        }
    }

    /** A thumbnail was generated and handed to the store. */
    public record ThumbnailReadyEvent(String path, byte[] thumbnail, Integer width, Integer height) {
        @Override
        public String toString() {
            return "ThumbnailReadyEvent[path=" + path + ", bytes=" + thumbnail.length + "]";
        }
    }

    /** The current request for a path failed to decode. */
    public record DecodeFailedEvent(String path, DecodeMode mode, DecodeError error) {
    }

    /**
     * Failure that has no single requesting caller, e.g. a background store
     * write or a folder that vanished.
     */
    public record EngineErrorEvent(String context, String message) {
    }
}
