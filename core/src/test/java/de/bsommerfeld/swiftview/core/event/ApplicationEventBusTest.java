package de.bsommerfeld.swiftview.core.event;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.swiftview.core.event.EngineEvents.EngineErrorEvent;
import de.bsommerfeld.swiftview.core.event.EngineEvents.ThumbnailRowsLoadedEvent;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ApplicationEventBusTest {

    @Test
    void post_shouldDeliverEventToRegisteredListener() {
        var eventBus = new ApplicationEventBus();
        var received = new AtomicReference<EngineErrorEvent>();

        Object listener = new Object() {
            @Subscribe
            public void onError(EngineErrorEvent event) {
                received.set(event);
            }
        };

        eventBus.register(listener);
        eventBus.post(new EngineErrorEvent("scan", "boom"));

        assertEquals("boom", received.get().message());
    }

    @Test
    void unregister_shouldStopDeliveringEvents() {
        var eventBus = new ApplicationEventBus();
        var received = new AtomicReference<String>();

        Object listener = new Object() {
            @Subscribe
            public void onEvent(String event) {
                received.set(event);
            }
        };

        eventBus.register(listener);
        eventBus.post("first");
        assertEquals("first", received.get());

        eventBus.unregister(listener);
        eventBus.post("second");
        assertEquals("first", received.get());
    }

    @Test
    void post_shouldDeliverRowBatchesWithoutLoggingThem() {
        var eventBus = new ApplicationEventBus();
        var received = new AtomicReference<ThumbnailRowsLoadedEvent>();

        Object listener = new Object() {
            @Subscribe
            public void onRows(ThumbnailRowsLoadedEvent event) {
                received.set(event);
            }
        };
        eventBus.register(listener);

        eventBus.post(new ThumbnailRowsLoadedEvent("/p", List.of()));
        assertNotNull(received.get());
        assertTrue(received.get().rows().isEmpty());
    }

    @Test
    void post_shouldNotThrowForUnhandledEvents() {
        var eventBus = new ApplicationEventBus();
        assertDoesNotThrow(() -> eventBus.post("nobody-listens"));
    }
}
