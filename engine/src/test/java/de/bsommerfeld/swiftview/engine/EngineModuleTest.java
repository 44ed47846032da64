package de.bsommerfeld.swiftview.engine;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.TypeLiteral;
import de.bsommerfeld.swiftview.core.config.EngineConfig;
import de.bsommerfeld.swiftview.core.domain.PixelBuffer;
import de.bsommerfeld.swiftview.core.event.ApplicationEventBus;
import de.bsommerfeld.swiftview.decoder.Decoder;
import de.bsommerfeld.swiftview.decoder.ImageIoDecoder;
import de.bsommerfeld.swiftview.decoder.pool.DecodePool;
import de.bsommerfeld.swiftview.decoder.pool.InProcessDecodePool;
import de.bsommerfeld.swiftview.decoder.pool.ProcessDecodePool;
import de.bsommerfeld.swiftview.engine.cache.MemoryCache;
import de.bsommerfeld.swiftview.engine.cache.Thumbnail;
import de.bsommerfeld.swiftview.engine.loader.Loader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EngineModuleTest {

    @TempDir
    Path tempDir;

    private ImageEngine engine;

    @AfterEach
    void tearDown() {
        if (engine != null)
            engine.close();
    }

    private static EngineConfig config(boolean processIsolation) {
        EngineConfig config = new EngineConfig();
        config.setProcessIsolation(processIsolation);
        config.setDecodeWorkers(1);
        return config;
    }

    @Test
    void injector_shouldWireSingletonEngine() throws Exception {
        Injector injector = Guice.createInjector(new EngineModule(config(false)));

        engine = injector.getInstance(ImageEngine.class);

        assertSame(engine, injector.getInstance(ImageEngine.class));
        assertSame(injector.getInstance(ApplicationEventBus.class), injector.getInstance(ApplicationEventBus.class));
        assertSame(injector.getInstance(Loader.class), injector.getInstance(Loader.class));
        assertInstanceOf(ImageIoDecoder.class, injector.getInstance(Decoder.class));

        Path image = TestImages.writePng(tempDir.resolve("a.png"), 40, 30, Color.ORANGE);
        assertEquals(40, engine.requestView(image).get(10, TimeUnit.SECONDS).width());
    }

    @Test
    void injector_shouldProvideSeparateCaches() {
        Injector injector = Guice.createInjector(new EngineModule(config(false)));

        MemoryCache<PixelBuffer> views = injector.getInstance(Key.get(new TypeLiteral<MemoryCache<PixelBuffer>>() {
        }));
        MemoryCache<Thumbnail> thumbnails = injector.getInstance(Key.get(new TypeLiteral<MemoryCache<Thumbnail>>() {
        }));

        assertEquals("view", views.name());
        assertEquals("thumbnail", thumbnails.name());
    }

    @Test
    void decodePool_shouldFollowProcessIsolationSwitch() {
        try (DecodePool inProcess = Guice.createInjector(new EngineModule(config(false)))
                .getInstance(DecodePool.class)) {
            assertInstanceOf(InProcessDecodePool.class, inProcess);
        }
        // Workers start lazily, so no child JVM is spawned here
        try (DecodePool isolated = Guice.createInjector(new EngineModule(config(true)))
                .getInstance(DecodePool.class)) {
            assertInstanceOf(ProcessDecodePool.class, isolated);
        }
    }
}
