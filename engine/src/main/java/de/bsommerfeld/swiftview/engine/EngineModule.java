package de.bsommerfeld.swiftview.engine;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.swiftview.core.config.EngineConfig;
import de.bsommerfeld.swiftview.core.config.EngineConfigLoader;
import de.bsommerfeld.swiftview.core.domain.PixelBuffer;
import de.bsommerfeld.swiftview.core.event.ApplicationEventBus;
import de.bsommerfeld.swiftview.core.util.StorageUtils;
import de.bsommerfeld.swiftview.decoder.Decoder;
import de.bsommerfeld.swiftview.decoder.ImageIoDecoder;
import de.bsommerfeld.swiftview.decoder.pool.DecodePool;
import de.bsommerfeld.swiftview.decoder.pool.InProcessDecodePool;
import de.bsommerfeld.swiftview.decoder.pool.ProcessDecodePool;
import de.bsommerfeld.swiftview.decoder.pool.WorkerLauncher;
import de.bsommerfeld.swiftview.engine.cache.MemoryCache;
import de.bsommerfeld.swiftview.engine.cache.Thumbnail;
import de.bsommerfeld.swiftview.engine.loader.Loader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guice wiring for the engine. The decode pool is chosen by
 * {@code processIsolation}.
 */
public class EngineModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(EngineModule.class);

    private final EngineConfig config;

    public EngineModule(EngineConfig config) {
        this.config = config;
    }

    /** Loads {@code engine.json} from the app data directory. */
    public static EngineModule fromAppData() {
        return new EngineModule(EngineConfigLoader.load(StorageUtils.getConfigFile(StorageUtils.APP_NAME)));
    }

    @Override
    protected void configure() {
        bind(EngineConfig.class).toInstance(config);
        bind(ApplicationEventBus.class).in(Singleton.class);
        bind(Decoder.class).to(ImageIoDecoder.class).in(Singleton.class);
    }

    @Provides
    @Singleton
    DecodePool decodePool(Decoder decoder) {
        if (config.isProcessIsolation()) {
            LOG.info("Decoding in {} worker processes ({} MB heap each)",
                    config.getDecodeWorkers(), config.getWorkerHeapMb());
            return new ProcessDecodePool(WorkerLauncher.defaults(config.getWorkerHeapMb()), config.getDecodeWorkers());
        }
        LOG.info("Decoding in-process on {} threads", config.getDecodeWorkers());
        return new InProcessDecodePool(decoder, config.getDecodeWorkers());
    }

    @Provides
    @Singleton
    Loader loader(DecodePool pool) {
        return new Loader(pool, config.getIoThreads());
    }

    @Provides
    @Singleton
    MemoryCache<PixelBuffer> viewCache() {
        return new MemoryCache<>("view");
    }

    @Provides
    @Singleton
    MemoryCache<Thumbnail> thumbnailCache() {
        return new MemoryCache<>("thumbnail");
    }
}
