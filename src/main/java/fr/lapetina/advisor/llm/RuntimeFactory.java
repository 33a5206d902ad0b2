package fr.lapetina.advisor.llm;

import fr.lapetina.advisor.llm.catalog.ModelCatalog;
import fr.lapetina.advisor.llm.disruptor.LifecycleEventBus;
import fr.lapetina.advisor.llm.domain.model.ModelId;
import fr.lapetina.advisor.llm.engine.GenerationEngine;
import fr.lapetina.advisor.llm.engine.ModelLoader;
import fr.lapetina.advisor.llm.engine.bigram.BigramModelLoader;
import fr.lapetina.advisor.llm.infrastructure.config.AdvisorConfig;
import fr.lapetina.advisor.llm.infrastructure.config.ConfigLoader;
import fr.lapetina.advisor.llm.infrastructure.device.DeviceMemoryProbe;
import fr.lapetina.advisor.llm.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.advisor.llm.infrastructure.store.HttpArtifactFetcher;
import fr.lapetina.advisor.llm.infrastructure.store.PersistenceRecord;
import fr.lapetina.advisor.llm.infrastructure.store.WeightStore;
import fr.lapetina.advisor.llm.lifecycle.BackgroundLoader;
import fr.lapetina.advisor.llm.lifecycle.ModelLifecycleManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Composition root: builds the lifecycle manager and its collaborators from
 * configuration. There is exactly one manager per factory, passed explicitly
 * to whoever needs it.
 *
 * <p>Usage:
 * <pre>{@code
 * try (RuntimeFactory factory = RuntimeFactory.create("config.yaml").start()) {
 *     ModelLifecycleManager manager = factory.getManager();
 *     // use manager...
 * }
 * }</pre>
 */
public class RuntimeFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RuntimeFactory.class);

    private final ConfigLoader configLoader;
    private final AdvisorConfig config;
    private final MetricsRegistry metricsRegistry;
    private final PersistenceRecord persistenceRecord;
    private final LifecycleEventBus eventBus;
    private final ModelLifecycleManager manager;
    private final BackgroundLoader backgroundLoader;
    private final ModelCatalog catalog;

    /**
     * @param baseDir        directory that relative cache and persistence paths resolve against
     * @param loaderOverride loader to use instead of the bigram loader, may be null
     */
    protected RuntimeFactory(String configPath, Path baseDir, ModelLoader loaderOverride) {
        log.info("Initializing RuntimeFactory from config: path={}", configPath);

        // Load configuration
        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();
        AdvisorConfig.ModelConfig modelConfig = config.getModel();

        // Initialize metrics
        this.metricsRegistry = config.getMetrics().isEnabled()
                ? new MetricsRegistry(config.getMetrics().getPrefix())
                : null;

        // Weight cache, with downloads only when enabled
        HttpArtifactFetcher fetcher = config.getDownload().isEnabled() ? createFetcher() : null;
        WeightStore weightStore = new WeightStore(baseDir.resolve(modelConfig.getCacheDir()), fetcher);
        this.persistenceRecord = new PersistenceRecord(baseDir.resolve(modelConfig.getPersistFile()));

        // Lifecycle events
        this.eventBus = LifecycleEventBus.builder()
                .fromConfig(config)
                .metricsRegistry(metricsRegistry)
                .build();

        // Loader (allow override for testing) and engine
        ModelLoader loader = loaderOverride != null ? loaderOverride : new BigramModelLoader(weightStore);
        GenerationEngine engine = new GenerationEngine(
                modelConfig.getMaxNewTokens(),
                Duration.ofMillis(config.getStreaming().getAbandonTimeoutMs()),
                config.getStreaming().getChannelCapacity()
        );

        this.manager = new ModelLifecycleManager(
                loader,
                engine,
                persistenceRecord,
                DeviceMemoryProbe.forDevice(modelConfig.getDevice()),
                eventBus
        );
        this.backgroundLoader = new BackgroundLoader(manager);

        // Catalog follows configuration reloads
        this.catalog = ModelCatalog.fromConfig(config, weightStore);
        configLoader.addListener(catalog);

        if (metricsRegistry != null) {
            metricsRegistry.registerLifecycleGauges(manager::status);
        }

        log.info("RuntimeFactory initialized: cacheDir={}, device={}, downloads={}",
                weightStore.getCacheDir(), modelConfig.getDevice(), fetcher != null);
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static RuntimeFactory create(String configPath) {
        return new RuntimeFactory(configPath, Paths.get(""), null);
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static RuntimeFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts the event bus and the configuration watcher, then resumes the
     * last model when auto-resume is enabled.
     */
    public RuntimeFactory start() {
        eventBus.start();
        configLoader.startWatching();
        if (config.getModel().isAutoResume()) {
            resume();
        }
        log.info("Runtime started");
        return this;
    }

    /**
     * Submits a background load of the persisted model, or of the configured
     * default model when nothing was persisted.
     */
    public Optional<CompletableFuture<Boolean>> resume() {
        return backgroundLoader.resumeLastModel(defaultModel().orElse(null));
    }

    private Optional<ModelId> defaultModel() {
        String configured = config.getModel().getDefaultModel();
        if (configured == null || configured.isBlank()) {
            return Optional.empty();
        }
        return catalog.resolve(configured).or(() -> Optional.of(ModelId.of(configured.strip())));
    }

    public ModelLifecycleManager getManager() {
        return manager;
    }

    public BackgroundLoader getBackgroundLoader() {
        return backgroundLoader;
    }

    public ModelCatalog getCatalog() {
        return catalog;
    }

    public LifecycleEventBus getEventBus() {
        return eventBus;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public PersistenceRecord getPersistenceRecord() {
        return persistenceRecord;
    }

    public AdvisorConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    private HttpArtifactFetcher createFetcher() {
        AdvisorConfig.DownloadConfig download = config.getDownload();
        return new HttpArtifactFetcher(
                download.getBaseUrl(),
                Duration.ofMillis(download.getConnectTimeoutMs()),
                Duration.ofMillis(download.getRequestTimeoutMs())
        );
    }

    @Override
    public void close() {
        log.info("Shutting down RuntimeFactory...");

        try {
            backgroundLoader.close();
        } catch (Exception e) {
            log.warn("Error closing background loader", e);
        }

        try {
            manager.close();
        } catch (Exception e) {
            log.warn("Error closing lifecycle manager", e);
        }

        try {
            eventBus.close();
        } catch (Exception e) {
            log.warn("Error closing event bus", e);
        }

        if (metricsRegistry != null) {
            try {
                metricsRegistry.close();
            } catch (Exception e) {
                log.warn("Error closing metrics registry", e);
            }
        }

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        log.info("RuntimeFactory shut down");
    }
}
