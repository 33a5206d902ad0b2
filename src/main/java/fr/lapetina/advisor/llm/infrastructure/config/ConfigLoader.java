package fr.lapetina.advisor.llm.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * YAML configuration loader with hot-reload support.
 *
 * The file system is tried first, then the classpath. A reload that fails
 * to parse or validate keeps the current configuration.
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final AtomicReference<AdvisorConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(AdvisorConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath and notifies listeners.
     *
     * @throws ConfigurationException if the file is missing, malformed or invalid
     */
    public AdvisorConfig load() {
        AdvisorConfig config = validate(loadFromPath());
        AdvisorConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    private AdvisorConfig loadFromPath() {
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        String classpathResource = configPath.toString().replace('\\', '/');
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: resource={}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private AdvisorConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: path={}", path);
        try (InputStream is = Files.newInputStream(path)) {
            lastModified = Files.getLastModifiedTime(path).toMillis();
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream and notifies listeners.
     */
    public AdvisorConfig loadFromStream(InputStream inputStream) {
        AdvisorConfig config = validate(parse(inputStream, "stream"));
        AdvisorConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    private AdvisorConfig parse(InputStream inputStream, String source) {
        try {
            AdvisorConfig config = yaml.load(inputStream);
            // an empty document yields null
            return config != null ? config : new AdvisorConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    static AdvisorConfig validate(AdvisorConfig config) {
        if (config.getServer() == null) {
            config.setServer(new AdvisorConfig.ServerConfig());
        }
        if (config.getModel() == null) {
            config.setModel(new AdvisorConfig.ModelConfig());
        }
        if (config.getStreaming() == null) {
            config.setStreaming(new AdvisorConfig.StreamingConfig());
        }
        if (config.getDownload() == null) {
            config.setDownload(new AdvisorConfig.DownloadConfig());
        }
        if (config.getEvents() == null) {
            config.setEvents(new AdvisorConfig.EventsConfig());
        }
        if (config.getMetrics() == null) {
            config.setMetrics(new AdvisorConfig.MetricsConfig());
        }
        if (config.getCatalog() == null) {
            config.setCatalog(List.of());
        }

        AdvisorConfig.ModelConfig model = config.getModel();
        if (model.getMaxNewTokens() <= 0) {
            throw new ConfigurationException("model.maxNewTokens must be > 0: " + model.getMaxNewTokens());
        }
        if (model.getDefaultTemperature() < 0) {
            throw new ConfigurationException("model.defaultTemperature must be >= 0: " + model.getDefaultTemperature());
        }
        if (config.getStreaming().getAbandonTimeoutMs() <= 0) {
            throw new ConfigurationException("streaming.abandonTimeoutMs must be > 0");
        }
        if (config.getStreaming().getChannelCapacity() <= 0) {
            throw new ConfigurationException("streaming.channelCapacity must be > 0");
        }
        int ringBufferSize = config.getEvents().getRingBufferSize();
        if (ringBufferSize <= 0 || Integer.bitCount(ringBufferSize) != 1) {
            throw new ConfigurationException("events.ringBufferSize must be a power of 2: " + ringBufferSize);
        }
        for (AdvisorConfig.CatalogEntryConfig entry : config.getCatalog()) {
            if (entry.getName() == null || entry.getName().isBlank()
                    || entry.getId() == null || entry.getId().isBlank()) {
                throw new ConfigurationException("Catalog entries need a name and an id");
            }
        }
        return config;
    }

    /**
     * Returns the current configuration.
     */
    public AdvisorConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Starts watching the configuration file for changes.
     */
    public void startWatching() {
        if (!Files.exists(configPath)) {
            log.warn("Config file does not exist, hot reload disabled: path={}", configPath);
            return;
        }

        try {
            watchService = FileSystems.getDefault().newWatchService();
            Path parent = configPath.toAbsolutePath().getParent();
            parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY, StandardWatchEventKinds.ENTRY_CREATE);

            watchExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "config-watcher");
                t.setDaemon(true);
                return t;
            });

            watchExecutor.scheduleWithFixedDelay(this::checkForChanges, 1, 1, TimeUnit.SECONDS);

            log.info("Configuration hot-reload enabled: path={}", configPath);

        } catch (IOException e) {
            log.error("Failed to start config watcher: path={}", configPath, e);
        }
    }

    private void checkForChanges() {
        try {
            WatchKey key = watchService.poll();
            if (key == null) {
                return;
            }

            for (WatchEvent<?> event : key.pollEvents()) {
                Path changed = (Path) event.context();
                if (changed != null && changed.equals(configPath.getFileName())) {
                    // editors fire several events per save
                    long newLastModified = Files.getLastModifiedTime(configPath).toMillis();
                    if (newLastModified > lastModified) {
                        log.info("Configuration file changed, reloading: path={}", configPath);
                        reload();
                    }
                }
            }

            key.reset();
        } catch (Exception e) {
            log.error("Error checking for config changes: path={}", configPath, e);
        }
    }

    /**
     * Forces a configuration reload, keeping the current one on failure.
     */
    public AdvisorConfig reload() {
        try {
            return load();
        } catch (ConfigurationException e) {
            log.error("Failed to reload configuration, keeping current: error={}", e.getMessage(), e);
            return currentConfig.get();
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(AdvisorConfig oldConfig, AdvisorConfig newConfig) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (Exception e) {
                log.error("Error notifying config change listener", e);
            }
        }
    }

    @Override
    public void close() {
        if (watchExecutor != null) {
            watchExecutor.shutdown();
            try {
                watchExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Error closing watch service", e);
            }
        }
    }

    /**
     * Creates a default configuration.
     */
    public static AdvisorConfig createDefault() {
        return validate(new AdvisorConfig());
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
