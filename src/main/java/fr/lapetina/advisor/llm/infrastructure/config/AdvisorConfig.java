package fr.lapetina.advisor.llm.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the advisor LLM runtime.
 * Designed to be populated from YAML.
 */
public class AdvisorConfig {

    private ServerConfig server = new ServerConfig();
    private ModelConfig model = new ModelConfig();
    private StreamingConfig streaming = new StreamingConfig();
    private DownloadConfig download = new DownloadConfig();
    private EventsConfig events = new EventsConfig();
    private MetricsConfig metrics = new MetricsConfig();
    private List<CatalogEntryConfig> catalog = new ArrayList<>();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public ModelConfig getModel() { return model; }
    public void setModel(ModelConfig model) { this.model = model; }

    public StreamingConfig getStreaming() { return streaming; }
    public void setStreaming(StreamingConfig streaming) { this.streaming = streaming; }

    public DownloadConfig getDownload() { return download; }
    public void setDownload(DownloadConfig download) { this.download = download; }

    public EventsConfig getEvents() { return events; }
    public void setEvents(EventsConfig events) { this.events = events; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    public List<CatalogEntryConfig> getCatalog() { return catalog; }
    public void setCatalog(List<CatalogEntryConfig> catalog) { this.catalog = catalog; }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8090;
        private String host = "127.0.0.1";
        private int backlog = 50;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }
    }

    /**
     * Model placement, persistence and decoding defaults.
     */
    public static class ModelConfig {
        private String cacheDir = "models";
        private String persistFile = "data/llm_config.json";
        private String defaultModel;
        private String device = "cpu";
        private boolean autoResume = true;
        private int maxNewTokens = 1024;
        private double defaultTemperature = 0.3;

        public String getCacheDir() { return cacheDir; }
        public void setCacheDir(String cacheDir) { this.cacheDir = cacheDir; }

        public String getPersistFile() { return persistFile; }
        public void setPersistFile(String persistFile) { this.persistFile = persistFile; }

        public String getDefaultModel() { return defaultModel; }
        public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }

        public String getDevice() { return device; }
        public void setDevice(String device) { this.device = device; }

        public boolean isAutoResume() { return autoResume; }
        public void setAutoResume(boolean autoResume) { this.autoResume = autoResume; }

        public int getMaxNewTokens() { return maxNewTokens; }
        public void setMaxNewTokens(int maxNewTokens) { this.maxNewTokens = maxNewTokens; }

        public double getDefaultTemperature() { return defaultTemperature; }
        public void setDefaultTemperature(double defaultTemperature) { this.defaultTemperature = defaultTemperature; }
    }

    /**
     * Streaming generation configuration.
     */
    public static class StreamingConfig {
        private long abandonTimeoutMs = 120000;
        private int channelCapacity = 256;

        public long getAbandonTimeoutMs() { return abandonTimeoutMs; }
        public void setAbandonTimeoutMs(long abandonTimeoutMs) { this.abandonTimeoutMs = abandonTimeoutMs; }

        public int getChannelCapacity() { return channelCapacity; }
        public void setChannelCapacity(int channelCapacity) { this.channelCapacity = channelCapacity; }
    }

    /**
     * Artifact download configuration.
     */
    public static class DownloadConfig {
        private boolean enabled = false;
        private String baseUrl = "https://huggingface.co";
        private long connectTimeoutMs = 10000;
        private long requestTimeoutMs = 600000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
    }

    /**
     * Lifecycle event bus configuration (LMAX Disruptor).
     */
    public static class EventsConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private int journalSize = 200;

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }

        public int getJournalSize() { return journalSize; }
        public void setJournalSize(int journalSize) { this.journalSize = journalSize; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "advisor_llm";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }

    /**
     * One selectable model: display name, hub id and published weight size.
     */
    public static class CatalogEntryConfig {
        private String name;
        private String id;
        private long officialWeightBytes;

        public CatalogEntryConfig() {
        }

        public CatalogEntryConfig(String name, String id, long officialWeightBytes) {
            this.name = name;
            this.id = id;
            this.officialWeightBytes = officialWeightBytes;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public long getOfficialWeightBytes() { return officialWeightBytes; }
        public void setOfficialWeightBytes(long officialWeightBytes) { this.officialWeightBytes = officialWeightBytes; }
    }
}
