package fr.lapetina.advisor.llm.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.advisor.llm.api.dto.GenerateRequestDto;
import fr.lapetina.advisor.llm.api.dto.LoadRequestDto;
import fr.lapetina.advisor.llm.api.dto.StatusResponse;
import fr.lapetina.advisor.llm.catalog.ModelCatalog;
import fr.lapetina.advisor.llm.catalog.NarrationPrompts;
import fr.lapetina.advisor.llm.disruptor.LifecycleEventBus;
import fr.lapetina.advisor.llm.domain.model.GenerationRequest;
import fr.lapetina.advisor.llm.domain.model.ModelId;
import fr.lapetina.advisor.llm.domain.model.StatusSnapshot;
import fr.lapetina.advisor.llm.engine.ProgressListener;
import fr.lapetina.advisor.llm.engine.StreamOutcome;
import fr.lapetina.advisor.llm.engine.TokenStream;
import fr.lapetina.advisor.llm.infrastructure.config.AdvisorConfig;
import fr.lapetina.advisor.llm.infrastructure.config.ConfigLoader;
import fr.lapetina.advisor.llm.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.advisor.llm.lifecycle.BackgroundLoader;
import fr.lapetina.advisor.llm.lifecycle.ModelLifecycleManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - GET /status - Lifecycle status snapshot
 * - GET /models - Catalog with measured cache size and official weights size
 * - POST /models/load - Start a background load (202, 409 when busy, 400 for unknown models)
 * - POST /models/unload - Release the current model
 * - POST /generate - Blocking generation
 * - POST /generate/stream - Streaming generation, one NDJSON object per snapshot
 * - POST /narrate/stock - Stock analysis narration
 * - POST /narrate/portfolio - Portfolio summary narration
 * - GET /events - Recent lifecycle events
 * - GET /health - Health check endpoint
 * - GET /metrics - Prometheus metrics endpoint
 * - POST /admin/reload - Reload configuration
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private static final String NDJSON = "application/x-ndjson";
    private static final int DEFAULT_EVENT_LIMIT = 50;

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final ModelLifecycleManager manager;
    private final BackgroundLoader backgroundLoader;
    private final ModelCatalog catalog;
    private final LifecycleEventBus eventBus;
    private final MetricsRegistry metricsRegistry;
    private final ConfigLoader configLoader;

    public HttpServer(
            String host,
            int port,
            int backlog,
            ModelLifecycleManager manager,
            BackgroundLoader backgroundLoader,
            ModelCatalog catalog,
            LifecycleEventBus eventBus,
            MetricsRegistry metricsRegistry,
            ConfigLoader configLoader
    ) throws IOException {
        this.manager = Objects.requireNonNull(manager, "Lifecycle manager is required");
        this.backgroundLoader = Objects.requireNonNull(backgroundLoader, "Background loader is required");
        this.catalog = Objects.requireNonNull(catalog, "Model catalog is required");
        this.eventBus = eventBus;
        this.metricsRegistry = metricsRegistry;
        this.configLoader = configLoader;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(host, port), backlog
        );

        AtomicInteger workerIds = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "http-worker-" + workerIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/status", new StatusHandler());
        server.createContext("/models", new ModelsHandler());
        server.createContext("/generate", new GenerateHandler());
        server.createContext("/narrate", new NarrateHandler());
        server.createContext("/events", new EventsHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/admin", new AdminHandler());

        log.info("HTTP server configured: host={}, port={}", host, port);
    }

    public void start() {
        server.start();
        log.info("HTTP server started: port={}", getPort());
    }

    /**
     * Bound port; differs from the configured one when 0 was requested.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdownNow();
        log.info("HTTP server stopped");
    }

    private double defaultTemperature() {
        AdvisorConfig config = configLoader != null ? configLoader.getCurrentConfig() : null;
        return config != null ? config.getModel().getDefaultTemperature() : GenerationRequest.DEFAULT_TEMPERATURE;
    }

    private String newRequestId(HttpExchange exchange) {
        String header = exchange.getRequestHeaders().getFirst("X-Request-ID");
        return header != null && !header.isBlank() ? header : UUID.randomUUID().toString();
    }

    // ==================== STATUS HANDLER ====================

    private class StatusHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            sendJson(exchange, 200, StatusResponse.from(manager.status()));
        }
    }

    // ==================== MODELS HANDLER ====================

    private class ModelsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            try {
                if (path.equals("/models") && "GET".equals(method)) {
                    handleList(exchange);
                } else if (path.equals("/models/load") && "POST".equals(method)) {
                    handleLoad(exchange);
                } else if (path.equals("/models/unload") && "POST".equals(method)) {
                    handleUnload(exchange);
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (JsonProcessingException e) {
                sendError(exchange, 400, "Malformed JSON: " + e.getOriginalMessage());
            }
        }

        private void handleList(HttpExchange exchange) throws IOException {
            StatusSnapshot status = manager.status();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("current", status.currentModel() != null ? status.currentModel().value() : null);
            body.put("phase", status.state().phase().name());
            body.put("models", catalog.sizes());
            sendJson(exchange, 200, body);
        }

        private void handleLoad(HttpExchange exchange) throws IOException {
            LoadRequestDto request;
            try (InputStream is = exchange.getRequestBody()) {
                request = objectMapper.readValue(is, LoadRequestDto.class);
            }
            Optional<ModelId> modelId = catalog.resolve(request.getModel());
            if (modelId.isEmpty()) {
                sendError(exchange, 400, "Unknown model: " + request.getModel());
                return;
            }

            Optional<CompletableFuture<Boolean>> submitted =
                    backgroundLoader.submit(modelId.get(), ProgressListener.NONE);
            if (submitted.isEmpty()) {
                sendError(exchange, 409, "A model load is already in progress");
                return;
            }
            sendJson(exchange, 202, Map.of(
                    "status", "started",
                    "model", modelId.get().value()
            ));
        }

        private void handleUnload(HttpExchange exchange) throws IOException {
            manager.unload();
            sendJson(exchange, 200, Map.of("status", "unloaded"));
        }
    }

    // ==================== GENERATE HANDLER ====================

    private class GenerateHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String requestId = newRequestId(exchange);
            MDC.put("requestId", requestId);

            try {
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }

                GenerationRequest request;
                try (InputStream is = exchange.getRequestBody()) {
                    GenerateRequestDto dto = objectMapper.readValue(is, GenerateRequestDto.class);
                    request = dto.toGenerationRequest(requestId, defaultTemperature());
                } catch (JsonProcessingException e) {
                    sendError(exchange, 400, "Malformed JSON: " + e.getOriginalMessage());
                    return;
                } catch (IllegalArgumentException e) {
                    sendError(exchange, 400, e.getMessage());
                    return;
                }

                if (!manager.isReady()) {
                    sendError(exchange, 503, "No model is loaded");
                    return;
                }

                String path = exchange.getRequestURI().getPath();
                if (path.equals("/generate/stream")) {
                    handleStream(exchange, request);
                } else if (path.equals("/generate")) {
                    sendJson(exchange, 200, Map.of(
                            "request_id", request.requestId(),
                            "response", manager.generate(request)
                    ));
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } finally {
                MDC.remove("requestId");
            }
        }

        private void handleStream(HttpExchange exchange, GenerationRequest request) throws IOException {
            exchange.getResponseHeaders().set("Content-Type", NDJSON);
            exchange.sendResponseHeaders(200, 0);
            try (TokenStream stream = manager.streamGenerate(request);
                 OutputStream os = exchange.getResponseBody()) {
                String text = "";
                while (stream.hasNext()) {
                    text = stream.next();
                    writeLine(os, Map.of("text", text));
                }
                writeLine(os, streamEndLine(text, stream.outcome().orElse(StreamOutcome.CLOSED)));
            } catch (IOException e) {
                // closing the stream above released the model for other callers
                log.info("Streaming client disconnected: requestId={}, error={}", request.requestId(), e.getMessage());
            }
        }

        private void writeLine(OutputStream os, Object body) throws IOException {
            os.write(objectMapper.writeValueAsBytes(body));
            os.write('\n');
            os.flush();
        }
    }

    /**
     * Last NDJSON line of a stream. {@code done} is only true when the model
     * finished the answer.
     */
    static Map<String, Object> streamEndLine(String text, StreamOutcome outcome) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("text", text);
        line.put("done", outcome == StreamOutcome.COMPLETED);
        line.put("outcome", outcome.name().toLowerCase(Locale.ROOT));
        if (outcome == StreamOutcome.ABANDONED) {
            line.put("abandoned", true);
        }
        return line;
    }

    // ==================== NARRATE HANDLER ====================

    private class NarrateHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String requestId = newRequestId(exchange);
            MDC.put("requestId", requestId);

            try {
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }

                NarrationPrompts prompts = new NarrationPrompts(defaultTemperature());
                Function<Map<String, Object>, GenerationRequest> builder = switch (exchange.getRequestURI().getPath()) {
                    case "/narrate/stock" -> prompts::analyzeStock;
                    case "/narrate/portfolio" -> prompts::summarizePortfolio;
                    default -> null;
                };
                if (builder == null) {
                    sendError(exchange, 404, "Not Found");
                    return;
                }

                Map<String, Object> data;
                try (InputStream is = exchange.getRequestBody()) {
                    data = objectMapper.readValue(is, new TypeReference<Map<String, Object>>() { });
                } catch (JsonProcessingException e) {
                    sendError(exchange, 400, "Malformed JSON: " + e.getOriginalMessage());
                    return;
                }
                if (!manager.isReady()) {
                    sendError(exchange, 503, "No model is loaded");
                    return;
                }

                sendJson(exchange, 200, Map.of("response", manager.generate(builder.apply(data))));
            } finally {
                MDC.remove("requestId");
            }
        }
    }

    // ==================== EVENTS HANDLER ====================

    private class EventsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            if (eventBus == null) {
                sendJson(exchange, 200, List.of());
                return;
            }
            int limit = DEFAULT_EVENT_LIMIT;
            String query = exchange.getRequestURI().getQuery();
            if (query != null && query.startsWith("limit=")) {
                try {
                    limit = Integer.parseInt(query.substring("limit=".length()));
                } catch (NumberFormatException e) {
                    sendError(exchange, 400, "Invalid limit: " + query);
                    return;
                }
            }
            sendJson(exchange, 200, eventBus.recentEvents(limit));
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            StatusSnapshot status = manager.status();
            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", "UP");
            health.put("timestamp", System.currentTimeMillis());
            health.put("model", status.state().toString());
            health.put("available", status.available());
            health.put("loading", status.loading());
            if (eventBus != null) {
                health.put("eventRingBufferRemaining", eventBus.getRemainingCapacity());
            }
            sendJson(exchange, 200, health);
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            if (metricsRegistry == null) {
                sendError(exchange, 404, "Metrics are disabled");
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== ADMIN HANDLER ====================

    private class AdminHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            if (!path.equals("/admin/reload") || !"POST".equals(exchange.getRequestMethod())) {
                sendError(exchange, 404, "Not Found");
                return;
            }
            if (configLoader == null) {
                sendError(exchange, 409, "Configuration was not loaded from a file");
                return;
            }
            AdvisorConfig newConfig = configLoader.reload();
            sendJson(exchange, 200, Map.of(
                    "message", "Configuration reloaded",
                    "models", newConfig.getCatalog().size()
            ));
        }
    }

    // ==================== HELPER METHODS ====================

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        sendJson(exchange, statusCode, Map.of("error", message));
    }
}
