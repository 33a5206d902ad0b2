package fr.lapetina.advisor.llm;

import fr.lapetina.advisor.llm.api.HttpServer;
import fr.lapetina.advisor.llm.infrastructure.config.AdvisorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the advisor LLM runtime.
 */
public class AdvisorLlmApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AdvisorLlmApplication.class);

    private final RuntimeFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public AdvisorLlmApplication(String configPath) throws Exception {
        log.info("Starting advisor LLM runtime...");

        this.factory = RuntimeFactory.create(configPath).start();

        AdvisorConfig.ServerConfig server = factory.getConfig().getServer();
        this.httpServer = new HttpServer(
                server.getHost(),
                server.getPort(),
                server.getBacklog(),
                factory.getManager(),
                factory.getBackgroundLoader(),
                factory.getCatalog(),
                factory.getEventBus(),
                factory.getMetricsRegistry(),
                factory.getConfigLoader()
        );

        log.info("Advisor LLM runtime initialized");
    }

    public void start() {
        httpServer.start();
        log.info("Advisor LLM runtime started: port={}", httpServer.getPort());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public RuntimeFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        log.info("Shutting down advisor LLM runtime...");

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Advisor LLM runtime shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            AdvisorLlmApplication app = new AdvisorLlmApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start advisor LLM runtime", e);
            System.exit(1);
        }
    }
}
