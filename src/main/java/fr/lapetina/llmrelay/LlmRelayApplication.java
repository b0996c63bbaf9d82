package fr.lapetina.llmrelay;

import fr.lapetina.llmrelay.api.HttpServer;
import fr.lapetina.llmrelay.infrastructure.config.RelayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the LLM relay.
 */
public class LlmRelayApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LlmRelayApplication.class);

    private final RelayFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public LlmRelayApplication(String configPath) throws Exception {
        this(RelayFactory.create(configPath));
    }

    LlmRelayApplication(RelayFactory factory) throws Exception {
        log.info("Starting LLM relay...");
        this.factory = factory.start();

        RelayConfig.ServerConfig server = factory.getConfig().getServer();
        this.httpServer = new HttpServer(
                server.getHost(),
                server.getPort(),
                server.getBacklog(),
                server.getThreads(),
                factory.getConfig().getTimeouts().getRequestTimeoutMs(),
                factory.getPipeline(),
                factory.getRecorder(),
                factory.getUsageLogs(),
                factory.getChannelRegistry(),
                factory.getLoadBalancer(),
                factory.getPolicyProvider(),
                factory.getMetricsRegistry()
        );

        log.info("LLM relay initialized");
    }

    public void start() {
        httpServer.start();
        log.info("LLM relay started on port {}", httpServer.getPort());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public RelayFactory getFactory() {
        return factory;
    }

    public int getPort() {
        return httpServer.getPort();
    }

    @Override
    public void close() {
        log.info("Shutting down LLM relay...");

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

        log.info("LLM relay shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            LlmRelayApplication app = new LlmRelayApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start LLM relay", e);
            System.exit(1);
        }
    }
}
