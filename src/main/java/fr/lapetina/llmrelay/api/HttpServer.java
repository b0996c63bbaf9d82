package fr.lapetina.llmrelay.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.llmrelay.api.dto.RequestView;
import fr.lapetina.llmrelay.disruptor.RequestPipeline;
import fr.lapetina.llmrelay.disruptor.exception.BackpressureException;
import fr.lapetina.llmrelay.disruptor.exception.RequestRejectedException;
import fr.lapetina.llmrelay.domain.model.AutoDisablePolicy;
import fr.lapetina.llmrelay.domain.model.Channel;
import fr.lapetina.llmrelay.domain.model.ChannelCircuitBreaker;
import fr.lapetina.llmrelay.domain.model.ChannelHealth;
import fr.lapetina.llmrelay.domain.model.ChannelStatus;
import fr.lapetina.llmrelay.domain.model.ErrorType;
import fr.lapetina.llmrelay.domain.model.Request;
import fr.lapetina.llmrelay.domain.model.RequestExecution;
import fr.lapetina.llmrelay.domain.model.RequestSource;
import fr.lapetina.llmrelay.domain.model.RequestStatus;
import fr.lapetina.llmrelay.domain.model.RetryPolicy;
import fr.lapetina.llmrelay.domain.strategy.LoadBalancer;
import fr.lapetina.llmrelay.infrastructure.config.RetryPolicyProvider;
import fr.lapetina.llmrelay.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llmrelay.infrastructure.persistence.RequestRepository;
import fr.lapetina.llmrelay.infrastructure.persistence.UsageLogRepository;
import fr.lapetina.llmrelay.infrastructure.registry.ChannelRegistry;
import fr.lapetina.llmrelay.retry.CancellationToken;
import fr.lapetina.llmrelay.retry.ChunkListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /v1/chat/completions - Relay an OpenAI-style request, streamed or buffered
 * - GET /v1/requests - Most recent terminal requests
 * - GET /v1/requests/{id} - Request, its executions and metrics
 * - DELETE /v1/requests/{id} - Cancel an in-flight request
 * - GET /v1/retry-policy - Current retry policy snapshot
 * - GET /v1/channels - Channels with health and adaptive score
 * - GET /v1/channels/{id} - One channel
 * - PUT /v1/channels/{id} - Change status and/or weight
 * - GET /health - Health check endpoint
 * - GET /metrics - Prometheus metrics endpoint
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    /** Non-standard status used when the client cancelled the request. */
    static final int CLIENT_CLOSED_REQUEST = 499;

    private static final long CANCEL_GRACE_MS = 5_000;
    private static final int DEFAULT_RECENT_LIMIT = 50;

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final RequestPipeline pipeline;
    private final RequestRepository requests;
    private final UsageLogRepository usageLogs;
    private final ChannelRegistry channelRegistry;
    private final LoadBalancer loadBalancer;
    private final RetryPolicyProvider policyProvider;
    private final MetricsRegistry metricsRegistry;
    private final long requestTimeoutMs;

    public HttpServer(
            String host,
            int port,
            int backlog,
            int threads,
            long requestTimeoutMs,
            RequestPipeline pipeline,
            RequestRepository requests,
            UsageLogRepository usageLogs,
            ChannelRegistry channelRegistry,
            LoadBalancer loadBalancer,
            RetryPolicyProvider policyProvider,
            MetricsRegistry metricsRegistry
    ) throws IOException {
        this.pipeline = pipeline;
        this.requests = requests;
        this.usageLogs = usageLogs;
        this.channelRegistry = channelRegistry;
        this.loadBalancer = loadBalancer;
        this.policyProvider = policyProvider;
        this.metricsRegistry = metricsRegistry;
        this.requestTimeoutMs = requestTimeoutMs;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.server = com.sun.net.httpserver.HttpServer.create(new InetSocketAddress(host, port), backlog);
        this.executor = Executors.newFixedThreadPool(threads);
        server.setExecutor(executor);

        server.createContext("/v1/chat/completions", new ChatCompletionsHandler());
        server.createContext("/v1/requests", new RequestsHandler());
        server.createContext("/v1/retry-policy", new RetryPolicyHandler());
        server.createContext("/v1/channels", new ChannelsHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());

        log.info("HTTP server configured on {}:{}", host, getPort());
    }

    public void start() {
        server.start();
        log.info("HTTP server started");
    }

    /**
     * Bound port, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(5);
        executor.shutdown();
        log.info("HTTP server stopped");
    }

    // ==================== CHAT COMPLETIONS ====================

    private class ChatCompletionsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }

                String body;
                try (InputStream is = exchange.getRequestBody()) {
                    body = new String(is.readAllBytes(), StandardCharsets.UTF_8);
                }

                JsonNode root;
                try {
                    root = objectMapper.readTree(body);
                } catch (JsonProcessingException e) {
                    sendError(exchange, 400, "Malformed JSON body");
                    return;
                }
                if (root == null || !root.isObject()) {
                    sendError(exchange, 400, "Request body must be a JSON object");
                    return;
                }

                RequestSource source;
                try {
                    source = RequestSource.fromValue(exchange.getRequestHeaders().getFirst("X-Request-Source"));
                } catch (IllegalArgumentException e) {
                    sendError(exchange, 400, e.getMessage());
                    return;
                }

                Request request = Request.create(
                        source,
                        root.path("model").asText(""),
                        root.path("stream").asBoolean(false),
                        body
                );
                MDC.put("requestId", request.id());
                relay(exchange, request);
            } catch (Exception e) {
                log.error("Error handling chat completion request", e);
                sendErrorIfPossible(exchange, 500, "Internal server error: " + e.getMessage());
            } finally {
                MDC.remove("requestId");
            }
        }

        private void relay(HttpExchange exchange, Request request) throws IOException, InterruptedException {
            CancellationToken token = new CancellationToken();
            StreamWriter writer = request.stream() ? new StreamWriter(exchange, token) : null;
            exchange.getResponseHeaders().set("X-Request-ID", request.id());

            CompletableFuture<Request> future;
            try {
                future = pipeline.submit(request, token, writer != null ? writer : ChunkListener.NOOP);
            } catch (BackpressureException e) {
                log.warn("Backpressure: {}", e.getMessage());
                sendError(exchange, 503, e.getMessage());
                return;
            }

            Request terminal;
            try {
                terminal = awaitTerminal(request, future);
            } catch (ExecutionException e) {
                handleRejection(exchange, writer, e.getCause());
                return;
            }
            if (terminal == null) {
                sendErrorIfPossible(exchange, writer, 504, "Request did not finish within " + requestTimeoutMs + "ms");
                return;
            }

            if (writer != null && writer.isStarted()) {
                writer.finish(terminal);
                return;
            }
            respond(exchange, terminal);
        }

        private Request awaitTerminal(Request request, CompletableFuture<Request> future)
                throws InterruptedException, ExecutionException {
            try {
                return future.get(requestTimeoutMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.warn("Request timed out, cancelling: requestId={}, timeoutMs={}", request.id(), requestTimeoutMs);
                pipeline.cancel(request.id(), "timeout");
            }
            try {
                return future.get(CANCEL_GRACE_MS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.error("Request still running after cancellation: requestId={}", request.id());
                return null;
            }
        }

        private void handleRejection(HttpExchange exchange, StreamWriter writer, Throwable cause) throws IOException {
            if (cause instanceof RequestRejectedException rejected) {
                int status = rejected.getErrorType() == ErrorType.VALIDATION_ERROR ? 400 : 503;
                sendErrorIfPossible(exchange, writer, status, rejected.getMessage());
            } else if (cause instanceof BackpressureException backpressure) {
                sendErrorIfPossible(exchange, writer, 503, backpressure.getMessage());
            } else {
                log.error("Request processing failed", cause);
                sendErrorIfPossible(exchange, writer, 500, "Internal server error: "
                        + (cause != null ? cause.getMessage() : "unknown"));
            }
        }

        private void respond(HttpExchange exchange, Request terminal) throws IOException {
            if (terminal.status() == RequestStatus.COMPLETED) {
                Optional<RequestExecution> success = requests.findExecutions(terminal.id()).stream()
                        .filter(RequestExecution::isSuccess)
                        .reduce((first, second) -> second);
                String responseBody = success.map(RequestExecution::responseBody).orElse("");
                sendBytes(exchange, 200, "application/json", responseBody.getBytes(StandardCharsets.UTF_8));
                return;
            }

            Map<String, Object> error = new LinkedHashMap<>();
            error.put("error", terminal.errorSummary());
            error.put("request_id", terminal.id());
            error.put("status", terminal.status().name());
            sendJson(exchange, statusFor(terminal), error);
        }
    }

    static int statusFor(Request terminal) {
        String summary = terminal.errorSummary() != null ? terminal.errorSummary() : "";
        return switch (terminal.status()) {
            case COMPLETED -> 200;
            case CANCELED -> "timeout".equals(summary) ? 504 : CLIENT_CLOSED_REQUEST;
            case FAILED -> summary.startsWith(ErrorType.NO_AVAILABLE_CHANNEL.name()) ? 503 : 502;
            default -> 500;
        };
    }

    /**
     * Forwards streamed chunks to the client as server-sent events.
     * Headers are sent with the first chunk; a write failure cancels the request.
     */
    private final class StreamWriter implements ChunkListener {
        private final HttpExchange exchange;
        private final CancellationToken token;
        private OutputStream out;
        private boolean broken;

        StreamWriter(HttpExchange exchange, CancellationToken token) {
            this.exchange = exchange;
            this.token = token;
        }

        @Override
        public synchronized void onChunk(String chunk) {
            if (broken) {
                return;
            }
            try {
                if (out == null) {
                    exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
                    exchange.getResponseHeaders().set("Cache-Control", "no-cache");
                    exchange.sendResponseHeaders(200, 0);
                    out = exchange.getResponseBody();
                }
                out.write((chunk + "\n\n").getBytes(StandardCharsets.UTF_8));
                out.flush();
            } catch (IOException e) {
                broken = true;
                log.info("Client stream closed, cancelling request: {}", e.getMessage());
                token.cancel("client disconnected");
            }
        }

        synchronized boolean isStarted() {
            return out != null;
        }

        synchronized void finish(Request terminal) {
            try (OutputStream os = out) {
                if (!broken && terminal.status() != RequestStatus.COMPLETED) {
                    Map<String, Object> error = Map.of(
                            "error", Map.of(
                                    "message", String.valueOf(terminal.errorSummary()),
                                    "type", terminal.status().name()));
                    os.write(("data: " + objectMapper.writeValueAsString(error) + "\n\n")
                            .getBytes(StandardCharsets.UTF_8));
                }
            } catch (IOException e) {
                log.debug("Could not close client stream: {}", e.getMessage());
            }
        }
    }

    // ==================== REQUESTS ====================

    private class RequestsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            try {
                if (path.equals("/v1/requests") && "GET".equals(method)) {
                    handleRecent(exchange);
                } else if (path.matches("/v1/requests/[^/]+") && "GET".equals(method)) {
                    handleGet(exchange, lastSegment(path));
                } else if (path.matches("/v1/requests/[^/]+") && "DELETE".equals(method)) {
                    handleCancel(exchange, lastSegment(path));
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (Exception e) {
                log.error("Error in requests handler", e);
                sendError(exchange, 500, e.getMessage());
            }
        }

        private void handleRecent(HttpExchange exchange) throws IOException {
            int limit = DEFAULT_RECENT_LIMIT;
            String query = exchange.getRequestURI().getQuery();
            if (query != null && query.startsWith("limit=")) {
                try {
                    limit = Math.max(1, Integer.parseInt(query.substring("limit=".length())));
                } catch (NumberFormatException e) {
                    sendError(exchange, 400, "Invalid limit: " + query);
                    return;
                }
            }
            List<RequestView> views = new ArrayList<>();
            for (Request request : requests.findRecent(limit)) {
                views.add(view(request));
            }
            sendJson(exchange, 200, views);
        }

        private void handleGet(HttpExchange exchange, String requestId) throws IOException {
            Optional<Request> request = requests.findRequest(requestId);
            if (request.isPresent()) {
                sendJson(exchange, 200, view(request.get()));
                return;
            }
            if (pipeline.isInFlight(requestId)) {
                Map<String, Object> inFlight = new LinkedHashMap<>();
                inFlight.put("id", requestId);
                inFlight.put("status", RequestStatus.PROCESSING.name());
                inFlight.put("attempts", requests.findExecutions(requestId).size());
                sendJson(exchange, 200, inFlight);
                return;
            }
            sendError(exchange, 404, "Request not found: " + requestId);
        }

        private void handleCancel(HttpExchange exchange, String requestId) throws IOException {
            if (pipeline.cancel(requestId, "canceled by client")) {
                sendJson(exchange, 202, Map.of("id", requestId, "cancelled", true));
            } else if (requests.findRequest(requestId).isPresent()) {
                sendError(exchange, 409, "Request already finished: " + requestId);
            } else if (pipeline.isInFlight(requestId)) {
                sendError(exchange, 409, "Request already cancelled: " + requestId);
            } else {
                sendError(exchange, 404, "Request not found: " + requestId);
            }
        }

        private RequestView view(Request request) {
            return RequestView.from(request, requests.findExecutions(request.id()),
                    executionId -> usageLogs.findByExecution(executionId).orElse(null));
        }
    }

    // ==================== RETRY POLICY ====================

    private class RetryPolicyHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            RetryPolicy policy = policyProvider.snapshot();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("enabled", policy.enabled());
            body.put("max_channel_retries", policy.maxChannelRetries());
            body.put("max_single_channel_retries", policy.maxSingleChannelRetries());
            body.put("retry_delay_ms", policy.retryDelayMs());
            body.put("load_balancer_strategy", policy.loadBalancerStrategy().value());
            body.put("max_attempts", policy.maxAttempts());
            List<Map<String, Object>> statuses = new ArrayList<>();
            for (AutoDisablePolicy.StatusThreshold threshold : policy.autoDisableChannel().statuses()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("status", threshold.status());
                entry.put("times", threshold.times());
                statuses.add(entry);
            }
            Map<String, Object> autoDisable = new LinkedHashMap<>();
            autoDisable.put("enabled", policy.autoDisableChannel().enabled());
            autoDisable.put("statuses", statuses);
            body.put("auto_disable_channel", autoDisable);
            sendJson(exchange, 200, body);
        }
    }

    // ==================== CHANNELS ====================

    private class ChannelsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            try {
                if (path.equals("/v1/channels") && "GET".equals(method)) {
                    handleList(exchange);
                } else if (path.matches("/v1/channels/[^/]+") && "GET".equals(method)) {
                    handleGet(exchange, lastSegment(path));
                } else if (path.matches("/v1/channels/[^/]+") && "PUT".equals(method)) {
                    handleUpdate(exchange, lastSegment(path));
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (Exception e) {
                log.error("Error in channels handler", e);
                sendError(exchange, 500, e.getMessage());
            }
        }

        private void handleList(HttpExchange exchange) throws IOException {
            List<Channel> channels = channelRegistry.snapshot();
            Map<String, Double> scores = loadBalancer.adaptiveScores(channels);
            List<Map<String, Object>> body = new ArrayList<>();
            for (Channel channel : channels) {
                body.add(channelInfo(channel, scores.get(channel.getId())));
            }
            sendJson(exchange, 200, body);
        }

        private void handleGet(HttpExchange exchange, String channelId) throws IOException {
            Optional<Channel> channel = channelRegistry.get(channelId);
            if (channel.isEmpty()) {
                sendError(exchange, 404, "Channel not found: " + channelId);
                return;
            }
            Double score = loadBalancer.adaptiveScores(channelRegistry.snapshot()).get(channelId);
            sendJson(exchange, 200, channelInfo(channel.get(), score));
        }

        @SuppressWarnings("unchecked")
        private void handleUpdate(HttpExchange exchange, String channelId) throws IOException {
            if (channelRegistry.get(channelId).isEmpty()) {
                sendError(exchange, 404, "Channel not found: " + channelId);
                return;
            }

            Map<String, Object> update;
            try (InputStream is = exchange.getRequestBody()) {
                update = objectMapper.readValue(is, Map.class);
            } catch (JsonProcessingException e) {
                sendError(exchange, 400, "Malformed JSON body");
                return;
            }
            if (update == null) {
                sendError(exchange, 400, "Request body must be a JSON object");
                return;
            }

            ChannelStatus status = null;
            Double weight = null;
            try {
                if (update.get("status") != null) {
                    status = ChannelStatus.fromValue(String.valueOf(update.get("status")));
                }
                if (update.get("weight") != null) {
                    if (!(update.get("weight") instanceof Number number)) {
                        throw new IllegalArgumentException("weight must be a number");
                    }
                    weight = number.doubleValue();
                    if (!Double.isFinite(weight) || weight < 0) {
                        throw new IllegalArgumentException("weight must be a finite number >= 0");
                    }
                }
            } catch (IllegalArgumentException e) {
                sendError(exchange, 400, e.getMessage());
                return;
            }
            if (status == null && weight == null) {
                sendError(exchange, 400, "Nothing to update, expected 'status' and/or 'weight'");
                return;
            }

            Optional<Channel> updated = channelRegistry.update(channelId, status, weight);
            if (updated.isEmpty()) {
                sendError(exchange, 404, "Channel not found: " + channelId);
                return;
            }
            sendJson(exchange, 200, channelInfo(updated.get(), null));
        }

        private Map<String, Object> channelInfo(Channel channel, Double score) {
            ChannelHealth.Snapshot health = channel.getHealth().snapshot();
            Map<String, Object> healthInfo = new LinkedHashMap<>();
            healthInfo.put("successes", health.successes());
            healthInfo.put("failures", health.failures());
            healthInfo.put("success_rate", health.successRate());
            healthInfo.put("avg_latency_ms", health.averageLatencyMs());
            healthInfo.put("consecutive_failures", health.consecutiveFailures());
            healthInfo.put("breaker_state", health.breakerState().name());
            healthInfo.put("cooling_down", health.coolingDown());

            Map<String, Object> info = new LinkedHashMap<>();
            info.put("id", channel.getId());
            info.put("name", channel.getName());
            info.put("url", channel.getBaseUrl().toString());
            info.put("models", channel.getModels());
            info.put("status", channel.getStatus().value());
            info.put("weight", channel.getWeight());
            if (score != null) {
                info.put("score", score);
            }
            info.put("health", healthInfo);
            return info;
        }
    }

    // ==================== HEALTH ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            List<Channel> enabled = channelRegistry.getEnabledChannels();
            long open = enabled.stream()
                    .filter(c -> c.getHealth().snapshot().breakerState() == ChannelCircuitBreaker.State.OPEN)
                    .count();

            String status;
            if (enabled.isEmpty() || open == enabled.size()) {
                status = "DOWN";
            } else if (open > 0) {
                status = "DEGRADED";
            } else {
                status = "UP";
            }

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", status);
            health.put("timestamp", System.currentTimeMillis());
            health.put("enabledChannels", enabled.size());
            health.put("unhealthyChannels", open);

            Map<String, Object> pipelineStats = new LinkedHashMap<>();
            pipelineStats.put("globalInFlight", pipeline.getGlobalInFlight());
            pipelineStats.put("ringBufferRemaining", pipeline.getRemainingCapacity());
            pipelineStats.put("strategy", policyProvider.snapshot().loadBalancerStrategy().value());
            health.put("pipeline", pipelineStats);

            sendJson(exchange, "DOWN".equals(status) ? 503 : 200, health);
        }
    }

    // ==================== METRICS ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            metricsRegistry.setGlobalInFlight(pipeline.getGlobalInFlight());
            metricsRegistry.setRingBufferRemaining((int) pipeline.getRemainingCapacity());

            sendBytes(exchange, 200, "text/plain; version=0.0.4",
                    metricsRegistry.scrape().getBytes(StandardCharsets.UTF_8));
        }
    }

    // ==================== HELPER METHODS ====================

    private static String lastSegment(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        sendBytes(exchange, statusCode, "application/json", objectMapper.writeValueAsBytes(body));
    }

    private static void sendBytes(HttpExchange exchange, int statusCode, String contentType, byte[] bytes)
            throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        if (bytes.length == 0) {
            exchange.sendResponseHeaders(statusCode, -1);
            exchange.close();
            return;
        }
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message != null ? message : "unknown error");
        sendJson(exchange, statusCode, error);
    }

    private void sendErrorIfPossible(HttpExchange exchange, int statusCode, String message) {
        try {
            sendError(exchange, statusCode, message);
        } catch (IOException | RuntimeException e) {
            log.debug("Could not send error response: {}", e.getMessage());
        }
    }

    private void sendErrorIfPossible(HttpExchange exchange, StreamWriter writer, int statusCode, String message) {
        if (writer != null && writer.isStarted()) {
            log.warn("Stream already started, dropping error response: status={}, error={}", statusCode, message);
            exchange.close();
            return;
        }
        sendErrorIfPossible(exchange, statusCode, message);
    }
}
