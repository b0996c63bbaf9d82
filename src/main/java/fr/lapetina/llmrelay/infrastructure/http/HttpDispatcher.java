package fr.lapetina.llmrelay.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.llmrelay.domain.model.Channel;
import fr.lapetina.llmrelay.domain.model.ErrorType;
import fr.lapetina.llmrelay.domain.model.ExecutionStatus;
import fr.lapetina.llmrelay.domain.model.Request;
import fr.lapetina.llmrelay.domain.model.RequestExecution;
import fr.lapetina.llmrelay.domain.model.UsageLog;
import fr.lapetina.llmrelay.retry.CancellationToken;
import fr.lapetina.llmrelay.retry.ChunkListener;
import fr.lapetina.llmrelay.retry.DispatchResult;
import fr.lapetina.llmrelay.retry.Dispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Dispatcher that relays the opaque request body to a channel's endpoint over HTTP.
 *
 * <p>Buffered requests read the whole body. Streaming requests read the response line by
 * line, forwarding every non-empty line to the caller as it arrives and keeping it for the
 * audit trail. Cancellation cancels the pending exchange or closes the open stream.
 *
 * <p>Classification:
 * - 2xx: success
 * - 408, 425, 429, 5xx, timeouts, connection, I/O and unknown errors: transient
 * - any other status, or a request that cannot be built: non-retryable
 * - a stream breaking after its first chunk was forwarded: stream interrupted
 */
public class HttpDispatcher implements Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(HttpDispatcher.class);

    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final ObjectMapper objectMapper;
    private final UsageExtractor usageExtractor;

    public HttpDispatcher(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.usageExtractor = new UsageExtractor(objectMapper);
    }

    public HttpDispatcher(Duration connectTimeout, Duration requestTimeout) {
        this(HttpClient.newBuilder()
                        .connectTimeout(connectTimeout)
                        .version(HttpClient.Version.HTTP_1_1)
                        .build(),
                requestTimeout);
    }

    public HttpDispatcher() {
        this(Duration.ofSeconds(10), Duration.ofSeconds(120));
    }

    @Override
    public DispatchResult dispatch(
            Request request,
            Channel channel,
            int attempt,
            CancellationToken token,
            ChunkListener listener
    ) {
        Instant startedAt = Instant.now();
        if (token.isCancelled()) {
            return DispatchResult.failure(request, channel, attempt, startedAt, ErrorType.CANCELLED, null);
        }

        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(channel, request);
        } catch (IllegalArgumentException e) {
            log.error("Failed to build request: channelId={}, requestId={}", channel.getId(), request.id(), e);
            return DispatchResult.failure(request, channel, attempt, startedAt,
                    ErrorType.NON_RETRYABLE_PROVIDER_ERROR, "Failed to build request: " + e.getMessage());
        }

        log.info("Sending attempt: channelId={}, requestId={}, attempt={}, model={}, stream={}, endpoint={}",
                channel.getId(), request.id(), attempt, request.modelId(), request.stream(), httpRequest.uri());

        return request.stream()
                ? dispatchStreaming(request, channel, attempt, httpRequest, startedAt, token, listener)
                : dispatchBuffered(request, channel, attempt, httpRequest, startedAt, token);
    }

    private HttpRequest buildHttpRequest(Channel channel, Request request) {
        if (channel.getBaseUrl() == null) {
            throw new IllegalArgumentException("Channel has no endpoint: " + channel.getId());
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(channel.getBaseUrl())
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("X-Request-ID", request.id())
                .POST(HttpRequest.BodyPublishers.ofString(request.requestBody()));
        if (request.stream()) {
            builder.header("Accept", "text/event-stream");
        }
        if (channel.getApiKey() != null && !channel.getApiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + channel.getApiKey());
        }
        return builder.build();
    }

    private DispatchResult dispatchBuffered(
            Request request,
            Channel channel,
            int attempt,
            HttpRequest httpRequest,
            Instant startedAt,
            CancellationToken token
    ) {
        CompletableFuture<HttpResponse<String>> future =
                httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString());

        HttpResponse<String> response;
        try (CancellationToken.Registration registration = token.onCancel(() -> future.cancel(true))) {
            response = future.get();
        } catch (CancellationException e) {
            return canceled(request, channel, attempt, startedAt, List.of(), null);
        } catch (ExecutionException e) {
            return exceptional(request, channel, attempt, startedAt, List.of(), null, e.getCause(), token);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            token.cancel("interrupted");
            return canceled(request, channel, attempt, startedAt, List.of(), null);
        }

        int statusCode = response.statusCode();
        Duration latency = Duration.between(startedAt, Instant.now());
        if (statusCode >= 200 && statusCode < 300) {
            log.info("Attempt successful: channelId={}, requestId={}, attempt={}, status={}, latencyMs={}",
                    channel.getId(), request.id(), attempt, statusCode, latency.toMillis());
            String body = response.body();
            RequestExecution execution = RequestExecution.builder()
                    .request(request)
                    .channelId(channel.getId())
                    .attempt(attempt)
                    .status(ExecutionStatus.COMPLETED)
                    .responseBody(body)
                    .createdAt(startedAt)
                    .updatedAt(Instant.now())
                    .build();
            return DispatchResult.success(execution, usageExtractor.fromBody(body).orElse(null));
        }

        return httpError(request, channel, attempt, startedAt, statusCode, response.body());
    }

    private DispatchResult dispatchStreaming(
            Request request,
            Channel channel,
            int attempt,
            HttpRequest httpRequest,
            Instant startedAt,
            CancellationToken token,
            ChunkListener listener
    ) {
        CompletableFuture<HttpResponse<Stream<String>>> future =
                httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofLines());

        HttpResponse<Stream<String>> response;
        try (CancellationToken.Registration registration = token.onCancel(() -> future.cancel(true))) {
            response = future.get();
        } catch (CancellationException e) {
            return canceled(request, channel, attempt, startedAt, List.of(), null);
        } catch (ExecutionException e) {
            return exceptional(request, channel, attempt, startedAt, List.of(), null, e.getCause(), token);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            token.cancel("interrupted");
            return canceled(request, channel, attempt, startedAt, List.of(), null);
        }

        int statusCode = response.statusCode();
        if (statusCode < 200 || statusCode >= 300) {
            String body;
            try (Stream<String> lines = response.body()) {
                body = lines.collect(Collectors.joining("\n"));
            } catch (UncheckedIOException e) {
                body = null;
            }
            return httpError(request, channel, attempt, startedAt, statusCode, body);
        }

        List<String> chunks = new ArrayList<>();
        Instant firstChunkAt = null;
        try (Stream<String> lines = response.body();
             CancellationToken.Registration registration = token.onCancel(lines::close)) {
            Iterator<String> iterator = lines.iterator();
            while (!token.isCancelled() && iterator.hasNext()) {
                String line = iterator.next();
                if (line.isEmpty()) {
                    continue;
                }
                if (firstChunkAt == null) {
                    firstChunkAt = Instant.now();
                }
                chunks.add(line);
                listener.onChunk(line);
            }
        } catch (RuntimeException e) {
            return exceptional(request, channel, attempt, startedAt, chunks, firstChunkAt, e, token);
        }

        if (token.isCancelled()) {
            return canceled(request, channel, attempt, startedAt, chunks, firstChunkAt);
        }

        log.info("Stream completed: channelId={}, requestId={}, attempt={}, chunks={}, latencyMs={}",
                channel.getId(), request.id(), attempt, chunks.size(),
                Duration.between(startedAt, Instant.now()).toMillis());

        RequestExecution execution = RequestExecution.builder()
                .request(request)
                .channelId(channel.getId())
                .attempt(attempt)
                .status(ExecutionStatus.COMPLETED)
                .responseChunks(chunks)
                .createdAt(startedAt)
                .firstChunkAt(firstChunkAt)
                .updatedAt(Instant.now())
                .build();
        return DispatchResult.success(execution, usageExtractor.fromChunks(chunks).orElse(null));
    }

    private DispatchResult httpError(
            Request request,
            Channel channel,
            int attempt,
            Instant startedAt,
            int statusCode,
            String body
    ) {
        ErrorType errorType = classifyStatus(statusCode);
        String message = "HTTP " + statusCode + ": " + parseErrorMessage(body);
        log.warn("Attempt failed with HTTP error: channelId={}, requestId={}, attempt={}, status={}, errorType={}",
                channel.getId(), request.id(), attempt, statusCode, errorType);
        return DispatchResult.httpFailure(request, channel, attempt, startedAt, statusCode, errorType, message);
    }

    private DispatchResult exceptional(
            Request request,
            Channel channel,
            int attempt,
            Instant startedAt,
            List<String> chunks,
            Instant firstChunkAt,
            Throwable ex,
            CancellationToken token
    ) {
        if (token.isCancelled() || ex instanceof CancellationException) {
            return canceled(request, channel, attempt, startedAt, chunks, firstChunkAt);
        }

        ErrorType errorType = classifyException(ex);
        if (!chunks.isEmpty()) {
            errorType = ErrorType.STREAM_INTERRUPTED;
        }
        Throwable cause = ex instanceof UncheckedIOException && ex.getCause() != null ? ex.getCause() : ex;
        String message = cause.getClass().getSimpleName() + ": " + cause.getMessage();

        if (!(cause instanceof IOException || cause instanceof TimeoutException)) {
            log.error("Attempt failed unexpectedly: channelId={}, requestId={}, attempt={}, error={}",
                    channel.getId(), request.id(), attempt, message, ex);
        } else {
            log.warn("Attempt failed: channelId={}, requestId={}, attempt={}, errorType={}, error={}",
                    channel.getId(), request.id(), attempt, errorType, message);
        }
        return DispatchResult.failure(request, channel, attempt, startedAt, chunks, firstChunkAt, errorType, message);
    }

    private DispatchResult canceled(
            Request request,
            Channel channel,
            int attempt,
            Instant startedAt,
            List<String> chunks,
            Instant firstChunkAt
    ) {
        log.info("Attempt canceled: channelId={}, requestId={}, attempt={}, chunks={}",
                channel.getId(), request.id(), attempt, chunks.size());
        return DispatchResult.failure(request, channel, attempt, startedAt, chunks, firstChunkAt,
                ErrorType.CANCELLED, null);
    }

    /**
     * Maps an upstream HTTP status to a classification, or null for success.
     */
    public static ErrorType classifyStatus(int statusCode) {
        if (statusCode >= 200 && statusCode < 300) {
            return null;
        }
        if (statusCode == 408 || statusCode == 425 || statusCode == 429 || statusCode >= 500) {
            return ErrorType.TRANSIENT_PROVIDER_ERROR;
        }
        return ErrorType.NON_RETRYABLE_PROVIDER_ERROR;
    }

    /**
     * Maps a transport failure to a classification. Timeouts, connection and I/O errors are
     * transient, and so is any failure not recognised here.
     */
    public static ErrorType classifyException(Throwable ex) {
        Throwable cause = ex instanceof UncheckedIOException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof CancellationException) {
            return ErrorType.CANCELLED;
        }
        return ErrorType.TRANSIENT_PROVIDER_ERROR;
    }

    private String parseErrorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "no body";
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode error = root.path("error");
            if (error.isTextual()) {
                return error.asText();
            }
            if (error.isObject() && error.hasNonNull("message")) {
                return error.get("message").asText();
            }
            if (root.hasNonNull("message")) {
                return root.get("message").asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: {}", e.getOriginalMessage());
        }
        return body.length() > 500 ? body.substring(0, 500) : body;
    }
}
