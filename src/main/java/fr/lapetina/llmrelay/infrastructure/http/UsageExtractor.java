package fr.lapetina.llmrelay.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.llmrelay.domain.model.UsageLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Reads OpenAI-style {@code usage} blocks from upstream responses.
 *
 * Streams carry usage in one of their last chunks, so chunks are scanned from the end.
 */
public final class UsageExtractor {

    private static final Logger log = LoggerFactory.getLogger(UsageExtractor.class);
    private static final String DATA_PREFIX = "data:";
    private static final String DONE_MARKER = "[DONE]";

    private final ObjectMapper objectMapper;

    public UsageExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<UsageLog> fromBody(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        return parse(body);
    }

    public Optional<UsageLog> fromChunks(List<String> chunks) {
        for (int i = chunks.size() - 1; i >= 0; i--) {
            String payload = payloadOf(chunks.get(i));
            if (payload.isEmpty() || DONE_MARKER.equals(payload) || !payload.contains("\"usage\"")) {
                continue;
            }
            Optional<UsageLog> usage = parse(payload);
            if (usage.isPresent()) {
                return usage;
            }
        }
        return Optional.empty();
    }

    private Optional<UsageLog> parse(String json) {
        try {
            JsonNode usage = objectMapper.readTree(json).path("usage");
            if (!usage.isObject()) {
                return Optional.empty();
            }
            JsonNode details = usage.path("completion_tokens_details");
            long prompt = usage.has("prompt_tokens")
                    ? usage.path("prompt_tokens").asLong(0)
                    : usage.path("input_tokens").asLong(0);
            long completion = usage.has("completion_tokens")
                    ? usage.path("completion_tokens").asLong(0)
                    : usage.path("output_tokens").asLong(0);
            return Optional.of(new UsageLog(
                    Math.max(0, prompt),
                    Math.max(0, completion),
                    Math.max(0, details.path("reasoning_tokens").asLong(0)),
                    Math.max(0, details.path("audio_tokens").asLong(0))
            ));
        } catch (JsonProcessingException e) {
            log.debug("Response is not JSON, no usage extracted: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static String payloadOf(String chunk) {
        String trimmed = chunk.trim();
        if (trimmed.startsWith(DATA_PREFIX)) {
            return trimmed.substring(DATA_PREFIX.length()).trim();
        }
        return trimmed;
    }
}
