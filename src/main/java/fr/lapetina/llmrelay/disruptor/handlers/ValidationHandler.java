package fr.lapetina.llmrelay.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.llmrelay.domain.event.EventState;
import fr.lapetina.llmrelay.domain.event.RelayRequestEvent;
import fr.lapetina.llmrelay.domain.model.ErrorType;
import fr.lapetina.llmrelay.domain.model.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * First stage handler: validates incoming requests.
 *
 * Validates:
 * - Request is not null
 * - Model name is present and allowed (if a model whitelist is configured)
 * - Body is present and within the size limit
 */
public final class ValidationHandler implements EventHandler<RelayRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(ValidationHandler.class);

    private final Set<String> allowedModels;
    private final int maxBodyBytes;

    public ValidationHandler(Set<String> allowedModels, int maxBodyBytes) {
        this.allowedModels = allowedModels != null ? Set.copyOf(allowedModels) : Set.of();
        this.maxBodyBytes = maxBodyBytes;
    }

    /**
     * Creates a handler with no model restrictions and a 1 MiB body limit.
     */
    public static ValidationHandler withDefaults() {
        return new ValidationHandler(Set.of(), 1_048_576);
    }

    @Override
    public void onEvent(RelayRequestEvent event, long sequence, boolean endOfBatch) {
        if (event.isRejected()) {
            log.debug("Skipping already rejected event: sequence={}", sequence);
            return;
        }

        event.setSequence(sequence);
        Request request = event.getRequest();

        try {
            validate(request);
            event.markValidated();
            log.debug("Request validated: requestId={}, model={}, sequence={}",
                    request.id(), request.modelId(), sequence);
        } catch (ValidationException e) {
            event.reject(EventState.VALIDATION_FAILED, ErrorType.VALIDATION_ERROR, e.getMessage());
            log.warn("Validation failed: requestId={}, model={}, reason={}, sequence={}",
                    request != null ? request.id() : "null",
                    request != null ? request.modelId() : "null",
                    e.getMessage(),
                    sequence);
        }
    }

    void validate(Request request) throws ValidationException {
        if (request == null) {
            throw new ValidationException("Request is null");
        }

        String model = request.modelId();
        if (model == null || model.isBlank()) {
            throw new ValidationException("Model name is required");
        }
        if (!allowedModels.isEmpty() && !allowedModels.contains(model)) {
            throw new ValidationException("Model not allowed: " + model);
        }

        String body = request.requestBody();
        if (body == null || body.isBlank()) {
            throw new ValidationException("Request body is required");
        }
        int size = body.getBytes(StandardCharsets.UTF_8).length;
        if (size > maxBodyBytes) {
            throw new ValidationException("Request body of " + size + " bytes exceeds maximum of " + maxBodyBytes);
        }
    }

    static final class ValidationException extends Exception {
        ValidationException(String message) {
            super(message);
        }
    }
}
