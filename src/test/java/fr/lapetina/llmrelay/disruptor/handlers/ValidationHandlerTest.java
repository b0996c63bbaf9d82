package fr.lapetina.llmrelay.disruptor.handlers;

import fr.lapetina.llmrelay.domain.event.EventState;
import fr.lapetina.llmrelay.domain.event.RelayRequestEvent;
import fr.lapetina.llmrelay.domain.model.ErrorType;
import fr.lapetina.llmrelay.domain.model.Request;
import fr.lapetina.llmrelay.domain.model.RequestSource;
import fr.lapetina.llmrelay.retry.CancellationToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class ValidationHandlerTest {

    private ValidationHandler handler;
    private RelayRequestEvent event;

    @BeforeEach
    void setUp() {
        handler = new ValidationHandler(Set.of("gpt-4o", "gpt-4o-mini"), 64);
        event = new RelayRequestEvent();
    }

    private void initialize(Request request) {
        event.initialize(request, new CancellationToken(), null, new CompletableFuture<>());
    }

    @Test
    @DisplayName("should validate a well-formed request")
    void shouldValidateValidRequest() {
        initialize(Request.create("gpt-4o", "{\"messages\":[]}"));

        handler.onEvent(event, 5, true);

        assertThat(event.getState()).isEqualTo(EventState.VALIDATED);
        assertThat(event.getErrorType()).isNull();
        assertThat(event.getValidatedAt()).isNotNull();
        assertThat(event.getSequence()).isEqualTo(5);
    }

    @Test
    @DisplayName("should reject a null request")
    void shouldRejectNullRequest() {
        initialize(null);

        handler.onEvent(event, 0, true);

        assertThat(event.getState()).isEqualTo(EventState.VALIDATION_FAILED);
        assertThat(event.getErrorType()).isEqualTo(ErrorType.VALIDATION_ERROR);
        assertThat(event.getErrorMessage()).isEqualTo("Request is null");
    }

    @Test
    @DisplayName("should reject a blank model")
    void shouldRejectBlankModel() {
        initialize(Request.create(RequestSource.API, " ", false, "{}"));

        handler.onEvent(event, 0, true);

        assertThat(event.getState()).isEqualTo(EventState.VALIDATION_FAILED);
        assertThat(event.getErrorMessage()).isEqualTo("Model name is required");
    }

    @Test
    @DisplayName("should reject a model outside the allowed list")
    void shouldRejectDisallowedModel() {
        initialize(Request.create("llama3", "{}"));

        handler.onEvent(event, 0, true);

        assertThat(event.getState()).isEqualTo(EventState.VALIDATION_FAILED);
        assertThat(event.getErrorMessage()).isEqualTo("Model not allowed: llama3");
    }

    @Test
    @DisplayName("should accept any model when no allowed list is configured")
    void shouldAcceptAnyModelWithoutAllowedList() {
        handler = ValidationHandler.withDefaults();
        initialize(Request.create("llama3", "{}"));

        handler.onEvent(event, 0, true);

        assertThat(event.getState()).isEqualTo(EventState.VALIDATED);
    }

    @Test
    @DisplayName("should reject an empty body")
    void shouldRejectEmptyBody() {
        initialize(Request.create("gpt-4o", "   "));

        handler.onEvent(event, 0, true);

        assertThat(event.getState()).isEqualTo(EventState.VALIDATION_FAILED);
        assertThat(event.getErrorMessage()).isEqualTo("Request body is required");
    }

    @Test
    @DisplayName("should measure the body limit in UTF-8 bytes")
    void shouldRejectOversizedBody() {
        // 40 characters, 80 bytes
        initialize(Request.create("gpt-4o", "é".repeat(40)));

        handler.onEvent(event, 0, true);

        assertThat(event.getState()).isEqualTo(EventState.VALIDATION_FAILED);
        assertThat(event.getErrorMessage()).isEqualTo("Request body of 80 bytes exceeds maximum of 64");
    }

    @Test
    @DisplayName("should leave an already rejected event untouched")
    void shouldSkipRejectedEvent() {
        initialize(Request.create("gpt-4o", "{}"));
        event.reject(EventState.REJECTED, ErrorType.CAPACITY_ERROR, "full");

        handler.onEvent(event, 9, true);

        assertThat(event.getState()).isEqualTo(EventState.REJECTED);
        assertThat(event.getErrorType()).isEqualTo(ErrorType.CAPACITY_ERROR);
    }
}
