package fr.lapetina.llmrelay.domain.event;

/**
 * Intake state of a request event in the Disruptor pipeline.
 * The pipeline only admits requests; the attempt loop runs after {@link #HANDED_OFF}.
 */
public enum EventState {
    /** Published, awaiting validation */
    ACCEPTED,

    /** Request validated successfully */
    VALIDATED,

    /** Validation failed */
    VALIDATION_FAILED,

    /** Request holds a global in-flight slot */
    ADMITTED,

    /** Global in-flight limit reached */
    REJECTED,

    /** Request handed to a coordination worker */
    HANDED_OFF
}
