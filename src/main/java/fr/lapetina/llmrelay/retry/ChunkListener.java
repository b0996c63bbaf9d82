package fr.lapetina.llmrelay.retry;

/**
 * Receives streamed response chunks as the dispatcher reads them, in order.
 */
@FunctionalInterface
public interface ChunkListener {

    ChunkListener NOOP = chunk -> { };

    void onChunk(String chunk);
}
