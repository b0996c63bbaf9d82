package fr.lapetina.llmrelay.domain.model;

/**
 * Token usage reported by the upstream for one execution.
 */
public record UsageLog(
        long promptTokens,
        long completionTokens,
        long completionReasoningTokens,
        long completionAudioTokens
) {
    public UsageLog {
        if (promptTokens < 0 || completionTokens < 0
                || completionReasoningTokens < 0 || completionAudioTokens < 0) {
            throw new IllegalArgumentException("Token counts must be >= 0");
        }
    }

    public static UsageLog of(long promptTokens, long completionTokens) {
        return new UsageLog(promptTokens, completionTokens, 0, 0);
    }

    public long totalTokens() {
        return promptTokens + completionTokens;
    }
}
