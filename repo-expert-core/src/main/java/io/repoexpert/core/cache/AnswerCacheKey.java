package io.repoexpert.core.cache;

import io.repoexpert.core.ask.QuestionNormalizer;

/**
 * Identifies a cached answer. The commit component ties an answer to the repository
 * content it was produced from.
 *
 * @param modelKey model override, or blank for the agent's default model
 * @param lastSyncCommit commit of the last sync, or {@code null} when the agent was never synced
 */
public record AnswerCacheKey(String agentId, String question, String modelKey, String lastSyncCommit) {
    public static final String DEFAULT_MODEL_KEY = "__agent_default__";
    public static final String NO_SYNC_COMMIT = "no-sync-commit";

    public static String toModelKey(String model) {
        String trimmed = model == null ? "" : model.trim();
        return trimmed.isEmpty() ? DEFAULT_MODEL_KEY : trimmed;
    }

    Slot slot() {
        return new Slot(
            agentId == null ? "" : agentId,
            toModelKey(modelKey),
            lastSyncCommit == null ? NO_SYNC_COMMIT : lastSyncCommit,
            QuestionNormalizer.normalize(question)
        );
    }

    /**
     * Structured lookup key; field-wise equality rules out separator collisions.
     */
    record Slot(String agentId, String modelKey, String commit, String normalizedQuestion) {
    }
}
