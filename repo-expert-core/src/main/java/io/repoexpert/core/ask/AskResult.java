package io.repoexpert.core.ask;

/**
 * @param model model that produced the answer, {@code null} for the agent default
 */
public record AskResult(String answer, boolean cacheHit, String model, boolean fellBack) {
}
