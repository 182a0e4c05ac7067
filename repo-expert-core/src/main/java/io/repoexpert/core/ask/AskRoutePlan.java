package io.repoexpert.core.ask;

import java.time.Duration;

/**
 * How a single question is sent to the agent.
 *
 * @param primaryOverrideModel model override for the first attempt, {@code null} for the agent default
 * @param enableFallback whether a failed first attempt is retried on the agent default model
 */
public record AskRoutePlan(
    String primaryOverrideModel,
    Duration primaryTimeout,
    Duration fallbackTimeout,
    boolean enableFallback
) {
}
