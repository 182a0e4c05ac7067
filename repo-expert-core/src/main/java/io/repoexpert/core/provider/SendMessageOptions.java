package io.repoexpert.core.provider;

/**
 * @param overrideModel model to use instead of the agent's configured one, or {@code null}
 * @param maxSteps upper bound on agent steps, or {@code null} for the server default
 */
public record SendMessageOptions(String overrideModel, Integer maxSteps) {
    public static final SendMessageOptions DEFAULTS = new SendMessageOptions(null, null);

    public static SendMessageOptions withModel(String model) {
        return new SendMessageOptions(model, null);
    }
}
