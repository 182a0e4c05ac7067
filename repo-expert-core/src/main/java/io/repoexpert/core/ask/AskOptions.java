package io.repoexpert.core.ask;

/**
 * @param model explicit model override; disables routing when set
 * @param fastModel model used for questions routed to the fast path, blank to disable it
 */
public record AskOptions(String model, AskRoutingMode routing, String fastModel, boolean useCache) {
    public AskOptions {
        routing = routing == null ? AskRoutingMode.AUTO : routing;
    }

    public static AskOptions defaults() {
        return new AskOptions(null, AskRoutingMode.AUTO, null, true);
    }
}
