package io.repoexpert.core.provider;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * Non-2xx answer from the remote provider.
 */
public class ProviderHttpException extends IOException {
    private final int statusCode;
    private final Duration retryAfter;

    public ProviderHttpException(int statusCode, String message) {
        this(statusCode, message, null);
    }

    public ProviderHttpException(int statusCode, String message, Duration retryAfter) {
        super("HTTP " + statusCode + ": " + message);
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
    }

    public int statusCode() {
        return statusCode;
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    public boolean notFound() {
        return statusCode == 404;
    }

    public boolean transientFailure() {
        return statusCode == 429 || statusCode == 500 || statusCode == 502 || statusCode == 503;
    }
}
