package io.repoexpert.core.provider;

import java.io.IOException;

/**
 * The provider answered successfully but the body is missing required fields.
 */
public class ProviderResponseException extends IOException {
    public ProviderResponseException(String message) {
        super(message);
    }

    public ProviderResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
