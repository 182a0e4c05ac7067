package io.repoexpert.core.doctor;

import java.util.Objects;

public record CheckResult(String name, CheckStatus status, String message) {
    public CheckResult {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(status, "status must not be null");
        message = message == null ? "" : message;
    }

    public static CheckResult pass(String name, String message) {
        return new CheckResult(name, CheckStatus.PASS, message);
    }

    public static CheckResult warn(String name, String message) {
        return new CheckResult(name, CheckStatus.WARN, message);
    }

    public static CheckResult fail(String name, String message) {
        return new CheckResult(name, CheckStatus.FAIL, message);
    }
}
