package io.repoexpert.core.doctor;

public enum CheckStatus {
    PASS,
    WARN,
    FAIL
}
