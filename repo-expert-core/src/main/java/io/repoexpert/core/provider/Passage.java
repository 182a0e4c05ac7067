package io.repoexpert.core.provider;

import java.util.Objects;

public record Passage(String id, String text) {
    public Passage {
        Objects.requireNonNull(id, "id must not be null");
        text = text == null ? "" : text;
    }
}
