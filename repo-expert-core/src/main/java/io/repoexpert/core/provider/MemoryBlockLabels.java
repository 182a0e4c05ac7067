package io.repoexpert.core.provider;

import java.util.List;

public final class MemoryBlockLabels {
    public static final String PERSONA = "persona";
    public static final String ARCHITECTURE = "architecture";
    public static final String CONVENTIONS = "conventions";

    public static final List<String> STANDARD = List.of(PERSONA, ARCHITECTURE, CONVENTIONS);

    private MemoryBlockLabels() {
    }
}
