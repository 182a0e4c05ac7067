package io.repoexpert.core.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * JSON file holding {@link AppState}. A missing file reads as empty state; a corrupt one is
 * an error so that passage mappings are never silently discarded.
 */
public final class FileStateStore implements StateStore {
    private final Path path;
    private final ObjectMapper mapper;

    public FileStateStore(Path path) {
        this.path = path;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public Path path() {
        return path;
    }

    @Override
    public synchronized AppState load() throws IOException {
        if (!Files.exists(path)) {
            return AppState.empty();
        }
        return mapper.readValue(Files.readString(path), AppState.class);
    }

    @Override
    public synchronized void save(AppState state) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(state);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
