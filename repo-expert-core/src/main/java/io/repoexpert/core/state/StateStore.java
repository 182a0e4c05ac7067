package io.repoexpert.core.state;

import java.io.IOException;

public interface StateStore {
    AppState load() throws IOException;

    void save(AppState state) throws IOException;
}
