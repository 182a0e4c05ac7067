package io.repoexpert.core.passage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable record of which remote passage IDs belong to which local file.
 *
 * <p>A passage ID is mapped to at most one file, and files never map to an empty list.
 * All mutators return a new instance.
 */
public final class PassageMap {
    private static final PassageMap EMPTY = new PassageMap(Map.of());

    private final Map<String, List<String>> entries;

    private PassageMap(Map<String, List<String>> entries) {
        this.entries = entries;
    }

    public static PassageMap empty() {
        return EMPTY;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PassageMap of(Map<String, List<String>> source) {
        if (source == null || source.isEmpty()) {
            return EMPTY;
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        Map<String, String> owners = new HashMap<>();
        for (Map.Entry<String, List<String>> entry : source.entrySet()) {
            String path = Objects.requireNonNull(entry.getKey(), "file path must not be null");
            List<String> ids = entry.getValue() == null ? List.of() : List.copyOf(entry.getValue());
            if (ids.isEmpty()) {
                continue;
            }
            for (String id : ids) {
                String previous = owners.putIfAbsent(id, path);
                if (previous != null && !previous.equals(path)) {
                    throw new IllegalArgumentException(
                        "Passage " + id + " is mapped to both " + previous + " and " + path
                    );
                }
            }
            copy.put(path, ids);
        }
        return copy.isEmpty() ? EMPTY : new PassageMap(Collections.unmodifiableMap(copy));
    }

    @JsonValue
    public Map<String, List<String>> asMap() {
        return entries;
    }

    public List<String> passageIds(String path) {
        return entries.getOrDefault(path, List.of());
    }

    public boolean containsFile(String path) {
        return entries.containsKey(path);
    }

    public Set<String> files() {
        return entries.keySet();
    }

    /**
     * Every passage ID in the map, in file order then list order.
     */
    public Set<String> allPassageIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (List<String> fileIds : entries.values()) {
            ids.addAll(fileIds);
        }
        return Collections.unmodifiableSet(ids);
    }

    public int fileCount() {
        return entries.size();
    }

    public int passageCount() {
        int count = 0;
        for (List<String> ids : entries.values()) {
            count += ids.size();
        }
        return count;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public PassageMap withFile(String path, List<String> passageIds) {
        Map<String, List<String>> copy = new LinkedHashMap<>(entries);
        copy.put(path, passageIds);
        return of(copy);
    }

    public PassageMap withoutFiles(Collection<String> paths) {
        if (paths == null || paths.isEmpty()) {
            return this;
        }
        Set<String> removed = new HashSet<>(paths);
        Map<String, List<String>> copy = new LinkedHashMap<>(entries);
        boolean changed = copy.keySet().removeAll(removed);
        return changed ? of(copy) : this;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof PassageMap that && entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "PassageMap" + entries;
    }
}
