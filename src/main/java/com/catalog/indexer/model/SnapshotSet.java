package com.catalog.indexer.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Versioned college lists keyed by {@code YYYY-MM}. Used both for the valid-college
 * lists and for the canonical college ordering.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SnapshotSet {

    NavigableMap<String, List<String>> versions;

    public static SnapshotSet of(Map<String, List<String>> byVersion) {
        TreeMap<String, List<String>> copy = new TreeMap<>();
        byVersion.forEach((version, colleges) -> copy.put(version, List.copyOf(colleges)));
        return new SnapshotSet(Collections.unmodifiableNavigableMap(copy));
    }

    public boolean isEmpty() {
        return versions.isEmpty();
    }

    public List<String> get(String version) {
        return versions.get(version);
    }
}
