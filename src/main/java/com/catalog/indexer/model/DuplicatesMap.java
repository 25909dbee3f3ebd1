package com.catalog.indexer.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw degree name to canonical degree name. Names without an entry resolve to themselves.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DuplicatesMap {

    Map<String, String> mapping;

    public static DuplicatesMap of(Map<String, String> mapping) {
        Map<String, String> copy = new LinkedHashMap<>();
        mapping.forEach((raw, resolved) -> copy.put(raw.strip(), resolved.strip()));
        return new DuplicatesMap(Map.copyOf(copy));
    }

    public String resolve(String rawName) {
        String key = rawName.strip();
        return mapping.getOrDefault(key, key).strip();
    }

    public int size() {
        return mapping.size();
    }
}
