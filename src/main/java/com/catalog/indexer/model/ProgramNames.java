package com.catalog.indexer.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Degree names listed in a catalog's front matter, grouped by the college heading
 * they appeared under. Both colleges and degrees keep document order.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ProgramNames {

    String catalogDate;
    Map<String, List<String>> byCollege;

    public static ProgramNames of(String catalogDate, Map<String, List<String>> byCollege) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        byCollege.forEach((college, degrees) -> copy.put(college, List.copyOf(degrees)));
        return new ProgramNames(catalogDate, Collections.unmodifiableMap(copy));
    }

    public static ProgramNames empty(String catalogDate) {
        return new ProgramNames(catalogDate, Map.of());
    }

    public boolean isEmpty() {
        return byCollege.isEmpty();
    }

    public Set<String> colleges() {
        return byCollege.keySet();
    }

    public List<String> degreesOf(String college) {
        return byCollege.getOrDefault(college, List.of());
    }

    public boolean isCollege(String line) {
        return byCollege.containsKey(line);
    }

    public int degreeCount() {
        return byCollege.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Accumulates degree names per college while a document is scanned.
     */
    public static class Builder {
        private final String catalogDate;
        private final Map<String, List<String>> byCollege = new LinkedHashMap<>();

        public Builder(String catalogDate) {
            this.catalogDate = catalogDate;
        }

        public Builder addAll(String college, List<String> degrees) {
            byCollege.computeIfAbsent(college, c -> new ArrayList<>()).addAll(degrees);
            return this;
        }

        public ProgramNames build() {
            return ProgramNames.of(catalogDate, byCollege);
        }
    }
}
