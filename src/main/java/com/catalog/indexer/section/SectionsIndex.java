package com.catalog.indexer.section;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only {@code date -> college -> degree -> Section} index in insertion order.
 * Only {@link SectionIndexer} can build one.
 */
public final class SectionsIndex {

    private final Map<String, Map<String, Map<String, Section>>> byDate;

    private SectionsIndex(Map<String, Map<String, Map<String, Section>>> byDate) {
        this.byDate = byDate;
    }

    public Set<String> dates() {
        return byDate.keySet();
    }

    public Map<String, Map<String, Section>> collegesOf(String catalogDate) {
        return byDate.getOrDefault(catalogDate, Map.of());
    }

    public Optional<Section> find(String catalogDate, String college, String degreeName) {
        return Optional.ofNullable(collegesOf(catalogDate).getOrDefault(college, Map.of()).get(degreeName));
    }

    /**
     * All sections of one date, colleges and degrees in insertion order.
     */
    public List<Section> sectionsOf(String catalogDate) {
        List<Section> result = new ArrayList<>();
        collegesOf(catalogDate).values().forEach(degrees -> result.addAll(degrees.values()));
        return result;
    }

    public int size() {
        return byDate.keySet().stream().mapToInt(d -> sectionsOf(d).size()).sum();
    }

    static final class Builder {
        private final Map<String, Map<String, Map<String, Section>>> byDate = new LinkedHashMap<>();
        private boolean built;

        void date(String catalogDate) {
            checkOpen();
            byDate.computeIfAbsent(catalogDate, d -> new LinkedHashMap<>());
        }

        void college(String catalogDate, String college) {
            checkOpen();
            byDate.computeIfAbsent(catalogDate, d -> new LinkedHashMap<>())
                    .computeIfAbsent(college, c -> new LinkedHashMap<>());
        }

        void put(Section section) {
            college(section.getCatalogDate(), section.getCollege());
            byDate.get(section.getCatalogDate()).get(section.getCollege()).put(section.getDegreeName(), section);
        }

        SectionsIndex build() {
            built = true;
            Map<String, Map<String, Map<String, Section>>> frozen = new LinkedHashMap<>();
            byDate.forEach((date, colleges) -> {
                Map<String, Map<String, Section>> c = new LinkedHashMap<>();
                colleges.forEach((college, degrees) ->
                        c.put(college, Collections.unmodifiableMap(new LinkedHashMap<>(degrees))));
                frozen.put(date, Collections.unmodifiableMap(c));
            });
            return new SectionsIndex(Collections.unmodifiableMap(frozen));
        }

        private void checkOpen() {
            if (built) {
                throw new IllegalStateException("SectionsIndex already built");
            }
        }
    }
}
