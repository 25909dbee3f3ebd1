package com.catalog.indexer.aggregate;

import com.catalog.indexer.model.ClassifiedCourseRow;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only course index keyed by course code, codes in first-seen order.
 * Only {@link CourseIndexAggregator} can build one.
 */
public final class CourseIndex {

    private final Map<String, CourseIndexEntry> entries;

    private CourseIndex(Map<String, CourseIndexEntry> entries) {
        this.entries = entries;
    }

    public Optional<CourseIndexEntry> get(String code) {
        return Optional.ofNullable(entries.get(code));
    }

    public Set<String> codes() {
        return entries.keySet();
    }

    public Collection<CourseIndexEntry> entries() {
        return entries.values();
    }

    public Map<String, CourseIndexEntry> asMap() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    static final class Builder {

        private final Map<String, Accumulator> byCode = new LinkedHashMap<>();

        /**
         * Records a sighting; the first sighting of a code fixes its canonical title and credit units.
         */
        void upsert(ClassifiedCourseRow row, CourseInstance instance) {
            String code = row.code().orElseThrow(() ->
                    new IllegalArgumentException("Row has no course code: " + row.getRawLine()));
            byCode.computeIfAbsent(code, c -> new Accumulator(row.getTitle(), row.getCreditUnits()))
                    .instances.add(instance);
        }

        CourseIndex build() {
            Map<String, CourseIndexEntry> frozen = new LinkedHashMap<>();
            byCode.forEach((code, acc) -> frozen.put(code,
                    new CourseIndexEntry(code, acc.title, acc.creditUnits, List.copyOf(acc.instances))));
            return new CourseIndex(Collections.unmodifiableMap(frozen));
        }
    }

    private static final class Accumulator {
        private final String title;
        private final int creditUnits;
        private final List<CourseInstance> instances = new ArrayList<>();

        private Accumulator(String title, int creditUnits) {
            this.title = title;
            this.creditUnits = creditUnits;
        }
    }
}
