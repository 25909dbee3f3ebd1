package com.catalog.indexer.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical degree names per college for one catalog date, in canonical college order.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DegreeSnapshot {

    public static final String CERTIFICATES_BUCKET = "Certificates - Standard Paths";

    String catalogDate;
    String snapshotVersion;
    Map<String, List<String>> colleges;

    public static DegreeSnapshot of(String catalogDate, String snapshotVersion,
                                    Map<String, List<String>> orderedColleges) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        orderedColleges.forEach((college, degrees) -> copy.put(college, List.copyOf(degrees)));
        return new DegreeSnapshot(catalogDate, snapshotVersion, Collections.unmodifiableMap(copy));
    }

    public boolean hasCertificatesBucket() {
        return colleges.containsKey(CERTIFICATES_BUCKET);
    }
}
