package com.catalog.indexer.canon;

import com.catalog.indexer.exception.DuplicateCertificateException;
import com.catalog.indexer.exception.MissingCollegeException;
import com.catalog.indexer.model.DegreeSnapshot;
import com.catalog.indexer.model.DuplicatesMap;
import com.catalog.indexer.model.ProgramNames;
import com.catalog.indexer.model.SnapshotSet;
import com.catalog.indexer.snapshot.SnapshotResolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds the canonical degree snapshot of one catalog date.
 * <p>
 * Raw names are resolved through the duplicates map, sorted and deduplicated per
 * college, and emitted in the canonical college order of the applicable snapshot
 * version. Degrees listed under {@value DegreeSnapshot#CERTIFICATES_BUCKET} form an
 * optional trailing bucket that must not repeat a certificate already listed under
 * a subject college.
 */
public class DegreeCanonicalizer {

    private static final Logger log = LoggerFactory.getLogger(DegreeCanonicalizer.class);

    private static final String CERTIFICATE_MARKER = "Certificate";

    private final DuplicatesMap duplicates;
    private final SnapshotSet collegeOrder;

    public DegreeCanonicalizer(DuplicatesMap duplicates, SnapshotSet collegeOrder) {
        this.duplicates = duplicates;
        this.collegeOrder = collegeOrder;
    }

    /**
     * @throws DuplicateCertificateException if a certificate is both embedded and trailing
     * @throws MissingCollegeException       if a canonical college has no observed degrees
     */
    public DegreeSnapshot canonicalize(ProgramNames programNames) {
        String date = programNames.getCatalogDate();
        String version = SnapshotResolver.pickSnapshotVersion(date, collegeOrder);
        List<String> canonicalColleges = collegeOrder.get(version);

        Map<String, List<String>> resolved = new LinkedHashMap<>();
        Set<String> embeddedCertificates = new TreeSet<>();
        Set<String> trailingCertificates = new TreeSet<>();

        programNames.getByCollege().forEach((college, rawNames) -> {
            TreeSet<String> names = new TreeSet<>();
            rawNames.forEach(raw -> names.add(duplicates.resolve(raw)));

            if (DegreeSnapshot.CERTIFICATES_BUCKET.equals(college)) {
                trailingCertificates.addAll(names);
            } else {
                resolved.put(college, List.copyOf(names));
                names.stream().filter(n -> n.contains(CERTIFICATE_MARKER)).forEach(embeddedCertificates::add);
            }
        });

        if (!trailingCertificates.isEmpty()) {
            Set<String> overlap = new TreeSet<>(embeddedCertificates);
            overlap.retainAll(trailingCertificates);
            if (!overlap.isEmpty()) {
                throw new DuplicateCertificateException(date, overlap);
            }
            resolved.put(DegreeSnapshot.CERTIFICATES_BUCKET, List.copyOf(trailingCertificates));
        }

        Map<String, List<String>> ordered = new LinkedHashMap<>();
        for (String college : canonicalColleges) {
            if (resolved.containsKey(college)) {
                ordered.put(college, resolved.get(college));
            } else if (!DegreeSnapshot.CERTIFICATES_BUCKET.equals(college)) {
                throw new MissingCollegeException(date, college);
            }
        }

        resolved.keySet().stream()
                .filter(college -> !ordered.containsKey(college))
                .forEach(college -> log.warn("{}: college '{}' is not in canonical snapshot {}, dropped",
                        date, college, version));

        log.debug("{}: degree snapshot built against version {} ({} colleges)", date, version, ordered.size());
        return DegreeSnapshot.of(date, version, ordered);
    }
}
