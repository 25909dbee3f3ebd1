package com.catalog.indexer.snapshot;

import com.catalog.indexer.exception.NoApplicableSnapshotException;
import com.catalog.indexer.model.SnapshotSet;

import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * Picks the snapshot that applies to a catalog date: the greatest version that is
 * not after the date. Versions are {@code YYYY-MM}, so string order is date order.
 */
@UtilityClass
public class SnapshotResolver {

    public static List<String> pickSnapshot(String catalogDate, SnapshotSet snapshots) {
        return snapshots.get(pickSnapshotVersion(catalogDate, snapshots));
    }

    public static String pickSnapshotVersion(String catalogDate, SnapshotSet snapshots) {
        String version = snapshots.getVersions().floorKey(catalogDate);
        if (version == null) {
            throw new NoApplicableSnapshotException(catalogDate);
        }
        return version;
    }
}
