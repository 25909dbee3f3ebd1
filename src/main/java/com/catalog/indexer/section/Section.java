package com.catalog.indexer.section;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * Half-open line interval {@code [startLine, stopLine)} holding one degree's course
 * listing. {@code startLine} is the CCN header that opens the listing.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Section {

    @NonNull
    String catalogDate;

    @NonNull
    String college;

    @NonNull
    String degreeName;

    int startLine;
    int stopLine;

    /**
     * @throws IllegalArgumentException unless {@code 0 <= start < stop <= lineCount}
     */
    public static Section of(String catalogDate, String college, String degreeName,
                             int startLine, int stopLine, int lineCount) {
        if (startLine < 0 || startLine >= stopLine || stopLine > lineCount) {
            throw new IllegalArgumentException(String.format(
                    "Invalid section [%d, %d) for '%s' in %s (%d lines)",
                    startLine, stopLine, degreeName, catalogDate, lineCount));
        }
        return new Section(catalogDate, college, degreeName, startLine, stopLine);
    }

    public int length() {
        return stopLine - startLine;
    }
}
