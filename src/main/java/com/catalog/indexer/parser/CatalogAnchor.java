package com.catalog.indexer.parser;

import java.util.regex.Pattern;

/**
 * Structural anchors recognised in trimmed catalog lines.
 */
public enum CatalogAnchor {

    CCN_HEADER("CCN.*Course Number", Pattern.CASE_INSENSITIVE),
    COURSES_SECTION_BREAK("^Courses", Pattern.CASE_INSENSITIVE),
    PROGRAM_OUTCOMES("^Program Outcomes$", Pattern.CASE_INSENSITIVE),
    SCHOOL_OF("^School of ", Pattern.CASE_INSENSITIVE),
    COLLEGE_HEADING("^(College of |School of )", Pattern.CASE_INSENSITIVE),
    FOOTER_COPYRIGHT("©", 0),
    FOOTER_TOTAL_CUS("Total CUs", Pattern.CASE_INSENSITIVE);

    private final Pattern pattern;

    CatalogAnchor(String regex, int flags) {
        this.pattern = Pattern.compile(regex, flags | Pattern.UNICODE_CHARACTER_CLASS);
    }

    /** Anchor occurs anywhere in the line. */
    public boolean foundIn(String line) {
        return pattern.matcher(line).find();
    }

    /** Anchor matches at the start of the line. */
    public boolean startsLine(String line) {
        return pattern.matcher(line).lookingAt();
    }

    public static boolean isFooter(String line) {
        return FOOTER_COPYRIGHT.foundIn(line) || FOOTER_TOTAL_CUS.foundIn(line);
    }

    public static boolean isCcnHeader(String line) {
        return CCN_HEADER.foundIn(line);
    }
}
