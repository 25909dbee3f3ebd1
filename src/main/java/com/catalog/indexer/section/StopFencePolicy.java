package com.catalog.indexer.section;

/**
 * Which lines close a heading-driven section, in addition to footer anchors.
 * <p>
 * Two historical variants of the parser disagreed here. {@link #SIBLING_OR_COLLEGE}
 * is the default; {@link #SIBLING_ONLY} reproduces the looser variant that lets a
 * section run across a college heading until a sibling degree or footer appears.
 */
public enum StopFencePolicy {

    SIBLING_OR_COLLEGE(true),
    SIBLING_ONLY(false);

    private final boolean stopsOnCollege;

    StopFencePolicy(boolean stopsOnCollege) {
        this.stopsOnCollege = stopsOnCollege;
    }

    public boolean stopsOnCollege() {
        return stopsOnCollege;
    }
}
