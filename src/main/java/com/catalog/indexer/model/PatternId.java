package com.catalog.indexer.model;

import java.util.regex.Pattern;

/**
 * Known course-row layouts, declared in match priority order.
 */
public enum PatternId {

    /**
     * {@code DEPT NUMBER CODE TITLE CUS TERM}, e.g. {@code BUS 1010 C100 Intro to Business 3 1}.
     */
    CCN_FULL("^([A-Z]{2,5})\\s+(\\d{1,4})\\s+([A-Z0-9]{2,5})\\s+(.+?)\\s+(\\d+)\\s+(\\d+)$"),

    /**
     * {@code CODE TITLE CUS TERM}; later catalogs dropped department and number.
     */
    CODE_ONLY("^([A-Z0-9]{1,6})\\s+(.+?)\\s+(\\d+)\\s+(\\d+)$"),

    /**
     * {@code TITLE CUS TERM} with no extractable code.
     */
    FALLBACK("^(.+?)\\s+(\\d+)\\s+(\\d+)$");

    private final Pattern pattern;

    PatternId(String regex) {
        this.pattern = Pattern.compile(regex, Pattern.UNICODE_CHARACTER_CLASS);
    }

    public Pattern getPattern() {
        return pattern;
    }
}
