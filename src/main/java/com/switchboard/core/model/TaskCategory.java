package com.switchboard.core.model;

import java.util.Locale;

/**
 * Model family best suited to answer a fast-path request.
 */
public enum TaskCategory {
    SIMPLE_TEXT("simple_text"),
    GENERAL_TEXT("general_text"),
    MATH_REASONING("math_reasoning"),
    PROGRAMMING("programming"),
    CREATIVE("creative"),
    VISION("vision"),
    UNKNOWN("unknown");

    private final String wireName;

    TaskCategory(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a category from either its wire name ({@code "math_reasoning"})
     * or its enum name ({@code "MATH_REASONING"}).
     *
     * @return the category, or {@link #UNKNOWN} for null/unrecognized input
     */
    public static TaskCategory fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (TaskCategory category : values()) {
            if (category.wireName.equals(normalized)) {
                return category;
            }
        }
        return UNKNOWN;
    }
}
