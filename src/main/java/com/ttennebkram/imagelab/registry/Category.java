package com.ttennebkram.imagelab.registry;

import com.ttennebkram.imagelab.errors.UnknownOperationException;

import java.util.Locale;

/**
 * Operation categories, in menu order.
 */
public enum Category {
    COLOR("Color Conversion"),
    GEOMETRIC("Transformations"),
    FILTER("Filtering"),
    MORPHOLOGY("Morphology"),
    ENHANCEMENT("Enhancement"),
    EDGE("Edge Detection"),
    BITWISE("Bitwise"),
    COMPRESSION("Compression");

    private final String displayName;

    Category(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Parse either the enum name or the display name, ignoring case.
     */
    public static Category fromName(String name) {
        if (name != null) {
            String trimmed = name.trim();
            for (Category category : values()) {
                if (category.name().equalsIgnoreCase(trimmed)
                        || category.displayName.equalsIgnoreCase(trimmed)) {
                    return category;
                }
            }
            // "Filter" / "Edge" style singular or plural forms
            String upper = trimmed.toUpperCase(Locale.ROOT);
            for (Category category : values()) {
                if (upper.startsWith(category.name()) || category.name().startsWith(upper) && upper.length() >= 4) {
                    return category;
                }
            }
        }
        throw new UnknownOperationException("Unknown category: " + name);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
