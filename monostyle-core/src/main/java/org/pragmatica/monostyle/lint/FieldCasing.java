package org.pragmatica.monostyle.lint;

/**
 * Accepted casing for instance fields.
 */
public enum FieldCasing {
    /** Lower case words joined by underscores, e.g. {@code max_count}. */
    SEPARATOR,
    /** Camel case, e.g. {@code maxCount}. */
    CAMEL
}
