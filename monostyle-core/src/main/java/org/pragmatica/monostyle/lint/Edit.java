package org.pragmatica.monostyle.lint;

/**
 * Replacement of the half-open character range {@code [start, end)} with new text.
 * An insertion has {@code start == end}.
 */
public record Edit(int start, int end, String replacement) {
    public Edit {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid edit range [" + start + ", " + end + ")");
        }
    }

    public static Edit edit(int start, int end, String replacement) {
        return new Edit(start, end, replacement);
    }

    public static Edit insert(int offset, String text) {
        return new Edit(offset, offset, text);
    }

    public static Edit delete(int start, int end) {
        return new Edit(start, end, "");
    }

    public boolean isInsertion() {
        return start == end;
    }

    /**
     * Two edits conflict when their ranges intersect, or when both touch the same insertion point
     * with different effects. Identical edits never conflict.
     */
    public boolean conflictsWith(Edit other) {
        if (equals(other)) {
            return false;
        }
        if (start < other.end && other.start < end) {
            return true;
        }
        return start == other.start && (isInsertion() || other.isInsertion());
    }

    /**
     * Apply this edit alone to the text.
     */
    public String applyTo(String text) {
        return text.substring(0, start) + replacement + text.substring(end);
    }
}
