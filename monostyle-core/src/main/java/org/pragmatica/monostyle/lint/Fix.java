package org.pragmatica.monostyle.lint;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Atomic group of non-overlapping edits: the merger applies all of them or none.
 */
public record Fix(List<Edit> edits) {
    public Fix {
        var sorted = new ArrayList<>(edits);
        sorted.sort(Comparator.comparingInt(Edit::start)
                              .thenComparingInt(Edit::end));
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i - 1)
                      .conflictsWith(sorted.get(i))) {
                throw new IllegalArgumentException("Overlapping edits in one fix: " + sorted.get(i - 1) + ", " + sorted.get(i));
            }
        }
        if (sorted.isEmpty()) {
            throw new IllegalArgumentException("A fix needs at least one edit");
        }
        edits = List.copyOf(sorted);
    }

    public static Fix fix(Edit... edits) {
        return new Fix(List.of(edits));
    }

    public static Fix fix(List<Edit> edits) {
        return new Fix(edits);
    }

    public int start() {
        return edits.get(0)
                    .start();
    }

    public int end() {
        return edits.stream()
                    .mapToInt(Edit::end)
                    .max()
                    .orElse(start());
    }
}
