package org.pragmatica.monostyle.format;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.Edit;
import org.pragmatica.monostyle.lint.RuleCategory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Resolves the fixes proposed by independent rules into one rewrite.
 *
 * <p>Fixes are considered by category precedence, then by start offset. A fix is accepted only when
 * none of its edits overlaps an edit accepted earlier; edits identical to an accepted one are applied
 * once. Fixes reaching into a malformed region are never applied. Accepted edits are applied in a
 * single left-to-right pass without re-parsing.
 */
public final class EditMerger {
    private EditMerger() {}

    public static MergeResult apply(String text,
                                    List<Diagnostic> diagnostics,
                                    List<RuleCategory> precedence,
                                    List<Integer> errorRegionStarts) {
        int protectedFrom = errorRegionStarts.stream()
                                             .mapToInt(Integer::intValue)
                                             .min()
                                             .orElse(Integer.MAX_VALUE);
        var ordered = diagnostics.stream()
                                 .filter(Diagnostic::isFixable)
                                 .sorted(Comparator.<Diagnostic> comparingInt(d -> rank(d.category(), precedence))
                                                   .thenComparingInt(d -> d.fix()
                                                                           .orElseThrow()
                                                                           .start())
                                                   .thenComparing(Diagnostic::ruleId))
                                 .toList();
        var accepted = new ArrayList<Edit>();
        var applied = new ArrayList<Diagnostic>();
        var skipped = new ArrayList<SkippedEdit>();
        for (var diagnostic : ordered) {
            var fix = diagnostic.fix()
                                .orElseThrow();
            if (fix.start() >= protectedFrom || fix.end() > protectedFrom) {
                skipped.add(new SkippedEdit(diagnostic, SkipReason.STRUCTURAL_REGION));
                continue;
            }
            if (fix.edits()
                   .stream()
                   .anyMatch(edit -> conflicts(edit, accepted))) {
                skipped.add(new SkippedEdit(diagnostic, SkipReason.CONFLICTING_EDIT));
                continue;
            }
            fix.edits()
               .stream()
               .filter(edit -> !accepted.contains(edit))
               .forEach(accepted::add);
            applied.add(diagnostic);
        }
        return new MergeResult(rewrite(text, accepted), applied, skipped);
    }

    private static int rank(RuleCategory category, List<RuleCategory> precedence) {
        int index = precedence.indexOf(category);
        return index < 0
               ? precedence.size()
               : index;
    }

    private static boolean conflicts(Edit edit, List<Edit> accepted) {
        return accepted.stream()
                       .anyMatch(edit::conflictsWith);
    }

    private static String rewrite(String text, List<Edit> edits) {
        if (edits.isEmpty()) {
            return text;
        }
        var sorted = new ArrayList<>(edits);
        sorted.sort(Comparator.comparingInt(Edit::start)
                              .thenComparingInt(Edit::end));
        var sb = new StringBuilder(text.length());
        int position = 0;
        for (var edit : sorted) {
            sb.append(text, position, edit.start())
              .append(edit.replacement());
            position = edit.end();
        }
        sb.append(text, position, text.length());
        return sb.toString();
    }
}
