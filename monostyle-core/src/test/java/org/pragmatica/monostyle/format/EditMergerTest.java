package org.pragmatica.monostyle.format;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.DiagnosticSeverity;
import org.pragmatica.monostyle.lint.Edit;
import org.pragmatica.monostyle.lint.Fix;
import org.pragmatica.monostyle.lint.RuleCategory;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EditMergerTest {

    private static final String TEXT = "abcdef";

    @Test
    void apply_rewritesAllNonOverlappingEdits() {
        var fix = diagnostic("MONO-SPC-01", RuleCategory.SPACING, Edit.edit(0, 1, "A"), Edit.edit(5, 6, "F"));
        var insert = diagnostic("MONO-BRC-01", RuleCategory.BRACES, Edit.insert(3, "-"));

        var result = merge(List.of(fix, insert));

        assertThat(result.text()).isEqualTo("Abc-deF");
        assertThat(result.applied()).hasSize(2);
        assertThat(result.skipped()).isEmpty();
    }

    @Test
    void apply_overlappingEdits_higherPrecedenceCategoryWins() {
        var naming = diagnostic("MONO-NAM-02", RuleCategory.NAMING, Edit.edit(1, 3, "X"));
        var spacing = diagnostic("MONO-SPC-06", RuleCategory.SPACING, Edit.edit(2, 4, "Y"));

        var result = merge(List.of(naming, spacing));

        assertThat(result.text()).isEqualTo("abYef");
        assertThat(result.applied()).containsExactly(spacing);
        assertThat(result.skipped()).singleElement()
                                    .satisfies(skip -> {
                                        assertThat(skip.diagnostic()).isEqualTo(naming);
                                        assertThat(skip.reason()).isEqualTo(SkipReason.CONFLICTING_EDIT);
                                    });
    }

    @Test
    void apply_customPrecedence_changesWinner() {
        var naming = diagnostic("MONO-NAM-02", RuleCategory.NAMING, Edit.edit(1, 3, "X"));
        var spacing = diagnostic("MONO-SPC-06", RuleCategory.SPACING, Edit.edit(2, 4, "Y"));

        var result = EditMerger.apply(TEXT,
                                      List.of(naming, spacing),
                                      List.of(RuleCategory.NAMING, RuleCategory.SPACING),
                                      List.of());

        assertThat(result.text()).isEqualTo("aXdef");
    }

    @Test
    void apply_differentInsertionsAtSameOffset_conflict() {
        var first = diagnostic("MONO-SPC-01", RuleCategory.SPACING, Edit.insert(3, " "));
        var second = diagnostic("MONO-BRC-04", RuleCategory.BRACES, Edit.insert(3, "\n"));

        var result = merge(List.of(second, first));

        assertThat(result.text()).isEqualTo("abc def");
        assertThat(result.skippedFor(SkipReason.CONFLICTING_EDIT)).isEqualTo(1);
    }

    @Test
    void apply_identicalEditsFromTwoRules_areAppliedOnce() {
        var first = diagnostic("MONO-SPC-01", RuleCategory.SPACING, Edit.insert(3, " "));
        var second = diagnostic("MONO-SPC-07", RuleCategory.SPACING, Edit.insert(3, " "));

        var result = merge(List.of(first, second));

        assertThat(result.text()).isEqualTo("abc def");
        assertThat(result.applied()).hasSize(2);
    }

    @Test
    void apply_fixesReachingErrorRegion_areSkipped() {
        var before = diagnostic("MONO-SPC-01", RuleCategory.SPACING, Edit.edit(0, 1, "A"));
        var straddling = diagnostic("MONO-SPC-06", RuleCategory.SPACING, Edit.edit(2, 4, "Y"));
        var inside = diagnostic("MONO-SPC-09", RuleCategory.SPACING, Edit.edit(4, 5, "E"));

        var result = EditMerger.apply(TEXT,
                                      List.of(before, straddling, inside),
                                      RuleCategory.DEFAULT_PRECEDENCE,
                                      List.of(3));

        assertThat(result.text()).isEqualTo("Abcdef");
        assertThat(result.skippedFor(SkipReason.STRUCTURAL_REGION)).isEqualTo(2);
    }

    @Test
    void apply_ignoresDiagnosticsWithoutFix() {
        var advisory = Diagnostic.diagnostic("MONO-CMT-02",
                                             DiagnosticSeverity.ADVISORY,
                                             RuleCategory.COMMENTS,
                                             "Sample.cs",
                                             0,
                                             1,
                                             1,
                                             1,
                                             "Comment should end with punctuation");

        var result = merge(List.of(advisory));

        assertThat(result.changed()).isFalse();
        assertThat(result.text()).isEqualTo(TEXT);
    }

    private static MergeResult merge(List<Diagnostic> diagnostics) {
        return EditMerger.apply(TEXT, diagnostics, RuleCategory.DEFAULT_PRECEDENCE, List.of());
    }

    private static Diagnostic diagnostic(String ruleId, RuleCategory category, Edit... edits) {
        return Diagnostic.diagnostic(ruleId,
                                     DiagnosticSeverity.WARNING,
                                     category,
                                     "Sample.cs",
                                     edits[0].start(),
                                     edits[0].end(),
                                     1,
                                     edits[0].start() + 1,
                                     "test finding")
                         .withFix(Fix.fix(edits));
    }
}
