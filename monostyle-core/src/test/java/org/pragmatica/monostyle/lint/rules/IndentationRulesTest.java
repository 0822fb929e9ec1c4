package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.monostyle.lint.rules.RuleFixtures.check;
import static org.pragmatica.monostyle.lint.rules.RuleFixtures.format;
import static org.pragmatica.monostyle.lint.rules.RuleFixtures.inMethod;

class IndentationRulesTest {

    @Test
    void caseLabels_alignWithSwitch() {
        var code = inMethod("switch (x) {\n\tcase 1:\n\t\tbreak;\n\tdefault:\n\t\tbreak;\n}");

        assertThat(check(code, "MONO-IND-01")).extracting(Diagnostic::line)
                                              .containsExactly(5, 7);
        assertThat(format(code, "MONO-IND-01")).contains("\t\tswitch (x) {\n\t\tcase 1:\n\t\t\tbreak;\n\t\tdefault:\n");
    }

    @Test
    void caseLabels_bracedSectionMovesWithLabel() {
        var code = inMethod("switch (x) {\n\tcase 1: {\n\t\tbreak;\n\t}\n\tdefault:\n\t\treturn;\n}");

        assertThat(format(code, "MONO-IND-01"))
                .contains("\t\tswitch (x) {\n\t\tcase 1: {\n\t\t\tbreak;\n\t\t}\n\t\tdefault:\n\t\t\treturn;\n\t\t}\n");
    }

    @Test
    void caseLabels_fixIsOneAtomicEditGroupPerSection() {
        var code = inMethod("switch (x) {\n\tcase 1:\n\t\tFirst ();\n\t\tbreak;\n}");

        assertThat(check(code, "MONO-IND-01")).singleElement()
                                              .satisfies(diagnostic -> assertThat(diagnostic.fix()).hasValueSatisfying(fix -> assertThat(fix.edits()).hasSize(3)));
    }

    @Test
    void caseLabels_alreadyAligned_areAccepted() {
        assertThat(check(inMethod("switch (x) {\ncase 1:\n\tbreak;\n}"), "MONO-IND-01")).isEmpty();
    }

    @Test
    void wrappedParameters_areIndentedTwoLevels() {
        var code = "class Sample {\n\tvoid Run (int first,\n\t\tint second)\n\t{\n\t}\n}\n";

        assertThat(check(code, "MONO-IND-02")).hasSize(1);
        assertThat(format(code, "MONO-IND-02")).contains("\tvoid Run (int first,\n\t\t\tint second)\n");
    }

    @Test
    void parametersOnOneLine_areNotReindented() {
        assertThat(check("class Sample {\n\tvoid Run (int first, int second)\n\t{\n\t}\n}\n", "MONO-IND-02")).isEmpty();
    }

    @Test
    void wrappedCondition_movesLeadingOperatorToPreviousLine() {
        var code = inMethod("if (first\n\t&& second) {\n}");

        assertThat(check(code, "MONO-IND-03")).extracting(Diagnostic::message)
                                              .containsExactly("Boolean operator '&&' should end the previous line");
        assertThat(format(code, "MONO-IND-03")).contains("\t\tif (first &&\n\t\t\t\tsecond) {\n");
    }

    @Test
    void wrappedCondition_continuationIsIndentedTwoLevels() {
        var code = inMethod("while (first &&\n\tsecond) {\n}");

        assertThat(format(code, "MONO-IND-03")).contains("\t\twhile (first &&\n\t\t\t\tsecond) {\n");
    }

    @Test
    void chainContinuation_isIndentedOneLevelPastReceiver() {
        var code = inMethod("var x = items\n.Where (p)\n.First ();");

        assertThat(check(code, "MONO-IND-04")).hasSize(2);
        assertThat(format(code, "MONO-IND-04")).contains("\t\tvar x = items\n\t\t\t.Where (p)\n\t\t\t.First ();\n");
    }
}
