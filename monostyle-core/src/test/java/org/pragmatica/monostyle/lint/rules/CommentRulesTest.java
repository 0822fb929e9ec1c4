package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.DiagnosticSeverity;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.monostyle.lint.rules.RuleFixtures.check;
import static org.pragmatica.monostyle.lint.rules.RuleFixtures.format;
import static org.pragmatica.monostyle.lint.rules.RuleFixtures.inMethod;

class CommentRulesTest {

    @Test
    void commentMarker_getsSingleSpace() {
        var code = inMethod("//comment without space\nRun ();\n//   too many spaces\nRun ();");

        assertThat(check(code, "MONO-CMT-01")).hasSize(2);
        assertThat(format(code, "MONO-CMT-01")).contains("\t\t// comment without space\n")
                                               .contains("\t\t// too many spaces\n");
    }

    @Test
    void separatorLines_andDocComments_areAccepted() {
        var code = "//////////////////\n/// <summary>\n///   Indented doc text.\n/// </summary>\nclass Sample {\n}\n";

        assertThat(check(code, "MONO-CMT-01")).isEmpty();
    }

    @Test
    void comments_shouldBeSentences() {
        var code = inMethod("// this is lowercase text.\nRun ();\n// Missing final punctuation here\nRun ();");

        assertThat(check(code, "MONO-CMT-02")).extracting(Diagnostic::message)
                                              .containsExactly("Comment should start with an upper case letter",
                                                               "Comment should end with punctuation");
        assertThat(check(code, "MONO-CMT-02")).allMatch(diagnostic -> diagnostic.severity() == DiagnosticSeverity.ADVISORY)
                                              .noneMatch(Diagnostic::isFixable);
    }

    @Test
    void markerAndShortComments_areNotSentenceChecked() {
        var code = inMethod("// TODO: handle the empty case\nRun ();\n// short note\nRun ();\n// Keeps the cache warm.\nRun ();");

        assertThat(check(code, "MONO-CMT-02")).isEmpty();
    }

    @Test
    void paraphrasingComment_isReported() {
        var code = inMethod("// increment the counter\ncounter++;");

        assertThat(check(code, "MONO-CMT-03")).singleElement()
                                              .satisfies(diagnostic -> {
                                                  assertThat(diagnostic.severity()).isEqualTo(DiagnosticSeverity.ADVISORY);
                                                  assertThat(diagnostic.line()).isEqualTo(4);
                                              });
    }

    @Test
    void explanatoryComment_isAccepted() {
        var code = inMethod("// Retries may wrap around after overflow.\ncounter++;");

        assertThat(check(code, "MONO-CMT-03")).isEmpty();
    }
}
