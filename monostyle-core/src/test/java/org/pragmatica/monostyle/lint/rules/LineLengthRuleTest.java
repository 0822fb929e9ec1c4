package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.DiagnosticSeverity;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.monostyle.lint.rules.RuleFixtures.check;
import static org.pragmatica.monostyle.lint.rules.RuleFixtures.format;
import static org.pragmatica.monostyle.lint.rules.RuleFixtures.inMethod;
import static org.pragmatica.monostyle.lint.rules.RuleFixtures.only;

class LineLengthRuleTest {

    private static final String LONG_CALL = inMethod(
            "Console.WriteLine (first_argument_value, second_argument_value, third_value);");

    @Test
    void longCall_isReportedWithWidthAndWrapped() {
        assertThat(check(LONG_CALL, "MONO-LEN-01")).singleElement()
                                                   .satisfies(diagnostic -> {
                                                       assertThat(diagnostic.severity()).isEqualTo(DiagnosticSeverity.WARNING);
                                                       assertThat(diagnostic.message()).isEqualTo("Line is 93 columns long, limit is 80");
                                                       assertThat(diagnostic.isFixable()).isTrue();
                                                   });
        assertThat(format(LONG_CALL, "MONO-LEN-01")).contains("\t\tConsole.WriteLine (first_argument_value,\n"
                                                              + "\t\t\t\tsecond_argument_value,\n"
                                                              + "\t\t\t\tthird_value);\n");
    }

    @Test
    void longComment_isAdvisoryOnly() {
        var code = inMethod("// " + "This comment keeps going well past the configured limit of the line width.");

        assertThat(check(code, "MONO-LEN-01")).singleElement()
                                              .satisfies(diagnostic -> {
                                                  assertThat(diagnostic.severity()).isEqualTo(DiagnosticSeverity.ADVISORY);
                                                  assertThat(diagnostic.isFixable()).isFalse();
                                              });
    }

    @Test
    void widerLimit_acceptsLongLine() {
        assertThat(check(LONG_CALL, only("MONO-LEN-01").withMaxLineLength(120))).isEmpty();
    }

    @Test
    void tabWidth_countsTowardsLineWidth() {
        var config = only("MONO-LEN-01").withTabWidth(4);

        assertThat(check(LONG_CALL, config)).extracting(Diagnostic::message)
                                            .containsExactly("Line is 85 columns long, limit is 80");
    }

    @Test
    void structuralProblems_areAlwaysReportedAsErrors() {
        assertThat(check("class A {\n", "MONO-LEN-01")).singleElement()
                                                      .satisfies(diagnostic -> {
                                                          assertThat(diagnostic.ruleId()).isEqualTo("MONO-STR-01");
                                                          assertThat(diagnostic.severity()).isEqualTo(DiagnosticSeverity.ERROR);
                                                          assertThat(diagnostic.isFixable()).isFalse();
                                                      });
    }

    @Test
    void unterminatedString_isReportedAsMalformedToken() {
        var code = "class A {\n\tstring s = \"abc;\n}\n";

        assertThat(check(code, "MONO-LEN-01")).extracting(Diagnostic::ruleId)
                                              .contains("MONO-STR-02");
    }
}
