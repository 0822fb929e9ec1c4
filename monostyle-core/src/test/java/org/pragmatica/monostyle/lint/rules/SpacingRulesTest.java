package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.DiagnosticSeverity;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.monostyle.lint.rules.RuleFixtures.check;
import static org.pragmatica.monostyle.lint.rules.RuleFixtures.format;
import static org.pragmatica.monostyle.lint.rules.RuleFixtures.inMethod;

class SpacingRulesTest {

    @Test
    void callSpacing_insertsSpaceBeforeParenthesis() {
        var code = inMethod("method(a);");

        assertThat(check(code, "MONO-SPC-01")).singleElement()
                                              .satisfies(diagnostic -> {
                                                  assertThat(diagnostic.severity()).isEqualTo(DiagnosticSeverity.WARNING);
                                                  assertThat(diagnostic.line()).isEqualTo(4);
                                                  assertThat(diagnostic.isFixable()).isTrue();
                                              });
        assertThat(format(code, "MONO-SPC-01")).contains("\t\tmethod (a);");
    }

    @Test
    void callSpacing_appliesToDeclaredParameterLists() {
        var code = "class Sample {\n\tvoid Run(int a)\n\t{\n\t}\n}\n";

        assertThat(format(code, "MONO-SPC-01")).contains("void Run (int a)");
    }

    @Test
    void callSpacing_leavesGapWithCommentAlone() {
        var code = inMethod("method /* note */(a);");

        assertThat(check(code, "MONO-SPC-01")).isEmpty();
    }

    @Test
    void indexerSpacing_insertsSpaceBeforeBracket() {
        assertThat(format(inMethod("var x = array[10];"), "MONO-SPC-02")).contains("var x = array [10];");
    }

    @Test
    void innerSpacing_removesSpaceInsideDelimiters() {
        assertThat(format(inMethod("call ( a, b );"), "MONO-SPC-03")).contains("call (a, b);");
    }

    @Test
    void genericSpacing_joinsNameAndAngle() {
        assertThat(format(inMethod("var list = new List <int> ();"), "MONO-SPC-04")).contains("new List<int> ()");
    }

    @Test
    void commaSpacing_addsSpaceAfterComma() {
        var code = inMethod("var map = new Dictionary<UserId,User> ();");

        assertThat(format(code, "MONO-SPC-05")).contains("Dictionary<UserId, User>");
    }

    @Test
    void commaSpacing_ignoresRankSpecifiers() {
        assertThat(check(inMethod("int[,] grid = null;"), "MONO-SPC-05")).isEmpty();
    }

    @Test
    void operatorSpacing_surroundsBinaryOperators() {
        assertThat(format(inMethod("x=a+b;"), "MONO-SPC-06")).contains("\t\tx = a + b;");
    }

    @Test
    void operatorSpacing_leavesUnaryMinusAlone() {
        assertThat(check(inMethod("x = -1;"), "MONO-SPC-06")).isEmpty();
    }

    @Test
    void controlKeywordSpacing_separatesKeywordAndParenthesis() {
        var code = inMethod("if(ready) {\n}\nwhile(true) {\n}");

        assertThat(check(code, "MONO-SPC-07")).hasSize(2);
        assertThat(format(code, "MONO-SPC-07")).contains("if (ready) {")
                                               .contains("while (true) {");
    }

    @Test
    void semicolonSpacing_removesSpaceBeforeSemicolon() {
        assertThat(format(inMethod("call () ;"), "MONO-SPC-08")).contains("\t\tcall ();\n");
    }

    @Test
    void semicolonSpacing_keepsEmptyForHeaders() {
        assertThat(check(inMethod("for (; ;) {\n}"), "MONO-SPC-08")).isEmpty();
    }

    @Test
    void trailingWhitespace_isRemoved() {
        var code = "class Sample {   \n\tint x;\t\n}\n";

        assertThat(check(code, "MONO-SPC-09")).extracting(Diagnostic::line)
                                              .containsExactly(1, 2);
        assertThat(format(code, "MONO-SPC-09")).isEqualTo("class Sample {\n\tint x;\n}\n");
    }

    @Test
    void trailingWhitespace_keepsVerbatimStringContent() {
        var code = "class Sample {\n\tstring s = @\"line   \nnext\";\n}\n";

        assertThat(check(code, "MONO-SPC-09")).isEmpty();
    }
}
