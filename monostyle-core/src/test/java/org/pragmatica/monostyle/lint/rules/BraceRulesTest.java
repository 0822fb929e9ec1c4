package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.monostyle.lint.rules.RuleFixtures.check;
import static org.pragmatica.monostyle.lint.rules.RuleFixtures.format;
import static org.pragmatica.monostyle.lint.rules.RuleFixtures.inMethod;

class BraceRulesTest {

    @Test
    void typeBrace_movesToOwnLine_forConstrainedGenericType() {
        var code = "class Box<T> where T : class {\n}\n";

        assertThat(format(code, "MONO-BRC-01")).isEqualTo("class Box<T> where T : class\n{\n}\n");
    }

    @Test
    void typeBrace_staysOnHeaderLine_forPlainAndUnconstrainedTypes() {
        assertThat(format("class Plain\n{\n}\n", "MONO-BRC-01")).isEqualTo("class Plain {\n}\n");
        assertThat(format("class Box<T>\n{\n}\n", "MONO-BRC-01")).isEqualTo("class Box<T> {\n}\n");
        assertThat(format("namespace Demo\n{\n}\n", "MONO-BRC-01")).isEqualTo("namespace Demo {\n}\n");
    }

    @Test
    void typeBrace_acceptsConformingLayouts() {
        assertThat(check("class Box<T> where T : class\n{\n}\n", "MONO-BRC-01")).isEmpty();
        assertThat(check("class Box<T> {\n}\n", "MONO-BRC-01")).isEmpty();
    }

    @Test
    void methodBrace_movesToOwnLine_evenForGenericMethods() {
        var code = "class Sample {\n\tvoid Run () {\n\t}\n\tT Get<T> () where T : class {\n\t\treturn null;\n\t}\n}\n";

        assertThat(format(code, "MONO-BRC-02")).isEqualTo("class Sample {\n\tvoid Run ()\n\t{\n\t}\n"
                                                          + "\tT Get<T> () where T : class\n\t{\n\t\treturn null;\n\t}\n}\n");
    }

    @Test
    void propertyBrace_joinsHeaderLine() {
        var code = "class Sample {\n\tint Count\n\t{\n\t\tget { return 1; }\n\t}\n}\n";

        assertThat(format(code, "MONO-BRC-03")).contains("\tint Count {\n\t\tget { return 1; }\n");
    }

    @Test
    void blockBrace_joinsControlHeadersAndElse() {
        var code = inMethod("if (x)\n{\n\ta ();\n}\nelse\n{\n\tb ();\n}");

        assertThat(format(code, "MONO-BRC-04")).contains("\t\tif (x) {\n\t\t\ta ();\n\t\t} else {\n\t\t\tb ();\n\t\t}\n");
    }

    @Test
    void blockBrace_joinsLambdaBody() {
        var code = inMethod("Run (() =>\n{\n\tWork ();\n});");

        assertThat(format(code, "MONO-BRC-04")).contains("Run (() => {\n");
    }

    @Test
    void unbracedCondition_wrapsCompoundCondition() {
        var code = inMethod("if (a && b)\n\tc ();");

        assertThat(check(code, "MONO-BRC-05")).extracting(Diagnostic::ruleId)
                                              .containsExactly("MONO-BRC-05");
        assertThat(format(code, "MONO-BRC-05")).contains("\t\tif (a && b) {\n\t\t\tc ();\n\t\t}\n");
    }

    @Test
    void unbracedCondition_allowsSingleOneLineCondition() {
        assertThat(check(inMethod("if (a)\n\tc ();"), "MONO-BRC-05")).isEmpty();
    }

    @Test
    void nestedUnbracedCondition_isWrapped() {
        var code = inMethod("if (a)\n\tif (b)\n\t\tc ();");

        assertThat(check(code, "MONO-BRC-06")).hasSize(1);
        assertThat(format(code, "MONO-BRC-06")).contains("\t\tif (a) {\n\t\t\tif (b)\n\t\t\t\tc ();\n\t\t}\n");
    }

    @Test
    void nestedUnbracedCondition_allowsElseIfChains() {
        assertThat(check(inMethod("if (a)\n\tc ();\nelse if (b)\n\td ();"), "MONO-BRC-06")).isEmpty();
    }
}
