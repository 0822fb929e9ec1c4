package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.FieldCasing;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.monostyle.lint.rules.RuleFixtures.check;
import static org.pragmatica.monostyle.lint.rules.RuleFixtures.format;
import static org.pragmatica.monostyle.lint.rules.RuleFixtures.inMethod;
import static org.pragmatica.monostyle.lint.rules.RuleFixtures.only;

class NamingRulesTest {

    private static final String FIELDS = """
                                         class Sample {
                                         \tint m_count;
                                         \tint item_count;
                                         \tint itemCount;
                                         \tpublic int Total;
                                         }
                                         """;

    @Test
    void lambdaParameter_isRenamedWithItsUses() {
        var code = inMethod("var names = items.Select (Item => Item.Name);");

        assertThat(format(code, "MONO-NAM-01")).contains("items.Select (item => item.Name);");
    }

    @Test
    void methodParameter_isReportedWithoutFix() {
        var code = "class Sample {\n\tvoid Run (int Count)\n\t{\n\t\tUse (Count);\n\t}\n}\n";

        assertThat(check(code, "MONO-NAM-01")).singleElement()
                                              .satisfies(diagnostic -> {
                                                  assertThat(diagnostic.isFixable()).isFalse();
                                                  assertThat(diagnostic.message()).contains("'count'");
                                              });
    }

    @Test
    void camelParameters_areAccepted() {
        assertThat(check("class Sample {\n\tvoid Run (int count, string @class, int _)\n\t{\n\t}\n}\n",
                         "MONO-NAM-01")).isEmpty();
    }

    @Test
    void localVariable_isRenamedThroughoutItsScope() {
        var code = inMethod("int first_value = 1;\nUse (first_value);");

        assertThat(check(code, "MONO-NAM-02")).extracting(Diagnostic::message)
                                              .containsExactly("Local variable 'first_value' should be camel case: 'firstValue'");
        assertThat(format(code, "MONO-NAM-02")).contains("\t\tint firstValue = 1;\n\t\tUse (firstValue);\n");
    }

    @Test
    void localVariable_isNotRenamedWhenNewNameIsTaken() {
        var code = inMethod("int first_value = 1;\nUse (first_value, firstValue);");

        assertThat(check(code, "MONO-NAM-02")).singleElement()
                                              .satisfies(diagnostic -> assertThat(diagnostic.isFixable()).isFalse());
    }

    @Test
    void constantLocals_areIgnored() {
        assertThat(check(inMethod("const int MaxCount = 10;"), "MONO-NAM-02")).isEmpty();
    }

    @Test
    void fields_separatorCasing_flagsHungarianPrefixOnly() {
        assertThat(check(FIELDS, "MONO-NAM-03")).extracting(Diagnostic::message)
                                                .containsExactly("Field 'm_count' should be lower case with '_' separators");
    }

    @Test
    void fields_camelCasing_flagsSeparatedNames() {
        var config = only("MONO-NAM-03").withFieldCasing(FieldCasing.CAMEL);

        assertThat(check(FIELDS, config)).extracting(Diagnostic::line)
                                         .containsExactly(2, 3);
    }

    @Test
    void fields_inExemptTypes_areIgnored() {
        var config = only("MONO-NAM-03").withExemptType("Sample");

        assertThat(check(FIELDS, config)).isEmpty();
    }

    @Test
    void fields_inInteropStructs_areIgnored() {
        var code = "[StructLayout (LayoutKind.Sequential)]\nstruct Native {\n\tint m_handle;\n}\n";

        assertThat(check(code, "MONO-NAM-03")).isEmpty();
    }
}
