package org.pragmatica.monostyle.lint;

import org.pragmatica.monostyle.lint.rules.CallSpacingRule;
import org.pragmatica.monostyle.lint.rules.StyleRule;
import org.pragmatica.monostyle.parser.NodeKind;
import org.pragmatica.monostyle.parser.ParseResult;
import org.pragmatica.monostyle.parser.StructuralParser;
import org.pragmatica.monostyle.parser.SyntaxNode;
import org.pragmatica.monostyle.token.Tokenizer;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RuleEngineTest {

    private static final String CODE = """
                                       class Sample {
                                       \tvoid Run ()
                                       \t{
                                       \t\tfirst(a);
                                       \t\tsecond(b);
                                       \t}
                                       }
                                       """;

    @Test
    void evaluate_failingRule_isReportedOnceAndOthersKeepRunning() {
        var config = StyleConfig.defaultConfig();
        var registry = RuleRegistry.ruleRegistry(List.of(new ThrowingRule(), new CallSpacingRule()), config);

        var diagnostics = RuleEngine.ruleEngine(config, registry)
                                    .evaluate(parse(CODE), "Sample.cs");

        assertThat(diagnostics).extracting(Diagnostic::ruleId)
                               .containsExactly("MONO-INT-01", "MONO-SPC-01", "MONO-SPC-01");
        assertThat(diagnostics.get(0)
                              .severity()).isEqualTo(DiagnosticSeverity.ADVISORY);
        assertThat(diagnostics.get(0)
                              .message()).contains("TEST-01")
                                         .contains("boom");
    }

    @Test
    void evaluate_returnsDiagnosticsInDocumentOrder() {
        var diagnostics = RuleEngine.ruleEngine(StyleConfig.defaultConfig())
                                    .evaluate(parse("class Sample {\n\tint m_x;\n\tvoid Run ()\n\t{\n\t\tcall(x=1);\n\t}\n}\n"),
                                              "Sample.cs");

        assertThat(diagnostics).isNotEmpty()
                               .isSortedAccordingTo(Comparator.comparingInt(Diagnostic::start)
                                                              .thenComparing(Diagnostic::ruleId));
        assertThat(diagnostics).extracting(Diagnostic::file)
                               .containsOnly("Sample.cs");
    }

    @Test
    void disabledRule_producesNothing() {
        var config = StyleConfig.defaultConfig()
                                .withDisabledRule("MONO-SPC-01");

        var diagnostics = RuleEngine.ruleEngine(config)
                                    .evaluate(parse(CODE), "Sample.cs");

        assertThat(diagnostics).extracting(Diagnostic::ruleId)
                               .doesNotContain("MONO-SPC-01");
    }

    @Test
    void structuralRules_cannotBeDisabled() {
        var config = StyleConfig.defaultConfig()
                                .withDisabledRule("MONO-STR")
                                .withDisabledRule("MONO-STR-01");

        var diagnostics = RuleEngine.ruleEngine(config)
                                    .evaluate(parse("class A {\n"), "A.cs");

        assertThat(diagnostics).extracting(Diagnostic::ruleId)
                               .contains("MONO-STR-01");
    }

    @Test
    void severityOverride_isApplied() {
        var config = StyleConfig.defaultConfig()
                                .withEnabledRules(Set.of("MONO-SPC-01"))
                                .withRuleSeverity("MONO-SPC-01", DiagnosticSeverity.ERROR);

        var diagnostics = RuleEngine.ruleEngine(config)
                                    .evaluate(parse(CODE), "Sample.cs");

        assertThat(diagnostics).hasSize(2)
                               .allMatch(Diagnostic::isError);
    }

    private static ParseResult parse(String text) {
        return StructuralParser.parse(Tokenizer.tokenize(text));
    }

    private static final class ThrowingRule implements StyleRule {
        @Override
        public String ruleId() {
            return "TEST-01";
        }

        @Override
        public RuleCategory category() {
            return RuleCategory.SPACING;
        }

        @Override
        public String description() {
            return "Always fails";
        }

        @Override
        public Set<NodeKind> interests() {
            return Set.of(NodeKind.CALL);
        }

        @Override
        public Stream<Diagnostic> analyze(SyntaxNode node, RuleContext ctx) {
            throw new IllegalStateException("boom");
        }
    }
}
