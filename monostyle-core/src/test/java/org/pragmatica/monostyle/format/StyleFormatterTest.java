package org.pragmatica.monostyle.format;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.shared.SourceFile;
import org.pragmatica.monostyle.token.Tokenizer;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class StyleFormatterTest {

    private static final String MESSY = """
                                        class Sample
                                        {
                                        \tvoid Run(int a){
                                        \t\tif(a>1)
                                        \t\t\tcall(a,b);
                                        \t\tvar x=items[0];
                                        \t}
                                        }
                                        """;

    private final StyleFormatter formatter = StyleFormatter.styleFormatter();

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "method(a);                   | method (a);",
            "var v = array[10];           | var v = array [10];",
            "call ( a, b );               | call (a, b);",
            "var list = new List <int> ();| var list = new List<int> ();"
    })
    void format_fixesSpacing(String input, String expected) {
        var result = formatter.format(source(inMethod(input)));

        assertThat(result.source()
                         .content()).isEqualTo(inMethod(expected));
        assertThat(result.appliedCount()).isPositive();
        assertThat(result.remaining()).isEmpty();
    }

    @Test
    void format_placesBracesPerDeclarationKind() {
        var result = formatter.format(source(MESSY));

        assertThat(result.source()
                         .content()).isEqualTo("""
                                               class Sample {
                                               \tvoid Run (int a)
                                               \t{
                                               \t\tif (a > 1)
                                               \t\t\tcall (a, b);
                                               \t\tvar x = items [0];
                                               \t}
                                               }
                                               """);
    }

    @Test
    void format_isIdempotent() {
        var once = formatter.format(source("using System.Linq;\nusing System;\n" + MESSY))
                            .source();
        var twice = formatter.format(once)
                             .source();

        assertThat(twice.content()).isEqualTo(once.content());
        assertThat(formatter.isFormatted(once)).isTrue();
    }

    @Test
    void format_changesOnlyWhitespace() {
        var formatted = formatter.format(source(MESSY))
                                 .source()
                                 .content();

        assertThat(significant(formatted)).isEqualTo(significant(MESSY));
    }

    @Test
    void format_keepsFileWithStructuralProblemUnchanged() {
        var text = "class A {\n\tint x=1;\n";

        var result = formatter.format(source(text));

        assertThat(result.source()
                         .content()).isEqualTo(text);
        assertThat(result.remaining()).extracting(Diagnostic::ruleId)
                                      .contains("MONO-STR-01");
    }

    @Test
    void format_fixesInsideUnbalancedRegion_areCountedAsStructuralNotConflicting() {
        var text = "class A {\n\tvoid Run(int a){\n\t\tcall(a);\n";

        var summary = formatter.format(source(text))
                               .summary();

        assertThat(summary.fixed()).isZero();
        assertThat(summary.skippedConflicting()).isZero();
        assertThat(summary.skippedStructural()).isPositive();
    }

    @Test
    void format_cancelledBeforeStart_returnsOriginal() {
        var cancellation = CancellationToken.cancellationToken();
        cancellation.cancel();

        var result = formatter.format(source(MESSY), cancellation);

        assertThat(result.cancelled()).isTrue();
        assertThat(result.source()
                         .content()).isEqualTo(MESSY);
        assertThat(result.appliedCount()).isZero();
    }

    @Test
    void format_withAutoFixDisabled_onlyReports() {
        var reporting = StyleFormatter.styleFormatter(formatter.config()
                                                               .withAutoFix(false));

        var result = reporting.format(source(MESSY));

        assertThat(result.source()
                         .content()).isEqualTo(MESSY);
        assertThat(result.remaining()).isNotEmpty();
        assertThat(result.remaining()).anyMatch(Diagnostic::isFixable);
        assertThat(result.summary()
                         .skippedConflicting()).isZero();
        assertThat(result.summary()
                         .skippedStructural()).isZero();
    }

    @Test
    void check_withCancelledToken_returnsNoDiagnostics() {
        var cancellation = CancellationToken.cancellationToken();

        assertThat(formatter.check(source(MESSY), cancellation)).hasValueSatisfying(diagnostics -> assertThat(diagnostics).isNotEmpty());

        cancellation.cancel();

        assertThat(formatter.check(source(MESSY), cancellation)).isEmpty();
    }

    @Test
    void check_reportsWithoutChangingSource() {
        var source = source(MESSY);

        assertThat(formatter.check(source)).extracting(Diagnostic::ruleId)
                                           .contains("MONO-SPC-01", "MONO-SPC-07", "MONO-BRC-01", "MONO-BRC-02");
        assertThat(source.content()).isEqualTo(MESSY);
    }

    private static List<String> significant(String text) {
        return Tokenizer.tokenize(text)
                        .tokens()
                        .stream()
                        .map(token -> token.kind() + ":" + token.text())
                        .toList();
    }

    private static String inMethod(String statement) {
        return "class Sample {\n\tvoid Run ()\n\t{\n\t\t" + statement.strip() + "\n\t}\n}\n";
    }

    private static SourceFile source(String text) {
        return SourceFile.sourceFile(Path.of("Sample.cs"), text);
    }
}
