package org.pragmatica.monostyle.report;

import org.pragmatica.monostyle.format.FixSummary;
import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.DiagnosticSeverity;
import org.pragmatica.monostyle.lint.RuleCategory;

import java.util.List;

import org.junit.jupiter.api.Test;
import tools.jackson.databind.json.JsonMapper;

import static org.assertj.core.api.Assertions.assertThat;

class ReporterTest {

    private final Reporter reporter = Reporter.reporter();

    @Test
    void report_sortsByFileLineColumnAndRule() {
        var records = reporter.report(List.of(FileDiagnostics.fileDiagnostics("b.cs",
                                                                             List.of(diagnostic("MONO-SPC-01", 1, 5, DiagnosticSeverity.WARNING))),
                                              FileDiagnostics.fileDiagnostics("a.cs",
                                                                             List.of(diagnostic("MONO-SPC-06", 2, 1, DiagnosticSeverity.WARNING),
                                                                                     diagnostic("MONO-SPC-01", 2, 1, DiagnosticSeverity.WARNING),
                                                                                     diagnostic("MONO-LEN-01", 1, 1, DiagnosticSeverity.ADVISORY)))));

        assertThat(records).extracting(record -> record.file() + ":" + record.line() + ":" + record.ruleId())
                           .containsExactly("a.cs:1:MONO-LEN-01", "a.cs:2:MONO-SPC-01", "a.cs:2:MONO-SPC-06", "b.cs:1:MONO-SPC-01");
    }

    @Test
    void human_printsOneLinePerRecordAndTotals() {
        var records = reporter.report(List.of(FileDiagnostics.fileDiagnostics("a.cs",
                                                                             List.of(diagnostic("MONO-STR-01", 3, 1, DiagnosticSeverity.ERROR),
                                                                                     diagnostic("MONO-SPC-01", 1, 7, DiagnosticSeverity.WARNING)))));

        assertThat(reporter.human(records)).isEqualTo("""
                                                      a.cs:1:7: warning [MONO-SPC-01] finding
                                                      a.cs:3:1: error [MONO-STR-01] finding
                                                      1 error(s), 1 warning(s), 0 advisory note(s)""");
    }

    @Test
    void human_emptyReport_printsZeroTotals() {
        assertThat(reporter.human(List.of())).isEqualTo("0 error(s), 0 warning(s), 0 advisory note(s)");
    }

    @Test
    void json_containsDiagnosticsCountsAndSummary() throws ReportException {
        var records = reporter.report(List.of(FileDiagnostics.fileDiagnostics("a.cs",
                                                                             List.of(diagnostic("MONO-SPC-01", 1, 7, DiagnosticSeverity.WARNING),
                                                                                     diagnostic("MONO-CMT-02", 4, 3, DiagnosticSeverity.ADVISORY)))));

        var tree = JsonMapper.builder()
                             .build()
                             .readTree(reporter.json(records, new FixSummary(3, 1, 0, 1)));

        assertThat(tree.get("diagnostics")
                       .size()).isEqualTo(2);
        assertThat(tree.get("diagnostics")
                       .get(0)
                       .get("ruleId")
                       .asString()).isEqualTo("MONO-SPC-01");
        assertThat(tree.get("diagnostics")
                       .get(0)
                       .get("line")
                       .asInt()).isEqualTo(1);
        assertThat(tree.get("counts")
                       .get("warning")
                       .asInt()).isEqualTo(1);
        assertThat(tree.get("counts")
                       .get("advisory")
                       .asInt()).isEqualTo(1);
        assertThat(tree.get("summary")
                       .get("fixed")
                       .asInt()).isEqualTo(3);
    }

    private static Diagnostic diagnostic(String ruleId, int line, int column, DiagnosticSeverity severity) {
        return Diagnostic.diagnostic(ruleId, severity, RuleCategory.SPACING, "ignored", 0, 0, line, column, "finding");
    }
}
