package org.pragmatica.monostyle.report;

import org.pragmatica.monostyle.format.FixSummary;
import org.pragmatica.monostyle.lint.DiagnosticSeverity;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.SerializationFeature;
import tools.jackson.databind.json.JsonMapper;

/**
 * Aggregates per-file diagnostics into a stable report.
 *
 * <p>Records are sorted by file, line, column and rule id. The sort is stable, so records equal on
 * all four keys keep the order the rule engine produced them in.
 */
public final class Reporter {
    private static final Comparator<ReportRecord> ORDER = Comparator.comparing(ReportRecord::file)
                                                                    .thenComparingInt(ReportRecord::line)
                                                                    .thenComparingInt(ReportRecord::column)
                                                                    .thenComparing(ReportRecord::ruleId);

    private final JsonMapper mapper;

    private Reporter() {
        this.mapper = JsonMapper.builder()
                                .enable(SerializationFeature.INDENT_OUTPUT)
                                .build();
    }

    public static Reporter reporter() {
        return new Reporter();
    }

    public List<ReportRecord> report(List<FileDiagnostics> files) {
        return files.stream()
                    .flatMap(file -> file.diagnostics()
                                         .stream()
                                         .map(diagnostic -> ReportRecord.reportRecord(file.file(), diagnostic)))
                    .sorted(ORDER)
                    .toList();
    }

    /// One line per record followed by a totals line.
    public String human(List<ReportRecord> records) {
        var sb = new StringBuilder();
        records.forEach(record -> sb.append(record.toHumanString())
                                    .append('\n'));
        sb.append(totals(records));
        return sb.toString();
    }

    public String json(List<ReportRecord> records, FixSummary summary) throws ReportException {
        var document = new LinkedHashMap<String, Object>();
        document.put("diagnostics", records);
        document.put("counts", counts(records));
        document.put("summary", summary);
        try {
            return mapper.writeValueAsString(document);
        } catch (JacksonException e) {
            throw new ReportException(ReportError.fromException(e), e);
        }
    }

    static String totals(List<ReportRecord> records) {
        var counts = counts(records);
        return counts.get("error") + " error(s), " + counts.get("warning") + " warning(s), " + counts.get("advisory") + " advisory note(s)";
    }

    private static Map<String, Long> counts(List<ReportRecord> records) {
        var counts = new LinkedHashMap<String, Long>();
        for (var severity : DiagnosticSeverity.values()) {
            counts.put(severity.label(),
                       records.stream()
                              .filter(record -> record.severity() == severity)
                              .count());
        }
        return counts;
    }
}
