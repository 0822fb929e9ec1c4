package org.pragmatica.monostyle.lint;

import org.pragmatica.monostyle.parser.ParseResult;
import org.pragmatica.monostyle.parser.SyntaxTree;
import org.pragmatica.monostyle.shared.LineMap;
import org.pragmatica.monostyle.token.TokenSequence;

/// Context for rule analysis: the parsed file, configuration and file name.
public record RuleContext(ParseResult parse, StyleConfig config, String fileName) {
    public static RuleContext ruleContext(ParseResult parse, StyleConfig config, String fileName) {
        return new RuleContext(parse, config, fileName);
    }

    public SyntaxTree tree() {
        return parse.tree();
    }

    public TokenSequence tokens() {
        return parse.tree()
                    .tokens();
    }

    public String text() {
        return tokens().text();
    }

    public LineMap lineMap() {
        return tokens().lineMap();
    }

    /// Line break used by the file; the first break found wins, `\n` when there is none.
    public String lineBreak() {
        var text = text();
        int index = text.indexOf('\n');
        if (index > 0 && text.charAt(index - 1) == '\r') {
            return "\r\n";
        }
        if (index < 0 && text.indexOf('\r') >= 0) {
            return "\r";
        }
        return "\n";
    }

    /// Indentation `levels` units past the given indentation.
    public String indent(String base, int levels) {
        return base + config.indentUnit()
                            .repeat(levels);
    }

    /// Build a diagnostic for the span, honoring configured severity overrides.
    public Diagnostic diagnostic(String ruleId,
                                 DiagnosticSeverity severity,
                                 RuleCategory category,
                                 int start,
                                 int end,
                                 String message) {
        var lineMap = lineMap();
        return Diagnostic.diagnostic(ruleId,
                                     config.severityFor(ruleId, severity),
                                     category,
                                     fileName,
                                     start,
                                     end,
                                     lineMap.line(start),
                                     lineMap.column(start),
                                     message);
    }
}
