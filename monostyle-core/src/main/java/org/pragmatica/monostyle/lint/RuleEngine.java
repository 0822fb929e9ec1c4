package org.pragmatica.monostyle.lint;

import org.pragmatica.monostyle.lint.rules.StyleRule;
import org.pragmatica.monostyle.parser.ParseResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/// Evaluates the registered rules over one parsed file.
///
/// The tree is walked once in document order and each node is offered to the rules interested in its
/// kind. A rule that throws is reported as `MONO-INT-01` and skipped for the rest of the file; the
/// remaining rules keep running.
public final class RuleEngine {
    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);
    private static final String INTERNAL_RULE_ID = "MONO-INT-01";
    private static final Comparator<Diagnostic> ORDER = Comparator.comparingInt(Diagnostic::start)
                                                                   .thenComparing(Diagnostic::ruleId);

    private final StyleConfig config;
    private final RuleRegistry registry;

    private RuleEngine(StyleConfig config, RuleRegistry registry) {
        this.config = config;
        this.registry = registry;
    }

    public static RuleEngine ruleEngine(StyleConfig config) {
        return new RuleEngine(config, RuleRegistry.ruleRegistry(config));
    }

    public static RuleEngine ruleEngine(StyleConfig config, RuleRegistry registry) {
        return new RuleEngine(config, registry);
    }

    public StyleConfig config() {
        return config;
    }

    /// Diagnostics for the file, ordered by start offset and rule id.
    public List<Diagnostic> evaluate(ParseResult parse, String fileName) {
        var ctx = RuleContext.ruleContext(parse, config, fileName);
        var diagnostics = new ArrayList<Diagnostic>();
        var failed = new HashSet<String>();
        for (var node : parse.tree()
                             .nodes()) {
            for (var rule : registry.rulesFor(node.kind())) {
                if (failed.contains(rule.ruleId())) {
                    continue;
                }
                try {
                    diagnostics.addAll(rule.analyze(node, ctx)
                                           .toList());
                } catch (RuntimeException e) {
                    failed.add(rule.ruleId());
                    log.warn("Rule {} failed on {} at node {}", rule.ruleId(), fileName, node.kind(), e);
                    diagnostics.add(internalDiagnostic(rule, node.start(), ctx, e));
                }
            }
        }
        diagnostics.sort(ORDER);
        log.debug("{}: {} diagnostics", fileName, diagnostics.size());
        return diagnostics;
    }

    private static Diagnostic internalDiagnostic(StyleRule rule, int offset, RuleContext ctx, RuntimeException e) {
        return ctx.diagnostic(INTERNAL_RULE_ID,
                              DiagnosticSeverity.ADVISORY,
                              RuleCategory.INTERNAL,
                              offset,
                              offset,
                              "Rule " + rule.ruleId() + " failed and was skipped for this file: " + e.getMessage());
    }
}
