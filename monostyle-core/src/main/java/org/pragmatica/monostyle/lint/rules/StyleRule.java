package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.RuleCategory;
import org.pragmatica.monostyle.lint.RuleContext;
import org.pragmatica.monostyle.parser.NodeKind;
import org.pragmatica.monostyle.parser.SyntaxNode;

import java.util.Set;
import java.util.stream.Stream;

/**
 * Interface for style rules.
 *
 * Each rule declares the node kinds it is interested in and is invoked once per matching node
 * during a single walk of the tree. Rules that look at the whole token stream declare interest in
 * {@link NodeKind#COMPILATION_UNIT}.
 */
public interface StyleRule {

    /**
     * Get the rule ID (e.g., "MONO-SPC-01").
     */
    String ruleId();

    RuleCategory category();

    /**
     * Get a short description of what this rule checks.
     */
    String description();

    Set<NodeKind> interests();

    /**
     * Analyze one node and return any diagnostics.
     *
     * @param node the node of an interesting kind
     * @param ctx  the rule context providing the parsed file and configuration
     * @return stream of diagnostics found
     */
    Stream<Diagnostic> analyze(SyntaxNode node, RuleContext ctx);
}
