package org.pragmatica.monostyle.lint;

import org.pragmatica.monostyle.lint.rules.BlockBraceRule;
import org.pragmatica.monostyle.lint.rules.CallSpacingRule;
import org.pragmatica.monostyle.lint.rules.CaseLabelIndentRule;
import org.pragmatica.monostyle.lint.rules.ChainIndentRule;
import org.pragmatica.monostyle.lint.rules.CommaSpacingRule;
import org.pragmatica.monostyle.lint.rules.CommentSentenceRule;
import org.pragmatica.monostyle.lint.rules.CommentSpacingRule;
import org.pragmatica.monostyle.lint.rules.ConditionIndentRule;
import org.pragmatica.monostyle.lint.rules.ControlKeywordSpacingRule;
import org.pragmatica.monostyle.lint.rules.DirectiveOrderRule;
import org.pragmatica.monostyle.lint.rules.FieldNamingRule;
import org.pragmatica.monostyle.lint.rules.GenericSpacingRule;
import org.pragmatica.monostyle.lint.rules.IndexerSpacingRule;
import org.pragmatica.monostyle.lint.rules.InnerSpacingRule;
import org.pragmatica.monostyle.lint.rules.LineLengthRule;
import org.pragmatica.monostyle.lint.rules.LocalNamingRule;
import org.pragmatica.monostyle.lint.rules.MethodBraceRule;
import org.pragmatica.monostyle.lint.rules.NestedUnbracedConditionRule;
import org.pragmatica.monostyle.lint.rules.OperatorSpacingRule;
import org.pragmatica.monostyle.lint.rules.ParameterIndentRule;
import org.pragmatica.monostyle.lint.rules.ParameterNamingRule;
import org.pragmatica.monostyle.lint.rules.ParaphraseCommentRule;
import org.pragmatica.monostyle.lint.rules.PropertyBraceRule;
import org.pragmatica.monostyle.lint.rules.RedundantDirectiveRule;
import org.pragmatica.monostyle.lint.rules.SemicolonSpacingRule;
import org.pragmatica.monostyle.lint.rules.StructuralProblemRule;
import org.pragmatica.monostyle.lint.rules.StyleRule;
import org.pragmatica.monostyle.lint.rules.TrailingWhitespaceRule;
import org.pragmatica.monostyle.lint.rules.TypeBraceRule;
import org.pragmatica.monostyle.lint.rules.UnbracedConditionRule;
import org.pragmatica.monostyle.parser.NodeKind;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Table from node kind to the enabled rules interested in it.
 *
 * <p>The walk looks up each node's kind once instead of offering every node to every rule.
 */
public final class RuleRegistry {
    private final List<StyleRule> rules;
    private final Map<NodeKind, List<StyleRule>> byKind;

    private RuleRegistry(List<StyleRule> rules) {
        this.rules = List.copyOf(rules);
        var table = new EnumMap<NodeKind, List<StyleRule>>(NodeKind.class);
        for (var rule : this.rules) {
            for (var kind : rule.interests()) {
                table.computeIfAbsent(kind, k -> new ArrayList<>())
                     .add(rule);
            }
        }
        this.byKind = table;
    }

    /**
     * Registry of the built-in rules enabled by the configuration.
     */
    public static RuleRegistry ruleRegistry(StyleConfig config) {
        return ruleRegistry(builtInRules(), config);
    }

    public static RuleRegistry ruleRegistry(List<StyleRule> candidates, StyleConfig config) {
        return new RuleRegistry(candidates.stream()
                                          .filter(rule -> config.isRuleEnabled(rule.ruleId()))
                                          .toList());
    }

    /**
     * Every built-in rule, in catalogue order.
     */
    public static List<StyleRule> builtInRules() {
        return List.of(new StructuralProblemRule(),
                       new CallSpacingRule(),
                       new IndexerSpacingRule(),
                       new InnerSpacingRule(),
                       new GenericSpacingRule(),
                       new CommaSpacingRule(),
                       new OperatorSpacingRule(),
                       new ControlKeywordSpacingRule(),
                       new SemicolonSpacingRule(),
                       new TrailingWhitespaceRule(),
                       new TypeBraceRule(),
                       new MethodBraceRule(),
                       new PropertyBraceRule(),
                       new BlockBraceRule(),
                       new UnbracedConditionRule(),
                       new NestedUnbracedConditionRule(),
                       new CaseLabelIndentRule(),
                       new ParameterIndentRule(),
                       new ConditionIndentRule(),
                       new ChainIndentRule(),
                       new DirectiveOrderRule(),
                       new RedundantDirectiveRule(),
                       new ParameterNamingRule(),
                       new LocalNamingRule(),
                       new FieldNamingRule(),
                       new CommentSpacingRule(),
                       new CommentSentenceRule(),
                       new ParaphraseCommentRule(),
                       new LineLengthRule());
    }

    public List<StyleRule> rules() {
        return rules;
    }

    public List<StyleRule> rulesFor(NodeKind kind) {
        return byKind.getOrDefault(kind, List.of());
    }
}
