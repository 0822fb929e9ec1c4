package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.DiagnosticSeverity;
import org.pragmatica.monostyle.lint.FieldCasing;
import org.pragmatica.monostyle.lint.RuleCategory;
import org.pragmatica.monostyle.lint.RuleContext;
import org.pragmatica.monostyle.parser.NodeFlag;
import org.pragmatica.monostyle.parser.NodeKind;
import org.pragmatica.monostyle.parser.SyntaxNode;
import org.pragmatica.monostyle.token.TokenKind;

import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * MONO-NAM-03: Non-public instance fields use lower case with underscore separators
 * ({@code field_name}); unseparated camel case ({@code fieldName}) is accepted unless the configured
 * casing is {@link FieldCasing#CAMEL}, which requires it. Leading underscores and {@code m_}/{@code mX}
 * prefixes are rejected.
 *
 * <p>Types listed as exempt, or carrying a compatibility attribute such as {@code StructLayout},
 * are skipped: their field names mirror an external format.
 */
public class FieldNamingRule implements StyleRule {

    private static final String RULE_ID = "MONO-NAM-03";
    private static final Pattern SEPARATED = Pattern.compile("^[a-z][a-z0-9]*(_[a-z0-9]+)*$");
    private static final Pattern HUNGARIAN = Pattern.compile("^(m_|s_|_|m[A-Z]).*");
    private static final Set<String> VISIBLE = Set.of("public", "protected", "internal", "event");

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    public RuleCategory category() {
        return RuleCategory.NAMING;
    }

    @Override
    public String description() {
        return "Instance fields in lower case with separators";
    }

    @Override
    public Set<NodeKind> interests() {
        return Set.of(NodeKind.FIELD);
    }

    @Override
    public Stream<Diagnostic> analyze(SyntaxNode node, RuleContext ctx) {
        if (node.has(NodeFlag.STATIC) || node.has(NodeFlag.CONST) || isVisible(node) || isExempt(node, ctx)) {
            return Stream.empty();
        }
        var casing = ctx.config()
                        .fieldCasing();
        return node.children(NodeKind.VARIABLE)
                   .stream()
                   .filter(variable -> variable.nameToken() >= 0)
                   .filter(variable -> !isAcceptable(variable.name()
                                                             .orElse(""), casing))
                   .map(variable -> {
                       var token = ctx.tokens()
                                      .get(variable.nameToken());
                       return ctx.diagnostic(RULE_ID,
                                             DiagnosticSeverity.WARNING,
                                             category(),
                                             token.start(),
                                             token.end(),
                                             message(token.text(), casing));
                   });
    }

    static boolean isAcceptable(String name, FieldCasing casing) {
        if (name.startsWith("@")) {
            return true;
        }
        if (HUNGARIAN.matcher(name)
                     .matches()) {
            return false;
        }
        return switch (casing) {
            case SEPARATOR -> SEPARATED.matcher(name)
                                       .matches() || Names.isCamel(name);
            case CAMEL -> Names.isCamel(name);
        };
    }

    private static String message(String name, FieldCasing casing) {
        return casing == FieldCasing.CAMEL
               ? "Field '" + name + "' should be camel case"
               : "Field '" + name + "' should be lower case with '_' separators";
    }

    private static boolean isVisible(SyntaxNode field) {
        var tokens = field.tokens();
        int limit = field.nameToken() >= 0
                    ? field.nameToken()
                    : field.lastToken();
        for (int i = field.firstToken(); i < limit; i++) {
            var token = tokens.get(i);
            if (token.is(TokenKind.KEYWORD) && VISIBLE.contains(token.text())) {
                return true;
            }
        }
        return false;
    }

    private static boolean isExempt(SyntaxNode field, RuleContext ctx) {
        var config = ctx.config();
        return field.enclosing(NodeKind.TYPE)
                    .map(type -> type.name()
                                     .map(config.exemptTypes()::contains)
                                     .orElse(false) || type.attributes()
                                                           .stream()
                                                           .anyMatch(config.compatibilityAttributes()::contains))
                    .orElse(false);
    }
}
