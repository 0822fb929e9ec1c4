package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.StyleConfig;
import org.pragmatica.monostyle.parser.NodeFlag;
import org.pragmatica.monostyle.parser.NodeKind;
import org.pragmatica.monostyle.parser.SyntaxNode;
import org.pragmatica.monostyle.token.TokenKind;
import org.pragmatica.monostyle.token.TokenSequence;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * Directive block analysis shared by the ordering rules.
 *
 * <p>Directives are ordered in tiers:
 * <ol>
 *   <li>platform-neutral ({@code System})</li>
 *   <li>libraries</li>
 *   <li>platform-specific (configured prefixes)</li>
 *   <li>application (configured prefixes, or the first segment of the file namespace)</li>
 * </ol>
 * Within a tier directives are grouped by top-level prefix, groups alphabetically, names within a group
 * shortest first. Alias and {@code using static} directives form a last group in source order.
 */
final class Directives {
    private static final Comparator<Directive> ORDER = Comparator.comparingInt(Directive::tier)
                                                                 .thenComparing(Directive::group)
                                                                 .thenComparingInt(directive -> directive.name()
                                                                                                         .length())
                                                                 .thenComparing(Directive::name);

    private Directives() {}

    record Directive(SyntaxNode node, String name, String key, int tier, String group, boolean special) {}

    /// Outcome of analyzing one directive block.
    record Block(List<Directive> directives, List<Directive> redundant, List<List<Directive>> groups) {
        int start() {
            return directives.get(0)
                             .node()
                             .start();
        }

        int end() {
            return directives.get(directives.size() - 1)
                             .node()
                             .end();
        }
    }

    /// Leading run of directives under a compilation unit or namespace.
    static Optional<Block> block(SyntaxNode scope, StyleConfig config) {
        var nodes = new ArrayList<SyntaxNode>();
        for (var child : scope.children()) {
            if (!child.is(NodeKind.USING_DIRECTIVE)) {
                break;
            }
            nodes.add(child);
        }
        if (nodes.isEmpty()) {
            return Optional.empty();
        }
        var namespace = namespaceOf(scope);
        var applicationPrefixes = config.applicationPrefixes()
                                        .isEmpty()
                                  ? namespace.map(name -> List.of(topSegment(name)))
                                             .orElse(List.of())
                                  : config.applicationPrefixes();
        var directives = nodes.stream()
                              .map(node -> directive(node, config.platformPrefixes(), applicationPrefixes))
                              .toList();
        var seen = new HashSet<String>();
        var redundant = new ArrayList<Directive>();
        var kept = new ArrayList<Directive>();
        for (var directive : directives) {
            if (!seen.add(directive.key()) || isCoveredBy(directive, namespace)) {
                redundant.add(directive);
            } else {
                kept.add(directive);
            }
        }
        return Optional.of(new Block(directives, redundant, group(kept)));
    }

    /// Expected text of the block, directives joined with the given break and indentation.
    static String render(Block block, String lineBreak, String indent) {
        var sb = new StringBuilder();
        for (var group : block.groups()) {
            for (var directive : group) {
                if (sb.length() > 0) {
                    sb.append(lineBreak)
                      .append(indent);
                }
                sb.append(directive.node()
                                   .text());
            }
            sb.append(lineBreak);
        }
        // drop the separator after the last group
        var text = sb.toString();
        if (text.isEmpty()) {
            return text;
        }
        return text.substring(0, text.length() - lineBreak.length());
    }

    private static List<List<Directive>> group(List<Directive> directives) {
        var sorted = directives.stream()
                               .filter(directive -> !directive.special())
                               .sorted(ORDER)
                               .toList();
        var groups = new ArrayList<List<Directive>>();
        List<Directive> current = null;
        Directive previous = null;
        for (var directive : sorted) {
            if (previous == null || previous.tier() != directive.tier() || !previous.group()
                                                                                    .equals(directive.group())) {
                current = new ArrayList<>();
                groups.add(current);
            }
            current.add(directive);
            previous = directive;
        }
        var special = directives.stream()
                                .filter(Directive::special)
                                .toList();
        if (!special.isEmpty()) {
            groups.add(special);
        }
        return groups;
    }

    private static Directive directive(SyntaxNode node, List<String> platformPrefixes, List<String> applicationPrefixes) {
        var tokens = node.tokens();
        boolean special = node.has(NodeFlag.ALIAS_DIRECTIVE) || node.has(NodeFlag.STATIC_DIRECTIVE);
        var name = special
                   ? ""
                   : qualifiedName(tokens, node.nameToken(), node.lastToken());
        var key = special
                  ? compact(tokens, node.firstToken(), node.lastToken())
                  : name;
        var group = topSegment(name);
        int tier;
        if (group.equals("System")) {
            tier = 0;
        } else if (matches(name, applicationPrefixes)) {
            tier = 3;
        } else if (matches(name, platformPrefixes)) {
            tier = 2;
        } else {
            tier = 1;
        }
        return new Directive(node, name, key, tier, group, special);
    }

    /// A directive naming the enclosing namespace or one of its parents is already in scope.
    private static boolean isCoveredBy(Directive directive, Optional<String> namespace) {
        if (directive.special() || directive.name()
                                            .isEmpty()) {
            return false;
        }
        return namespace.map(ns -> ns.equals(directive.name()) || ns.startsWith(directive.name() + "."))
                        .orElse(false);
    }

    static Optional<String> namespaceOf(SyntaxNode scope) {
        var namespace = scope.is(NodeKind.NAMESPACE)
                        ? Optional.of(scope)
                        : scope.firstChild(NodeKind.NAMESPACE);
        return namespace.filter(node -> node.nameToken() >= 0)
                        .map(node -> qualifiedName(node.tokens(), node.nameToken(), node.lastToken()));
    }

    private static String qualifiedName(TokenSequence tokens, int first, int limit) {
        if (first < 0) {
            return "";
        }
        var sb = new StringBuilder();
        for (int i = first; i <= limit; i++) {
            var token = tokens.get(i);
            if (!token.is(TokenKind.IDENTIFIER) && !token.is(TokenKind.DOT) && !token.is(TokenKind.KEYWORD)) {
                break;
            }
            sb.append(token.text());
        }
        return sb.toString();
    }

    private static String compact(TokenSequence tokens, int first, int last) {
        var sb = new StringBuilder();
        for (int i = first; i <= last; i++) {
            sb.append(tokens.get(i)
                            .text())
              .append(' ');
        }
        return sb.toString()
                 .trim();
    }

    private static String topSegment(String name) {
        int dot = name.indexOf('.');
        return dot < 0
               ? name
               : name.substring(0, dot);
    }

    private static boolean matches(String name, List<String> prefixes) {
        return prefixes.stream()
                       .anyMatch(prefix -> name.equals(prefix) || name.startsWith(prefix + "."));
    }
}
