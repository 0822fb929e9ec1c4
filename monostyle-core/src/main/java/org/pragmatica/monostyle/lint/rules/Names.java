package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Edit;
import org.pragmatica.monostyle.lint.Fix;
import org.pragmatica.monostyle.parser.NodeKind;
import org.pragmatica.monostyle.parser.SyntaxNode;
import org.pragmatica.monostyle.token.TokenKind;
import org.pragmatica.monostyle.token.TokenSequence;
import org.pragmatica.monostyle.token.Tokenizer;

import java.util.ArrayList;
import java.util.Optional;
import java.util.regex.Pattern;

/// Casing checks and local renames for the naming rules.
final class Names {
    private static final Pattern CAMEL = Pattern.compile("^[a-z][A-Za-z0-9]*$");
    private static final Pattern DISCARD = Pattern.compile("^_+$");

    private Names() {}

    static boolean isCamel(String name) {
        return CAMEL.matcher(name)
                    .matches();
    }

    /// Verbatim identifiers and discards are left alone.
    static boolean isExempt(String name) {
        return name.startsWith("@") || DISCARD.matcher(name)
                                              .matches();
    }

    /// Camel-case form of the name, split on underscores and case boundaries.
    static String toCamel(String name) {
        var words = new ArrayList<String>();
        for (var part : name.split("_")) {
            if (!part.isEmpty()) {
                words.add(part);
            }
        }
        if (words.isEmpty()) {
            return name;
        }
        var sb = new StringBuilder(lowerLeading(words.get(0)));
        for (int i = 1; i < words.size(); i++) {
            var word = words.get(i);
            sb.append(Character.toUpperCase(word.charAt(0)))
              .append(word.substring(1));
        }
        return sb.toString();
    }

    /// `XMLParser` becomes `xmlParser`, `URL` becomes `url`, `Name` becomes `name`.
    private static String lowerLeading(String word) {
        int run = 0;
        while (run < word.length() && Character.isUpperCase(word.charAt(run))) {
            run++;
        }
        if (run == 0) {
            return word;
        }
        if (run == word.length() || run == 1) {
            return word.substring(0, run)
                       .toLowerCase() + word.substring(run);
        }
        return word.substring(0, run - 1)
                   .toLowerCase() + word.substring(run - 1);
    }

    /// Outermost member containing the node, or the compilation unit for top-level code.
    static SyntaxNode outermostMember(SyntaxNode node) {
        SyntaxNode result = node.tree()
                                .root();
        var current = node.parent();
        while (current.isPresent()) {
            var candidate = current.get();
            if (candidate.is(NodeKind.TYPE) || candidate.is(NodeKind.NAMESPACE)) {
                break;
            }
            if (candidate.kind()
                         .isMember() || candidate.is(NodeKind.ACCESSOR)) {
                result = candidate;
            }
            current = candidate.parent();
        }
        return result;
    }

    /// Rename every use of the identifier inside `scope`, provided nothing in `outer` could observe it.
    ///
    /// The rename is refused when the name is also used outside the scope, appears as a member access
    /// or named argument, is captured by `nameof` or an interpolated string, or when the new name is
    /// already taken.
    static Optional<Fix> localRename(SyntaxNode scope, SyntaxNode outer, String oldName, String newName) {
        if (oldName.equals(newName) || !isCamel(newName) || Tokenizer.isKeyword(newName)) {
            return Optional.empty();
        }
        if (isInitializerMember(outer, oldName)) {
            return Optional.empty();
        }
        var tokens = scope.tokens();
        var edits = new ArrayList<Edit>();
        for (int i = outer.firstToken(); i <= outer.lastToken(); i++) {
            var token = tokens.get(i);
            if (token.text()
                     .equals(newName)) {
                return Optional.empty();
            }
            if (token.is(TokenKind.STRING) && token.text()
                                                   .contains("$") && token.text()
                                                                          .contains(oldName)) {
                return Optional.empty();
            }
            if (!token.is(TokenKind.IDENTIFIER)) {
                continue;
            }
            if (token.text()
                     .equals("nameof") && scope.contains(i)) {
                return Optional.empty();
            }
            if (!token.text()
                      .equals(oldName)) {
                continue;
            }
            if (!scope.contains(i) || isQualified(tokens, i)) {
                return Optional.empty();
            }
            edits.add(Edit.edit(token.start(), token.end(), newName));
        }
        return edits.isEmpty()
               ? Optional.empty()
               : Optional.of(Fix.fix(edits));
    }

    /// `new Foo { name = value }` assigns a member that merely shares the name.
    private static boolean isInitializerMember(SyntaxNode outer, String name) {
        var tokens = outer.tokens();
        return outer.descendants()
                    .filter(node -> node.is(NodeKind.INITIALIZER) || node.is(NodeKind.ANONYMOUS))
                    .anyMatch(node -> node.tokenIndexes()
                                          .anyMatch(i -> tokens.get(i)
                                                               .is(TokenKind.IDENTIFIER, name) && tokens.get(i + 1)
                                                                                                        .is(TokenKind.ASSIGNMENT, "=")));
    }

    private static boolean isQualified(TokenSequence tokens, int index) {
        return (index > 0 && tokens.get(index - 1)
                                   .is(TokenKind.DOT)) || tokens.get(index + 1)
                                                                .is(TokenKind.COLON);
    }
}
