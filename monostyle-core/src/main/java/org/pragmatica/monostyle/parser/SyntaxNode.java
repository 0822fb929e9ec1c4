package org.pragmatica.monostyle.parser;

import org.pragmatica.monostyle.token.Token;
import org.pragmatica.monostyle.token.TokenSequence;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/// Lightweight view of one node in a {@link SyntaxTree}.
public record SyntaxNode(SyntaxTree tree, int index) {
    public NodeKind kind() {
        return tree.kind(index);
    }

    public boolean is(NodeKind expected) {
        return kind() == expected;
    }

    public int firstToken() {
        return tree.firstToken(index);
    }

    public int lastToken() {
        return tree.lastToken(index);
    }

    /// Token index of the declared name, or -1.
    public int nameToken() {
        return tree.nameToken(index);
    }

    /// Token index of the opening delimiter of the node's body or argument list, or -1.
    public int delimiter() {
        return tree.delimiter(index);
    }

    public boolean has(NodeFlag flag) {
        return tree.has(index, flag);
    }

    /// Simple names of attributes attached to the declaration.
    public List<String> attributes() {
        return tree.attributes(index);
    }

    public Optional<String> name() {
        int token = nameToken();
        return token < 0
               ? Optional.empty()
               : Optional.of(tokens().get(token)
                                     .text());
    }

    public TokenSequence tokens() {
        return tree.tokens();
    }

    public Token first() {
        return tokens().get(firstToken());
    }

    public Token last() {
        return tokens().get(lastToken());
    }

    public int start() {
        return first().start();
    }

    public int end() {
        return last().end();
    }

    public String text() {
        return tokens().text()
                       .substring(start(), end());
    }

    public Optional<SyntaxNode> parent() {
        int parent = tree.parent(index);
        return parent < 0
               ? Optional.empty()
               : Optional.of(tree.node(parent));
    }

    public List<SyntaxNode> children() {
        var indexes = tree.children(index);
        var result = new ArrayList<SyntaxNode>(indexes.length);
        for (int child : indexes) {
            result.add(tree.node(child));
        }
        return result;
    }

    public List<SyntaxNode> children(NodeKind kind) {
        return children().stream()
                         .filter(child -> child.is(kind))
                         .toList();
    }

    public Optional<SyntaxNode> firstChild(NodeKind kind) {
        return children().stream()
                         .filter(child -> child.is(kind))
                         .findFirst();
    }

    /// Nearest ancestor of the given kind.
    public Optional<SyntaxNode> enclosing(NodeKind kind) {
        var current = parent();
        while (current.isPresent() && !current.get()
                                              .is(kind)) {
            current = current.get()
                             .parent();
        }
        return current;
    }

    /// Nearest ancestor matching any of the kinds.
    public Optional<SyntaxNode> enclosing(Predicate<SyntaxNode> predicate) {
        var current = parent();
        while (current.isPresent() && !predicate.test(current.get())) {
            current = current.get()
                             .parent();
        }
        return current;
    }

    /// This node and all nodes below it, in document order.
    public Stream<SyntaxNode> descendants() {
        return Stream.concat(Stream.of(this),
                             children().stream()
                                       .flatMap(SyntaxNode::descendants));
    }

    /// Token indexes covered by this node.
    public IntStream tokenIndexes() {
        return IntStream.rangeClosed(firstToken(), lastToken());
    }

    /// First token index within the node satisfying the predicate, or -1.
    public int findToken(Predicate<Token> predicate) {
        for (int i = firstToken(); i <= lastToken(); i++) {
            if (predicate.test(tokens().get(i))) {
                return i;
            }
        }
        return -1;
    }

    public boolean contains(int tokenIndex) {
        return tokenIndex >= firstToken() && tokenIndex <= lastToken();
    }

    /// 1-based line where the node starts.
    public int line() {
        return tokens().line(firstToken());
    }
}
