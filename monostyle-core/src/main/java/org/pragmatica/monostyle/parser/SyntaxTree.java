package org.pragmatica.monostyle.parser;

import org.pragmatica.monostyle.token.TokenSequence;

import java.util.ArrayList;
import java.util.List;

/// Arena holding every node of one file in flat parallel arrays.
///
/// Nodes refer to tokens and to each other by index, so the tree never holds object references
/// in both directions. Node 0 is always the compilation unit.
public final class SyntaxTree {
    private static final int[] NO_CHILDREN = new int[0];

    private final TokenSequence tokens;
    private final NodeKind[] kinds;
    private final int[] firstTokens;
    private final int[] lastTokens;
    private final int[] parents;
    private final int[] nameTokens;
    private final int[] delimiters;
    private final int[] flags;
    private final int[][] children;
    private final List<List<String>> attributes;

    private SyntaxTree(Builder builder) {
        this.tokens = builder.tokens;
        int size = builder.kinds.size();
        this.kinds = builder.kinds.toArray(new NodeKind[0]);
        this.firstTokens = toArray(builder.firstTokens);
        this.lastTokens = toArray(builder.lastTokens);
        this.parents = toArray(builder.parents);
        this.nameTokens = toArray(builder.nameTokens);
        this.delimiters = toArray(builder.delimiters);
        this.flags = toArray(builder.flags);
        this.children = new int[size][];
        this.attributes = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            var list = builder.children.get(i);
            children[i] = list.isEmpty()
                          ? NO_CHILDREN
                          : toArray(list);
            attributes.add(List.copyOf(builder.attributes.get(i)));
        }
    }

    static Builder builder(TokenSequence tokens) {
        return new Builder(tokens);
    }

    public TokenSequence tokens() {
        return tokens;
    }

    public int size() {
        return kinds.length;
    }

    public SyntaxNode root() {
        return node(0);
    }

    public SyntaxNode node(int index) {
        return new SyntaxNode(this, index);
    }

    /// All nodes in document (pre-order) order.
    public List<SyntaxNode> nodes() {
        var result = new ArrayList<SyntaxNode>(size());
        for (int i = 0; i < size(); i++) {
            result.add(node(i));
        }
        return result;
    }

    NodeKind kind(int node) {
        return kinds[node];
    }

    int firstToken(int node) {
        return firstTokens[node];
    }

    int lastToken(int node) {
        return lastTokens[node];
    }

    int parent(int node) {
        return parents[node];
    }

    int nameToken(int node) {
        return nameTokens[node];
    }

    int delimiter(int node) {
        return delimiters[node];
    }

    boolean has(int node, NodeFlag flag) {
        return (flags[node] & flag.mask()) != 0;
    }

    int[] children(int node) {
        return children[node];
    }

    List<String> attributes(int node) {
        return attributes.get(node);
    }

    private static int[] toArray(List<Integer> list) {
        var result = new int[list.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = list.get(i);
        }
        return result;
    }

    /// Incremental construction with open/close semantics. Nodes are stored in the order they are
    /// opened, which makes the arena order a pre-order traversal.
    static final class Builder {
        private final TokenSequence tokens;
        private final List<NodeKind> kinds = new ArrayList<>();
        private final List<Integer> firstTokens = new ArrayList<>();
        private final List<Integer> lastTokens = new ArrayList<>();
        private final List<Integer> parents = new ArrayList<>();
        private final List<Integer> nameTokens = new ArrayList<>();
        private final List<Integer> delimiters = new ArrayList<>();
        private final List<Integer> flags = new ArrayList<>();
        private final List<List<Integer>> children = new ArrayList<>();
        private final List<List<String>> attributes = new ArrayList<>();
        private final List<Integer> open = new ArrayList<>();

        private Builder(TokenSequence tokens) {
            this.tokens = tokens;
        }

        int open(NodeKind kind, int firstToken) {
            int index = kinds.size();
            int parent = open.isEmpty()
                         ? -1
                         : open.get(open.size() - 1);
            kinds.add(kind);
            firstTokens.add(firstToken);
            lastTokens.add(firstToken);
            parents.add(parent);
            nameTokens.add(-1);
            delimiters.add(-1);
            flags.add(0);
            children.add(new ArrayList<>());
            attributes.add(new ArrayList<>());
            if (parent >= 0) {
                children.get(parent)
                        .add(index);
            }
            open.add(index);
            return index;
        }

        /// Close the node so that it ends at the given token. Nodes that consumed nothing end at
        /// their first token.
        void close(int node, int lastToken) {
            int top = open.remove(open.size() - 1);
            if (top != node) {
                throw new IllegalStateException("Closing node " + node + " while node " + top + " is open");
            }
            lastTokens.set(node, Math.max(firstTokens.get(node), lastToken));
        }

        void name(int node, int token) {
            nameTokens.set(node, token);
        }

        void delimiter(int node, int token) {
            delimiters.set(node, token);
        }

        void flag(int node, NodeFlag flag) {
            flags.set(node, flags.get(node) | flag.mask());
        }

        void attributes(int node, List<String> names) {
            attributes.get(node)
                      .addAll(names);
        }

        SyntaxTree build() {
            if (!open.isEmpty()) {
                throw new IllegalStateException("Unclosed nodes remain: " + open);
            }
            return new SyntaxTree(this);
        }
    }
}
