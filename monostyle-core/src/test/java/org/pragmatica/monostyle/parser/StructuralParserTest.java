package org.pragmatica.monostyle.parser;

import org.pragmatica.monostyle.token.Tokenizer;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StructuralParserTest {

    @Test
    void parse_buildsDeclarationsAndStatements() {
        var result = parse("""
                using System;
                namespace Demo {
                \tclass Box<T> where T : class
                \t{
                \t\tint count;
                \t\tpublic T Value { get; set; }
                \t\tpublic void Put (T item)
                \t\t{
                \t\t\tif (item != null)
                \t\t\t\tcount++;
                \t\t}
                \t}
                }
                """);

        assertThat(result.problems()).isEmpty();
        assertThat(result.finalState()).isEqualTo(ParserState.NORMAL);
        assertThat(kinds(result)).contains(NodeKind.USING_DIRECTIVE,
                                           NodeKind.NAMESPACE,
                                           NodeKind.TYPE,
                                           NodeKind.TYPE_PARAMETER_LIST,
                                           NodeKind.CONSTRAINT_CLAUSE,
                                           NodeKind.FIELD,
                                           NodeKind.PROPERTY,
                                           NodeKind.ACCESSOR,
                                           NodeKind.METHOD,
                                           NodeKind.PARAMETER,
                                           NodeKind.IF,
                                           NodeKind.CONDITION);
        var type = first(result, NodeKind.TYPE).orElseThrow();
        assertThat(type.name()).contains("Box");
        assertThat(type.has(NodeFlag.GENERIC)).isTrue();
        assertThat(type.has(NodeFlag.CONSTRAINED)).isTrue();
        assertThat(type.parent()
                       .map(SyntaxNode::kind)).contains(NodeKind.NAMESPACE);
        assertThat(first(result, NodeKind.METHOD).flatMap(SyntaxNode::name)).contains("Put");
    }

    @Test
    void parse_recordsUsingDirectiveKinds() {
        var result = parse("using System;\nusing static System.Math;\nusing Json = Newtonsoft.Json;\n");
        var directives = result.tree()
                               .root()
                               .children(NodeKind.USING_DIRECTIVE);

        assertThat(directives).hasSize(3);
        assertThat(directives.get(0)
                             .name()).contains("System");
        assertThat(directives.get(1)
                             .has(NodeFlag.STATIC_DIRECTIVE)).isTrue();
        assertThat(directives.get(2)
                             .has(NodeFlag.ALIAS_DIRECTIVE)).isTrue();
        assertThat(directives.get(2)
                             .name()).contains("Json");
    }

    @Test
    void parse_recognizesLocalsInBlocksAndLoopHeaders() {
        var result = parse("""
                void Run ()
                {
                \tint first_value = 1;
                \tforeach (var item in items) {
                \t}
                }
                """);

        var names = result.tree()
                          .nodes()
                          .stream()
                          .filter(node -> node.is(NodeKind.VARIABLE))
                          .map(node -> node.name()
                                           .orElse(""))
                          .toList();
        assertThat(names).containsExactly("first_value", "item");
        assertThat(first(result, NodeKind.LOCAL_DECLARATION).flatMap(SyntaxNode::parent)
                                                           .map(SyntaxNode::kind)).contains(NodeKind.BLOCK);
    }

    @Test
    void parse_buildsCallIndexAndLambdaNodes() {
        var result = parse("""
                void Run ()
                {
                \tvar x = array [10];
                \titems.Select (item => item.Name);
                }
                """);

        assertThat(kinds(result)).contains(NodeKind.INDEX, NodeKind.CALL, NodeKind.LAMBDA);
        var lambda = first(result, NodeKind.LAMBDA).orElseThrow();
        assertThat(lambda.firstChild(NodeKind.PARAMETER_LIST)
                         .flatMap(list -> list.firstChild(NodeKind.PARAMETER))
                         .flatMap(SyntaxNode::name)).contains("item");
    }

    @Test
    void parse_recoversFromMissingClosingBrace() {
        var text = "class A {\n\tvoid M ()\n\t{\n\t\tcall ();\n}\n";
        var result = parse(text);

        assertThat(result.problems()).hasSize(1);
        assertThat(result.problems()
                         .get(0)).isInstanceOf(StructuralProblem.UnbalancedBraces.class);
        assertThat(result.finalState()).isEqualTo(ParserState.RECOVERING);
        assertThat(first(result, NodeKind.METHOD)).isPresent();
        assertThat(result.errorRegionStarts()).containsExactly(text.indexOf('{'));
    }

    @Test
    void parse_reportsStrayClosingBrace() {
        var result = parse("class A {\n}\n}\n");

        assertThat(result.problems()).singleElement()
                                     .isInstanceOf(StructuralProblem.UnbalancedBraces.class);
        assertThat(first(result, NodeKind.TYPE)).isPresent();
    }

    @Test
    void parse_reportsUnterminatedLiteralAndKeepsEarlierStructure() {
        var result = parse("class A {\n\tvoid M ()\n\t{\n\t}\n\tstring s = \"open\n}\n");

        assertThat(result.problems()).anyMatch(problem -> problem instanceof StructuralProblem.MalformedToken);
        assertThat(first(result, NodeKind.METHOD)).isPresent();
    }

    @Test
    void parse_reportsUnbalancedParenthesis() {
        var result = parse("void M ()\n{\n\tcall (a;\n}\n");

        assertThat(result.problems()).anyMatch(problem -> problem instanceof StructuralProblem.UnbalancedDelimiter);
    }

    private static ParseResult parse(String text) {
        return StructuralParser.parse(Tokenizer.tokenize(text));
    }

    private static List<NodeKind> kinds(ParseResult result) {
        return result.tree()
                     .nodes()
                     .stream()
                     .map(SyntaxNode::kind)
                     .toList();
    }

    private static Optional<SyntaxNode> first(ParseResult result, NodeKind kind) {
        return result.tree()
                     .nodes()
                     .stream()
                     .filter(node -> node.is(kind))
                     .findFirst();
    }
}
