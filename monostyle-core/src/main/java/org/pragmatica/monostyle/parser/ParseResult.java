package org.pragmatica.monostyle.parser;

import java.util.List;

/// Outcome of structural parsing. The tree is always present; problems list malformed regions.
public record ParseResult(SyntaxTree tree, List<StructuralProblem> problems, ParserState finalState) {
    public ParseResult {
        problems = List.copyOf(problems);
    }

    public static ParseResult parseResult(SyntaxTree tree, List<StructuralProblem> problems, ParserState finalState) {
        return new ParseResult(tree, problems, finalState);
    }

    public boolean hasProblems() {
        return !problems.isEmpty();
    }

    /// Character offsets where malformed regions begin; each region extends to end of input.
    public List<Integer> errorRegionStarts() {
        return problems.stream()
                       .map(problem -> tree.tokens()
                                           .get(problem.token())
                                           .start())
                       .sorted()
                       .toList();
    }
}
