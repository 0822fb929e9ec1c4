package org.pragmatica.monostyle.parser;

/// Boolean facts recorded on nodes while parsing.
public enum NodeFlag {
    /// Declares type parameters.
    GENERIC,
    /// Has `where` constraint clauses.
    CONSTRAINED,
    /// Body is `=> expression;`.
    EXPRESSION_BODY,
    STATIC,
    CONST,
    /// File-scoped `namespace X;`.
    FILE_SCOPED,
    /// `using static X;` directive.
    STATIC_DIRECTIVE,
    /// `using Alias = X;` directive.
    ALIAS_DIRECTIVE;

    int mask() {
        return 1 << ordinal();
    }
}
