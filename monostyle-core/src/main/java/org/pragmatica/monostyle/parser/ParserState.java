package org.pragmatica.monostyle.parser;

/// Recovery state of the structural parser.
public enum ParserState {
    /// Input is well formed so far.
    NORMAL,
    /// A structural problem was seen; the parser is resynchronizing on the next member or statement boundary.
    RECOVERING
}
