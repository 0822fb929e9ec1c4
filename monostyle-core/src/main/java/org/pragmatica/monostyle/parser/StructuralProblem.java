package org.pragmatica.monostyle.parser;

/// Malformed region found while parsing. The region runs from the offending token to end of input.
public sealed interface StructuralProblem {
    /// Index of the offending token.
    int token();

    String message();

    /// Brace without a partner.
    record UnbalancedBraces(int token, String brace) implements StructuralProblem {
        @Override
        public String message() {
            return "Unbalanced brace '" + brace + "'";
        }
    }

    /// Unterminated comment, string or character literal, or an unknown character.
    record MalformedToken(int token, String text) implements StructuralProblem {
        @Override
        public String message() {
            var head = text.length() > 20
                       ? text.substring(0, 20) + "..."
                       : text;
            return "Unterminated or unrecognized token '" + head.replace("\n", "\\n")
                                                               .replace("\r", "\\r") + "'";
        }
    }

    /// Parenthesis or bracket without a partner.
    record UnbalancedDelimiter(int token, String delimiter) implements StructuralProblem {
        @Override
        public String message() {
            return "Unbalanced delimiter '" + delimiter + "'";
        }
    }
}
