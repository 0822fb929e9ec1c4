package org.pragmatica.monostyle.parser;

/// Construct kinds recognized by the structural parser.
public enum NodeKind {
    COMPILATION_UNIT,
    USING_DIRECTIVE,
    NAMESPACE,
    TYPE,
    TYPE_PARAMETER_LIST,
    CONSTRAINT_CLAUSE,
    ENUM_MEMBER,
    METHOD,
    CONSTRUCTOR,
    PROPERTY,
    INDEXER,
    ACCESSOR,
    FIELD,
    VARIABLE,
    PARAMETER_LIST,
    PARAMETER,
    BLOCK,
    IF,
    ELSE_CLAUSE,
    CONDITION,
    SWITCH,
    CASE_LABEL,
    LOOP,
    BLOCK_STATEMENT,
    STATEMENT,
    LOCAL_DECLARATION,
    CALL,
    INDEX,
    GENERIC_NAME,
    LAMBDA,
    ANONYMOUS,
    INITIALIZER;

    public boolean isStatement() {
        return switch (this) {
            case BLOCK, IF, SWITCH, LOOP, BLOCK_STATEMENT, STATEMENT, LOCAL_DECLARATION -> true;
            default -> false;
        };
    }

    public boolean isMember() {
        return switch (this) {
            case TYPE, METHOD, CONSTRUCTOR, PROPERTY, INDEXER, FIELD, ENUM_MEMBER -> true;
            default -> false;
        };
    }
}
