package org.pragmatica.monostyle.parser;

import org.pragmatica.monostyle.token.Token;
import org.pragmatica.monostyle.token.TokenKind;
import org.pragmatica.monostyle.token.TokenSequence;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.pragmatica.monostyle.parser.NodeKind.*;
import static org.pragmatica.monostyle.token.TokenKind.*;

/// Recursive-descent parser producing a structural tree that is just deep enough for style rules.
///
/// The parser never fails. Unbalanced braces, unterminated literals and stray tokens are recorded as
/// {@link StructuralProblem}s, open scopes are closed at end of input and parsing resumes at the next
/// plausible member or statement boundary.
public final class StructuralParser {
    private static final Logger log = LoggerFactory.getLogger(StructuralParser.class);

    private static final Set<String> MODIFIERS = Set.of("public", "private", "protected", "internal", "static",
                                                        "readonly", "const", "abstract", "sealed", "virtual",
                                                        "override", "extern", "unsafe", "volatile", "new", "event",
                                                        "fixed");
    private static final Set<String> CONTEXTUAL_MODIFIERS = Set.of("partial", "async", "required");
    private static final Set<String> TYPE_KEYWORDS = Set.of("class", "struct", "interface", "enum");
    private static final Set<String> BUILTIN_TYPES = Set.of("bool", "byte", "char", "decimal", "double", "float",
                                                            "int", "long", "object", "sbyte", "short", "string",
                                                            "uint", "ulong", "ushort", "void");
    private static final Set<String> ACCESSORS = Set.of("get", "set", "init", "add", "remove");
    private static final Set<String> ACCESSOR_MODIFIERS = Set.of("private", "protected", "internal", "readonly");
    private static final Set<String> CALLABLE_KEYWORDS = Set.of("typeof", "sizeof", "default", "checked",
                                                                "unchecked", "this", "base");
    private static final Set<String> PARAMETER_MODIFIERS = Set.of("ref", "out", "in", "params", "this", "readonly",
                                                                  "scoped");
    private static final Set<String> LOCAL_MODIFIERS = Set.of("const", "ref", "readonly", "using", "scoped");
    private static final Set<String> LOCAL_FUNCTION_MODIFIERS = Set.of("static", "async", "unsafe", "extern");
    private static final Set<String> EXPRESSION_WORDS = Set.of("await", "yield", "nameof");
    private static final Set<String> LOOP_KEYWORDS = Set.of("for", "foreach", "while");
    private static final Set<String> GUARDED_KEYWORDS = Set.of("lock", "fixed", "using", "checked", "unchecked",
                                                               "unsafe");

    private final TokenSequence tokens;
    private final SyntaxTree.Builder builder;
    private final List<StructuralProblem> problems = new ArrayList<>();
    private final Set<Integer> reported = new HashSet<>();
    private ParserState state = ParserState.NORMAL;
    private int pos;

    private StructuralParser(TokenSequence tokens) {
        this.tokens = tokens;
        this.builder = SyntaxTree.builder(tokens);
    }

    public static ParseResult parse(TokenSequence tokens) {
        return new StructuralParser(tokens).parseCompilationUnit();
    }

    private ParseResult parseCompilationUnit() {
        int root = builder.open(COMPILATION_UNIT, 0);
        parseMembers(-1, "");
        builder.close(root, tokens.lastIndex());
        reportUnpaired();
        problems.sort(Comparator.comparingInt(StructuralProblem::token));
        var tree = builder.build();
        log.debug("Parsed {} nodes, {} structural problems", tree.size(), problems.size());
        return ParseResult.parseResult(tree, problems, state);
    }

    // --- Members -------------------------------------------------------------------------------------------

    private void parseMembers(int openBrace, String typeName) {
        while (true) {
            var token = current();
            if (token.is(END_OF_FILE)) {
                if (openBrace >= 0) {
                    unbalanced(openBrace);
                }
                return;
            }
            if (token.is(CLOSE_BRACE)) {
                if (openBrace >= 0) {
                    return;
                }
                unbalanced(pos);
                advance();
                continue;
            }
            if (state == ParserState.RECOVERING) {
                if (!isSynchronizationPoint()) {
                    advance();
                    continue;
                }
                state = ParserState.NORMAL;
            }
            int before = pos;
            parseMember(typeName);
            if (pos == before) {
                advance();
            }
        }
    }

    private void parseMember(String typeName) {
        int start = pos;
        var attributes = parseAttributes();
        if (current().isKeyword("using") && !peek(1).is(OPEN_PAREN)) {
            parseUsingDirective(start);
            return;
        }
        if (current().isKeyword("namespace")) {
            parseNamespace(start);
            return;
        }
        var flags = parseModifiers();
        switch (classifyMember(typeName)) {
            case TYPE -> parseType(start, attributes, flags);
            case DELEGATE -> parseDelegate(start, flags);
            case DESTRUCTOR -> parseDestructor(start, flags);
            case CONSTRUCTOR -> parseConstructor(start, flags);
            case CONVERSION -> parseConversion(start, flags);
            case OPERATOR -> parseOperator(start, flags);
            case METHOD -> parseMethod(start, flags);
            case PROPERTY -> parseProperty(start, flags);
            case INDEXER -> parseIndexer(start, flags);
            case FIELD -> parseField(start, flags);
            case OTHER -> parseStrayMember(start);
        }
    }

    private enum MemberShape {
        TYPE,
        DELEGATE,
        DESTRUCTOR,
        CONSTRUCTOR,
        CONVERSION,
        OPERATOR,
        METHOD,
        PROPERTY,
        INDEXER,
        FIELD,
        OTHER
    }

    private MemberShape classifyMember(String typeName) {
        var token = current();
        if (isTypeDeclarationStart()) {
            return MemberShape.TYPE;
        }
        if (token.isKeyword("delegate") && !peek(1).is(OPEN_PAREN) && !peek(1).is(OPEN_BRACE)) {
            return MemberShape.DELEGATE;
        }
        if (token.is(UNARY_OPERATOR, "~") && peek(1).is(IDENTIFIER)) {
            return MemberShape.DESTRUCTOR;
        }
        if (token.is(IDENTIFIER) && token.text()
                                         .equals(typeName) && peek(1).is(OPEN_PAREN)) {
            return MemberShape.CONSTRUCTOR;
        }
        if (token.isKeyword("implicit") || token.isKeyword("explicit")) {
            return MemberShape.CONVERSION;
        }
        int afterType = skipType(pos);
        if (afterType < 0) {
            return MemberShape.OTHER;
        }
        var next = tokens.get(afterType);
        if (next.isKeyword("operator")) {
            return MemberShape.OPERATOR;
        }
        if (next.isKeyword("this") && tokens.get(afterType + 1)
                                            .is(OPEN_BRACKET)) {
            return MemberShape.INDEXER;
        }
        if (!next.is(IDENTIFIER)) {
            return MemberShape.OTHER;
        }
        var afterName = tokens.get(skipMemberName(afterType));
        return switch (afterName.kind()) {
            case GENERIC_OPEN, OPEN_PAREN -> MemberShape.METHOD;
            case OPEN_BRACE, ARROW -> MemberShape.PROPERTY;
            case SEMICOLON, COMMA, OPEN_BRACKET -> MemberShape.FIELD;
            case ASSIGNMENT -> afterName.text()
                                        .equals("=")
                               ? MemberShape.FIELD
                               : MemberShape.OTHER;
            default -> MemberShape.OTHER;
        };
    }

    private void parseUsingDirective(int start) {
        int node = builder.open(USING_DIRECTIVE, start);
        advance();
        if (current().isKeyword("static")) {
            builder.flag(node, NodeFlag.STATIC_DIRECTIVE);
            advance();
        }
        if (current().is(IDENTIFIER) && peek(1).is(ASSIGNMENT, "=")) {
            builder.flag(node, NodeFlag.ALIAS_DIRECTIVE);
            builder.name(node, pos);
            advance();
            advance();
        } else {
            builder.name(node, pos);
        }
        while (!isAtAny(SEMICOLON, OPEN_BRACE, CLOSE_BRACE, END_OF_FILE)) {
            advance();
        }
        if (current().is(SEMICOLON)) {
            advance();
        }
        builder.close(node, pos - 1);
    }

    private void parseNamespace(int start) {
        int node = builder.open(NAMESPACE, start);
        advance();
        builder.name(node, pos);
        while (current().is(IDENTIFIER) || current().is(DOT)) {
            advance();
        }
        if (current().is(SEMICOLON)) {
            builder.flag(node, NodeFlag.FILE_SCOPED);
            advance();
            parseMembers(-1, "");
        } else if (current().is(OPEN_BRACE)) {
            int brace = pos;
            builder.delimiter(node, brace);
            advance();
            parseMembers(brace, "");
            if (current().is(CLOSE_BRACE)) {
                advance();
            }
        }
        builder.close(node, pos - 1);
    }

    private void parseType(int start, List<String> attributes, Set<NodeFlag> flags) {
        int node = builder.open(TYPE, start);
        builder.attributes(node, attributes);
        flags.forEach(flag -> builder.flag(node, flag));
        boolean isEnum = current().isKeyword("enum");
        if (current().isWord("record")) {
            advance();
            if (current().isKeyword("class") || current().isKeyword("struct")) {
                advance();
            }
        } else {
            advance();
        }
        var name = "";
        if (current().is(IDENTIFIER)) {
            builder.name(node, pos);
            name = current().text();
            advance();
        }
        if (current().is(GENERIC_OPEN)) {
            parseTypeParameterList();
            builder.flag(node, NodeFlag.GENERIC);
        }
        if (current().is(OPEN_PAREN)) {
            parseParameterList(CLOSE_PAREN);
        }
        if (current().is(COLON)) {
            advance();
            parseBaseList();
        }
        while (isConstraintStart()) {
            parseConstraintClause();
            builder.flag(node, NodeFlag.CONSTRAINED);
        }
        if (current().is(OPEN_BRACE)) {
            int brace = pos;
            builder.delimiter(node, brace);
            advance();
            if (isEnum) {
                parseEnumMembers(brace);
            } else {
                parseMembers(brace, name);
            }
            if (current().is(CLOSE_BRACE)) {
                advance();
            }
        }
        if (current().is(SEMICOLON)) {
            advance();
        }
        builder.close(node, pos - 1);
    }

    private void parseBaseList() {
        while (isTypeStart(current())) {
            parseTypeReference();
            if (current().is(OPEN_PAREN)) {
                parseGroup(CLOSE_PAREN);
            }
            if (!current().is(COMMA)) {
                return;
            }
            advance();
        }
    }

    private void parseEnumMembers(int brace) {
        while (true) {
            if (current().is(END_OF_FILE)) {
                unbalanced(brace);
                return;
            }
            if (current().is(CLOSE_BRACE)) {
                return;
            }
            int start = pos;
            parseAttributes();
            if (current().is(IDENTIFIER)) {
                int member = builder.open(ENUM_MEMBER, start);
                builder.name(member, pos);
                advance();
                if (current().is(ASSIGNMENT, "=")) {
                    advance();
                    parseExpression(EnumSet.of(COMMA, CLOSE_BRACE));
                }
                builder.close(member, pos - 1);
            }
            if (current().is(COMMA)) {
                advance();
            } else if (pos == start) {
                advance();
            }
        }
    }

    private void parseDelegate(int start, Set<NodeFlag> flags) {
        int node = openMember(METHOD, start, flags);
        advance();
        parseTypeReference();
        if (current().is(IDENTIFIER)) {
            builder.name(node, pos);
            advance();
        }
        parseMethodRest(node);
    }

    private void parseDestructor(int start, Set<NodeFlag> flags) {
        int node = openMember(METHOD, start, flags);
        advance();
        builder.name(node, pos);
        advance();
        parseMethodRest(node);
    }

    private void parseConstructor(int start, Set<NodeFlag> flags) {
        int node = openMember(CONSTRUCTOR, start, flags);
        builder.name(node, pos);
        advance();
        parseMethodRest(node);
    }

    private void parseConversion(int start, Set<NodeFlag> flags) {
        int node = openMember(METHOD, start, flags);
        advance();
        if (current().isKeyword("operator")) {
            advance();
        }
        builder.name(node, pos);
        parseTypeReference();
        parseMethodRest(node);
    }

    private void parseOperator(int start, Set<NodeFlag> flags) {
        int node = openMember(METHOD, start, flags);
        parseTypeReference();
        advance();
        builder.name(node, pos);
        while (!isAtAny(OPEN_PAREN, OPEN_BRACE, SEMICOLON, CLOSE_BRACE, END_OF_FILE) && pos - start < 64) {
            advance();
        }
        parseMethodRest(node);
    }

    private void parseMethod(int start, Set<NodeFlag> flags) {
        int node = openMember(METHOD, start, flags);
        parseTypeReference();
        parseMemberName(node);
        parseMethodRest(node);
    }

    private void parseMethodRest(int node) {
        if (current().is(GENERIC_OPEN)) {
            parseTypeParameterList();
            builder.flag(node, NodeFlag.GENERIC);
        }
        if (current().is(OPEN_PAREN)) {
            parseParameterList(CLOSE_PAREN);
        }
        if (current().is(COLON)) {
            advance();
            parseExpression(EnumSet.of(OPEN_BRACE, ARROW));
        }
        while (isConstraintStart()) {
            parseConstraintClause();
            builder.flag(node, NodeFlag.CONSTRAINED);
        }
        parseBody(node);
        builder.close(node, pos - 1);
    }

    private void parseBody(int node) {
        if (current().is(OPEN_BRACE)) {
            builder.delimiter(node, pos);
            parseBlock();
        } else if (current().is(ARROW)) {
            builder.flag(node, NodeFlag.EXPRESSION_BODY);
            advance();
            parseExpression(EnumSet.noneOf(TokenKind.class));
            if (current().is(SEMICOLON)) {
                advance();
            }
        } else if (current().is(SEMICOLON)) {
            advance();
        }
    }

    private void parseProperty(int start, Set<NodeFlag> flags) {
        int node = openMember(PROPERTY, start, flags);
        parseTypeReference();
        parseMemberName(node);
        parsePropertyBody(node);
    }

    private void parseIndexer(int start, Set<NodeFlag> flags) {
        int node = openMember(INDEXER, start, flags);
        parseTypeReference();
        builder.name(node, pos);
        advance();
        parseParameterList(CLOSE_BRACKET);
        parsePropertyBody(node);
    }

    private void parsePropertyBody(int node) {
        if (current().is(OPEN_BRACE)) {
            builder.delimiter(node, pos);
            parseAccessors();
            if (current().is(ASSIGNMENT, "=")) {
                advance();
                parseExpression(EnumSet.noneOf(TokenKind.class));
                if (current().is(SEMICOLON)) {
                    advance();
                }
            }
        } else {
            parseBody(node);
        }
        builder.close(node, pos - 1);
    }

    private void parseAccessors() {
        int brace = pos;
        advance();
        while (true) {
            if (current().is(END_OF_FILE)) {
                unbalanced(brace);
                return;
            }
            if (current().is(CLOSE_BRACE)) {
                advance();
                return;
            }
            int start = pos;
            parseAttributes();
            while (current().is(KEYWORD) && ACCESSOR_MODIFIERS.contains(current().text())) {
                advance();
            }
            if (current().is(IDENTIFIER) && ACCESSORS.contains(current().text())) {
                int accessor = builder.open(ACCESSOR, start);
                builder.name(accessor, pos);
                advance();
                parseBody(accessor);
                builder.close(accessor, pos - 1);
            } else if (pos == start) {
                advance();
            }
        }
    }

    private void parseField(int start, Set<NodeFlag> flags) {
        int node = openMember(FIELD, start, flags);
        parseTypeReference();
        if (current().is(IDENTIFIER)) {
            builder.name(node, pos);
        }
        parseDeclarators();
        if (current().is(SEMICOLON)) {
            advance();
        }
        builder.close(node, pos - 1);
    }

    private void parseDeclarators() {
        while (current().is(IDENTIFIER)) {
            int variable = builder.open(VARIABLE, pos);
            builder.name(variable, pos);
            advance();
            if (current().is(OPEN_BRACKET) && tokens.matching(pos) > pos) {
                advanceTo(tokens.matching(pos) + 1);
            }
            if (current().is(ASSIGNMENT, "=")) {
                advance();
                parseExpression(EnumSet.of(COMMA));
            }
            builder.close(variable, pos - 1);
            if (!current().is(COMMA)) {
                return;
            }
            advance();
        }
    }

    private void parseStrayMember(int start) {
        if (pos == start) {
            parseStatement();
            return;
        }
        int node = builder.open(STATEMENT, start);
        parseExpression(EnumSet.noneOf(TokenKind.class));
        if (current().is(SEMICOLON)) {
            advance();
        }
        builder.close(node, pos - 1);
    }

    private int openMember(NodeKind kind, int start, Set<NodeFlag> flags) {
        int node = builder.open(kind, start);
        flags.forEach(flag -> builder.flag(node, flag));
        return node;
    }

    private List<String> parseAttributes() {
        var names = new ArrayList<String>();
        while (current().is(OPEN_BRACKET) && tokens.matching(pos) > pos) {
            int close = tokens.matching(pos);
            collectAttributeNames(pos, close, names);
            advanceTo(close + 1);
        }
        return names;
    }

    private void collectAttributeNames(int open, int close, List<String> names) {
        int depth = 0;
        for (int i = open + 1; i < close; i++) {
            var token = tokens.get(i);
            if (token.is(OPEN_PAREN)) {
                depth++;
            } else if (token.is(CLOSE_PAREN)) {
                depth--;
            } else if (depth == 0 && token.is(IDENTIFIER) && startsAttribute(i)) {
                while (tokens.get(i + 1)
                             .is(DOT) && tokens.get(i + 2)
                                               .is(IDENTIFIER)) {
                    i += 2;
                }
                var name = tokens.get(i)
                                 .text();
                names.add(name.endsWith("Attribute") && name.length() > "Attribute".length()
                          ? name.substring(0, name.length() - "Attribute".length())
                          : name);
            }
        }
    }

    private boolean startsAttribute(int index) {
        var previous = tokens.get(index - 1);
        return (previous.is(OPEN_BRACKET) || previous.is(COMMA) || previous.is(COLON)) && !tokens.get(index + 1)
                                                                                                 .is(COLON);
    }

    private Set<NodeFlag> parseModifiers() {
        var flags = EnumSet.noneOf(NodeFlag.class);
        while (true) {
            var token = current();
            if (token.is(KEYWORD) && MODIFIERS.contains(token.text())) {
                if (token.text()
                         .equals("static")) {
                    flags.add(NodeFlag.STATIC);
                } else if (token.text()
                                .equals("const")) {
                    flags.add(NodeFlag.CONST);
                }
                advance();
            } else if (token.is(IDENTIFIER) && CONTEXTUAL_MODIFIERS.contains(token.text()) && (peek(1).is(IDENTIFIER) || peek(1).is(KEYWORD))) {
                advance();
            } else {
                return flags;
            }
        }
    }

    private boolean isTypeDeclarationStart() {
        var token = current();
        if (token.is(KEYWORD) && TYPE_KEYWORDS.contains(token.text())) {
            return true;
        }
        return token.isWord("record") && (peek(1).is(IDENTIFIER) || peek(1).isKeyword("class") || peek(1).isKeyword("struct"));
    }

    private boolean isConstraintStart() {
        return current().isWord("where") && peek(1).is(IDENTIFIER) && peek(2).is(COLON);
    }

    private void parseConstraintClause() {
        int node = builder.open(CONSTRAINT_CLAUSE, pos);
        advance();
        while (!isAtAny(END_OF_FILE, OPEN_BRACE, CLOSE_BRACE, SEMICOLON, ARROW) && !isConstraintStart()) {
            if (current().is(OPEN_PAREN) && tokens.matching(pos) > pos) {
                advanceTo(tokens.matching(pos) + 1);
            } else {
                advance();
            }
        }
        builder.close(node, pos - 1);
    }

    private void parseTypeParameterList() {
        int node = builder.open(TYPE_PARAMETER_LIST, pos);
        builder.delimiter(node, pos);
        int close = tokens.matching(pos);
        if (close > pos) {
            advanceTo(close + 1);
        } else {
            advance();
        }
        builder.close(node, pos - 1);
    }

    private void parseParameterList(TokenKind closeKind) {
        int node = builder.open(PARAMETER_LIST, pos);
        builder.delimiter(node, pos);
        advance();
        while (true) {
            var token = current();
            if (token.is(closeKind)) {
                advance();
                break;
            }
            if (token.is(END_OF_FILE) || token.is(SEMICOLON) || token.is(OPEN_BRACE) || token.is(CLOSE_BRACE)) {
                break;
            }
            if (token.is(COMMA)) {
                advance();
                continue;
            }
            int before = pos;
            parseParameter(closeKind);
            if (pos == before) {
                advance();
            }
        }
        builder.close(node, pos - 1);
    }

    private void parseParameter(TokenKind closeKind) {
        int start = pos;
        parseAttributes();
        int node = builder.open(PARAMETER, start);
        while (isParameterModifier(current()) && !peek(1).is(COMMA) && !peek(1).is(closeKind)) {
            advance();
        }
        int typeStart = pos;
        if (isTypeStart(current())) {
            parseTypeReference();
        }
        if (current().is(IDENTIFIER)) {
            builder.name(node, pos);
            advance();
        } else if (pos - typeStart == 1 && tokens.get(typeStart)
                                                 .is(IDENTIFIER)) {
            builder.name(node, typeStart);
        }
        if (current().is(ASSIGNMENT, "=")) {
            advance();
            parseExpression(EnumSet.of(COMMA, closeKind));
        }
        builder.close(node, pos - 1);
    }

    private static boolean isParameterModifier(Token token) {
        return (token.is(KEYWORD) || token.is(IDENTIFIER)) && PARAMETER_MODIFIERS.contains(token.text());
    }

    private void parseMemberName(int node) {
        int last = -1;
        while (current().is(IDENTIFIER)) {
            last = pos;
            advance();
            if (current().is(GENERIC_OPEN)) {
                int close = tokens.matching(pos);
                if (close > pos && tokens.get(close + 1)
                                         .is(DOT)) {
                    advanceTo(close + 1);
                }
            }
            if (!(current().is(DOT) && peek(1).is(IDENTIFIER))) {
                break;
            }
            advance();
        }
        if (last >= 0) {
            builder.name(node, last);
        }
    }

    private int skipMemberName(int index) {
        int i = index;
        while (tokens.get(i)
                     .is(IDENTIFIER)) {
            i++;
            if (tokens.get(i)
                      .is(GENERIC_OPEN)) {
                int close = tokens.matching(i);
                if (close > i && tokens.get(close + 1)
                                       .is(DOT)) {
                    i = close + 1;
                }
            }
            if (!(tokens.get(i)
                        .is(DOT) && tokens.get(i + 1)
                                          .is(IDENTIFIER))) {
                break;
            }
            i++;
        }
        return Math.min(i, tokens.lastIndex());
    }

    // --- Types ---------------------------------------------------------------------------------------------

    private static boolean isTypeStart(Token token) {
        return token.is(IDENTIFIER) || token.is(OPEN_PAREN) || (token.is(KEYWORD) && BUILTIN_TYPES.contains(token.text()));
    }

    /// Consume a type reference, building generic-name nodes for instantiated generic types.
    private void parseTypeReference() {
        var token = current();
        if (token.is(OPEN_PAREN)) {
            int close = tokens.matching(pos);
            if (close < pos) {
                return;
            }
            advanceTo(close + 1);
        } else if (token.is(IDENTIFIER) || (token.is(KEYWORD) && BUILTIN_TYPES.contains(token.text()))) {
            while (true) {
                if (current().is(IDENTIFIER) && peek(1).is(GENERIC_OPEN)) {
                    parseGenericName();
                } else {
                    advance();
                }
                if (!(current().is(DOT) && peek(1).is(IDENTIFIER))) {
                    break;
                }
                advance();
            }
        } else {
            return;
        }
        while (true) {
            if (current().is(QUESTION) || current().is(BINARY_OPERATOR, "*")) {
                advance();
            } else if (isRankSpecifier(pos)) {
                advanceTo(tokens.matching(pos) + 1);
            } else {
                return;
            }
        }
    }

    /// Index just past a type reference starting at the given token, or -1 when none starts there.
    private int skipType(int index) {
        int i = index;
        var token = tokens.get(i);
        if (token.is(OPEN_PAREN)) {
            int close = tokens.matching(i);
            if (close < i) {
                return -1;
            }
            i = close + 1;
        } else if (token.is(IDENTIFIER) || (token.is(KEYWORD) && BUILTIN_TYPES.contains(token.text()))) {
            i++;
            while (true) {
                if (tokens.get(i)
                          .is(GENERIC_OPEN)) {
                    int close = tokens.matching(i);
                    if (close < i) {
                        return -1;
                    }
                    i = close + 1;
                }
                if (tokens.get(i)
                          .is(DOT) && tokens.get(i + 1)
                                            .is(IDENTIFIER)) {
                    i += 2;
                    continue;
                }
                break;
            }
        } else {
            return -1;
        }
        while (true) {
            var suffix = tokens.get(i);
            if (suffix.is(QUESTION) || suffix.is(BINARY_OPERATOR, "*")) {
                i++;
            } else if (isRankSpecifier(i)) {
                i = tokens.matching(i) + 1;
            } else {
                return Math.min(i, tokens.lastIndex());
            }
        }
    }

    /// `[]` or `[,,]` following an array element type.
    private boolean isRankSpecifier(int index) {
        if (!tokens.get(index)
                   .is(OPEN_BRACKET)) {
            return false;
        }
        int close = tokens.matching(index);
        if (close < index) {
            return false;
        }
        for (int i = index + 1; i < close; i++) {
            if (!tokens.get(i)
                       .is(COMMA)) {
                return false;
            }
        }
        return true;
    }

    private void parseGenericName() {
        int node = builder.open(GENERIC_NAME, pos);
        builder.name(node, pos);
        advance();
        builder.delimiter(node, pos);
        int close = tokens.matching(pos);
        advance();
        while (!isAtAny(GENERIC_CLOSE, SEMICOLON, OPEN_BRACE, CLOSE_BRACE, END_OF_FILE) && (close < 0 || pos < close)) {
            int before = pos;
            parseTypeReference();
            if (current().is(COMMA)) {
                advance();
            }
            if (pos == before) {
                advance();
            }
        }
        if (current().is(GENERIC_CLOSE)) {
            advance();
        }
        builder.close(node, pos - 1);
    }

    // --- Statements ----------------------------------------------------------------------------------------

    private void parseBlock() {
        int brace = pos;
        int node = builder.open(BLOCK, brace);
        builder.delimiter(node, brace);
        advance();
        parseStatements(brace);
        if (current().is(CLOSE_BRACE)) {
            advance();
        }
        builder.close(node, pos - 1);
    }

    private void parseStatements(int brace) {
        while (true) {
            var token = current();
            if (token.is(END_OF_FILE)) {
                unbalanced(brace);
                return;
            }
            if (token.is(CLOSE_BRACE)) {
                return;
            }
            state = ParserState.NORMAL;
            int before = pos;
            parseStatement();
            if (pos == before) {
                advance();
            }
        }
    }

    private void parseStatement() {
        var token = current();
        if (token.is(OPEN_BRACE)) {
            parseBlock();
        } else if (token.is(SEMICOLON)) {
            int node = builder.open(STATEMENT, pos);
            advance();
            builder.close(node, pos - 1);
        } else if (token.isKeyword("if")) {
            parseIf();
        } else if (token.isKeyword("switch")) {
            parseSwitch();
        } else if (token.is(KEYWORD) && LOOP_KEYWORDS.contains(token.text())) {
            parseLoop();
        } else if (token.isKeyword("do")) {
            parseDo();
        } else if (token.isKeyword("try")) {
            parseTry();
        } else if (isGuardedStatement(token)) {
            parseGuarded();
        } else if (isLocalFunction()) {
            int start = pos;
            parseMethod(start, parseModifiers());
        } else if (isLocalDeclaration()) {
            parseLocalDeclaration();
        } else {
            parseExpressionStatement();
        }
    }

    private boolean isGuardedStatement(Token token) {
        if (!token.is(KEYWORD) || !GUARDED_KEYWORDS.contains(token.text())) {
            return false;
        }
        return switch (token.text()) {
            case "checked", "unchecked", "unsafe" -> peek(1).is(OPEN_BRACE);
            default -> peek(1).is(OPEN_PAREN);
        };
    }

    /// Body of `if`, `else` and loops: absent only at a closing brace or end of input.
    private void parseEmbeddedStatement() {
        if (!current().is(CLOSE_BRACE) && !current().is(END_OF_FILE)) {
            parseStatement();
        }
    }

    private void parseIf() {
        int node = builder.open(IF, pos);
        advance();
        if (current().is(OPEN_PAREN)) {
            parseCondition("if");
        }
        parseEmbeddedStatement();
        if (current().isKeyword("else")) {
            int clause = builder.open(ELSE_CLAUSE, pos);
            advance();
            parseEmbeddedStatement();
            builder.close(clause, pos - 1);
        }
        builder.close(node, pos - 1);
    }

    private void parseLoop() {
        int node = builder.open(LOOP, pos);
        var keyword = current().text();
        advance();
        if (current().is(OPEN_PAREN)) {
            parseCondition(keyword);
        }
        parseEmbeddedStatement();
        builder.close(node, pos - 1);
    }

    private void parseDo() {
        int node = builder.open(LOOP, pos);
        advance();
        parseEmbeddedStatement();
        if (current().isKeyword("while")) {
            advance();
            if (current().is(OPEN_PAREN)) {
                parseCondition("while");
            }
            if (current().is(SEMICOLON)) {
                advance();
            }
        }
        builder.close(node, pos - 1);
    }

    private void parseTry() {
        int node = builder.open(BLOCK_STATEMENT, pos);
        advance();
        if (current().is(OPEN_BRACE)) {
            parseBlock();
        }
        while (current().isKeyword("catch")) {
            advance();
            if (current().is(OPEN_PAREN)) {
                parseCondition("catch");
            }
            if (current().isWord("when")) {
                advance();
                if (current().is(OPEN_PAREN)) {
                    parseCondition("when");
                }
            }
            if (current().is(OPEN_BRACE)) {
                parseBlock();
            }
        }
        if (current().isKeyword("finally")) {
            advance();
            if (current().is(OPEN_BRACE)) {
                parseBlock();
            }
        }
        builder.close(node, pos - 1);
    }

    private void parseGuarded() {
        int node = builder.open(BLOCK_STATEMENT, pos);
        var keyword = current().text();
        advance();
        if (current().is(OPEN_PAREN)) {
            parseCondition(keyword);
        }
        parseEmbeddedStatement();
        builder.close(node, pos - 1);
    }

    private void parseSwitch() {
        int node = builder.open(SWITCH, pos);
        advance();
        if (current().is(OPEN_PAREN)) {
            parseCondition("switch");
        }
        if (current().is(OPEN_BRACE)) {
            int brace = pos;
            builder.delimiter(node, brace);
            advance();
            parseSwitchSections(brace);
            if (current().is(CLOSE_BRACE)) {
                advance();
            }
        }
        builder.close(node, pos - 1);
    }

    private void parseSwitchSections(int brace) {
        while (true) {
            var token = current();
            if (token.is(END_OF_FILE)) {
                unbalanced(brace);
                return;
            }
            if (token.is(CLOSE_BRACE)) {
                return;
            }
            int before = pos;
            if (token.isKeyword("case") || (token.isKeyword("default") && peek(1).is(COLON))) {
                parseCaseLabel();
            } else {
                parseStatement();
            }
            if (pos == before) {
                advance();
            }
        }
    }

    private void parseCaseLabel() {
        int node = builder.open(CASE_LABEL, pos);
        advance();
        while (!isAtAny(SEMICOLON, OPEN_BRACE, CLOSE_BRACE, END_OF_FILE)) {
            if (current().is(COLON)) {
                advance();
                break;
            }
            if (current().kind()
                         .isOpening() && tokens.matching(pos) > pos) {
                advanceTo(tokens.matching(pos) + 1);
            } else {
                advance();
            }
        }
        builder.close(node, pos - 1);
    }

    /// Parenthesized header of a control statement, including `for` and `foreach` headers.
    private void parseCondition(String keyword) {
        int node = builder.open(CONDITION, pos);
        builder.delimiter(node, pos);
        advance();
        switch (keyword) {
            case "for" -> {
                if (isLocalDeclaration()) {
                    parseLocalDeclaration();
                }
            }
            case "foreach", "catch", "using", "fixed" -> parseInlineDeclaration();
            default -> {
            }
        }
        while (!isAtAny(CLOSE_PAREN, CLOSE_BRACE, END_OF_FILE)) {
            if (current().is(SEMICOLON) || current().is(COMMA)) {
                advance();
                continue;
            }
            int before = pos;
            parseExpression(EnumSet.of(CLOSE_PAREN, COMMA));
            if (pos == before) {
                break;
            }
        }
        if (current().is(CLOSE_PAREN)) {
            advance();
        }
        builder.close(node, pos - 1);
    }

    /// `Type name` inside a `foreach`, `catch`, `using` or `fixed` header.
    private void parseInlineDeclaration() {
        int afterType = skipType(pos);
        if (afterType < 0 || !tokens.get(afterType)
                                    .is(IDENTIFIER)) {
            return;
        }
        var follower = tokens.get(afterType + 1);
        if (!follower.isKeyword("in") && !follower.is(CLOSE_PAREN) && !follower.is(ASSIGNMENT, "=")) {
            return;
        }
        int node = builder.open(LOCAL_DECLARATION, pos);
        parseTypeReference();
        int variable = builder.open(VARIABLE, pos);
        builder.name(variable, pos);
        advance();
        if (current().is(ASSIGNMENT, "=")) {
            advance();
            parseExpression(EnumSet.of(CLOSE_PAREN, COMMA));
        }
        builder.close(variable, pos - 1);
        builder.close(node, pos - 1);
    }

    private boolean isLocalFunction() {
        int i = pos;
        while (tokens.get(i)
                     .is(KEYWORD) || tokens.get(i)
                                           .is(IDENTIFIER)) {
            if (!LOCAL_FUNCTION_MODIFIERS.contains(tokens.get(i)
                                                         .text())) {
                break;
            }
            i++;
        }
        int afterType = skipType(i);
        if (afterType < 0 || !tokens.get(afterType)
                                    .is(IDENTIFIER)) {
            return false;
        }
        int paren = afterType + 1;
        if (tokens.get(paren)
                  .is(GENERIC_OPEN)) {
            int close = tokens.matching(paren);
            if (close < paren) {
                return false;
            }
            paren = close + 1;
        }
        if (!tokens.get(paren)
                   .is(OPEN_PAREN)) {
            return false;
        }
        int close = tokens.matching(paren);
        if (close < paren) {
            return false;
        }
        var next = tokens.get(close + 1);
        return next.is(OPEN_BRACE) || next.is(ARROW) || next.isWord("where");
    }

    private boolean isLocalDeclaration() {
        int i = pos;
        while ((tokens.get(i)
                      .is(KEYWORD) || tokens.get(i)
                                            .is(IDENTIFIER)) && LOCAL_MODIFIERS.contains(tokens.get(i)
                                                                                               .text()) && !tokens.get(i + 1)
                                                                                                                  .is(OPEN_PAREN)) {
            i++;
        }
        if (EXPRESSION_WORDS.contains(tokens.get(i)
                                            .text())) {
            return false;
        }
        int afterType = skipType(i);
        if (afterType < 0 || !tokens.get(afterType)
                                    .is(IDENTIFIER)) {
            return false;
        }
        var follower = tokens.get(afterType + 1);
        return follower.is(ASSIGNMENT, "=") || follower.is(SEMICOLON) || follower.is(COMMA);
    }

    private void parseLocalDeclaration() {
        int node = builder.open(LOCAL_DECLARATION, pos);
        while (LOCAL_MODIFIERS.contains(current().text()) && !peek(1).is(OPEN_PAREN) && skipType(pos + 1) >= 0) {
            if (current().isKeyword("const")) {
                builder.flag(node, NodeFlag.CONST);
            }
            advance();
        }
        parseTypeReference();
        if (current().is(IDENTIFIER)) {
            builder.name(node, pos);
        }
        parseDeclarators();
        if (current().is(SEMICOLON)) {
            advance();
        }
        builder.close(node, pos - 1);
    }

    private void parseExpressionStatement() {
        int node = builder.open(STATEMENT, pos);
        parseExpression(EnumSet.noneOf(TokenKind.class));
        if (current().is(SEMICOLON)) {
            advance();
        }
        builder.close(node, pos - 1);
    }

    // --- Expressions ---------------------------------------------------------------------------------------

    /// Walk an expression up to a statement terminator, a closing brace or one of the stop kinds,
    /// building nodes for calls, indexers, generic names, lambdas and initializers.
    private void parseExpression(Set<TokenKind> stops) {
        while (true) {
            var kind = current().kind();
            if (kind == END_OF_FILE || kind == SEMICOLON || kind == CLOSE_BRACE || stops.contains(kind)) {
                return;
            }
            int before = pos;
            parsePrimary(stops);
            if (pos == before) {
                advance();
            }
        }
    }

    private void parsePrimary(Set<TokenKind> stops) {
        var token = current();
        switch (token.kind()) {
            case IDENTIFIER -> parseIdentifierExpression(stops);
            case KEYWORD -> parseKeywordExpression(stops);
            case OPEN_PAREN -> {
                int close = tokens.matching(pos);
                if (close > pos && tokens.get(close + 1)
                                         .is(ARROW)) {
                    parseLambda(stops);
                } else {
                    parseGroup(CLOSE_PAREN);
                }
            }
            case OPEN_BRACKET -> parseGroup(CLOSE_BRACKET);
            case OPEN_BRACE -> parseInitializer(INITIALIZER, pos);
            default -> advance();
        }
    }

    private void parseIdentifierExpression(Set<TokenKind> stops) {
        var token = current();
        if (token.text()
                 .equals("async") && isAsyncLambda()) {
            advance();
            return;
        }
        if (peek(1).is(ARROW)) {
            parseLambda(stops);
            return;
        }
        parseNameOrCall();
    }

    private boolean isAsyncLambda() {
        if (peek(1).is(IDENTIFIER) && peek(2).is(ARROW)) {
            return true;
        }
        if (!peek(1).is(OPEN_PAREN)) {
            return false;
        }
        int close = tokens.matching(pos + 1);
        return close > pos && tokens.get(close + 1)
                                    .is(ARROW);
    }

    private void parseKeywordExpression(Set<TokenKind> stops) {
        var token = current();
        if (CALLABLE_KEYWORDS.contains(token.text()) && (peek(1).is(OPEN_PAREN) || peek(1).is(OPEN_BRACKET))) {
            parseNameOrCall();
        } else if (token.isKeyword("delegate")) {
            parseAnonymousMethod();
        } else if (token.isKeyword("new") && peek(1).is(OPEN_BRACE)) {
            int start = pos;
            advance();
            parseInitializer(ANONYMOUS, start);
        } else if (token.isKeyword("switch") && peek(1).is(OPEN_BRACE)) {
            advance();
            parseInitializer(INITIALIZER, pos);
        } else {
            advance();
        }
    }

    private void parseNameOrCall() {
        boolean generic = current().is(IDENTIFIER) && peek(1).is(GENERIC_OPEN) && tokens.matching(pos + 1) > pos;
        int after = generic
                    ? tokens.matching(pos + 1) + 1
                    : pos + 1;
        var next = tokens.get(after);
        if (next.is(OPEN_PAREN)) {
            parseInvocation(CALL, generic, CLOSE_PAREN);
        } else if (next.is(OPEN_BRACKET) && !generic && !isRankSpecifier(after)) {
            parseInvocation(INDEX, false, CLOSE_BRACKET);
        } else if (generic) {
            parseGenericName();
        } else {
            advance();
        }
    }

    private void parseInvocation(NodeKind kind, boolean generic, TokenKind closeKind) {
        int node = builder.open(kind, pos);
        builder.name(node, pos);
        if (generic) {
            parseGenericName();
        } else {
            advance();
        }
        builder.delimiter(node, pos);
        parseGroup(closeKind);
        builder.close(node, pos - 1);
    }

    /// Parenthesized or bracketed comma-separated list.
    private void parseGroup(TokenKind closeKind) {
        advance();
        var stops = EnumSet.of(closeKind, COMMA);
        while (true) {
            parseExpression(stops);
            if (!current().is(COMMA)) {
                break;
            }
            advance();
        }
        if (current().is(closeKind)) {
            advance();
        }
    }

    private void parseLambda(Set<TokenKind> stops) {
        int node = builder.open(LAMBDA, pos);
        if (current().is(OPEN_PAREN)) {
            parseParameterList(CLOSE_PAREN);
        } else {
            int list = builder.open(PARAMETER_LIST, pos);
            int parameter = builder.open(PARAMETER, pos);
            builder.name(parameter, pos);
            advance();
            builder.close(parameter, pos - 1);
            builder.close(list, pos - 1);
        }
        if (current().is(ARROW)) {
            advance();
        }
        if (current().is(OPEN_BRACE)) {
            builder.delimiter(node, pos);
            parseBlock();
        } else {
            parseExpression(stops);
        }
        builder.close(node, pos - 1);
    }

    private void parseAnonymousMethod() {
        int node = builder.open(ANONYMOUS, pos);
        advance();
        if (current().is(OPEN_PAREN)) {
            parseParameterList(CLOSE_PAREN);
        }
        if (current().is(OPEN_BRACE)) {
            builder.delimiter(node, pos);
            parseBlock();
        }
        builder.close(node, pos - 1);
    }

    private void parseInitializer(NodeKind kind, int start) {
        int node = builder.open(kind, start);
        builder.delimiter(node, pos);
        advance();
        var stops = EnumSet.of(COMMA, CLOSE_BRACE);
        while (true) {
            parseExpression(stops);
            if (!current().is(COMMA)) {
                break;
            }
            advance();
        }
        if (current().is(CLOSE_BRACE)) {
            advance();
        }
        builder.close(node, pos - 1);
    }

    // --- Recovery ------------------------------------------------------------------------------------------

    private boolean isSynchronizationPoint() {
        var token = current();
        if (!(token.is(KEYWORD) || token.is(IDENTIFIER) || token.is(OPEN_BRACKET))) {
            return false;
        }
        if (tokens.isFirstOnLine(pos)) {
            return true;
        }
        return pos > 0 && (tokens.get(pos - 1)
                                 .is(SEMICOLON) || tokens.get(pos - 1)
                                                         .is(CLOSE_BRACE));
    }

    private void unbalanced(int brace) {
        if (reported.add(brace)) {
            problems.add(new StructuralProblem.UnbalancedBraces(brace,
                                                                tokens.get(brace)
                                                                      .text()));
        }
        state = ParserState.RECOVERING;
    }

    /// Delimiters and malformed tokens that the descent did not already report.
    private void reportUnpaired() {
        for (int i = 0; i < tokens.size(); i++) {
            var token = tokens.get(i);
            if (token.is(ERROR)) {
                reportMalformed(i);
            } else if ((token.is(OPEN_BRACE) || token.is(CLOSE_BRACE)) && tokens.matching(i) < 0) {
                unbalanced(i);
            } else if ((token.is(OPEN_PAREN) || token.is(CLOSE_PAREN) || token.is(OPEN_BRACKET) || token.is(CLOSE_BRACKET)) && tokens.matching(i) < 0 && reported.add(i)) {
                problems.add(new StructuralProblem.UnbalancedDelimiter(i, token.text()));
                state = ParserState.RECOVERING;
            }
        }
    }

    private void reportMalformed(int index) {
        if (reported.add(index)) {
            problems.add(new StructuralProblem.MalformedToken(index,
                                                              tokens.get(index)
                                                                    .text()));
            state = ParserState.RECOVERING;
        }
    }

    // --- Cursor --------------------------------------------------------------------------------------------

    private Token current() {
        return tokens.get(pos);
    }

    private Token peek(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.lastIndex()));
    }

    private boolean isAtAny(TokenKind... kinds) {
        var kind = current().kind();
        for (var candidate : kinds) {
            if (kind == candidate) {
                return true;
            }
        }
        return false;
    }

    /// Move to the next token; never moves past end of input.
    private void advance() {
        if (pos >= tokens.lastIndex()) {
            return;
        }
        if (current().is(ERROR)) {
            reportMalformed(pos);
        }
        pos++;
    }

    private void advanceTo(int target) {
        while (pos < target && pos < tokens.lastIndex()) {
            advance();
        }
    }
}
