package org.pragmatica.monostyle.lint;

import java.util.List;

/**
 * Rule families. The declaration order is the default fix precedence.
 */
public enum RuleCategory {
    STRUCTURE,
    SPACING,
    BRACES,
    INDENTATION,
    ORDERING,
    NAMING,
    COMMENTS,
    LINE_LENGTH,
    INTERNAL;

    public static final List<RuleCategory> DEFAULT_PRECEDENCE = List.of(STRUCTURE,
                                                                         SPACING,
                                                                         BRACES,
                                                                         INDENTATION,
                                                                         ORDERING,
                                                                         NAMING,
                                                                         COMMENTS,
                                                                         LINE_LENGTH);
}
