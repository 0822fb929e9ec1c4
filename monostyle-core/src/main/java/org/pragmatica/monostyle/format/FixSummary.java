package org.pragmatica.monostyle.format;

/**
 * Counts reported after fix mode.
 *
 * @param fixed              diagnostics whose fixes were applied, over all passes
 * @param skippedConflicting fixes left out because they overlapped a higher-precedence edit and the
 *                           pass limit ran out before they could be retried
 * @param skippedStructural  fixes left out because they touched an unparseable region, or because
 *                           applying them would have added structural problems
 * @param advisoryOnly       remaining advisory diagnostics, which never carry a safe fix
 */
public record FixSummary(int fixed, int skippedConflicting, int skippedStructural, int advisoryOnly) {
    public static final FixSummary EMPTY = new FixSummary(0, 0, 0, 0);

    public FixSummary plus(FixSummary other) {
        return new FixSummary(fixed + other.fixed,
                              skippedConflicting + other.skippedConflicting,
                              skippedStructural + other.skippedStructural,
                              advisoryOnly + other.advisoryOnly);
    }
}
