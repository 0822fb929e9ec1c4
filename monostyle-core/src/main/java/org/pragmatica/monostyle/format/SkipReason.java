package org.pragmatica.monostyle.format;

/// Why a proposed fix was not applied.
public enum SkipReason {
    /// An edit overlaps an edit already accepted from a higher-precedence fix.
    CONFLICTING_EDIT,
    /// The fix touches a region the parser could not make sense of.
    STRUCTURAL_REGION
}
