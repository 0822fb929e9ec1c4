package org.pragmatica.monostyle.batch;

public enum Mode {
    /// Report diagnostics, leave text untouched.
    CHECK,
    /// Apply fixes and report what remains.
    FIX
}
