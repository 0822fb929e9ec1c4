package org.pragmatica.monostyle.format;

import org.pragmatica.monostyle.lint.Diagnostic;

public record SkippedEdit(Diagnostic diagnostic, SkipReason reason) {}
