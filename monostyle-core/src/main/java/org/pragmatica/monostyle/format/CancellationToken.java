package org.pragmatica.monostyle.format;

import java.util.concurrent.atomic.AtomicBoolean;

/// Cooperative cancellation flag, checked between pipeline stages.
public final class CancellationToken {
    private static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean();

    private CancellationToken() {}

    public static CancellationToken cancellationToken() {
        return new CancellationToken();
    }

    /// Token that is never cancelled.
    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        if (this != NONE) {
            cancelled.set(true);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
