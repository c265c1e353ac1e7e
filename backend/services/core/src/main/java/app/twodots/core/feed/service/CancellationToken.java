package app.twodots.core.feed.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Marks one page fetch as superseded. The fetch itself still runs to completion;
 * its result is discarded when the token is found cancelled.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
