package com.bookscrape.scrape.util;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop flag shared by the components of one run. Firing it stops new page
 * discovery and new retries; work already in flight is allowed to finish.
 */
public final class CancellationSignal {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    /** @return {@code true} if this call fired the signal */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
