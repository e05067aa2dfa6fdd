package org.revas.reference;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag that is polled by the strip compositor once per frame.
 */
public class CancellationToken {

    /** Token that is never cancelled. */
    public static final CancellationToken NONE = new CancellationToken() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("the shared NONE token cannot be cancelled");
        }
    };

    private final AtomicBoolean cancelled;

    public CancellationToken() {
        this.cancelled = new AtomicBoolean(false);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

}
