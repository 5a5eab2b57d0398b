package com.trading.opg.api;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * External stop request for a run. Once raised the executor starts no new
 * stage and no new retry; attempts already running are allowed to finish.
 */
public final class CancellationSignal {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
