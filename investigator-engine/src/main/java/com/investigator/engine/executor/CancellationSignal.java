package com.investigator.engine.executor;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-controlled cancellation of an investigation.
 * Once cancelled, no further primitive is started; facts already collected are kept.
 */
public final class CancellationSignal {
    
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    
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
