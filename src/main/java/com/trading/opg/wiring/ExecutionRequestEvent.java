package com.trading.opg.wiring;

/**
 * Ring buffer slot carrying one execution request.
 * <p>
 * Instances are pre-allocated by the ring buffer and reused; the consumer
 * clears the slot once the request has been handled so the run can be
 * collected.
 */
public final class ExecutionRequestEvent {
    private ExecutionRun run;

    public void set(ExecutionRun run) {
        this.run = run;
    }

    public ExecutionRun run() {
        return run;
    }

    public void clear() {
        run = null;
    }
}
