package com.trading.opg.engine;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Knobs of a {@link PlanExecutor}.
 *
 * <ul>
 * <li>{@code concurrency}: worker threads in the pool (default 4).</li>
 * <li>{@code retryBudget}: maximum attempts per node, the first one included
 * (default 3). A node failing this many times aborts the run.</li>
 * </ul>
 */
@Getter
@ToString
public final class ExecutionConfig {
    public static final int DEFAULT_CONCURRENCY = 4;
    public static final int DEFAULT_RETRY_BUDGET = 3;

    private final int concurrency;
    private final int retryBudget;

    @Builder
    private ExecutionConfig(Integer concurrency, Integer retryBudget) {
        this.concurrency = concurrency != null ? concurrency : DEFAULT_CONCURRENCY;
        this.retryBudget = retryBudget != null ? retryBudget : DEFAULT_RETRY_BUDGET;
        if (this.concurrency < 1)
            throw new IllegalArgumentException("concurrency must be >= 1, got " + this.concurrency);
        if (this.retryBudget < 1)
            throw new IllegalArgumentException("retryBudget must be >= 1, got " + this.retryBudget);
    }

    public static ExecutionConfig defaults() {
        return builder().build();
    }
}
