package com.trading.opg.fn;

import com.trading.opg.util.ErrorRateLimiter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Common guard for three-input indicators.
 * <p>
 * A NaN bar is rejected before it reaches {@link #calculate}, so indicator
 * state only ever sees complete bars. A runtime failure inside
 * {@code calculate} is reported through an {@link ErrorRateLimiter} and the
 * bar evaluates to NaN; the series keeps going.
 */
public abstract class AbstractFn3 implements Fn3 {
    private final ErrorRateLimiter errors;

    protected AbstractFn3() {
        Logger logger = LogManager.getLogger(getClass());
        this.errors = new ErrorRateLimiter(logger, 1000);
    }

    @Override
    public final double apply(double a, double b, double c) {
        if (Double.isNaN(a) || Double.isNaN(b) || Double.isNaN(c))
            return Double.NaN;
        try {
            return calculate(a, b, c);
        } catch (RuntimeException e) {
            errors.log(getClass().getSimpleName() + " failed on bar (" + a + ", " + b + ", " + c + ")", e);
            return Double.NaN;
        }
    }

    /** Indicator update for one complete bar. */
    protected abstract double calculate(double a, double b, double c);
}
