package com.trading.opg.fn;

/**
 * Simple Moving Average (SMA) over a ring buffer.
 *
 * Undefined (NaN) until {@code size} observations have been seen, then the
 * mean of the last {@code size}. A NaN observation is not recorded and
 * yields NaN.
 *
 * Performance: O(1) per observation with a running sum.
 */
public class Sma implements Fn1 {
    private final double[] ring;
    private int next;
    private int seen;
    private double total;

    public Sma(int size) {
        if (size < 1)
            throw new IllegalArgumentException("Window must be >= 1, got " + size);
        this.ring = new double[size];
    }

    @Override
    public double apply(double x) {
        if (Double.isNaN(x))
            return Double.NaN;

        // slot about to be overwritten leaves the window once it is full
        total += x - (seen == ring.length ? ring[next] : 0.0);
        ring[next] = x;
        next = next + 1 == ring.length ? 0 : next + 1;
        if (seen < ring.length)
            seen++;
        return seen == ring.length ? total / ring.length : Double.NaN;
    }

    /** {@code true} once the window holds {@code size} observations. */
    public boolean isWarm() {
        return seen == ring.length;
    }

    public int size() {
        return ring.length;
    }
}
