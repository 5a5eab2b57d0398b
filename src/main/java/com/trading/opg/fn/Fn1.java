package com.trading.opg.fn;

/**
 * Streaming scalar function of one input, fed one observation at a time.
 *
 * <p>
 * Examples:
 * <ul>
 * <li>{@code new Sma(20)}</li>
 * <li>{@code x -> x * 2.0}</li>
 * </ul>
 */
@FunctionalInterface
public interface Fn1 {
    /**
     * Consumes the next observation.
     *
     * @param a The input value.
     * @return The function value after this observation.
     */
    double apply(double a);

    /**
     * Feeds every element of {@code series} in order and collects the outputs.
     */
    default double[] applyAll(double[] series) {
        double[] out = new double[series.length];
        for (int i = 0; i < series.length; i++)
            out[i] = apply(series[i]);
        return out;
    }
}
