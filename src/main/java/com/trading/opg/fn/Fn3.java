package com.trading.opg.fn;

/**
 * Streaming scalar function of three aligned inputs.
 */
@FunctionalInterface
public interface Fn3 {
    /**
     * Consumes the next aligned observation.
     *
     * @param a First input.
     * @param b Second input.
     * @param c Third input.
     * @return The function value after this observation.
     */
    double apply(double a, double b, double c);

    /**
     * Feeds three aligned series element by element.
     *
     * @throws IllegalArgumentException if the series lengths differ
     */
    default double[] applyAll(double[] a, double[] b, double[] c) {
        if (a.length != b.length || a.length != c.length)
            throw new IllegalArgumentException(
                    "Series lengths differ: " + a.length + ", " + b.length + ", " + c.length);
        double[] out = new double[a.length];
        for (int i = 0; i < a.length; i++)
            out[i] = apply(a[i], b[i], c[i]);
        return out;
    }
}
