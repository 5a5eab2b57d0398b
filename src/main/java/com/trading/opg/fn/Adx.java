package com.trading.opg.fn;

/**
 * Wilder's Average Directional Index.
 *
 * <p>
 * Inputs are aligned (high, low, close) bars. True range and directional
 * movement are summed over the first {@code period} bar-to-bar changes and
 * Wilder-smoothed afterwards; DX values are averaged over {@code period}
 * observations to seed ADX, which is then smoothed the same way. The first
 * defined value appears on bar {@code 2 * period - 1}; earlier bars yield NaN.
 */
public class Adx extends AbstractFn3 {
    private final int period;

    private boolean primed;
    private double prevHigh, prevLow, prevClose;

    private int changes;
    private double trSum, plusDmSum, minusDmSum;

    private int dxCount;
    private double dxSum;
    private double adx = Double.NaN;

    public Adx(int period) {
        if (period < 1)
            throw new IllegalArgumentException("Period must be >= 1, got " + period);
        this.period = period;
    }

    @Override
    protected double calculate(double high, double low, double close) {
        if (!primed) {
            remember(high, low, close);
            primed = true;
            return Double.NaN;
        }

        double tr = Math.max(high - low, Math.max(Math.abs(high - prevClose), Math.abs(low - prevClose)));
        double up = high - prevHigh;
        double down = prevLow - low;
        double plusDm = up > down && up > 0 ? up : 0.0;
        double minusDm = down > up && down > 0 ? down : 0.0;
        remember(high, low, close);

        changes++;
        if (changes <= period) {
            trSum += tr;
            plusDmSum += plusDm;
            minusDmSum += minusDm;
            if (changes < period)
                return Double.NaN;
        } else {
            trSum = trSum - trSum / period + tr;
            plusDmSum = plusDmSum - plusDmSum / period + plusDm;
            minusDmSum = minusDmSum - minusDmSum / period + minusDm;
        }

        double dx = directionalIndex();
        dxCount++;
        if (dxCount < period) {
            dxSum += dx;
            return Double.NaN;
        }
        if (dxCount == period) {
            dxSum += dx;
            adx = dxSum / period;
        } else {
            adx = (adx * (period - 1) + dx) / period;
        }
        return adx;
    }

    private double directionalIndex() {
        if (trSum == 0.0)
            return 0.0;
        double plusDi = 100.0 * plusDmSum / trSum;
        double minusDi = 100.0 * minusDmSum / trSum;
        double diSum = plusDi + minusDi;
        return diSum == 0.0 ? 0.0 : 100.0 * Math.abs(plusDi - minusDi) / diSum;
    }

    private void remember(double high, double low, double close) {
        prevHigh = high;
        prevLow = low;
        prevClose = close;
    }

    public int period() {
        return period;
    }
}
