package com.trading.opg.ops;

import com.trading.opg.api.ColumnFrame;
import com.trading.opg.api.OperationUnit;
import com.trading.opg.api.Parameters;
import com.trading.opg.fn.Adx;

import java.util.List;

/**
 * ADX: Average Directional Index. Expects exactly three column references,
 * in the order high, low, close; the scalar is the smoothing period.
 */
public final class AdxUnit implements OperationUnit {

    @Override
    public double[] execute(Parameters parameters, ColumnFrame frame) {
        List<String> refs = parameters.columns();
        if (refs.size() != 3)
            throw new IllegalArgumentException("ADX needs columns [high, low, close], got " + refs);
        int period = parameters.positiveIntValue("ADX period");
        return new Adx(period).applyAll(frame.column(refs.get(0)), frame.column(refs.get(1)),
                frame.column(refs.get(2)));
    }
}
