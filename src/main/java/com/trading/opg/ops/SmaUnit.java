package com.trading.opg.ops;

import com.trading.opg.api.ColumnFrame;
import com.trading.opg.api.OperationUnit;
import com.trading.opg.api.Parameters;
import com.trading.opg.fn.Sma;

/**
 * SMA: moving average of the first referenced column; the scalar is the
 * window length. Extra column references are ignored.
 */
public final class SmaUnit implements OperationUnit {

    @Override
    public double[] execute(Parameters parameters, ColumnFrame frame) {
        if (parameters.columns().isEmpty())
            throw new IllegalArgumentException("SMA needs a column");
        int window = parameters.positiveIntValue("SMA window");
        return new Sma(window).applyAll(frame.column(parameters.columns().get(0)));
    }
}
