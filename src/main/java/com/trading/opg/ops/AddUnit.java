package com.trading.opg.ops;

import com.trading.opg.api.ColumnFrame;
import com.trading.opg.api.OperationUnit;
import com.trading.opg.api.Parameters;

import java.util.List;

/**
 * ADD: element-wise sum of every referenced column, plus the scalar.
 * All columns must have the same length.
 */
public final class AddUnit implements OperationUnit {

    @Override
    public double[] execute(Parameters parameters, ColumnFrame frame) {
        List<String> refs = parameters.columns();
        if (refs.isEmpty())
            throw new IllegalArgumentException("ADD needs at least one column");
        double offset = parameters.value().orElse(0.0);

        double[] out = frame.column(refs.get(0));
        for (int c = 1; c < refs.size(); c++) {
            double[] next = frame.column(refs.get(c));
            if (next.length != out.length)
                throw new IllegalArgumentException("Column '" + refs.get(c) + "' has length " + next.length
                        + ", expected " + out.length);
            for (int i = 0; i < out.length; i++)
                out[i] += next[i];
        }
        for (int i = 0; i < out.length; i++)
            out[i] += offset;
        return out;
    }
}
