package com.trading.opg.api;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named numeric columns an execution reads from and writes to.
 *
 * <p>
 * Arrays are copied on the way in and out, so callers never share mutable
 * state with the frame. Safe for concurrent use.
 */
public final class ColumnFrame {
    private final Map<String, double[]> columns = new ConcurrentHashMap<>();

    public static ColumnFrame empty() {
        return new ColumnFrame();
    }

    public static ColumnFrame of(Map<String, double[]> data) {
        ColumnFrame f = new ColumnFrame();
        data.forEach(f::put);
        return f;
    }

    public ColumnFrame put(String name, double[] values) {
        columns.put(name, values.clone());
        return this;
    }

    /**
     * @throws IllegalArgumentException if the column is not present
     */
    public double[] column(String name) {
        double[] values = columns.get(name);
        if (values == null)
            throw new IllegalArgumentException("Unknown column: " + name);
        return values.clone();
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public Set<String> columnNames() {
        return Set.copyOf(columns.keySet());
    }

    public ColumnFrame copy() {
        ColumnFrame f = new ColumnFrame();
        f.columns.putAll(columns);
        return f;
    }
}
