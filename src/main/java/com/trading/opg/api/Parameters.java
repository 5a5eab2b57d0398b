package com.trading.opg.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Canonical, immutable parameter shape of a node: an ordered list of column
 * references plus an optional scalar value.
 *
 * <p>
 * Only two parameter names exist. {@link #COLUMNS} is present when at least
 * one column is referenced, {@link #VALUE} when the scalar is set.
 */
public final class Parameters {
    public static final String COLUMNS = "columns";
    public static final String VALUE = "value";

    private static final Parameters EMPTY = new Parameters(List.of(), null);

    private final List<String> columns;
    private final Double value;

    private Parameters(List<String> columns, Double value) {
        this.columns = columns;
        this.value = value;
    }

    public static Parameters empty() {
        return EMPTY;
    }

    public static Parameters of(List<String> columns, Double value) {
        for (String c : columns) {
            if (c == null || c.isBlank())
                throw new InvalidParameterException("Column reference must not be blank");
        }
        return new Parameters(List.copyOf(columns), value);
    }

    public static Parameters of(double value, String... columns) {
        return of(List.of(columns), value);
    }

    /**
     * Converts the wire form. Entry order of columns is preserved.
     *
     * @throws InvalidParameterException if an entry is neither a column nor a
     *                                   value, is both, or repeats the value
     */
    public static Parameters fromEntries(List<ParameterEntry> entries) {
        if (entries == null || entries.isEmpty())
            return EMPTY;

        List<String> cols = new ArrayList<>(entries.size());
        Double scalar = null;
        for (int i = 0; i < entries.size(); i++) {
            ParameterEntry e = entries.get(i);
            if (e == null)
                throw new InvalidParameterException("Parameter #" + i + " is null");
            boolean hasColumn = e.getColumn() != null;
            boolean hasValue = e.getValue() != null;
            if (hasColumn == hasValue)
                throw new InvalidParameterException(
                        "Parameter #" + i + " must hold exactly one of 'column' or 'value': " + e);
            if (hasColumn) {
                cols.add(e.getColumn());
            } else {
                if (scalar != null)
                    throw new InvalidParameterException(
                            "Parameter #" + i + " repeats 'value' (already " + scalar + ")");
                if (!Double.isFinite(e.getValue()))
                    throw new InvalidParameterException("Parameter #" + i + " value is not finite");
                scalar = e.getValue();
            }
        }
        return of(cols, scalar);
    }

    /** Wire form: columns in order, then the value if present. */
    public List<ParameterEntry> toEntries() {
        List<ParameterEntry> out = new ArrayList<>(columns.size() + 1);
        for (String c : columns)
            out.add(ParameterEntry.column(c));
        if (value != null)
            out.add(ParameterEntry.value(value));
        return out;
    }

    public boolean has(String name) {
        return switch (name) {
            case COLUMNS -> !columns.isEmpty();
            case VALUE -> value != null;
            default -> false;
        };
    }

    /** Names present in this parameter set. */
    public Set<String> names() {
        Set<String> names = new LinkedHashSet<>(2);
        if (has(COLUMNS))
            names.add(COLUMNS);
        if (has(VALUE))
            names.add(VALUE);
        return Collections.unmodifiableSet(names);
    }

    public List<String> columns() {
        return columns;
    }

    public OptionalDouble value() {
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    /**
     * Reads the scalar as a strictly positive whole number (window, period).
     *
     * @throws IllegalArgumentException if absent, fractional or below 1
     */
    public int positiveIntValue(String meaning) {
        if (value == null)
            throw new IllegalArgumentException(meaning + " is missing");
        double v = value;
        if (v != Math.rint(v) || v < 1 || v > Integer.MAX_VALUE)
            throw new IllegalArgumentException(meaning + " must be a positive integer, got " + v);
        return (int) v;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Parameters p))
            return false;
        return columns.equals(p.columns) && Objects.equals(value, p.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, value);
    }

    @Override
    public String toString() {
        return "Parameters{columns=" + columns + ", value=" + value + '}';
    }
}
