package com.trading.opg.registry;

import com.trading.opg.api.MissingParameterException;
import com.trading.opg.api.OperationKind;
import com.trading.opg.api.OperationUnit;
import com.trading.opg.api.Parameters;
import com.trading.opg.api.UnknownKindException;
import com.trading.opg.ops.AddUnit;
import com.trading.opg.ops.AdxUnit;
import com.trading.opg.ops.SmaUnit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Table mapping each {@link OperationKind} to its executable unit and the
 * ordered names of the parameters it requires.
 *
 * <p>
 * Built once through {@link #builder()} (or {@link #defaults()}) and read-only
 * afterwards, so a single instance can be shared by every graph and every
 * concurrent execution.
 */
public final class OperationRegistry {

    /** Registry row: the unit and its required parameter names, in order. */
    public record Entry(OperationKind kind, OperationUnit unit, List<String> requiredParameters) {
    }

    private final Map<OperationKind, Entry> entries;

    private OperationRegistry(Map<OperationKind, Entry> entries) {
        this.entries = Collections.unmodifiableMap(new EnumMap<>(entries));
    }

    /** Registry with the built-in ADD, SMA and ADX units. */
    public static OperationRegistry defaults() {
        return builder().withDefaults().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws UnknownKindException if the kind has no entry
     */
    public Entry lookup(OperationKind kind) {
        Entry e = entries.get(kind);
        if (e == null)
            throw new UnknownKindException(String.valueOf(kind));
        return e;
    }

    /**
     * Resolves a wire tag, then looks it up.
     *
     * @throws UnknownKindException if the tag is not a kind or is not registered
     */
    public Entry lookup(String kind) {
        return lookup(OperationKind.fromString(kind));
    }

    /**
     * Checks that every required name is present. Values are not inspected;
     * units reject bad values when they run.
     *
     * @throws UnknownKindException      if the kind has no entry
     * @throws MissingParameterException listing the absent names in registry order
     */
    public void validate(OperationKind kind, Parameters parameters) {
        Entry e = lookup(kind);
        List<String> missing = new ArrayList<>();
        for (String name : e.requiredParameters()) {
            if (!parameters.has(name))
                missing.add(name);
        }
        if (!missing.isEmpty())
            throw new MissingParameterException(kind, e.requiredParameters(), parameters.names(), missing);
    }

    public boolean isRegistered(OperationKind kind) {
        return entries.containsKey(kind);
    }

    public Set<OperationKind> kinds() {
        return entries.keySet();
    }

    /** Collects entries; {@link #build()} freezes them. */
    public static final class Builder {
        private final Map<OperationKind, Entry> entries = new EnumMap<>(OperationKind.class);

        private Builder() {
        }

        public Builder register(OperationKind kind, OperationUnit unit, String... requiredParameters) {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(unit, "unit");
            for (String p : requiredParameters) {
                if (!Parameters.COLUMNS.equals(p) && !Parameters.VALUE.equals(p))
                    throw new IllegalArgumentException("Unknown parameter name '" + p + "' for " + kind);
            }
            entries.put(kind, new Entry(kind, unit, List.of(requiredParameters)));
            return this;
        }

        public Builder withDefaults() {
            register(OperationKind.ADD, new AddUnit(), Parameters.COLUMNS, Parameters.VALUE);
            register(OperationKind.SMA, new SmaUnit(), Parameters.COLUMNS, Parameters.VALUE);
            register(OperationKind.ADX, new AdxUnit(), Parameters.COLUMNS, Parameters.VALUE);
            return this;
        }

        public OperationRegistry build() {
            return new OperationRegistry(entries);
        }
    }
}
