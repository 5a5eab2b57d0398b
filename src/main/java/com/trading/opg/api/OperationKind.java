package com.trading.opg.api;

/**
 * Closed set of operation types a node may carry. The wire tag is the enum
 * name ({@code "ADD"}, {@code "SMA"}, {@code "ADX"}).
 */
public enum OperationKind {
    /** Element-wise sum of the referenced columns plus a scalar. */
    ADD,
    /** Simple moving average of one column; the scalar is the window. */
    SMA,
    /** Average Directional Index over high, low, close; the scalar is the period. */
    ADX;

    public static OperationKind fromString(String text) {
        if (text != null) {
            for (OperationKind k : values()) {
                if (k.name().equalsIgnoreCase(text.trim())) {
                    return k;
                }
            }
        }
        throw new UnknownKindException(text);
    }
}
