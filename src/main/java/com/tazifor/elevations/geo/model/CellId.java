package com.tazifor.elevations.geo.model;

/**
 * Value wrapper around a 64-bit H3 cell index.
 * <p>
 * H3 indexes are unsigned on the wire, so {@link #toString()} prints the
 * unsigned decimal form that callers send and receive.
 * </p>
 */
public record CellId(long value) {

    public static CellId of(long value) { return new CellId(value); }

    @Override
    public String toString() {
        return Long.toUnsignedString(value);
    }
}
