package com.tazifor.elevations.geo.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * A latitude/longitude pair exactly as the caller wrote it.
 * <p>
 * The decimal components are kept verbatim so a coordinate-addressed response can
 * echo {@code [54.53097, 5.96836]} rather than the center of the H3 cell it maps to.
 * Geometry code works on {@link #lat()} and {@link #lng()}.
 * </p>
 */
public record Coordinate(BigDecimal latitude, BigDecimal longitude) {

    public static Coordinate of(String latitude, String longitude) {
        return new Coordinate(new BigDecimal(latitude), new BigDecimal(longitude));
    }

    public static Coordinate of(double latitude, double longitude) {
        return new Coordinate(BigDecimal.valueOf(latitude), BigDecimal.valueOf(longitude));
    }

    public double lat() { return latitude.doubleValue(); }

    public double lng() { return longitude.doubleValue(); }

    /**
     * True when both components are finite and inside the geographic range
     * ([-90, 90] latitude, [-180, 180] longitude).
     */
    public boolean isInRange() {
        double lat = lat(), lng = lng();
        return Double.isFinite(lat) && Double.isFinite(lng)
            && lat >= -90.0 && lat <= 90.0
            && lng >= -180.0 && lng <= 180.0;
    }

    /** The {@code [lat, lng]} pair in the caller's original notation. */
    public List<BigDecimal> toPair() {
        return List.of(latitude, longitude);
    }

    /** Response key form, e.g. {@code "[54.53097, 5.96836]"}. */
    public String toKey() {
        return "[" + latitude.toPlainString() + ", " + longitude.toPlainString() + "]";
    }
}
