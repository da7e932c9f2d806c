package com.tazifor.elevations.geo.spi;

/**
 * Thrown when a polygon would need more cells than the grid library can
 * allocate for a single polyfill.
 */
public class CoverageTooLargeException extends RuntimeException {

    public CoverageTooLargeException(String message, Throwable cause) {
        super(message, cause);
    }
}
