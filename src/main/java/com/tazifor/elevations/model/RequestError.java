package com.tazifor.elevations.model;

/**
 * A caller error detected while resolving or validating a request.
 * Carries no state beyond the message; nothing was looked up or recorded.
 */
public record RequestError(Kind kind, String message) {

    public enum Kind {
        MALFORMED_REQUEST,        // missing or ambiguous shape key, bad coordinates, short polygon
        RESOLUTION_OUT_OF_RANGE,  // outside [min, max]
        CELL_LIMIT_EXCEEDED,      // too many cells for the request shape
        INVALID_CELL_IDENTIFIER,  // fails the structural H3 check
        EMPTY_COVERAGE            // polygon covers no cell centers
    }

    public static RequestError malformed(String message) {
        return new RequestError(Kind.MALFORMED_REQUEST, message);
    }

    public static RequestError of(Kind kind, String message) {
        return new RequestError(kind, message);
    }
}
