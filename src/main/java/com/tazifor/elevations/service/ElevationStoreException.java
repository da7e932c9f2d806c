package com.tazifor.elevations.service;

/**
 * The elevation store could not answer. Without availability the request
 * cannot proceed, so this surfaces to the caller as a server-side failure.
 */
public class ElevationStoreException extends RuntimeException {

    public ElevationStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
