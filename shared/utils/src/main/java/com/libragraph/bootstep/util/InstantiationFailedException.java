package com.libragraph.bootstep.util;

/**
 * Thrown when {@link Instantiator} cannot load or construct a class.
 */
public class InstantiationFailedException extends RuntimeException {

    public InstantiationFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    public InstantiationFailedException(String message) {
        super(message);
    }
}
