package com.libragraph.bootstep.core.component;

/**
 * Thrown when a component definition is invalid, e.g. a concrete component without a name.
 * Raised when the blueprint is built, never deferred to claim time.
 */
public class DefinitionException extends RuntimeException {

    public DefinitionException(String message, Throwable cause) {
        super(message, cause);
    }

    public DefinitionException(String message) {
        super(message);
    }
}
