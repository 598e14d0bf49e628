package com.libragraph.bootstep.types;

/**
 * Lifecycle states of a namespace. Transitions only move forward:
 * {@code NEW -> RUN -> CLOSE -> TERMINATE}. A namespace that never finished
 * starting skips {@code CLOSE} and goes straight to {@code TERMINATE}.
 */
public enum NamespaceState {
    NEW,
    RUN,
    CLOSE,
    TERMINATE;

    public boolean isShuttingDown() {
        return this == CLOSE || this == TERMINATE;
    }
}
