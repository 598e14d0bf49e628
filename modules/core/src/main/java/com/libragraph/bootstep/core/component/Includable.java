package com.libragraph.bootstep.core.component;

/**
 * A component that can be included in a host: an eligibility predicate plus the step
 * that creates its runtime object.
 *
 * @param <T> type of the created object
 */
public interface Includable<T> {

    /** Creates the component's runtime object, or returns null if it has none. */
    T create(Host parent);

    boolean includeIf(Host parent);
}
