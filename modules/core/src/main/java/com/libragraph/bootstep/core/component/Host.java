package com.libragraph.bootstep.core.component;

import java.util.List;

/**
 * The object whose services a namespace's components create and manage.
 * <p>
 * Passed unchanged to every component constructor, {@code create}, {@code includeIf} and
 * lifecycle call. {@link StartStopComponent}s append themselves to {@link #components()}
 * when included.
 */
public interface Host {

    /** Mutable, ordered list of included startable components. */
    List<Startable> components();
}
