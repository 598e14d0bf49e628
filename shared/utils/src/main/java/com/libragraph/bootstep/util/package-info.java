/**
 * Shared utilities for all Bootstep modules.
 *
 * <p>Contains {@link com.libragraph.bootstep.util.DependencyGraph} (requirement graph with
 * deterministic topological ordering) and {@link com.libragraph.bootstep.util.Instantiator}
 * (class loading and construction by name). No framework dependencies.
 */
package com.libragraph.bootstep.util;
