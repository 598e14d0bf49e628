/**
 * Pure Java value types shared across all Bootstep modules.
 *
 * <p>{@link com.libragraph.bootstep.types.StepName} parses qualified boot-step names and
 * {@link com.libragraph.bootstep.types.NamespaceState} enumerates namespace lifecycle states.
 * No framework dependencies.
 */
package com.libragraph.bootstep.types;
