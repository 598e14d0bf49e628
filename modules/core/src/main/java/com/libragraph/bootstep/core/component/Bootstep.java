package com.libragraph.bootstep.core.component;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Declares a {@link Component} subclass as a boot-step. Read by {@link Blueprint#of(Class)}.
 * <p>
 * Not inherited: every concrete subclass declares its own name. Annotated classes need a
 * constructor taking {@code (Host)} or {@code (Host, Map<String, Object>)}.
 */
@Target(TYPE)
@Retention(RUNTIME)
public @interface Bootstep {

    /** Step name, or {@code namespace.name} when {@link #namespace()} is empty. */
    String name() default "";

    String namespace() default "";

    /** Names of steps in the same namespace that must start first. */
    String[] requires() default {};

    /** Order this step after every other step in its namespace. */
    boolean last() default false;

    /** Default for {@link Component#includeIf(Host)}. */
    boolean enabled() default true;

    /** Never registered; only extended. */
    boolean abstractStep() default false;
}
