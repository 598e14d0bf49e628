package com.libragraph.bootstep.core.component;

import com.libragraph.bootstep.types.StepName;
import com.libragraph.bootstep.util.Instantiator;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Declarative, unbound description of one boot-step: its name and namespace, the steps it
 * requires, ordering and inclusion defaults, and the factory that binds it to a host.
 * <p>
 * Built either from a {@link Bootstep}-annotated class via {@link #of(Class)} or through
 * {@link #builder(String)}. Validation happens in {@link Builder#build()}: a concrete
 * blueprint without a resolvable name fails there with {@link DefinitionException}.
 */
public final class Blueprint {

    private final String name;
    private final String namespace;
    private final Set<String> requires;
    private final boolean last;
    private final boolean enabled;
    private final boolean abstractBlueprint;
    private final ComponentFactory factory;
    private final Class<?> type;

    private Blueprint(Builder b, StepName stepName) {
        this.name = stepName == null ? b.name : stepName.name();
        this.namespace = stepName == null ? b.namespace : stepName.namespace();
        this.requires = Collections.unmodifiableSet(new LinkedHashSet<>(b.requires));
        this.last = b.last;
        this.enabled = b.enabled;
        this.abstractBlueprint = b.abstractBlueprint;
        this.factory = b.factory;
        this.type = b.type;
    }

    public static Builder builder(String name) {
        return new Builder().name(name);
    }

    /** Starts an abstract blueprint, meant only as a base for {@link #extend(Blueprint)}. */
    public static Builder abstractBuilder() {
        return new Builder().abstractBlueprint(true);
    }

    /** Starts a concrete blueprint inheriting requirements, flags and factory from {@code base}. */
    public static Builder extend(Blueprint base) {
        Builder b = new Builder();
        b.namespace = base.abstractBlueprint ? base.namespace : null;
        b.requires.addAll(base.requires);
        b.last = base.last;
        b.enabled = base.enabled;
        b.factory = base.factory;
        b.type = base.type;
        return b;
    }

    /**
     * Reads the {@link Bootstep} annotation of a component class. Abstract classes yield
     * abstract blueprints.
     *
     * @throws DefinitionException if a concrete class is not annotated or not named
     */
    public static Blueprint of(Class<? extends Component<?>> cls) {
        Bootstep meta = cls.getAnnotation(Bootstep.class);
        boolean isAbstract = Modifier.isAbstract(cls.getModifiers())
                || (meta != null && meta.abstractStep());
        if (meta == null && !isAbstract) {
            throw new DefinitionException(
                    "Component " + cls.getName() + " must be annotated with @Bootstep");
        }
        Builder b = new Builder()
                .type(cls)
                .abstractBlueprint(isAbstract)
                .factory((parent, options) -> construct(cls, parent, options));
        if (meta != null) {
            b.name(emptyToNull(meta.name()))
                    .namespace(emptyToNull(meta.namespace()))
                    .requires(meta.requires())
                    .last(meta.last())
                    .enabled(meta.enabled());
        }
        return b.build();
    }

    private static Component<?> construct(Class<? extends Component<?>> cls, Host parent,
                                          Map<String, Object> options) {
        for (Constructor<?> c : cls.getDeclaredConstructors()) {
            if (acceptsHostAndOptions(c, parent)) {
                return Instantiator.instantiate(cls, parent, options);
            }
        }
        return Instantiator.instantiate(cls, parent);
    }

    private static boolean acceptsHostAndOptions(Constructor<?> c, Host parent) {
        Class<?>[] params = c.getParameterTypes();
        return params.length == 2
                && params[0].isAssignableFrom(parent.getClass())
                && params[1].isAssignableFrom(Map.class);
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }

    public String name() {
        return name;
    }

    public String namespace() {
        return namespace;
    }

    /** {@code namespace.name}; only valid for concrete blueprints. */
    public StepName stepName() {
        if (abstractBlueprint) {
            throw new IllegalStateException("Abstract blueprint has no step name");
        }
        return new StepName(namespace, name);
    }

    public Set<String> requires() {
        return requires;
    }

    public boolean last() {
        return last;
    }

    public boolean enabled() {
        return enabled;
    }

    public boolean isAbstract() {
        return abstractBlueprint;
    }

    public ComponentFactory factory() {
        return factory;
    }

    /** The component class this blueprint was read from, or null for builder-made blueprints. */
    public Class<?> type() {
        return type;
    }

    @Override
    public String toString() {
        String id = abstractBlueprint ? "<abstract>" : namespace + "." + name;
        return "Blueprint[" + id + ", requires=" + requires
                + (last ? ", last" : "") + (enabled ? "" : ", disabled") + "]";
    }

    public static final class Builder {
        private String name;
        private String namespace;
        private final Set<String> requires = new LinkedHashSet<>();
        private boolean last;
        private boolean enabled = true;
        private boolean abstractBlueprint;
        private ComponentFactory factory;
        private Class<?> type;

        private Builder() {
        }

        /** Plain name, or {@code namespace.name} when no namespace is set. */
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder requires(String... names) {
            requires.addAll(Arrays.asList(names));
            return this;
        }

        public Builder last() {
            return last(true);
        }

        public Builder last(boolean last) {
            this.last = last;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder abstractBlueprint(boolean abstractBlueprint) {
            this.abstractBlueprint = abstractBlueprint;
            return this;
        }

        public Builder factory(ComponentFactory factory) {
            this.factory = factory;
            return this;
        }

        public Builder type(Class<?> type) {
            this.type = type;
            return this;
        }

        public Blueprint build() {
            if (abstractBlueprint) {
                return new Blueprint(this, null);
            }
            StepName stepName;
            try {
                stepName = StepName.resolve(namespace, name);
            } catch (IllegalArgumentException e) {
                throw new DefinitionException("Components must be named"
                        + (type != null ? " (" + type.getName() + ")" : "")
                        + ": " + e.getMessage(), e);
            }
            if (requires.stream().anyMatch(r -> r == null || r.isBlank())) {
                throw new DefinitionException("Component " + stepName + " has a blank requirement");
            }
            if (factory == null) {
                throw new DefinitionException("Component " + stepName + " has no factory");
            }
            return new Blueprint(this, stepName);
        }
    }
}
