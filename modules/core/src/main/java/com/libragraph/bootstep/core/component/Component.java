package com.libragraph.bootstep.core.component;

import com.libragraph.bootstep.core.namespace.Namespace;
import com.libragraph.bootstep.util.Instantiator;
import org.jboss.logging.Logger;

/**
 * A boot-step bound to a host.
 * <p>
 * The constructor runs when the namespace binds the step to its host and may initialize
 * state on the host. {@link #include(Host)} then decides whether the step takes part and,
 * if so, stores the result of {@link #create(Host)} as {@link #obj()}.
 *
 * @param <T> type of the object created by {@link #create(Host)}
 */
public abstract class Component<T> implements Includable<T> {

    protected final Logger log = Logger.getLogger(getClass());

    private Blueprint blueprint;
    private Namespace namespace;
    private Boolean enabled;
    private T obj;

    protected Component(Host parent) {
    }

    /**
     * Attaches the blueprint this instance was bound from and the owning namespace.
     * Called once by the namespace right after construction.
     */
    public final void attach(Namespace namespace, Blueprint blueprint) {
        if (this.blueprint != null) {
            throw new IllegalStateException(
                    "Component " + qualifiedName() + " is already attached");
        }
        this.namespace = namespace;
        this.blueprint = blueprint;
    }

    @Override
    public T create(Host parent) {
        return null;
    }

    /** Defaults to {@link #enabled()}; override to decide from the host's state. */
    @Override
    public boolean includeIf(Host parent) {
        return enabled();
    }

    /** Creates the runtime object if {@link #includeIf(Host)} allows. */
    public boolean include(Host parent) {
        if (includeIf(parent)) {
            obj = create(parent);
            return true;
        }
        return false;
    }

    /** Per-instance override of the blueprint's {@code enabled} default. */
    protected void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean enabled() {
        if (enabled != null) return enabled;
        return blueprint == null || blueprint.enabled();
    }

    /** Loads a plugin class by name and constructs it with {@code args}. */
    protected <S> S instantiate(String qualifiedName, Class<S> type, Object... args) {
        return Instantiator.instantiate(qualifiedName, type, args);
    }

    public T obj() {
        return obj;
    }

    public Blueprint blueprint() {
        return blueprint;
    }

    public Namespace namespace() {
        return namespace;
    }

    public String name() {
        return blueprint != null ? blueprint.name() : getClass().getSimpleName();
    }

    public String qualifiedName() {
        return blueprint != null ? blueprint.stepName().toString() : getClass().getName();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + qualifiedName() + "]";
    }
}
