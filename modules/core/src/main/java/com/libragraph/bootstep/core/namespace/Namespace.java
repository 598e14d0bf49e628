package com.libragraph.bootstep.core.namespace;

import com.libragraph.bootstep.core.component.Blueprint;
import com.libragraph.bootstep.core.component.Component;
import com.libragraph.bootstep.core.component.Host;
import com.libragraph.bootstep.core.component.Startable;
import com.libragraph.bootstep.core.config.BootstepConfig;
import com.libragraph.bootstep.core.config.ShutdownPolicy;
import com.libragraph.bootstep.core.net.SocketTimeouts;
import com.libragraph.bootstep.core.registry.BlueprintModule;
import com.libragraph.bootstep.core.registry.ComponentRegistry;
import com.libragraph.bootstep.types.NamespaceState;
import com.libragraph.bootstep.util.CycleException;
import com.libragraph.bootstep.util.DependencyGraph;
import com.libragraph.bootstep.util.Instantiator;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * A group of components sharing one boot order and one lifecycle.
 * <p>
 * {@link #apply(Host, Map)} claims the blueprints registered under this namespace's name,
 * resolves their boot order, binds each to the host and includes the eligible ones. The
 * host then drives the included components with {@link #start(Host)} and
 * {@link #stop(Host)} / {@link #terminate(Host)}; external waiters block in {@link #join()}.
 *
 * <pre>
 * NEW ──start──▶ RUN ──stop──▶ CLOSE ──▶ TERMINATE
 *  │              │                        ▲
 *  └──────────────┴── stop (not fully ─────┘
 *                     started)
 * </pre>
 *
 * Only the first {@code stop}/{@code terminate} call does anything; later and concurrent
 * calls return immediately.
 */
public class Namespace {

    private static final Logger log = Logger.getLogger(Namespace.class);

    private final String name;
    private final ComponentRegistry registry;
    private final BootstepConfig config;

    private final AtomicReference<NamespaceState> state = new AtomicReference<>(NamespaceState.NEW);
    private final AtomicBoolean applied = new AtomicBoolean();
    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private final ShutdownSignal shutdownComplete = new ShutdownSignal();

    private final List<Component<?>> bootSteps = new CopyOnWriteArrayList<>();
    private final List<Startable> components = new CopyOnWriteArrayList<>();
    private volatile Map<String, Blueprint> claimed = Map.of();
    private volatile DependencyGraph<String> graph;
    private volatile int started;
    private volatile boolean startCompleted;

    private Runnable onStart;
    private Runnable onClose;
    private Runnable onStopped;

    /** Uses the global registry and configuration from MicroProfile Config. */
    public Namespace(String name) {
        this(name, ComponentRegistry.global(), BootstepConfig.load());
    }

    public Namespace(String name, ComponentRegistry registry, BootstepConfig config) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Namespace name cannot be blank");
        }
        this.name = name;
        this.registry = registry;
        this.config = config;
    }

    // -- hooks --

    public Namespace onStart(Runnable hook) {
        this.onStart = hook;
        return this;
    }

    public Namespace onClose(Runnable hook) {
        this.onClose = hook;
        return this;
    }

    public Namespace onStopped(Runnable hook) {
        this.onStopped = hook;
        return this;
    }

    /**
     * Module classes to load before components are claimed. Loading a module registers
     * more blueprints; see {@link BlueprintModule}.
     */
    protected List<String> modules() {
        return List.of();
    }

    // -- building --

    public Namespace apply(Host parent) {
        return apply(parent, Map.of());
    }

    /**
     * Claims, orders, binds and includes this namespace's components. {@code options} are
     * passed to every component constructor.
     *
     * @throws ResolutionException if requirements are unknown or cyclic
     * @throws IllegalStateException if already applied
     */
    public Namespace apply(Host parent, Map<String, Object> options) {
        if (!applied.compareAndSet(false, true)) {
            throw new IllegalStateException("Namespace '" + name + "' has already been applied");
        }
        debug("Loading modules.");
        loadModules();
        debug("Claiming components.");
        claimed = registry.claim(name);
        debug("Building boot step graph.");
        for (String stepName : finalizeBootSteps()) {
            bootSteps.add(bindComponent(stepName, parent, options));
        }
        debug("New boot order: {%s}",
                bootSteps.stream().map(Component::name).collect(Collectors.joining(", ")));

        for (Component<?> step : bootSteps) {
            if (step.include(parent) && step instanceof Startable startable) {
                components.add(startable);
            }
        }
        return this;
    }

    /** Binds the named blueprint to the host and attaches it to this namespace. */
    public Component<?> bindComponent(String stepName, Host parent, Map<String, Object> options) {
        Blueprint blueprint = blueprint(stepName);
        Component<?> component = blueprint.factory().bind(parent, options);
        if (component == null) {
            throw new IllegalStateException("Factory of " + blueprint.stepName() + " returned null");
        }
        component.attach(this, blueprint);
        return component;
    }

    public void loadModules() {
        for (String module : modules()) {
            importModule(module);
        }
    }

    /** Loads a module class and, if it is a {@link BlueprintModule}, lets it register. */
    protected Class<?> importModule(String qualifiedName) {
        Class<?> cls = Instantiator.loadClass(qualifiedName);
        if (BlueprintModule.class.isAssignableFrom(cls)) {
            BlueprintModule module = Instantiator.instantiate(cls.asSubclass(BlueprintModule.class));
            module.register(registry);
        }
        return cls;
    }

    /** Looks up a claimed blueprint by step name. */
    public Blueprint blueprint(String stepName) {
        Blueprint blueprint = claimed.get(stepName);
        if (blueprint == null) {
            throw new IllegalArgumentException(
                    "No component '" + stepName + "' in namespace '" + name + "'");
        }
        return blueprint;
    }

    private List<String> finalizeBootSteps() {
        Map<String, Set<String>> requirements = new LinkedHashMap<>();
        for (Blueprint blueprint : claimed.values()) {
            for (String required : blueprint.requires()) {
                if (!claimed.containsKey(required)) {
                    throw new ResolutionException("Component '" + blueprint.stepName()
                            + "' requires unknown component '" + name + "." + required + "'",
                            List.of(blueprint.name(), required));
                }
            }
            requirements.put(blueprint.name(), blueprint.requires());
        }
        DependencyGraph<String> g = new DependencyGraph<>(requirements);
        findLast().ifPresent(last -> {
            List<String> nodes = new ArrayList<>();
            g.forEach(nodes::add);
            for (String node : nodes) {
                if (!node.equals(last.name())) {
                    g.addEdge(last.name(), node);
                }
            }
        });
        graph = g;
        try {
            return g.topologicalOrder();
        } catch (CycleException e) {
            List<String> cycle = e.cycle().stream().map(String::valueOf).collect(Collectors.toList());
            throw new ResolutionException("Cannot resolve boot order of namespace '" + name + "': "
                    + e.getMessage(), cycle, e);
        }
    }

    /** First registered blueprint marked {@code last}; others marked last are ignored. */
    private Optional<Blueprint> findLast() {
        List<Blueprint> lasts = claimed.values().stream()
                .filter(Blueprint::last)
                .collect(Collectors.toList());
        if (lasts.size() > 1) {
            log.warnf("[%s] Several components are marked last %s; only '%s' is pinned last",
                    label(), lasts.stream().map(Blueprint::name).collect(Collectors.toList()),
                    lasts.get(0).name());
        }
        return lasts.stream().findFirst();
    }

    // -- lifecycle --

    /**
     * Starts the included components in boot order. A failing component's exception
     * propagates unchanged; the namespace stays in {@code RUN} and {@link #started()}
     * counts the components whose start was attempted.
     *
     * @throws IllegalStateException if the namespace is not {@code NEW}
     */
    public void start(Host parent) throws Exception {
        if (!state.compareAndSet(NamespaceState.NEW, NamespaceState.RUN)) {
            throw new IllegalStateException(
                    "Namespace '" + name + "' cannot start from state " + state.get());
        }
        if (onStart != null) {
            onStart.run();
        }
        int index = 0;
        for (Startable component : components) {
            log.debugf("Starting %s...", describe(component));
            started = ++index;
            component.start(parent);
            log.debugf("%s OK!", describe(component));
        }
        startCompleted = true;
    }

    /** Closes every component in the host's list, in list order. */
    public void close(Host parent) throws Exception {
        if (onClose != null) {
            onClose.run();
        }
        for (Startable component : new ArrayList<>(parent.components())) {
            if (component != null) {
                invoke("Closing", component, () -> component.close(parent));
            }
        }
    }

    public void stop(Host parent) throws Exception {
        stop(parent, false);
    }

    public void terminate(Host parent) throws Exception {
        stop(parent, true);
    }

    /**
     * Shuts the namespace down. Components are closed first; if the namespace finished
     * starting they are then stopped (or terminated) in reverse boot order, otherwise they
     * are left alone. Either way the namespace ends in {@code TERMINATE} and the shutdown
     * signal fires, even when a component call fails.
     */
    public void stop(Host parent, boolean terminate) throws Exception {
        if (state.get().isShuttingDown() || !stopRequested.compareAndSet(false, true)) {
            return;
        }
        String what = terminate ? "Terminating" : "Stopping";
        try (SocketTimeouts.Scope ignored = SocketTimeouts.override(config.shutdownSocketTimeout())) {
            try {
                close(parent);
                // started counts attempts, so a failed final start still reaches size()
                if (state.get() != NamespaceState.RUN || !startCompleted
                        || started != components.size()) {
                    debug("Not fully started, skipping component shutdown.");
                    return;
                }
                state.set(NamespaceState.CLOSE);

                List<Startable> reversed = new ArrayList<>(components);
                Collections.reverse(reversed);
                for (Startable component : reversed) {
                    log.debugf("%s %s...", what, describe(component));
                    invoke(what, component, () -> {
                        if (terminate) {
                            component.terminate(parent);
                        } else {
                            component.stop(parent);
                        }
                    });
                }
                if (onStopped != null) {
                    onStopped.run();
                }
            } finally {
                state.set(NamespaceState.TERMINATE);
                shutdownComplete.set();
            }
        }
    }

    /** Waits for shutdown to complete. */
    public void join() {
        join(null);
    }

    /**
     * Waits up to {@code timeout} (null waits forever) for shutdown to complete.
     * Interruption of the waiting thread ends the wait without an error: the interrupt
     * flag is restored and the current signal state is returned.
     *
     * @return true if shutdown has completed
     */
    public boolean join(Duration timeout) {
        try {
            if (timeout == null) {
                shutdownComplete.await();
                return true;
            }
            return shutdownComplete.await(timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            debug("Join interrupted.");
            return shutdownComplete.isSet();
        }
    }

    private void invoke(String what, Startable component, LifecycleCall call) throws Exception {
        try {
            call.run();
        } catch (Exception e) {
            if (config.shutdownPolicy() == ShutdownPolicy.PROPAGATE) {
                throw e;
            }
            log.errorf(e, "[%s] %s %s failed", label(), what, describe(component));
        }
    }

    @FunctionalInterface
    private interface LifecycleCall {
        void run() throws Exception;
    }

    // -- accessors --

    public String name() {
        return name;
    }

    public NamespaceState state() {
        return state.get();
    }

    /** Number of components whose start was attempted. */
    public int started() {
        return started;
    }

    /** Every bound component, in boot order. */
    public List<Component<?>> bootSteps() {
        return Collections.unmodifiableList(bootSteps);
    }

    /** Included startable components, in boot order. */
    public List<Startable> components() {
        return Collections.unmodifiableList(components);
    }

    /** The graph used for the last boot order, once applied. */
    public Optional<DependencyGraph<String>> graph() {
        return Optional.ofNullable(graph);
    }

    public ShutdownSignal shutdownComplete() {
        return shutdownComplete;
    }

    public ComponentRegistry registry() {
        return registry;
    }

    public BootstepConfig config() {
        return config;
    }

    private static String describe(Startable component) {
        return component instanceof Component<?> c ? c.qualifiedName() : component.getClass().getName();
    }

    private String label() {
        return name.substring(0, 1).toUpperCase(Locale.ROOT) + name.substring(1);
    }

    private void debug(String format, Object... args) {
        if (log.isDebugEnabled()) {
            log.debugf("[" + label() + "] " + format, args);
        }
    }

    @Override
    public String toString() {
        return "Namespace[" + name + ", " + state.get() + "]";
    }
}
