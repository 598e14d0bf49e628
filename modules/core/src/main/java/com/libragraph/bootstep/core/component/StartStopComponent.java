package com.libragraph.bootstep.core.component;

import com.libragraph.bootstep.core.service.ManagedService;

/**
 * A component owning a {@link ManagedService}. Start and stop are forwarded to the
 * created service and are no-ops when {@link #create(Host)} returned nothing.
 * {@code terminate} keeps the {@link Startable} default and goes through {@link #stop(Host)};
 * steps whose service has a cold shutdown override it.
 * <p>
 * Included instances append themselves to the host's {@link Host#components()} list.
 */
public abstract class StartStopComponent<T extends ManagedService> extends Component<T>
        implements Startable {

    protected StartStopComponent(Host parent) {
        super(parent);
    }

    @Override
    public void start(Host parent) throws Exception {
        T service = obj();
        if (service != null) {
            service.start();
        }
    }

    @Override
    public void stop(Host parent) throws Exception {
        T service = obj();
        if (service != null) {
            service.stop();
        }
    }

    @Override
    public boolean include(Host parent) {
        if (super.include(parent)) {
            parent.components().add(this);
            return true;
        }
        return false;
    }
}
