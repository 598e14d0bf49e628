package com.libragraph.bootstep.core.service;

@FunctionalInterface
public interface ServiceStateListener {

    void onStateChanged(ServiceStateChangedEvent event);
}
