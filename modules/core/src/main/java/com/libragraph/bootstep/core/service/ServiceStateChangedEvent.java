package com.libragraph.bootstep.core.service;

import java.time.Instant;

/**
 * Delivered to {@link ServiceStateListener}s whenever a {@link ManagedService} transitions
 * between states.
 */
public record ServiceStateChangedEvent(
        String serviceId,
        ManagedService.State oldState,
        ManagedService.State newState,
        Instant timestamp
) {}
