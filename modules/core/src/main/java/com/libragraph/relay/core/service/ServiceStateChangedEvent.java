package com.libragraph.relay.core.service;

import java.time.Instant;

/**
 * Fired via CDI whenever a {@link ManagedService} transitions between states.
 *
 * @param detail failure message for transitions into FAILED, otherwise null
 */
public record ServiceStateChangedEvent(
        String serviceId,
        ManagedService.State oldState,
        ManagedService.State newState,
        Instant timestamp,
        String detail
) {}
