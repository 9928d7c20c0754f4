package com.cloudmusic.resolver;

/**
 * Availability state of a guarded provider.
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
