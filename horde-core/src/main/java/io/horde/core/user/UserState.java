package io.horde.core.user;

/**
 * Lifecycle of a virtual user. STOPPED is terminal.
 */
public enum UserState {
    STARTING,
    RUNNING,
    STOPPING,
    STOPPED
}
