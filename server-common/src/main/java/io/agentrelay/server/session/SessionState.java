package io.agentrelay.server.session;

/**
 * Lifecycle of a {@link Session}. States only move forward.
 */
public enum SessionState {
    CREATED,
    STARTED,
    FINISHED,
    CLOSED
}
