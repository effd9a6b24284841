package io.agentrelay.server.session;

/**
 * Thrown when an agent emits an event after its session event processor was closed, typically
 * because the task was cancelled.
 */
public class SessionClosedException extends IllegalStateException {

    public SessionClosedException(String message) {
        super(message);
    }
}
