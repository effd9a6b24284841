package io.agentrelay.server.session;

/**
 * Thrown when an agent emits an event that breaks the rules of its session, such as an event for
 * another task or an update after the task reached a terminal state.
 */
public class InvalidEventException extends IllegalArgumentException {

    public InvalidEventException(String message) {
        super(message);
    }
}
