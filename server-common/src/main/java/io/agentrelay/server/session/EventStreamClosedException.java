package io.agentrelay.server.session;

import org.jspecify.annotations.Nullable;

/**
 * Signals the end of an event stream to a subscriber. The cause, when present, is the failure the
 * session ended with.
 */
public class EventStreamClosedException extends Exception {

    public EventStreamClosedException(@Nullable Throwable cause) {
        super(cause == null ? "Event stream is closed" : "Event stream failed: " + cause.getMessage(), cause);
    }
}
