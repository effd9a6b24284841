package io.agentrelay.server;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.agentrelay.server.auth.User;
import io.agentrelay.util.Assert;

/**
 * Per-request context handed from the transport to the request handler and on to the agent:
 * the calling user and transport specific state, such as request headers.
 */
public class ServerCallContext {

    private final User user;
    private final Map<String, Object> state;

    public ServerCallContext(User user, Map<String, Object> state) {
        this.user = Assert.checkNotNullParam("user", user);
        this.state = new ConcurrentHashMap<>(Assert.checkNotNullParam("state", state));
    }

    public User getUser() {
        return user;
    }

    public Map<String, Object> getState() {
        return state;
    }
}
