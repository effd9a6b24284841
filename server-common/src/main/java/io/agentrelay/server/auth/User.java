package io.agentrelay.server.auth;

public interface User {

    boolean isAuthenticated();

    String getUsername();
}
