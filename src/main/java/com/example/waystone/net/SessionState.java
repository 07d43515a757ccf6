package com.example.waystone.net;

/**
 * Lifecycle of a session. {@link #DISCONNECTED} is terminal.
 */
public enum SessionState {
    CONNECTED("connected"),            // just connected, not yet logging in
    AUTHENTICATING("authenticating"),  // in the login / character-select flow
    PLAYING("playing"),                // a character is in the world
    DISCONNECTED("disconnected");

    private final String displayName;

    SessionState(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
