package org.relaychat.auth;

public enum AuthState {
    CONNECTED,
    AWAIT_CHOICE,
    AWAIT_USERNAME,
    AWAIT_PASSWORD,
    AUTHENTICATED,
    REJECTED;

    public boolean isTerminal() {
        return this == AUTHENTICATED || this == REJECTED;
    }
}
