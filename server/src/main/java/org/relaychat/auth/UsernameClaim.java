package org.relaychat.auth;

/**
 * Final step of a successful authentication: take the username for this connection.
 * Returns false when another live connection already holds it.
 */
@FunctionalInterface
public interface UsernameClaim {
    boolean claim(String username);
}
