package org.relaychat.registry;

import org.relaychat.net.ClientConnection;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Who is online. Maps each live connection to its authenticated username.
 *
 * <p>All reads and writes go through one lock. Live usernames are unique (case-sensitive);
 * a name becomes available again as soon as its entry is removed.
 */
public final class ClientRegistry {

    public record Entry(ClientConnection connection, String username) {}

    private final ReentrantLock lock = new ReentrantLock();
    // insertion order gives snapshots a stable, registration ordered iteration
    private final Map<ClientConnection, String> usernamesByConnection = new LinkedHashMap<>();
    private final Map<String, ClientConnection> connectionsByUsername = new HashMap<>();

    /**
     * Inserts the entry unless the username is already live or the connection already holds an entry.
     *
     * @return false on conflict; the caller must reject the authentication
     */
    public boolean register(ClientConnection connection, String username) {
        lock.lock();
        try {
            if (connectionsByUsername.containsKey(username) || usernamesByConnection.containsKey(connection)) {
                return false;
            }
            usernamesByConnection.put(connection, username);
            connectionsByUsername.put(username, connection);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the connection's entry. Removing an absent connection is a no-op.
     *
     * @return true if an entry was removed by this call
     */
    public boolean deregister(ClientConnection connection) {
        lock.lock();
        try {
            String username = usernamesByConnection.remove(connection);
            if (username == null) {
                return false;
            }
            connectionsByUsername.remove(username);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Point-in-time copy of all live entries, taken under the lock. Later mutations do not affect it.
     */
    public List<Entry> snapshot() {
        lock.lock();
        try {
            List<Entry> entries = new ArrayList<>(usernamesByConnection.size());
            usernamesByConnection.forEach((connection, username) -> entries.add(new Entry(connection, username)));
            return entries;
        } finally {
            lock.unlock();
        }
    }

    public List<String> onlineUsernames() {
        lock.lock();
        try {
            return new ArrayList<>(usernamesByConnection.values());
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> usernameOf(ClientConnection connection) {
        lock.lock();
        try {
            return Optional.ofNullable(usernamesByConnection.get(connection));
        } finally {
            lock.unlock();
        }
    }

    public boolean isOnline(String username) {
        lock.lock();
        try {
            return connectionsByUsername.containsKey(username);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return usernamesByConnection.size();
        } finally {
            lock.unlock();
        }
    }
}
