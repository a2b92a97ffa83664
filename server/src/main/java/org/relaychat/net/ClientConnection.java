package org.relaychat.net;

import org.relaychat.auth.AuthState;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Handle for one accepted client. Owned by its worker until registered; afterwards the
 * broadcast path may write to it as well, so writes are serialized here.
 * Identity is reference identity.
 */
public class ClientConnection {
    private static final AtomicLong ids = new AtomicLong();

    private final long id = ids.incrementAndGet();
    private final LineTransport transport;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile String authenticatedUsername;
    private volatile AuthState state = AuthState.CONNECTED;

    public ClientConnection(LineTransport transport) {
        this.transport = transport;
    }

    public String readLine() throws IOException {
        return transport.readLine();
    }

    public void send(String line) throws IOException {
        if (closed.get()) {
            throw new IOException("Connection " + id + " is closed");
        }
        writeLock.lock();
        try {
            transport.writeLine(line);
        } finally {
            writeLock.unlock();
        }
    }

    // Holding the write lock keeps broadcasts from overtaking lines the owning worker is about to send.
    void lockWrites() {
        writeLock.lock();
    }

    void unlockWrites() {
        writeLock.unlock();
    }

    // Idempotent; only the first call reaches the transport.
    public void close() {
        if (closed.compareAndSet(false, true)) {
            transport.close();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    public long id() {
        return id;
    }

    public String remoteAddress() {
        return transport.remoteAddress();
    }

    public Optional<String> authenticatedUsername() {
        return Optional.ofNullable(authenticatedUsername);
    }

    void setAuthenticatedUsername(String username) {
        this.authenticatedUsername = username;
    }

    public AuthState state() {
        return state;
    }

    void setState(AuthState state) {
        this.state = state;
    }

    @Override
    public String toString() {
        return "conn#" + id + "(" + remoteAddress() + ")";
    }
}
