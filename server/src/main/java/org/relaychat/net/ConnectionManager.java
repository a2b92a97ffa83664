package org.relaychat.net;

import org.relaychat.broadcast.BroadcastRouter;
import org.relaychat.crypto.MessageCodec;
import org.relaychat.registry.ClientRegistry;
import org.relaychat.store.CredentialStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ServerSocketFactory;
import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Clock;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Accept loop plus one worker thread per connection.
 * Nothing a worker does, including crashing, can stop the accept loop.
 */
public class ConnectionManager implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);
    private static final int BACKLOG = 50;

    private final ServerSocketFactory serverSocketFactory;
    private final String host;
    private final int port;
    private final int maxConnections;
    private final ClientRegistry registry;
    private final BroadcastRouter router;
    private final CredentialStore store;
    private final MessageCodec codec;
    private final ConnectionWorker.Settings settings;
    private final Clock clock;

    private final Set<ClientConnection> openConnections = ConcurrentHashMap.newKeySet();
    private final AtomicInteger workerCount = new AtomicInteger();
    private final ExecutorService workers = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "Relay-Worker-" + workerCount.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private volatile ServerSocket serverSocket;
    private volatile boolean running = false;
    private Thread acceptThread;

    public ConnectionManager(ServerSocketFactory serverSocketFactory, String host, int port, int maxConnections,
                             ClientRegistry registry, BroadcastRouter router, CredentialStore store,
                             MessageCodec codec, ConnectionWorker.Settings settings, Clock clock) {
        this.serverSocketFactory = serverSocketFactory;
        this.host = host;
        this.port = port;
        this.maxConnections = maxConnections;
        this.registry = registry;
        this.router = router;
        this.store = store;
        this.codec = codec;
        this.settings = settings;
        this.clock = clock;
    }

    /** Binds the listening socket and starts the accept loop on its own thread. */
    public synchronized void start() throws IOException {
        if (running) return;
        serverSocket = serverSocketFactory.createServerSocket(port, BACKLOG, InetAddress.getByName(host));
        running = true;
        acceptThread = new Thread(this::acceptLoop, "Relay-Accept-Thread");
        acceptThread.start();
        log.info("Listening on {}:{}", host, serverSocket.getLocalPort());
    }

    /** Blocks until a client connects. */
    public ClientConnection accept() throws IOException {
        Socket socket = serverSocket.accept();
        try {
            return new ClientConnection(new SocketLineTransport(socket, settings.maxLineLength()));
        } catch (IOException e) {
            socket.close();
            throw e;
        }
    }

    /** Starts an independent worker that owns {@code connection} until it is torn down. */
    public void spawnWorker(ClientConnection connection) {
        ConnectionWorker worker = new ConnectionWorker(connection, registry, router, store, codec, settings, clock);
        openConnections.add(connection);
        try {
            workers.execute(() -> {
                try {
                    worker.run();
                } finally {
                    openConnections.remove(connection);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Server shutting down, refusing {}", connection);
            openConnections.remove(connection);
            connection.close();
        }
    }

    private void acceptLoop() {
        while (running) {
            try {
                ClientConnection connection = accept();
                if (openConnections.size() >= maxConnections) {
                    log.warn("Connection limit {} reached, refusing {}", maxConnections, connection);
                    connection.close();
                    continue;
                }
                log.info("Connection from {}", connection.remoteAddress());
                spawnWorker(connection);
            } catch (IOException e) {
                if (!running) {
                    break;
                }
                log.warn("Accept failed", e);
            } catch (RuntimeException e) {
                log.error("Unexpected error in accept loop", e);
            }
        }
        log.info("Accept loop stopped");
    }

    public int localPort() {
        ServerSocket socket = serverSocket;
        if (socket == null) {
            throw new IllegalStateException("Not started");
        }
        return socket.getLocalPort();
    }

    public boolean isRunning() {
        return running;
    }

    public int openConnectionCount() {
        return openConnections.size();
    }

    @Override
    public synchronized void close() {
        if (!running) return;
        running = false;
        try {
            serverSocket.close();
        } catch (IOException e) {
            log.warn("Error closing server socket", e);
        }
        // Closing each connection unblocks its worker's read; teardown runs on the worker.
        openConnections.forEach(ClientConnection::close);
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Workers still running after 5s, forcing shutdown");
                workers.shutdownNow();
            }
            acceptThread.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for workers to stop.", e);
            Thread.currentThread().interrupt();
        }
        log.info("Connection manager closed");
    }
}
