package org.relaychat;

import org.relaychat.broadcast.BroadcastRouter;
import org.relaychat.crypto.AesGcmMessageCodec;
import org.relaychat.crypto.Keys;
import org.relaychat.crypto.MessageCodec;
import org.relaychat.crypto.PlaintextMessageCodec;
import org.relaychat.net.ConnectionManager;
import org.relaychat.net.ConnectionWorker;
import org.relaychat.net.TlsServerSockets;
import org.relaychat.registry.ClientRegistry;
import org.relaychat.store.SqliteCredentialStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ServerSocketFactory;
import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

public class Server {

    public static void main(String[] args) throws Exception {
        Logger log = LoggerFactory.getLogger(Server.class);

        ServerConfig config = ServerConfig.load(args);
        log.info("Starting relay with {}", config);

        SqliteCredentialStore store = new SqliteCredentialStore(config.databasePath());
        store.initializeDatabase();

        MessageCodec codec = createCodec(config);
        if (config.codecMode() == ServerConfig.CodecMode.PLAINTEXT && !config.tlsEnabled()) {
            log.warn("Running without payload encryption and without TLS: traffic is readable on the wire");
        }

        ClientRegistry registry = new ClientRegistry();
        BroadcastRouter router = new BroadcastRouter(registry, codec);
        ConnectionManager manager = new ConnectionManager(
                serverSocketFactory(config),
                config.host(),
                config.port(),
                config.maxConnections(),
                registry,
                router,
                store,
                codec,
                new ConnectionWorker.Settings(
                        config.maxAuthAttempts(), config.historyReplay(), config.maxLineLength()),
                Clock.systemUTC());
        manager.start();

        // --- Periodic status report ---
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Relay-Status-Thread");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(() -> {
            try {
                log.info("Status: {} online, {} registered users, {} stored messages",
                        registry.size(), store.userCount(), store.messageCount());
            } catch (RuntimeException e) {
                log.warn("Status report failed", e);
            }
        }, 1, 1, TimeUnit.MINUTES);

        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                scheduler.shutdown();
                manager.close();
                log.info("Server shut down gracefully.");
            } catch (Exception e) {
                log.error("Error during shutdown", e);
            }
            latch.countDown();
        }));

        log.info("Server running. Press CTRL+C to stop.");
        latch.await();
    }

    static MessageCodec createCodec(ServerConfig config) {
        if (config.codecMode() == ServerConfig.CodecMode.PLAINTEXT) {
            return new PlaintextMessageCodec();
        }
        return new AesGcmMessageCodec(Keys.fromPassphrase(config.encryptionKey()));
    }

    static ServerSocketFactory serverSocketFactory(ServerConfig config) throws IOException {
        if (config.tlsKeystore().isPresent()) {
            return TlsServerSockets.fromKeystore(config.tlsKeystore().get(), config.tlsPassword().toCharArray());
        }
        return TlsServerSockets.plain();
    }
}
