package org.relaychat.net;

import org.relaychat.auth.AuthState;
import org.relaychat.auth.AuthenticationStateMachine;
import org.relaychat.broadcast.BroadcastRouter;
import org.relaychat.broadcast.ChatMessage;
import org.relaychat.crypto.CodecException;
import org.relaychat.crypto.MessageCodec;
import org.relaychat.protocol.ProtocolTokens;
import org.relaychat.registry.ClientRegistry;
import org.relaychat.store.CredentialStore;
import org.relaychat.store.HistoryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.List;

/**
 * Owns one connection from accept to teardown: authentication, join notice, read loop,
 * and on every exit path deregistration, departure notice and release of the socket.
 */
public class ConnectionWorker implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(ConnectionWorker.class);

    public static final int DEFAULT_HISTORY_REPLAY = 20;
    // Well above the Base64 envelope of any chat line a person types.
    public static final int DEFAULT_MAX_LINE_LENGTH = 64 * 1024;

    private final ClientConnection connection;
    private final ClientRegistry registry;
    private final BroadcastRouter router;
    private final CredentialStore store;
    private final MessageCodec codec;
    private final Settings settings;
    private final Clock clock;
    private boolean joinAnnounced = false;

    /**
     * @param maxAuthAttempts failed authentication attempts before the connection is dropped
     * @param historyReplay   number of stored messages replayed to a client after it joins, 0 disables
     * @param maxLineLength   longest line accepted from a client, in characters
     */
    public record Settings(int maxAuthAttempts, int historyReplay, int maxLineLength) {}

    public ConnectionWorker(ClientConnection connection, ClientRegistry registry, BroadcastRouter router,
                            CredentialStore store, MessageCodec codec, Settings settings, Clock clock) {
        this.connection = connection;
        this.registry = registry;
        this.router = router;
        this.store = store;
        this.codec = codec;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            serve();
        } catch (LineTooLongException e) {
            log.warn("Closing {}: {}", connection, e.getMessage());
        } catch (IOException e) {
            log.debug("Connection {} lost: {}", connection, e.toString());
        } catch (RuntimeException e) {
            log.error("Worker for {} failed", connection, e);
        } finally {
            teardown();
        }
    }

    private void serve() throws IOException {
        if (!authenticate()) {
            return;
        }
        String username = connection.authenticatedUsername().orElseThrow();
        log.info("{} authenticated as '{}' ({} online)", connection, username, registry.size());

        replayHistory(username);
        router.deliver(ProtocolTokens.joinNotice(username), connection);
        joinAnnounced = true;
        readLoop(username);
    }

    private boolean authenticate() throws IOException {
        AuthenticationStateMachine auth = new AuthenticationStateMachine(
                store, name -> registry.register(connection, name), settings.maxAuthAttempts());

        sendAll(auth.start());
        connection.setState(auth.state());
        while (!auth.isTerminal()) {
            String line = connection.readLine();
            if (line == null) {
                log.debug("{} closed during authentication in state {}", connection, auth.state());
                return false;
            }
            // A successful claim makes the connection visible to broadcasts; AUTH_SUCCESS must go out first.
            connection.lockWrites();
            try {
                List<String> replies = auth.onInput(line);
                connection.setState(auth.state());
                auth.authenticatedUsername().ifPresent(connection::setAuthenticatedUsername);
                sendAll(replies);
            } finally {
                connection.unlockWrites();
            }
        }
        if (auth.state() == AuthState.REJECTED) {
            log.info("{} rejected after {} failed attempt(s)", connection, auth.failedAttempts());
            return false;
        }
        return true;
    }

    private void readLoop(String username) throws IOException {
        String line;
        while ((line = connection.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            String text;
            try {
                text = codec.decodeLine(line);
            } catch (CodecException e) {
                log.warn("Discarding {} payload from '{}' on {}, closing connection",
                        e.getReason(), username, connection);
                return;
            }

            String trimmed = text.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.equalsIgnoreCase(ProtocolTokens.CMD_QUIT)) {
                log.info("'{}' quit", username);
                return;
            }
            if (trimmed.equalsIgnoreCase(ProtocolTokens.CMD_USERS)) {
                router.sendTo(connection, username, ProtocolTokens.onlineLine(registry.onlineUsernames()));
                continue;
            }

            ChatMessage message = new ChatMessage(username, text, clock.instant());
            persist(message);
            router.deliver(message, connection);
        }
        log.debug("'{}' closed the stream", username);
    }

    // History is best effort: a store failure never holds up delivery.
    private void persist(ChatMessage message) {
        try {
            store.appendHistory(message.senderUsername(), message.plaintext(), message.timestamp());
        } catch (RuntimeException e) {
            log.warn("Could not store message from '{}'", message.senderUsername(), e);
        }
    }

    private void replayHistory(String username) {
        if (settings.historyReplay() <= 0) {
            return;
        }
        List<HistoryRecord> history;
        try {
            history = store.recentHistory(settings.historyReplay());
        } catch (RuntimeException e) {
            log.warn("Could not load history for '{}'", username, e);
            return;
        }
        for (HistoryRecord record : history) {
            if (!router.sendTo(connection, username, ProtocolTokens.historyLine(record.username(), record.message()))) {
                return;
            }
        }
    }

    private void sendAll(List<String> lines) throws IOException {
        for (String line : lines) {
            connection.send(line);
        }
    }

    private void teardown() {
        registry.deregister(connection);
        connection.close();
        connection.authenticatedUsername().ifPresent(username -> {
            log.info("'{}' left ({} online)", username, registry.size());
            // Nobody heard about a user whose session failed before the join notice.
            if (joinAnnounced) {
                router.deliver(ProtocolTokens.leaveNotice(username), connection);
            }
        });
    }
}
