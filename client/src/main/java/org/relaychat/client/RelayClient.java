package org.relaychat.client;

import org.relaychat.crypto.CodecException;
import org.relaychat.crypto.MessageCodec;
import org.relaychat.protocol.ProtocolTokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.SocketFactory;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.ProtocolException;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * Protocol level client: connects, authenticates, sends encoded chat lines and hands decoded
 * incoming lines to a {@link MessageListener}. It does no rendering of its own.
 */
public class RelayClient implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(RelayClient.class);

    public enum AuthResult { SUCCESS, FAILED, USERNAME_TAKEN, INVALID_USERNAME, INVALID_PASSWORD }

    // Server prompt already read and not yet answered.
    private enum Prompt { NONE, CHOICE, USERNAME, PASSWORD }

    public interface MessageListener {
        void onMessage(String text);

        default void onDisconnected() {}
    }

    private final String host;
    private final int port;
    private final MessageCodec codec;
    private final SocketFactory socketFactory;

    private Socket socket;
    private BufferedReader in;
    private BufferedWriter out;
    private Prompt awaiting = Prompt.NONE;
    private volatile boolean authenticated = false;
    private volatile boolean running = false;
    private Thread receiver;

    public RelayClient(String host, int port, MessageCodec codec) {
        this(host, port, codec, SocketFactory.getDefault());
    }

    public RelayClient(String host, int port, MessageCodec codec, SocketFactory socketFactory) {
        this.host = host;
        this.port = port;
        this.codec = codec;
        this.socketFactory = socketFactory;
    }

    public void connect() throws IOException {
        socket = socketFactory.createSocket(host, port);
        in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        out = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
        log.info("Connected to {}:{}", host, port);
    }

    public AuthResult login(String username, String password) throws IOException {
        return authenticate(ProtocolTokens.LOGIN, username, password);
    }

    public AuthResult register(String username, String password) throws IOException {
        return authenticate(ProtocolTokens.REGISTER, username, password);
    }

    /**
     * Answers the server's current prompt and those that follow until it decides or re-prompts.
     *
     * <p>After {@link AuthResult#USERNAME_TAKEN} the server waits for a new choice. After
     * {@link AuthResult#INVALID_USERNAME} it waits for another username and keeps the earlier
     * choice, so {@code choice} is ignored. After {@link AuthResult#INVALID_PASSWORD} only
     * {@code password} is used. In all three cases another call may follow; after
     * {@link AuthResult#FAILED} the server closes the connection.
     */
    private AuthResult authenticate(String choice, String username, String password) throws IOException {
        if (authenticated) {
            throw new IllegalStateException("Already authenticated");
        }
        if (awaiting == Prompt.NONE) {
            expect(ProtocolTokens.AUTH_REQUIRED);
            awaiting = Prompt.CHOICE;
        }
        if (awaiting == Prompt.CHOICE) {
            writeLine(choice);
            String reply = readRequired();
            if (ProtocolTokens.AUTH_FAILED.equals(reply)) {
                return AuthResult.FAILED;
            }
            if (!ProtocolTokens.ENTER_USERNAME.equals(reply)) {
                throw new ProtocolException("Expected " + ProtocolTokens.ENTER_USERNAME + " but got " + reply);
            }
            awaiting = Prompt.USERNAME;
        }
        if (awaiting == Prompt.USERNAME) {
            writeLine(username);
            String reply = readRequired();
            switch (reply) {
                case ProtocolTokens.USERNAME_TAKEN:
                    expect(ProtocolTokens.AUTH_REQUIRED);
                    awaiting = Prompt.CHOICE;
                    return AuthResult.USERNAME_TAKEN;
                case ProtocolTokens.ENTER_USERNAME:
                    return AuthResult.INVALID_USERNAME;
                case ProtocolTokens.AUTH_FAILED:
                    return AuthResult.FAILED;
                case ProtocolTokens.ENTER_PASSWORD:
                    awaiting = Prompt.PASSWORD;
                    break;
                default:
                    throw new ProtocolException("Expected " + ProtocolTokens.ENTER_PASSWORD + " but got " + reply);
            }
        }

        writeLine(password);
        String reply = readRequired();
        switch (reply) {
            case ProtocolTokens.AUTH_SUCCESS:
                authenticated = true;
                awaiting = Prompt.NONE;
                return AuthResult.SUCCESS;
            case ProtocolTokens.ENTER_PASSWORD:
                return AuthResult.INVALID_PASSWORD;
            case ProtocolTokens.AUTH_FAILED:
                return AuthResult.FAILED;
            default:
                throw new ProtocolException("Unexpected authentication reply: " + reply);
        }
    }

    public void send(String text) throws IOException {
        if (!authenticated) {
            throw new IllegalStateException("Not authenticated");
        }
        writeLine(codec.encodeToLine(text));
    }

    public void quit() throws IOException {
        send(ProtocolTokens.CMD_QUIT);
    }

    /** Starts a daemon thread that decodes every incoming line and passes it to {@code listener}. */
    public synchronized void startReceiving(MessageListener listener) {
        if (!authenticated) {
            throw new IllegalStateException("Not authenticated");
        }
        if (running) return;
        running = true;
        receiver = new Thread(() -> receiveLoop(listener), "Relay-Receiver-Thread");
        receiver.setDaemon(true);
        receiver.start();
    }

    private void receiveLoop(MessageListener listener) {
        try {
            String line;
            while (running && (line = in.readLine()) != null) {
                try {
                    listener.onMessage(codec.decodeLine(line));
                } catch (CodecException e) {
                    log.warn("Dropping undecodable line from server ({})", e.getReason());
                }
            }
        } catch (IOException e) {
            if (running) {
                log.info("Connection lost: {}", e.toString());
            }
        } finally {
            running = false;
            listener.onDisconnected();
        }
    }

    public boolean isAuthenticated() {
        return authenticated;
    }

    private String readRequired() throws IOException {
        String line = in.readLine();
        if (line == null) {
            throw new ProtocolException("Server closed the connection");
        }
        return line;
    }

    private void expect(String token) throws IOException {
        String line = readRequired();
        if (!token.equals(line)) {
            throw new ProtocolException("Expected " + token + " but got " + line);
        }
    }

    private synchronized void writeLine(String line) throws IOException {
        out.write(line);
        out.write('\n');
        out.flush();
    }

    @Override
    public void close() {
        running = false;
        if (socket != null) {
            try {
                socket.close();
            } catch (IOException e) {
                log.debug("Error closing socket", e);
            }
        }
    }
}
