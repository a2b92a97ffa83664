package org.relaychat.client;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.relaychat.client.RelayClient.AuthResult;
import org.relaychat.crypto.AesGcmMessageCodec;
import org.relaychat.crypto.Keys;
import org.relaychat.crypto.MessageCodec;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.net.ProtocolException;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Runs the client against a scripted server on a loopback socket. */
class RelayClientTest {
    private final MessageCodec codec = new AesGcmMessageCodec(Keys.fromPassphrase("client-test"));
    private final List<String> received = new CopyOnWriteArrayList<>();
    private final ExecutorService serverThread = Executors.newSingleThreadExecutor();
    private ServerSocket serverSocket;
    private RelayClient client;

    @FunctionalInterface
    private interface Script {
        void run(Peer peer) throws Exception;
    }

    private final class Peer {
        private final BufferedReader in;
        private final PrintWriter out;

        Peer(Socket socket) throws IOException {
            in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            out = new PrintWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8), true);
        }

        void send(String... lines) {
            for (String line : lines) {
                out.println(line);
            }
        }

        String read() throws IOException {
            String line = in.readLine();
            received.add(line);
            return line;
        }
    }

    @BeforeEach
    void setUp() throws IOException {
        serverSocket = new ServerSocket(0);
        client = new RelayClient("127.0.0.1", serverSocket.getLocalPort(), codec);
    }

    @AfterEach
    void tearDown() throws IOException {
        client.close();
        serverSocket.close();
        serverThread.shutdownNow();
    }

    private Future<?> serve(Script script) {
        return serverThread.submit(() -> {
            try (Socket socket = serverSocket.accept()) {
                script.run(new Peer(socket));
            }
            return null;
        });
    }

    @Test
    void registersSendsAndReceives() throws Exception {
        CountDownLatch sent = new CountDownLatch(1);
        Future<?> server = serve(peer -> {
            peer.send("AUTH_REQUIRED");
            peer.read();
            peer.send("ENTER_USERNAME");
            peer.read();
            peer.send("ENTER_PASSWORD");
            peer.read();
            peer.send("AUTH_SUCCESS");
            peer.read();
            sent.countDown();
            peer.send(codec.encodeToLine("bob: hi"), "not-an-envelope", codec.encodeToLine("[SERVER] bob left the chat"));
        });

        client.connect();
        assertThat(client.register("alice", "pass1234")).isEqualTo(AuthResult.SUCCESS);
        assertThat(client.isAuthenticated()).isTrue();

        BlockingQueue<String> inbox = new LinkedBlockingQueue<>();
        CountDownLatch disconnected = new CountDownLatch(1);
        client.startReceiving(new RelayClient.MessageListener() {
            @Override
            public void onMessage(String text) {
                inbox.add(text);
            }

            @Override
            public void onDisconnected() {
                disconnected.countDown();
            }
        });
        client.send("hello");

        assertThat(sent.await(3, TimeUnit.SECONDS)).isTrue();
        server.get(3, TimeUnit.SECONDS);
        assertThat(received.subList(0, 3)).containsExactly("REGISTER", "alice", "pass1234");
        assertThat(codec.decodeLine(received.get(3))).isEqualTo("hello");
        assertThat(inbox.poll(3, TimeUnit.SECONDS)).isEqualTo("bob: hi");
        assertThat(inbox.poll(3, TimeUnit.SECONDS)).isEqualTo("[SERVER] bob left the chat");
        assertThat(disconnected.await(3, TimeUnit.SECONDS)).isTrue();
        assertThat(inbox).isEmpty();
    }

    @Test
    void takenUsernameAllowsAnotherAttempt() throws Exception {
        Future<?> server = serve(peer -> {
            peer.send("AUTH_REQUIRED");
            peer.read();
            peer.send("ENTER_USERNAME");
            peer.read();
            peer.send("USERNAME_TAKEN", "AUTH_REQUIRED");
            peer.read();
            peer.send("ENTER_USERNAME");
            peer.read();
            peer.send("ENTER_PASSWORD");
            peer.read();
            peer.send("AUTH_SUCCESS");
        });

        client.connect();
        assertThat(client.register("alice", "pass1234")).isEqualTo(AuthResult.USERNAME_TAKEN);
        assertThat(client.isAuthenticated()).isFalse();
        assertThat(client.register("alice2", "pass1234")).isEqualTo(AuthResult.SUCCESS);

        server.get(3, TimeUnit.SECONDS);
        assertThat(received).containsExactly("REGISTER", "alice", "REGISTER", "alice2", "pass1234");
    }

    @Test
    void invalidUsernameCanBeRetriedUnderTheSameChoice() throws Exception {
        Future<?> server = serve(peer -> {
            peer.send("AUTH_REQUIRED");
            peer.read();
            peer.send("ENTER_USERNAME");
            peer.read();
            peer.send("ENTER_USERNAME");
            peer.read();
            peer.send("ENTER_PASSWORD");
            peer.read();
            peer.send("AUTH_SUCCESS");
        });

        client.connect();
        assertThat(client.register("ab", "pass1234")).isEqualTo(AuthResult.INVALID_USERNAME);
        assertThat(client.register("alice", "pass1234")).isEqualTo(AuthResult.SUCCESS);

        server.get(3, TimeUnit.SECONDS);
        assertThat(received).containsExactly("REGISTER", "ab", "alice", "pass1234");
    }

    @Test
    void shortPasswordCanBeRetried() throws Exception {
        Future<?> server = serve(peer -> {
            peer.send("AUTH_REQUIRED");
            peer.read();
            peer.send("ENTER_USERNAME");
            peer.read();
            peer.send("ENTER_PASSWORD");
            peer.read();
            peer.send("ENTER_PASSWORD");
            peer.read();
            peer.send("AUTH_SUCCESS");
        });

        client.connect();
        assertThat(client.login("alice", "abc")).isEqualTo(AuthResult.INVALID_PASSWORD);
        assertThat(client.isAuthenticated()).isFalse();
        assertThat(client.login("alice", "pass1234")).isEqualTo(AuthResult.SUCCESS);

        server.get(3, TimeUnit.SECONDS);
        assertThat(received).containsExactly("LOGIN", "alice", "abc", "pass1234");
    }

    @Test
    void rejectionAfterRepeatedInvalidInputIsAFailure() throws Exception {
        serve(peer -> {
            peer.send("AUTH_REQUIRED");
            peer.read();
            peer.send("ENTER_USERNAME");
            peer.read();
            peer.send("AUTH_FAILED");
        });

        client.connect();
        assertThat(client.register("ab", "pass1234")).isEqualTo(AuthResult.FAILED);
    }

    @Test
    void wrongPasswordReportsFailure() throws Exception {
        Future<?> server = serve(peer -> {
            peer.send("AUTH_REQUIRED");
            peer.read();
            peer.send("ENTER_USERNAME");
            peer.read();
            peer.send("ENTER_PASSWORD");
            peer.read();
            peer.send("AUTH_FAILED");
        });

        client.connect();
        assertThat(client.login("alice", "wrong123")).isEqualTo(AuthResult.FAILED);
        assertThat(client.isAuthenticated()).isFalse();
        server.get(3, TimeUnit.SECONDS);
        assertThat(received.get(0)).isEqualTo("LOGIN");
    }

    @Test
    void unexpectedServerLineIsAProtocolError() throws Exception {
        serve(peer -> peer.send("HELLO"));

        client.connect();
        assertThatThrownBy(() -> client.register("alice", "pass1234"))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("HELLO");
    }

    @Test
    void serverHangingUpDuringHandshakeIsReported() throws Exception {
        serve(peer -> peer.send("AUTH_REQUIRED"));

        client.connect();
        assertThatThrownBy(() -> client.login("alice", "pass1234")).isInstanceOf(IOException.class);
    }

    @Test
    void sendingRequiresAuthentication() throws Exception {
        serve(peer -> peer.send("AUTH_REQUIRED"));
        client.connect();

        assertThatThrownBy(() -> client.send("hello")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> client.startReceiving(text -> { }))
                .isInstanceOf(IllegalStateException.class);
    }
}
