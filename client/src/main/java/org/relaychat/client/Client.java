package org.relaychat.client;

import org.relaychat.crypto.AesGcmMessageCodec;
import org.relaychat.crypto.Keys;
import org.relaychat.crypto.MessageCodec;
import org.relaychat.crypto.PlaintextMessageCodec;
import org.relaychat.protocol.ProtocolTokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.SocketFactory;
import javax.net.ssl.SSLSocketFactory;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

/**
 * Minimal console front end: plain stdin/stdout lines, no formatting.
 * Reads {@code RELAY_CODEC} (aes-gcm or plaintext), {@code ENCRYPTION_KEY} and {@code RELAY_TLS}
 * from the environment, matching the server's settings.
 */
public class Client {
    private static final Logger log = LoggerFactory.getLogger(Client.class);

    public static void main(String[] args) throws InterruptedException {
        String host = args.length > 0 ? args[0] : "127.0.0.1";
        int port = args.length > 1 ? Integer.parseInt(args[1]) : 5555;

        MessageCodec codec;
        SocketFactory socketFactory;
        try {
            codec = createCodec(System.getenv());
            socketFactory = socketFactory(System.getenv());
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.exit(2);
            return;
        }
        if (codec instanceof PlaintextMessageCodec && !(socketFactory instanceof SSLSocketFactory)) {
            log.warn("Sending without payload encryption and without TLS");
        }

        BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        try (RelayClient client = new RelayClient(host, port, codec, socketFactory)) {
            client.connect();
            if (!logIn(client, stdin)) {
                return;
            }
            chat(client, stdin);
        } catch (IOException e) {
            log.debug("Session ended with an error", e);
            System.err.println("Connection error: " + e.getMessage());
            System.exit(1);
        }
    }

    private static boolean logIn(RelayClient client, BufferedReader stdin) throws IOException {
        RelayClient.AuthResult result = RelayClient.AuthResult.USERNAME_TAKEN;
        String choice = null;
        String username = null;
        while (true) {
            if (result == RelayClient.AuthResult.USERNAME_TAKEN) {
                choice = prompt(stdin, "login or register? ");
            }
            if (result != RelayClient.AuthResult.INVALID_PASSWORD) {
                username = prompt(stdin, "username: ");
            }
            String password = prompt(stdin, "password: ");
            result = ProtocolTokens.isChoice(choice, ProtocolTokens.REGISTER)
                    ? client.register(username, password)
                    : client.login(username, password);
            switch (result) {
                case SUCCESS:
                    return true;
                case FAILED:
                    System.out.println("Authentication failed.");
                    return false;
                case USERNAME_TAKEN:
                    System.out.println("Username taken, try another.");
                    break;
                case INVALID_USERNAME:
                    System.out.println("Usernames are 3 to 32 characters, without spaces or ':'.");
                    break;
                case INVALID_PASSWORD:
                    System.out.println("Passwords need at least 4 characters.");
                    break;
                default:
                    throw new IllegalStateException("Unhandled result " + result);
            }
        }
    }

    private static void chat(RelayClient client, BufferedReader stdin) throws IOException, InterruptedException {
        CountDownLatch disconnected = new CountDownLatch(1);
        client.startReceiving(new RelayClient.MessageListener() {
            @Override
            public void onMessage(String text) {
                System.out.println(text);
            }

            @Override
            public void onDisconnected() {
                disconnected.countDown();
            }
        });

        String line;
        while (disconnected.getCount() > 0 && (line = stdin.readLine()) != null) {
            client.send(line);
            if (line.trim().equalsIgnoreCase(ProtocolTokens.CMD_QUIT)) {
                break;
            }
        }
    }

    static MessageCodec createCodec(Map<String, String> env) {
        String mode = env.getOrDefault("RELAY_CODEC", "aes-gcm").trim().toLowerCase(Locale.ROOT);
        switch (mode) {
            case "aes-gcm":
                String key = env.get("ENCRYPTION_KEY");
                if (key == null || key.isEmpty()) {
                    throw new IllegalArgumentException("ENCRYPTION_KEY must be set when RELAY_CODEC is aes-gcm");
                }
                return new AesGcmMessageCodec(Keys.fromPassphrase(key));
            case "plaintext":
                return new PlaintextMessageCodec();
            default:
                throw new IllegalArgumentException("Unknown RELAY_CODEC: " + mode);
        }
    }

    // Trust material comes from the usual javax.net.ssl.trustStore system properties.
    static SocketFactory socketFactory(Map<String, String> env) {
        return Boolean.parseBoolean(env.getOrDefault("RELAY_TLS", "false").trim())
                ? SSLSocketFactory.getDefault()
                : SocketFactory.getDefault();
    }

    private static String prompt(BufferedReader stdin, String label) throws IOException {
        System.out.print(label);
        System.out.flush();
        String line = stdin.readLine();
        if (line == null) {
            throw new IOException("stdin closed");
        }
        return line.trim();
    }
}
