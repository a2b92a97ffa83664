package org.relaychat;

import org.relaychat.auth.AuthenticationStateMachine;
import org.relaychat.net.ConnectionWorker;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Server settings. Defaults come from {@code relay-server.properties} on the classpath,
 * environment variables override them, and a port given as first argument overrides both.
 */
public record ServerConfig(
        String host,
        int port,
        CodecMode codecMode,
        String encryptionKey,
        Path databasePath,
        int maxConnections,
        int maxAuthAttempts,
        int historyReplay,
        int maxLineLength,
        Optional<Path> tlsKeystore,
        String tlsPassword) {

    public enum CodecMode { AES_GCM, PLAINTEXT }

    static final String RESOURCE = "relay-server.properties";

    // property key -> environment variable
    private static final Map<String, String> ENV_OVERRIDES = Map.ofEntries(
            Map.entry("relay.host", "SERVER_HOST"),
            Map.entry("relay.port", "SERVER_PORT"),
            Map.entry("relay.codec", "RELAY_CODEC"),
            Map.entry("relay.encryption.key", "ENCRYPTION_KEY"),
            Map.entry("relay.db.path", "RELAY_DB_PATH"),
            Map.entry("relay.max.connections", "RELAY_MAX_CONNECTIONS"),
            Map.entry("relay.auth.max.attempts", "RELAY_AUTH_MAX_ATTEMPTS"),
            Map.entry("relay.history.replay", "RELAY_HISTORY_REPLAY"),
            Map.entry("relay.max.line.length", "RELAY_MAX_LINE_LENGTH"),
            Map.entry("relay.tls.keystore", "RELAY_TLS_KEYSTORE"),
            Map.entry("relay.tls.password", "RELAY_TLS_PASSWORD"));

    public ServerConfig {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
        if (maxConnections < 1) {
            throw new IllegalArgumentException("relay.max.connections must be positive");
        }
        if (maxAuthAttempts < 1) {
            throw new IllegalArgumentException("relay.auth.max.attempts must be positive");
        }
        if (historyReplay < 0) {
            throw new IllegalArgumentException("relay.history.replay must not be negative");
        }
        if (maxLineLength < 1) {
            throw new IllegalArgumentException("relay.max.line.length must be positive");
        }
        if (codecMode == CodecMode.AES_GCM && (encryptionKey == null || encryptionKey.isEmpty())) {
            throw new IllegalArgumentException("ENCRYPTION_KEY must be set when relay.codec is aes-gcm");
        }
    }

    public static ServerConfig load(String[] args) {
        return load(args, System.getenv(), loadDefaults());
    }

    static ServerConfig load(String[] args, Map<String, String> env, Properties defaults) {
        Properties props = new Properties();
        props.putAll(defaults);
        ENV_OVERRIDES.forEach((key, var) -> {
            String value = env.get(var);
            if (value != null && !value.isBlank()) {
                props.setProperty(key, value);
            }
        });
        if (args.length > 0) {
            props.setProperty("relay.port", args[0]);
        }

        String keystore = props.getProperty("relay.tls.keystore", "").trim();
        return new ServerConfig(
                props.getProperty("relay.host", "0.0.0.0").trim(),
                intValue(props, "relay.port", 5555),
                codecMode(props.getProperty("relay.codec", "aes-gcm")),
                props.getProperty("relay.encryption.key", ""),
                Path.of(props.getProperty("relay.db.path", "data/chat_system.db").trim()),
                intValue(props, "relay.max.connections", 100),
                intValue(props, "relay.auth.max.attempts", AuthenticationStateMachine.DEFAULT_MAX_ATTEMPTS),
                intValue(props, "relay.history.replay", ConnectionWorker.DEFAULT_HISTORY_REPLAY),
                intValue(props, "relay.max.line.length", ConnectionWorker.DEFAULT_MAX_LINE_LENGTH),
                keystore.isEmpty() ? Optional.empty() : Optional.of(Path.of(keystore)),
                props.getProperty("relay.tls.password", ""));
    }

    static Properties loadDefaults() {
        Properties props = new Properties();
        try (InputStream in = ServerConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
        return props;
    }

    private static int intValue(Properties props, String key, int fallback) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
        }
    }

    private static CodecMode codecMode(String value) {
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "aes-gcm":
                return CodecMode.AES_GCM;
            case "plaintext":
                return CodecMode.PLAINTEXT;
            default:
                throw new IllegalArgumentException("Unknown relay.codec: " + value);
        }
    }

    public boolean tlsEnabled() {
        return tlsKeystore.isPresent();
    }

    @Override
    public String toString() {
        // keeps secrets out of the logs
        return "ServerConfig[host=" + host + ", port=" + port + ", codec=" + codecMode
                + ", db=" + databasePath + ", maxConnections=" + maxConnections
                + ", maxAuthAttempts=" + maxAuthAttempts + ", historyReplay=" + historyReplay
                + ", maxLineLength=" + maxLineLength
                + ", tls=" + tlsEnabled() + "]";
    }
}
