package org.relaychat.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class SqliteCredentialStore implements CredentialStore {
    private static final Logger log = LoggerFactory.getLogger(SqliteCredentialStore.class);
    private final String dbUrl;
    private final Path dbPath;

    public SqliteCredentialStore(Path dbPath) {
        this.dbPath = dbPath;
        this.dbUrl = "jdbc:sqlite:" + dbPath;
    }

    public void initializeDatabase() {
        String users = """
                CREATE TABLE IF NOT EXISTS users (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    username TEXT UNIQUE NOT NULL,
                    password_hash TEXT NOT NULL,
                    created_at INTEGER NOT NULL
                );
                """;
        String messages = """
                CREATE TABLE IF NOT EXISTS messages (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    username TEXT NOT NULL,
                    message TEXT NOT NULL,
                    timestamp INTEGER NOT NULL
                );
                """;

        try {
            Path parent = dbPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new CredentialStoreException("Failed to create database directory for " + dbPath, e);
        }

        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            stmt.execute(users);
            stmt.execute(messages);
            log.info("Database initialized: {}", dbPath);
        } catch (SQLException e) {
            log.error("Error initializing the database", e);
            throw new CredentialStoreException("Failed to initialize the database", e);
        }
    }

    @Override
    public synchronized CreateResult createCredential(String username, String passwordHash) {
        // The UNIQUE constraint decides races between concurrent registrations.
        String sql = "INSERT OR IGNORE INTO users(username, password_hash, created_at) VALUES(?,?,?)";

        try (Connection conn = connect(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, username);
            stmt.setString(2, passwordHash);
            stmt.setLong(3, System.currentTimeMillis());
            if (stmt.executeUpdate() == 0) {
                log.info("Registration refused: username '{}' already exists", username);
                return CreateResult.CONFLICT;
            }
            log.info("User registered: {}", username);
            return CreateResult.CREATED;
        } catch (SQLException e) {
            log.error("Error registering user '{}'", username, e);
            throw new CredentialStoreException("Failed to create credential", e);
        }
    }

    @Override
    public boolean verifyCredential(String username, String passwordHash) {
        String sql = "SELECT 1 FROM users WHERE username = ? AND password_hash = ?";

        try (Connection conn = connect(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, username);
            stmt.setString(2, passwordHash);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            log.error("Error verifying credentials for '{}'", username, e);
            throw new CredentialStoreException("Failed to verify credential", e);
        }
    }

    @Override
    public boolean usernameExists(String username) {
        String sql = "SELECT 1 FROM users WHERE username = ?";

        try (Connection conn = connect(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, username);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            log.error("Error checking username '{}'", username, e);
            throw new CredentialStoreException("Failed to check username", e);
        }
    }

    @Override
    public synchronized void appendHistory(String username, String message, Instant timestamp) {
        String sql = "INSERT INTO messages(username, message, timestamp) VALUES(?,?,?)";

        try (Connection conn = connect(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, username);
            stmt.setString(2, message);
            stmt.setLong(3, timestamp.toEpochMilli());
            stmt.executeUpdate();
        } catch (SQLException e) {
            log.error("Error logging message from '{}'", username, e);
            throw new CredentialStoreException("Failed to append history", e);
        }
    }

    @Override
    public List<HistoryRecord> recentHistory(int limit) {
        String sql = "SELECT username, message, timestamp FROM messages ORDER BY id DESC LIMIT ?";
        List<HistoryRecord> records = new ArrayList<>();

        try (Connection conn = connect(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setInt(1, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    records.add(new HistoryRecord(
                            rs.getString("username"),
                            rs.getString("message"),
                            Instant.ofEpochMilli(rs.getLong("timestamp"))
                    ));
                }
            }
        } catch (SQLException e) {
            log.error("Error retrieving chat history", e);
            throw new CredentialStoreException("Failed to read history", e);
        }
        Collections.reverse(records);
        return records;
    }

    @Override
    public long userCount() {
        return count("SELECT COUNT(*) FROM users");
    }

    @Override
    public long messageCount() {
        return count("SELECT COUNT(*) FROM messages");
    }

    private long count(String sql) {
        try (Connection conn = connect();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getLong(1) : 0;
        } catch (SQLException e) {
            log.error("Error running count query '{}'", sql, e);
            throw new CredentialStoreException("Failed to count rows", e);
        }
    }

    private Connection connect() throws SQLException {
        Connection conn = DriverManager.getConnection(dbUrl);
        // Wait for the disk on every write; history and credentials must survive a crash.
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("PRAGMA synchronous = FULL;");
        }
        return conn;
    }
}
