package org.relaychat.store;

import java.time.Instant;
import java.util.List;

/**
 * Credentials and chat history. Implementations serialize their own writes.
 * Password hashes arrive already hashed; raw passwords never reach a store.
 */
public interface CredentialStore {

    enum CreateResult { CREATED, CONFLICT }

    CreateResult createCredential(String username, String passwordHash);

    boolean verifyCredential(String username, String passwordHash);

    boolean usernameExists(String username);

    void appendHistory(String username, String message, Instant timestamp);

    /** The most recent {@code limit} records, oldest first. */
    List<HistoryRecord> recentHistory(int limit);

    long userCount();

    long messageCount();
}
