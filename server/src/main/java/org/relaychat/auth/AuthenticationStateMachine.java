package org.relaychat.auth;

import org.relaychat.crypto.PasswordHasher;
import org.relaychat.protocol.ProtocolTokens;
import org.relaychat.store.CredentialStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Drives one connection through login or registration.
 *
 * <p>The machine does no I/O: {@link #start()} and {@link #onInput(String)} return the lines
 * to send back. Every re-prompt costs one attempt; running out of attempts rejects the connection.
 * Not thread-safe, it belongs to a single worker.
 */
public class AuthenticationStateMachine {
    private static final Logger log = LoggerFactory.getLogger(AuthenticationStateMachine.class);

    public static final int MIN_USERNAME_LENGTH = 3;
    public static final int MAX_USERNAME_LENGTH = 32;
    public static final int MIN_PASSWORD_LENGTH = 4;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    private final CredentialStore store;
    private final UsernameClaim usernameClaim;
    private final int maxAttempts;

    private AuthState state = AuthState.CONNECTED;
    private AuthChoice choice;
    private String username;
    private int failedAttempts;

    public AuthenticationStateMachine(CredentialStore store, UsernameClaim usernameClaim, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.store = store;
        this.usernameClaim = usernameClaim;
        this.maxAttempts = maxAttempts;
    }

    public List<String> start() {
        requireState(AuthState.CONNECTED);
        state = AuthState.AWAIT_CHOICE;
        return List.of(ProtocolTokens.AUTH_REQUIRED);
    }

    public List<String> onInput(String input) {
        String line = input == null ? "" : input.trim();
        switch (state) {
            case AWAIT_CHOICE:
                return onChoice(line);
            case AWAIT_USERNAME:
                return onUsername(line);
            case AWAIT_PASSWORD:
                return onPassword(line);
            default:
                throw new IllegalStateException("No input expected in state " + state);
        }
    }

    private List<String> onChoice(String line) {
        Optional<AuthChoice> parsed = AuthChoice.parse(line);
        if (parsed.isEmpty()) {
            return retry(ProtocolTokens.AUTH_REQUIRED);
        }
        choice = parsed.get();
        state = AuthState.AWAIT_USERNAME;
        return List.of(ProtocolTokens.ENTER_USERNAME);
    }

    private List<String> onUsername(String line) {
        if (!isValidUsername(line)) {
            return retry(ProtocolTokens.ENTER_USERNAME);
        }
        if (choice == AuthChoice.REGISTER) {
            boolean exists;
            try {
                exists = store.usernameExists(line);
            } catch (RuntimeException e) {
                log.warn("Credential store unavailable while checking username '{}'", line, e);
                return reject();
            }
            if (exists) {
                log.info("Registration refused, username '{}' is taken", line);
                if (++failedAttempts >= maxAttempts) {
                    return reject();
                }
                choice = null;
                state = AuthState.AWAIT_CHOICE;
                return List.of(ProtocolTokens.USERNAME_TAKEN, ProtocolTokens.AUTH_REQUIRED);
            }
        }
        username = line;
        state = AuthState.AWAIT_PASSWORD;
        return List.of(ProtocolTokens.ENTER_PASSWORD);
    }

    private List<String> onPassword(String line) {
        if (line.length() < MIN_PASSWORD_LENGTH) {
            return retry(ProtocolTokens.ENTER_PASSWORD);
        }
        String passwordHash = PasswordHasher.hash(line);

        boolean accepted;
        try {
            if (choice == AuthChoice.LOGIN) {
                accepted = store.verifyCredential(username, passwordHash);
                if (!accepted) {
                    log.info("Login failed for '{}': invalid credentials", username);
                }
            } else {
                accepted = store.createCredential(username, passwordHash) == CredentialStore.CreateResult.CREATED;
                if (!accepted) {
                    log.info("Registration of '{}' lost a race with a concurrent registration", username);
                }
            }
        } catch (RuntimeException e) {
            log.warn("Credential store failed during {} of '{}'", choice, username, e);
            return reject();
        }
        if (!accepted) {
            return reject();
        }

        if (!usernameClaim.claim(username)) {
            log.info("'{}' is already online, rejecting second session", username);
            return reject();
        }
        state = AuthState.AUTHENTICATED;
        return List.of(ProtocolTokens.AUTH_SUCCESS);
    }

    private List<String> retry(String prompt) {
        if (++failedAttempts >= maxAttempts) {
            return reject();
        }
        return List.of(prompt);
    }

    private List<String> reject() {
        state = AuthState.REJECTED;
        return List.of(ProtocolTokens.AUTH_FAILED);
    }

    static boolean isValidUsername(String name) {
        if (name.length() < MIN_USERNAME_LENGTH || name.length() > MAX_USERNAME_LENGTH) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isWhitespace(c) || c == ':') {
                return false;
            }
        }
        return true;
    }

    private void requireState(AuthState expected) {
        if (state != expected) {
            throw new IllegalStateException("Expected state " + expected + " but was " + state);
        }
    }

    public AuthState state() {
        return state;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    /** The authenticated username, present only in {@link AuthState#AUTHENTICATED}. */
    public Optional<String> authenticatedUsername() {
        return state == AuthState.AUTHENTICATED ? Optional.of(username) : Optional.empty();
    }

    public Optional<AuthChoice> choice() {
        return Optional.ofNullable(choice);
    }

    public int failedAttempts() {
        return failedAttempts;
    }
}
