package org.relaychat.protocol;

import java.util.Locale;

/**
 * Text tokens exchanged over the relay's line protocol.
 * Authentication tokens travel as plain lines; once {@link #AUTH_SUCCESS} has been sent
 * every line in both directions is an encoded envelope.
 */
public final class ProtocolTokens {

    // Server -> client, authentication phase
    public static final String AUTH_REQUIRED = "AUTH_REQUIRED";
    public static final String ENTER_USERNAME = "ENTER_USERNAME";
    public static final String ENTER_PASSWORD = "ENTER_PASSWORD";
    public static final String USERNAME_TAKEN = "USERNAME_TAKEN";
    public static final String AUTH_SUCCESS = "AUTH_SUCCESS";
    public static final String AUTH_FAILED = "AUTH_FAILED";

    // Client -> server, authentication phase
    public static final String LOGIN = "LOGIN";
    public static final String REGISTER = "REGISTER";

    // Client -> server commands, sent encoded like chat text
    public static final String CMD_QUIT = "/quit";
    public static final String CMD_USERS = "/users";

    // Prefixes of server generated chat lines
    public static final String SERVER_PREFIX = "[SERVER] ";
    public static final String HISTORY_PREFIX = "[HISTORY] ";

    private ProtocolTokens() {}

    public static String chatLine(String username, String text) {
        return username + ": " + text;
    }

    public static String joinNotice(String username) {
        return SERVER_PREFIX + username + " joined the chat";
    }

    public static String leaveNotice(String username) {
        return SERVER_PREFIX + username + " left the chat";
    }

    public static String historyLine(String username, String text) {
        return HISTORY_PREFIX + chatLine(username, text);
    }

    public static String onlineLine(Iterable<String> usernames) {
        return SERVER_PREFIX + "Online: " + String.join(", ", usernames);
    }

    // Path selection is case-insensitive; surrounding whitespace is ignored.
    public static boolean isChoice(String input, String token) {
        return input != null && input.trim().toUpperCase(Locale.ROOT).equals(token);
    }
}
