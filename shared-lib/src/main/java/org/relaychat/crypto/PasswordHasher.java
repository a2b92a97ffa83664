package org.relaychat.crypto;

import java.nio.charset.StandardCharsets;

/**
 * Hashes raw passwords before they leave the authentication layer.
 */
public final class PasswordHasher {

    private PasswordHasher() {}

    // SHA-256, lower-case hex
    public static String hash(String password) {
        byte[] hash = Keys.Digests.sha256(password.getBytes(StandardCharsets.UTF_8));
        StringBuilder sb = new StringBuilder(hash.length * 2);
        for (byte h : hash) {
            sb.append(String.format("%02x", h));
        }
        return sb.toString();
    }
}
