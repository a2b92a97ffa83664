package org.relaychat.crypto;

import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;

public final class Keys {
    private static final SecureRandom secureRandom = new SecureRandom();

    private Keys() {}

    // Any passphrase length works: SHA-256 always yields the 32 bytes AES-256 needs.
    public static SecretKey fromPassphrase(String passphrase) {
        if (passphrase == null || passphrase.isEmpty()) {
            throw new IllegalArgumentException("Passphrase must not be empty");
        }
        return new SecretKeySpec(Digests.sha256(passphrase.getBytes(StandardCharsets.UTF_8)), "AES");
    }

    public static SecretKey generate() {
        try {
            KeyGenerator keyGen = KeyGenerator.getInstance("AES");
            keyGen.init(256, secureRandom);
            return keyGen.generateKey();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("AES not available", e);
        }
    }

    static final class Digests {
        private Digests() {}

        static byte[] sha256(byte[] input) {
            try {
                return MessageDigest.getInstance("SHA-256").digest(input);
            } catch (NoSuchAlgorithmException e) {
                // In a normal JVM, SHA-256 is always present
                throw new IllegalStateException("SHA-256 algorithm not available", e);
            }
        }
    }
}
