package org.relaychat.crypto;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * AES-256 GCM codec producing envelopes laid out as {@code nonce(16) || tag(16) || ciphertext}.
 */
public final class AesGcmMessageCodec implements MessageCodec {
    private static final String ALGO = "AES/GCM/NoPadding";
    public static final int NONCE_LENGTH = 16;
    public static final int TAG_LENGTH = 16;
    public static final int HEADER_LENGTH = NONCE_LENGTH + TAG_LENGTH;
    private static final int TAG_LENGTH_BITS = TAG_LENGTH * 8;
    private static final SecureRandom RANDOM = new SecureRandom();

    private final SecretKey key;

    public AesGcmMessageCodec(SecretKey key) {
        if (key == null || !"AES".equals(key.getAlgorithm())) {
            throw new IllegalArgumentException("An AES key is required");
        }
        this.key = key;
    }

    @Override
    public byte[] encode(byte[] plaintext) {
        byte[] nonce = new byte[NONCE_LENGTH];
        RANDOM.nextBytes(nonce); // never reused: a fresh nonce for every envelope

        byte[] sealed;
        try {
            Cipher cipher = Cipher.getInstance(ALGO);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
            sealed = cipher.doFinal(plaintext);
        } catch (GeneralSecurityException e) {
            // AES/GCM is always available on a standard JVM
            throw new IllegalStateException("AES-GCM encryption failed", e);
        }

        // JCE appends the tag to the ciphertext; the envelope carries it up front.
        int ctLength = sealed.length - TAG_LENGTH;
        return ByteBuffer.allocate(HEADER_LENGTH + ctLength)
                .put(nonce)
                .put(sealed, ctLength, TAG_LENGTH)
                .put(sealed, 0, ctLength)
                .array();
    }

    @Override
    public byte[] decode(byte[] envelope) throws CodecException {
        if (envelope == null || envelope.length < HEADER_LENGTH) {
            throw new CodecException(CodecException.Reason.MALFORMED,
                    "Envelope shorter than " + HEADER_LENGTH + " bytes");
        }
        byte[] nonce = Arrays.copyOfRange(envelope, 0, NONCE_LENGTH);
        int ctLength = envelope.length - HEADER_LENGTH;

        byte[] sealed = ByteBuffer.allocate(ctLength + TAG_LENGTH)
                .put(envelope, HEADER_LENGTH, ctLength)
                .put(envelope, NONCE_LENGTH, TAG_LENGTH)
                .array();
        try {
            Cipher cipher = Cipher.getInstance(ALGO);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
            return cipher.doFinal(sealed);
        } catch (AEADBadTagException e) {
            throw new CodecException(CodecException.Reason.TAMPER_DETECTED, "Authentication tag mismatch", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM decryption failed", e);
        }
    }
}
