package org.relaychat.crypto;

/**
 * Raised when an envelope cannot be turned back into plaintext.
 */
public class CodecException extends Exception {

    public enum Reason {
        /** Authentication tag did not verify: the envelope was altered or the key is wrong. */
        TAMPER_DETECTED,
        /** Envelope too short or not valid Base64. */
        MALFORMED
    }

    private final Reason reason;

    public CodecException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public CodecException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
