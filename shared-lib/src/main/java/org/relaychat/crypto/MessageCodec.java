package org.relaychat.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Turns plaintext chat payloads into transport-safe envelopes and back.
 * Implementations hold nothing but their key; they know nothing about users or connections.
 */
public interface MessageCodec {

    byte[] encode(byte[] plaintext);

    byte[] decode(byte[] envelope) throws CodecException;

    // One envelope per text line: Base64 of the raw envelope bytes.
    default String encodeToLine(String plaintext) {
        return Base64.getEncoder().encodeToString(encode(plaintext.getBytes(StandardCharsets.UTF_8)));
    }

    default String decodeLine(String line) throws CodecException {
        byte[] envelope;
        try {
            envelope = Base64.getDecoder().decode(line.trim());
        } catch (IllegalArgumentException e) {
            throw new CodecException(CodecException.Reason.MALFORMED, "Envelope is not valid Base64", e);
        }
        return new String(decode(envelope), StandardCharsets.UTF_8);
    }
}
