package org.relaychat.crypto;

/**
 * Pass-through codec for deployments where the TLS channel already provides confidentiality.
 */
public final class PlaintextMessageCodec implements MessageCodec {

    @Override
    public byte[] encode(byte[] plaintext) {
        return plaintext.clone();
    }

    @Override
    public byte[] decode(byte[] envelope) {
        return envelope.clone();
    }
}
