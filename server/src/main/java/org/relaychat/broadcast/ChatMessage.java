package org.relaychat.broadcast;

import org.relaychat.protocol.ProtocolTokens;

import java.time.Instant;

/**
 * One inbound chat payload after decoding. Lives only until it has been persisted and delivered.
 */
public record ChatMessage(String senderUsername, String plaintext, Instant timestamp) {

    // What recipients see: "alice: hi"
    public String render() {
        return ProtocolTokens.chatLine(senderUsername, plaintext);
    }
}
