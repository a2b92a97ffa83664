package org.relaychat.auth;

import org.relaychat.protocol.ProtocolTokens;

import java.util.Optional;

public enum AuthChoice {
    LOGIN,
    REGISTER;

    static Optional<AuthChoice> parse(String input) {
        if (ProtocolTokens.isChoice(input, ProtocolTokens.LOGIN)) {
            return Optional.of(LOGIN);
        }
        if (ProtocolTokens.isChoice(input, ProtocolTokens.REGISTER)) {
            return Optional.of(REGISTER);
        }
        return Optional.empty();
    }
}
