package org.relaychat.crypto;

import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeysTest {

    @Test
    void passphraseDerivesStableAes256Key() {
        SecretKey a = Keys.fromPassphrase("short");
        SecretKey b = Keys.fromPassphrase("short");

        assertThat(a.getAlgorithm()).isEqualTo("AES");
        assertThat(a.getEncoded()).hasSize(32).isEqualTo(b.getEncoded());
        assertThat(Keys.fromPassphrase("other").getEncoded()).isNotEqualTo(a.getEncoded());
    }

    @Test
    void emptyPassphraseIsRefused() {
        assertThatThrownBy(() -> Keys.fromPassphrase("")).isInstanceOf(IllegalArgumentException.class);
    }
}
