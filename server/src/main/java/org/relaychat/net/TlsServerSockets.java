package org.relaychat.net;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ServerSocketFactory;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;

/**
 * Chooses between plain TCP and TLS listening sockets.
 * Certificates are provisioned outside the relay; it only loads an existing PKCS12 keystore.
 */
public final class TlsServerSockets {
    private static final Logger log = LoggerFactory.getLogger(TlsServerSockets.class);
    private static final String KEYSTORE_TYPE = "PKCS12";

    private TlsServerSockets() {}

    public static ServerSocketFactory plain() {
        return ServerSocketFactory.getDefault();
    }

    public static ServerSocketFactory fromKeystore(Path keystore, char[] password) throws IOException {
        try (InputStream in = Files.newInputStream(keystore)) {
            KeyStore ks = KeyStore.getInstance(KEYSTORE_TYPE);
            ks.load(in, password);

            KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
            kmf.init(ks, password);

            SSLContext context = SSLContext.getInstance("TLS");
            context.init(kmf.getKeyManagers(), null, null);
            log.info("TLS enabled with keystore {}", keystore.toAbsolutePath());
            return context.getServerSocketFactory();
        } catch (GeneralSecurityException e) {
            throw new IOException("Cannot load TLS keystore " + keystore, e);
        }
    }
}
