package io.github.social.nostr.shard.security;

import java.io.IOException;
import java.security.KeyManagementException;
import java.security.KeyStore;
import java.security.KeyStoreException;
import java.security.NoSuchAlgorithmException;
import java.security.UnrecoverableKeyException;
import javax.net.ServerSocketFactory;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;

import io.github.social.nostr.shard.exceptions.UtilityInstantiationException;
import io.github.social.nostr.shard.utilities.AppProperties;
import io.github.social.nostr.shard.utilities.LogService;

/**
 * Plain or TLS server sockets for the relay listener.
 */
public class ServerSocketFactoryBuilder {
    private static final LogService logger = LogService.getInstance(ServerSocketFactoryBuilder.class.getCanonicalName());

    private ServerSocketFactoryBuilder() {
        throw new UtilityInstantiationException();
    }

    public static ServerSocketFactory newFactory(final boolean tlsRequired) throws IOException {
        if (!tlsRequired) {
            return ServerSocketFactory.getDefault();
        }

        final char[] passphrase = AppProperties.getKeystoreSecret().toCharArray();

        try {
            final SSLContext ctx = SSLContext.getInstance("TLS");
            final KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
            final KeyStore ks = KeystoreFactory.load(AppProperties.getKeystorePath(), passphrase);

            kmf.init(ks, passphrase);
            ctx.init(kmf.getKeyManagers(), null, null);

            logger.info("[Server] TLS Server Socket Factory initialized.");
            return ctx.getServerSocketFactory();
        } catch (NoSuchAlgorithmException
                | KeyStoreException
                | UnrecoverableKeyException
                | KeyManagementException failure) {
            throw new IOException(failure);
        }

    }

}
