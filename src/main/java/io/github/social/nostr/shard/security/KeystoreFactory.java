package io.github.social.nostr.shard.security;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.KeyStore;
import java.security.KeyStoreException;
import java.security.NoSuchAlgorithmException;
import java.security.cert.CertificateException;

import io.github.social.nostr.shard.exceptions.UtilityInstantiationException;
import io.github.social.nostr.shard.utilities.LogService;

/**
 * Loads the TLS keystore from a file, or from the {@code /keystore} classpath resource.
 */
public class KeystoreFactory {
    private static final LogService logger = LogService.getInstance(KeystoreFactory.class.getCanonicalName());

    private KeystoreFactory() {
        throw new UtilityInstantiationException();
    }

    public static KeyStore load(final String path, final char[] passphrase) throws IOException {
        final KeyStore ks;
        try(final InputStream infile = open(path)) {
            if( infile == null ) {
                throw new IOException("keystore not found");
            }
            ks = KeyStore.getInstance(KeyStore.getDefaultType());
            ks.load(infile, passphrase);
        } catch(KeyStoreException | NoSuchAlgorithmException | CertificateException failure) {
            throw new IOException(failure);
        }

        logger.info("[Server] Keystore initialized.");
        return ks;
    }

    private static InputStream open(final String path) throws IOException {
        if( path == null ) {
            return KeystoreFactory.class.getResourceAsStream("/keystore");
        }
        return new FileInputStream(path);
    }

}
