package io.github.social.nostr.shard.exceptions;

import java.io.IOException;

/**
 * Raised from the socket loop when the connection must be terminated.
 */
public class CloseConnectionException extends IOException {

    public CloseConnectionException() {
        super();
    }

    public CloseConnectionException(final String message) {
        super(message);
    }

}
