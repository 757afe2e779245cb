package io.github.social.nostr.shard.exceptions;

/**
 * A subscription filter carries keys or values the relay cannot serve.
 */
public class UnsupportedFilterException extends Exception {

    public UnsupportedFilterException(final String message) {
        super(message);
    }

}
