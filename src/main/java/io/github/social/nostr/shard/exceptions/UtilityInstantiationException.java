package io.github.social.nostr.shard.exceptions;

public class UtilityInstantiationException extends UnsupportedOperationException {

    public UtilityInstantiationException() {
        super("Utility class cannot be instantiated");
    }

}
