package io.github.social.nostr.shard.exceptions;

/**
 * Failure of the event storage backend.
 * <p>
 * Never closes the connection: writers answer with a failed {@code OK},
 * readers with a {@code CLOSED} frame for the affected subscription.
 */
public class EventRepositoryException extends RuntimeException {

    public EventRepositoryException(final String message) {
        super(message);
    }

    public EventRepositoryException(final String message, final Throwable cause) {
        super(message, cause);
    }

}
