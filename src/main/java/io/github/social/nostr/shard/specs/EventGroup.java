package io.github.social.nostr.shard.specs;

/**
 * Storage behaviour of an event, derived from its kind only.
 */
public enum EventGroup {
    /** Immutable append. */
    REGULAR,
    /** At most one kept per {@code (kind, pubkey)}. */
    REPLACEABLE,
    /** At most one kept per {@code (kind, pubkey, d-tag)}. */
    ADDRESSABLE,
    /** Broadcast only, never persisted. */
    EPHEMERAL,
    /** Stored as regular, then removes the referenced events of the same author. */
    DELETION;

    public static EventGroup byKind(final int kind) {
        if( kind == EventKind.DELETION ) return DELETION;

        if( kind == EventKind.METADATA || kind == EventKind.CONTACT_LIST ) return REPLACEABLE;

        if( 10000 <= kind && kind < 20000 ) return REPLACEABLE;

        if( 20000 <= kind && kind < 30000 ) return EPHEMERAL;

        if( 30000 <= kind && kind < 40000 ) return ADDRESSABLE;

        return REGULAR;
    }

}
