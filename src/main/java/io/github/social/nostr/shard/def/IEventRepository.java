package io.github.social.nostr.shard.def;

import java.util.List;

import io.github.social.nostr.shard.specs.EventData;
import io.github.social.nostr.shard.specs.EventMetadata;
import io.github.social.nostr.shard.specs.ReqFilter;

/**
 * Storage port for events.
 * <p>
 * Every method may throw {@link io.github.social.nostr.shard.exceptions.EventRepositoryException}
 * when the backend fails.
 */
public interface IEventRepository {

    byte start();

    /**
     * Immutable append.
     *
     * @return {@code false} when the event was already stored
     */
    boolean save(EventData eventData, EventMetadata metadata);

    /**
     * Keeps at most one event per {@code (kind, pubkey)}.
     *
     * @return {@code false} when the event lost against the stored latest revision
     */
    boolean saveReplaceable(EventData eventData, EventMetadata metadata);

    /**
     * Keeps at most one event per {@code (kind, pubkey, d-tag)}.
     *
     * @return {@code false} when the event lost against the stored latest revision
     */
    boolean saveAddressable(EventData eventData, EventMetadata metadata);

    /**
     * Removes the events referenced by {@code e} tags of a deletion request,
     * restricted to the requester's own non-deletion events.
     *
     * @return number of removed events
     */
    int deleteByReference(EventData deletion);

    /**
     * Stored events matching the filter, newest first, limited.
     */
    List<EventData> find(ReqFilter filter);

    byte close();

}
