package io.github.social.nostr.shard.service;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import io.github.social.nostr.shard.specs.EventData;
import io.github.social.nostr.shard.specs.EventMetadata;
import io.github.social.nostr.shard.specs.EventVersion;
import io.github.social.nostr.shard.specs.FilterMatcher;
import io.github.social.nostr.shard.specs.ReqFilter;
import io.github.social.nostr.shard.specs.RelayPolicy;
import io.github.social.nostr.shard.utilities.LogService;

/**
 * Process-local repository. Nothing survives a restart.
 */
public class MemoryEventRepository extends AbstractEventRepository {
    private final LogService logger = LogService.getInstance(getClass().getCanonicalName());

    private final Map<String, EventData> events = new ConcurrentHashMap<>();
    private final Map<String, EventMetadata> metadata = new ConcurrentHashMap<>();

    public MemoryEventRepository(final RelayPolicy policy) {
        super(policy);
    }

    boolean storeEvent(final EventData eventData, final EventMetadata eventMetadata) {
        if( events.putIfAbsent(eventData.getId(), eventData) != null ) {
            return false;
        }
        metadata.put(eventData.getId(), eventMetadata);

        logger.info("[Memory] event {} stored", eventData.getId());
        return true;
    }

    List<EventVersion> acquireVersions(final int kind, final String pubkey, final String identifier) {
        return events.values()
            .stream()
            .filter(event -> event.getKind() == kind)
            .filter(event -> event.getPubkey().equals(pubkey))
            .filter(event -> identifier == null || event.getTagValuesByName("d").contains(identifier))
            .map(EventVersion::of)
            .collect(Collectors.toList());
    }

    void removeStoredEvents(final Collection<String> ids) {
        ids.forEach(id -> {
            events.remove(id);
            metadata.remove(id);
        });
    }

    Collection<EventData> acquireEventsByIds(final Collection<String> ids) {
        return ids
            .stream()
            .distinct()
            .map(events::get)
            .filter(Objects::nonNull)
            .collect(Collectors.toList());
    }

    List<String> acquireIdsByQuery(final ReqFilter filter, final int limit) {
        return events.values()
            .stream()
            .filter(event -> FilterMatcher.matches(filter, event))
            .sorted(EventData.NEWEST_FIRST)
            .limit(limit)
            .map(EventData::getId)
            .collect(Collectors.toList());
    }

    /**
     * Relay-side facts of a stored event, or {@code null}.
     */
    public EventMetadata getMetadata(final String id) {
        return metadata.get(id);
    }

    public int count() {
        return events.size();
    }

    public byte close() {
        events.clear();
        metadata.clear();
        return 0;
    }

}
