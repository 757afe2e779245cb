package io.github.social.nostr.shard.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import io.github.social.nostr.shard.def.IEventRepository;
import io.github.social.nostr.shard.specs.EventData;
import io.github.social.nostr.shard.specs.EventGroup;
import io.github.social.nostr.shard.specs.EventMetadata;
import io.github.social.nostr.shard.specs.EventVersion;
import io.github.social.nostr.shard.specs.ReqFilter;
import io.github.social.nostr.shard.specs.RelayPolicy;
import io.github.social.nostr.shard.utilities.LogService;
import io.github.social.nostr.shard.utilities.Utils;

/**
 * Storage rules shared by every backend: latest-wins replacement, deletion
 * requests and query planning. Backends only provide the primitive hooks.
 */
public abstract class AbstractEventRepository implements IEventRepository {
    private final LogService logger = LogService.getInstance(getClass().getCanonicalName());

    protected final RelayPolicy policy;

    protected AbstractEventRepository(final RelayPolicy policy) {
        this.policy = policy;
    }

    public byte start() {
        return 0;
    }

    public final boolean save(final EventData eventData, final EventMetadata metadata) {
        return this.storeEvent(eventData, metadata);
    }

    public final boolean saveReplaceable(final EventData eventData, final EventMetadata metadata) {
        final List<EventVersion> versions = this.acquireVersions(eventData.getKind(), eventData.getPubkey(), null);

        return this.saveLatest(eventData, metadata, versions);
    }

    public final boolean saveAddressable(final EventData eventData, final EventMetadata metadata) {
        final String identifier = eventData.getIdentifier().orElse("");
        final List<EventVersion> versions = this.acquireVersions(eventData.getKind(), eventData.getPubkey(), identifier);

        return this.saveLatest(eventData, metadata, versions);
    }

    /*
     * Read-then-write: two writers of the same object may both read the same
     * previous versions and both store. Any leftover loser is removed by the
     * next write of that object, since every stored version is deleted then.
     */
    private boolean saveLatest(
            final EventData eventData,
            final EventMetadata metadata,
            final List<EventVersion> versions
    ) {
        if( versions.isEmpty() ) {
            return this.storeEvent(eventData, metadata);
        }

        final EventVersion latest = versions.stream().min(EventVersion.LATEST_FIRST).get();
        if( !EventVersion.of(eventData).supersedes(latest) ) {
            logger.info("[Storage] event {} does not supersede {}", eventData.getId(), latest);
            return false;
        }

        final boolean stored = this.storeEvent(eventData, metadata);

        final Set<String> previous = versions
            .stream()
            .map(EventVersion::getId)
            .filter(id -> !id.equals(eventData.getId()))
            .collect(Collectors.toCollection(LinkedHashSet::new));
        this.removeStoredEvents(previous);

        logger.info("[Storage] event {} replaced {} previous version(s)", eventData.getId(), previous.size());

        return stored;
    }

    public final int deleteByReference(final EventData deletion) {
        final Set<String> targetIds = deletion.getTagValuesByName("e")
            .stream()
            .filter(Utils::isHex64)
            .collect(Collectors.toCollection(LinkedHashSet::new));

        if( targetIds.isEmpty() ) return 0;

        final Set<String> removable = this.acquireEventsByIds(targetIds)
            .stream()
            .filter(target -> target.getPubkey().equals(deletion.getPubkey()))
            .filter(target -> target.getGroup() != EventGroup.DELETION)
            .map(EventData::getId)
            .collect(Collectors.toCollection(LinkedHashSet::new));

        if( removable.isEmpty() ) return 0;

        this.removeStoredEvents(removable);

        logger.info("[Storage] deletion {} removed {} event(s)", deletion.getId(), removable.size());

        return removable.size();
    }

    public final List<EventData> find(final ReqFilter filter) {
        if( hasEmptyCondition(filter) ) return new ArrayList<>();

        final List<EventData> events;
        if( filter.isIdsOnly() && filter.getIds().get().size() <= policy.getMaxLimit() ) {
            events = new ArrayList<>(this.acquireEventsByIds(filter.getIds().get()));
            events.sort(EventData.NEWEST_FIRST);

            final int limit = filter.getLimit().orElse(events.size());
            return limit < events.size() ? new ArrayList<>(events.subList(0, limit)) : events;
        }

        final List<String> ids = this.acquireIdsByQuery(filter, policy.effectiveLimit(filter));
        if( ids.isEmpty() ) return new ArrayList<>();

        events = new ArrayList<>(this.acquireEventsByIds(ids));
        events.sort(EventData.NEWEST_FIRST);

        return events;
    }

    /**
     * An explicitly empty set can never match anything.
     */
    static boolean hasEmptyCondition(final ReqFilter filter) {
        return filter.getIds().map(Set::isEmpty).orElse(false)
            || filter.getAuthors().map(Set::isEmpty).orElse(false)
            || filter.getKinds().map(Set::isEmpty).orElse(false)
            || filter.getTags().values().stream().anyMatch(Set::isEmpty)
            || filter.getLimit().map(limit -> limit == 0).orElse(false);
    }

    /**
     * Stores body and index entries of the event.
     *
     * @return {@code false} when an event with the same id was already stored
     */
    abstract boolean storeEvent(EventData eventData, EventMetadata metadata);

    /**
     * Every stored version of {@code (kind, pubkey)}, narrowed to the given
     * {@code d} tag value unless {@code identifier} is {@code null}.
     */
    abstract List<EventVersion> acquireVersions(int kind, String pubkey, String identifier);

    abstract void removeStoredEvents(Collection<String> ids);

    /**
     * Bodies of the stored events among {@code ids}; unknown ids are skipped.
     */
    abstract Collection<EventData> acquireEventsByIds(Collection<String> ids);

    /**
     * Ids of the stored events matching the filter, newest first, at most {@code limit}.
     */
    abstract List<String> acquireIdsByQuery(ReqFilter filter, int limit);

}
