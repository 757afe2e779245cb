package io.github.social.nostr.shard.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import io.github.social.nostr.shard.def.ISubscriptionStore;
import io.github.social.nostr.shard.specs.ReqFilter;

public class MemorySubscriptionStore implements ISubscriptionStore {
    private final Map<String, Map<String, List<ReqFilter>>> subscriptions = new ConcurrentHashMap<>();

    private volatile boolean maintenance = false;

    public byte start() {
        return 0;
    }

    public void put(final String connectionId, final Map<String, List<ReqFilter>> subscriptionMap) {
        subscriptions.put(connectionId, new LinkedHashMap<>(subscriptionMap));
    }

    public void delete(final String connectionId) {
        subscriptions.remove(connectionId);
    }

    public Set<String> listConnectionIds(final int limit) {
        return subscriptions.keySet().stream().limit(limit).collect(Collectors.toSet());
    }

    /**
     * Stored subscriptions of a connection, or {@code null}.
     */
    public Map<String, List<ReqFilter>> get(final String connectionId) {
        return subscriptions.get(connectionId);
    }

    public void deleteAll() {
        subscriptions.clear();
    }

    public boolean isMaintenance() {
        return maintenance;
    }

    public void setMaintenance(final boolean maintenance) {
        this.maintenance = maintenance;
    }

    public byte close() {
        subscriptions.clear();
        return 0;
    }

}
