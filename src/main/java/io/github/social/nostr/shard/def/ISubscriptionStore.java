package io.github.social.nostr.shard.def;

import java.util.List;
import java.util.Map;
import java.util.Set;

import io.github.social.nostr.shard.specs.ReqFilter;

/**
 * Transient per-connection subscription bookkeeping and the maintenance flag.
 * <p>
 * Live matching never reads from here; the connection record holds the live copy.
 */
public interface ISubscriptionStore {

    byte start();

    void put(String connectionId, Map<String, List<ReqFilter>> subscriptions);

    void delete(String connectionId);

    /**
     * At most {@code limit} connection ids that have stored subscriptions.
     */
    Set<String> listConnectionIds(int limit);

    void deleteAll();

    boolean isMaintenance();

    void setMaintenance(boolean maintenance);

    byte close();

}
