package io.github.social.nostr.shard.session;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import io.github.social.nostr.shard.auth.AuthSession;
import io.github.social.nostr.shard.specs.ReqFilter;

/**
 * Session record of one client connection.
 * <p>
 * Mutated only by the handling context of its own connection; the broadcaster
 * reads the subscription map concurrently, hence the concurrent collections.
 */
public final class Connection {
    private final String id;
    private final String ipAddress;
    private final String url;

    private volatile AuthSession auth;

    private final Set<String> pubkeys = ConcurrentHashMap.newKeySet();

    private final Map<String, List<ReqFilter>> subscriptions = new ConcurrentHashMap<>();

    public Connection(final String id, final String ipAddress, final String url) {
        this.id = id;
        this.ipAddress = ipAddress;
        this.url = url;
    }

    public String getId() {
        return id;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    /**
     * Canonical URL the client connected to; AUTH events must echo it.
     */
    public String getUrl() {
        return url;
    }

    public AuthSession getAuth() {
        return auth;
    }

    public void setAuth(final AuthSession auth) {
        this.auth = auth;
    }

    public boolean isAuthenticated(final String pubkey) {
        return pubkeys.contains(pubkey);
    }

    public Set<String> getPubkeys() {
        return Collections.unmodifiableSet(pubkeys);
    }

    /**
     * Authorized pubkeys are never revoked during the connection's lifetime.
     */
    public boolean authorize(final String pubkey) {
        return pubkeys.add(pubkey);
    }

    public Map<String, List<ReqFilter>> getSubscriptions() {
        return Collections.unmodifiableMap(subscriptions);
    }

    /**
     * Ordered copy, suitable for persistence.
     */
    public Map<String, List<ReqFilter>> snapshotSubscriptions() {
        return new LinkedHashMap<>(subscriptions);
    }

    public boolean hasSubscription(final String subscriptionId) {
        return subscriptions.containsKey(subscriptionId);
    }

    public int countSubscriptions() {
        return subscriptions.size();
    }

    public void putSubscription(final String subscriptionId, final List<ReqFilter> filters) {
        subscriptions.put(subscriptionId, Collections.unmodifiableList(filters));
    }

    public boolean removeSubscription(final String subscriptionId) {
        return subscriptions.remove(subscriptionId) != null;
    }

    public void clearSubscriptions() {
        subscriptions.clear();
    }

}
