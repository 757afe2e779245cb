package io.github.social.nostr.shard.server;

import com.google.gson.JsonObject;

/**
 * Point-in-time counters of live sessions.
 */
public final class RelayMetrics {
    private final int connections;
    private final int subscriptions;
    private final int filters;

    public RelayMetrics(final int connections, final int subscriptions, final int filters) {
        this.connections = connections;
        this.subscriptions = subscriptions;
        this.filters = filters;
    }

    public int getConnections() {
        return connections;
    }

    public int getSubscriptions() {
        return subscriptions;
    }

    public int getFilters() {
        return filters;
    }

    public JsonObject toJson() {
        final JsonObject json = new JsonObject();
        json.addProperty("connections", connections);
        json.addProperty("subscriptions", subscriptions);
        json.addProperty("filters", filters);

        return json;
    }

}
