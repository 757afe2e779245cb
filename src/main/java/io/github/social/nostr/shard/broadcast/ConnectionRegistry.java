package io.github.social.nostr.shard.broadcast;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.github.social.nostr.shard.server.WebsocketContext;

/**
 * Currently live connections, keyed by connection id.
 */
public class ConnectionRegistry {
    private final Map<String, WebsocketContext> live = new ConcurrentHashMap<>();

    public void register(final WebsocketContext context) {
        live.put(context.getConnection().getId(), context);
    }

    public void unregister(final WebsocketContext context) {
        live.remove(context.getConnection().getId());
    }

    public boolean isLive(final String connectionId) {
        return live.containsKey(connectionId);
    }

    /**
     * Point-in-time copy; connections may come and go while it is iterated.
     */
    public Collection<WebsocketContext> snapshot() {
        return new ArrayList<>(live.values());
    }

    public int count() {
        return live.size();
    }

}
