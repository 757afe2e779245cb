package io.github.social.nostr.shard.broadcast;

import java.util.List;
import java.util.Map;

import com.google.gson.JsonObject;

import io.github.social.nostr.shard.message.RelayResponse;
import io.github.social.nostr.shard.server.WebsocketContext;
import io.github.social.nostr.shard.session.Connection;
import io.github.social.nostr.shard.specs.EventData;
import io.github.social.nostr.shard.specs.FilterMatcher;
import io.github.social.nostr.shard.specs.ReqFilter;
import io.github.social.nostr.shard.utilities.LogService;

/**
 * Pushes a newly accepted event to every live subscription it matches.
 * <p>
 * Reads only in-memory subscription maps. Delivery to one connection never
 * blocks or fails delivery to the others.
 */
public class Broadcaster {
    private final LogService logger = LogService.getInstance(getClass().getCanonicalName());

    private final ConnectionRegistry registry;

    public Broadcaster(final ConnectionRegistry registry) {
        this.registry = registry;
    }

    /**
     * @return number of delivered frames
     */
    public int publish(final EventData eventData) {
        final JsonObject eventJson = eventData.toJson();

        int delivered = 0;
        for(final WebsocketContext context: registry.snapshot()) {
            if( !context.isConnected() ) continue;

            final Connection connection = context.getConnection();
            for(final Map.Entry<String, List<ReqFilter>> subscription: connection.getSubscriptions().entrySet()) {
                if( !FilterMatcher.matchesAny(subscription.getValue(), eventData) ) continue;

                try {
                    context.send(RelayResponse.event(subscription.getKey(), eventJson));
                    ++delivered;
                } catch(RuntimeException failure) {
                    logger.warning(
                        "[Nostr] [Broadcast] could not deliver {} to {}: {}",
                        eventData.getId(), connection.getId(), failure.getMessage());
                }
            }
        }

        if( delivered > 0 ) {
            logger.info("[Nostr] [Broadcast] event {} delivered {} time(s)", eventData.getId(), delivered);
        }

        return delivered;
    }

}
