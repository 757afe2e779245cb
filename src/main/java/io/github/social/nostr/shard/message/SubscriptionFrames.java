package io.github.social.nostr.shard.message;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;

import io.github.social.nostr.shard.exceptions.EventRepositoryException;
import io.github.social.nostr.shard.exceptions.UtilityInstantiationException;
import io.github.social.nostr.shard.session.Connection;
import io.github.social.nostr.shard.utilities.LogService;

final class SubscriptionFrames {
    private static final LogService logger = LogService.getInstance(SubscriptionFrames.class.getCanonicalName());

    private SubscriptionFrames() {
        throw new UtilityInstantiationException();
    }

    static String subscriptionId(final JsonArray message) {
        if( message.size() < 2 ) return null;

        final JsonElement element = message.get(1);
        if( !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString() ) return null;

        return element.getAsString();
    }

    /**
     * Mirrors the live subscription map into the subscription store.
     * The store is bookkeeping only, so a failure is logged and not surfaced.
     */
    static void persist(final RelayServices services, final Connection connection) {
        try {
            if( connection.countSubscriptions() == 0 ) {
                services.getSubscriptionStore().delete(connection.getId());
            } else {
                services.getSubscriptionStore().put(connection.getId(), connection.snapshotSubscriptions());
            }
        } catch(EventRepositoryException failure) {
            logger.warning("[Nostr] [Subscription] could not persist subscriptions of {}: {}",
                connection.getId(), failure.getMessage());
        }
    }

}
