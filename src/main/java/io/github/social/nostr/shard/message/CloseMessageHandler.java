package io.github.social.nostr.shard.message;

import com.google.gson.JsonArray;

import io.github.social.nostr.shard.server.WebsocketContext;
import io.github.social.nostr.shard.session.Connection;
import io.github.social.nostr.shard.utilities.LogService;

/**
 * {@code ["CLOSE", <subscriptionId>]}. Closing an unknown subscription is a no-op.
 */
public class CloseMessageHandler implements MessageHandler {
    private final LogService logger = LogService.getInstance(getClass().getCanonicalName());

    private final RelayServices services;

    public CloseMessageHandler(final RelayServices services) {
        this.services = services;
    }

    public byte handle(final WebsocketContext context, final JsonArray message) {
        final String subscriptionId = SubscriptionFrames.subscriptionId(message);
        if( subscriptionId == null ) {
            return context.send(RelayResponse.notice("invalid: CLOSE frame requires a subscription id"));
        }

        final Connection connection = context.getConnection();
        if( connection.removeSubscription(subscriptionId) ) {
            SubscriptionFrames.persist(services, connection);
            logger.info("[Nostr] [Subscription] [{}] unregistered.", subscriptionId);
        }

        return 0;
    }

}
