package io.github.social.nostr.shard.message;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.JsonArray;

import io.github.social.nostr.shard.exceptions.EventRepositoryException;
import io.github.social.nostr.shard.exceptions.UnsupportedFilterException;
import io.github.social.nostr.shard.server.WebsocketContext;
import io.github.social.nostr.shard.session.Connection;
import io.github.social.nostr.shard.specs.EventData;
import io.github.social.nostr.shard.specs.ReqFilter;
import io.github.social.nostr.shard.specs.RelayPolicy;
import io.github.social.nostr.shard.utilities.LogService;

/**
 * {@code ["REQ", <subscriptionId>, <filter>...]}: limits check, live
 * registration, then stored-event backfill terminated by {@code EOSE}.
 */
public class ReqMessageHandler implements MessageHandler {
    private final LogService logger = LogService.getInstance(getClass().getCanonicalName());

    private final RelayServices services;

    public ReqMessageHandler(final RelayServices services) {
        this.services = services;
    }

    public byte handle(final WebsocketContext context, final JsonArray message) {
        final String subscriptionId = SubscriptionFrames.subscriptionId(message);
        if( subscriptionId == null ) {
            return context.send(RelayResponse.notice("invalid: REQ frame requires a subscription id"));
        }

        final RelayPolicy policy = services.getPolicy();
        final Connection connection = context.getConnection();

        if( subscriptionId.length() > policy.getMaxSubidLength() ) {
            return context.send(RelayResponse.closed(subscriptionId, "unsupported: too long subscription id"));
        }

        if( message.size() - 2 > policy.getMaxFilters() ) {
            return context.send(RelayResponse.closed(subscriptionId, "unsupported: too many filters"));
        }

        final List<ReqFilter> filters = new ArrayList<>();
        try {
            for(int i = 2; i < message.size(); ++i) {
                filters.add(ReqFilter.of(message.get(i)));
            }
        } catch(UnsupportedFilterException failure) {
            logger.info("[Nostr] [Subscription] [{}] rejected: {}", subscriptionId, failure.getMessage());
            return context.send(RelayResponse.closed(subscriptionId, "unsupported: filters contain unsupported elements"));
        }

        if( !connection.hasSubscription(subscriptionId)
                && connection.countSubscriptions() >= policy.getMaxSubscriptions() ) {
            return context.send(RelayResponse.closed(subscriptionId, "unsupported: too many subscriptions"));
        }

        connection.putSubscription(subscriptionId, filters);
        SubscriptionFrames.persist(services, connection);
        logger.info("[Nostr] [Subscription] [{}] registered with {} filter(s).", subscriptionId, filters.size());

        final Map<String, EventData> stored = new LinkedHashMap<>();
        try {
            for(final ReqFilter filter: filters) {
                services.getRepository().find(filter).forEach(event -> stored.putIfAbsent(event.getId(), event));
            }
        } catch(EventRepositoryException failure) {
            logger.error("[Nostr] [Subscription] [{}] backfill failed: {}", subscriptionId, failure.getMessage());

            connection.removeSubscription(subscriptionId);
            SubscriptionFrames.persist(services, connection);
            return context.send(RelayResponse.closed(subscriptionId, "error: could not fetch stored events"));
        }

        final List<EventData> events = new ArrayList<>(stored.values());
        events.sort(EventData.NEWEST_FIRST);
        events.forEach(event -> context.send(RelayResponse.event(subscriptionId, event.toJson())));

        return context.send(RelayResponse.eose(subscriptionId));
    }

}
