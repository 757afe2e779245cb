package io.github.social.nostr.shard.server;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;

import io.github.social.nostr.shard.auth.RelayUrl;
import io.github.social.nostr.shard.def.ISubscriptionStore;
import io.github.social.nostr.shard.exceptions.EventRepositoryException;
import io.github.social.nostr.shard.message.AuthChallenger;
import io.github.social.nostr.shard.message.AuthMessageHandler;
import io.github.social.nostr.shard.message.CloseMessageHandler;
import io.github.social.nostr.shard.message.EventMessageHandler;
import io.github.social.nostr.shard.message.MessageHandler;
import io.github.social.nostr.shard.message.RelayResponse;
import io.github.social.nostr.shard.message.RelayServices;
import io.github.social.nostr.shard.message.ReqMessageHandler;
import io.github.social.nostr.shard.session.Connection;
import io.github.social.nostr.shard.specs.ReqFilter;
import io.github.social.nostr.shard.utilities.LogService;
import io.github.social.nostr.shard.websocket.TextMessage;

/**
 * Relay controller: session lifecycle, frame dispatch, maintenance and pruning.
 */
public class NostrService {
    private final LogService logger = LogService.getInstance(getClass().getCanonicalName());

    static final String MAINTENANCE_CLOSED = "error: closed due to maintenance";
    static final String MAINTENANCE_NOTICE = "disconnected due to maintenance";

    private final RelayServices services;
    private final AuthChallenger challenger;

    private final Map<String, MessageHandler> handlers = new HashMap<>();

    private final Gson gson = new GsonBuilder().create();

    private final int pruneIntervalSecond;
    private final int pruneBatchSize;

    private ScheduledExecutorService pruneService;

    public NostrService(final RelayServices services, final int pruneIntervalSecond, final int pruneBatchSize) {
        this.services = services;
        this.pruneIntervalSecond = pruneIntervalSecond;
        this.pruneBatchSize = pruneBatchSize;
        this.challenger = new AuthChallenger(services);

        this.handlers.put("EVENT", new EventMessageHandler(services, challenger));
        this.handlers.put("REQ", new ReqMessageHandler(services));
        this.handlers.put("CLOSE", new CloseMessageHandler(services));
        this.handlers.put("AUTH", new AuthMessageHandler(services));
    }

    public RelayServices getServices() {
        return services;
    }

    byte open() {
        services.getRepository().start();
        services.getRegistration().start();
        services.getSubscriptionStore().start();

        if( pruneIntervalSecond > 0 ) {
            this.pruneService = Executors.newSingleThreadScheduledExecutor();
            this.pruneService.scheduleAtFixedRate(
                this::scheduledPrune,
                pruneIntervalSecond,
                pruneIntervalSecond,
                TimeUnit.SECONDS);
        }

        return logger.info("[Nostr] relay services started.");
    }

    byte close() {
        if( pruneService != null ) {
            pruneService.shutdownNow();
        }

        services.getSubscriptionStore().close();
        services.getRegistration().close();
        services.getRepository().close();

        return logger.info("[Nostr] relay services stopped.");
    }

    byte openSession(final WebsocketContext context) {
        logger.info("[Nostr] [Context] {} startup session.", context.getContextID());

        final Connection connection = new Connection(
            context.getContextID().toString(),
            context.getRemoteAddress(),
            RelayUrl.normalize(context.getUrl()));

        context.attach(connection);

        services.getConnections().register(context);

        if( services.getPolicy().isAuthRequired() ) {
            return challenger.issue(context);
        }

        return 0;
    }

    byte closeSession(final WebsocketContext context) {
        logger.info("[Nostr] [Context] {} cleanup session.", context.getContextID());

        final Connection connection = context.getConnection();
        if( connection == null ) return 0;

        services.getConnections().unregister(context);
        connection.clearSubscriptions();

        try {
            services.getSubscriptionStore().delete(connection.getId());
        } catch(EventRepositoryException failure) {
            logger.warning("[Nostr] [Context] could not drop stored subscriptions of {}: {}",
                connection.getId(), failure.getMessage());
        }

        return 0;
    }

    byte consume(final WebsocketContext context, final TextMessage message) {
        if(!context.isConnected()) return 0;

        final String jsonData = message.getMessage().trim();

        if( ! jsonData.startsWith("[") || ! jsonData.endsWith("]") ) {
            logger.warning("[Nostr] [Context] {} sent a non-array payload (User-Agent: {}).",
                context.getContextID(), context.getUserAgent());

            return this.notifyClient(context, "error: Not a json array payload.");
        }

        final JsonArray nostrMessage;
        try {
            nostrMessage = gson.fromJson(jsonData, JsonArray.class);
        } catch(JsonParseException failure) {
            logger.warning("[Nostr] could not parse message: {}", jsonData);

            return this.notifyClient(context, "error: could not parse data: " + failure.getMessage());
        }

        if( nostrMessage == null || nostrMessage.isEmpty() ) {
            logger.warning("[Nostr] Empty message received.");

            return this.notifyClient(context, "error: empty message.");
        }

        final JsonElement typeEL = nostrMessage.get(0);
        if( !typeEL.isJsonPrimitive() || !typeEL.getAsJsonPrimitive().isString() ) {
            return this.notifyClient(context, "error: message type must be a string.");
        }

        final String messageType = typeEL.getAsString();
        final MessageHandler handler = handlers.get(messageType);
        if( handler == null ) {
            return this.notifyClient(context, "unsupported: message type '" + messageType + "' not supported");
        }

        try {
            return handler.handle(context, nostrMessage);
        } catch(RuntimeException failure) {
            logger.error(
                "[Nostr] [Message] {} handling failed.\n> Class: {}\n> Message: {}",
                messageType,
                failure.getClass().getCanonicalName(),
                failure.getMessage());

            return this.notifyClient(context, "error: could not process " + messageType + " message");
        }
    }

    private byte notifyClient(final WebsocketContext context, final String message) {
        return context.send(RelayResponse.notice(message));
    }

    public boolean isMaintenance() {
        try {
            return services.getSubscriptionStore().isMaintenance();
        } catch(EventRepositoryException failure) {
            logger.warning("[Nostr] [Maintenance] flag unavailable: {}", failure.getMessage());
            return false;
        }
    }

    /**
     * Drops every stored subscription, raises the maintenance flag and
     * disconnects all live clients.
     *
     * @return number of connections asked to close
     */
    public int enableMaintenance() {
        final ISubscriptionStore store = services.getSubscriptionStore();
        store.deleteAll();
        store.setMaintenance(true);

        int closed = 0;
        for(final WebsocketContext context: services.getConnections().snapshot()) {
            final Connection connection = context.getConnection();
            for(final String subscriptionId: connection.snapshotSubscriptions().keySet()) {
                context.send(RelayResponse.closed(subscriptionId, MAINTENANCE_CLOSED));
            }
            connection.clearSubscriptions();

            this.notifyClient(context, MAINTENANCE_NOTICE);
            context.requestClose();
            ++closed;
        }

        logger.info("[Nostr] [Maintenance] enabled; {} connection(s) closed.", closed);

        return closed;
    }

    public void disableMaintenance() {
        services.getSubscriptionStore().setMaintenance(false);

        logger.info("[Nostr] [Maintenance] disabled.");
    }

    /**
     * Removes stored subscriptions of connections that are no longer live.
     *
     * @return number of connection entries removed
     */
    public int prune() {
        final ISubscriptionStore store = services.getSubscriptionStore();
        final Set<String> connectionIds = store.listConnectionIds(pruneBatchSize);

        int removed = 0;
        for(final String connectionId: connectionIds) {
            if( services.getConnections().isLive(connectionId) ) continue;

            store.delete(connectionId);
            ++removed;
        }

        logger.info("[Nostr] [Prune] {} of {} stored connection(s) removed.", removed, connectionIds.size());

        return removed;
    }

    private void scheduledPrune() {
        try {
            this.prune();
        } catch(EventRepositoryException failure) {
            logger.warning("[Nostr] [Prune] failed: {}", failure.getMessage());
        }
    }

    public RelayMetrics metrics() {
        int connections = 0;
        int subscriptions = 0;
        int filters = 0;

        for(final WebsocketContext context: services.getConnections().snapshot()) {
            final Connection connection = context.getConnection();
            ++connections;

            final Map<String, List<ReqFilter>> live = connection == null
                ? Collections.emptyMap()
                : connection.snapshotSubscriptions();

            subscriptions += live.size();
            for(final List<ReqFilter> list: live.values()) {
                filters += list.size();
            }
        }

        return new RelayMetrics(connections, subscriptions, filters);
    }

}
