package io.github.social.nostr.shard.message;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;

import io.github.social.nostr.shard.server.WebsocketContext;
import io.github.social.nostr.shard.session.Connection;
import io.github.social.nostr.shard.specs.EventData;
import io.github.social.nostr.shard.specs.RelayPolicy;
import io.github.social.nostr.shard.utilities.LogService;

/**
 * {@code ["AUTH", <kind 22242 event>]}: proves control of a pubkey for this connection.
 * Authorized pubkeys stay authorized until the connection closes.
 */
public class AuthMessageHandler implements MessageHandler {
    private final LogService logger = LogService.getInstance(getClass().getCanonicalName());

    private final RelayServices services;

    public AuthMessageHandler(final RelayServices services) {
        this.services = services;
    }

    public byte handle(final WebsocketContext context, final JsonArray message) {
        final JsonElement eventElement = message.size() > 1 ? message.get(1) : null;
        if( eventElement == null || !eventElement.isJsonObject() ) {
            return context.send(RelayResponse.notice("invalid: AUTH frame requires an event object"));
        }

        final EventData eventData;
        try {
            eventData = EventData.of(eventElement.getAsJsonObject());
        } catch(JsonParseException failure) {
            final String id = EventMessageHandler.idOf(eventElement.getAsJsonObject());
            if( id == null ) {
                return context.send(RelayResponse.notice("invalid: " + failure.getMessage()));
            }
            return context.send(RelayResponse.ok(id, false, "invalid: " + failure.getMessage()));
        }

        final RelayPolicy policy = services.getPolicy();
        final Connection connection = context.getConnection();

        if( connection.isAuthenticated(eventData.getPubkey()) ) {
            return context.send(RelayResponse.ok(eventData.getId(), true, "duplicate: already authenticated"));
        }

        if( connection.getPubkeys().size() >= policy.getAuthLimit() ) {
            logger.warning("[Nostr] [Auth] connection {} reached the authentication limit", connection.getId());
            return context.send(RelayResponse.notice("too many authentications (> " + policy.getAuthLimit() + ")"));
        }

        if( !services.getValidator().validate(eventData) ) {
            return context.send(RelayResponse.ok(eventData.getId(), false, "invalid: auth event signature does not verify"));
        }

        final String failure = services.getChallengeVerifier()
            .verify(eventData, connection.getAuth(), connection.getUrl(), services.now());
        if( failure != null ) {
            logger.info("[Nostr] [Auth] {} rejected: {}", eventData.getPubkey(), failure);
            return context.send(RelayResponse.ok(eventData.getId(), false, failure));
        }

        if( (policy.isAuthRequired() || policy.isRestrictedWrites())
                && !services.getRegistration().isRegistered(eventData.getPubkey()) ) {
            return context.send(RelayResponse.ok(eventData.getId(), false, "restricted: required to register"));
        }

        connection.authorize(eventData.getPubkey());
        logger.info("[Nostr] [Auth] {} authenticated on {}", eventData.getPubkey(), connection.getId());

        return context.send(RelayResponse.ok(eventData.getId(), true, ""));
    }

}
