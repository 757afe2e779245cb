package io.github.social.nostr.shard.message;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import io.github.social.nostr.shard.def.IEventRepository;
import io.github.social.nostr.shard.exceptions.EventRepositoryException;
import io.github.social.nostr.shard.server.WebsocketContext;
import io.github.social.nostr.shard.session.Connection;
import io.github.social.nostr.shard.specs.EventData;
import io.github.social.nostr.shard.specs.EventMetadata;
import io.github.social.nostr.shard.specs.EventOutcome;
import io.github.social.nostr.shard.specs.RelayPolicy;
import io.github.social.nostr.shard.utilities.LogService;

/**
 * {@code ["EVENT", <event>]}: validation, authentication gate, kind dispatch,
 * acknowledgement and live broadcast.
 */
public class EventMessageHandler implements MessageHandler {
    private final LogService logger = LogService.getInstance(getClass().getCanonicalName());

    static final String DUPLICATE = "duplicate: already have this event";

    private final RelayServices services;
    private final AuthChallenger challenger;

    public EventMessageHandler(final RelayServices services, final AuthChallenger challenger) {
        this.services = services;
        this.challenger = challenger;
    }

    public byte handle(final WebsocketContext context, final JsonArray message) {
        final JsonElement eventElement = message.size() > 1 ? message.get(1) : null;
        if( eventElement == null || !eventElement.isJsonObject() ) {
            return context.send(RelayResponse.notice("invalid: EVENT frame requires an event object"));
        }

        final EventData eventData;
        try {
            eventData = EventData.of(eventElement.getAsJsonObject());
        } catch(JsonParseException failure) {
            logger.info("[Nostr] [Message] could not parse event: {}", failure.getMessage());

            final String id = idOf(eventElement.getAsJsonObject());
            if( id == null ) {
                return context.send(RelayResponse.notice("invalid: " + failure.getMessage()));
            }
            return context.send(RelayResponse.ok(id, false, "invalid: " + failure.getMessage()));
        }

        final EventOutcome outcome = this.ingest(context, eventData);
        logger.info("[Nostr] [Message] event {} kind {}: {}", eventData.getId(), eventData.getKind(), outcome);

        context.send(RelayResponse.ok(eventData.getId(), outcome.isAccepted(), outcome.getMessage()));

        if( outcome.isBroadcast() ) {
            services.getBroadcaster().publish(eventData);
        }

        return 0;
    }

    EventOutcome ingest(final WebsocketContext context, final EventData eventData) {
        final RelayPolicy policy = services.getPolicy();
        final Connection connection = context.getConnection();

        if( !services.getValidator().validate(eventData) ) {
            return EventOutcome.rejected("invalid: event id or signature does not verify");
        }

        final long nowSecond = services.now() / 1000L;
        if( eventData.getCreatedAt() > nowSecond + policy.getCreatedAtToleranceSecond() ) {
            return EventOutcome.rejected(
                "invalid: the event 'created_at' field is out of the acceptable range (, +"
                + policy.getCreatedAtToleranceSecond() + "s) for this relay");
        }

        if( !connection.isAuthenticated(eventData.getPubkey()) ) {
            if( eventData.isProtected() ) {
                challenger.issue(context);
                return EventOutcome.rejected("auth-required: this event may only be published by its author");
            }
            if( policy.isAuthRequired() || policy.isRestrictedWrites() ) {
                challenger.issue(context);
                return EventOutcome.rejected("auth-required: we only accept events from registered users");
            }
        }

        final EventMetadata metadata = new EventMetadata(connection.getIpAddress(), services.now());
        final IEventRepository repository = services.getRepository();

        try {
            switch(eventData.getGroup()) {
                case REGULAR:
                    return repository.save(eventData, metadata)
                        ? EventOutcome.accepted()
                        : EventOutcome.unchanged(DUPLICATE);
                case REPLACEABLE:
                    return repository.saveReplaceable(eventData, metadata)
                        ? EventOutcome.accepted()
                        : EventOutcome.unchanged("");
                case ADDRESSABLE:
                    if( !eventData.getIdentifier().isPresent() ) {
                        return EventOutcome.rejected("invalid: addressable event requires d tag");
                    }
                    return repository.saveAddressable(eventData, metadata)
                        ? EventOutcome.accepted()
                        : EventOutcome.unchanged("");
                case EPHEMERAL:
                    return EventOutcome.accepted();
                case DELETION:
                    if( !repository.save(eventData, metadata) ) {
                        return EventOutcome.unchanged(DUPLICATE);
                    }
                    repository.deleteByReference(eventData);
                    return EventOutcome.accepted();
                default:
                    return EventOutcome.rejected("invalid: event kind unknown");
            }
        } catch(EventRepositoryException failure) {
            logger.error("[Nostr] [Message] storage failure for event {}: {}", eventData.getId(), failure.getMessage());
            return EventOutcome.rejected("error: " + failure.getMessage());
        }
    }

    static String idOf(final JsonObject event) {
        final JsonElement id = event.get("id");
        if( id == null || !id.isJsonPrimitive() || !id.getAsJsonPrimitive().isString() ) return null;

        return id.getAsString();
    }

}
