package io.github.social.nostr.shard.message;

import com.google.gson.JsonArray;

import io.github.social.nostr.shard.server.WebsocketContext;

/**
 * Handles one inbound frame type. The first element of {@code message} is the frame type.
 */
public interface MessageHandler {

    byte handle(WebsocketContext context, JsonArray message);

}
