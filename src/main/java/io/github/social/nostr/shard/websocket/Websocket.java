package io.github.social.nostr.shard.websocket;

import io.github.social.nostr.shard.server.WebsocketContext;

/**
 * Websocket lifecycle callbacks, driven by the client handler.
 */
public interface Websocket {
    byte onServerStartup();
    byte onServerShutdown();

    /**
     * Whether new upgrades must be refused (maintenance).
     */
    boolean isRefusingConnections();

    byte onOpen(final WebsocketContext context);
    byte onClose(final WebsocketContext context);
    byte onMessage(final WebsocketContext context, TextMessage message);
    byte onMessage(final WebsocketContext context, BinaryMessage message);
    byte onError(WebsocketException exception);
}
