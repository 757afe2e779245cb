package io.github.social.nostr.shard.server;

import io.github.social.nostr.shard.message.RelayResponse;
import io.github.social.nostr.shard.utilities.LogService;
import io.github.social.nostr.shard.websocket.BinaryMessage;
import io.github.social.nostr.shard.websocket.TextMessage;
import io.github.social.nostr.shard.websocket.Websocket;
import io.github.social.nostr.shard.websocket.WebsocketException;

public class WebsocketHandler implements Websocket {
    private final LogService logger = LogService.getInstance(getClass().getCanonicalName());

    private final NostrService nostr;

    public WebsocketHandler(final NostrService nostr) {
        this.nostr = nostr;
    }

    public byte onServerStartup() {
        return nostr.open();
    }

    public byte onServerShutdown() {
        return nostr.close();
    }

    public boolean isRefusingConnections() {
        return nostr.isMaintenance();
    }

    public byte onOpen(final WebsocketContext context) {
        logger.info("[WS] Server ready to accept data.");

        return nostr.openSession(context);
    }

    public byte onClose(final WebsocketContext context) {
        logger.info("[WS] Client gone. Bye.");

        return nostr.closeSession(context);
    }

    public byte onMessage(final WebsocketContext context, final TextMessage message) {
        logger.debug("[WS] Client [{}] -> Server\n{}", context.getRemoteAddress(), message.getMessage());

        return nostr.consume(context, message);
    }

    public byte onMessage(final WebsocketContext context, final BinaryMessage message) {
        return context.send(RelayResponse.notice("unsupported: binary messages"));
    }

    public byte onError(WebsocketException exception) {
        return logger.info("[WS] Server got error: {}", exception.getMessage());
    }

}
