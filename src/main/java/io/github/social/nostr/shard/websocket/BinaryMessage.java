package io.github.social.nostr.shard.websocket;

/**
 * Binary frames carry no relay protocol; they are acknowledged with a notice.
 */
public class BinaryMessage extends Message {

    public BinaryMessage(byte[] data) {
        super(data, Message.Type.BINARY);
    }

}
