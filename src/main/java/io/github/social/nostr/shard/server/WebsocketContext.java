package io.github.social.nostr.shard.server;

import java.util.UUID;

import io.github.social.nostr.shard.session.Connection;

/**
 * Live handle of one upgraded client connection.
 * <p>
 * {@link #send(String)} only enqueues; delivery happens on the connection's own writer.
 */
public abstract class WebsocketContext {
    private final UUID contextID = UUID.randomUUID();

    private volatile Connection connection;

    public UUID getContextID() {
        return contextID;
    }

    private boolean connected = false;

    void connect() {
        this.connected = true;
    }

    synchronized void disconnect() {
        this.connected = false;
    }

    public final synchronized boolean isConnected() {
        return connected;
    }

    /**
     * Session record, attached when the session opens.
     */
    public Connection getConnection() {
        return connection;
    }

    void attach(final Connection connection) {
        this.connection = connection;
    }

    public abstract String getRemoteAddress();

    public abstract String getUserAgent();

    /**
     * URL the client reached this relay with ({@code ws[s]://host[:port]/path}).
     */
    public abstract String getUrl();

    public abstract byte send(String message);

    public abstract byte requestClose();

}
