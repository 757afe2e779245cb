package io.github.social.nostr.shard.specs;

/**
 * Relay-side facts recorded next to a stored event.
 */
public final class EventMetadata {
    private final String ipAddress;
    private final long receivedAt;

    public EventMetadata(final String ipAddress, final long receivedAt) {
        this.ipAddress = ipAddress;
        this.receivedAt = receivedAt;
    }

    /**
     * May be {@code null} when the transport did not expose it.
     */
    public String getIpAddress() {
        return ipAddress;
    }

    /**
     * Epoch milliseconds.
     */
    public long getReceivedAt() {
        return receivedAt;
    }

}
