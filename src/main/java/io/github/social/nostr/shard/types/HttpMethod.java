package io.github.social.nostr.shard.types;

public enum HttpMethod {
    OPTIONS, GET, POST, DELETE;

    public static HttpMethod from(final String method) {
        if (method == null) {
            return null;
        }
        for (final HttpMethod m : values()) {
            if (m.name().equalsIgnoreCase(method)) {
                return m;
            }
        }
        return null;
    }
}
