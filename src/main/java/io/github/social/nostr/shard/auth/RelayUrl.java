package io.github.social.nostr.shard.auth;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Locale;

import io.github.social.nostr.shard.exceptions.UtilityInstantiationException;

/**
 * Canonical relay URL, used to bind AUTH events to the connection they were meant for.
 */
public final class RelayUrl {
    private RelayUrl() {
        throw new UtilityInstantiationException();
    }

    /**
     * Lower-cases scheme and host, maps http(s) to ws(s), drops default ports,
     * duplicate and trailing slashes, query ordering and fragment.
     *
     * @return {@code null} when the value is not a URL
     */
    public static String normalize(final String url) {
        if( url == null || url.isBlank() ) return null;

        final String candidate = url.contains("://") ? url.trim() : "wss://" + url.trim();

        final URI uri;
        try {
            uri = new URI(candidate);
        } catch(URISyntaxException failure) {
            return null;
        }
        if( uri.getScheme() == null || uri.getHost() == null ) return null;

        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if( "http".equals(scheme) ) scheme = "ws";
        if( "https".equals(scheme) ) scheme = "wss";

        int port = uri.getPort();
        if( ("ws".equals(scheme) && port == 80) || ("wss".equals(scheme) && port == 443) ) port = -1;

        String path = uri.getRawPath() == null ? "" : uri.getRawPath().replaceAll("/+", "/");
        if( path.endsWith("/") ) path = path.substring(0, path.length() - 1);

        final StringBuilder out = new StringBuilder();
        out.append(scheme).append("://").append(uri.getHost().toLowerCase(Locale.ROOT));
        if( port != -1 ) out.append(':').append(port);
        out.append(path);

        final String query = uri.getRawQuery();
        if( query != null && !query.isEmpty() ) {
            final String[] params = query.split("&");
            Arrays.sort(params);
            out.append('?').append(String.join("&", params));
        }

        return out.toString();
    }

    public static boolean same(final String left, final String right) {
        final String a = normalize(left);
        return a != null && a.equals(normalize(right));
    }

}
