package io.github.social.nostr.shard.server;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

import com.google.gson.JsonObject;

import io.github.social.nostr.shard.exceptions.EventRepositoryException;
import io.github.social.nostr.shard.types.HttpMethod;
import io.github.social.nostr.shard.types.HttpStatus;
import io.github.social.nostr.shard.utilities.LogService;

/**
 * Operator endpoints under {@code /admin/}, guarded by a bearer token.
 * An empty token disables them altogether.
 */
public class AdminHandler {
    private final LogService logger = LogService.getInstance(getClass().getCanonicalName());

    static final String BEARER = "Bearer ";

    private final NostrService nostr;
    private final byte[] token;

    public AdminHandler(final NostrService nostr, final String token) {
        this.nostr = nostr;
        this.token = token == null ? new byte[0] : token.getBytes(StandardCharsets.UTF_8);
    }

    public AdminResponse handle(final HttpMethod method, final String path, final String authorization) {
        if( token.length == 0 ) {
            return error(HttpStatus.NOT_FOUND, "not found");
        }

        if( !authorized(authorization) ) {
            return error(HttpStatus.UNAUTHORIZED, "unauthorized");
        }

        try {
            switch(path) {
                case "/admin/metrics":
                    return method == HttpMethod.GET
                        ? new AdminResponse(HttpStatus.OK, nostr.metrics().toJson().toString())
                        : error(HttpStatus.METHOD_NOT_ALLOWED, "method not allowed");
                case "/admin/maintenance":
                    return maintenance(method);
                case "/admin/prune":
                    return method == HttpMethod.POST
                        ? prune()
                        : error(HttpStatus.METHOD_NOT_ALLOWED, "method not allowed");
                default:
                    return error(HttpStatus.NOT_FOUND, "not found");
            }
        } catch(EventRepositoryException failure) {
            logger.error("[Admin] {} {} failed: {}", method, path, failure.getMessage());

            return error(HttpStatus.SERVER_ERROR, failure.getMessage());
        }
    }

    private AdminResponse maintenance(final HttpMethod method) {
        final JsonObject body = new JsonObject();

        switch(method) {
            case GET:
                body.addProperty("maintenance", nostr.isMaintenance());
                break;
            case POST:
                final int closed = nostr.enableMaintenance();
                body.addProperty("maintenance", true);
                body.addProperty("closed", closed);
                break;
            case DELETE:
                nostr.disableMaintenance();
                body.addProperty("maintenance", false);
                break;
            default:
                return error(HttpStatus.METHOD_NOT_ALLOWED, "method not allowed");
        }

        return new AdminResponse(HttpStatus.OK, body.toString());
    }

    private AdminResponse prune() {
        final JsonObject body = new JsonObject();
        body.addProperty("removed", nostr.prune());

        return new AdminResponse(HttpStatus.OK, body.toString());
    }

    private boolean authorized(final String authorization) {
        if( authorization == null || !authorization.startsWith(BEARER) ) return false;

        final byte[] presented = authorization.substring(BEARER.length()).trim().getBytes(StandardCharsets.UTF_8);

        return MessageDigest.isEqual(token, presented);
    }

    private static AdminResponse error(final HttpStatus status, final String message) {
        final JsonObject body = new JsonObject();
        body.addProperty("error", message);

        return new AdminResponse(status, body.toString());
    }

    public static final class AdminResponse {
        private final HttpStatus status;
        private final String body;

        AdminResponse(final HttpStatus status, final String body) {
            this.status = status;
            this.body = body;
        }

        public HttpStatus getStatus() {
            return status;
        }

        public String getBody() {
            return body;
        }
    }

}
