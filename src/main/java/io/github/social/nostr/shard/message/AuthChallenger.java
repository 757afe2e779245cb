package io.github.social.nostr.shard.message;

import io.github.social.nostr.shard.auth.AuthSession;
import io.github.social.nostr.shard.server.WebsocketContext;
import io.github.social.nostr.shard.utilities.LogService;

/**
 * Issues a fresh challenge, replacing any outstanding one, and sends it as an {@code AUTH} frame.
 */
public class AuthChallenger {
    private final LogService logger = LogService.getInstance(getClass().getCanonicalName());

    private final RelayServices services;

    public AuthChallenger(final RelayServices services) {
        this.services = services;
    }

    public byte issue(final WebsocketContext context) {
        final AuthSession auth = AuthSession.issue(services.now());
        context.getConnection().setAuth(auth);

        logger.info("[Nostr] [Auth] challenge issued for {}", context.getConnection().getId());

        return context.send(RelayResponse.auth(auth.getChallenge()));
    }

}
