package io.github.social.nostr.shard.auth;

import io.github.social.nostr.shard.specs.EventData;
import io.github.social.nostr.shard.specs.EventKind;

/**
 * Checks an AUTH event against the outstanding challenge of its connection.
 */
public class ChallengeVerifier {
    private final long timeoutSecond;

    public ChallengeVerifier(final long timeoutSecond) {
        this.timeoutSecond = timeoutSecond;
    }

    /**
     * @return {@code null} when the event authenticates its pubkey, otherwise the rejection reason
     */
    public String verify(final EventData eventData, final AuthSession auth, final String connectionUrl, final long nowMillis) {
        if( eventData.getKind() != EventKind.CLIENT_AUTH ) {
            return "invalid: auth event kind must be " + EventKind.CLIENT_AUTH;
        }

        if( auth == null ) {
            return "invalid: no challenge has been issued for this connection";
        }

        if( auth.isExpired(nowMillis, timeoutSecond) ) {
            return "invalid: auth challenge expired";
        }

        final String challenge = eventData.getTagValue("challenge").orElse(null);
        if( !auth.getChallenge().equals(challenge) ) {
            return "invalid: auth challenge does not match";
        }

        final String relay = eventData.getTagValue("relay").orElse(null);
        if( !RelayUrl.same(relay, connectionUrl) ) {
            return "invalid: auth relay url does not match";
        }

        return null;
    }

}
