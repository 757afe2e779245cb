package io.github.social.nostr.shard.auth;

import io.github.social.nostr.shard.utilities.Utils;

/**
 * Outstanding authentication challenge of a connection. Replaced on every re-issue.
 */
public final class AuthSession {
    private final String challenge;
    private final long challengedAt;

    public AuthSession(final String challenge, final long challengedAt) {
        this.challenge = challenge;
        this.challengedAt = challengedAt;
    }

    /**
     * Fresh, unguessable challenge issued now.
     */
    public static AuthSession issue(final long nowMillis) {
        return new AuthSession(Utils.secureHash(), nowMillis);
    }

    public String getChallenge() {
        return challenge;
    }

    /**
     * Issuance time, epoch milliseconds.
     */
    public long getChallengedAt() {
        return challengedAt;
    }

    public boolean isExpired(final long nowMillis, final long timeoutSecond) {
        return challengedAt + timeoutSecond * 1000L < nowMillis;
    }

}
