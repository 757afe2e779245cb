package io.github.social.nostr.shard.service;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import io.github.social.nostr.shard.def.IRegistrationService;

/**
 * Fixed registration list. {@link #openToAll()} treats every author as registered.
 */
public class StaticRegistrationService implements IRegistrationService {
    private final Set<String> registered;

    public StaticRegistrationService(final Collection<String> pubkeys) {
        this.registered = Collections.unmodifiableSet(new LinkedHashSet<>(pubkeys));
    }

    private StaticRegistrationService() {
        this.registered = null;
    }

    public static StaticRegistrationService openToAll() {
        return new StaticRegistrationService();
    }

    public byte start() {
        return 0;
    }

    public boolean isRegistered(final String pubkey) {
        return registered == null || registered.contains(pubkey);
    }

    public byte close() {
        return 0;
    }

}
