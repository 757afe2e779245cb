package io.github.social.nostr.shard.def;

/**
 * Registered (allow-listed) authors, consulted when writes are restricted.
 */
public interface IRegistrationService {

    byte start();

    boolean isRegistered(String pubkey);

    byte close();

}
