package io.github.social.nostr.shard.message;

import java.util.function.LongSupplier;

import io.github.social.nostr.shard.auth.ChallengeVerifier;
import io.github.social.nostr.shard.broadcast.Broadcaster;
import io.github.social.nostr.shard.broadcast.ConnectionRegistry;
import io.github.social.nostr.shard.def.IEventRepository;
import io.github.social.nostr.shard.def.IRegistrationService;
import io.github.social.nostr.shard.def.ISubscriptionStore;
import io.github.social.nostr.shard.security.EventValidator;
import io.github.social.nostr.shard.specs.RelayPolicy;

/**
 * Collaborators shared by the frame handlers of one relay instance.
 */
public final class RelayServices {
    private final RelayPolicy policy;
    private final IEventRepository repository;
    private final IRegistrationService registration;
    private final ISubscriptionStore subscriptionStore;
    private final ConnectionRegistry connections;
    private final Broadcaster broadcaster;
    private final EventValidator validator;
    private final ChallengeVerifier challengeVerifier;
    private final LongSupplier clock;

    private RelayServices(final Builder builder) {
        this.policy = builder.policy;
        this.repository = builder.repository;
        this.registration = builder.registration;
        this.subscriptionStore = builder.subscriptionStore;
        this.clock = builder.clock;
        this.validator = new EventValidator();
        this.challengeVerifier = new ChallengeVerifier(policy.getAuthTimeoutSecond());
        this.connections = new ConnectionRegistry();
        this.broadcaster = new Broadcaster(connections);
    }

    public static Builder builder() {
        return new Builder();
    }

    public RelayPolicy getPolicy() {
        return policy;
    }

    public IEventRepository getRepository() {
        return repository;
    }

    public IRegistrationService getRegistration() {
        return registration;
    }

    public ISubscriptionStore getSubscriptionStore() {
        return subscriptionStore;
    }

    public ConnectionRegistry getConnections() {
        return connections;
    }

    public Broadcaster getBroadcaster() {
        return broadcaster;
    }

    public EventValidator getValidator() {
        return validator;
    }

    public ChallengeVerifier getChallengeVerifier() {
        return challengeVerifier;
    }

    /**
     * Epoch milliseconds.
     */
    public long now() {
        return clock.getAsLong();
    }

    public static final class Builder {
        private RelayPolicy policy = RelayPolicy.builder().build();
        private IEventRepository repository;
        private IRegistrationService registration;
        private ISubscriptionStore subscriptionStore;
        private LongSupplier clock = System::currentTimeMillis;

        private Builder() {}

        public Builder policy(final RelayPolicy value) {
            this.policy = value;
            return this;
        }

        public Builder repository(final IEventRepository value) {
            this.repository = value;
            return this;
        }

        public Builder registration(final IRegistrationService value) {
            this.registration = value;
            return this;
        }

        public Builder subscriptionStore(final ISubscriptionStore value) {
            this.subscriptionStore = value;
            return this;
        }

        public Builder clock(final LongSupplier value) {
            this.clock = value;
            return this;
        }

        public RelayServices build() {
            if( repository == null || registration == null || subscriptionStore == null ) {
                throw new IllegalStateException("repository, registration and subscription store are required");
            }
            return new RelayServices(this);
        }
    }

}
