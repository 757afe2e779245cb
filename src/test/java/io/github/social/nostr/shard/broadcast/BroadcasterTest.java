package io.github.social.nostr.shard.broadcast;

import static io.github.social.nostr.shard.specs.EventFixtures.ALICE;
import static io.github.social.nostr.shard.specs.EventFixtures.event;
import static io.github.social.nostr.shard.specs.EventFixtures.hex;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;

import org.junit.jupiter.api.Test;

import io.github.social.nostr.shard.server.RecordingContext;
import io.github.social.nostr.shard.specs.EventData;
import io.github.social.nostr.shard.specs.ReqFilter;

class BroadcasterTest {
    private final ConnectionRegistry registry = new ConnectionRegistry();
    private final Broadcaster broadcaster = new Broadcaster(registry);

    private RecordingContext subscribed(final String subscriptionId, final ReqFilter filter) {
        final RecordingContext context = RecordingContext.attached("ws://localhost");
        context.getConnection().putSubscription(subscriptionId, Collections.singletonList(filter));
        registry.register(context);
        return context;
    }

    @Test
    void deliversToEveryMatchingSubscription() {
        final RecordingContext notes = subscribed("notes", ReqFilter.builder().kinds(1).build());
        final RecordingContext metadata = subscribed("meta", ReqFilter.builder().kinds(0).build());
        notes.getConnection().putSubscription("mine", Collections.singletonList(ReqFilter.builder().authors(ALICE).build()));

        final EventData note = event(hex(1), ALICE, 1, 100);

        assertEquals(2, broadcaster.publish(note));
        assertEquals(2, notes.frames("EVENT").size());
        assertTrue(metadata.frames().isEmpty());
    }

    @Test
    void skipsDisconnectedAndUnregisteredContexts() {
        final RecordingContext gone = subscribed("all", ReqFilter.builder().build());
        gone.drop();
        final RecordingContext left = subscribed("all", ReqFilter.builder().build());
        registry.unregister(left);

        assertEquals(0, broadcaster.publish(event(hex(1), ALICE, 1, 100)));
        assertTrue(gone.frames().isEmpty());
        assertTrue(left.frames().isEmpty());
    }

    @Test
    void failingContextDoesNotStopDelivery() {
        final RecordingContext failing = RecordingContext.withSession(new RecordingContext("ws://localhost") {
            public byte send(final String message) {
                throw new IllegalStateException("socket gone");
            }
        });
        failing.getConnection().putSubscription("all", Collections.singletonList(ReqFilter.builder().build()));
        registry.register(failing);
        final RecordingContext healthy = subscribed("all", ReqFilter.builder().build());

        broadcaster.publish(event(hex(1), ALICE, 1, 100));

        assertEquals(1, healthy.frames("EVENT").size());
    }

}
