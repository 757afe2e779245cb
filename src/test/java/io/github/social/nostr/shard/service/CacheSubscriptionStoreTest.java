package io.github.social.nostr.shard.service;

import static io.github.social.nostr.shard.specs.EventFixtures.ALICE;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import io.github.social.nostr.shard.exceptions.UnsupportedFilterException;
import io.github.social.nostr.shard.specs.ReqFilter;

class CacheSubscriptionStoreTest {

    @Test
    void keysAreScopedByConnection() {
        assertEquals("subscription#c-1", CacheSubscriptionStore.key("c-1"));
    }

    @Test
    void snapshotKeepsFiltersPerSubscription() throws UnsupportedFilterException {
        final Map<String, List<ReqFilter>> subscriptions = new LinkedHashMap<>();
        subscriptions.put("feed", Arrays.asList(
            ReqFilter.builder().kinds(1).authors(ALICE).limit(10).build(),
            ReqFilter.builder().tag("t", "nostr").since(100).build()));
        subscriptions.put("all", Collections.singletonList(ReqFilter.builder().build()));

        final JsonObject snapshot = JsonParser.parseString(CacheSubscriptionStore.snapshot(subscriptions)).getAsJsonObject();

        assertEquals(2, snapshot.size());
        assertEquals(2, snapshot.getAsJsonArray("feed").size());
        assertEquals(
            JsonParser.parseString("{\"authors\":[\"" + ALICE + "\"],\"kinds\":[1],\"limit\":10}"),
            snapshot.getAsJsonArray("feed").get(0));
        assertEquals(
            ReqFilter.of(snapshot.getAsJsonArray("feed").get(1)).getTags(),
            subscriptions.get("feed").get(1).getTags());
        assertEquals(JsonParser.parseString("[{}]"), snapshot.get("all"));
    }

}
