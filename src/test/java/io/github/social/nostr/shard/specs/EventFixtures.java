package io.github.social.nostr.shard.specs;

import java.util.Arrays;
import java.util.List;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * Structurally valid, unsigned events for storage and matching tests.
 */
public final class EventFixtures {
    public static final String ALICE = hex(0xa11ce);
    public static final String BOB = hex(0xb0b);

    private EventFixtures() {}

    public static String hex(final long value) {
        return String.format("%064x", value);
    }

    public static List<String> tag(final String... values) {
        return Arrays.asList(values);
    }

    @SafeVarargs
    public static EventData event(
            final String id,
            final String pubkey,
            final int kind,
            final long createdAt,
            final List<String>... tags
    ) {
        final JsonObject json = new JsonObject();
        json.addProperty("id", id);
        json.addProperty("pubkey", pubkey);
        json.addProperty("created_at", createdAt);
        json.addProperty("kind", kind);
        final JsonArray tagArray = new JsonArray();
        for(final List<String> tag: tags) {
            final JsonArray entry = new JsonArray();
            tag.forEach(entry::add);
            tagArray.add(entry);
        }
        json.add("tags", tagArray);
        json.addProperty("content", "");
        json.addProperty("sig", "");

        return EventData.of(json);
    }

}
