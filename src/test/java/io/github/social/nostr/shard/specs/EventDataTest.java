package io.github.social.nostr.shard.specs;

import static io.github.social.nostr.shard.specs.EventFixtures.ALICE;
import static io.github.social.nostr.shard.specs.EventFixtures.event;
import static io.github.social.nostr.shard.specs.EventFixtures.hex;
import static io.github.social.nostr.shard.specs.EventFixtures.tag;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

class EventDataTest {

    @Test
    void serializesCanonically() {
        final JsonObject json = JsonParser.parseString(
            "{\"id\":\"\",\"pubkey\":\"" + ALICE + "\",\"created_at\":10,\"kind\":1,"
            + "\"tags\":[[\"t\",\"a\\\"b\"]],\"content\":\"line\\nnext\\u0001\",\"sig\":\"\"}").getAsJsonObject();

        final String canonical = EventData.of(json).serialize();

        assertEquals(
            "[0,\"" + ALICE + "\",10,1,[[\"t\",\"a\\\"b\"]],\"line\\nnext\\u0001\"]",
            canonical);
    }

    @Test
    void rejectsMissingFields() {
        final JsonObject json = event(hex(1), ALICE, 1, 10).toJson();
        json.remove("sig");

        assertThrows(JsonParseException.class, () -> EventData.of(json));
    }

    @Test
    void rejectsNonStringTagValues() {
        final JsonObject json = event(hex(1), ALICE, 1, 10).toJson();
        json.add("tags", JsonParser.parseString("[[\"e\", 1]]"));

        assertThrows(JsonParseException.class, () -> EventData.of(json));
    }

    @Test
    void rejectsFractionalCreatedAt() {
        final JsonObject json = event(hex(1), ALICE, 1, 10).toJson();
        json.addProperty("created_at", 10.5);

        assertThrows(JsonParseException.class, () -> EventData.of(json));
    }

    @Test
    void readsIdentifierAndProtectionMarker() {
        final EventData eventData = event(hex(1), ALICE, 30023, 10, tag("d", ""), tag("-"));

        assertEquals("", eventData.getIdentifier().get());
        assertTrue(eventData.isProtected());
        assertFalse(event(hex(2), ALICE, 1, 10).isProtected());
    }

    @Test
    void ordersNewestFirstThenById() {
        final EventData older = event(hex(1), ALICE, 1, 10);
        final EventData newer = event(hex(9), ALICE, 1, 20);
        final EventData tie = event(hex(2), ALICE, 1, 20);

        assertTrue(EventData.NEWEST_FIRST.compare(newer, older) < 0);
        assertTrue(EventData.NEWEST_FIRST.compare(tie, newer) < 0);
    }

}
