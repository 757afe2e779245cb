package io.github.social.nostr.shard.specs;

import static io.github.social.nostr.shard.specs.EventFixtures.hex;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonParser;

import io.github.social.nostr.shard.exceptions.UnsupportedFilterException;

class ReqFilterTest {

    private static ReqFilter parse(final String json) throws UnsupportedFilterException {
        return ReqFilter.of(JsonParser.parseString(json));
    }

    @Test
    void lowerCasesHexIdentifiers() throws UnsupportedFilterException {
        final ReqFilter filter = parse("{\"ids\":[\"" + hex(0xabc).toUpperCase() + "\"]}");

        assertTrue(filter.getIds().get().contains(hex(0xabc)));
        assertTrue(filter.isIdsOnly());
    }

    @Test
    void keepsGenericTagValuesVerbatim() throws UnsupportedFilterException {
        final ReqFilter filter = parse("{\"#t\":[\"Nostr\"],\"kinds\":[1],\"limit\":5}");

        assertTrue(filter.getTags().get("t").contains("Nostr"));
        assertEquals(5, filter.getLimit().get());
        assertFalse(filter.isIdsOnly());
    }

    @Test
    void rejectsUnknownKeys() {
        assertThrows(UnsupportedFilterException.class, () -> parse("{\"search\":\"x\"}"));
        assertThrows(UnsupportedFilterException.class, () -> parse("{\"#zz\":[\"x\"]}"));
        assertThrows(UnsupportedFilterException.class, () -> parse("{\"#x\":[\"x\"]}"));
    }

    @Test
    void rejectsMalformedValues() {
        assertThrows(UnsupportedFilterException.class, () -> parse("{\"ids\":[\"abc\"]}"));
        assertThrows(UnsupportedFilterException.class, () -> parse("{\"kinds\":[-1]}"));
        assertThrows(UnsupportedFilterException.class, () -> parse("{\"limit\":\"10\"}"));
        assertThrows(UnsupportedFilterException.class, () -> parse("[]"));
    }

    @Test
    void keepsEmptySetsDistinctFromAbsent() throws UnsupportedFilterException {
        final ReqFilter filter = parse("{\"authors\":[]}");

        assertTrue(filter.getAuthors().isPresent());
        assertTrue(filter.getAuthors().get().isEmpty());
        assertFalse(filter.getKinds().isPresent());
    }

}
