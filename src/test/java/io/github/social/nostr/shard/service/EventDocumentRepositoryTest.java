package io.github.social.nostr.shard.service;

import static io.github.social.nostr.shard.specs.EventFixtures.ALICE;
import static io.github.social.nostr.shard.specs.EventFixtures.BOB;
import static io.github.social.nostr.shard.specs.EventFixtures.event;
import static io.github.social.nostr.shard.specs.EventFixtures.hex;
import static io.github.social.nostr.shard.specs.EventFixtures.tag;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.bson.BsonArray;
import org.bson.BsonBinary;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.bson.Document;
import org.bson.types.Binary;
import org.junit.jupiter.api.Test;

import io.github.social.nostr.shard.specs.ReqFilter;

class EventDocumentRepositoryTest {

    private static BsonBinary binary(final String hex) throws DecoderException {
        return new BsonBinary(Hex.decodeHex(hex));
    }

    /**
     * Every condition on {@code field}, whether the query was rendered as a single
     * document or as an {@code $and} list.
     */
    private static List<BsonDocument> conditionsOn(final BsonDocument query, final String field) {
        final List<BsonDocument> parts = new ArrayList<>();
        if( query.containsKey("$and") ) {
            for(final BsonValue part: query.getArray("$and")) parts.add(part.asDocument());
        } else {
            parts.add(query);
        }

        final List<BsonDocument> found = new ArrayList<>();
        for(final BsonDocument part: parts) {
            if( part.containsKey(field) ) found.add(part.getDocument(field));
        }
        return found;
    }

    private static BsonArray inValues(final BsonDocument query, final String field) {
        final List<BsonDocument> conditions = conditionsOn(query, field);
        assertEquals(1, conditions.size(), field);
        return conditions.get(0).getArray("$in");
    }

    @Test
    void emptyFilterQueriesEverything() {
        assertEquals(new BsonDocument(), EventDocumentRepository.query(ReqFilter.builder().build()).toBsonDocument());
    }

    @Test
    void idsAndAuthorsAreMatchedAsBinary() throws DecoderException {
        final BsonDocument query = EventDocumentRepository.query(ReqFilter.builder()
            .ids(hex(1), hex(2))
            .authors(ALICE)
            .build()).toBsonDocument();

        assertEquals(new BsonArray(Arrays.asList(binary(hex(1)), binary(hex(2)))), inValues(query, "_id"));
        assertEquals(new BsonArray(Arrays.asList(binary(ALICE))), inValues(query, "pubkey"));
        assertTrue(conditionsOn(query, "kind").isEmpty());
    }

    @Test
    void timeBoundsAreInclusive() {
        final BsonDocument query = EventDocumentRepository.query(ReqFilter.builder()
            .kinds(1, 7)
            .since(100)
            .until(200)
            .build()).toBsonDocument();

        assertEquals(new BsonArray(Arrays.asList(new BsonInt32(1), new BsonInt32(7))), inValues(query, "kind"));

        final BsonDocument bounds = new BsonDocument();
        conditionsOn(query, "created_at").forEach(bounds::putAll);
        assertEquals(new BsonInt64(100), bounds.get("$gte"));
        assertEquals(new BsonInt64(200), bounds.get("$lte"));
        assertEquals(2, bounds.size());
    }

    @Test
    void tagFiltersTargetTheTagSubdocument() {
        final BsonDocument query = EventDocumentRepository.query(ReqFilter.builder()
            .tag("t", "nostr", "java")
            .tag("e", hex(9))
            .build()).toBsonDocument();

        assertEquals(new BsonArray(Arrays.asList(new BsonString("nostr"), new BsonString("java"))),
            inValues(query, "tags.t"));
        assertEquals(new BsonArray(Arrays.asList(new BsonString(hex(9)))), inValues(query, "tags.e"));
    }

    @Test
    void indexDocumentNormalisesTags() throws DecoderException {
        final Document index = EventDocumentRepository.indexDocument(event(hex(3), BOB, 30023, 150,
            tag("d", ""),
            tag("p", ALICE.toUpperCase()),
            tag("p", ALICE),
            tag("t", "Nostr"),
            tag("t", "Nostr"),
            tag("x", "not indexed"),
            tag("client", "some app"),
            tag("e")));

        assertEquals(new Binary(Hex.decodeHex(hex(3))), index.get("_id"));
        assertEquals(new Binary(Hex.decodeHex(BOB)), index.get("pubkey"));
        assertEquals(30023, index.get("kind"));
        assertEquals(150L, index.get("created_at"));

        final Document tags = index.get("tags", Document.class);
        assertEquals(Arrays.asList(""), tags.get("d"));
        assertEquals(Arrays.asList(ALICE), tags.get("p"));
        assertEquals(Arrays.asList("Nostr"), tags.get("t"));
        assertFalse(tags.containsKey("x"));
        assertFalse(tags.containsKey("client"));
        assertFalse(tags.containsKey("e"));
    }

}
