package io.github.social.nostr.shard.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.Binary;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.Sorts;

import io.github.social.nostr.shard.datasource.CacheDS;
import io.github.social.nostr.shard.datasource.DocumentDS;
import io.github.social.nostr.shard.exceptions.EventRepositoryException;
import io.github.social.nostr.shard.specs.EventData;
import io.github.social.nostr.shard.specs.EventMetadata;
import io.github.social.nostr.shard.specs.EventVersion;
import io.github.social.nostr.shard.specs.ReqFilter;
import io.github.social.nostr.shard.specs.RelayPolicy;
import io.github.social.nostr.shard.utilities.LogService;

import redis.clients.jedis.Jedis;
import redis.clients.jedis.Pipeline;
import redis.clients.jedis.Response;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.SetParams;

/**
 * Redis holds the full event bodies ({@code event#<id>}) and relay-side
 * metadata ({@code meta#<id>}); the MongoDB {@code events} collection holds
 * the queryable index: binary id and pubkey, kind, created_at and the values
 * of indexable single-letter tags.
 */
public class EventDocumentRepository extends AbstractEventRepository {
    private final LogService logger = LogService.getInstance(getClass().getCanonicalName());

    static final String COLLECTION = "events";

    static final int BULK_SIZE = 100;

    private final CacheDS cache;
    private final DocumentDS document;

    private final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

    public EventDocumentRepository(final RelayPolicy policy, final CacheDS cache, final DocumentDS document) {
        super(policy);
        this.cache = cache;
        this.document = document;
    }

    public byte start() {
        try {
            final MongoCollection<Document> index = collection();
            index.createIndex(Indexes.descending("created_at"));
            index.createIndex(Indexes.compoundIndex(
                Indexes.ascending("kind"), Indexes.ascending("pubkey"), Indexes.descending("created_at")));
            index.createIndex(Indexes.compoundIndex(
                Indexes.ascending("pubkey"), Indexes.descending("created_at")));
            for(final String letter: ReqFilter.INDEXED_TAGS) {
                index.createIndex(Indexes.ascending("tags."+letter));
            }
        } catch(MongoException e) {
            throw new EventRepositoryException("could not prepare the event index", e);
        }

        return logger.info("[MongoDB] event index ready.");
    }

    boolean storeEvent(final EventData eventData, final EventMetadata metadata) {
        final boolean stored;
        try (final Jedis jedis = cache.connect()) {
            stored = "OK".equals(jedis.set(bodyKey(eventData.getId()), eventData.toString(), SetParams.setParams().nx()));

            if( stored ) {
                final Map<String, String> meta = new HashMap<>();
                meta.put("receivedAt", String.valueOf(metadata.getReceivedAt()));
                if( metadata.getIpAddress() != null ) meta.put("ipAddress", metadata.getIpAddress());
                jedis.hset(metaKey(eventData.getId()), meta);
            }
        } catch(JedisException e) {
            logger.warning("[Redis] Failure: {}", e.getMessage());
            throw new EventRepositoryException("could not store event body", e);
        }

        try {
            final Document indexDoc = indexDocument(eventData);
            collection().replaceOne(
                Filters.eq("_id", indexDoc.get("_id")),
                indexDoc,
                new ReplaceOptions().upsert(true));
        } catch(MongoException e) {
            logger.warning("[MongoDB] Failure: {}", e.getMessage());
            throw new EventRepositoryException("could not index event", e);
        }

        if( stored ) logger.info("[Storage] event {} stored.", eventData.getId());

        return stored;
    }

    List<EventVersion> acquireVersions(final int kind, final String pubkey, final String identifier) {
        final List<Bson> conditions = new ArrayList<>();
        conditions.add(Filters.eq("kind", kind));
        conditions.add(Filters.eq("pubkey", binary(pubkey)));
        if( identifier != null ) {
            conditions.add(Filters.eq("tags.d", identifier));
        }

        final List<EventVersion> versions = new ArrayList<>();
        try(final MongoCursor<Document> cursor = collection()
                .find(Filters.and(conditions))
                .projection(Projections.include("_id", "created_at"))
                .cursor()) {
            cursor.forEachRemaining(doc -> versions.add(new EventVersion(
                hex(doc.get("_id", Binary.class)),
                doc.getLong("created_at"))));
        } catch(MongoException e) {
            logger.warning("[MongoDB] Failure: {}", e.getMessage());
            throw new EventRepositoryException("could not read previous versions", e);
        }

        return versions;
    }

    void removeStoredEvents(final Collection<String> ids) {
        if( ids.isEmpty() ) return;

        try {
            collection().deleteMany(Filters.in("_id", binaries(ids)));
        } catch(MongoException e) {
            logger.warning("[MongoDB] Failure: {}", e.getMessage());
            throw new EventRepositoryException("could not remove index entries", e);
        }

        try (final Jedis jedis = cache.connect()) {
            final Pipeline pipeline = jedis.pipelined();
            ids.forEach(id -> pipeline.del(bodyKey(id), metaKey(id)));
            pipeline.sync();
        } catch(JedisException e) {
            logger.warning("[Redis] Failure: {}", e.getMessage());
            throw new EventRepositoryException("could not remove event bodies", e);
        }

        logger.info("[Storage] {} event(s) removed.", ids.size());
    }

    Collection<EventData> acquireEventsByIds(final Collection<String> ids) {
        final List<String> unique = ids.stream().distinct().collect(Collectors.toList());
        final List<EventData> events = new ArrayList<>(unique.size());

        try (final Jedis jedis = cache.connect()) {
            for(int from = 0; from < unique.size(); from += BULK_SIZE) {
                final List<String> chunk = unique.subList(from, Math.min(from + BULK_SIZE, unique.size()));

                final Pipeline pipeline = jedis.pipelined();
                final List<Response<String>> responses = chunk
                    .stream()
                    .map(id -> pipeline.get(bodyKey(id)))
                    .collect(Collectors.toList());
                pipeline.sync();

                for(final Response<String> response: responses) {
                    final String body = response.get();
                    if( body == null ) continue;
                    try {
                        events.add(EventData.gsonEngine(gson, body));
                    } catch(JsonParseException e) {
                        logger.warning("[Redis] Ignoring unreadable body: {}", e.getMessage());
                    }
                }
            }
        } catch(JedisException e) {
            logger.warning("[Redis] Failure: {}", e.getMessage());
            throw new EventRepositoryException("could not read event bodies", e);
        }

        return events;
    }

    List<String> acquireIdsByQuery(final ReqFilter filter, final int limit) {
        final List<String> ids = new ArrayList<>();
        try(final MongoCursor<Document> cursor = collection()
                .find(query(filter))
                .projection(Projections.include("_id"))
                .sort(Sorts.orderBy(Sorts.descending("created_at"), Sorts.ascending("_id")))
                .limit(limit)
                .cursor()) {
            cursor.forEachRemaining(doc -> ids.add(hex(doc.get("_id", Binary.class))));
        } catch(MongoException e) {
            logger.warning("[MongoDB] Failure: {}", e.getMessage());
            throw new EventRepositoryException("could not query the event index", e);
        }

        return ids;
    }

    public byte close() {
        document.close();
        return cache.close();
    }

    /**
     * Conjunction of the filter's conditions over the index collection.
     */
    static Bson query(final ReqFilter filter) {
        final List<Bson> conditions = new ArrayList<>();

        filter.getIds().ifPresent(ids -> conditions.add(Filters.in("_id", binaries(ids))));
        filter.getAuthors().ifPresent(authors -> conditions.add(Filters.in("pubkey", binaries(authors))));
        filter.getKinds().ifPresent(kinds -> conditions.add(Filters.in("kind", kinds)));
        filter.getSince().ifPresent(since -> conditions.add(Filters.gte("created_at", since)));
        filter.getUntil().ifPresent(until -> conditions.add(Filters.lte("created_at", until)));
        filter.getTags().forEach((letter, values) -> conditions.add(Filters.in("tags."+letter, values)));

        return conditions.isEmpty() ? new Document() : Filters.and(conditions);
    }

    static Document indexDocument(final EventData eventData) {
        final Map<String, List<String>> tags = new HashMap<>();
        for(final List<String> tag: eventData.getTags()) {
            if( tag.size() < 2 || !ReqFilter.INDEXED_TAGS.contains(tag.get(0)) ) continue;

            final String letter = tag.get(0);
            final String value = ReqFilter.HEX_TAGS.contains(letter) ? tag.get(1).toLowerCase() : tag.get(1);
            final List<String> values = tags.computeIfAbsent(letter, key -> new ArrayList<>());
            if( !values.contains(value) ) values.add(value);
        }

        final Document tagDoc = new Document();
        tags.forEach(tagDoc::append);

        return new Document("_id", binary(eventData.getId()))
            .append("pubkey", binary(eventData.getPubkey()))
            .append("kind", eventData.getKind())
            .append("created_at", eventData.getCreatedAt())
            .append("tags", tagDoc);
    }

    static String bodyKey(final String id) {
        return "event#"+id;
    }

    static String metaKey(final String id) {
        return "meta#"+id;
    }

    static Binary binary(final String hex) {
        try {
            return new Binary(Hex.decodeHex(hex));
        } catch(DecoderException e) {
            throw new IllegalArgumentException("not a hex string: " + hex, e);
        }
    }

    static List<Binary> binaries(final Collection<String> hexList) {
        return hexList.stream().map(EventDocumentRepository::binary).collect(Collectors.toList());
    }

    static String hex(final Binary binary) {
        return Hex.encodeHexString(binary.getData());
    }

    private MongoCollection<Document> collection() {
        return document.database().getCollection(COLLECTION);
    }

}
