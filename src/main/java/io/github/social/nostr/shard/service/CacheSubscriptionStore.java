package io.github.social.nostr.shard.service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import io.github.social.nostr.shard.datasource.CacheDS;
import io.github.social.nostr.shard.def.ISubscriptionStore;
import io.github.social.nostr.shard.exceptions.EventRepositoryException;
import io.github.social.nostr.shard.specs.ReqFilter;
import io.github.social.nostr.shard.utilities.LogService;

import redis.clients.jedis.Jedis;
import redis.clients.jedis.Pipeline;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

/**
 * Subscriptions are kept as {@code subscription#<connectionId>} JSON documents,
 * indexed by the {@code subscriptions} set. The maintenance flag is the
 * {@code maintenance} key.
 */
public class CacheSubscriptionStore implements ISubscriptionStore {
    private final LogService logger = LogService.getInstance(getClass().getCanonicalName());

    static final String INDEX_KEY = "subscriptions";
    static final String MAINTENANCE_KEY = "maintenance";

    private final CacheDS cache;

    public CacheSubscriptionStore(final CacheDS cache) {
        this.cache = cache;
    }

    public byte start() {
        return 0;
    }

    public void put(final String connectionId, final Map<String, List<ReqFilter>> subscriptions) {
        final String document = snapshot(subscriptions);

        try (final Jedis jedis = cache.connect()) {
            final Pipeline pipeline = jedis.pipelined();
            pipeline.set(key(connectionId), document);
            pipeline.sadd(INDEX_KEY, connectionId);
            pipeline.sync();
        } catch(JedisException e) {
            logger.warning("[Redis] Failure: {}", e.getMessage());
            throw new EventRepositoryException("could not store subscriptions", e);
        }
    }

    public void delete(final String connectionId) {
        try (final Jedis jedis = cache.connect()) {
            final Pipeline pipeline = jedis.pipelined();
            pipeline.del(key(connectionId));
            pipeline.srem(INDEX_KEY, connectionId);
            pipeline.sync();
        } catch(JedisException e) {
            logger.warning("[Redis] Failure: {}", e.getMessage());
            throw new EventRepositoryException("could not remove subscriptions", e);
        }
    }

    public Set<String> listConnectionIds(final int limit) {
        final Set<String> ids = new LinkedHashSet<>();

        try (final Jedis jedis = cache.connect()) {
            final ScanParams params = new ScanParams().count(Math.min(limit, 1000));
            String cursor = ScanParams.SCAN_POINTER_START;
            do {
                final ScanResult<String> page = jedis.sscan(INDEX_KEY, cursor, params);
                for(final String id: page.getResult()) {
                    if( ids.size() >= limit ) break;
                    ids.add(id);
                }
                cursor = page.getCursor();
            } while( !ScanParams.SCAN_POINTER_START.equals(cursor) && ids.size() < limit );
        } catch(JedisException e) {
            logger.warning("[Redis] Failure: {}", e.getMessage());
            throw new EventRepositoryException("could not list subscriptions", e);
        }

        return ids;
    }

    public void deleteAll() {
        try (final Jedis jedis = cache.connect()) {
            final Set<String> ids = jedis.smembers(INDEX_KEY);

            final Pipeline pipeline = jedis.pipelined();
            ids.forEach(id -> pipeline.del(key(id)));
            pipeline.del(INDEX_KEY);
            pipeline.sync();

            logger.info("[Redis] {} subscription record(s) removed.", ids.size());
        } catch(JedisException e) {
            logger.warning("[Redis] Failure: {}", e.getMessage());
            throw new EventRepositoryException("could not remove subscriptions", e);
        }
    }

    public boolean isMaintenance() {
        try (final Jedis jedis = cache.connect()) {
            return "1".equals(jedis.get(MAINTENANCE_KEY));
        } catch(JedisException e) {
            logger.warning("[Redis] Failure: {}", e.getMessage());
            throw new EventRepositoryException("could not read maintenance flag", e);
        }
    }

    public void setMaintenance(final boolean maintenance) {
        try (final Jedis jedis = cache.connect()) {
            if( maintenance ) {
                jedis.set(MAINTENANCE_KEY, "1");
            } else {
                jedis.del(MAINTENANCE_KEY);
            }
        } catch(JedisException e) {
            logger.warning("[Redis] Failure: {}", e.getMessage());
            throw new EventRepositoryException("could not write maintenance flag", e);
        }
    }

    public byte close() {
        return 0;
    }

    /**
     * {@code {"<subscription id>": [<filter>, ...], ...}}
     */
    static String snapshot(final Map<String, List<ReqFilter>> subscriptions) {
        final JsonObject document = new JsonObject();
        subscriptions.forEach((subscriptionId, filters) -> {
            final JsonArray filterArray = new JsonArray();
            filters.forEach(filter -> filterArray.add(filter.toJson()));
            document.add(subscriptionId, filterArray);
        });

        return document.toString();
    }

    static String key(final String connectionId) {
        return "subscription#"+connectionId;
    }

}
