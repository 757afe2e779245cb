package io.github.social.nostr.shard.datasource;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;

import io.github.social.nostr.shard.utilities.AppProperties;
import io.github.social.nostr.shard.utilities.LogService;

/**
 * MongoDB client holding the event index and the registration list.
 * <p>
 * The client is created on first use and shared; it owns its own connection pool.
 */
public class DocumentDS {
    private final LogService logger = LogService.getInstance(getClass().getCanonicalName());

    private final MongoClientSettings settings;
    private final String databaseName;

    private MongoClient client;
    private boolean closed = false;

    public DocumentDS(final String host, final int port, final String databaseName) {
        this.databaseName = databaseName;

        final String uri = "mongodb://"+host+":"+port+"/"+databaseName+"?maxPoolSize=20";
        logger.info("[MongoDB] Connecting to {}", uri);

        this.settings = MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString(uri))
                .build();
    }

    public static DocumentDS fromProperties() {
        return new DocumentDS(
            AppProperties.getMongoDbHost(),
            AppProperties.getMongoDbPort(),
            AppProperties.getMongoDbDatabase());
    }

    public synchronized MongoDatabase database() {
        if(this.closed) throw new IllegalStateException("datasource is closed");

        if(this.client == null) {
            this.client = MongoClients.create(this.settings);
        }

        return this.client.getDatabase(databaseName);
    }

    public synchronized byte close() {
        if(this.closed) return 0;
        this.closed = true;

        if(this.client != null) this.client.close();

        return logger.info("[MongoDB] Client closed.");
    }

}
