package io.github.social.nostr.shard.service;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.bson.Document;

import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;

import io.github.social.nostr.shard.datasource.DocumentDS;
import io.github.social.nostr.shard.def.IRegistrationService;
import io.github.social.nostr.shard.utilities.LogService;

/**
 * Registered authors from the MongoDB {@code registration} collection
 * ({@code {pubkey: <hex>}} documents), reloaded every minute.
 */
public class RegistrationDocumentService implements IRegistrationService {
    private final LogService logger = LogService.getInstance(getClass().getCanonicalName());

    static final String COLLECTION = "registration";

    private final ScheduledExecutorService scheduledTask = Executors.newSingleThreadScheduledExecutor();

    private final Set<String> registration = new HashSet<>();

    private final DocumentDS datasource;

    public RegistrationDocumentService(final DocumentDS datasource) {
        this.datasource = datasource;
    }

    public byte start() {
        scheduledTask.scheduleAtFixedRate(this::refreshRegistration, 0, 60000, TimeUnit.MILLISECONDS);

        return 0;
    }

    public boolean isRegistered(final String pubkey) {
        synchronized(registration) {
            return registration.contains(pubkey);
        }
    }

    private byte refreshRegistration() {
        final Set<String> current;
        try {
            current = acquireRegistrationFromStorage();
        } catch(MongoException e) {
            return logger.warning("[MongoDB] Could not fetch registrations: {}", e.getMessage());
        }

        synchronized(registration) {
            registration.clear();
            registration.addAll(current);
        }

        return logger.debug("[MongoDB] {} registered author(s)", current.size());
    }

    private Set<String> acquireRegistrationFromStorage() {
        final Set<String> pubkeys = new LinkedHashSet<>();

        final MongoCollection<Document> registrationDB = datasource.database().getCollection(COLLECTION);
        try(final MongoCursor<Document> cursor = registrationDB.find().cursor()) {
            cursor.forEachRemaining(document -> {
                final Object pubkey = document.get("pubkey");
                if( pubkey != null ) pubkeys.add(pubkey.toString().toLowerCase());
            });
        }

        return pubkeys;
    }

    public byte close() {
        scheduledTask.shutdown();
        return 0;
    }

}
