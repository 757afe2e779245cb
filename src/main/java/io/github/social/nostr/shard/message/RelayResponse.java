package io.github.social.nostr.shard.message;

import java.util.Arrays;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import io.github.social.nostr.shard.exceptions.UtilityInstantiationException;

/**
 * Outbound relay frames.
 */
public final class RelayResponse {
    private static final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

    private RelayResponse() {
        throw new UtilityInstantiationException();
    }

    public static String ok(final String eventId, final boolean accepted, final String message) {
        return gson.toJson(Arrays.asList("OK", eventId, accepted, message));
    }

    public static String notice(final String message) {
        return gson.toJson(Arrays.asList("NOTICE", message));
    }

    public static String closed(final String subscriptionId, final String message) {
        return gson.toJson(Arrays.asList("CLOSED", subscriptionId, message));
    }

    public static String eose(final String subscriptionId) {
        return gson.toJson(Arrays.asList("EOSE", subscriptionId));
    }

    public static String auth(final String challenge) {
        return gson.toJson(Arrays.asList("AUTH", challenge));
    }

    public static String event(final String subscriptionId, final JsonObject event) {
        final JsonArray frame = new JsonArray();
        frame.add("EVENT");
        frame.add(subscriptionId);
        frame.add(event);

        return gson.toJson(frame);
    }

}
