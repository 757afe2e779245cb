package io.github.social.nostr.shard.server;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import com.google.gson.JsonArray;
import com.google.gson.JsonParser;

import io.github.social.nostr.shard.session.Connection;

/**
 * Connected context that records every frame sent to it.
 */
public class RecordingContext extends WebsocketContext {
    private final List<JsonArray> frames = new CopyOnWriteArrayList<>();
    private final String url;

    private volatile boolean closeRequested = false;

    public RecordingContext(final String url) {
        this.url = url;
        this.connect();
    }

    /**
     * Context with a session record already attached, for use without a relay controller.
     */
    public static RecordingContext attached(final String url) {
        return withSession(new RecordingContext(url));
    }

    public static <T extends RecordingContext> T withSession(final T context) {
        context.attach(new Connection(context.getContextID().toString(), "127.0.0.1", context.getUrl()));
        return context;
    }

    public String getRemoteAddress() {
        return "127.0.0.1";
    }

    public String getUserAgent() {
        return "junit";
    }

    public String getUrl() {
        return url;
    }

    public byte send(final String message) {
        frames.add(JsonParser.parseString(message).getAsJsonArray());
        return 0;
    }

    public byte requestClose() {
        this.closeRequested = true;
        return 0;
    }

    public void drop() {
        this.disconnect();
    }

    public boolean isCloseRequested() {
        return closeRequested;
    }

    public List<JsonArray> frames() {
        return new ArrayList<>(frames);
    }

    public List<JsonArray> frames(final String type) {
        return frames
            .stream()
            .filter(frame -> type.equals(frame.get(0).getAsString()))
            .collect(Collectors.toList());
    }

    public JsonArray last() {
        return frames.get(frames.size() - 1);
    }

    public JsonArray last(final String type) {
        final List<JsonArray> matching = frames(type);
        return matching.isEmpty() ? null : matching.get(matching.size() - 1);
    }

    public void clear() {
        frames.clear();
    }

}
