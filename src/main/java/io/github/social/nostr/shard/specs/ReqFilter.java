package io.github.social.nostr.shard.specs;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import io.github.social.nostr.shard.exceptions.UnsupportedFilterException;
import io.github.social.nostr.shard.utilities.Utils;

/**
 * Immutable subscription filter.
 * <p>
 * Absent fields impose no constraint; a present but empty set matches nothing.
 * Identifiers ({@code ids}, {@code authors} and the hex tag letters) are
 * lower-cased on the way in, so they compare case-insensitively.
 */
public final class ReqFilter {
    /** Tag letters the storage layer indexes. */
    public static final Set<String> INDEXED_TAGS = Collections.unmodifiableSet(new LinkedHashSet<>(
        Arrays.asList("a", "d", "e", "g", "i", "k", "l", "p", "q", "r", "t", "E", "K", "L", "P")));

    /** Subset of {@link #INDEXED_TAGS} holding event ids or pubkeys. */
    public static final Set<String> HEX_TAGS = Collections.unmodifiableSet(new LinkedHashSet<>(
        Arrays.asList("e", "p", "q", "E", "P")));

    private final Set<String> ids;
    private final Set<String> authors;
    private final Set<Integer> kinds;
    private final Map<String, Set<String>> tags;
    private final Long since;
    private final Long until;
    private final Integer limit;

    private final JsonObject json;

    private ReqFilter(final Builder builder) {
        this.ids = freeze(builder.ids);
        this.authors = freeze(builder.authors);
        this.kinds = freeze(builder.kinds);
        this.since = builder.since;
        this.until = builder.until;
        this.limit = builder.limit;

        final Map<String, Set<String>> tagMap = new LinkedHashMap<>();
        builder.tags.forEach((letter, values) -> tagMap.put(letter, Collections.unmodifiableSet(new LinkedHashSet<>(values))));
        this.tags = Collections.unmodifiableMap(tagMap);

        this.json = this.buildJson();
    }

    /**
     * Structural-support check and normalization of one REQ filter.
     */
    public static ReqFilter of(final JsonElement element) throws UnsupportedFilterException {
        if( element == null || !element.isJsonObject() ) {
            throw new UnsupportedFilterException("filter must be a json object");
        }

        final Builder builder = builder();

        for(final Map.Entry<String, JsonElement> entry: element.getAsJsonObject().entrySet()) {
            final String key = entry.getKey();
            final JsonElement value = entry.getValue();

            switch(key) {
                case "ids":
                    builder.ids = hexValues(key, value);
                    break;
                case "authors":
                    builder.authors = hexValues(key, value);
                    break;
                case "kinds":
                    builder.kinds = new LinkedHashSet<>();
                    for(final JsonElement kind: array(key, value)) {
                        final long n = nonNegative(key, kind);
                        if( n > Integer.MAX_VALUE ) throw new UnsupportedFilterException("'kinds' out of range");
                        builder.kinds.add((int) n);
                    }
                    break;
                case "since":
                    builder.since = nonNegative(key, value);
                    break;
                case "until":
                    builder.until = nonNegative(key, value);
                    break;
                case "limit":
                    builder.limit = (int) Math.min(nonNegative(key, value), Integer.MAX_VALUE);
                    break;
                default:
                    if( key.length() != 2 || key.charAt(0) != '#' || !INDEXED_TAGS.contains(key.substring(1)) ) {
                        throw new UnsupportedFilterException("unsupported filter key '" + key + "'");
                    }
                    final String letter = key.substring(1);
                    builder.tags.put(letter, HEX_TAGS.contains(letter) ? hexValues(key, value) : stringValues(key, value));
                    break;
            }
        }

        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Set<String>> getIds() {
        return Optional.ofNullable(ids);
    }

    public Optional<Set<String>> getAuthors() {
        return Optional.ofNullable(authors);
    }

    public Optional<Set<Integer>> getKinds() {
        return Optional.ofNullable(kinds);
    }

    /**
     * Tag letter (without {@code #}) to accepted values.
     */
    public Map<String, Set<String>> getTags() {
        return tags;
    }

    public Optional<Long> getSince() {
        return Optional.ofNullable(since);
    }

    public Optional<Long> getUntil() {
        return Optional.ofNullable(until);
    }

    public Optional<Integer> getLimit() {
        return Optional.ofNullable(limit);
    }

    /**
     * Only {@code ids} (and optionally {@code limit}) are present.
     */
    public boolean isIdsOnly() {
        return ids != null
            && authors == null
            && kinds == null
            && tags.isEmpty()
            && since == null
            && until == null;
    }

    public JsonObject toJson() {
        return this.json.deepCopy();
    }

    public String toString() {
        return json.toString();
    }

    private JsonObject buildJson() {
        final JsonObject out = new JsonObject();
        if( ids != null ) out.add("ids", toArray(ids));
        if( authors != null ) out.add("authors", toArray(authors));
        if( kinds != null ) {
            final JsonArray kindArray = new JsonArray();
            kinds.forEach(kindArray::add);
            out.add("kinds", kindArray);
        }
        tags.forEach((letter, values) -> out.add("#" + letter, toArray(values)));
        if( since != null ) out.addProperty("since", since);
        if( until != null ) out.addProperty("until", until);
        if( limit != null ) out.addProperty("limit", limit);

        return out;
    }

    private static JsonArray toArray(final Set<String> values) {
        final JsonArray array = new JsonArray();
        values.forEach(array::add);
        return array;
    }

    private static <T> Set<T> freeze(final Set<T> values) {
        return values == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    private static JsonArray array(final String key, final JsonElement value) throws UnsupportedFilterException {
        if( value == null || !value.isJsonArray() ) {
            throw new UnsupportedFilterException("'" + key + "' must be an array");
        }
        return value.getAsJsonArray();
    }

    private static Set<String> stringValues(final String key, final JsonElement value) throws UnsupportedFilterException {
        final Set<String> values = new LinkedHashSet<>();
        for(final JsonElement element: array(key, value)) {
            if( !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString() ) {
                throw new UnsupportedFilterException("'" + key + "' values must be strings");
            }
            values.add(element.getAsString());
        }
        return values;
    }

    private static Set<String> hexValues(final String key, final JsonElement value) throws UnsupportedFilterException {
        final Set<String> values = new LinkedHashSet<>();
        for(final String raw: stringValues(key, value)) {
            final String hex = raw.toLowerCase(Locale.ROOT);
            if( !Utils.isHex64(hex) ) {
                throw new UnsupportedFilterException("'" + key + "' values must be 32-byte hex strings");
            }
            values.add(hex);
        }
        return values;
    }

    private static long nonNegative(final String key, final JsonElement value) throws UnsupportedFilterException {
        if( value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber() ) {
            throw new UnsupportedFilterException("'" + key + "' must be a number");
        }

        final JsonPrimitive primitive = value.getAsJsonPrimitive();
        final long n;
        try {
            n = primitive.getAsBigDecimal().longValueExact();
        } catch(ArithmeticException failure) {
            throw new UnsupportedFilterException("'" + key + "' must be an integer");
        }
        if( n < 0 ) throw new UnsupportedFilterException("'" + key + "' must not be negative");

        return n;
    }

    public static final class Builder {
        private Set<String> ids;
        private Set<String> authors;
        private Set<Integer> kinds;
        private final Map<String, Set<String>> tags = new LinkedHashMap<>();
        private Long since;
        private Long until;
        private Integer limit;

        private Builder() { /***/ }

        public Builder ids(final String... values) {
            this.ids = new LinkedHashSet<>(Arrays.asList(values));
            return this;
        }

        public Builder authors(final String... values) {
            this.authors = new LinkedHashSet<>(Arrays.asList(values));
            return this;
        }

        public Builder kinds(final Integer... values) {
            this.kinds = new LinkedHashSet<>(Arrays.asList(values));
            return this;
        }

        public Builder tag(final String letter, final String... values) {
            this.tags.put(letter, new LinkedHashSet<>(Arrays.asList(values)));
            return this;
        }

        public Builder since(final long value) {
            this.since = value;
            return this;
        }

        public Builder until(final long value) {
            this.until = value;
            return this;
        }

        public Builder limit(final int value) {
            this.limit = value;
            return this;
        }

        public ReqFilter build() {
            return new ReqFilter(this);
        }
    }

}
