package io.github.social.nostr.shard.security;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import io.github.social.nostr.shard.specs.EventData;

/**
 * BIP-340 signer for building valid events in tests.
 */
public final class TestSigner {
    private final BigInteger secret;
    private final Schnorr.Point point;

    public TestSigner(final BigInteger secret) {
        this.secret = secret;
        this.point = Schnorr.multiply(Schnorr.G, secret);
    }

    public static TestSigner of(final long secret) {
        return new TestSigner(BigInteger.valueOf(secret));
    }

    public String pubkey() {
        return Hex.encodeHexString(Schnorr.toBytes(point.x));
    }

    public byte[] sign(final byte[] message, final byte[] aux) {
        final byte[] px = Schnorr.toBytes(point.x);
        final BigInteger d = point.y.testBit(0) ? Schnorr.N.subtract(secret) : secret;

        final byte[] t = xor(Schnorr.toBytes(d), Schnorr.taggedHash("BIP0340/aux", aux));
        final BigInteger k0 = Schnorr.toInt(Schnorr.taggedHash("BIP0340/nonce", Schnorr.concat(t, px, message)))
            .mod(Schnorr.N);

        final Schnorr.Point r = Schnorr.multiply(Schnorr.G, k0);
        final BigInteger k = r.y.testBit(0) ? Schnorr.N.subtract(k0) : k0;
        final byte[] rx = Schnorr.toBytes(r.x);

        final BigInteger e = Schnorr.toInt(Schnorr.taggedHash("BIP0340/challenge", Schnorr.concat(rx, px, message)))
            .mod(Schnorr.N);

        return Schnorr.concat(rx, Schnorr.toBytes(k.add(e.multiply(d)).mod(Schnorr.N)));
    }

    public EventData event(final int kind, final long createdAt, final List<List<String>> tags, final String content) {
        final JsonObject json = new JsonObject();
        json.addProperty("id", "");
        json.addProperty("pubkey", pubkey());
        json.addProperty("created_at", createdAt);
        json.addProperty("kind", kind);
        final JsonArray tagArray = new JsonArray();
        for(final List<String> tag: tags) {
            final JsonArray entry = new JsonArray();
            tag.forEach(entry::add);
            tagArray.add(entry);
        }
        json.add("tags", tagArray);
        json.addProperty("content", content);
        json.addProperty("sig", "");

        final String id = EventData.of(json).computeId();
        json.addProperty("id", id);
        try {
            json.addProperty("sig", Hex.encodeHexString(sign(Hex.decodeHex(id), new byte[32])));
        } catch(DecoderException failure) {
            throw new IllegalStateException(failure);
        }

        return EventData.of(json);
    }

    public EventData event(final int kind, final long createdAt, final String content) {
        return event(kind, createdAt, Arrays.asList(), content);
    }

    private static byte[] xor(final byte[] a, final byte[] b) {
        final byte[] out = new byte[a.length];
        for(int i = 0; i < a.length; ++i) {
            out[i] = (byte) (a[i] ^ b[i]);
        }
        return out;
    }

}
