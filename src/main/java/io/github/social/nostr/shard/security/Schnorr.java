package io.github.social.nostr.shard.security;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import io.github.social.nostr.shard.exceptions.UtilityInstantiationException;
import io.github.social.nostr.shard.utilities.Utils;

/**
 * BIP-340 Schnorr signature verification over secp256k1.
 *
 * @see https://github.com/bitcoin/bips/blob/master/bip-0340.mediawiki
 */
public final class Schnorr {
    static final BigInteger P = new BigInteger("FFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFEFFFFFC2F", 16);
    static final BigInteger N = new BigInteger("FFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFEBAAEDCE6AF48A03BBFD25E8CD0364141", 16);

    static final Point G = new Point(
        new BigInteger("79BE667EF9DCBBAC55A06295CE870B07029BFCDB2DCE28D959F2815B16F81798", 16),
        new BigInteger("483ADA7726A3C4655DA4FBFC0E1108A8FD17B448A68554199C47D08FFB10D4B8", 16));

    private static final BigInteger SEVEN = BigInteger.valueOf(7);
    private static final BigInteger TWO = BigInteger.valueOf(2);
    private static final BigInteger THREE = BigInteger.valueOf(3);

    private Schnorr() {
        throw new UtilityInstantiationException();
    }

    /**
     * @param pubkey 32-byte x-only public key
     * @param message 32-byte message (the event id)
     * @param signature 64-byte signature
     */
    public static boolean verify(final byte[] pubkey, final byte[] message, final byte[] signature) {
        if(pubkey.length != 32 || message.length != 32 || signature.length != 64) return false;

        final Point point = liftX(toInt(pubkey));
        if(point == null) return false;

        final BigInteger r = toInt(Arrays.copyOfRange(signature, 0, 32));
        final BigInteger s = toInt(Arrays.copyOfRange(signature, 32, 64));
        if(r.compareTo(P) >= 0 || s.compareTo(N) >= 0) return false;

        final BigInteger e = toInt(taggedHash(
            "BIP0340/challenge",
            concat(Arrays.copyOfRange(signature, 0, 32), pubkey, message))).mod(N);

        final Point rPoint = add(multiply(G, s), multiply(point, N.subtract(e)));

        return rPoint != null
            && !rPoint.y.testBit(0)
            && rPoint.x.equals(r);
    }

    static Point liftX(final BigInteger x) {
        if(x.compareTo(P) >= 0) return null;

        final BigInteger c = x.modPow(THREE, P).add(SEVEN).mod(P);
        final BigInteger y = c.modPow(P.add(BigInteger.ONE).shiftRight(2), P);
        if(!y.modPow(TWO, P).equals(c)) return null;

        return new Point(x, y.testBit(0) ? P.subtract(y) : y);
    }

    static byte[] taggedHash(final String tag, final byte[] data) {
        final byte[] tagHash = Utils.sha256(tag.getBytes(StandardCharsets.UTF_8));

        return Utils.sha256(concat(tagHash, tagHash, data));
    }

    /**
     * {@code null} stands for the point at infinity.
     */
    static Point add(final Point p1, final Point p2) {
        if(p1 == null) return p2;
        if(p2 == null) return p1;

        final BigInteger lambda;
        if(p1.x.equals(p2.x)) {
            if(!p1.y.equals(p2.y) || p1.y.signum() == 0) return null;

            lambda = THREE.multiply(p1.x).multiply(p1.x)
                .multiply(TWO.multiply(p1.y).modInverse(P))
                .mod(P);
        } else {
            lambda = p2.y.subtract(p1.y)
                .multiply(p2.x.subtract(p1.x).modInverse(P))
                .mod(P);
        }

        final BigInteger x3 = lambda.multiply(lambda).subtract(p1.x).subtract(p2.x).mod(P);
        final BigInteger y3 = lambda.multiply(p1.x.subtract(x3)).subtract(p1.y).mod(P);

        return new Point(x3, y3);
    }

    static Point multiply(final Point point, final BigInteger scalar) {
        Point result = null;
        Point addend = point;

        for(int i = 0; i < scalar.bitLength(); ++i) {
            if(scalar.testBit(i)) result = add(result, addend);
            addend = add(addend, addend);
        }

        return result;
    }

    static BigInteger toInt(final byte[] raw) {
        return new BigInteger(1, raw);
    }

    static byte[] toBytes(final BigInteger value) {
        final byte[] raw = value.toByteArray();
        if(raw.length == 32) return raw;

        final byte[] out = new byte[32];
        if(raw.length > 32) {
            System.arraycopy(raw, raw.length - 32, out, 0, 32);
        } else {
            System.arraycopy(raw, 0, out, 32 - raw.length, raw.length);
        }

        return out;
    }

    static byte[] concat(final byte[]... parts) {
        int length = 0;
        for(final byte[] part: parts) length += part.length;

        final byte[] out = new byte[length];
        int offset = 0;
        for(final byte[] part: parts) {
            System.arraycopy(part, 0, out, offset, part.length);
            offset += part.length;
        }

        return out;
    }

    static final class Point {
        final BigInteger x;
        final BigInteger y;

        Point(final BigInteger x, final BigInteger y) {
            this.x = x;
            this.y = y;
        }
    }

}
