package io.github.social.nostr.shard.utilities;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.regex.Pattern;

import org.apache.commons.codec.binary.Hex;

import io.github.social.nostr.shard.exceptions.UtilityInstantiationException;

public final class Utils {
	private static final SecureRandom random = new SecureRandom();

	private static final Pattern HEX_64 = Pattern.compile("^[0-9a-f]{64}$");

	private Utils() {
		throw new UtilityInstantiationException();
	}

	@SafeVarargs
	public static <T> T nullValue(final T... options) {
		for(final T q: options) {
			if(q != null) { return q; }
		}
		throw new IllegalArgumentException("At least one non-null arg must be provided");
	}

	public static String secWebsocketAccept(final String secWebSocketKey) {
		final String data = secWebSocketKey + Constants.WEBSOCKET_UUID;

		final MessageDigest md;
		try {
			md = MessageDigest.getInstance("SHA-1");
		} catch(NoSuchAlgorithmException failure) {
			throw new IllegalStateException(failure);
		}

		md.update(data.getBytes(StandardCharsets.US_ASCII));

		return Base64.getEncoder().encodeToString(md.digest());
	}

	public static byte[] sha256(final byte[] source) {
		try {
			return MessageDigest.getInstance("SHA-256").digest(source);
		} catch(NoSuchAlgorithmException e) {
			throw new IllegalStateException(e);
		}
	}

	public static String sha256Hex(final byte[] source) {
		return Hex.encodeHexString(sha256(source));
	}

	/**
	 * Unguessable one-time token, used as authentication challenge.
	 */
	public static String secureHash() {
		final byte[] key = new byte[1024];
		random.nextBytes(key);

		return sha256Hex(key);
	}

	/**
	 * Lower-case, 32-byte hex string.
	 */
	public static boolean isHex64(final String value) {
		return value != null && HEX_64.matcher(value).matches();
	}

}
