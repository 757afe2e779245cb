package io.github.social.nostr.shard.security;

import java.util.regex.Pattern;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;

import io.github.social.nostr.shard.specs.EventData;
import io.github.social.nostr.shard.utilities.LogService;
import io.github.social.nostr.shard.utilities.Utils;

/**
 * Structural and cryptographic validity of an event.
 * <p>
 * Fails closed: any anomaly yields {@code false}, nothing is thrown.
 */
public class EventValidator {
    private final LogService logger = LogService.getInstance(getClass().getCanonicalName());

    private static final Pattern HEX_128 = Pattern.compile("^[0-9a-f]{128}$");

    public boolean validate(final EventData eventData) {
        try {
            return doValidate(eventData);
        } catch(RuntimeException | DecoderException failure) {
            logger.warning(
                "[Nostr] [Validation] event rejected: {}: {}",
                failure.getClass().getCanonicalName(),
                failure.getMessage());
            return false;
        }
    }

    private boolean doValidate(final EventData eventData) throws DecoderException {
        if( eventData == null ) return false;

        if( !Utils.isHex64(eventData.getId()) ) return false;
        if( !Utils.isHex64(eventData.getPubkey()) ) return false;
        if( !HEX_128.matcher(eventData.getSig()).matches() ) return false;

        if( !eventData.getId().equals(eventData.computeId()) ) {
            logger.info("[Nostr] [Validation] event {} does not match its content hash.", eventData.getId());
            return false;
        }

        return Schnorr.verify(
            Hex.decodeHex(eventData.getPubkey()),
            Hex.decodeHex(eventData.getId()),
            Hex.decodeHex(eventData.getSig()));
    }

}
