package io.github.social.nostr.shard.utilities;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logging facade used across the relay.
 * <p>
 * Messages accept SLF4J {@code {}} placeholders ({@link #info(String, Object...)})
 * or {@link String#format} patterns ({@link #infof(String, Object...)}).
 * Every method returns {@code 0} so callers may {@code return logger.info(...)}
 * from handlers that report a status byte.
 */
public final class LogService {
    private static final Map<String, LogService> instances = new ConcurrentHashMap<>();

    private final Logger logger;

    private LogService(final String name) {
        this.logger = LoggerFactory.getLogger(name);
    }

    public static LogService getInstance(final String name) {
        return instances.computeIfAbsent(name, LogService::new);
    }

    public byte info(final String message, final Object... args) {
        logger.info(message, args);
        return 0;
    }

    public byte warning(final String message, final Object... args) {
        logger.warn(message, args);
        return 0;
    }

    public byte error(final String message, final Object... args) {
        logger.error(message, args);
        return 0;
    }

    public byte debug(final String message, final Object... args) {
        logger.debug(message, args);
        return 0;
    }

    public byte infof(final String pattern, final Object... args) {
        if(logger.isInfoEnabled()) logger.info(String.format(pattern, args));
        return 0;
    }

    public byte warningf(final String pattern, final Object... args) {
        if(logger.isWarnEnabled()) logger.warn(String.format(pattern, args));
        return 0;
    }

}
