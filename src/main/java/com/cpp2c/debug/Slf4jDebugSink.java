package com.cpp2c.debug;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default sink: one SLF4J logger per tag, named {@code cpp2c.<tag>}.
 */
public final class Slf4jDebugSink implements DebugSink {

    private static final String LOGGER_PREFIX = "cpp2c.";

    private final Map<String, Logger> loggers = new ConcurrentHashMap<>();

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        Logger logger = loggers.computeIfAbsent(tag == null ? "root" : tag,
                t -> LoggerFactory.getLogger(LOGGER_PREFIX + t));
        switch (level) {
            case TRACE:
                logger.trace(message, error);
                break;
            case DEBUG:
                logger.debug(message, error);
                break;
            case INFO:
                logger.info(message, error);
                break;
            case WARN:
                logger.warn(message, error);
                break;
            default:
                logger.error(message, error);
        }
    }
}
