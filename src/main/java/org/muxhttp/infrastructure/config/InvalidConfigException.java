package org.muxhttp.infrastructure.config;

/**
 * Thrown if configuration is unreadable or a value is out of range (e.g. a port above 65535).
 */
public class InvalidConfigException extends RuntimeException {
    public InvalidConfigException(String message) {
        super(message);
    }
    public InvalidConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
