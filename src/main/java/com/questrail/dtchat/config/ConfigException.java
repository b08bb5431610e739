package com.questrail.dtchat.config;

/**
 * Configuration could not be read or is inconsistent.
 */
public final class ConfigException extends RuntimeException
{
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
