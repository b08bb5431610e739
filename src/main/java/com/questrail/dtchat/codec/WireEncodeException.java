package com.questrail.dtchat.codec;

/**
 * Indicates that a {@link WireEnvelope} cannot be represented on the wire,
 * for example because a string field is not valid UTF-16.
 */
public final class WireEncodeException extends RuntimeException
{
    public WireEncodeException(String message) {
        super(message);
    }

    public WireEncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
