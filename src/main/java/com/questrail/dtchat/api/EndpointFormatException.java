package com.questrail.dtchat.api;

/**
 * Indicates that a textual endpoint could not be parsed into an {@link Endpoint}.
 */
public final class EndpointFormatException extends RuntimeException
{
    public EndpointFormatException(String message) {
        super(message);
    }
}
