package com.questrail.dtchat.codec;

/**
 * Indicates that received bytes could not be decoded into a {@link WireEnvelope}.
 *
 * This typically reflects:
 * <ul>
 *   <li>Truncated input</li>
 *   <li>Malformed tags, varints or length prefixes</li>
 *   <li>An envelope carrying no payload variant</li>
 * </ul>
 */
public final class WireDecodeException extends RuntimeException
{
    public WireDecodeException(String message) {
        super(message);
    }

    public WireDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
