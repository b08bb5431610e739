package com.questrail.dtchat.codec;

/**
 * WireEnvelopeDecoder
 * -----------------------------------------------------------------------------
 * Inbound boundary between transport bytes and a {@link WireEnvelope}.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Validating wire-level structure</li>
 *   <li>Detecting truncation or corruption</li>
 *   <li>Rejecting envelopes that carry no payload variant</li>
 * </ul>
 *
 * <p>It does <strong>not</strong> validate timestamps, parse endpoints or
 * interpret the payload. Those are protocol concerns.</p>
 */
public interface WireEnvelopeDecoder
{
    /**
     * Decode exactly one envelope from a complete payload. Streaming or
     * accumulation across calls is not supported.
     *
     * @param data raw bytes delivered by the transport
     * @throws WireDecodeException if the bytes are not a well-formed envelope
     */
    WireEnvelope decode(byte[] data);
}
