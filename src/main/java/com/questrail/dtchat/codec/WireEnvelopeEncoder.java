package com.questrail.dtchat.codec;

/**
 * WireEnvelopeEncoder
 * -----------------------------------------------------------------------------
 * Outbound boundary between a {@link WireEnvelope} and transport bytes.
 *
 * <p>The encoder does not decide what to send or where. It only applies the
 * mechanical wire rules. The returned array is suitable for immediate
 * transmission by any transport without further modification.</p>
 */
public interface WireEnvelopeEncoder
{
    /**
     * Encode one envelope into a complete wire payload.
     *
     * @throws WireEncodeException if a field cannot be represented on the wire
     */
    byte[] encode(WireEnvelope envelope);
}
