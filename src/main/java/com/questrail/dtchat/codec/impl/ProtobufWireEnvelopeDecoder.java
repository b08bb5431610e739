package com.questrail.dtchat.codec.impl;

import com.google.protobuf.InvalidProtocolBufferException;
import com.questrail.dtchat.codec.WireDecodeException;
import com.questrail.dtchat.codec.WireEnvelope;
import com.questrail.dtchat.codec.WireEnvelopeDecoder;
import com.questrail.dtchat.codec.WirePayload;
import com.questrail.dtchat.codec.proto.Envelope;

import java.util.Objects;

/**
 * ProtobufWireEnvelopeDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link WireEnvelopeDecoder} over the generated
 * {@link Envelope} message.
 *
 * <p>Parsing is protobuf-java's: unknown fields and fields with an unexpected
 * wire type are skipped, strings must be valid UTF-8, and the last payload
 * variant seen replaces any earlier one. On top of that an envelope with no
 * payload at all is rejected.</p>
 */
public final class ProtobufWireEnvelopeDecoder implements WireEnvelopeDecoder
{
    @Override
    public WireEnvelope decode(byte[] data)
    {
        Objects.requireNonNull(data, "data");

        Envelope in;
        try {
            in = Envelope.parseFrom(data);
        }
        catch (InvalidProtocolBufferException e) {
            throw new WireDecodeException("Malformed envelope: " + e.getMessage(), e);
        }

        return new WireEnvelope(
                in.getUuid(),
                in.getSenderUuid(),
                in.getRoomUuid(),
                in.getTimestamp(),
                in.getSourceEndpoint(),
                payload(in));
    }

    private static WirePayload payload(Envelope in)
    {
        switch (in.getPayloadCase()) {
            case TEXT:
                return new WirePayload.Text(in.getText().getText());
            case ACK:
                return new WirePayload.Ack(in.getAck().getMessageUuid());
            case FILE:
                return new WirePayload.File(in.getFile().getName(), in.getFile().getData().toByteArray());
            default:
                throw new WireDecodeException("Envelope carries no payload");
        }
    }
}
