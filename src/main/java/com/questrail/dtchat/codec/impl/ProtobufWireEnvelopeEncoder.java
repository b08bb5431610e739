package com.questrail.dtchat.codec.impl;

import com.google.protobuf.ByteString;
import com.questrail.dtchat.codec.WireEncodeException;
import com.questrail.dtchat.codec.WireEnvelope;
import com.questrail.dtchat.codec.WireEnvelopeEncoder;
import com.questrail.dtchat.codec.WirePayload;
import com.questrail.dtchat.codec.proto.AckPayload;
import com.questrail.dtchat.codec.proto.Envelope;
import com.questrail.dtchat.codec.proto.FilePayload;
import com.questrail.dtchat.codec.proto.TextPayload;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * ProtobufWireEnvelopeEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link WireEnvelopeEncoder} over the generated
 * {@link Envelope} message.
 *
 * <p>Every string is checked before it is handed to protobuf-java, which would
 * otherwise replace unpaired surrogates with {@code '?'} and silently alter
 * the message. Such a string is a {@link WireEncodeException}.</p>
 */
public final class ProtobufWireEnvelopeEncoder implements WireEnvelopeEncoder
{
    @Override
    public byte[] encode(WireEnvelope envelope)
    {
        Objects.requireNonNull(envelope, "envelope");

        Envelope.Builder out = Envelope.newBuilder()
                .setUuid(wellFormed("uuid", envelope.uuid()))
                .setSenderUuid(wellFormed("sender_uuid", envelope.senderUuid()))
                .setTimestamp(envelope.timestampMillis())
                .setRoomUuid(wellFormed("room_uuid", envelope.roomUuid()))
                .setSourceEndpoint(wellFormed("source_endpoint", envelope.sourceEndpoint()));

        WirePayload payload = envelope.payload();
        if (payload instanceof WirePayload.Text text) {
            out.setText(TextPayload.newBuilder()
                    .setText(wellFormed("text", text.text())));
        } else if (payload instanceof WirePayload.Ack ack) {
            out.setAck(AckPayload.newBuilder()
                    .setMessageUuid(wellFormed("message_uuid", ack.messageUuid())));
        } else if (payload instanceof WirePayload.File file) {
            out.setFile(FilePayload.newBuilder()
                    .setName(wellFormed("name", file.name()))
                    .setData(ByteString.copyFrom(file.data())));
        } else {
            throw new WireEncodeException("Unsupported payload type: " + payload.getClass().getName());
        }

        return out.build().toByteArray();
    }

    private static String wellFormed(String field, String value)
    {
        if (!StandardCharsets.UTF_8.newEncoder().canEncode(value)) {
            throw new WireEncodeException("Field " + field + " is not valid UTF-16 (unpaired surrogate)");
        }
        return value;
    }
}
