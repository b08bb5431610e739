package com.questrail.dtchat.codec;

import com.questrail.dtchat.api.Endpoint;
import com.questrail.dtchat.message.ChatMessage;
import com.questrail.dtchat.message.MessageContent;
import com.questrail.dtchat.time.ChatTime;

import java.util.Objects;
import java.util.UUID;

/**
 * WireEnvelope
 * -----------------------------------------------------------------------------
 * Flat, transport-neutral representation of one chat protocol datagram.
 *
 * <p>This is the unit the codec layer encodes and decodes. It carries no
 * semantic validation: empty strings, zero timestamps and unparseable endpoint
 * text are all representable. Interpretation (timestamp range, endpoint
 * parsing) happens in the protocol engine.</p>
 *
 * @param uuid            message identity (for Ack envelopes, the ack's own identity)
 * @param senderUuid      originating peer
 * @param roomUuid        room the message belongs to
 * @param timestampMillis send time (Text/File) or acknowledgement time (Ack), epoch millis
 * @param sourceEndpoint  sender endpoint in canonical text form
 * @param payload         Text, File or Ack
 */
public record WireEnvelope(String uuid,
                           String senderUuid,
                           String roomUuid,
                           long timestampMillis,
                           String sourceEndpoint,
                           WirePayload payload)
{
    public WireEnvelope {
        Objects.requireNonNull(uuid, "uuid");
        Objects.requireNonNull(senderUuid, "senderUuid");
        Objects.requireNonNull(roomUuid, "roomUuid");
        Objects.requireNonNull(sourceEndpoint, "sourceEndpoint");
        Objects.requireNonNull(payload, "payload");
    }

    /**
     * Builds the Text or File envelope carrying an outbound message.
     */
    public static WireEnvelope forMessage(ChatMessage message) {
        Objects.requireNonNull(message, "message");

        WirePayload payload;
        MessageContent content = message.content();
        if (content instanceof MessageContent.Text text) {
            payload = new WirePayload.Text(text.text());
        } else if (content instanceof MessageContent.File file) {
            payload = new WirePayload.File(file.name(), file.data());
        } else {
            throw new IllegalStateException("Unhandled content type: " + content.getClass());
        }

        return new WireEnvelope(
                message.uuid(),
                message.senderUuid(),
                message.roomUuid(),
                message.sendTime().timestampMillis(),
                message.sourceEndpoint().toString(),
                payload);
    }

    /**
     * Builds an Ack envelope for a received message. The ack receives a fresh uuid.
     *
     * @param acked         message being acknowledged
     * @param localPeerUuid identity of the acknowledging peer
     * @param ackTime       acknowledgement instant, applied by the original sender as its receive time
     * @param localEndpoint endpoint the ack is sent from
     */
    public static WireEnvelope ackFor(ChatMessage acked,
                                      String localPeerUuid,
                                      ChatTime ackTime,
                                      Endpoint localEndpoint) {
        Objects.requireNonNull(acked, "acked");
        Objects.requireNonNull(ackTime, "ackTime");
        Objects.requireNonNull(localEndpoint, "localEndpoint");

        return new WireEnvelope(
                UUID.randomUUID().toString(),
                localPeerUuid,
                acked.roomUuid(),
                ackTime.timestampMillis(),
                localEndpoint.toString(),
                new WirePayload.Ack(acked.uuid()));
    }
}
