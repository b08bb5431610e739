package com.questrail.dtchat.message;

import com.questrail.dtchat.api.Endpoint;
import com.questrail.dtchat.codec.WireEnvelope;
import com.questrail.dtchat.time.ChatTime;
import com.questrail.dtchat.time.WallClock;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * ChatMessage
 * -----------------------------------------------------------------------------
 * Immutable record of one chat message, outbound or inbound.
 *
 * <p>Lifecycle changes never mutate an instance. The {@code with*} and
 * {@code marked*} methods return copies; the store decides which copy
 * replaces the stored one (see {@link MessageStatus#canTransitionTo}).</p>
 *
 * <h2>Timestamps</h2>
 * <ul>
 *   <li>{@code sendTime}: when the author created the message</li>
 *   <li>{@code sendCompleted}: when the local transport reported completion
 *       (inbound messages copy the sender's timestamp here)</li>
 *   <li>{@code predictedArrivalTime}: advisory delivery-time estimate</li>
 *   <li>{@code receiveTime}: for outbound messages, the peer's acknowledgement
 *       time; for inbound messages, local reception time</li>
 * </ul>
 */
public final class ChatMessage
{
    private final String uuid;
    private final String senderUuid;
    private final String roomUuid;
    private final MessageContent content;
    private final Endpoint sourceEndpoint;
    private final ChatTime sendTime;
    private final ChatTime sendCompleted;
    private final ChatTime predictedArrivalTime;
    private final ChatTime receiveTime;
    private final MessageStatus status;

    private ChatMessage(String uuid,
                        String senderUuid,
                        String roomUuid,
                        MessageContent content,
                        Endpoint sourceEndpoint,
                        ChatTime sendTime,
                        ChatTime sendCompleted,
                        ChatTime predictedArrivalTime,
                        ChatTime receiveTime,
                        MessageStatus status) {
        this.uuid = Objects.requireNonNull(uuid, "uuid");
        this.senderUuid = Objects.requireNonNull(senderUuid, "senderUuid");
        this.roomUuid = Objects.requireNonNull(roomUuid, "roomUuid");
        this.content = Objects.requireNonNull(content, "content");
        this.sourceEndpoint = Objects.requireNonNull(sourceEndpoint, "sourceEndpoint");
        this.sendTime = Objects.requireNonNull(sendTime, "sendTime");
        this.sendCompleted = sendCompleted;
        this.predictedArrivalTime = predictedArrivalTime;
        this.receiveTime = receiveTime;
        this.status = Objects.requireNonNull(status, "status");
    }

    /**
     * Creates a locally authored message in {@link MessageStatus#SENDING} with a fresh uuid.
     */
    public static ChatMessage newToSend(String senderUuid,
                                        String roomUuid,
                                        MessageContent content,
                                        Endpoint sourceEndpoint,
                                        WallClock clock) {
        Objects.requireNonNull(clock, "clock");
        return new ChatMessage(
                UUID.randomUUID().toString(),
                senderUuid,
                roomUuid,
                content,
                sourceEndpoint,
                clock.chatNow(),
                null,
                null,
                null,
                MessageStatus.SENDING);
    }

    /**
     * Builds the inbound form of a decoded Text or File envelope.
     *
     * @return empty if the envelope timestamp is outside the representable range
     *         or its source endpoint cannot be parsed
     */
    public static Optional<ChatMessage> newReceived(WireEnvelope envelope,
                                                    MessageContent content,
                                                    WallClock clock) {
        Objects.requireNonNull(envelope, "envelope");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(clock, "clock");

        Optional<ChatTime> sent = ChatTime.fromTimestampMillis(envelope.timestampMillis());
        Optional<Endpoint> source = Endpoint.tryParse(envelope.sourceEndpoint());
        if (sent.isEmpty() || source.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(new ChatMessage(
                envelope.uuid(),
                envelope.senderUuid(),
                envelope.roomUuid(),
                content,
                source.get(),
                sent.get(),
                sent.get(),
                null,
                clock.chatNow(),
                MessageStatus.RECEIVED));
    }

    public String uuid() {
        return uuid;
    }

    public String senderUuid() {
        return senderUuid;
    }

    public String roomUuid() {
        return roomUuid;
    }

    public MessageContent content() {
        return content;
    }

    public Endpoint sourceEndpoint() {
        return sourceEndpoint;
    }

    public ChatTime sendTime() {
        return sendTime;
    }

    public Optional<ChatTime> sendCompleted() {
        return Optional.ofNullable(sendCompleted);
    }

    public Optional<ChatTime> predictedArrivalTime() {
        return Optional.ofNullable(predictedArrivalTime);
    }

    public Optional<ChatTime> receiveTime() {
        return Optional.ofNullable(receiveTime);
    }

    public MessageStatus status() {
        return status;
    }

    public DeliveryTimestamps deliveryTimestamps() {
        return new DeliveryTimestamps(
                sendTime.timestampMillis(),
                predictedArrivalTime == null ? OptionalLong.empty() : OptionalLong.of(predictedArrivalTime.timestampMillis()),
                receiveTime == null ? OptionalLong.empty() : OptionalLong.of(receiveTime.timestampMillis()));
    }

    public boolean isAuthoredBy(String peerUuid) {
        return senderUuid.equals(peerUuid);
    }

    public ChatMessage withStatus(MessageStatus newStatus) {
        return new ChatMessage(uuid, senderUuid, roomUuid, content, sourceEndpoint,
                sendTime, sendCompleted, predictedArrivalTime, receiveTime, newStatus);
    }

    public ChatMessage withPredictedArrival(ChatTime predicted) {
        return new ChatMessage(uuid, senderUuid, roomUuid, content, sourceEndpoint,
                sendTime, sendCompleted, predicted, receiveTime, status);
    }

    /**
     * Records transport completion. A message already acknowledged keeps its status.
     */
    public ChatMessage markedSent(ChatTime completed) {
        Objects.requireNonNull(completed, "completed");
        MessageStatus next = status == MessageStatus.RECEIVED_BY_PEER ? status : MessageStatus.SENT;
        return new ChatMessage(uuid, senderUuid, roomUuid, content, sourceEndpoint,
                sendTime, completed, predictedArrivalTime, receiveTime, next);
    }

    public ChatMessage markedAcked(ChatTime ackTime) {
        Objects.requireNonNull(ackTime, "ackTime");
        return new ChatMessage(uuid, senderUuid, roomUuid, content, sourceEndpoint,
                sendTime, sendCompleted, predictedArrivalTime, ackTime, MessageStatus.RECEIVED_BY_PEER);
    }

    public ChatMessage markedFailed() {
        return withStatus(MessageStatus.FAILED);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChatMessage that)) return false;
        return uuid.equals(that.uuid)
                && senderUuid.equals(that.senderUuid)
                && roomUuid.equals(that.roomUuid)
                && content.equals(that.content)
                && sourceEndpoint.equals(that.sourceEndpoint)
                && sendTime.equals(that.sendTime)
                && Objects.equals(sendCompleted, that.sendCompleted)
                && Objects.equals(predictedArrivalTime, that.predictedArrivalTime)
                && Objects.equals(receiveTime, that.receiveTime)
                && status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(uuid, senderUuid, roomUuid, content, sourceEndpoint,
                sendTime, sendCompleted, predictedArrivalTime, receiveTime, status);
    }

    @Override
    public String toString() {
        return "ChatMessage[" +
                "uuid=" + uuid +
                ", sender=" + senderUuid +
                ", room=" + roomUuid +
                ", status=" + status +
                ", content=" + content +
                ']';
    }
}
