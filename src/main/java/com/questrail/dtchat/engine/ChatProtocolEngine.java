package com.questrail.dtchat.engine;

import com.questrail.dtchat.api.Endpoint;
import com.questrail.dtchat.api.Peer;
import com.questrail.dtchat.api.Room;
import com.questrail.dtchat.api.RoomParticipant;
import com.questrail.dtchat.api.TransportKind;
import com.questrail.dtchat.codec.WireDecodeException;
import com.questrail.dtchat.codec.WireEncodeException;
import com.questrail.dtchat.codec.WireEnvelope;
import com.questrail.dtchat.codec.WireEnvelopeDecoder;
import com.questrail.dtchat.codec.WireEnvelopeEncoder;
import com.questrail.dtchat.codec.WirePayload;
import com.questrail.dtchat.codec.impl.ProtobufWireEnvelopeDecoder;
import com.questrail.dtchat.codec.impl.ProtobufWireEnvelopeEncoder;
import com.questrail.dtchat.message.ChatMessage;
import com.questrail.dtchat.message.MessageContent;
import com.questrail.dtchat.message.MessageOrdering;
import com.questrail.dtchat.message.MessageStatus;
import com.questrail.dtchat.message.RoomMessage;
import com.questrail.dtchat.message.SortStrategy;
import com.questrail.dtchat.observability.ChatEvent;
import com.questrail.dtchat.observability.ChatEvent.ErrorKind;
import com.questrail.dtchat.observability.ChatEvent.InfoKind;
import com.questrail.dtchat.observability.ChatEventObserver;
import com.questrail.dtchat.observability.ObserverRegistry;
import com.questrail.dtchat.prediction.PredictionException;
import com.questrail.dtchat.prediction.PredictionState;
import com.questrail.dtchat.store.ChatStore;
import com.questrail.dtchat.store.MarkIntent;
import com.questrail.dtchat.time.ChatTime;
import com.questrail.dtchat.time.SystemWallClock;
import com.questrail.dtchat.time.WallClock;
import com.questrail.dtchat.transport.TransportEngine;
import com.questrail.dtchat.transport.TransportEvent;
import com.questrail.dtchat.transport.TransportEventListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * ChatProtocolEngine
 * =============================================================================
 * Message lifecycle and acknowledgement protocol over an asynchronous,
 * multi-transport {@link TransportEngine}.
 *
 * <h2>Purpose</h2>
 * The engine turns fire-and-forget transport primitives into tracked message
 * states:
 * <pre>
 *   SENDING ──Sent──▶ SENT ──Ack──▶ RECEIVED_BY_PEER
 *      │                │
 *      └──failure──▶ FAILED ◀──failure
 * </pre>
 * Inbound Text/File envelopes are stored as RECEIVED and acknowledged on the
 * transport they arrived from. The ack leaves before RECEIVED is announced.
 *
 * <h2>Correlation</h2>
 * Every send is registered in a pending-send table under its token (message
 * uuid for TEXT, ack envelope uuid for ACK) before it is handed to the
 * transport. A completion or failure callback removes the entry; whichever
 * arrives first wins and any later callback for the same token is a no-op.
 *
 * <h2>Threading Model</h2>
 * All public operations, including transport callbacks entering through
 * {@link #onTransportEvent}, run under one private lock. Observers are
 * notified inside that lock and must not block on another thread that calls
 * back into the engine.
 *
 * <h2>Error Policy</h2>
 * Nothing is fatal. Every failure becomes a {@link ChatEvent.Error} or a
 * forwarded {@link ChatEvent.TransportError} and processing continues.
 * Prediction failures are not errors at all; they only leave the predicted
 * arrival time unset.
 */
public final class ChatProtocolEngine implements TransportEventListener
{
    private static final Logger log = LoggerFactory.getLogger(ChatProtocolEngine.class);

    private final Object lock = new Object();

    private final ChatStore store;
    private final PredictionState prediction;
    private final WireEnvelopeEncoder encoder;
    private final WireEnvelopeDecoder decoder;
    private final WallClock clock;

    private final ObserverRegistry observers = new ObserverRegistry();
    private final PendingSendTable pending = new PendingSendTable();

    private TransportEngine transport;

    public ChatProtocolEngine(ChatStore store,
                              PredictionState prediction,
                              WireEnvelopeEncoder encoder,
                              WireEnvelopeDecoder decoder,
                              WallClock clock)
    {
        this.store = Objects.requireNonNull(store, "store");
        this.prediction = Objects.requireNonNull(prediction, "prediction");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Engine with the protobuf codec and the system clock.
     */
    public ChatProtocolEngine(ChatStore store, PredictionState prediction)
    {
        this(store, prediction,
                new ProtobufWireEnvelopeEncoder(),
                new ProtobufWireEnvelopeDecoder(),
                SystemWallClock.INSTANCE);
    }

    public void addObserver(ChatEventObserver observer)
    {
        observers.add(observer);
    }

    /**
     * @return false if the observer was not registered
     */
    public boolean removeObserver(ChatEventObserver observer)
    {
        return observers.remove(observer);
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /**
     * Binds the transport and starts a listener on every local endpoint.
     *
     * @throws IllegalStateException if the engine was already started
     */
    public void start(TransportEngine transport)
    {
        Objects.requireNonNull(transport, "transport");
        synchronized (lock) {
            if (this.transport != null) {
                throw new IllegalStateException("ChatProtocolEngine already started");
            }
            this.transport = transport;
            transport.setListener(this);

            for (Endpoint endpoint : store.localPeer().endpoints()) {
                transport.startListener(endpoint);
            }

            observers.notify(ChatEvent.info(InfoKind.PREDICTION_STATUS, describe(prediction)));
        }
    }

    // -------------------------------------------------------------------------
    // Outbound
    // -------------------------------------------------------------------------

    /**
     * Sends {@code content} to one peer at {@code destination}.
     *
     * <p>The message leaves from the local endpoint whose transport matches the
     * destination. When there is none, when encoding fails, or when the engine
     * has not been started, nothing is sent: the message is stored as FAILED
     * and exactly one error event is emitted.</p>
     *
     * @return the new message uuid, whatever the transport outcome
     */
    public String sendToPeer(MessageContent content,
                             String roomUuid,
                             String peerUuid,
                             Endpoint destination,
                             boolean wantPrediction)
    {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(roomUuid, "roomUuid");
        Objects.requireNonNull(peerUuid, "peerUuid");
        Objects.requireNonNull(destination, "destination");

        synchronized (lock) {
            Peer local = store.localPeer();
            Optional<Endpoint> localEndpoint = local.endpointFor(destination.kind());
            Endpoint source = localEndpoint.orElseGet(() ->
                    local.endpoints().isEmpty() ? destination : local.endpoints().get(0));

            ChatMessage message = ChatMessage.newToSend(local.uuid(), roomUuid, content, source, clock);
            pending.register(PendingSend.text(message.uuid()));

            byte[] bytes = null;
            ChatEvent failure = null;
            if (localEndpoint.isEmpty()) {
                failure = ChatEvent.error(ErrorKind.PROTOCOL_ENCODE,
                        "No local " + destination.kind().token() + " endpoint to reach peer "
                                + peerUuid + " at " + destination);
            } else {
                try {
                    bytes = encoder.encode(WireEnvelope.forMessage(message));
                }
                catch (WireEncodeException e) {
                    failure = ChatEvent.error(ErrorKind.PROTOCOL_ENCODE,
                            "Failed to encode message " + message.uuid() + ": " + e.getMessage());
                }
                if (bytes != null && transport == null) {
                    failure = ChatEvent.error(ErrorKind.INTERNAL_ERROR,
                            "Engine not started, message " + message.uuid() + " not sent");
                }
            }

            if (failure == null && wantPrediction) {
                message = withPrediction(message, local, peerUuid, bytes.length);
            }

            store.addMessage(message);
            observers.notify(ChatEvent.info(InfoKind.SENDING, message, "to " + peerUuid + " at " + destination));

            if (failure != null) {
                pending.pop(message.uuid());
                store.markAs(message.uuid(), MarkIntent.failed());
                observers.notify(failure);
                return message.uuid();
            }

            transport.send(localEndpoint.get(), destination, bytes, message.uuid());
            return message.uuid();
        }
    }

    /**
     * Sends {@code content} once to every other participant of a room, each on
     * the endpoint the room lists for them.
     *
     * @return empty if the room is unknown, the local peer is not a participant
     *         or nobody else is
     */
    public Optional<RoomMessage> sendToRoom(MessageContent content, String roomUuid, boolean wantPrediction)
    {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(roomUuid, "roomUuid");

        synchronized (lock) {
            Room room = store.rooms().get(roomUuid);
            String localUuid = store.localPeer().uuid();
            if (room == null || !room.hasParticipant(localUuid)) {
                return Optional.empty();
            }

            List<RoomParticipant> others = room.participantsExcept(localUuid);
            if (others.isEmpty()) {
                return Optional.empty();
            }

            List<String> uuids = new ArrayList<>(others.size());
            for (RoomParticipant p : others) {
                uuids.add(sendToPeer(content, roomUuid, p.peerUuid(), p.endpoint(), wantPrediction));
            }
            return Optional.of(new RoomMessage(UUID.randomUUID().toString(), roomUuid, uuids));
        }
    }

    /**
     * Acknowledges {@code message} to {@code target} from the local endpoint of
     * the same transport.
     */
    public void sendAckToPeer(ChatMessage message, Endpoint target)
    {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(target, "target");

        synchronized (lock) {
            Peer local = store.localPeer();
            Optional<Endpoint> localEndpoint = local.endpointFor(target.kind());
            if (localEndpoint.isEmpty()) {
                observers.notify(ChatEvent.error(ErrorKind.PROTOCOL_ENCODE,
                        "No local " + target.kind().token() + " endpoint to acknowledge "
                                + message.uuid() + " to " + target));
                return;
            }

            WireEnvelope ack = WireEnvelope.ackFor(message, local.uuid(), clock.chatNow(), localEndpoint.get());
            byte[] bytes;
            try {
                bytes = encoder.encode(ack);
            }
            catch (WireEncodeException e) {
                observers.notify(ChatEvent.error(ErrorKind.PROTOCOL_ENCODE,
                        "Failed to encode ack for " + message.uuid() + ": " + e.getMessage()));
                return;
            }

            if (transport == null) {
                observers.notify(ChatEvent.error(ErrorKind.INTERNAL_ERROR,
                        "Engine not started, ack for " + message.uuid() + " not sent"));
                return;
            }

            pending.register(PendingSend.ack(ack.uuid(), message.uuid()));
            transport.send(localEndpoint.get(), target, bytes, ack.uuid());
            observers.notify(ChatEvent.info(InfoKind.ACK_SENT, message, "ack " + ack.uuid() + " to " + target));
        }
    }

    // -------------------------------------------------------------------------
    // Inbound
    // -------------------------------------------------------------------------

    /**
     * Decodes and dispatches one inbound payload.
     *
     * @param data bytes as delivered by the transport
     * @param from transport-level sender; informational only, acks go to the
     *             endpoint the envelope names
     */
    public void onWireData(byte[] data, Endpoint from)
    {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(from, "from");

        synchronized (lock) {
            WireEnvelope envelope;
            try {
                envelope = decoder.decode(data);
            }
            catch (WireDecodeException e) {
                observers.notify(ChatEvent.error(ErrorKind.PROTOCOL_DECODE,
                        "Undecodable payload from " + from + ": " + e.getMessage()));
                return;
            }

            WirePayload payload = envelope.payload();
            if (payload instanceof WirePayload.Ack ack) {
                onAck(envelope, ack);
            } else if (payload instanceof WirePayload.Text text) {
                onContent(envelope, new MessageContent.Text(text.text()));
            } else if (payload instanceof WirePayload.File file) {
                onContent(envelope, new MessageContent.File(file.name(), file.data()));
            }
        }
    }

    private void onContent(WireEnvelope envelope, MessageContent content)
    {
        Optional<ChatMessage> received = ChatMessage.newReceived(envelope, content, clock);
        if (received.isEmpty()) {
            observers.notify(ChatEvent.error(ErrorKind.PROTOCOL_DECODE,
                    "Message " + envelope.uuid() + " has an invalid timestamp (" + envelope.timestampMillis()
                            + ") or source endpoint ('" + envelope.sourceEndpoint() + "')"));
            return;
        }

        ChatMessage message = received.get();
        boolean added = store.addMessage(message);
        if (!added) {
            // duplicate delivery; our earlier ack may have been lost
            log.debug("Duplicate message {} from {}, acknowledging again", message.uuid(), message.senderUuid());
        }

        // ack before RECEIVED so a failing observer cannot suppress it
        sendAckToPeer(message, message.sourceEndpoint());

        if (added) {
            observers.notify(ChatEvent.info(InfoKind.RECEIVED, message, "from " + message.senderUuid()));
        }
    }

    private void onAck(WireEnvelope envelope, WirePayload.Ack ack)
    {
        if (ChatTime.fromTimestampMillis(envelope.timestampMillis()).isEmpty()) {
            observers.notify(ChatEvent.error(ErrorKind.PROTOCOL_DECODE,
                    "Ack " + envelope.uuid() + " has an invalid timestamp: " + envelope.timestampMillis()));
            return;
        }
        markAsAcked(ack.messageUuid(), envelope.timestampMillis());
    }

    // -------------------------------------------------------------------------
    // State transitions
    // -------------------------------------------------------------------------

    /**
     * Records the peer's acknowledgement; the ack time becomes the message's
     * receive time. An ack the message's status does not admit (FAILED,
     * already acknowledged, inbound) is dropped without an event.
     */
    public void markAsAcked(String messageUuid, long ackTimestampMillis)
    {
        Objects.requireNonNull(messageUuid, "messageUuid");
        synchronized (lock) {
            Optional<ChatTime> ackTime = ChatTime.fromTimestampMillis(ackTimestampMillis);
            if (ackTime.isEmpty()) {
                observers.notify(ChatEvent.error(ErrorKind.PROTOCOL_DECODE,
                        "Invalid ack timestamp " + ackTimestampMillis + " for " + messageUuid));
                return;
            }

            Optional<ChatMessage> current = store.message(messageUuid);
            if (current.isEmpty()) {
                observers.notify(ChatEvent.error(ErrorKind.MESSAGE_NOT_FOUND,
                        "Received ack for unknown message: " + messageUuid));
                return;
            }
            if (!current.get().status().canTransitionTo(MessageStatus.RECEIVED_BY_PEER)) {
                log.debug("Ignoring ack for {} in status {}", messageUuid, current.get().status());
                return;
            }

            store.markAs(messageUuid, new MarkIntent.Acked(ackTime.get())).ifPresent(updated ->
                    observers.notify(ChatEvent.info(InfoKind.ACK_RECEIVED, updated, "acked at " + ackTime.get())));
        }
    }

    /**
     * Transport completion for {@code token}. Unknown tokens are ignored.
     */
    public void markAsSent(String token)
    {
        Objects.requireNonNull(token, "token");
        synchronized (lock) {
            Optional<PendingSend> entry = pending.pop(token);
            if (entry.isEmpty() || entry.get().kind() == PendingKind.ACK) {
                return;
            }

            Optional<ChatMessage> updated = store.markAs(token, new MarkIntent.Sent(clock.chatNow()));
            if (updated.isPresent()) {
                observers.notify(ChatEvent.info(InfoKind.SENT, updated.get(), "send completed"));
            } else {
                observers.notify(ChatEvent.error(ErrorKind.MESSAGE_NOT_FOUND,
                        "Unable to mark unknown message as sent: " + token));
            }
        }
    }

    /**
     * Transport failure for {@code token}. ACK failures are dropped; a TEXT
     * failure moves the message to FAILED and emits one host error.
     */
    public void markPendingMessageAsFailed(String token, String reason)
    {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(reason, "reason");
        synchronized (lock) {
            Optional<PendingSend> entry = pending.pop(token);
            if (entry.isEmpty()) {
                return;
            }
            if (entry.get().kind() == PendingKind.ACK) {
                log.debug("Ack {} for {} not delivered: {}", token, entry.get().originalMessageUuid().orElse("?"), reason);
                return;
            }

            store.markAs(token, MarkIntent.failed());
            observers.notify(ChatEvent.error(ErrorKind.HOST_ERROR, "Message " + token + " failed: " + reason));
        }
    }

    // -------------------------------------------------------------------------
    // Transport callbacks
    // -------------------------------------------------------------------------

    /**
     * Forwards every transport event to observers, then applies its protocol
     * meaning. Exceptions thrown by observers are logged here so they never
     * propagate into transport threads.
     */
    @Override
    public void onTransportEvent(TransportEvent event)
    {
        Objects.requireNonNull(event, "event");
        synchronized (lock) {
            try {
                dispatch(event);
            }
            catch (RuntimeException e) {
                log.error("Failed to process transport event {}", event, e);
            }
        }
    }

    private void dispatch(TransportEvent event)
    {
        observers.notify(event.isError()
                ? new ChatEvent.TransportError(event)
                : new ChatEvent.TransportInfo(event));

        if (event instanceof TransportEvent.Received r) {
            onWireData(r.data(), r.from());
        } else if (event instanceof TransportEvent.Sent s) {
            markAsSent(s.token());
        } else if (event instanceof TransportEvent.ConnectionFailed c) {
            c.token().ifPresent(t -> markPendingMessageAsFailed(t,
                    "connection to " + c.endpoint() + " failed: " + c.reason()));
        } else if (event instanceof TransportEvent.SendFailed f) {
            f.token().ifPresent(t -> markPendingMessageAsFailed(t,
                    "send to " + f.endpoint() + " failed: " + f.reason()));
        }
    }

    // -------------------------------------------------------------------------
    // Queries
    // -------------------------------------------------------------------------

    public Peer localPeer()
    {
        return store.localPeer();
    }

    public PredictionState predictionState()
    {
        return prediction;
    }

    public int pendingSendCount()
    {
        synchronized (lock) {
            return pending.size();
        }
    }

    /**
     * Snapshot of every stored message in the requested order.
     */
    public List<ChatMessage> messages(SortStrategy strategy)
    {
        Objects.requireNonNull(strategy, "strategy");
        List<ChatMessage> all = new ArrayList<>(store.allMessages());
        MessageOrdering.sort(all, strategy.comparator());
        return all;
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private ChatMessage withPrediction(ChatMessage message, Peer local, String peerUuid, int size)
    {
        if (!(prediction instanceof PredictionState.Enabled enabled)) {
            return message;
        }

        Optional<Endpoint> localBp = local.endpointFor(TransportKind.BUNDLE_PROTOCOL);
        Optional<Endpoint> remoteBp = Optional.ofNullable(store.otherPeers().get(peerUuid))
                .flatMap(p -> p.endpointFor(TransportKind.BUNDLE_PROTOCOL));
        if (localBp.isEmpty() || remoteBp.isEmpty()) {
            return message;
        }

        try {
            ChatTime arrival = enabled.oracle().predict(localBp.get().address(), remoteBp.get().address(), size);
            return message.withPredictedArrival(arrival);
        }
        catch (PredictionException e) {
            log.debug("No prediction for {} ({}): {}", message.uuid(), e.reason(), e.getMessage());
            return message;
        }
        catch (RuntimeException e) {
            log.warn("Delivery-time oracle failed for {}, sending without prediction", message.uuid(), e);
            return message;
        }
    }

    private static String describe(PredictionState state)
    {
        if (state instanceof PredictionState.Enabled) {
            return "Prediction enabled";
        }
        if (state instanceof PredictionState.Error error) {
            return "Prediction error: " + error.reason();
        }
        return "Prediction disabled";
    }
}
