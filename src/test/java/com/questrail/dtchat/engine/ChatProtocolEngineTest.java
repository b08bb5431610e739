package com.questrail.dtchat.engine;

import com.questrail.dtchat.api.Endpoint;
import com.questrail.dtchat.api.Peer;
import com.questrail.dtchat.api.Room;
import com.questrail.dtchat.api.RoomParticipant;
import com.questrail.dtchat.codec.WireEnvelope;
import com.questrail.dtchat.codec.WirePayload;
import com.questrail.dtchat.codec.impl.ProtobufWireEnvelopeDecoder;
import com.questrail.dtchat.codec.impl.ProtobufWireEnvelopeEncoder;
import com.questrail.dtchat.message.ChatMessage;
import com.questrail.dtchat.message.MessageContent;
import com.questrail.dtchat.message.MessageStatus;
import com.questrail.dtchat.message.RoomMessage;
import com.questrail.dtchat.message.SortStrategy;
import com.questrail.dtchat.observability.ChatEvent;
import com.questrail.dtchat.observability.ChatEvent.ErrorKind;
import com.questrail.dtchat.observability.ChatEvent.InfoKind;
import com.questrail.dtchat.observability.RecordingChatEventObserver;
import com.questrail.dtchat.prediction.ContactGraphRouter;
import com.questrail.dtchat.prediction.ContactPlan;
import com.questrail.dtchat.prediction.ContactPlanOracle;
import com.questrail.dtchat.prediction.ContactPlanParser;
import com.questrail.dtchat.prediction.PredictionException;
import com.questrail.dtchat.prediction.PredictionState;
import com.questrail.dtchat.store.InMemoryChatStore;
import com.questrail.dtchat.time.ChatTime;
import com.questrail.dtchat.time.ManualWallClock;
import com.questrail.dtchat.transport.FakeTransportEngine;
import com.questrail.dtchat.transport.FakeTransportEngine.SentPayload;
import com.questrail.dtchat.transport.TransportEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ChatProtocolEngineTest
 * -----------------------------------------------------------------------------
 * Message lifecycle and acknowledgement behaviour against a
 * {@link FakeTransportEngine}.
 *
 * <p>The fake never calls back on its own. Each test drives completions,
 * failures and inbound payloads explicitly, so every ordering of callbacks
 * can be exercised deterministically.</p>
 *
 * <pre>
 *   A (local)  tcp 127.0.0.1:7001, udp 127.0.0.1:7002
 *   B          tcp 127.0.0.1:8001
 *   C          udp 127.0.0.1:9002
 *
 *   room "r":      A (tcp), B (tcp), C (udp)
 *   room "others": B, C
 * </pre>
 */
final class ChatProtocolEngineTest
{
    private static final Endpoint A_TCP = Endpoint.tcp("127.0.0.1:7001");
    private static final Endpoint A_UDP = Endpoint.udp("127.0.0.1:7002");
    private static final Endpoint B_TCP = Endpoint.tcp("127.0.0.1:8001");
    private static final Endpoint C_UDP = Endpoint.udp("127.0.0.1:9002");

    private static final Peer A = new Peer("A", "alice", "red", List.of(A_TCP, A_UDP));
    private static final Peer B = new Peer("B", "bob", "blue", List.of(B_TCP));
    private static final Peer C = new Peer("C", "carol", "green", List.of(C_UDP));

    private static final Room ROOM = new Room("r", "general", List.of(
            new RoomParticipant("A", A_TCP),
            new RoomParticipant("B", B_TCP),
            new RoomParticipant("C", C_UDP)));

    private static final Room OTHERS = new Room("others", "without us", List.of(
            new RoomParticipant("B", B_TCP),
            new RoomParticipant("C", C_UDP)));

    private final ManualWallClock clock = new ManualWallClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final ProtobufWireEnvelopeEncoder encoder = new ProtobufWireEnvelopeEncoder();
    private final ProtobufWireEnvelopeDecoder decoder = new ProtobufWireEnvelopeDecoder();
    private final FakeTransportEngine transport = new FakeTransportEngine();
    private final RecordingChatEventObserver events = new RecordingChatEventObserver();

    private InMemoryChatStore store;
    private ChatProtocolEngine engine;

    @BeforeEach
    void setUp()
    {
        store = new InMemoryChatStore(A, List.of(B, C), List.of(ROOM, OTHERS));
        engine = newEngine(store, PredictionState.disabled());
        engine.start(transport);
        events.clear();
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    @Test
    void startListensOnEveryLocalEndpointAndReportsPrediction()
    {
        FakeTransportEngine other = new FakeTransportEngine();
        ChatProtocolEngine fresh = newEngine(new InMemoryChatStore(A, List.of(B), List.of()), PredictionState.disabled());

        fresh.start(other);

        assertEquals(List.of(A_TCP, A_UDP), other.listenersStarted());
        List<ChatEvent.Info> status = events.infos(InfoKind.PREDICTION_STATUS);
        assertEquals(1, status.size());
        assertEquals("Prediction disabled", status.get(0).detail());
    }

    @Test
    void engineCanOnlyBeStartedOnce()
    {
        assertThrows(IllegalStateException.class, () -> engine.start(new FakeTransportEngine()));
    }

    // -------------------------------------------------------------------------
    // Outbound
    // -------------------------------------------------------------------------

    @Test
    void sendStoresMessageAndHandsEncodedEnvelopeToTransport()
    {
        String uuid = engine.sendToPeer(new MessageContent.Text("hello"), "r", "B", B_TCP, false);

        ChatMessage stored = only(store.allMessages());
        assertEquals(uuid, stored.uuid());
        assertEquals(MessageStatus.SENDING, stored.status());
        assertEquals(A_TCP, stored.sourceEndpoint());

        SentPayload sent = transport.lastSent();
        assertEquals(A_TCP, sent.local());
        assertEquals(B_TCP, sent.remote());
        assertEquals(uuid, sent.token());

        WireEnvelope env = decoder.decode(sent.data());
        assertEquals(uuid, env.uuid());
        assertEquals("A", env.senderUuid());
        assertEquals("r", env.roomUuid());
        assertEquals("tcp 127.0.0.1:7001", env.sourceEndpoint());
        assertEquals(clock.now().toEpochMilli(), env.timestampMillis());
        assertEquals(new WirePayload.Text("hello"), env.payload());

        assertEquals(1, engine.pendingSendCount());
        assertEquals(1, events.infos(InfoKind.SENDING).size());
        assertTrue(events.errors().isEmpty());
    }

    @Test
    void everySendGetsItsOwnUuid()
    {
        String first = engine.sendToPeer(new MessageContent.Text("x"), "r", "B", B_TCP, false);
        String second = engine.sendToPeer(new MessageContent.Text("x"), "r", "B", B_TCP, false);

        assertNotEquals(first, second);
        assertEquals(2, store.allMessages().size());
    }

    @Test
    void sendCompletionMarksMessageSent()
    {
        String uuid = engine.sendToPeer(new MessageContent.Text("hello"), "r", "B", B_TCP, false);
        clock.advance(Duration.ofSeconds(2));

        transport.completeSend(transport.lastSent());

        ChatMessage m = message(uuid);
        assertEquals(MessageStatus.SENT, m.status());
        assertEquals(clock.chatNow(), m.sendCompleted().orElseThrow());
        assertEquals(1, events.infos(InfoKind.SENT).size());
        assertEquals(0, engine.pendingSendCount());
    }

    @Test
    void ackMarksMessageReceivedByPeerAtAckTime()
    {
        String uuid = engine.sendToPeer(new MessageContent.Text("hello"), "r", "B", B_TCP, false);
        transport.completeSend(transport.lastSent());

        long ackMillis = clock.now().plusSeconds(30).toEpochMilli();
        transport.injectReceived(ackBytes(uuid, ackMillis), B_TCP);

        ChatMessage m = message(uuid);
        assertEquals(MessageStatus.RECEIVED_BY_PEER, m.status());
        assertEquals(ackMillis, m.receiveTime().orElseThrow().timestampMillis());
        assertEquals(1, events.infos(InfoKind.ACK_RECEIVED).size());
    }

    @Test
    void ackOvertakingTransportCompletionKeepsReceivedByPeer()
    {
        String uuid = engine.sendToPeer(new MessageContent.Text("hello"), "r", "B", B_TCP, false);
        SentPayload sent = transport.lastSent();

        transport.injectReceived(ackBytes(uuid, 5_000L), B_TCP);
        transport.completeSend(sent);

        ChatMessage m = message(uuid);
        assertEquals(MessageStatus.RECEIVED_BY_PEER, m.status());
        assertTrue(m.sendCompleted().isPresent());
    }

    @Test
    void unknownCompletionTokenHasNoEffect()
    {
        engine.sendToPeer(new MessageContent.Text("hello"), "r", "B", B_TCP, false);
        List<ChatMessage> before = store.allMessages();
        events.clear();

        engine.markAsSent("no-such-token");

        assertEquals(before, store.allMessages());
        assertTrue(events.events().isEmpty());
        assertEquals(1, engine.pendingSendCount());
    }

    @Test
    void connectionFailureMarksMessageFailedWithExactlyOneError()
    {
        String uuid = engine.sendToPeer(new MessageContent.Text("hello"), "r", "B", B_TCP, false);
        SentPayload sent = transport.lastSent();

        transport.failConnection(sent, "connection refused");

        assertEquals(MessageStatus.FAILED, message(uuid).status());
        assertEquals(1, events.errors().size());
        assertEquals(ErrorKind.HOST_ERROR, events.errors().get(0).kind());
        assertTrue(events.errors().get(0).detail().contains("connection refused"));
        assertEquals(1, events.transportErrors().size());
    }

    @Test
    void firstCallbackForATokenWins()
    {
        String uuid = engine.sendToPeer(new MessageContent.Text("hello"), "r", "B", B_TCP, false);
        SentPayload sent = transport.lastSent();

        transport.failConnection(sent, "refused");
        transport.failConnection(sent, "refused again");
        transport.completeSend(sent);

        assertEquals(MessageStatus.FAILED, message(uuid).status());
        assertEquals(1, events.count(ErrorKind.HOST_ERROR));
        assertTrue(events.infos(InfoKind.SENT).isEmpty());
    }

    @Test
    void sendFailureAfterConnectingAlsoFailsMessage()
    {
        String uuid = engine.sendToPeer(new MessageContent.Text("hello"), "r", "B", B_TCP, false);

        transport.inject(new TransportEvent.SendFailed(B_TCP, "broken pipe", Optional.of(uuid)));

        assertEquals(MessageStatus.FAILED, message(uuid).status());
        assertEquals(1, events.count(ErrorKind.HOST_ERROR));
    }

    @Test
    void failureWithoutTokenIsOnlyForwarded()
    {
        engine.sendToPeer(new MessageContent.Text("hello"), "r", "B", B_TCP, false);
        events.clear();

        transport.inject(new TransportEvent.ConnectionFailed(B_TCP, "refused", Optional.empty()));
        transport.inject(new TransportEvent.SocketError(A_TCP, "address in use"));

        assertTrue(events.errors().isEmpty());
        assertEquals(2, events.transportErrors().size());
        assertEquals(MessageStatus.SENDING, only(store.allMessages()).status());
    }

    @Test
    void sendBeforeStartFailsTheMessage()
    {
        InMemoryChatStore idleStore = new InMemoryChatStore(A, List.of(B), List.of(ROOM));
        ChatProtocolEngine idle = newEngine(idleStore, PredictionState.disabled());

        String uuid = idle.sendToPeer(new MessageContent.Text("hello"), "r", "B", B_TCP, false);

        assertEquals(MessageStatus.FAILED, only(idleStore.allMessages()).status());
        assertEquals(uuid, only(idleStore.allMessages()).uuid());
        assertEquals(1, events.count(ErrorKind.INTERNAL_ERROR));
        assertEquals(0, idle.pendingSendCount());
    }

    @Test
    void unencodableContentFailsWithoutSending()
    {
        String uuid = engine.sendToPeer(new MessageContent.Text("broken \uD800"), "r", "B", B_TCP, false);

        assertEquals(MessageStatus.FAILED, message(uuid).status());
        assertEquals(1, events.count(ErrorKind.PROTOCOL_ENCODE));
        assertTrue(transport.sent().isEmpty());
        assertEquals(0, engine.pendingSendCount());
    }

    // -------------------------------------------------------------------------
    // Rooms
    // -------------------------------------------------------------------------

    @Test
    void roomMessageGoesToEveryOtherParticipantOnItsTransport()
    {
        RoomMessage rm = engine.sendToRoom(new MessageContent.Text("hi all"), "r", false).orElseThrow();

        assertEquals("r", rm.roomUuid());
        assertEquals(2, rm.messageUuids().size());

        List<SentPayload> sent = transport.sent();
        assertEquals(2, sent.size());
        assertEquals(B_TCP, sent.get(0).remote());
        assertEquals(A_TCP, sent.get(0).local());
        assertEquals(C_UDP, sent.get(1).remote());
        assertEquals(A_UDP, sent.get(1).local());
        assertEquals(rm.messageUuids(), sent.stream().map(SentPayload::token).toList());
    }

    @Test
    void roomWithoutLocalPeerSendsNothing()
    {
        assertTrue(engine.sendToRoom(new MessageContent.Text("x"), "others", false).isEmpty());
        assertTrue(engine.sendToRoom(new MessageContent.Text("x"), "no-such-room", false).isEmpty());

        assertTrue(transport.sent().isEmpty());
        assertTrue(store.allMessages().isEmpty());
    }

    @Test
    void roomWithOnlyTheLocalPeerSendsNothing()
    {
        Room alone = new Room("alone", "alone", List.of(new RoomParticipant("A", A_TCP)));
        InMemoryChatStore s = new InMemoryChatStore(A, List.of(), List.of(alone));
        ChatProtocolEngine e = newEngine(s, PredictionState.disabled());
        e.start(new FakeTransportEngine());

        assertTrue(e.sendToRoom(new MessageContent.Text("x"), "alone", false).isEmpty());
        assertTrue(s.allMessages().isEmpty());
    }

    @Test
    void participantOnTransportWeLackFailsWithEncodeError()
    {
        // P1 only speaks TCP; P3 is registered on UDP
        Endpoint p1Tcp = Endpoint.tcp("10.0.0.1:7000");
        Endpoint p2Tcp = Endpoint.tcp("10.0.0.2:7000");
        Endpoint p3Udp = Endpoint.udp("10.0.0.3:7000");
        Peer p1 = new Peer("P1", "p1", "white", List.of(p1Tcp));
        Peer p2 = new Peer("P2", "p2", "white", List.of(p2Tcp));
        Peer p3 = new Peer("P3", "p3", "white", List.of(p3Udp));
        Room room = new Room("mixed", "mixed", List.of(
                new RoomParticipant("P1", p1Tcp),
                new RoomParticipant("P2", p2Tcp),
                new RoomParticipant("P3", p3Udp)));

        InMemoryChatStore s = new InMemoryChatStore(p1, List.of(p2, p3), List.of(room));
        FakeTransportEngine t = new FakeTransportEngine();
        ChatProtocolEngine e = newEngine(s, PredictionState.disabled());
        e.start(t);
        events.clear();

        RoomMessage rm = e.sendToRoom(new MessageContent.Text("hello"), "mixed", false).orElseThrow();

        assertEquals(2, rm.messageUuids().size());
        assertEquals(1, t.sent().size());
        assertEquals(p2Tcp, t.lastSent().remote());

        assertEquals(1, events.errors().size());
        assertEquals(ErrorKind.PROTOCOL_ENCODE, events.errors().get(0).kind());

        String toP3 = rm.messageUuids().get(1);
        assertEquals(MessageStatus.FAILED, s.allMessages().stream()
                .filter(m -> m.uuid().equals(toP3)).findFirst().orElseThrow().status());
        assertEquals(1, e.pendingSendCount());
    }

    // -------------------------------------------------------------------------
    // Inbound
    // -------------------------------------------------------------------------

    @Test
    void inboundTextIsStoredAndAcknowledgedToItsSource()
    {
        clock.advance(Duration.ofMinutes(1));
        byte[] data = textBytes("m-1", "B", 1_000L, "tcp 127.0.0.1:8001", "hi");

        transport.injectReceived(data, Endpoint.tcp("127.0.0.1:55555"));

        ChatMessage m = only(store.allMessages());
        assertEquals("m-1", m.uuid());
        assertEquals(MessageStatus.RECEIVED, m.status());
        assertEquals(clock.chatNow(), m.receiveTime().orElseThrow());
        assertEquals(1, events.infos(InfoKind.RECEIVED).size());

        SentPayload ack = transport.lastSent();
        assertEquals(A_TCP, ack.local());
        assertEquals(B_TCP, ack.remote());

        WireEnvelope env = decoder.decode(ack.data());
        assertEquals(new WirePayload.Ack("m-1"), env.payload());
        assertEquals("A", env.senderUuid());
        assertEquals("r", env.roomUuid());
        assertEquals(clock.now().toEpochMilli(), env.timestampMillis());
        assertEquals(env.uuid(), ack.token());
        assertNotEquals("m-1", env.uuid());

        assertEquals(1, events.infos(InfoKind.ACK_SENT).size());
        assertEquals(1, engine.pendingSendCount());
    }

    @Test
    void ackLeavesOnTheTransportTheMessageArrivedOn()
    {
        transport.injectReceived(textBytes("m-2", "C", 1_000L, "udp 127.0.0.1:9002", "hey"), C_UDP);

        SentPayload ack = transport.lastSent();
        assertEquals(A_UDP, ack.local());
        assertEquals(C_UDP, ack.remote());
    }

    @Test
    void duplicateDeliveryIsAcknowledgedAgainButStoredOnce()
    {
        byte[] data = textBytes("m-1", "B", 1_000L, "tcp 127.0.0.1:8001", "hi");

        transport.injectReceived(data, B_TCP);
        transport.injectReceived(data, B_TCP);

        assertEquals(1, store.allMessages().size());
        assertEquals(1, events.infos(InfoKind.RECEIVED).size());
        assertEquals(2, transport.sent().size());
    }

    @Test
    void inboundFileIsStored()
    {
        WireEnvelope env = new WireEnvelope("f-1", "B", "r", 1_000L, "tcp 127.0.0.1:8001",
                new WirePayload.File("photo.png", new byte[] { 1, 2, 3 }));

        transport.injectReceived(encoder.encode(env), B_TCP);

        MessageContent.File file = assertInstanceOf(MessageContent.File.class, only(store.allMessages()).content());
        assertEquals("photo.png", file.name());
        assertArrayEquals(new byte[] { 1, 2, 3 }, file.data());
    }

    @Test
    void ackFailureIsNotAnError()
    {
        transport.injectReceived(textBytes("m-1", "B", 1_000L, "tcp 127.0.0.1:8001", "hi"), B_TCP);
        events.clear();

        transport.failConnection(transport.lastSent(), "refused");

        assertTrue(events.errors().isEmpty());
        assertEquals(1, events.transportErrors().size());
        assertEquals(MessageStatus.RECEIVED, only(store.allMessages()).status());
        assertEquals(0, engine.pendingSendCount());
    }

    @Test
    void ackCompletionDoesNotTouchMessages()
    {
        transport.injectReceived(textBytes("m-1", "B", 1_000L, "tcp 127.0.0.1:8001", "hi"), B_TCP);
        events.clear();

        transport.completeSend(transport.lastSent());

        assertTrue(events.infos(InfoKind.SENT).isEmpty());
        assertEquals(MessageStatus.RECEIVED, only(store.allMessages()).status());
    }

    @Test
    void inboundFromTransportWeLackIsStoredButCannotBeAcknowledged()
    {
        transport.injectReceived(textBytes("m-3", "B", 1_000L, "bp ipn:2.0", "over bp"), B_TCP);

        assertEquals(1, store.allMessages().size());
        assertEquals(1, events.count(ErrorKind.PROTOCOL_ENCODE));
        assertTrue(transport.sent().isEmpty());
    }

    @Test
    void undecodablePayloadIsReported()
    {
        transport.injectReceived(new byte[] { 0x0A, 0x05, 'x' }, B_TCP);

        assertEquals(1, events.count(ErrorKind.PROTOCOL_DECODE));
        assertTrue(store.allMessages().isEmpty());
        assertTrue(transport.sent().isEmpty());
    }

    @Test
    void inboundWithInvalidTimestampOrEndpointIsReported()
    {
        transport.injectReceived(textBytes("m-1", "B", Long.MAX_VALUE, "tcp 127.0.0.1:8001", "hi"), B_TCP);
        transport.injectReceived(textBytes("m-2", "B", 1_000L, "", "hi"), B_TCP);

        assertEquals(2, events.count(ErrorKind.PROTOCOL_DECODE));
        assertTrue(store.allMessages().isEmpty());
        assertTrue(transport.sent().isEmpty());
    }

    @Test
    void inboundMessageIsAcknowledgedEvenWhenAnObserverFails()
    {
        engine.addObserver(e -> {
            if (e instanceof ChatEvent.Info i && i.kind() == InfoKind.RECEIVED) {
                throw new IllegalStateException("observer bug");
            }
        });

        transport.injectReceived(textBytes("m-1", "B", 1_000L, "tcp 127.0.0.1:8001", "hi"), B_TCP);

        assertEquals(1, store.allMessages().size());
        assertEquals(1, transport.sent().size());
        assertEquals(new WirePayload.Ack("m-1"), decoder.decode(transport.lastSent().data()).payload());
    }

    @Test
    void ackForFailedMessageChangesNothing()
    {
        String uuid = engine.sendToPeer(new MessageContent.Text("hello"), "r", "B", B_TCP, false);
        transport.failConnection(transport.lastSent(), "refused");
        events.clear();

        transport.injectReceived(ackBytes(uuid, 5_000L), B_TCP);

        ChatMessage m = message(uuid);
        assertEquals(MessageStatus.FAILED, m.status());
        assertTrue(m.receiveTime().isEmpty());
        assertTrue(events.infos(InfoKind.ACK_RECEIVED).isEmpty());
        assertTrue(events.errors().isEmpty());
    }

    @Test
    void repeatedAckIsReportedOnceAndKeepsFirstAckTime()
    {
        String uuid = engine.sendToPeer(new MessageContent.Text("hello"), "r", "B", B_TCP, false);
        transport.completeSend(transport.lastSent());

        transport.injectReceived(ackBytes(uuid, 5_000L), B_TCP);
        transport.injectReceived(ackBytes(uuid, 9_000L), B_TCP);

        assertEquals(1, events.infos(InfoKind.ACK_RECEIVED).size());
        assertEquals(5_000L, message(uuid).receiveTime().orElseThrow().timestampMillis());
    }

    @Test
    void ackNamingAnInboundMessageIsIgnored()
    {
        transport.injectReceived(textBytes("m-1", "B", 1_000L, "tcp 127.0.0.1:8001", "hi"), B_TCP);
        events.clear();

        transport.injectReceived(ackBytes("m-1", 5_000L), B_TCP);

        assertEquals(MessageStatus.RECEIVED, only(store.allMessages()).status());
        assertTrue(events.infos(InfoKind.ACK_RECEIVED).isEmpty());
        assertTrue(events.errors().isEmpty());
    }

    @Test
    void ackForUnknownMessageIsReported()
    {
        transport.injectReceived(ackBytes("never-sent", 1_000L), B_TCP);

        assertEquals(1, events.count(ErrorKind.MESSAGE_NOT_FOUND));
    }

    @Test
    void ackWithInvalidTimestampIsReported()
    {
        String uuid = engine.sendToPeer(new MessageContent.Text("hello"), "r", "B", B_TCP, false);

        transport.injectReceived(ackBytes(uuid, ChatTime.MAX_MILLIS + 1), B_TCP);

        assertEquals(1, events.count(ErrorKind.PROTOCOL_DECODE));
        assertEquals(MessageStatus.SENDING, message(uuid).status());
    }

    @Test
    void observerFailureDuringTransportCallbackDoesNotEscape()
    {
        engine.addObserver(e -> {
            if (e instanceof ChatEvent.TransportInfo) {
                throw new IllegalStateException("observer bug");
            }
        });

        assertDoesNotThrow(() -> transport.inject(new TransportEvent.ListenerStarted(A_TCP)));
    }

    // -------------------------------------------------------------------------
    // Prediction
    // -------------------------------------------------------------------------

    @Test
    void predictionIsAttachedWhenBothPeersHaveBundleEndpoints()
    {
        ChatTime predicted = ChatTime.of(clock.now().plusSeconds(90));
        ChatProtocolEngine e = bpEngine(new PredictionState.Enabled((src, dst, size) -> {
            assertEquals("ipn:1.0", src);
            assertEquals("ipn:2.0", dst);
            assertTrue(size > 0);
            return predicted;
        }));

        String uuid = e.sendToPeer(new MessageContent.Text("x"), "r", "B", B_TCP, true);
        String without = e.sendToPeer(new MessageContent.Text("x"), "r", "B", B_TCP, false);

        assertEquals(Optional.of(predicted), find(e, uuid).predictedArrivalTime());
        assertTrue(find(e, without).predictedArrivalTime().isEmpty());
        assertEquals("Prediction enabled", events.infos(InfoKind.PREDICTION_STATUS).get(0).detail());
    }

    @Test
    void predictionFailureOnlyLeavesEstimateUnset()
    {
        ChatProtocolEngine e = bpEngine(new PredictionState.Enabled((src, dst, size) -> {
            throw new PredictionException(PredictionException.Reason.NO_ROUTE_FOUND, "no contact");
        }));

        String uuid = e.sendToPeer(new MessageContent.Text("x"), "r", "B", B_TCP, true);

        assertTrue(find(e, uuid).predictedArrivalTime().isEmpty());
        assertEquals(MessageStatus.SENDING, find(e, uuid).status());
        assertTrue(events.errors().isEmpty());
    }

    @Test
    void oracleBugDoesNotStopTheSend()
    {
        ChatProtocolEngine e = bpEngine(new PredictionState.Enabled((src, dst, size) -> {
            throw new IllegalStateException("oracle bug");
        }));

        String uuid = e.sendToPeer(new MessageContent.Text("x"), "r", "B", B_TCP, true);

        assertEquals(MessageStatus.SENDING, find(e, uuid).status());
        assertTrue(find(e, uuid).predictedArrivalTime().isEmpty());
        assertEquals(1, e.pendingSendCount());
    }

    @Test
    void arrivalPastRepresentableTimeOnlyLeavesEstimateUnset() throws Exception
    {
        ContactPlan slow = ContactPlanParser.parse(new StringReader("a contact +0 +1e14 1 2 1e-10\n"));
        ContactPlanOracle oracle = new ContactPlanOracle(new ContactGraphRouter(slow), clock.chatNow(), clock);
        ChatProtocolEngine e = bpEngine(new PredictionState.Enabled(oracle));

        String uuid = e.sendToPeer(new MessageContent.Text("x"), "r", "B", B_TCP, true);

        assertEquals(MessageStatus.SENDING, find(e, uuid).status());
        assertTrue(find(e, uuid).predictedArrivalTime().isEmpty());
        assertEquals(1, e.pendingSendCount());
        assertTrue(events.errors().isEmpty());
    }

    @Test
    void predictionErrorStateIsReportedAtStart()
    {
        ChatProtocolEngine e = bpEngine(new PredictionState.Error("bad plan"));

        assertEquals("Prediction error: bad plan", events.infos(InfoKind.PREDICTION_STATUS).get(0).detail());
        assertInstanceOf(PredictionState.Error.class, e.predictionState());
    }

    // -------------------------------------------------------------------------
    // Queries
    // -------------------------------------------------------------------------

    @Test
    void messagesAreReturnedInRequestedOrder()
    {
        transport.injectReceived(textBytes("late", "B", 9_000L, "tcp 127.0.0.1:8001", "late"), B_TCP);
        transport.injectReceived(textBytes("early", "B", 1_000L, "tcp 127.0.0.1:8001", "early"), B_TCP);

        List<String> order = engine.messages(SortStrategy.standard()).stream().map(ChatMessage::uuid).toList();

        assertEquals(List.of("early", "late"), order);
        assertEquals(List.of("late", "early"), store.allMessages().stream().map(ChatMessage::uuid).toList());
    }

    @Test
    void removedObserverReceivesNoFurtherEvents()
    {
        RecordingChatEventObserver extra = new RecordingChatEventObserver();
        engine.addObserver(extra);

        assertTrue(engine.removeObserver(extra));
        assertFalse(engine.removeObserver(extra));

        engine.sendToPeer(new MessageContent.Text("hello"), "r", "B", B_TCP, false);
        assertTrue(extra.events().isEmpty());
        assertEquals(1, events.infos(InfoKind.SENDING).size());
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private ChatProtocolEngine newEngine(InMemoryChatStore s, PredictionState prediction)
    {
        ChatProtocolEngine e = new ChatProtocolEngine(s, prediction, encoder, decoder, clock);
        e.addObserver(events);
        return e;
    }

    private ChatProtocolEngine bpEngine(PredictionState prediction)
    {
        Peer a = new Peer("A", "alice", "red", List.of(A_TCP, Endpoint.bundleProtocol("ipn:1.0")));
        Peer b = new Peer("B", "bob", "blue", List.of(B_TCP, Endpoint.bundleProtocol("ipn:2.0")));
        ChatProtocolEngine e = newEngine(new InMemoryChatStore(a, List.of(b), List.of(ROOM)), prediction);
        events.clear();
        e.start(new FakeTransportEngine());
        return e;
    }

    private static ChatMessage find(ChatProtocolEngine e, String uuid)
    {
        return e.messages(SortStrategy.standard()).stream()
                .filter(m -> m.uuid().equals(uuid))
                .findFirst()
                .orElseThrow();
    }

    private ChatMessage message(String uuid)
    {
        return store.allMessages().stream()
                .filter(m -> m.uuid().equals(uuid))
                .findFirst()
                .orElseThrow();
    }

    private byte[] textBytes(String uuid, String sender, long timestamp, String source, String text)
    {
        return encoder.encode(new WireEnvelope(uuid, sender, "r", timestamp, source, new WirePayload.Text(text)));
    }

    private byte[] ackBytes(String ackedUuid, long timestamp)
    {
        return encoder.encode(new WireEnvelope(UUID.randomUUID().toString(), "B", "r", timestamp,
                "tcp 127.0.0.1:8001", new WirePayload.Ack(ackedUuid)));
    }

    private static <T> T only(List<T> list)
    {
        assertEquals(1, list.size(), "expected exactly one element: " + list);
        return list.get(0);
    }
}
