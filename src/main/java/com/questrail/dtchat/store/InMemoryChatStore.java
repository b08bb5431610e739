package com.questrail.dtchat.store;

import com.questrail.dtchat.api.Peer;
import com.questrail.dtchat.api.Room;
import com.questrail.dtchat.message.ChatMessage;
import com.questrail.dtchat.message.MessageStatus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Insertion-ordered, thread-safe {@link ChatStore} held in memory.
 */
public final class InMemoryChatStore implements ChatStore
{
    private final Peer localPeer;
    private final Map<String, Peer> otherPeers;
    private final Map<String, Room> rooms;

    private final Object lock = new Object();
    private final List<ChatMessage> messages = new ArrayList<>();
    private final Map<String, Integer> indexByUuid = new HashMap<>();

    public InMemoryChatStore(Peer localPeer, Collection<Peer> otherPeers, Collection<Room> rooms) {
        this.localPeer = Objects.requireNonNull(localPeer, "localPeer");

        Map<String, Peer> peers = new LinkedHashMap<>();
        for (Peer p : Objects.requireNonNull(otherPeers, "otherPeers")) {
            peers.put(p.uuid(), p);
        }
        this.otherPeers = Collections.unmodifiableMap(peers);

        Map<String, Room> roomMap = new LinkedHashMap<>();
        for (Room r : Objects.requireNonNull(rooms, "rooms")) {
            roomMap.put(r.uuid(), r);
        }
        this.rooms = Collections.unmodifiableMap(roomMap);
    }

    @Override
    public Peer localPeer() {
        return localPeer;
    }

    @Override
    public Map<String, Peer> otherPeers() {
        return otherPeers;
    }

    @Override
    public Map<String, Room> rooms() {
        return rooms;
    }

    @Override
    public boolean addMessage(ChatMessage message) {
        Objects.requireNonNull(message, "message");
        synchronized (lock) {
            if (indexByUuid.containsKey(message.uuid())) {
                return false;
            }
            indexByUuid.put(message.uuid(), messages.size());
            messages.add(message);
            return true;
        }
    }

    @Override
    public Optional<ChatMessage> message(String uuid) {
        Objects.requireNonNull(uuid, "uuid");
        synchronized (lock) {
            Integer index = indexByUuid.get(uuid);
            return index == null ? Optional.empty() : Optional.of(messages.get(index));
        }
    }

    @Override
    public Optional<ChatMessage> markAs(String uuid, MarkIntent intent) {
        Objects.requireNonNull(uuid, "uuid");
        Objects.requireNonNull(intent, "intent");
        synchronized (lock) {
            Integer index = indexByUuid.get(uuid);
            if (index == null) {
                return Optional.empty();
            }
            ChatMessage current = messages.get(index);
            ChatMessage updated = apply(current, intent);
            messages.set(index, updated);
            return Optional.of(updated);
        }
    }

    private static ChatMessage apply(ChatMessage current, MarkIntent intent) {
        MessageStatus status = current.status();
        if (intent instanceof MarkIntent.Acked acked) {
            return status.canTransitionTo(MessageStatus.RECEIVED_BY_PEER)
                    ? current.markedAcked(acked.ackTime())
                    : current;
        }
        if (intent instanceof MarkIntent.Sent sent) {
            if (status.canTransitionTo(MessageStatus.SENT)) {
                return current.markedSent(sent.completedAt());
            }
            // ack overtook the transport completion
            if (status == MessageStatus.RECEIVED_BY_PEER && current.sendCompleted().isEmpty()) {
                return current.markedSent(sent.completedAt());
            }
            return current;
        }
        return status.canTransitionTo(MessageStatus.FAILED) ? current.markedFailed() : current;
    }

    @Override
    public List<ChatMessage> lastMessages(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative: " + count);
        }
        synchronized (lock) {
            int from = Math.max(0, messages.size() - count);
            return List.copyOf(messages.subList(from, messages.size()));
        }
    }

    @Override
    public List<ChatMessage> allMessages() {
        synchronized (lock) {
            return List.copyOf(messages);
        }
    }
}
