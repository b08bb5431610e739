package com.questrail.dtchat.api;

import java.util.List;
import java.util.Objects;

/**
 * A named multicast group.
 *
 * <p>A room is only usable for sending by a peer that is itself registered
 * among the participants; every other participant receives one copy of each
 * room message on its registered endpoint.</p>
 */
public record Room(String uuid, String name, List<RoomParticipant> participants)
{
    public Room {
        Objects.requireNonNull(uuid, "uuid");
        Objects.requireNonNull(name, "name");
        participants = List.copyOf(Objects.requireNonNull(participants, "participants"));
    }

    public boolean hasParticipant(String peerUuid) {
        return participants.stream().anyMatch(p -> p.peerUuid().equals(peerUuid));
    }

    /**
     * Returns every participant except {@code peerUuid}, in registration order.
     */
    public List<RoomParticipant> participantsExcept(String peerUuid) {
        return participants.stream()
                .filter(p -> !p.peerUuid().equals(peerUuid))
                .toList();
    }
}
