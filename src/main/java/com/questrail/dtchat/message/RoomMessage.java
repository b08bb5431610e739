package com.questrail.dtchat.message;

import java.util.List;
import java.util.Objects;

/**
 * Correlates the per-peer messages produced by one room send.
 *
 * @param uuid         identity of the room send
 * @param roomUuid     target room
 * @param messageUuids one message per remaining participant, in participant order
 */
public record RoomMessage(String uuid, String roomUuid, List<String> messageUuids)
{
    public RoomMessage {
        Objects.requireNonNull(uuid, "uuid");
        Objects.requireNonNull(roomUuid, "roomUuid");
        messageUuids = List.copyOf(Objects.requireNonNull(messageUuids, "messageUuids"));
    }
}
