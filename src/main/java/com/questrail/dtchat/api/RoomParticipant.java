package com.questrail.dtchat.api;

import java.util.Objects;

/**
 * Binds a room member to the endpoint that messages for that room must use.
 */
public record RoomParticipant(String peerUuid, Endpoint endpoint)
{
    public RoomParticipant {
        Objects.requireNonNull(peerUuid, "peerUuid");
        Objects.requireNonNull(endpoint, "endpoint");
    }
}
