package com.questrail.dtchat.message;

/**
 * Lifecycle of a {@link ChatMessage}.
 *
 * <pre>
 *   outbound:  SENDING ──► SENT ──► RECEIVED_BY_PEER
 *                 │          │
 *                 └──► FAILED ◄┘
 *
 *   inbound:   RECEIVED
 * </pre>
 *
 * <p>Transitions are monotonic. {@link #FAILED} is terminal and reachable from
 * any non-terminal outbound state.</p>
 */
public enum MessageStatus
{
    /** Created locally, handed to the transport, no completion yet. */
    SENDING,

    /** The local transport confirmed transmission. */
    SENT,

    /** The recipient acknowledged the message. */
    RECEIVED_BY_PEER,

    /** The transport reported a connection or send failure. */
    FAILED,

    /** Inbound message decoded from the wire. */
    RECEIVED;

    /**
     * Whether the lifecycle permits moving from this status to {@code target}.
     */
    public boolean canTransitionTo(MessageStatus target) {
        return switch (this) {
            case SENDING -> target == SENT || target == FAILED || target == RECEIVED_BY_PEER;
            case SENT -> target == RECEIVED_BY_PEER || target == FAILED;
            case RECEIVED_BY_PEER, FAILED, RECEIVED -> false;
        };
    }
}
